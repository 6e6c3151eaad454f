package io.surfworks.hybridforge.report;

import io.surfworks.hybridforge.stage.Location;
import io.surfworks.hybridforge.stage.Stage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Compares timing reports of the same pipeline run under different execution plans.
 *
 * <p>The usual modes are {@link #LOCAL} (every stage local), {@link #REMOTE}
 * (every eligible stage remote) and {@link #HYBRID} (mixed). A mode's total is
 * its optional {@code local_prepare_time} plus, per stage, the
 * {@code _total_time} when the stage ran remotely or the {@code _time} otherwise.
 */
public final class ReportComparator {

    private static final Logger LOG = Logger.getLogger(ReportComparator.class.getName());

    public static final String LOCAL = "local";
    public static final String REMOTE = "remote";
    public static final String HYBRID = "hybrid";

    private static final String PREPARE_KEY = "local_prepare_time";

    private ReportComparator() {
    }

    /**
     * Reads and compares report files, skipping any that do not exist.
     *
     * @param reportsByMode report path by mode name, in display order
     * @return the comparison (with no modes if no file exists)
     * @throws IOException if an existing file cannot be parsed
     */
    public static ReportComparison compareFiles(Map<String, Path> reportsByMode) throws IOException {
        Map<String, Map<String, Object>> loaded = new LinkedHashMap<>();
        for (Map.Entry<String, Path> entry : reportsByMode.entrySet()) {
            if (!Files.exists(entry.getValue())) {
                LOG.warning("Timing report not found, skipping " + entry.getKey() + ": " + entry.getValue());
                continue;
            }
            loaded.put(entry.getKey(), TimingReportWriter.read(entry.getValue()));
        }
        return compare(loaded);
    }

    /**
     * Compares already loaded reports.
     *
     * @param reportsByMode flat report map by mode name, in display order
     */
    public static ReportComparison compare(Map<String, Map<String, Object>> reportsByMode) {
        List<String> modes = List.copyOf(reportsByMode.keySet());

        List<ReportComparison.StageRow> computeRows = new ArrayList<>();
        List<ReportComparison.TransferRow> transferRows = new ArrayList<>();
        for (Stage stage : Stage.remoteEligible()) {
            Map<String, Double> compute = collect(reportsByMode, stage.reportName() + "_time");
            computeRows.add(new ReportComparison.StageRow(stage, compute, fastest(compute)));

            for (String direction : List.of("upload", "download")) {
                Map<String, Double> transfer = collect(reportsByMode, stage.reportName() + "_" + direction + "_time");
                if (!transfer.isEmpty()) {
                    transferRows.add(new ReportComparison.TransferRow(stage, direction, transfer));
                }
            }
        }

        Map<String, Double> totals = new LinkedHashMap<>();
        Map<String, Map<String, String>> locations = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : reportsByMode.entrySet()) {
            totals.put(entry.getKey(), total(entry.getValue()));
            locations.put(entry.getKey(), locations(entry.getKey(), entry.getValue()));
        }

        String best = fastest(totals);
        Double speedup = null;
        Double local = totals.get(LOCAL);
        Double hybrid = totals.get(HYBRID);
        if (local != null && hybrid != null && local > 0) {
            speedup = (local - hybrid) / local * 100.0;
        }

        return new ReportComparison(modes, computeRows, transferRows, totals, best, speedup, locations);
    }

    private static double total(Map<String, Object> report) {
        double total = number(report.get(PREPARE_KEY)) != null ? number(report.get(PREPARE_KEY)) : 0.0;
        for (Stage stage : Stage.remoteEligible()) {
            Double stageTotal = number(report.get(stage.reportName() + "_total_time"));
            Double stageTime = number(report.get(stage.reportName() + "_time"));
            if (stageTotal != null) {
                total += stageTotal;
            } else if (stageTime != null) {
                total += stageTime;
            }
        }
        return total;
    }

    private static Map<String, String> locations(String mode, Map<String, Object> report) {
        String fallback = switch (mode) {
            case LOCAL -> Location.LOCAL.tag();
            case REMOTE -> Location.REMOTE.tag();
            default -> "-";
        };
        Map<String, String> result = new LinkedHashMap<>();
        for (Stage stage : Stage.remoteEligible()) {
            Object location = report.get(stage.reportName() + "_location");
            result.put(stage.reportName(), location != null ? location.toString() : fallback);
        }
        return result;
    }

    private static Map<String, Double> collect(Map<String, Map<String, Object>> reports, String key) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : reports.entrySet()) {
            Double value = number(entry.getValue().get(key));
            if (value != null) {
                values.put(entry.getKey(), value);
            }
        }
        return values;
    }

    private static String fastest(Map<String, Double> values) {
        String best = null;
        double bestValue = Double.MAX_VALUE;
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            if (entry.getValue() < bestValue) {
                best = entry.getKey();
                bestValue = entry.getValue();
            }
        }
        return best;
    }

    private static Double number(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }
}
