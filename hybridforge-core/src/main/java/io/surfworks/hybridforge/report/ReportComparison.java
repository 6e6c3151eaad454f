package io.surfworks.hybridforge.report;

import io.surfworks.hybridforge.stage.Stage;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Side-by-side comparison of timing reports produced under different execution plans.
 *
 * @param modes          compared modes, in the order given
 * @param computeRows    per-stage compute time by mode
 * @param transferRows   per-stage upload/download time, for stages where some mode transferred
 * @param totals         end-to-end time by mode
 * @param bestMode       mode with the smallest total (null if no totals)
 * @param hybridSpeedup  percentage by which hybrid beats local-only (null unless both ran)
 * @param locations      stage locations by mode, keyed by stage report name
 */
public record ReportComparison(
        List<String> modes,
        List<StageRow> computeRows,
        List<TransferRow> transferRows,
        Map<String, Double> totals,
        String bestMode,
        Double hybridSpeedup,
        Map<String, Map<String, String>> locations
) {

    public ReportComparison {
        modes = List.copyOf(modes);
        computeRows = List.copyOf(computeRows);
        transferRows = List.copyOf(transferRows);
        totals = Map.copyOf(totals);
        locations = Map.copyOf(locations);
    }

    public Optional<StageRow> row(Stage stage) {
        return computeRows.stream().filter(r -> r.stage() == stage).findFirst();
    }

    /**
     * Compute time of one stage across modes.
     *
     * @param stage       the stage
     * @param seconds     compute seconds by mode (modes without the key are absent)
     * @param fastestMode mode with the smallest compute time (null if none)
     */
    public record StageRow(Stage stage, Map<String, Double> seconds, String fastestMode) {

        public StageRow {
            seconds = Map.copyOf(seconds);
        }
    }

    /**
     * Transfer time of one stage in one direction across modes.
     *
     * @param stage     the stage
     * @param direction {@code "upload"} or {@code "download"}
     * @param seconds   transfer seconds by mode
     */
    public record TransferRow(Stage stage, String direction, Map<String, Double> seconds) {

        public TransferRow {
            seconds = Map.copyOf(seconds);
        }
    }
}
