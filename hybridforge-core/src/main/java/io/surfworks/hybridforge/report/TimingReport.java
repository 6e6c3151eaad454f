package io.surfworks.hybridforge.report;

import io.surfworks.hybridforge.stage.Stage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Timing records of one run, in the order the stages ran.
 *
 * <p>{@link #toMap()} produces the flat key layout external comparison tools
 * read: {@code <stage>_time}, {@code <stage>_wall_time}, {@code <stage>_location}
 * and, for remote stages, {@code <stage>_upload_time},
 * {@code <stage>_download_time} and {@code <stage>_total_time}. The two
 * pre-stages only carry their compute and wall times.
 */
public final class TimingReport {

    /**
     * Terminal state of the run the report describes.
     */
    public enum Status {
        RUNNING,
        COMPLETED,
        ABORTED
    }

    private final List<TimingRecord> records = new ArrayList<>();
    private Status status = Status.RUNNING;
    private Stage failedStage;

    /**
     * Appends a record.
     *
     * @throws IllegalStateException if the report is already finished or the stage is already recorded
     */
    public void add(TimingRecord record) {
        Objects.requireNonNull(record, "record cannot be null");
        if (status != Status.RUNNING) {
            throw new IllegalStateException("Report is already " + status);
        }
        if (find(record.stage()).isPresent()) {
            throw new IllegalStateException("Stage already recorded: " + record.stage().reportName());
        }
        records.add(record);
    }

    public void markCompleted() {
        status = Status.COMPLETED;
    }

    /**
     * Marks the run as aborted at the given stage (may be null if it failed between stages).
     */
    public void markAborted(Stage stage) {
        status = Status.ABORTED;
        failedStage = stage;
    }

    public List<TimingRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public Optional<TimingRecord> find(Stage stage) {
        return records.stream().filter(r -> r.stage() == stage).findFirst();
    }

    public Status status() {
        return status;
    }

    public Optional<Stage> failedStage() {
        return Optional.ofNullable(failedStage);
    }

    /**
     * Sum of the total time of every recorded stage.
     */
    public double totalSeconds() {
        return records.stream().mapToDouble(TimingRecord::totalSeconds).sum();
    }

    /**
     * Flattens the report into its serialized key layout.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (TimingRecord record : records) {
            String prefix = record.stage().reportName();
            map.put(prefix + "_time", record.computeSeconds());
            if (record.hasTransferTimes()) {
                map.put(prefix + "_upload_time", record.uploadSeconds());
                map.put(prefix + "_download_time", record.downloadSeconds());
                map.put(prefix + "_total_time", record.totalSeconds());
            }
            map.put(prefix + "_wall_time", record.wallSeconds());
            if (record.stage().isRemoteEligible()) {
                map.put(prefix + "_location", record.location().tag());
            }
        }
        if (status == Status.ABORTED) {
            map.put("run_status", "aborted");
            if (failedStage != null) {
                map.put("failed_stage", failedStage.reportName());
            }
        }
        return map;
    }
}
