package io.surfworks.hybridforge.report;

import io.surfworks.hybridforge.stage.Location;
import io.surfworks.hybridforge.stage.Stage;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing of one stage run, shaped the same whether the stage ran locally or remotely.
 *
 * <p>Transfer times exist only for remote runs; for local runs they are null
 * and the total equals the compute time.
 *
 * @param stage           the stage
 * @param location        where it ran
 * @param computeSeconds  compute time as reported by the stage process
 * @param uploadSeconds   input upload time (remote only, else null)
 * @param downloadSeconds output download time (remote only, else null)
 * @param wallSeconds     time measured around the whole dispatch
 */
public record TimingRecord(
        Stage stage,
        Location location,
        double computeSeconds,
        Double uploadSeconds,
        Double downloadSeconds,
        double wallSeconds
) {

    public TimingRecord {
        Objects.requireNonNull(stage, "stage cannot be null");
        Objects.requireNonNull(location, "location cannot be null");
        requireSeconds("computeSeconds", computeSeconds);
        requireSeconds("wallSeconds", wallSeconds);

        if (location == Location.REMOTE) {
            Objects.requireNonNull(uploadSeconds, "uploadSeconds is required for remote runs");
            Objects.requireNonNull(downloadSeconds, "downloadSeconds is required for remote runs");
            requireSeconds("uploadSeconds", uploadSeconds);
            requireSeconds("downloadSeconds", downloadSeconds);
        } else if (uploadSeconds != null || downloadSeconds != null) {
            throw new IllegalArgumentException("Local runs have no transfer times");
        }
    }

    /**
     * Creates a record for a local run (wall time filled in later).
     */
    public static TimingRecord local(Stage stage, double computeSeconds) {
        return new TimingRecord(stage, Location.LOCAL, computeSeconds, null, null, 0.0);
    }

    /**
     * Creates a record for a remote run (wall time filled in later).
     */
    public static TimingRecord remote(Stage stage, double computeSeconds, Duration upload, Duration download) {
        return new TimingRecord(stage, Location.REMOTE, computeSeconds,
                seconds(upload), seconds(download), 0.0);
    }

    /**
     * Compute plus transfer time.
     */
    public double totalSeconds() {
        if (location == Location.LOCAL) {
            return computeSeconds;
        }
        return computeSeconds + uploadSeconds + downloadSeconds;
    }

    public boolean hasTransferTimes() {
        return location == Location.REMOTE;
    }

    /**
     * Returns a copy carrying the given wall time.
     */
    public TimingRecord withWallTime(Duration wall) {
        return new TimingRecord(stage, location, computeSeconds, uploadSeconds, downloadSeconds, seconds(wall));
    }

    /**
     * Converts a duration to fractional seconds.
     */
    public static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }

    private static void requireSeconds(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new IllegalArgumentException(name + " must be a finite, non-negative number: " + value);
        }
    }
}
