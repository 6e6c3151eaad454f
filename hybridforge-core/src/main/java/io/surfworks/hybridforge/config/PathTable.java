package io.surfworks.hybridforge.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Local artifact paths, report location and remote working directory.
 *
 * @param data          output of the generate stage
 * @param dataCheck1    output of the check stage
 * @param dataCheck2    output of the filter stage
 * @param saved         output of the collect stage
 * @param results       output of the patch stage
 * @param heatmap       output of the plot stage
 * @param timingReport  where the timing report is written
 * @param remoteWorkdir remote working directory (null when nothing runs remotely)
 */
public record PathTable(
        Path data,
        Path dataCheck1,
        Path dataCheck2,
        Path saved,
        Path results,
        Path heatmap,
        Path timingReport,
        String remoteWorkdir
) {

    /** Default output of the generate stage */
    public static final Path DEFAULT_DATA = Path.of("data.json");

    public PathTable {
        Objects.requireNonNull(dataCheck1, "dataCheck1 cannot be null");
        Objects.requireNonNull(dataCheck2, "dataCheck2 cannot be null");
        Objects.requireNonNull(saved, "saved cannot be null");
        Objects.requireNonNull(results, "results cannot be null");
        Objects.requireNonNull(heatmap, "heatmap cannot be null");
        Objects.requireNonNull(timingReport, "timingReport cannot be null");

        data = data == null ? DEFAULT_DATA : data;
        if (remoteWorkdir != null && remoteWorkdir.isBlank()) {
            remoteWorkdir = null;
        }
    }

    /**
     * Lays out every artifact and the report under one directory with the
     * file names the stage scripts use by default.
     */
    public static PathTable under(Path dir, String remoteWorkdir) {
        return new PathTable(
                dir.resolve("data.json"),
                dir.resolve("data_check1.json"),
                dir.resolve("data_check2.json"),
                dir.resolve("saved.pt"),
                dir.resolve("results.pt"),
                dir.resolve("heatmap.png"),
                dir.resolve("timing_report.json"),
                remoteWorkdir
        );
    }

    /**
     * Returns a new table with the specified remote working directory.
     */
    public PathTable withRemoteWorkdir(String workdir) {
        return new PathTable(data, dataCheck1, dataCheck2, saved, results, heatmap, timingReport, workdir);
    }

    /**
     * Returns a new table with the specified report path.
     */
    public PathTable withTimingReport(Path report) {
        return new PathTable(data, dataCheck1, dataCheck2, saved, results, heatmap, report, remoteWorkdir);
    }
}
