package io.surfworks.hybridforge.cli;

import io.surfworks.hybridforge.pipeline.PipelineException;
import io.surfworks.hybridforge.pipeline.PipelineListener;
import io.surfworks.hybridforge.report.TimingRecord;
import io.surfworks.hybridforge.stage.Location;
import io.surfworks.hybridforge.stage.Stage;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Prints pipeline progress banners for a human watching the terminal.
 */
class ConsoleProgressListener implements PipelineListener {

    static final String RULE = "=".repeat(60);

    private final PrintStream out;

    ConsoleProgressListener(PrintStream out) {
        this.out = out;
    }

    @Override
    public void connecting(String target) {
        out.println("Connecting to " + target + " ...");
    }

    @Override
    public void connected(String target) {
        out.println("Connected to " + target);
    }

    @Override
    public void stageStarted(Stage stage, Location location) {
        out.println();
        out.println(RULE);
        out.println("[" + stage.reportName() + "] running " + (location == Location.REMOTE ? "remotely" : "locally"));
        out.println(RULE);
    }

    @Override
    public void stageCompleted(TimingRecord record) {
        if (record.hasTransferTimes()) {
            out.printf("[OK] %s: compute %.3fs, upload %.3fs, download %.3fs, total %.3fs (wall %.3fs)%n",
                    record.stage().reportName(), record.computeSeconds(), record.uploadSeconds(),
                    record.downloadSeconds(), record.totalSeconds(), record.wallSeconds());
        } else {
            out.printf("[OK] %s: compute %.3fs (wall %.3fs)%n",
                    record.stage().reportName(), record.computeSeconds(), record.wallSeconds());
        }
    }

    @Override
    public void stageFailed(Stage stage, PipelineException failure) {
        out.println("[FAILED] " + stage.reportName());
    }

    @Override
    public void reportWritten(Path reportFile) {
        out.println("Timing report saved to " + reportFile);
    }
}
