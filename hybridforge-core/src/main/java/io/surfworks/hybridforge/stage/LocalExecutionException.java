package io.surfworks.hybridforge.stage;

import io.surfworks.hybridforge.pipeline.PipelineException;

/**
 * Thrown when a local stage process cannot be started, exits non-zero or times out.
 */
public class LocalExecutionException extends PipelineException {

    private final int exitCode;
    private final String output;

    public LocalExecutionException(Stage stage, int exitCode, String output) {
        super(stage, "Exit code " + exitCode + (output == null || output.isBlank() ? "" : ": " + output));
        this.exitCode = exitCode;
        this.output = output == null ? "" : output;
    }

    public LocalExecutionException(Stage stage, String message, Throwable cause) {
        super(stage, message, cause);
        this.exitCode = -1;
        this.output = "";
    }

    /**
     * Returns the process exit code, or -1 if the process never exited normally.
     */
    public int exitCode() {
        return exitCode;
    }

    /**
     * Returns the tail of the combined stdout/stderr of the process.
     */
    public String output() {
        return output;
    }
}
