package io.surfworks.hybridforge.pipeline;

import io.surfworks.hybridforge.stage.Stage;

/**
 * Checked exception for pipeline execution errors.
 *
 * <p>Every failure that aborts a run is a subclass of this type. Failures
 * raised while a stage was dispatched carry that stage, and their message
 * starts with its report name.
 */
public class PipelineException extends Exception {

    private final Stage stage;

    public PipelineException(String message) {
        super(message);
        this.stage = null;
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
        this.stage = null;
    }

    public PipelineException(Stage stage, String message) {
        super(stage.reportName() + ": " + message);
        this.stage = stage;
    }

    public PipelineException(Stage stage, String message, Throwable cause) {
        super(stage.reportName() + ": " + message, cause);
        this.stage = stage;
    }

    /**
     * Returns the stage that was running when the error occurred, or null for
     * failures outside any stage (configuration, connection, report output).
     */
    public Stage stage() {
        return stage;
    }
}
