package io.surfworks.hybridforge.stage;

import io.surfworks.hybridforge.pipeline.PipelineException;

/**
 * Thrown when a stage's timing side-channel file is missing or does not carry a usable {@code time}.
 */
public class TimingFileException extends PipelineException {

    public TimingFileException(String message) {
        super(message);
    }

    public TimingFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
