package io.surfworks.hybridforge.config;

import io.surfworks.hybridforge.pipeline.PipelineException;

/**
 * Thrown when the execution plan document is missing, unreadable or malformed.
 */
public class ConfigException extends PipelineException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
