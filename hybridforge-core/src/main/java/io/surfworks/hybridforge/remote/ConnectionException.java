package io.surfworks.hybridforge.remote;

import io.surfworks.hybridforge.pipeline.PipelineException;

/**
 * Thrown when a remote session cannot be established within the retry budget.
 */
public class ConnectionException extends PipelineException {

    private final String target;
    private final int attempts;

    public ConnectionException(String target, int attempts, Throwable cause) {
        super("Could not connect to " + target + " after " + attempts
                + (attempts == 1 ? " attempt" : " attempts")
                + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.target = target;
        this.attempts = attempts;
    }

    /**
     * Returns the connection target ({@code user@host:port}).
     */
    public String target() {
        return target;
    }

    /**
     * Returns how many connection attempts were made.
     */
    public int attempts() {
        return attempts;
    }
}
