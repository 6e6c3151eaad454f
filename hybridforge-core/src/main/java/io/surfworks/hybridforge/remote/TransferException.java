package io.surfworks.hybridforge.remote;

import io.surfworks.hybridforge.pipeline.PipelineException;

/**
 * Checked exception for artifact transfers between the local and remote host.
 */
public class TransferException extends PipelineException {

    public TransferException(String message) {
        super(message);
    }

    public TransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
