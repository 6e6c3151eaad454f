package io.surfworks.hybridforge.remote;

import java.io.IOException;
import java.time.Duration;

/**
 * One authenticated connection produced by a {@link RemoteTransport}.
 */
public interface RemoteConnection extends AutoCloseable {

    /**
     * Runs a shell command and blocks until it exits.
     *
     * <p>The command is passed to the remote shell verbatim.
     *
     * @param command shell command line
     * @param timeout how long to wait ({@link Duration#ZERO} = no limit); on expiry the
     *                command is torn down and {@link CommandResult#timeout} is returned
     * @return exit code and captured output
     * @throws IOException if the command channel fails
     */
    CommandResult exec(String command, Duration timeout) throws IOException;

    /**
     * Opens a file transfer channel. The caller closes it.
     */
    TransferChannel openTransferChannel() throws IOException;

    @Override
    void close();
}
