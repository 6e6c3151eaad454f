package io.surfworks.hybridforge.remote;

import io.surfworks.hybridforge.config.SshConfig;

import java.io.IOException;

/**
 * Opens authenticated connections to a remote host.
 *
 * <p>A transport makes exactly one attempt per call; retrying is the
 * responsibility of {@link RemoteSession}.
 */
public interface RemoteTransport {

    /**
     * Returns the name of this transport.
     */
    String name();

    /**
     * Makes a single connection attempt.
     *
     * @param config host, credentials and connect timeout
     * @return an open connection
     * @throws IOException if the host is unreachable or authentication fails
     */
    RemoteConnection connect(SshConfig config) throws IOException;
}
