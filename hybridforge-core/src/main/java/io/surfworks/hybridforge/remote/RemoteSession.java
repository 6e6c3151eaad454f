package io.surfworks.hybridforge.remote;

import io.surfworks.hybridforge.config.SshConfig;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One authenticated session with the remote host.
 *
 * <p>The session is opened with {@link #connect}, which retries a failing
 * connection a fixed number of times with a fixed pause in between. Once
 * connected it runs shell commands synchronously and hands out transfer
 * channels to {@link ArtifactStager}. Operations are never retried: a
 * failing command or transfer aborts the run.
 *
 * <p>A session is used by one thread at a time and is closed exactly once,
 * however many times {@link #close()} is called.
 */
public final class RemoteSession implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(RemoteSession.class.getName());

    private final SshConfig config;
    private final RemoteConnection connection;
    private boolean closed;

    private RemoteSession(SshConfig config, RemoteConnection connection) {
        this.config = config;
        this.connection = connection;
    }

    /**
     * Connects with the system sleeper between attempts.
     *
     * @see #connect(SshConfig, RemoteTransport, Sleeper)
     */
    public static RemoteSession connect(SshConfig config, RemoteTransport transport) throws ConnectionException {
        return connect(config, transport, Sleeper.SYSTEM);
    }

    /**
     * Establishes a session, retrying up to {@link SshConfig#maxAttempts()} times.
     *
     * @param config    host, credentials and retry policy
     * @param transport transport that makes the individual attempts
     * @param sleeper   used for the pause between attempts
     * @return a connected session
     * @throws ConnectionException after the last failed attempt, carrying its cause
     */
    public static RemoteSession connect(SshConfig config, RemoteTransport transport, Sleeper sleeper)
            throws ConnectionException {
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(transport, "transport cannot be null");

        int maxAttempts = config.maxAttempts();
        IOException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                RemoteConnection connection = transport.connect(config);
                LOG.info("Connected to " + config.target() + " via " + transport.name()
                        + " (attempt " + attempt + "/" + maxAttempts + ")");
                return new RemoteSession(config, connection);
            } catch (IOException e) {
                lastFailure = e;
                LOG.log(Level.WARNING, "Connection attempt " + attempt + "/" + maxAttempts
                        + " to " + config.target() + " failed: " + e.getMessage(), e);
            }

            if (attempt < maxAttempts) {
                try {
                    sleeper.sleep(config.retryDelay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    ConnectionException interrupted = new ConnectionException(config.target(), attempt, e);
                    interrupted.addSuppressed(lastFailure);
                    throw interrupted;
                }
            }
        }

        throw new ConnectionException(config.target(), maxAttempts, lastFailure);
    }

    /**
     * Runs a command in the given working directory and blocks until it exits.
     *
     * <p>The command is prefixed with the profile initialization sequence so
     * environment managers on the remote host are active, and with a
     * {@code cd} into the working directory when one is given.
     *
     * @param command          shell command
     * @param workingDirectory remote directory to run in (may be null)
     * @return the successful result
     * @throws RemoteExecutionException if the command exits non-zero, times out or its channel fails
     */
    public CommandResult run(String command, String workingDirectory) throws RemoteExecutionException {
        ensureOpen();
        String fullCommand = buildCommand(command, workingDirectory);
        LOG.fine("Remote exec: " + fullCommand);

        CommandResult result;
        try {
            result = connection.exec(fullCommand, config.commandTimeout());
        } catch (IOException e) {
            throw new RemoteExecutionException(fullCommand, "Remote command channel failed: " + e.getMessage(), e);
        }

        if (!result.isSuccess()) {
            LOG.warning("Remote command failed (exit " + result.exitCode() + "): " + fullCommand
                    + "\nSTDOUT:\n" + result.stdout() + "\nSTDERR:\n" + result.stderr());
            throw new RemoteExecutionException(fullCommand, result);
        }
        return result;
    }

    /**
     * Creates a remote directory and any missing parents. Safe to call repeatedly.
     */
    public void ensureDirectory(String path) throws RemoteExecutionException {
        run("mkdir -p " + quote(path), null);
    }

    /**
     * Opens a transfer channel on this session. The caller closes it.
     *
     * @throws TransferException if the channel cannot be opened
     */
    public TransferChannel openTransferChannel() throws TransferException {
        ensureOpen();
        try {
            return connection.openTransferChannel();
        } catch (IOException e) {
            throw new TransferException("Cannot open transfer channel to " + config.target()
                    + ": " + e.getMessage(), e);
        }
    }

    public SshConfig config() {
        return config;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;

        connection.close();
        LOG.info("Closed session to " + config.target());
    }

    String buildCommand(String command, String workingDirectory) {
        StringBuilder sb = new StringBuilder();
        if (workingDirectory != null && !workingDirectory.isBlank()) {
            sb.append("cd ").append(quote(workingDirectory)).append(" && ");
        }
        if (!config.profileInit().isEmpty()) {
            sb.append(config.profileInit()).append(" && ");
        }
        sb.append(command);
        return sb.toString();
    }

    /**
     * Quotes a path for the remote shell unless it only has safe characters.
     *
     * <p>A leading {@code ~/} is left outside the quotes so the shell still expands it.
     */
    public static String quote(String path) {
        if (path.matches("[A-Za-z0-9_./~-]+")) {
            return path;
        }
        if (path.startsWith("~/")) {
            return "~/" + quote(path.substring(2));
        }
        return "'" + path.replace("'", "'\\''") + "'";
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Remote session to " + config.target() + " is closed");
        }
    }
}
