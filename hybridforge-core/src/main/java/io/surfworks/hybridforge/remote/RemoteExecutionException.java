package io.surfworks.hybridforge.remote;

import io.surfworks.hybridforge.pipeline.PipelineException;

/**
 * Thrown when a remote command exits non-zero, ends without an exit status or exceeds its timeout.
 *
 * <p>Carries the captured output so the failure can be diagnosed without
 * logging into the remote host.
 */
public class RemoteExecutionException extends PipelineException {

    private final String command;
    private final int exitCode;
    private final boolean timedOut;
    private final String stdout;
    private final String stderr;

    public RemoteExecutionException(String command, CommandResult result) {
        super(describe(result) + ": " + command
                + (result.stderr().isBlank() ? "" : "\nSTDERR:\n" + result.stderr().strip()));
        this.command = command;
        this.exitCode = result.exitCode();
        this.timedOut = result.timedOut();
        this.stdout = result.stdout();
        this.stderr = result.stderr();
    }

    public RemoteExecutionException(String command, String message, Throwable cause) {
        super(message + ": " + command, cause);
        this.command = command;
        this.exitCode = CommandResult.NO_EXIT_STATUS;
        this.timedOut = false;
        this.stdout = "";
        this.stderr = "";
    }

    public String command() {
        return command;
    }

    /**
     * Returns the exit code, or {@link CommandResult#NO_EXIT_STATUS} if there was none.
     */
    public int exitCode() {
        return exitCode;
    }

    public String stdout() {
        return stdout;
    }

    public String stderr() {
        return stderr;
    }

    public boolean timedOut() {
        return timedOut;
    }

    private static String describe(CommandResult result) {
        if (result.timedOut()) {
            return "Remote command timed out";
        }
        if (result.exitCode() == CommandResult.NO_EXIT_STATUS) {
            return "Remote command ended without an exit status";
        }
        return "Remote command failed (exit " + result.exitCode() + ")";
    }
}
