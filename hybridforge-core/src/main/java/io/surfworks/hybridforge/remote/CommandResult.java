package io.surfworks.hybridforge.remote;

/**
 * Outcome of a remote command.
 *
 * @param exitCode exit status, or {@link #NO_EXIT_STATUS} if the command ended without one
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 * @param timedOut true if the command was torn down after exceeding its timeout
 */
public record CommandResult(int exitCode, String stdout, String stderr, boolean timedOut) {

    /** Exit code of a command that was killed by a signal, torn down or never reported a status */
    public static final int NO_EXIT_STATUS = -1;

    public CommandResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public CommandResult(int exitCode, String stdout, String stderr) {
        this(exitCode, stdout, stderr, false);
    }

    public static CommandResult success(String stdout) {
        return new CommandResult(0, stdout, "");
    }

    public static CommandResult timeout(String stdout, String stderr) {
        return new CommandResult(NO_EXIT_STATUS, stdout, stderr, true);
    }

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut;
    }
}
