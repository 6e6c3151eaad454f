package io.surfworks.hybridforge.config;

import io.surfworks.hybridforge.stage.Stage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * How stage processes are launched.
 *
 * @param localInterpreter  interpreter used for local stage processes
 * @param preStageScript    script implementing the generate and check stages
 * @param stageScript       script implementing the remote-eligible stages (uploaded for remote runs)
 * @param remoteInterpreter absolute path of the interpreter on the remote host
 * @param localTimeout      timeout of a local stage process ({@link Duration#ZERO} = wait forever)
 */
public record CommandConfig(
        String localInterpreter,
        Path preStageScript,
        Path stageScript,
        String remoteInterpreter,
        Duration localTimeout
) {

    public static final String DEFAULT_LOCAL_INTERPRETER = "python";
    public static final Path DEFAULT_PRE_STAGE_SCRIPT = Path.of("ioi_local_pre.py");
    public static final Path DEFAULT_STAGE_SCRIPT = Path.of("ioi_modules.py");
    public static final String DEFAULT_REMOTE_INTERPRETER = "/root/miniconda3/envs/ioi/bin/python";

    public CommandConfig {
        Objects.requireNonNull(localInterpreter, "localInterpreter cannot be null");
        Objects.requireNonNull(preStageScript, "preStageScript cannot be null");
        Objects.requireNonNull(stageScript, "stageScript cannot be null");
        Objects.requireNonNull(remoteInterpreter, "remoteInterpreter cannot be null");

        if (localInterpreter.isBlank()) {
            throw new IllegalArgumentException("localInterpreter cannot be blank");
        }
        if (remoteInterpreter.isBlank()) {
            throw new IllegalArgumentException("remoteInterpreter cannot be blank");
        }
        localTimeout = localTimeout == null ? Duration.ZERO : localTimeout;
        if (localTimeout.isNegative()) {
            throw new IllegalArgumentException("localTimeout cannot be negative");
        }
    }

    /**
     * Returns the default command settings.
     */
    public static CommandConfig defaults() {
        return new CommandConfig(DEFAULT_LOCAL_INTERPRETER, DEFAULT_PRE_STAGE_SCRIPT,
                DEFAULT_STAGE_SCRIPT, DEFAULT_REMOTE_INTERPRETER, Duration.ZERO);
    }

    /**
     * Returns a config that launches both scripts with the given local interpreter.
     */
    public static CommandConfig of(String interpreter, Path preStageScript, Path stageScript) {
        return new CommandConfig(interpreter, preStageScript, stageScript,
                DEFAULT_REMOTE_INTERPRETER, Duration.ZERO);
    }

    /**
     * Returns the script that implements the given stage.
     */
    public Path scriptFor(Stage stage) {
        return stage.isRemoteEligible() ? stageScript : preStageScript;
    }

    /**
     * Returns a new config with the specified remote interpreter.
     */
    public CommandConfig withRemoteInterpreter(String interpreter) {
        return new CommandConfig(localInterpreter, preStageScript, stageScript, interpreter, localTimeout);
    }

    /**
     * Returns a new config with the specified local process timeout.
     */
    public CommandConfig withLocalTimeout(Duration timeout) {
        return new CommandConfig(localInterpreter, preStageScript, stageScript, remoteInterpreter, timeout);
    }

    public boolean hasLocalTimeout() {
        return !localTimeout.isZero();
    }
}
