package io.surfworks.hybridforge.stage;

import io.surfworks.hybridforge.config.CommandConfig;
import io.surfworks.hybridforge.report.TimingRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Runs a stage as a child process on this machine.
 *
 * <p>The process is started as
 * {@code <interpreter> <script> --task <task> [--input <in>] --output <out> --timing-output <tmp>}
 * and the caller blocks until it exits. Its combined output is captured to a
 * temporary log; the tail of that log is attached to the exception when the
 * process fails. The timing file is read and deleted afterwards.
 */
public final class LocalStageExecutor implements StageExecutor {

    private static final Logger LOG = Logger.getLogger(LocalStageExecutor.class.getName());

    private static final int OUTPUT_TAIL_LINES = 40;

    private final CommandConfig commands;
    private final Path scratchDir;

    /**
     * Creates an executor that keeps its scratch files in the system temp directory.
     */
    public LocalStageExecutor(CommandConfig commands) {
        this(commands, Path.of(System.getProperty("java.io.tmpdir")));
    }

    /**
     * Creates an executor with a custom directory for timing and log scratch files.
     */
    public LocalStageExecutor(CommandConfig commands, Path scratchDir) {
        this.commands = Objects.requireNonNull(commands, "commands cannot be null");
        this.scratchDir = Objects.requireNonNull(scratchDir, "scratchDir cannot be null");
    }

    @Override
    public Location location() {
        return Location.LOCAL;
    }

    @Override
    public TimingRecord execute(Stage stage, Path input, Path output) throws LocalExecutionException, TimingFileException {
        String id = UUID.randomUUID().toString().substring(0, 8);
        Path timingFile = scratchDir.resolve("hybridforge-timing-" + stage.task() + "-" + id + ".json");
        Path logFile = scratchDir.resolve("hybridforge-" + stage.task() + "-" + id + ".log");

        try {
            Files.createDirectories(scratchDir);
            List<String> command = buildCommand(stage, input, output, timingFile);
            LOG.info("Running " + stage.reportName() + " locally: " + String.join(" ", command));

            runProcess(stage, command, logFile);

            double compute = TimingSideChannel.readComputeSeconds(timingFile);
            return TimingRecord.local(stage, compute);

        } catch (IOException e) {
            throw new LocalExecutionException(stage, "I/O error: " + e.getMessage(), e);
        } finally {
            deleteScratch(timingFile);
            deleteScratch(logFile);
        }
    }

    List<String> buildCommand(Stage stage, Path input, Path output, Path timingFile) {
        List<String> command = new ArrayList<>(Arrays.asList(commands.localInterpreter().trim().split("\\s+")));
        command.add(commands.scriptFor(stage).toString());
        command.add("--task");
        command.add(stage.task());
        if (input != null) {
            command.add("--input");
            command.add(input.toString());
        }
        command.add("--output");
        command.add(output.toString());
        command.add("--timing-output");
        command.add(timingFile.toString());
        return command;
    }

    private void runProcess(Stage stage, List<String> command, Path logFile)
            throws IOException, LocalExecutionException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        pb.redirectOutput(logFile.toFile());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new LocalExecutionException(stage, "Cannot start process: " + e.getMessage(), e);
        }
        try {
            if (commands.hasLocalTimeout()) {
                long timeoutMillis = commands.localTimeout().toMillis();
                boolean completed = process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS);
                if (!completed) {
                    process.destroyForcibly();
                    throw new LocalExecutionException(stage,
                            "Execution timed out after " + commands.localTimeout().toSeconds() + " seconds", null);
                }
            } else {
                process.waitFor();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new LocalExecutionException(stage, "Interrupted while waiting for process", e);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new LocalExecutionException(stage, exitCode, readTail(logFile));
        }
        if (LOG.isLoggable(Level.FINE)) {
            String output = readTail(logFile);
            if (!output.isEmpty()) {
                LOG.fine(stage.reportName() + " output:\n" + output);
            }
        }
    }

    /**
     * Returns the last lines of the captured output. Bytes that are not valid
     * UTF-8 are replaced.
     */
    static String readTail(Path logFile) throws IOException {
        if (!Files.exists(logFile)) {
            return "";
        }
        String text = new String(Files.readAllBytes(logFile), StandardCharsets.UTF_8);
        List<String> lines = text.lines().collect(Collectors.toList());
        int from = Math.max(0, lines.size() - OUTPUT_TAIL_LINES);
        return String.join("\n", lines.subList(from, lines.size())).strip();
    }

    private static void deleteScratch(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not delete scratch file " + file, e);
        }
    }
}
