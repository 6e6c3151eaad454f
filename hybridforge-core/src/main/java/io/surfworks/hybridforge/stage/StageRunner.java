package io.surfworks.hybridforge.stage;

import io.surfworks.hybridforge.config.PathTable;
import io.surfworks.hybridforge.pipeline.PipelineException;
import io.surfworks.hybridforge.report.TimingRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a stage at a given location against the run's artifact paths.
 *
 * <p>Checks that the input artifact is readable before dispatch and that the
 * output artifact exists afterwards, so a stage that exits cleanly without
 * producing its output still fails the run.
 */
public final class StageRunner {

    private final PathTable paths;
    private final Map<Location, StageExecutor> executors = new EnumMap<>(Location.class);

    /**
     * Creates a runner.
     *
     * @param paths  artifact paths
     * @param local  executor for local stages
     * @param remote executor for remote stages (null if no session is open)
     */
    public StageRunner(PathTable paths, StageExecutor local, StageExecutor remote) {
        this.paths = Objects.requireNonNull(paths, "paths cannot be null");
        Objects.requireNonNull(local, "local executor cannot be null");
        register(local);
        if (remote != null) {
            register(remote);
        }
    }

    /**
     * Runs a stage.
     *
     * @param stage    the stage
     * @param location where the plan places it
     * @return the stage's timing (wall time not yet set)
     * @throws PipelineException if an artifact invariant is violated or the stage fails
     */
    public TimingRecord run(Stage stage, Location location) throws PipelineException {
        StageExecutor executor = executors.get(location);
        if (executor == null) {
            throw new IllegalStateException("No executor for " + location.tag() + " stages");
        }

        Path input = stage.input(paths);
        Path output = stage.output(paths);
        if (input != null && !Files.isReadable(input)) {
            throw new PipelineException(stage, "Input artifact missing or unreadable: " + input);
        }
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new PipelineException(stage, "Cannot create output directory for " + output, e);
        }

        TimingRecord record = executor.execute(stage, input, output);

        if (!Files.exists(output)) {
            throw new PipelineException(stage, "Output artifact not produced: " + output);
        }
        return record;
    }

    private void register(StageExecutor executor) {
        if (executors.putIfAbsent(executor.location(), executor) != null) {
            throw new IllegalArgumentException("Two executors for " + executor.location().tag() + " stages");
        }
    }
}
