package io.surfworks.hybridforge.testing;

import io.surfworks.hybridforge.pipeline.PipelineException;
import io.surfworks.hybridforge.report.TimingRecord;
import io.surfworks.hybridforge.stage.LocalExecutionException;
import io.surfworks.hybridforge.stage.Location;
import io.surfworks.hybridforge.stage.Stage;
import io.surfworks.hybridforge.stage.StageExecutor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Local executor that fakes stage processes for unit testing.
 *
 * <p>Each stage writes a small text file to its output path and reports the
 * compute time configured with {@link #stageTime}. Stages marked with
 * {@link #failStage} exit with code 1 instead.
 */
public final class MockStageExecutor implements StageExecutor {

    private final Map<Stage, Double> stageTimes = new EnumMap<>(Stage.class);
    private final Set<Stage> failingStages = new HashSet<>();
    private final List<Stage> invocations = new ArrayList<>();

    public MockStageExecutor stageTime(Stage stage, double seconds) {
        stageTimes.put(stage, seconds);
        return this;
    }

    public MockStageExecutor failStage(Stage stage) {
        failingStages.add(stage);
        return this;
    }

    /**
     * Stages executed so far, in order.
     */
    public synchronized List<Stage> invocations() {
        return List.copyOf(invocations);
    }

    @Override
    public Location location() {
        return Location.LOCAL;
    }

    @Override
    public synchronized TimingRecord execute(Stage stage, Path input, Path output) throws PipelineException {
        invocations.add(stage);
        if (failingStages.contains(stage)) {
            throw new LocalExecutionException(stage, 1, "Simulated failure in " + stage.task());
        }
        try {
            Files.writeString(output, "output of " + stage.task());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return TimingRecord.local(stage, stageTimes.getOrDefault(stage, 0.0));
    }
}
