package io.surfworks.hybridforge.pipeline;

import io.surfworks.hybridforge.report.TimingRecord;
import io.surfworks.hybridforge.stage.Location;
import io.surfworks.hybridforge.stage.Stage;

import java.nio.file.Path;

/**
 * Receives progress callbacks from the {@link Orchestrator}.
 *
 * <p>Callbacks run on the orchestrator's thread; all methods default to no-ops.
 */
public interface PipelineListener {

    /** Listener that ignores every event */
    PipelineListener NONE = new PipelineListener() { };

    default void connecting(String target) {
    }

    default void connected(String target) {
    }

    default void stageStarted(Stage stage, Location location) {
    }

    default void stageCompleted(TimingRecord record) {
    }

    default void stageFailed(Stage stage, PipelineException failure) {
    }

    default void reportWritten(Path reportFile) {
    }
}
