package io.surfworks.hybridforge.stage;

import io.surfworks.hybridforge.pipeline.PipelineException;
import io.surfworks.hybridforge.report.TimingRecord;

import java.nio.file.Path;

/**
 * Runs one pipeline stage somewhere and reports how long it took.
 *
 * <p>Implementations differ only in where the stage process runs; both
 * return a {@link TimingRecord} of the same shape so runs can be compared.
 * The wall time is left at zero for the caller to fill in.
 */
public interface StageExecutor {

    /**
     * Returns where this executor runs stages.
     */
    Location location();

    /**
     * Runs a stage to completion.
     *
     * @param stage  the stage to run
     * @param input  local input artifact (null for a stage that consumes nothing)
     * @param output local path where the output artifact must end up
     * @return the stage's timing
     * @throws PipelineException if the stage fails; the run must abort
     */
    TimingRecord execute(Stage stage, Path input, Path output) throws PipelineException;
}
