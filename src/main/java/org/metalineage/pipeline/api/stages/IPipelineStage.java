package org.metalineage.pipeline.api.stages;

import org.metalineage.pipeline.stages.PipelineContext;

/**
 * One step of the classification pipeline.
 * <p>
 * Stages exchange data through files in the run's work and output directories, so a rerun
 * can skip the leading stages whose outputs survived an earlier run. Once one stage runs,
 * the orchestrator runs all later stages too.
 */
public interface IPipelineStage {

    /**
     * @return short name used in logs and run reports
     */
    String getName();

    /**
     * Idempotence check.
     *
     * @return {@code true} if the stage's outputs already exist and it can be skipped
     */
    boolean isComplete(PipelineContext context);

    /**
     * Produces the stage's outputs. Must either complete or leave no partial output behind.
     *
     * @throws org.metalineage.pipeline.api.errors.PipelineException on failure
     */
    void execute(PipelineContext context);
}
