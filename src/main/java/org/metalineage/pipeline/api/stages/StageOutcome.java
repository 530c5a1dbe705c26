package org.metalineage.pipeline.api.stages;

/**
 * How a stage ended within one run.
 */
public enum StageOutcome {
    /** Outputs already present; nothing was executed. */
    SKIPPED,
    COMPLETED,
    FAILED
}
