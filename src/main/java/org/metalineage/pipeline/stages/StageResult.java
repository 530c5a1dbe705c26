package org.metalineage.pipeline.stages;

import java.time.Duration;

import org.metalineage.pipeline.api.stages.StageOutcome;

/**
 * How one stage fared in a run.
 *
 * @param stage    stage name
 * @param outcome  final outcome
 * @param attempts executions tried, 0 when skipped
 * @param duration wall time spent including backoff
 * @param error    failure message, {@code null} unless failed
 */
public record StageResult(String stage, StageOutcome outcome, int attempts, Duration duration, String error) {
}
