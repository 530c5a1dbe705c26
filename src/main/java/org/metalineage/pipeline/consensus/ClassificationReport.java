package org.metalineage.pipeline.consensus;

import java.util.List;

import org.metalineage.pipeline.api.errors.DegradedModeWarning;
import org.metalineage.pipeline.api.model.ClassificationResult;

/**
 * Results of a classification run.
 *
 * @param results  one result per query, in query-set order
 * @param stats    run counters
 * @param warnings degraded modes entered during the run
 */
public record ClassificationReport(
        List<ClassificationResult> results,
        ClassificationStats stats,
        List<DegradedModeWarning> warnings) {
}
