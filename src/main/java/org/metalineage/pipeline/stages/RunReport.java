package org.metalineage.pipeline.stages;

import java.util.List;

import org.metalineage.pipeline.api.errors.DegradedModeWarning;
import org.metalineage.pipeline.api.stages.StageOutcome;

/**
 * Summary of an orchestrated run. Stages after a failed one are not listed.
 *
 * @param stages   per-stage results in execution order
 * @param warnings degraded modes entered during the run
 */
public record RunReport(List<StageResult> stages, List<DegradedModeWarning> warnings) {

    public boolean isSuccess() {
        return stages.stream().noneMatch(s -> s.outcome() == StageOutcome.FAILED);
    }

    public StageOutcome outcomeOf(String stage) {
        return stages.stream().filter(s -> s.stage().equals(stage)).map(StageResult::outcome)
                .findFirst().orElse(null);
    }
}
