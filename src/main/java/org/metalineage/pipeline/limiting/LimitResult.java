package org.metalineage.pipeline.limiting;

import java.util.List;

import org.metalineage.pipeline.api.model.CandidateGenome;
import org.metalineage.pipeline.api.model.LimitAudit;

/**
 * Limiter output.
 *
 * @param candidates surviving candidates sorted by identifier
 * @param audit      counts after each step
 */
public record LimitResult(List<CandidateGenome> candidates, LimitAudit audit) {

    public List<String> candidateIds() {
        return candidates.stream().map(CandidateGenome::accessionId).toList();
    }
}
