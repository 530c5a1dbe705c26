package org.metalineage.pipeline.api.model;

/**
 * Counts recorded while limiting a candidate list.
 *
 * @param inputCount     candidates handed to the limiter
 * @param postDedupCount candidates left after species-level deduplication
 * @param postCapCount   candidates left after the size cap
 */
public record LimitAudit(int inputCount, int postDedupCount, int postCapCount) {
}
