package org.metalineage.pipeline.consensus;

/**
 * Counters of one classification run.
 *
 * @param records        alignment records read
 * @param malformed      PAF lines skipped as malformed
 * @param unmappedHits   records whose target had no taxid in the map or hierarchy
 * @param ignoredQueries queries seen only in the alignments when an explicit query set was given
 * @param queries        queries classified
 * @param resolved       queries with a lineage
 * @param firstHitFallback whether the first-hit fallback produced the results
 */
public record ClassificationStats(
        long records,
        long malformed,
        long unmappedHits,
        int ignoredQueries,
        int queries,
        int resolved,
        boolean firstHitFallback) {

    public int unresolved() {
        return queries - resolved;
    }
}
