package org.metalineage.pipeline.consensus;

import java.util.Comparator;

/**
 * Best evidence for one taxon within one query.
 *
 * @param taxid           taxon
 * @param score           best per-hit score among the query's alignments to this taxon
 * @param targetAccession reference sequence of that best alignment
 */
public record TaxonHit(int taxid, double score, String targetAccession) {

    /** Score descending, then target id, then taxid. */
    public static final Comparator<TaxonHit> RANKING = Comparator.comparingDouble(TaxonHit::score).reversed()
            .thenComparing(TaxonHit::targetAccession)
            .thenComparingInt(TaxonHit::taxid);

    /**
     * @return {@code true} if this hit should replace {@code other} as best for the same taxon
     */
    boolean beats(TaxonHit other) {
        return RANKING.compare(this, other) < 0;
    }
}
