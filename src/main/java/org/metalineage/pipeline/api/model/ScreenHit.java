package org.metalineage.pipeline.api.model;

/**
 * One row of a similarity screen: a reference genome and how similar the query set is to it.
 *
 * @param genomeId   reference identifier as reported by the screener (usually a file name)
 * @param score      similarity score; higher means more similar
 * @param rawMetrics the remaining screener columns, kept for diagnostics
 */
public record ScreenHit(String genomeId, double score, RawMetrics rawMetrics) {

    /**
     * Mash screen columns other than identity and query id.
     *
     * @param sharedHashes       shared hashes as "matched/total"
     * @param medianMultiplicity median k-mer multiplicity
     * @param pValue             p-value of the identity estimate
     * @param comment            free-text comment from the sketch
     */
    public record RawMetrics(String sharedHashes, double medianMultiplicity, double pValue, String comment) {

        public static final RawMetrics NONE = new RawMetrics("", 0.0, 1.0, "");
    }

    public ScreenHit(String genomeId, double score) {
        this(genomeId, score, RawMetrics.NONE);
    }
}
