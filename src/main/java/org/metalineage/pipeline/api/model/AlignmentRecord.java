package org.metalineage.pipeline.api.model;

/**
 * One aligned segment between a query contig and a reference sequence (a PAF row).
 *
 * @param queryId         query sequence name
 * @param queryLen        query sequence length
 * @param queryStart      0-based start on the query
 * @param queryEnd        end on the query (exclusive)
 * @param strand          relative strand
 * @param targetAccession reference sequence name
 * @param targetLen       reference sequence length
 * @param targetStart     0-based start on the reference
 * @param targetEnd       end on the reference (exclusive)
 * @param matchBases      number of matching bases
 * @param blockLen        alignment block length including gaps
 * @param mapq            mapping quality, {@link #MAPQ_UNAVAILABLE} when not reported
 */
public record AlignmentRecord(
        String queryId,
        int queryLen,
        int queryStart,
        int queryEnd,
        Strand strand,
        String targetAccession,
        long targetLen,
        long targetStart,
        long targetEnd,
        int matchBases,
        int blockLen,
        int mapq) {

    /** PAF convention for a missing mapping quality. */
    public static final int MAPQ_UNAVAILABLE = 255;

    /**
     * @return matching bases over block length, 0 for an empty block
     */
    public double identity() {
        return blockLen > 0 ? (double) matchBases / blockLen : 0.0;
    }

    /**
     * @return block length over query length, capped at 1, 0 for an empty query
     */
    public double coverage() {
        return queryLen > 0 ? Math.min(1.0, (double) blockLen / queryLen) : 0.0;
    }

    /**
     * Relative strand of an alignment.
     */
    public enum Strand {
        FORWARD('+'),
        REVERSE('-');

        private final char symbol;

        Strand(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }

        public static Strand parse(String value) {
            return "-".equals(value) ? REVERSE : FORWARD;
        }
    }
}
