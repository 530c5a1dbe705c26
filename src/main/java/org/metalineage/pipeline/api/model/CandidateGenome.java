package org.metalineage.pipeline.api.model;

/**
 * A reference genome selected for full alignment.
 *
 * @param accessionId candidate identifier (screen genome id or accession)
 * @param speciesKey  key used for species-level deduplication
 * @param sourceDb    name of the reference database that produced the candidate
 * @param bestScore   best screen score observed for the candidate, or negative infinity
 */
public record CandidateGenome(String accessionId, String speciesKey, String sourceDb, double bestScore) {

    /**
     * Derives an assembly accession from a candidate file name by keeping the first two
     * underscore-separated tokens: {@code GCF_000005845.2_ASM584v2_genomic.fna.gz}
     * becomes {@code GCF_000005845.2}.
     *
     * @param candidate candidate file name or identifier
     * @return the accession, or the input unchanged when it has fewer than two tokens
     */
    public static String accessionOf(String candidate) {
        int first = candidate.indexOf('_');
        if (first < 0) {
            return candidate;
        }
        int second = candidate.indexOf('_', first + 1);
        return second < 0 ? candidate : candidate.substring(0, second);
    }
}
