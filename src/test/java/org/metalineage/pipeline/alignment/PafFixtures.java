package org.metalineage.pipeline.alignment;

/**
 * Builds PAF lines for tests.
 */
public final class PafFixtures {

    private PafFixtures() {
    }

    /**
     * @param query    query name; query length is 1000
     * @param target   reference sequence name
     * @param matches  matching bases
     * @param blockLen alignment block length
     * @param mapq     mapping quality
     */
    public static String line(String query, String target, int matches, int blockLen, int mapq) {
        return String.join("\t", query, "1000", "0", String.valueOf(blockLen), "+", target,
                "5000000", "100", String.valueOf(100 + blockLen), String.valueOf(matches),
                String.valueOf(blockLen), String.valueOf(mapq), "tp:A:P", "cm:i:80");
    }
}
