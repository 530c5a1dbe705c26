package org.metalineage.pipeline.taxonomy;

import java.util.List;
import java.util.Locale;

/**
 * The fixed, ordered set of taxonomic ranks the pipeline reports on.
 * <p>
 * Any rank outside this enumeration (NCBI "clade", "no rank", "subgenus", ...) maps to
 * {@link #NO_RANK}; such nodes stay in the tree but are skipped when lineages are built
 * and depths are counted.
 */
public enum Rank {
    SUPERKINGDOM("superkingdom"),
    PHYLUM("phylum"),
    CLASS("class"),
    ORDER("order"),
    FAMILY("family"),
    GENUS("genus"),
    SPECIES("species"),
    STRAIN("strain"),
    NO_RANK("no rank");

    /** Ranks written to CAMI profiles, in output order. */
    public static final List<Rank> CAMI_RANKS = List.of(SUPERKINGDOM, PHYLUM, CLASS, ORDER, FAMILY, GENUS, SPECIES);

    private final String label;

    Rank(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isRanked() {
        return this != NO_RANK;
    }

    /**
     * Parses a rank name, accepting NCBI names and the single-letter CAMI abbreviations.
     * "domain" is the newer NCBI name for superkingdom. "kingdom" is deliberately not
     * folded into superkingdom so a lineage never holds two nodes of the same rank.
     *
     * @param value rank name, case-insensitive
     * @return the matching rank, or {@link #NO_RANK}
     */
    public static Rank parse(String value) {
        if (value == null) {
            return NO_RANK;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "superkingdom", "domain", "sk", "d" -> SUPERKINGDOM;
            case "phylum", "p" -> PHYLUM;
            case "class", "c" -> CLASS;
            case "order", "o" -> ORDER;
            case "family", "f" -> FAMILY;
            case "genus", "g" -> GENUS;
            case "species", "s" -> SPECIES;
            case "strain", "t" -> STRAIN;
            default -> NO_RANK;
        };
    }
}
