package org.metalineage.pipeline.taxonomy;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

import org.metalineage.pipeline.api.errors.ConfigurationException;
import org.metalineage.pipeline.api.errors.DegradedModeWarning;
import org.metalineage.pipeline.api.model.TaxonomyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Immutable lookup from reference sequence identifiers to taxids.
 * <p>
 * The source is the downloader's taxonomy map, a TSV with header
 * {@code GCF  TaxID  Identifiers} where identifiers are {@code ;}-separated. Every
 * identifier and the bucket accession itself map to the row's taxid. Rows whose taxid is
 * not numeric (the downloader writes {@code Unknown TaxID}) are skipped.
 * <p>
 * Two lookups exist: {@link #taxidOf(String)} matches exactly, while
 * {@link #taxidOfLenient(String)} additionally tries the identifier with its version suffix
 * stripped ({@code NC_000913.3} → {@code NC_000913}).
 */
public final class AccessionTaxonomyMap {

    private static final Logger log = LoggerFactory.getLogger(AccessionTaxonomyMap.class);

    private static final AccessionTaxonomyMap EMPTY = of(List.of());

    private final Object2IntOpenHashMap<String> exact;
    private final Object2IntOpenHashMap<String> unversioned;
    private final int recordCount;

    private AccessionTaxonomyMap(Object2IntOpenHashMap<String> exact,
                                 Object2IntOpenHashMap<String> unversioned,
                                 int recordCount) {
        this.exact = exact;
        this.unversioned = unversioned;
        this.recordCount = recordCount;
    }

    public static AccessionTaxonomyMap empty() {
        return EMPTY;
    }

    /**
     * Builds a map from records. When two records claim the same identifier, the first wins.
     */
    public static AccessionTaxonomyMap of(Collection<TaxonomyRecord> records) {
        Object2IntOpenHashMap<String> exact = new Object2IntOpenHashMap<>();
        Object2IntOpenHashMap<String> unversioned = new Object2IntOpenHashMap<>();
        exact.defaultReturnValue(0);
        unversioned.defaultReturnValue(0);
        for (TaxonomyRecord record : records) {
            register(exact, unversioned, record.bucketId(), record.taxid());
            for (String identifier : record.identifierList()) {
                register(exact, unversioned, identifier, record.taxid());
            }
        }
        return new AccessionTaxonomyMap(exact, unversioned, records.size());
    }

    /**
     * Loads the taxonomy map.
     *
     * @throws ConfigurationException if the file is missing or unreadable
     */
    public static AccessionTaxonomyMap load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Taxonomy map not found: " + file.toAbsolutePath());
        }
        try {
            AccessionTaxonomyMap map = of(readRecords(file));
            log.info("Loaded {} taxonomy mappings ({} buckets) from {}", map.size(), map.recordCount, file);
            return map;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read taxonomy map " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads the taxonomy map, degrading to an empty map when it cannot be read.
     *
     * @param file     taxonomy map TSV
     * @param warnings receives a {@link DegradedModeWarning} when the map is unavailable
     */
    public static AccessionTaxonomyMap loadOrEmpty(Path file, Consumer<DegradedModeWarning> warnings) {
        try {
            return load(file);
        } catch (ConfigurationException e) {
            DegradedModeWarning warning = DegradedModeWarning.of(
                    DegradedModeWarning.Code.TAXONOMY_MAP_UNAVAILABLE,
                    "Taxonomy map unavailable, continuing without mappings: " + e.getMessage());
            log.warn(warning.message());
            warnings.accept(warning);
            return empty();
        }
    }

    static List<TaxonomyRecord> readRecords(Path file) throws IOException {
        List<TaxonomyRecord> records = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            // The header row has no numeric taxid and is skipped like any other such row
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    skipped += addRecord(records, line);
                }
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} taxonomy map rows without a numeric taxid in {}", skipped, file);
        }
        return records;
    }

    private static int addRecord(List<TaxonomyRecord> records, String line) {
        String[] parts = line.split("\t", -1);
        if (parts.length < 3) {
            return 1;
        }
        int taxid;
        try {
            taxid = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            return 1;
        }
        List<String> identifiers = new ArrayList<>();
        for (String identifier : parts[2].split(";")) {
            String cleaned = identifier.trim();
            if (!cleaned.isEmpty()) {
                identifiers.add(cleaned);
            }
        }
        records.add(new TaxonomyRecord(parts[0].trim(), taxid, identifiers));
        return 0;
    }

    private static void register(Object2IntOpenHashMap<String> exact, Object2IntOpenHashMap<String> unversioned,
                                 String identifier, int taxid) {
        if (identifier.isEmpty() || taxid <= 0) {
            return;
        }
        exact.putIfAbsent(identifier, taxid);
        unversioned.putIfAbsent(stripVersion(identifier), taxid);
    }

    static String stripVersion(String identifier) {
        int dot = identifier.indexOf('.');
        return dot > 0 ? identifier.substring(0, dot) : identifier;
    }

    /**
     * @return the taxid for an exact identifier match, or 0
     */
    public int taxidOf(String identifier) {
        return exact.getInt(identifier);
    }

    /**
     * @return the taxid for an exact or version-stripped match, or 0
     */
    public int taxidOfLenient(String identifier) {
        int taxid = exact.getInt(identifier);
        return taxid != 0 ? taxid : unversioned.getInt(stripVersion(identifier));
    }

    /**
     * @return number of distinct identifiers mapped
     */
    public int size() {
        return exact.size();
    }

    public boolean isEmpty() {
        return exact.isEmpty();
    }
}
