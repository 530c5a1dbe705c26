package org.metalineage.pipeline.limiting;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads NCBI {@code assembly_summary_*.txt} files into an accession to species-key map.
 * <p>
 * Column 1 holds the assembly accession, column 7 the species taxid and column 6 the
 * taxid used when the species taxid is missing or {@code na}.
 */
public final class AssemblySummaryReader {

    private static final Logger log = LoggerFactory.getLogger(AssemblySummaryReader.class);

    private AssemblySummaryReader() {
    }

    /**
     * Loads every readable summary; missing or unreadable files are logged and skipped.
     * Earlier files win when an accession appears twice.
     *
     * @param summaries summary files
     * @return accession to species key, possibly empty
     */
    public static Map<String, String> readAll(Collection<Path> summaries) {
        Map<String, String> keys = new HashMap<>();
        for (Path summary : summaries) {
            if (!Files.isRegularFile(summary)) {
                log.warn("Assembly summary not found, accessions stay their own species key: {}", summary);
                continue;
            }
            try {
                int before = keys.size();
                read(summary, keys);
                log.debug("Loaded {} species keys from {}", keys.size() - before, summary);
            } catch (IOException e) {
                log.warn("Failed to read assembly summary {}: {}", summary, e.getMessage());
            }
        }
        return keys;
    }

    static void read(Path summary, Map<String, String> keys) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(summary, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                String[] cols = line.split("\t", -1);
                if (cols.length < 6) {
                    continue;
                }
                String accession = cols[0].trim();
                String species = cols.length > 6 ? cols[6].trim() : "";
                if (species.isEmpty() || "na".equalsIgnoreCase(species)) {
                    species = cols[5].trim();
                }
                if (!accession.isEmpty() && !species.isEmpty()) {
                    keys.putIfAbsent(accession, species);
                }
            }
        }
    }
}
