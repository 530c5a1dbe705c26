package org.metalineage.pipeline.selection;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.metalineage.pipeline.api.model.ScreenHit;

/**
 * Parses similarity screen tables in Mash {@code screen} layout:
 * <pre>
 * identity  shared-hashes  median-multiplicity  p-value  query-ID  query-comment
 * </pre>
 * Only the best-scoring row per genome is kept. Rows with fewer than five columns or a
 * non-numeric identity are skipped and counted.
 */
public final class ScreenTableReader {

    /** Orders hits by score descending, then genome id ascending. */
    public static final Comparator<ScreenHit> BY_SCORE_DESC =
            Comparator.comparingDouble(ScreenHit::score).reversed().thenComparing(ScreenHit::genomeId);

    private ScreenTableReader() {
    }

    /**
     * Parsed table contents.
     *
     * @param hits      best hit per genome, score-descending
     * @param malformed number of rows skipped
     */
    public record ScreenTable(List<ScreenHit> hits, int malformed) {
    }

    public static ScreenTable read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public static ScreenTable parse(Reader source) throws IOException {
        Map<String, ScreenHit> best = new LinkedHashMap<>();
        int malformed = 0;
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split("\t", -1);
            if (parts.length < 5 || parts[4].isBlank()) {
                malformed++;
                continue;
            }
            double score;
            try {
                score = Double.parseDouble(parts[0].trim());
            } catch (NumberFormatException e) {
                malformed++;
                continue;
            }
            String genomeId = parts[4].trim();
            ScreenHit hit = new ScreenHit(genomeId, score, new ScreenHit.RawMetrics(
                    parts[1].trim(),
                    parseOrDefault(parts[2], 0.0),
                    parseOrDefault(parts[3], 1.0),
                    parts.length > 5 ? parts[5].trim() : ""));
            ScreenHit existing = best.get(genomeId);
            if (existing == null || hit.score() > existing.score()) {
                best.put(genomeId, hit);
            }
        }
        List<ScreenHit> hits = new ArrayList<>(best.values());
        hits.sort(BY_SCORE_DESC);
        return new ScreenTable(hits, malformed);
    }

    private static double parseOrDefault(String value, double fallback) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
