package org.metalineage.pipeline.profile;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.metalineage.pipeline.api.errors.InputException;
import org.metalineage.pipeline.api.model.ClassificationResult;
import org.metalineage.pipeline.api.model.ClassificationResult.State;
import org.metalineage.pipeline.taxonomy.HierarchyNode;
import org.metalineage.pipeline.taxonomy.Rank;
import org.metalineage.pipeline.taxonomy.TaxonomyHierarchy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Reads a {@code classified_sequences.tsv} back into classification results.
 * <p>
 * Each lineage is resolved through the hierarchy by its deepest {@code rank:name} token,
 * keeping only the taxa whose own ranked lineage carries every shallower token too, so
 * homonyms in other branches are not picked up. When the deepest token has no such match,
 * shallower tokens are tried in turn. Rows whose lineage cannot be resolved become
 * unclassified.
 */
public final class ClassifiedSequencesReader {

    private static final Logger log = LoggerFactory.getLogger(ClassifiedSequencesReader.class);

    private ClassifiedSequencesReader() {
    }

    public static List<ClassificationResult> read(Path file, TaxonomyHierarchy hierarchy) {
        List<ClassificationResult> results = new ArrayList<>();
        int unresolvable = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line = reader.readLine();
            if (line == null) {
                return results;
            }
            if (!line.startsWith("Query\t")) {
                throw new InputException("Missing 'Query' header in " + file);
            }
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                String[] cols = line.split("\t", -1);
                if (cols.length < 4) {
                    throw new InputException("Expected 4 columns in " + file + ": " + line);
                }
                ClassificationResult result = toResult(cols[0], cols[1], cols[3], hierarchy);
                if (!result.isResolved() && !ClassificationResult.UNCLASSIFIED.equals(cols[1].trim())) {
                    unresolvable++;
                }
                results.add(result);
            }
        } catch (IOException e) {
            throw new InputException("Cannot read classification file " + file + ": " + e.getMessage(), e);
        }
        if (unresolvable > 0) {
            log.warn("{} lineages in {} could not be matched to the hierarchy", unresolvable, file);
        }
        return results;
    }

    static ClassificationResult toResult(String queryId, String lineage, String confidenceText,
                                         TaxonomyHierarchy hierarchy) {
        List<Rank> ranks = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (String token : lineage.split(ClassificationResult.LINEAGE_SEPARATOR)) {
            int colon = token.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            Rank rank = Rank.parse(token.substring(0, colon));
            if (rank.isRanked()) {
                ranks.add(rank);
                names.add(token.substring(colon + 1));
            }
        }
        for (int i = ranks.size() - 1; i >= 0; i--) {
            IntList candidates = hierarchy.findAllByName(ranks.get(i), names.get(i));
            for (IntIterator it = candidates.iterator(); it.hasNext(); ) {
                int taxid = it.nextInt();
                List<HierarchyNode> chain = hierarchy.lineage(taxid);
                if (matchesPrefix(chain, ranks, names, i)) {
                    return new ClassificationResult(queryId, chain, ranks.get(i).label(),
                            parseConfidence(confidenceText), State.RESOLVED);
                }
            }
        }
        return ClassificationResult.unclassified(queryId);
    }

    /**
     * @return {@code true} if every token up to {@code last} names a node of {@code chain}
     */
    private static boolean matchesPrefix(List<HierarchyNode> chain, List<Rank> ranks, List<String> names, int last) {
        for (int i = 0; i <= last; i++) {
            boolean found = false;
            for (HierarchyNode node : chain) {
                if (node.rank() == ranks.get(i) && node.name().trim().equalsIgnoreCase(names.get(i).trim())) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    private static double parseConfidence(String text) {
        try {
            double value = Double.parseDouble(text.trim());
            return Math.max(0.0, Math.min(1.0, value));
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
