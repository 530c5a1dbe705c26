package org.metalineage.pipeline.api.model;

import java.util.List;

import org.metalineage.pipeline.taxonomy.HierarchyNode;

/**
 * The single lineage assignment made for one query.
 *
 * @param queryId         query sequence name
 * @param lineage         ranked ancestors from root to the assigned node, empty when unresolved
 * @param taxonomicLevel  rank name of the assigned node, or {@value #UNCLASSIFIED}
 * @param confidence      confidence in [0, 1]
 * @param state           terminal resolution state
 */
public record ClassificationResult(
        String queryId,
        List<HierarchyNode> lineage,
        String taxonomicLevel,
        double confidence,
        State state) {

    public static final String UNCLASSIFIED = "unclassified";
    public static final String LINEAGE_SEPARATOR = ";";

    /**
     * Terminal states of the per-query resolution.
     */
    public enum State {
        RESOLVED,
        UNRESOLVED
    }

    public ClassificationResult {
        lineage = List.copyOf(lineage);
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence out of [0,1] for " + queryId + ": " + confidence);
        }
    }

    public static ClassificationResult unclassified(String queryId) {
        return new ClassificationResult(queryId, List.of(), UNCLASSIFIED, 0.0, State.UNRESOLVED);
    }

    public boolean isResolved() {
        return state == State.RESOLVED;
    }

    /**
     * @return taxid of the assigned node, 0 when unresolved
     */
    public int assignedTaxid() {
        return lineage.isEmpty() ? 0 : lineage.get(lineage.size() - 1).taxid();
    }

    /**
     * Formats the lineage as {@code rank:name} tokens joined by {@value #LINEAGE_SEPARATOR}.
     *
     * @return the lineage string, or {@value #UNCLASSIFIED}
     */
    public String lineageString() {
        if (lineage.isEmpty()) {
            return UNCLASSIFIED;
        }
        StringBuilder sb = new StringBuilder();
        for (HierarchyNode node : lineage) {
            if (sb.length() > 0) {
                sb.append(LINEAGE_SEPARATOR);
            }
            sb.append(node.rank().label()).append(':').append(node.name());
        }
        return sb.toString();
    }
}
