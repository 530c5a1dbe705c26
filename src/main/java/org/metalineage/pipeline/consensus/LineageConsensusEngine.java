package org.metalineage.pipeline.consensus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.metalineage.pipeline.api.model.ClassificationResult;
import org.metalineage.pipeline.api.model.ClassificationResult.State;
import org.metalineage.pipeline.taxonomy.HierarchyNode;
import org.metalineage.pipeline.taxonomy.TaxonomyHierarchy;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Turns the per-taxon evidence of one query into a single lineage.
 * <p>
 * Taxa are ranked by score. A clear winner, whose score beats the runner-up by more than
 * the relative margin, or a lone taxon is assigned directly with its score as confidence.
 * Otherwise every taxon within the margin of the top score is collapsed to their lowest
 * common ancestor, and the confidence is scaled down by how many ranked levels were lost:
 * {@code top × rankedDepth(lca) / rankedDepth(topTaxon)}.
 * <p>
 * Unranked results climb to the nearest ranked ancestor; a query whose evidence has no
 * ranked ancestor at all is unresolved. Stateless apart from the shared immutable
 * hierarchy, so one engine serves all workers.
 */
public class LineageConsensusEngine {

    private final TaxonomyHierarchy hierarchy;
    private final double margin;

    public LineageConsensusEngine(TaxonomyHierarchy hierarchy, ConsensusSettings settings) {
        this.hierarchy = hierarchy;
        this.margin = settings.margin();
    }

    /**
     * Resolves one query.
     *
     * @param queryId query name
     * @param hits    best hit per taxon; taxa unknown to the hierarchy must already be removed
     * @return the classification, unclassified when there is no usable evidence
     */
    public ClassificationResult resolve(String queryId, Collection<TaxonHit> hits) {
        if (hits.isEmpty()) {
            return ClassificationResult.unclassified(queryId);
        }
        List<TaxonHit> ranked = new ArrayList<>(hits);
        ranked.sort(TaxonHit.RANKING);
        TaxonHit top = ranked.get(0);

        if (ranked.size() == 1 || top.score() > ranked.get(1).score() * (1.0 + margin)) {
            return assign(queryId, top.taxid(), top.score());
        }

        IntArrayList contenders = new IntArrayList();
        for (TaxonHit hit : ranked) {
            if (hit.score() * (1.0 + margin) >= top.score()) {
                contenders.add(hit.taxid());
            }
        }
        int lca = hierarchy.lowestCommonAncestor(contenders);
        int assigned = lca == 0 ? 0 : hierarchy.nearestRanked(lca);
        int topDepth = hierarchy.rankedDepth(top.taxid());
        if (assigned == 0 || topDepth == 0) {
            return ClassificationResult.unclassified(queryId);
        }
        double confidence = top.score() * hierarchy.rankedDepth(assigned) / topDepth;
        return result(queryId, assigned, confidence);
    }

    /**
     * Assigns a query directly to a taxon, climbing to the nearest ranked ancestor.
     *
     * @param queryId query name
     * @param taxid   taxon in the hierarchy
     * @param score   confidence before clamping
     * @return the classification, unclassified if the taxon has no ranked ancestor
     */
    public ClassificationResult assign(String queryId, int taxid, double score) {
        int assigned = hierarchy.nearestRanked(taxid);
        if (assigned == 0) {
            return ClassificationResult.unclassified(queryId);
        }
        return result(queryId, assigned, score);
    }

    private ClassificationResult result(String queryId, int taxid, double confidence) {
        List<HierarchyNode> lineage = hierarchy.lineage(taxid);
        HierarchyNode node = hierarchy.node(taxid);
        return new ClassificationResult(queryId, lineage, node.rank().label(), clamp(confidence), State.RESOLVED);
    }

    static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
