package org.metalineage.pipeline.taxonomy;

/**
 * A node of the taxonomy tree.
 *
 * @param taxid       node id
 * @param rank        node rank, {@link Rank#NO_RANK} for unranked internal nodes
 * @param parentTaxid parent id; a root points at itself or at 0
 * @param name        scientific name
 */
public record HierarchyNode(int taxid, Rank rank, int parentTaxid, String name) {

    public boolean isRoot() {
        return parentTaxid == taxid || parentTaxid == 0;
    }
}
