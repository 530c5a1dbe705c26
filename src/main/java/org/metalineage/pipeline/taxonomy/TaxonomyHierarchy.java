package org.metalineage.pipeline.taxonomy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.metalineage.pipeline.api.errors.DataIntegrityException;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;

/**
 * Immutable taxonomy tree with precomputed depths.
 * <p>
 * Built once at startup through {@link #of(Collection)}, which rejects orphans and cycles,
 * and then shared read-only by every classification worker. No method mutates state after
 * construction, so concurrent reads need no synchronization.
 * <p>
 * Two depths are kept per node: the total depth (every node on the path to the root,
 * used to walk two chains to their meeting point) and the ranked depth (only nodes with a
 * rank from {@link Rank}, used for lineages and confidence scaling).
 */
public final class TaxonomyHierarchy {

    private final Int2ObjectOpenHashMap<HierarchyNode> nodes;
    private final Int2IntOpenHashMap depth;
    private final Int2IntOpenHashMap rankedDepth;
    private final Object2ObjectOpenHashMap<String, IntArrayList> nameIndex;

    private TaxonomyHierarchy(Int2ObjectOpenHashMap<HierarchyNode> nodes,
                              Int2IntOpenHashMap depth,
                              Int2IntOpenHashMap rankedDepth,
                              Object2ObjectOpenHashMap<String, IntArrayList> nameIndex) {
        this.nodes = nodes;
        this.depth = depth;
        this.rankedDepth = rankedDepth;
        this.nameIndex = nameIndex;
    }

    /**
     * Builds and validates a hierarchy.
     *
     * @param input all nodes of the tree; later duplicates of a taxid replace earlier ones
     * @return the validated hierarchy
     * @throws DataIntegrityException if a parent taxid is missing or a parent chain loops
     */
    public static TaxonomyHierarchy of(Collection<HierarchyNode> input) {
        Int2ObjectOpenHashMap<HierarchyNode> nodes = new Int2ObjectOpenHashMap<>(input.size());
        for (HierarchyNode node : input) {
            nodes.put(node.taxid(), node);
        }

        Int2IntOpenHashMap depth = new Int2IntOpenHashMap(nodes.size());
        Int2IntOpenHashMap rankedDepth = new Int2IntOpenHashMap(nodes.size());
        IntArrayList path = new IntArrayList();
        IntOpenHashSet onPath = new IntOpenHashSet();

        IntIterator it = nodes.keySet().iterator();
        while (it.hasNext()) {
            int start = it.nextInt();
            if (depth.containsKey(start)) {
                continue;
            }
            path.clear();
            onPath.clear();

            // Walk up until a node with a known depth or a root is reached
            int current = start;
            int baseDepth = 0;
            int baseRankedDepth = 0;
            while (true) {
                if (depth.containsKey(current)) {
                    baseDepth = depth.get(current);
                    baseRankedDepth = rankedDepth.get(current);
                    break;
                }
                HierarchyNode node = nodes.get(current);
                if (node == null) {
                    int child = path.getInt(path.size() - 1);
                    throw new DataIntegrityException(
                            "Taxid " + child + " references missing parent taxid " + current, child);
                }
                if (!onPath.add(current)) {
                    throw new DataIntegrityException("Cycle in taxonomy hierarchy at taxid " + current, current);
                }
                path.add(current);
                if (node.isRoot()) {
                    break;
                }
                current = node.parentTaxid();
            }

            // Unwind from the topmost node down to the start node
            for (int i = path.size() - 1; i >= 0; i--) {
                int taxid = path.getInt(i);
                baseDepth++;
                if (nodes.get(taxid).rank().isRanked()) {
                    baseRankedDepth++;
                }
                depth.put(taxid, baseDepth);
                rankedDepth.put(taxid, baseRankedDepth);
            }
        }

        Object2ObjectOpenHashMap<String, IntArrayList> nameIndex = new Object2ObjectOpenHashMap<>(nodes.size());
        for (HierarchyNode node : nodes.values()) {
            String key = nameKey(node.rank(), node.name());
            IntArrayList taxids = nameIndex.get(key);
            if (taxids == null) {
                taxids = new IntArrayList(1);
                nameIndex.put(key, taxids);
            }
            taxids.add(node.taxid());
        }
        for (IntArrayList taxids : nameIndex.values()) {
            IntArrays.quickSort(taxids.elements(), 0, taxids.size());
        }

        return new TaxonomyHierarchy(nodes, depth, rankedDepth, nameIndex);
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(int taxid) {
        return nodes.containsKey(taxid);
    }

    /**
     * @param taxid node id
     * @return the node, or {@code null} if the taxid is unknown
     */
    public HierarchyNode node(int taxid) {
        return nodes.get(taxid);
    }

    /**
     * @param taxid node id
     * @return number of nodes from the root to this node inclusive, 0 if unknown
     */
    public int depth(int taxid) {
        return depth.getOrDefault(taxid, 0);
    }

    /**
     * @param taxid node id
     * @return number of ranked nodes from the root to this node inclusive, 0 if unknown
     */
    public int rankedDepth(int taxid) {
        return rankedDepth.getOrDefault(taxid, 0);
    }

    /**
     * Returns every node from the root down to {@code taxid}, unranked nodes included.
     *
     * @param taxid node id
     * @return the ancestor chain, empty if the taxid is unknown
     */
    public List<HierarchyNode> ancestors(int taxid) {
        HierarchyNode node = nodes.get(taxid);
        if (node == null) {
            return List.of();
        }
        List<HierarchyNode> chain = new ArrayList<>(depth(taxid));
        while (true) {
            chain.add(node);
            if (node.isRoot()) {
                break;
            }
            node = nodes.get(node.parentTaxid());
        }
        Collections.reverse(chain);
        return chain;
    }

    /**
     * Returns the ranked nodes from the root down to {@code taxid}.
     *
     * @param taxid node id
     * @return the lineage, empty if the taxid is unknown or has no ranked ancestor
     */
    public List<HierarchyNode> lineage(int taxid) {
        List<HierarchyNode> chain = ancestors(taxid);
        List<HierarchyNode> ranked = new ArrayList<>(chain.size());
        for (HierarchyNode node : chain) {
            if (node.rank().isRanked()) {
                ranked.add(node);
            }
        }
        return ranked;
    }

    /**
     * Returns the nearest ranked node at or above {@code taxid}.
     *
     * @param taxid node id
     * @return the ranked node's taxid, or 0 if none exists
     */
    public int nearestRanked(int taxid) {
        HierarchyNode node = nodes.get(taxid);
        while (node != null) {
            if (node.rank().isRanked()) {
                return node.taxid();
            }
            if (node.isRoot()) {
                return 0;
            }
            node = nodes.get(node.parentTaxid());
        }
        return 0;
    }

    /**
     * Returns the lowest common ancestor of two nodes by walking the deeper chain upwards
     * until both chains meet.
     *
     * @return the LCA taxid, or 0 if either node is unknown or the nodes live in different trees
     */
    public int lowestCommonAncestor(int a, int b) {
        HierarchyNode na = nodes.get(a);
        HierarchyNode nb = nodes.get(b);
        if (na == null || nb == null) {
            return 0;
        }
        int da = depth(a);
        int db = depth(b);
        while (na.taxid() != nb.taxid()) {
            if (da >= db) {
                if (na.isRoot()) {
                    return 0;
                }
                na = nodes.get(na.parentTaxid());
                da--;
            } else {
                if (nb.isRoot()) {
                    return 0;
                }
                nb = nodes.get(nb.parentTaxid());
                db--;
            }
        }
        return na.taxid();
    }

    /**
     * Returns the lowest common ancestor of a set of nodes.
     *
     * @param taxids the nodes; must not be empty
     * @return the deepest node that is an ancestor of every member, or 0 if none exists
     */
    public int lowestCommonAncestor(IntCollection taxids) {
        if (taxids.isEmpty()) {
            throw new IllegalArgumentException("LCA of an empty set is undefined");
        }
        IntIterator it = taxids.iterator();
        int lca = it.nextInt();
        if (!contains(lca)) {
            return 0;
        }
        while (it.hasNext() && lca != 0) {
            lca = lowestCommonAncestor(lca, it.nextInt());
        }
        return lca;
    }

    /**
     * @return {@code true} if {@code ancestor} lies on the chain from {@code taxid} to the root
     */
    public boolean isAncestorOrSelf(int ancestor, int taxid) {
        return contains(ancestor) && lowestCommonAncestor(ancestor, taxid) == ancestor;
    }

    /**
     * Looks a taxon up by rank and scientific name, case-insensitively.
     *
     * @return the taxid, the smallest one on name collisions, or 0 if none matches
     */
    public int findByName(Rank rank, String name) {
        IntList taxids = findAllByName(rank, name);
        return taxids.isEmpty() ? 0 : taxids.getInt(0);
    }

    /**
     * Looks up every taxon sharing a rank and scientific name, case-insensitively.
     * Homonyms are common across kingdoms, e.g. a bacterial and an insect genus.
     *
     * @return matching taxids in ascending order, empty if none matches
     */
    public IntList findAllByName(Rank rank, String name) {
        IntArrayList taxids = nameIndex.get(nameKey(rank, name));
        return taxids == null ? IntLists.emptyList() : IntLists.unmodifiable(taxids);
    }

    private static String nameKey(Rank rank, String name) {
        return rank.label() + ':' + name.trim().toLowerCase(Locale.ROOT);
    }
}
