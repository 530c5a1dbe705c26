package org.metalineage.pipeline.profile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.metalineage.pipeline.api.model.ClassificationResult;
import org.metalineage.pipeline.api.model.ProfileEntry;
import org.metalineage.pipeline.taxonomy.HierarchyNode;
import org.metalineage.pipeline.taxonomy.Rank;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/**
 * Builds a rank-wise abundance profile from classification results.
 * <p>
 * For every CAMI rank, each resolved query whose lineage reaches that rank counts once
 * toward the taxon it holds there. By default the percentage is relative to all queries,
 * so queries collapsed to a shallower rank or left unclassified make a rank sum to less
 * than 100. With renormalization the denominator is the number of queries reaching the rank.
 */
public class ProfileAggregator {

    private static final Comparator<ProfileEntry> ORDER = Comparator
            .comparingInt((ProfileEntry e) -> e.rank().ordinal())
            .thenComparing(Comparator.comparingDouble(ProfileEntry::percentage).reversed())
            .thenComparingInt(ProfileEntry::taxid);

    private final boolean renormalize;

    public ProfileAggregator(boolean renormalize) {
        this.renormalize = renormalize;
    }

    /**
     * @param results one result per query
     * @return profile rows ordered by rank, percentage descending, taxid ascending
     */
    public List<ProfileEntry> aggregate(List<ClassificationResult> results) {
        int total = results.size();
        List<ProfileEntry> entries = new ArrayList<>();
        if (total == 0) {
            return entries;
        }

        for (Rank rank : Rank.CAMI_RANKS) {
            Int2IntOpenHashMap counts = new Int2IntOpenHashMap();
            Int2ObjectOpenHashMap<List<HierarchyNode>> paths = new Int2ObjectOpenHashMap<>();
            int reached = 0;
            for (ClassificationResult result : results) {
                if (!result.isResolved()) {
                    continue;
                }
                List<HierarchyNode> path = camiPath(result.lineage(), rank);
                if (path == null) {
                    continue;
                }
                int taxid = path.get(path.size() - 1).taxid();
                counts.addTo(taxid, 1);
                paths.putIfAbsent(taxid, path);
                reached++;
            }
            int denominator = renormalize ? reached : total;
            for (Int2IntMap.Entry count : counts.int2IntEntrySet()) {
                List<HierarchyNode> path = paths.get(count.getIntKey());
                entries.add(new ProfileEntry(count.getIntKey(), rank, joinTaxids(path), joinNames(path),
                        100.0 * count.getIntValue() / denominator));
            }
        }
        entries.sort(ORDER);
        return entries;
    }

    /**
     * @return the lineage nodes at CAMI ranks down to {@code rank}, or {@code null} if the
     *         lineage does not reach that rank
     */
    static List<HierarchyNode> camiPath(List<HierarchyNode> lineage, Rank rank) {
        List<HierarchyNode> path = new ArrayList<>();
        for (HierarchyNode node : lineage) {
            if (Rank.CAMI_RANKS.contains(node.rank()) && node.rank().ordinal() <= rank.ordinal()) {
                path.add(node);
            }
            if (node.rank() == rank) {
                return path;
            }
        }
        return null;
    }

    private static String joinTaxids(List<HierarchyNode> path) {
        StringBuilder sb = new StringBuilder();
        for (HierarchyNode node : path) {
            if (sb.length() > 0) {
                sb.append('|');
            }
            sb.append(node.taxid());
        }
        return sb.toString();
    }

    private static String joinNames(List<HierarchyNode> path) {
        StringBuilder sb = new StringBuilder();
        for (HierarchyNode node : path) {
            if (sb.length() > 0) {
                sb.append('|');
            }
            sb.append(node.name());
        }
        return sb.toString();
    }
}
