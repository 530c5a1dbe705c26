package org.metalineage.cli.cleanup;

import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.metalineage.pipeline.cache.CacheEntry;
import org.metalineage.pipeline.cache.CacheFiles;
import org.metalineage.pipeline.cache.ReferenceCacheManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prunes the reference cache by age and total size.
 * <p>
 * Entries whose newest file is older than the age limit go first; then the oldest
 * remaining entries are removed until the cache fits the size limit. Without
 * {@code force} nothing is deleted and the selection is only printed. Each deletion holds
 * the entry's cache lock.
 */
public class CachePruner {

    private static final Logger log = LoggerFactory.getLogger(CachePruner.class);
    private static final long BYTES_PER_GIB = 1024L * 1024L * 1024L;

    private final ReferenceCacheManager cache;

    public CachePruner(ReferenceCacheManager cache) {
        this.cache = cache;
    }

    /**
     * Scanned entry.
     */
    record Candidate(CacheEntry entry, long sizeBytes, Instant modified) {
    }

    /**
     * @param maxAgeDays entries older than this are removed; {@code <= 0} disables the age limit
     * @param maxSizeGb  total cache size limit in GiB; {@code <= 0} disables the size limit
     * @param force      delete; otherwise only preview
     * @param now        reference time for ages
     * @param out        progress output
     */
    public PruneResult prune(double maxAgeDays, double maxSizeGb, boolean force, Instant now, PrintWriter out)
            throws IOException {
        List<Candidate> candidates = new ArrayList<>();
        for (CacheEntry entry : cache.listEntries()) {
            candidates.add(new Candidate(entry, CacheFiles.sizeOf(entry.directory()),
                    CacheFiles.newestModification(entry.directory()).toInstant()));
        }
        candidates.sort(Comparator.comparing(Candidate::modified).thenComparing(c -> c.entry().cacheKey()));

        Map<Candidate, String> toDelete = select(candidates, maxAgeDays, maxSizeGb, now);

        out.printf("Cache (%s):%n", cache.getCacheRoot());
        int kept = 0;
        int deleted = 0;
        int failed = 0;
        long freed = 0;
        for (Candidate candidate : candidates) {
            String key = candidate.entry().cacheKey();
            String reason = toDelete.get(candidate);
            if (reason == null) {
                out.printf("  %s KEEP   %s %s%n", "\u2713", key, humanSize(candidate.sizeBytes()));
                kept++;
                continue;
            }
            if (!force) {
                out.printf("  %s DELETE %s %s (%s)%n", "\u2717", key, humanSize(candidate.sizeBytes()), reason);
                deleted++;
                freed += candidate.sizeBytes();
                continue;
            }
            try {
                cache.withKeyLock(key, () -> {
                    CacheFiles.deleteRecursively(candidate.entry().directory());
                    return null;
                });
                out.printf("  %s DELETE %s %s (%s, deleted)%n", "\u2717", key, humanSize(candidate.sizeBytes()), reason);
                deleted++;
                freed += candidate.sizeBytes();
            } catch (IOException e) {
                out.printf("  %s DELETE %s (FAILED: %s)%n", "\u2717", key, e.getMessage());
                log.error("Failed to delete cache entry {}: {}", candidate.entry().directory(), e.getMessage());
                failed++;
            }
        }
        out.println();
        return new PruneResult(kept, deleted, freed, failed);
    }

    /**
     * Picks entries to delete from candidates sorted oldest first.
     *
     * @return entries to delete with the reason, in input order
     */
    static Map<Candidate, String> select(List<Candidate> oldestFirst, double maxAgeDays, double maxSizeGb,
                                         Instant now) {
        Map<Candidate, String> selected = new LinkedHashMap<>();
        long total = 0;
        for (Candidate candidate : oldestFirst) {
            total += candidate.sizeBytes();
        }

        if (maxAgeDays > 0) {
            Instant cutoff = now.minus(Duration.ofMillis((long) (maxAgeDays * 86_400_000L)));
            for (Candidate candidate : oldestFirst) {
                if (candidate.modified().isBefore(cutoff)) {
                    selected.put(candidate, "older than " + formatNumber(maxAgeDays) + " days");
                    total -= candidate.sizeBytes();
                }
            }
        }
        if (maxSizeGb > 0) {
            long limit = (long) (maxSizeGb * BYTES_PER_GIB);
            for (Candidate candidate : oldestFirst) {
                if (total <= limit) {
                    break;
                }
                if (!selected.containsKey(candidate)) {
                    selected.put(candidate, "cache above " + formatNumber(maxSizeGb) + " GiB");
                    total -= candidate.sizeBytes();
                }
            }
        }
        return selected;
    }

    public static String humanSize(long bytes) {
        String[] units = {"B", "KiB", "MiB", "GiB", "TiB"};
        double size = bytes;
        for (String unit : units) {
            if (size < 1024.0) {
                return String.format(Locale.ROOT, "%.1f %s", size, unit);
            }
            size /= 1024.0;
        }
        return String.format(Locale.ROOT, "%.1f PiB", size);
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
