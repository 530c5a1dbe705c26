package org.metalineage.pipeline.cache;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

import org.metalineage.pipeline.api.errors.InputException;
import org.metalineage.pipeline.api.errors.PipelineException;
import org.metalineage.pipeline.api.tools.IAligner;
import org.metalineage.pipeline.api.tools.IReferenceDownloader;
import org.metalineage.pipeline.api.tools.IReferenceDownloader.DownloadedReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Content-addressed cache of downloaded reference sets.
 * <p>
 * Layout under the cache root:
 * <pre>
 * {cacheRoot}/{key}/manifest.json        Ready manifest
 * {cacheRoot}/{key}/combined_genomes.fasta
 * {cacheRoot}/{key}/detailed_taxonomy.tsv
 * {cacheRoot}/{key}/reference.mmi        alignment index, built lazily
 * {cacheRoot}/{key}.lock                 cross-process lock file
 * </pre>
 * Entries are built in a hidden temporary sibling directory and renamed into place after
 * the manifest is written. Work on one key is serialized by an in-process lock plus an
 * exclusive file lock, so concurrent callers in this or another process either build the
 * entry or wait and then observe it ready.
 * <p>
 * Instances are thread-safe.
 */
public class ReferenceCacheManager {

    private static final Logger log = LoggerFactory.getLogger(ReferenceCacheManager.class);

    static final String FASTA_NAME = "combined_genomes.fasta";
    static final String TAXONOMY_NAME = "detailed_taxonomy.tsv";
    static final String INDEX_NAME = "reference.mmi";

    private final Path cacheRoot;
    private final IReferenceDownloader downloader;
    private final IAligner aligner;
    private final ConcurrentMap<String, ReentrantLock> keyLocks = new ConcurrentHashMap<>();

    public ReferenceCacheManager(Path cacheRoot, IReferenceDownloader downloader, IAligner aligner) {
        this.cacheRoot = cacheRoot;
        this.downloader = downloader;
        this.aligner = aligner;
    }

    public Path getCacheRoot() {
        return cacheRoot;
    }

    /**
     * Work performed while holding the lock of one key.
     */
    @FunctionalInterface
    public interface LockedAction<T> {
        T run() throws IOException;
    }

    /**
     * Returns the Ready entry for a candidate list, building it when absent.
     *
     * @param candidateIds candidate identifiers in any order
     * @param forceRefresh rebuild even if a Ready entry exists
     * @return the Ready entry; never a partially built one
     * @throws InputException if the candidate list is empty
     * @throws PipelineException if the entry cannot be built or stored
     */
    public CacheEntry resolve(Collection<String> candidateIds, boolean forceRefresh) {
        if (candidateIds.isEmpty()) {
            throw new InputException("Cannot resolve a reference cache entry for an empty candidate list");
        }
        List<String> sorted = CacheKeys.sorted(candidateIds);
        String key = CacheKeys.stableHash(sorted);
        try {
            return withKeyLock(key, () -> {
                Path entryDir = cacheRoot.resolve(key);
                if (!forceRefresh) {
                    CacheEntry existing = readReady(key, entryDir);
                    if (existing != null) {
                        log.info("Reference cache hit for {} candidates (key {})", sorted.size(), shortKey(key));
                        return existing;
                    }
                }
                log.info("Building reference cache entry for {} candidates (key {}{})",
                        sorted.size(), shortKey(key), forceRefresh ? ", forced" : "");
                return build(key, sorted, entryDir);
            });
        } catch (IOException e) {
            throw new PipelineException("Failed to resolve cache entry " + key + ": " + e.getMessage(), e);
        }
    }

    /**
     * Looks up the Ready entry of a candidate list without building it.
     *
     * @param candidateIds candidate identifiers in any order
     * @return the entry, or empty if none is Ready
     */
    public Optional<CacheEntry> find(Collection<String> candidateIds) {
        String key = CacheKeys.stableHash(candidateIds);
        try {
            return Optional.ofNullable(readReady(key, cacheRoot.resolve(key)));
        } catch (IOException e) {
            throw new PipelineException("Failed to read cache entry " + key + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns the entry with its alignment index built. The index is written to a
     * temporary file and renamed into place, so concurrent callers never see a partial index.
     *
     * @param entry a Ready entry
     * @return the same entry
     */
    public CacheEntry ensureIndex(CacheEntry entry) {
        if (entry.hasIndex()) {
            return entry;
        }
        try {
            return withKeyLock(entry.cacheKey(), () -> {
                if (entry.hasIndex()) {
                    return entry;
                }
                Path temp = entry.directory().resolve(INDEX_NAME + "." + UUID.randomUUID() + ".tmp");
                try {
                    log.info("Building alignment index for cache entry {}", shortKey(entry.cacheKey()));
                    aligner.index(entry.fastaPath(), temp);
                    moveAtomically(temp, entry.indexPath());
                } finally {
                    Files.deleteIfExists(temp);
                }
                return entry;
            });
        } catch (IOException e) {
            throw new PipelineException("Failed to build index for cache entry " + entry.cacheKey()
                    + ": " + e.getMessage(), e);
        }
    }

    /**
     * Lists the Ready entries currently in the cache.
     */
    public List<CacheEntry> listEntries() throws IOException {
        List<CacheEntry> entries = new ArrayList<>();
        if (!Files.isDirectory(cacheRoot)) {
            return entries;
        }
        try (Stream<Path> dirs = Files.list(cacheRoot)) {
            for (Path dir : (Iterable<Path>) dirs.sorted()::iterator) {
                String name = dir.getFileName().toString();
                if (Files.isDirectory(dir) && CacheKeys.isCacheKey(name)) {
                    CacheEntry entry = readReady(name, dir);
                    if (entry != null) {
                        entries.add(entry);
                    }
                }
            }
        }
        return entries;
    }

    /**
     * Runs an action while holding the in-process and file lock of a key.
     */
    public <T> T withKeyLock(String key, LockedAction<T> action) throws IOException {
        ReentrantLock lock = keyLocks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            Files.createDirectories(cacheRoot);
            Path lockFile = cacheRoot.resolve(key + ".lock");
            try (FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.run();
            }
        } finally {
            lock.unlock();
        }
    }

    private CacheEntry build(String key, List<String> sorted, Path entryDir) throws IOException {
        Path temp = cacheRoot.resolve("." + key + "." + UUID.randomUUID() + ".tmp");
        Files.createDirectories(temp);
        try {
            DownloadedReference downloaded = downloader.fetch(sorted, temp);
            placeInside(downloaded.fasta(), temp.resolve(FASTA_NAME));
            placeInside(downloaded.taxonomyMap(), temp.resolve(TAXONOMY_NAME));
            new CacheManifest(key, CacheStatus.READY, FASTA_NAME, TAXONOMY_NAME,
                    Instant.now().toString(), sorted).write(temp);

            if (Files.exists(entryDir)) {
                Path aside = cacheRoot.resolve("." + key + "." + UUID.randomUUID() + ".old");
                moveAtomically(entryDir, aside);
                moveAtomically(temp, entryDir);
                CacheFiles.deleteRecursively(aside);
            } else {
                moveAtomically(temp, entryDir);
            }
        } catch (IOException | RuntimeException e) {
            try {
                CacheFiles.deleteRecursively(temp);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temporary cache directory {}: {}", temp, cleanupEx.getMessage());
            }
            throw e;
        }
        return entryOf(key, entryDir);
    }

    private static void placeInside(Path produced, Path target) throws IOException {
        if (produced == null || !Files.isRegularFile(produced)) {
            throw new PipelineException("Reference downloader did not produce " + target.getFileName());
        }
        if (!produced.toAbsolutePath().normalize().equals(target.toAbsolutePath().normalize())) {
            Files.move(produced, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private CacheEntry readReady(String key, Path entryDir) throws IOException {
        if (!Files.isDirectory(entryDir)) {
            return null;
        }
        CacheManifest manifest = CacheManifest.read(entryDir);
        if (manifest == null || manifest.status != CacheStatus.READY || !key.equals(manifest.cacheKey)) {
            log.warn("Ignoring cache directory without a Ready manifest: {}", entryDir);
            return null;
        }
        return entryOf(key, entryDir);
    }

    private static CacheEntry entryOf(String key, Path entryDir) {
        return new CacheEntry(key, entryDir, entryDir.resolve(FASTA_NAME), entryDir.resolve(TAXONOMY_NAME),
                entryDir.resolve(INDEX_NAME), CacheStatus.READY);
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            throw new IOException("File system does not support atomic rename of " + source, e);
        }
    }

    private static String shortKey(String key) {
        return key.substring(0, 12);
    }
}
