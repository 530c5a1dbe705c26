package org.metalineage.pipeline.cache;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A materialized reference set in the cache.
 *
 * @param cacheKey        hash of the sorted candidate list
 * @param directory       entry directory {@code cacheRoot/cacheKey}
 * @param fastaPath       combined reference FASTA
 * @param taxonomyMapPath accession to taxid map
 * @param indexPath       alignment index location; the file exists once built
 * @param status          entry status
 */
public record CacheEntry(
        String cacheKey,
        Path directory,
        Path fastaPath,
        Path taxonomyMapPath,
        Path indexPath,
        CacheStatus status) {

    public boolean hasIndex() {
        return Files.isRegularFile(indexPath);
    }
}
