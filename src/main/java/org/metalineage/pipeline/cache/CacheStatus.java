package org.metalineage.pipeline.cache;

/**
 * Lifecycle of a cache entry. Only {@link #READY} entries are ever handed out.
 */
public enum CacheStatus {
    BUILDING,
    READY
}
