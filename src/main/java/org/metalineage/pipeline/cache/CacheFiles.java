package org.metalineage.pipeline.cache;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * File tree helpers shared by the cache manager and the pruner.
 */
public final class CacheFiles {

    private CacheFiles() {
        // Utility class - no instantiation
    }

    /**
     * Recursively deletes a directory or file. Missing paths are ignored.
     *
     * @throws IOException if any element cannot be deleted
     */
    public static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * @return total size in bytes of all regular files below {@code path}
     */
    public static long sizeOf(Path path) throws IOException {
        try (Stream<Path> walk = Files.walk(path)) {
            return walk.filter(Files::isRegularFile).mapToLong(p -> {
                try {
                    return Files.size(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }).sum();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * @return the newest modification time of any file below {@code path}, the path itself included
     */
    public static FileTime newestModification(Path path) throws IOException {
        try (Stream<Path> walk = Files.walk(path)) {
            return walk.map(p -> {
                try {
                    return Files.getLastModifiedTime(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }).max(Comparator.naturalOrder()).orElse(Files.getLastModifiedTime(path));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
