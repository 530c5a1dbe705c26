package org.metalineage.pipeline.output;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes text files all-or-nothing.
 * <p>
 * Content goes to a sibling {@code <name>.<uuid>.tmp} file that is moved over the target
 * with an atomic rename once complete. If writing fails the temp file is removed and the
 * target is left untouched. {@link #writeAll(Map)} extends this to a set of files: no
 * target is replaced until every temp file has been written.
 */
public final class AtomicFileWriter {

    private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

    /**
     * Produces the file content.
     */
    @FunctionalInterface
    public interface ContentWriter {
        void write(BufferedWriter out) throws IOException;
    }

    private AtomicFileWriter() {
    }

    public static void write(Path target, ContentWriter content) throws IOException {
        writeAll(Map.of(target, content));
    }

    /**
     * Writes several files as one unit.
     *
     * @param contents content per target, moved into place in iteration order
     * @throws IOException if any file fails to write; targets are then left untouched
     */
    public static void writeAll(Map<Path, ContentWriter> contents) throws IOException {
        Map<Path, Path> staged = new LinkedHashMap<>();
        try {
            for (Map.Entry<Path, ContentWriter> entry : contents.entrySet()) {
                Path absolute = entry.getKey().toAbsolutePath();
                Path parent = absolute.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Path temp = absolute.resolveSibling(absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
                staged.put(absolute, temp);
                try (BufferedWriter out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                    entry.getValue().write(out);
                }
            }
            for (Map.Entry<Path, Path> entry : staged.entrySet()) {
                Files.move(entry.getValue(), entry.getKey(),
                        StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            for (Path temp : staged.values()) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanupEx) {
                    log.warn("Failed to clean up temp file after write failure: {}", temp, cleanupEx);
                }
            }
            throw e;
        }
    }
}
