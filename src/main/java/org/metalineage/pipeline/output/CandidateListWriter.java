package org.metalineage.pipeline.output;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes candidate lists, one identifier per line.
 */
public final class CandidateListWriter {

    private CandidateListWriter() {
    }

    public static void write(Path target, List<String> candidateIds) throws IOException {
        AtomicFileWriter.write(target, out -> {
            for (String id : candidateIds) {
                out.write(id);
                out.newLine();
            }
        });
    }

    /**
     * @return non-blank trimmed lines of the file
     */
    public static List<String> read(Path file) throws IOException {
        List<String> ids = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String id = line.trim();
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }
}
