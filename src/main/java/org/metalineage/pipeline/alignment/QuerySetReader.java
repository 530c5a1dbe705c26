package org.metalineage.pipeline.alignment;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

import org.metalineage.pipeline.api.errors.InputException;

/**
 * Collects query identifiers from FASTA headers.
 * <p>
 * The identifier is the first whitespace-delimited token after {@code >}. Identifiers keep
 * the order of their first appearance; duplicates collapse.
 */
public final class QuerySetReader {

    private static final List<String> FASTA_SUFFIXES = List.of(".fna", ".fa", ".fasta", ".fas", ".fsa");

    private QuerySetReader() {
    }

    /**
     * Reads query ids from files or directories of FASTA files.
     *
     * @param sources FASTA files (optionally {@code .gz}) or directories containing them
     * @return query ids in first-appearance order
     * @throws InputException if a source is missing or unreadable
     */
    public static List<String> read(Collection<Path> sources) {
        Set<String> ids = new LinkedHashSet<>();
        for (Path file : expand(sources)) {
            try (BufferedReader reader = PafReader.open(file)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.startsWith(">")) {
                        String id = headerId(line);
                        if (!id.isEmpty()) {
                            ids.add(id);
                        }
                    }
                }
            } catch (IOException e) {
                throw new InputException("Cannot read query file " + file + ": " + e.getMessage(), e);
            }
        }
        return new ArrayList<>(ids);
    }

    /**
     * Expands directories into their FASTA files, sorted by name.
     */
    public static List<Path> expand(Collection<Path> sources) {
        List<Path> files = new ArrayList<>();
        for (Path source : sources) {
            if (Files.isDirectory(source)) {
                try (Stream<Path> list = Files.list(source)) {
                    list.filter(Files::isRegularFile).filter(QuerySetReader::isFasta).sorted().forEach(files::add);
                } catch (IOException e) {
                    throw new InputException("Cannot list query directory " + source + ": " + e.getMessage(), e);
                }
            } else if (Files.isRegularFile(source)) {
                files.add(source);
            } else {
                throw new InputException("Query input not found: " + source);
            }
        }
        return files;
    }

    static boolean isFasta(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".gz")) {
            name = name.substring(0, name.length() - 3);
        }
        for (String suffix : FASTA_SUFFIXES) {
            if (name.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    static String headerId(String header) {
        String rest = header.substring(1).strip();
        int end = 0;
        while (end < rest.length() && !Character.isWhitespace(rest.charAt(end))) {
            end++;
        }
        return rest.substring(0, end);
    }
}
