package org.metalineage.pipeline.taxonomy;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.metalineage.pipeline.api.errors.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/**
 * Loads a {@link TaxonomyHierarchy} from disk.
 * <p>
 * Two layouts are accepted:
 * <ul>
 *   <li>a hierarchy TSV with a header naming at least {@code TaxID}, {@code Name},
 *       {@code Rank} and {@code ParentTaxID} (a trailing {@code Lineage} column is ignored);</li>
 *   <li>an NCBI taxdump directory containing {@code nodes.dmp} and {@code names.dmp}.</li>
 * </ul>
 * Rows whose taxid is not numeric are skipped and counted.
 */
public final class HierarchyLoader {

    private static final Logger log = LoggerFactory.getLogger(HierarchyLoader.class);

    private static final String DMP_SEPARATOR = "\t|\t";

    private HierarchyLoader() {
    }

    /**
     * @param path hierarchy TSV or taxdump directory
     * @return the validated hierarchy
     * @throws ConfigurationException if the path does not exist or cannot be read
     */
    public static TaxonomyHierarchy load(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigurationException("Taxonomy hierarchy not found: " + path.toAbsolutePath());
        }
        try {
            List<HierarchyNode> nodes = Files.isDirectory(path) ? readTaxdump(path) : readTsv(path);
            TaxonomyHierarchy hierarchy = TaxonomyHierarchy.of(nodes);
            log.info("Loaded {} taxonomy nodes from {}", hierarchy.size(), path);
            return hierarchy;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read taxonomy hierarchy " + path + ": " + e.getMessage(), e);
        }
    }

    static List<HierarchyNode> readTsv(Path file) throws IOException {
        List<HierarchyNode> nodes = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            if (header == null) {
                throw new ConfigurationException("Taxonomy hierarchy is empty: " + file);
            }
            String[] columns = header.split("\t", -1);
            int taxidCol = indexOf(columns, "taxid", file);
            int nameCol = indexOf(columns, "name", file);
            int rankCol = indexOf(columns, "rank", file);
            int parentCol = indexOf(columns, "parenttaxid", file);
            int required = Math.max(Math.max(taxidCol, nameCol), Math.max(rankCol, parentCol)) + 1;

            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                String[] parts = line.split("\t", -1);
                if (parts.length < required) {
                    skipped++;
                    continue;
                }
                try {
                    int taxid = Integer.parseInt(parts[taxidCol].trim());
                    int parent = Integer.parseInt(parts[parentCol].trim());
                    nodes.add(new HierarchyNode(taxid, Rank.parse(parts[rankCol]), parent, parts[nameCol].trim()));
                } catch (NumberFormatException e) {
                    skipped++;
                }
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} malformed rows in {}", skipped, file);
        }
        return nodes;
    }

    static List<HierarchyNode> readTaxdump(Path directory) throws IOException {
        Path namesFile = directory.resolve("names.dmp");
        Path nodesFile = directory.resolve("nodes.dmp");
        if (!Files.isRegularFile(namesFile) || !Files.isRegularFile(nodesFile)) {
            throw new ConfigurationException("Taxdump directory must contain names.dmp and nodes.dmp: " + directory);
        }

        Int2ObjectOpenHashMap<String> names = new Int2ObjectOpenHashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(namesFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String[] parts = splitDmp(line);
                if (parts.length < 4 || !"scientific name".equals(parts[3])) {
                    continue;
                }
                try {
                    names.put(Integer.parseInt(parts[0]), parts[1]);
                } catch (NumberFormatException e) {
                    log.debug("Ignoring names.dmp row with non-numeric taxid: {}", parts[0]);
                }
            }
        }

        List<HierarchyNode> nodes = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(nodesFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String[] parts = splitDmp(line);
                if (parts.length < 3) {
                    skipped++;
                    continue;
                }
                try {
                    int taxid = Integer.parseInt(parts[0]);
                    int parent = Integer.parseInt(parts[1]);
                    String name = names.getOrDefault(taxid, "Unknown");
                    Rank rank = Rank.parse(parts[2]);
                    if (rank == Rank.NO_RANK && "no rank".equals(parts[2])
                            && name.toLowerCase(Locale.ROOT).contains("strain")) {
                        rank = Rank.STRAIN;
                    }
                    nodes.add(new HierarchyNode(taxid, rank, parent, name));
                } catch (NumberFormatException e) {
                    skipped++;
                }
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} malformed rows in {}", skipped, nodesFile);
        }
        return nodes;
    }

    private static String[] splitDmp(String line) {
        String trimmed = line.endsWith("\t|") ? line.substring(0, line.length() - 2) : line;
        String[] parts = trimmed.split(Pattern.quote(DMP_SEPARATOR), -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
        }
        return parts;
    }

    private static int indexOf(String[] columns, String wanted, Path file) {
        for (int i = 0; i < columns.length; i++) {
            if (columns[i].trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                return i;
            }
        }
        throw new ConfigurationException("Taxonomy hierarchy " + file + " has no '" + wanted + "' column");
    }
}
