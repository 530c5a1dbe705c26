package org.metalineage.pipeline.tools;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.metalineage.pipeline.api.errors.ExternalToolException;
import org.metalineage.pipeline.api.errors.PipelineException;
import org.metalineage.pipeline.api.tools.IReferenceDownloader;

import com.typesafe.config.Config;

/**
 * {@link IReferenceDownloader} that delegates to a configured download command.
 * <p>
 * The command is invoked as
 * {@code <command...> <candidates.txt> <targetDir> <targetDir>/detailed_taxonomy.tsv <download-cache>}
 * and must leave {@code combined_genomes.fasta} and {@code detailed_taxonomy.tsv} in the
 * target directory.
 * <p>
 * Configuration ({@code metalineage.tools.downloader}): {@code command} (list),
 * {@code download-cache}.
 */
public class CommandReferenceDownloader implements IReferenceDownloader {

    static final String CANDIDATES_FILE = "candidates.txt";
    static final String FASTA_FILE = "combined_genomes.fasta";
    static final String TAXONOMY_FILE = "detailed_taxonomy.tsv";

    private final ExternalCommand runner;
    private final List<String> command;
    private final Path downloadCache;

    public CommandReferenceDownloader(Config downloader, ExternalCommand runner) {
        this.runner = runner;
        this.command = downloader.getStringList("command");
        this.downloadCache = Path.of(downloader.getString("download-cache"));
    }

    @Override
    public DownloadedReference fetch(List<String> candidateIds, Path targetDir) {
        Path candidates = targetDir.resolve(CANDIDATES_FILE);
        Path taxonomy = targetDir.resolve(TAXONOMY_FILE);
        try {
            Files.write(candidates, candidateIds, StandardCharsets.UTF_8);
            Files.createDirectories(downloadCache);
        } catch (IOException e) {
            throw new PipelineException("Cannot prepare download directory " + targetDir + ": " + e.getMessage(), e);
        }

        List<String> full = new ArrayList<>(command);
        full.add(candidates.toString());
        full.add(targetDir.toString());
        full.add(taxonomy.toString());
        full.add(downloadCache.toString());
        runner.run(full, null, targetDir);

        Path fasta = targetDir.resolve(FASTA_FILE);
        if (!Files.isRegularFile(fasta) || !Files.isRegularFile(taxonomy)) {
            throw new ExternalToolException("Downloader finished without producing " + FASTA_FILE
                    + " and " + TAXONOMY_FILE, full, 0);
        }
        return new DownloadedReference(fasta, taxonomy);
    }
}
