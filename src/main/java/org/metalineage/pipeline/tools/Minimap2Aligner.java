package org.metalineage.pipeline.tools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.metalineage.pipeline.api.errors.PipelineException;
import org.metalineage.pipeline.api.tools.IAligner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * {@link IAligner} backed by {@code minimap2}.
 * <p>
 * Configuration ({@code metalineage.tools.minimap2}): {@code executable}, {@code preset},
 * {@code index-batch}, {@code threads}.
 */
public class Minimap2Aligner implements IAligner {

    private static final Logger log = LoggerFactory.getLogger(Minimap2Aligner.class);

    private final ExternalCommand runner;
    private final String executable;
    private final String preset;
    private final String indexBatch;
    private final int threads;

    public Minimap2Aligner(Config minimap2, ExternalCommand runner) {
        this.runner = runner;
        this.executable = minimap2.getString("executable");
        this.preset = minimap2.getString("preset");
        this.indexBatch = minimap2.getString("index-batch");
        this.threads = minimap2.getInt("threads");
    }

    @Override
    public void index(Path referenceFasta, Path indexPath) {
        runner.run(List.of(executable, "-I" + indexBatch, "-d", indexPath.toString(), referenceFasta.toString()),
                null, null);
    }

    /**
     * Aligns into a temp file next to {@code pafOut} and renames it into place, so a failed
     * run never leaves a truncated PAF.
     */
    @Override
    public void align(List<Path> queryFiles, Path index, Path pafOut) {
        List<String> command = new ArrayList<>(List.of(executable, "-x", preset,
                "-t", Integer.toString(threads), index.toString()));
        queryFiles.forEach(f -> command.add(f.toString()));

        Path absolute = pafOut.toAbsolutePath();
        Path temp = absolute.resolveSibling(absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(absolute.getParent());
            runner.run(command, temp, null);
            Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new PipelineException("Cannot store alignments at " + pafOut + ": " + e.getMessage(), e);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.warn("Failed to delete temporary alignment file {}", temp, e);
            }
        }
    }
}
