package org.metalineage.pipeline.tools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.metalineage.pipeline.api.errors.ExternalToolException;
import org.metalineage.pipeline.api.errors.PipelineException;
import org.metalineage.pipeline.api.model.ScreenHit;
import org.metalineage.pipeline.api.tools.ISketchScreener;
import org.metalineage.pipeline.selection.ScreenTableReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * {@link ISketchScreener} backed by {@code mash screen}.
 * <p>
 * Configuration ({@code metalineage.tools.mash}): {@code executable}, {@code threads},
 * {@code max-p-value}.
 */
public class MashScreener implements ISketchScreener {

    private static final Logger log = LoggerFactory.getLogger(MashScreener.class);

    private final ExternalCommand runner;
    private final String executable;
    private final int threads;
    private final double maxPValue;

    public MashScreener(Config mash, ExternalCommand runner) {
        this.runner = runner;
        this.executable = mash.getString("executable");
        this.threads = mash.getInt("threads");
        this.maxPValue = mash.getDouble("max-p-value");
    }

    @Override
    public List<ScreenHit> screen(List<Path> inputFiles, Path sketchDb) {
        List<String> command = new ArrayList<>(List.of(executable, "screen",
                "-p", Integer.toString(threads), "-v", Double.toString(maxPValue), sketchDb.toString()));
        inputFiles.forEach(f -> command.add(f.toString()));

        Path table;
        try {
            table = Files.createTempFile("mash-screen-", ".tab");
        } catch (IOException e) {
            throw new PipelineException("Cannot create temporary screen table: " + e.getMessage(), e);
        }
        try {
            runner.run(command, table, null);
            ScreenTableReader.ScreenTable parsed = ScreenTableReader.read(table);
            if (parsed.malformed() > 0) {
                log.warn("Skipped {} malformed screen lines for {}", parsed.malformed(), sketchDb.getFileName());
            }
            return parsed.hits();
        } catch (IOException e) {
            throw new ExternalToolException("Cannot read mash output: " + e.getMessage(), command, e);
        } finally {
            try {
                Files.deleteIfExists(table);
            } catch (IOException e) {
                log.warn("Failed to delete temporary screen table {}", table, e);
            }
        }
    }
}
