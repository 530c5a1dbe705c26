package org.metalineage.pipeline.stages;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;

import org.metalineage.pipeline.api.errors.ConfigurationException;
import org.metalineage.pipeline.api.errors.PipelineException;
import org.metalineage.pipeline.api.model.ScreenHit;
import org.metalineage.pipeline.api.stages.IPipelineStage;
import org.metalineage.pipeline.output.ScreenTableWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Screens the query files against every configured sketch database and stores one
 * screen table per database.
 */
public class ScreenStage implements IPipelineStage {

    private static final Logger log = LoggerFactory.getLogger(ScreenStage.class);

    @Override
    public String getName() {
        return "screen";
    }

    @Override
    public boolean isComplete(PipelineContext context) {
        return context.getDatabases().stream().allMatch(db -> Files.isRegularFile(context.screenTable(db)));
    }

    @Override
    public void execute(PipelineContext context) {
        if (context.getDatabases().isEmpty()) {
            throw new ConfigurationException("No reference databases configured (metalineage.databases)");
        }
        for (ReferenceDatabase db : context.getDatabases()) {
            if (Files.isRegularFile(context.screenTable(db))) {
                log.debug("Screen table for '{}' already present", db.name());
                continue;
            }
            List<ScreenHit> hits = context.getScreener().screen(context.getQueryFiles(), db.sketch());
            log.info("Screened {} query files against '{}': {} reference genomes",
                    context.getQueryFiles().size(), db.name(), hits.size());
            try {
                ScreenTableWriter.write(context.screenTable(db), hits);
            } catch (IOException e) {
                throw new PipelineException("Cannot write screen table for " + db.name() + ": " + e.getMessage(), e);
            }
        }
    }
}
