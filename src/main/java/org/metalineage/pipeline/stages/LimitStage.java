package org.metalineage.pipeline.stages;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.metalineage.pipeline.api.errors.InputException;
import org.metalineage.pipeline.api.errors.PipelineException;
import org.metalineage.pipeline.api.stages.IPipelineStage;
import org.metalineage.pipeline.limiting.AssemblySummaryReader;
import org.metalineage.pipeline.limiting.CandidateLimiter;
import org.metalineage.pipeline.limiting.LimitResult;
import org.metalineage.pipeline.output.CandidateListWriter;

import com.typesafe.config.Config;

/**
 * Deduplicates and caps the selected candidates.
 */
public class LimitStage implements IPipelineStage {

    @Override
    public String getName() {
        return "limit";
    }

    @Override
    public boolean isComplete(PipelineContext context) {
        return Files.isRegularFile(context.limitedCandidates());
    }

    @Override
    public void execute(PipelineContext context) {
        Config limiter = context.getSettings().getConfig("limiter");
        List<String> selected;
        try {
            selected = CandidateListWriter.read(context.selectedCandidates());
        } catch (IOException e) {
            throw new InputException("Cannot read candidate list " + context.selectedCandidates()
                    + ": " + e.getMessage(), e);
        }

        List<Path> scoreTables = new ArrayList<>();
        List<Path> summaries = new ArrayList<>();
        for (ReferenceDatabase db : context.getDatabases()) {
            scoreTables.add(context.screenTable(db));
            summaries.addAll(db.assemblySummaries());
        }

        CandidateLimiter candidateLimiter = new CandidateLimiter(AssemblySummaryReader.readAll(summaries));
        LimitResult result = candidateLimiter.limit(selected, scoreTables,
                limiter.getInt("max-candidates"), limiter.getBoolean("dedupe"));
        try {
            CandidateListWriter.write(context.limitedCandidates(), result.candidateIds());
        } catch (IOException e) {
            throw new PipelineException("Cannot write limited candidate list: " + e.getMessage(), e);
        }
    }
}
