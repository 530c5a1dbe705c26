package org.metalineage.pipeline.stages;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;

import org.metalineage.pipeline.api.errors.PipelineException;
import org.metalineage.pipeline.api.model.ClassificationResult;
import org.metalineage.pipeline.api.model.ProfileEntry;
import org.metalineage.pipeline.api.stages.IPipelineStage;
import org.metalineage.pipeline.output.CamiProfileWriter;
import org.metalineage.pipeline.profile.ClassifiedSequencesReader;
import org.metalineage.pipeline.profile.ProfileAggregator;

/**
 * Aggregates the classification into a CAMI profile. Uses the results of this run's
 * classify stage when it ran, otherwise reads {@code classified_sequences.tsv} back.
 */
public class ProfileStage implements IPipelineStage {

    @Override
    public String getName() {
        return "profile";
    }

    @Override
    public boolean isComplete(PipelineContext context) {
        return Files.isRegularFile(context.profile());
    }

    @Override
    public void execute(PipelineContext context) {
        List<ClassificationResult> results = context.getClassificationResults()
                .orElseGet(() -> ClassifiedSequencesReader.read(context.classification(), context.getHierarchy()));
        boolean renormalize = context.getSettings().getBoolean("profile.renormalize");
        List<ProfileEntry> entries = new ProfileAggregator(renormalize).aggregate(results);
        try {
            CamiProfileWriter.write(context.profile(), context.getSampleId(), entries);
        } catch (IOException e) {
            throw new PipelineException("Cannot write profile: " + e.getMessage(), e);
        }
    }
}
