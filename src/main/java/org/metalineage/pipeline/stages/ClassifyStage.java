package org.metalineage.pipeline.stages;

import java.io.IOException;
import java.nio.file.Files;

import org.metalineage.pipeline.alignment.PafReader;
import org.metalineage.pipeline.alignment.QuerySetReader;
import org.metalineage.pipeline.api.errors.PipelineException;
import org.metalineage.pipeline.api.stages.IPipelineStage;
import org.metalineage.pipeline.consensus.ClassificationReport;
import org.metalineage.pipeline.consensus.ConsensusClassifier;
import org.metalineage.pipeline.consensus.ConsensusSettings;
import org.metalineage.pipeline.output.ClassificationWriter;
import org.metalineage.pipeline.taxonomy.AccessionTaxonomyMap;

/**
 * Resolves one lineage per query from the alignments and writes {@code classified_sequences.tsv}.
 */
public class ClassifyStage implements IPipelineStage {

    @Override
    public String getName() {
        return "classify";
    }

    @Override
    public boolean isComplete(PipelineContext context) {
        return Files.isRegularFile(context.classification());
    }

    @Override
    public void execute(PipelineContext context) {
        AccessionTaxonomyMap taxonomyMap = AccessionTaxonomyMap.loadOrEmpty(
                context.requireCacheEntry().taxonomyMapPath(), context::addWarning);
        ConsensusSettings settings = ConsensusSettings.fromConfig(context.getSettings().getConfig("consensus"));
        ConsensusClassifier classifier = new ConsensusClassifier(context.getHierarchy(), taxonomyMap, settings);

        ClassificationReport report = classifier.classify(new PafReader(context.alignments()),
                QuerySetReader.read(context.getQueryFiles()));
        report.warnings().forEach(context::addWarning);
        try {
            ClassificationWriter.write(context.classification(), report.results());
        } catch (IOException e) {
            throw new PipelineException("Cannot write classification: " + e.getMessage(), e);
        }
        context.setClassificationResults(report.results());
    }
}
