package org.metalineage.pipeline.profile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.metalineage.pipeline.api.errors.InputException;
import org.metalineage.pipeline.api.model.ClassificationResult;
import org.metalineage.pipeline.consensus.ConsensusSettings;
import org.metalineage.pipeline.consensus.LineageConsensusEngine;
import org.metalineage.pipeline.output.ClassificationWriter;
import org.metalineage.pipeline.taxonomy.TaxonomyHierarchy;
import org.metalineage.pipeline.taxonomy.TestTaxonomy;

@Tag("unit")
class ClassifiedSequencesReaderTest {

    @TempDir
    Path tempDir;

    private final TaxonomyHierarchy hierarchy = TestTaxonomy.ncbiLike();

    @Test
    void readsBackWrittenClassifications() throws IOException {
        LineageConsensusEngine engine = new LineageConsensusEngine(hierarchy, ConsensusSettings.DEFAULTS);
        List<ClassificationResult> written = List.of(
                engine.assign("q1", 562, 0.9),
                engine.assign("q2", 543, 0.25),
                ClassificationResult.unclassified("q3"));
        Path file = tempDir.resolve("classified_sequences.tsv");
        ClassificationWriter.write(file, written);

        List<ClassificationResult> read = ClassifiedSequencesReader.read(file, hierarchy);

        assertThat(read).extracting(ClassificationResult::assignedTaxid).containsExactly(562, 543, 0);
        assertThat(read).extracting(ClassificationResult::confidence).containsExactly(0.9, 0.25, 0.0);
    }

    @Test
    void unknownDeepestTokenFallsBackToShallowerOne() {
        ClassificationResult result = ClassifiedSequencesReader.toResult("q",
                "superkingdom:Bacteria;phylum:Proteobacteria;genus:Escherichia;species:Escherichia novel", "0.5",
                hierarchy);

        assertThat(result.assignedTaxid()).isEqualTo(561);
        assertThat(result.taxonomicLevel()).isEqualTo("genus");
    }

    @Test
    @DisplayName("Homonym genera resolve to the taxon whose whole lineage matches")
    void homonymsResolveThroughTheFullLineage() throws IOException {
        TaxonomyHierarchy homonyms = TestTaxonomy.withHomonyms();
        LineageConsensusEngine engine = new LineageConsensusEngine(homonyms, ConsensusSettings.DEFAULTS);
        List<ClassificationResult> written = List.of(
                engine.assign("bacterial", 1386, 0.9),
                engine.assign("insect", 1300, 0.8));
        Path file = tempDir.resolve("classified_sequences.tsv");
        ClassificationWriter.write(file, written);

        List<ClassificationResult> read = ClassifiedSequencesReader.read(file, homonyms);

        assertThat(read).extracting(ClassificationResult::assignedTaxid).containsExactly(1386, 1300);
        assertThat(read.get(0).lineageString()).isEqualTo(written.get(0).lineageString())
                .startsWith("superkingdom:Bacteria;");
        assertThat(new ProfileAggregator(false).aggregate(read))
                .isEqualTo(new ProfileAggregator(false).aggregate(written));
    }

    @Test
    void homonymWithUnknownSpeciesFallsBackWithinItsOwnBranch() {
        ClassificationResult result = ClassifiedSequencesReader.toResult("q",
                "superkingdom:Bacteria;phylum:Firmicutes;genus:Bacillus;species:Bacillus novus", "0.5",
                TestTaxonomy.withHomonyms());

        assertThat(result.assignedTaxid()).isEqualTo(1386);
        assertThat(result.taxonomicLevel()).isEqualTo("genus");
    }

    @Test
    void unmatchedLineageIsUnclassified() {
        assertThat(ClassifiedSequencesReader.toResult("q", "species:Nothing known", "0.5", hierarchy).isResolved())
                .isFalse();
    }

    @Test
    void missingHeaderIsRejected() throws IOException {
        Path file = tempDir.resolve("bad.tsv");
        Files.writeString(file, "q1\tspecies:Escherichia coli\tspecies\t0.9\n");

        assertThatThrownBy(() -> ClassifiedSequencesReader.read(file, hierarchy))
                .isInstanceOf(InputException.class);
    }
}
