package org.metalineage.pipeline.output;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.metalineage.pipeline.api.model.ClassificationResult;
import org.metalineage.pipeline.api.model.ProfileEntry;
import org.metalineage.pipeline.api.model.ScreenHit;
import org.metalineage.pipeline.consensus.ConsensusSettings;
import org.metalineage.pipeline.consensus.LineageConsensusEngine;
import org.metalineage.pipeline.selection.ScreenTableReader;
import org.metalineage.pipeline.taxonomy.Rank;
import org.metalineage.pipeline.taxonomy.TestTaxonomy;

@Tag("unit")
class OutputWritersTest {

    @TempDir
    Path tempDir;

    @Test
    void classificationTableHasHeaderAndFourDecimalConfidence() throws IOException {
        LineageConsensusEngine engine = new LineageConsensusEngine(TestTaxonomy.minimal(), ConsensusSettings.DEFAULTS);
        Path file = tempDir.resolve("classified_sequences.tsv");

        ClassificationWriter.write(file, List.of(
                engine.assign("contig_1", 4, 0.95),
                ClassificationResult.unclassified("contig_2")));

        assertThat(Files.readAllLines(file)).containsExactly(
                "Query\tLineage\tTaxonomic Level\tConfidence",
                "contig_1\tsuperkingdom:Bacteria;phylum:Proteobacteria;genus:Escherichia;species:Escherichia coli"
                        + "\tspecies\t0.9500",
                "contig_2\tunclassified\tunclassified\t0.0000");
    }

    @Test
    void camiProfileHasHeaderBlockAndRows() throws IOException {
        Path file = tempDir.resolve("sample.cami.tsv");

        CamiProfileWriter.write(file, "sample_0", List.of(
                new ProfileEntry(2, Rank.SUPERKINGDOM, "2", "Bacteria", 100.0),
                new ProfileEntry(562, Rank.SPECIES, "2|1224|1236|91347|543|561|562",
                        "Bacteria|Proteobacteria|Gammaproteobacteria|Enterobacterales|Enterobacteriaceae|Escherichia|Escherichia coli",
                        100.0 / 3)));

        assertThat(Files.readAllLines(file)).containsExactly(
                "#CAMI Submission for Taxonomic Profiling",
                "@Version:0.9.1",
                "@Ranks:superkingdom|phylum|class|order|family|genus|species",
                "@SampleID:sample_0",
                "",
                "@@TAXID\tRANK\tTAXPATH\tTAXPATHSN\tPERCENTAGE",
                "2\tsuperkingdom\t2\tBacteria\t100.000000",
                "562\tspecies\t2|1224|1236|91347|543|561|562\tBacteria|Proteobacteria|Gammaproteobacteria"
                        + "|Enterobacterales|Enterobacteriaceae|Escherichia|Escherichia coli\t33.333333");
    }

    @Test
    void candidateListIsOneIdPerLine() throws IOException {
        Path file = tempDir.resolve("selected_genomes.txt");

        CandidateListWriter.write(file, List.of("GCF_1.1", "GCF_2.1"));
        Files.writeString(file, Files.readString(file) + "\n  \n");

        assertThat(CandidateListWriter.read(file)).containsExactly("GCF_1.1", "GCF_2.1");
    }

    @Test
    void screenTableIsReadableAgain() throws IOException {
        Path file = tempDir.resolve("refseq.tab");
        ScreenHit hit = new ScreenHit("GCF_1.1_A_genomic.fna.gz", 0.93,
                new ScreenHit.RawMetrics("930/1000", 4.0, 0.0, "Escherichia coli"));

        ScreenTableWriter.write(file, List.of(hit));

        assertThat(ScreenTableReader.read(file).hits()).containsExactly(hit);
    }
}
