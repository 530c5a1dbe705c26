package org.metalineage.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.metalineage.cli.CommandLineInterface;
import org.metalineage.pipeline.alignment.PafReader;
import org.metalineage.pipeline.alignment.QuerySetReader;
import org.metalineage.pipeline.api.errors.DegradedModeWarning;
import org.metalineage.pipeline.consensus.ClassificationReport;
import org.metalineage.pipeline.consensus.ConsensusClassifier;
import org.metalineage.pipeline.consensus.ConsensusSettings;
import org.metalineage.pipeline.output.AtomicFileWriter;
import org.metalineage.pipeline.output.CamiProfileWriter;
import org.metalineage.pipeline.output.ClassificationWriter;
import org.metalineage.pipeline.profile.ProfileAggregator;
import org.metalineage.pipeline.taxonomy.AccessionTaxonomyMap;
import org.metalineage.pipeline.taxonomy.HierarchyLoader;
import org.metalineage.pipeline.taxonomy.TaxonomyHierarchy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Classifies the queries of an existing PAF file.
 */
@Command(
    name = "classify",
    description = "Assign one lineage per query from PAF alignments"
)
public class ClassifyCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ClassifyCommand.class);

    @Option(names = {"--paf"}, required = true, description = "PAF alignment file (.gz accepted)")
    private Path paf;

    @Option(names = {"--taxonomy"}, required = true,
        description = "Accession to taxid map (GCF, TaxID, Identifiers)")
    private Path taxonomy;

    @Option(names = {"--hierarchy"}, required = true,
        description = "Taxonomy hierarchy TSV or NCBI taxdump directory")
    private Path hierarchy;

    @Option(names = {"--output"}, required = true, description = "classified_sequences.tsv to write")
    private Path output;

    @Option(names = {"--processes"}, description = "Worker threads (default: metalineage.consensus.workers)")
    private Integer processes;

    @Option(names = {"--queries"}, split = ",",
        description = "FASTA files or directories listing the queries to classify")
    private List<Path> queries = new ArrayList<>();

    @Option(names = {"--profile-output"}, description = "Also write a CAMI profile to this file")
    private Path profileOutput;

    @Option(names = {"--sample-id"}, defaultValue = "sample_0", description = "CAMI sample id (default: ${DEFAULT-VALUE})")
    private String sampleId;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            Config settings = parent.getSettings();
            ConsensusSettings consensus = ConsensusSettings.fromConfig(settings.getConfig("consensus"));
            if (processes != null) {
                consensus = consensus.withWorkers(processes);
            }

            List<DegradedModeWarning> warnings = new ArrayList<>();
            TaxonomyHierarchy tree = HierarchyLoader.load(hierarchy);
            AccessionTaxonomyMap map = AccessionTaxonomyMap.loadOrEmpty(taxonomy, warnings::add);
            List<String> querySet = queries.isEmpty() ? null : QuerySetReader.read(queries);

            ClassificationReport report = new ConsensusClassifier(tree, map, consensus)
                    .classify(new PafReader(paf), querySet);
            warnings.addAll(report.warnings());

            Map<Path, AtomicFileWriter.ContentWriter> outputs = new LinkedHashMap<>();
            outputs.put(output, ClassificationWriter.content(report.results()));
            if (profileOutput != null) {
                boolean renormalize = settings.getBoolean("profile.renormalize");
                outputs.put(profileOutput, CamiProfileWriter.content(sampleId,
                        new ProfileAggregator(renormalize).aggregate(report.results())));
            }
            AtomicFileWriter.writeAll(outputs);

            out.printf("Classified %d queries (%d resolved, %d unresolved) -> %s%n",
                    report.stats().queries(), report.stats().resolved(), report.stats().unresolved(), output);
            CommandSupport.printWarnings(out, warnings);
            return 0;
        } catch (Exception e) {
            return CommandSupport.fail(log, err, "Classification", e);
        }
    }
}
