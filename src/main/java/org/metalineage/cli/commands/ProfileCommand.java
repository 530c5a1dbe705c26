package org.metalineage.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.metalineage.cli.CommandLineInterface;
import org.metalineage.pipeline.api.model.ClassificationResult;
import org.metalineage.pipeline.api.model.ProfileEntry;
import org.metalineage.pipeline.output.CamiProfileWriter;
import org.metalineage.pipeline.profile.ClassifiedSequencesReader;
import org.metalineage.pipeline.profile.ProfileAggregator;
import org.metalineage.pipeline.taxonomy.HierarchyLoader;
import org.metalineage.pipeline.taxonomy.TaxonomyHierarchy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Converts an existing {@code classified_sequences.tsv} into a CAMI profile.
 */
@Command(
    name = "profile",
    description = "Build a CAMI profile from classified_sequences.tsv"
)
public class ProfileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProfileCommand.class);

    @Option(names = {"--input"}, required = true, description = "classified_sequences.tsv")
    private Path input;

    @Option(names = {"--hierarchy"}, required = true,
        description = "Taxonomy hierarchy TSV or NCBI taxdump directory")
    private Path hierarchy;

    @Option(names = {"--output"}, required = true, description = "CAMI profile to write")
    private Path output;

    @Option(names = {"--sample-id"}, defaultValue = "sample_0", description = "CAMI sample id (default: ${DEFAULT-VALUE})")
    private String sampleId;

    @Option(names = {"--renormalize"}, negatable = true,
        description = "Divide by queries reaching each rank instead of all queries (default: metalineage.profile.renormalize)")
    private Boolean renormalize;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            boolean perRank = renormalize != null ? renormalize : parent.getSettings().getBoolean("profile.renormalize");
            TaxonomyHierarchy tree = HierarchyLoader.load(hierarchy);
            List<ClassificationResult> results = ClassifiedSequencesReader.read(input, tree);
            List<ProfileEntry> entries = new ProfileAggregator(perRank).aggregate(results);
            CamiProfileWriter.write(output, sampleId, entries);
            out.printf("Wrote %d profile rows for %d queries -> %s%n", entries.size(), results.size(), output);
            return 0;
        } catch (Exception e) {
            return CommandSupport.fail(log, err, "Profile", e);
        }
    }
}
