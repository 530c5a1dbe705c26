package org.metalineage.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.metalineage.cli.CommandLineInterface;
import org.metalineage.pipeline.stages.PipelineContext;
import org.metalineage.pipeline.stages.PipelineOrchestrator;
import org.metalineage.pipeline.stages.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Screens the queries and writes the limited candidate list without downloading anything.
 */
@Command(
    name = "select",
    description = "Screen queries and select, deduplicate and cap candidate reference genomes"
)
public class SelectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SelectCommand.class);

    @Mixin
    private PipelineOptions options;

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
            PipelineContext context = options.toContext(settings);
            RunReport report = PipelineOrchestrator.fromConfig(PipelineOrchestrator.selectionPipeline(),
                    settings.getConfig("orchestrator")).run(context, options.force);
            RunCommand.printReport(out, report);
            if (!report.isSuccess()) {
                err.println("Error: candidate selection failed, see the stage summary above.");
                return CommandLineInterface.EXIT_FAILURE;
            }
            out.printf("Candidate list: %s%n", context.limitedCandidates());
            return 0;
        } catch (Exception e) {
            return CommandSupport.fail(log, err, "Candidate selection", e);
        }
    }
}
