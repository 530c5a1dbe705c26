package org.metalineage.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.metalineage.cli.CommandLineInterface;
import org.metalineage.pipeline.stages.PipelineContext;
import org.metalineage.pipeline.stages.PipelineOrchestrator;
import org.metalineage.pipeline.stages.RunReport;
import org.metalineage.pipeline.stages.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs the whole pipeline: screen, select, limit, reference, align, classify, profile.
 */
@Command(
    name = "run",
    description = "Run the full classification pipeline, skipping stages whose outputs exist"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

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
            PipelineOrchestrator orchestrator = PipelineOrchestrator.fromConfig(
                    PipelineOrchestrator.fullPipeline(), settings.getConfig("orchestrator"));
            RunReport report = orchestrator.run(context, options.force);
            printReport(out, report);
            if (!report.isSuccess()) {
                err.println("Error: pipeline failed, see the stage summary above.");
                return CommandLineInterface.EXIT_FAILURE;
            }
            out.printf("Results in %s%n", context.getOutputDir());
            return 0;
        } catch (Exception e) {
            return CommandSupport.fail(log, err, "Pipeline run", e);
        }
    }

    static void printReport(PrintWriter out, RunReport report) {
        out.println("=== Stages ===");
        for (StageResult stage : report.stages()) {
            out.printf("  %-10s %-9s attempts=%d %d ms%s%n", stage.stage(), stage.outcome(), stage.attempts(),
                    stage.duration().toMillis(), stage.error() != null ? "  " + stage.error() : "");
        }
        CommandSupport.printWarnings(out, report.warnings());
    }
}
