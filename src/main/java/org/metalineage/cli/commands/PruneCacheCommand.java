package org.metalineage.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.Callable;

import org.metalineage.cli.CommandLineInterface;
import org.metalineage.cli.cleanup.CachePruner;
import org.metalineage.cli.cleanup.PruneResult;
import org.metalineage.pipeline.tools.ExternalCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Removes old reference cache entries.
 * <p>
 * Default mode is dry-run (preview only), use --force to execute deletion.
 */
@Command(
    name = "prune-cache",
    description = "Prune reference cache entries by age and total size"
)
public class PruneCacheCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PruneCacheCommand.class);

    @Option(names = {"--cache-dir"}, description = "Reference cache root (default: metalineage.cache.root)")
    private Path cacheDir;

    @Option(names = {"--max-age-days"}, description = "Remove entries older than this (default: metalineage.cache.prune.max-age-days)")
    private Double maxAgeDays;

    @Option(names = {"--max-size-gb"}, description = "Shrink the cache below this size in GiB (default: metalineage.cache.prune.max-size-gb)")
    private Double maxSizeGb;

    @Option(names = {"--force"}, description = "Execute deletion (default: dry-run preview only)")
    private boolean force;

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
            double age = maxAgeDays != null ? maxAgeDays : settings.getDouble("cache.prune.max-age-days");
            double size = maxSizeGb != null ? maxSizeGb : settings.getDouble("cache.prune.max-size-gb");
            if (age <= 0 && size <= 0) {
                err.println("Error: Either --max-age-days or --max-size-gb must be positive.");
                return CommandLineInterface.EXIT_FAILURE;
            }

            if (force) {
                out.println("\n=== Cache Pruning ===");
            } else {
                out.println("\n=== Cache Pruning Preview (dry-run mode, use --force to execute) ===");
            }
            CachePruner pruner = new CachePruner(CommandSupport.cacheManager(settings, cacheDir, new ExternalCommand()));
            PruneResult result = pruner.prune(age, size, force, Instant.now(), out);

            out.println("=== Summary ===");
            out.printf("Entries: %d kept, %d %s (%s)%n", result.kept(), result.deleted(),
                    force ? "deleted" : "to delete", CachePruner.humanSize(result.bytesFreed()));
            if (!force && result.deleted() > 0) {
                out.println("\nRun with --force to execute deletion.");
            }
            return result.failed() > 0 ? CommandLineInterface.EXIT_FAILURE : 0;
        } catch (Exception e) {
            return CommandSupport.fail(log, err, "Cache pruning", e);
        }
    }
}
