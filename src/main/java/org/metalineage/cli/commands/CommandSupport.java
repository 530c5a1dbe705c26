package org.metalineage.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

import org.metalineage.cli.CommandLineInterface;
import org.metalineage.pipeline.api.errors.ConfigurationException;
import org.metalineage.pipeline.api.errors.DegradedModeWarning;
import org.metalineage.pipeline.cache.ReferenceCacheManager;
import org.metalineage.pipeline.tools.CommandReferenceDownloader;
import org.metalineage.pipeline.tools.ExternalCommand;
import org.metalineage.pipeline.tools.Minimap2Aligner;
import org.slf4j.Logger;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Helpers shared by the subcommands.
 */
final class CommandSupport {

    private CommandSupport() {
    }

    /**
     * Logs a command failure, prints it to stderr and maps it to an exit code.
     */
    static int fail(Logger log, PrintWriter err, String command, Exception e) {
        log.error("{} failed: {}", command, e.getMessage());
        err.println("Error: " + e.getMessage());
        return e instanceof ConfigurationException || e instanceof ConfigException
                ? CommandLineInterface.EXIT_CONFIG
                : CommandLineInterface.EXIT_FAILURE;
    }

    static void printWarnings(PrintWriter out, List<DegradedModeWarning> warnings) {
        for (DegradedModeWarning warning : warnings) {
            out.printf("Warning [%s]: %s%n", warning.code(), warning.message());
        }
    }

    /**
     * Builds the cache manager with the configured downloader and aligner.
     *
     * @param settings  the {@code metalineage} block
     * @param cacheRoot cache root override, or {@code null} for {@code cache.root}
     */
    static ReferenceCacheManager cacheManager(Config settings, Path cacheRoot, ExternalCommand runner) {
        Path root = cacheRoot != null ? cacheRoot : Path.of(settings.getString("cache.root"));
        return new ReferenceCacheManager(root,
                new CommandReferenceDownloader(settings.getConfig("tools.downloader"), runner),
                new Minimap2Aligner(settings.getConfig("tools.minimap2"), runner));
    }
}
