package org.metalineage.cli.commands;

import java.nio.file.Path;
import java.util.List;

import org.metalineage.pipeline.alignment.QuerySetReader;
import org.metalineage.pipeline.cache.ReferenceCacheManager;
import org.metalineage.pipeline.stages.ReferenceDatabase;
import org.metalineage.pipeline.stages.PipelineContext;
import org.metalineage.pipeline.tools.ExternalCommand;
import org.metalineage.pipeline.tools.MashScreener;
import org.metalineage.pipeline.tools.Minimap2Aligner;

import com.typesafe.config.Config;

import picocli.CommandLine.Option;

/**
 * Options shared by the commands that run pipeline stages.
 */
public class PipelineOptions {

    @Option(names = {"--input"}, required = true, split = ",",
        description = "Query FASTA files or directories of them")
    List<Path> inputs;

    @Option(names = {"--work-dir"}, defaultValue = "work", description = "Intermediate files (default: ${DEFAULT-VALUE})")
    Path workDir;

    @Option(names = {"--output-dir"}, defaultValue = "output", description = "Result files (default: ${DEFAULT-VALUE})")
    Path outputDir;

    @Option(names = {"--hierarchy"}, description = "Taxonomy hierarchy (default: metalineage.taxonomy.hierarchy)")
    Path hierarchy;

    @Option(names = {"--cache-dir"}, description = "Reference cache root (default: metalineage.cache.root)")
    Path cacheDir;

    @Option(names = {"--refresh-cache"}, description = "Rebuild the reference cache entry even if it is Ready")
    boolean refreshCache;

    @Option(names = {"--force"}, description = "Rerun stages whose outputs already exist")
    boolean force;

    @Option(names = {"--sample-id"}, defaultValue = "sample_0", description = "CAMI sample id (default: ${DEFAULT-VALUE})")
    String sampleId;

    /**
     * Builds the run context with the configured external tools.
     *
     * @param settings the {@code metalineage} block
     */
    PipelineContext toContext(Config settings) {
        ExternalCommand runner = new ExternalCommand();
        ReferenceCacheManager cache = CommandSupport.cacheManager(settings, cacheDir, runner);
        Path hierarchyPath = hierarchy != null ? hierarchy
                : settings.hasPath("taxonomy.hierarchy") ? Path.of(settings.getString("taxonomy.hierarchy")) : null;
        return PipelineContext.builder()
                .settings(settings)
                .queryFiles(QuerySetReader.expand(inputs))
                .databases(ReferenceDatabase.fromConfig(settings.getConfigList("databases")))
                .workDir(workDir)
                .outputDir(outputDir)
                .hierarchyPath(hierarchyPath)
                .sampleId(sampleId)
                .refreshCache(refreshCache)
                .screener(new MashScreener(settings.getConfig("tools.mash"), runner))
                .cache(cache)
                .aligner(new Minimap2Aligner(settings.getConfig("tools.minimap2"), runner))
                .build();
    }
}
