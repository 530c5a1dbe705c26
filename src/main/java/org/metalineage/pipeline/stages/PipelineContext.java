package org.metalineage.pipeline.stages;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.metalineage.pipeline.api.errors.DegradedModeWarning;
import org.metalineage.pipeline.api.errors.InputException;
import org.metalineage.pipeline.api.model.ClassificationResult;
import org.metalineage.pipeline.api.tools.IAligner;
import org.metalineage.pipeline.api.tools.ISketchScreener;
import org.metalineage.pipeline.cache.CacheEntry;
import org.metalineage.pipeline.cache.ReferenceCacheManager;
import org.metalineage.pipeline.output.CandidateListWriter;
import org.metalineage.pipeline.taxonomy.HierarchyLoader;
import org.metalineage.pipeline.taxonomy.TaxonomyHierarchy;

import com.typesafe.config.Config;

/**
 * Everything the stages of one run share: settings, collaborators, file locations and the
 * degraded-mode warnings collected so far.
 * <p>
 * File layout:
 * <pre>
 * {workDir}/screen/{database}.tab
 * {workDir}/selected_genomes.txt
 * {workDir}/limited_genomes.txt
 * {workDir}/alignments.paf
 * {outputDir}/classified_sequences.tsv
 * {outputDir}/{sampleId}.cami.tsv
 * </pre>
 */
public class PipelineContext {

    private final Config settings;
    private final List<Path> queryFiles;
    private final List<ReferenceDatabase> databases;
    private final Path workDir;
    private final Path outputDir;
    private final Path hierarchyPath;
    private final String sampleId;
    private final boolean refreshCache;
    private final ISketchScreener screener;
    private final ReferenceCacheManager cache;
    private final IAligner aligner;
    private final List<DegradedModeWarning> warnings = Collections.synchronizedList(new ArrayList<>());
    private TaxonomyHierarchy hierarchy;
    private List<ClassificationResult> classificationResults;

    private PipelineContext(Builder builder) {
        this.settings = Objects.requireNonNull(builder.settings, "settings");
        this.queryFiles = List.copyOf(builder.queryFiles);
        this.databases = List.copyOf(builder.databases);
        this.workDir = Objects.requireNonNull(builder.workDir, "workDir");
        this.outputDir = Objects.requireNonNull(builder.outputDir, "outputDir");
        this.hierarchyPath = builder.hierarchyPath;
        this.sampleId = builder.sampleId;
        this.refreshCache = builder.refreshCache;
        this.screener = builder.screener;
        this.cache = builder.cache;
        this.aligner = builder.aligner;
        this.hierarchy = builder.hierarchy;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return the {@code metalineage} configuration block */
    public Config getSettings() {
        return settings;
    }

    public List<Path> getQueryFiles() {
        return queryFiles;
    }

    public List<ReferenceDatabase> getDatabases() {
        return databases;
    }

    public Path getWorkDir() {
        return workDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public String getSampleId() {
        return sampleId;
    }

    public boolean isRefreshCache() {
        return refreshCache;
    }

    public ISketchScreener getScreener() {
        return screener;
    }

    public ReferenceCacheManager getCache() {
        return cache;
    }

    public IAligner getAligner() {
        return aligner;
    }

    public void addWarning(DegradedModeWarning warning) {
        warnings.add(warning);
    }

    public List<DegradedModeWarning> getWarnings() {
        synchronized (warnings) {
            return List.copyOf(warnings);
        }
    }

    /**
     * Loads the hierarchy on first use.
     */
    public synchronized TaxonomyHierarchy getHierarchy() {
        if (hierarchy == null) {
            if (hierarchyPath == null) {
                throw new InputException("No taxonomy hierarchy configured");
            }
            hierarchy = HierarchyLoader.load(hierarchyPath);
        }
        return hierarchy;
    }

    /**
     * Keeps the results of the classify stage for the stages after it in the same run.
     */
    public synchronized void setClassificationResults(List<ClassificationResult> results) {
        this.classificationResults = List.copyOf(results);
    }

    /**
     * @return the results classified in this run, or empty if the classify stage was skipped
     */
    public synchronized Optional<List<ClassificationResult>> getClassificationResults() {
        return Optional.ofNullable(classificationResults);
    }

    public Path screenTable(ReferenceDatabase database) {
        return workDir.resolve("screen").resolve(database.name() + ".tab");
    }

    public Path selectedCandidates() {
        return workDir.resolve("selected_genomes.txt");
    }

    public Path limitedCandidates() {
        return workDir.resolve("limited_genomes.txt");
    }

    public Path alignments() {
        return workDir.resolve("alignments.paf");
    }

    public Path classification() {
        return outputDir.resolve("classified_sequences.tsv");
    }

    public Path profile() {
        return outputDir.resolve(sampleId + ".cami.tsv");
    }

    /**
     * Reads the limited candidate list written by the limit stage.
     */
    public List<String> readLimitedCandidates() {
        try {
            return CandidateListWriter.read(limitedCandidates());
        } catch (IOException e) {
            throw new InputException("Cannot read candidate list " + limitedCandidates() + ": " + e.getMessage(), e);
        }
    }

    /**
     * @return the Ready cache entry of the limited candidate list
     * @throws InputException if the reference stage has not produced it
     */
    public CacheEntry requireCacheEntry() {
        List<String> candidates = readLimitedCandidates();
        return cache.find(candidates).orElseThrow(() -> new InputException(
                "No Ready reference cache entry for the " + candidates.size() + " limited candidates"));
    }

    /**
     * Builder for {@link PipelineContext}.
     */
    public static final class Builder {
        private Config settings;
        private List<Path> queryFiles = List.of();
        private List<ReferenceDatabase> databases = List.of();
        private Path workDir;
        private Path outputDir;
        private Path hierarchyPath;
        private TaxonomyHierarchy hierarchy;
        private String sampleId = "sample_0";
        private boolean refreshCache;
        private ISketchScreener screener;
        private ReferenceCacheManager cache;
        private IAligner aligner;

        private Builder() {
        }

        public Builder settings(Config settings) {
            this.settings = settings;
            return this;
        }

        public Builder queryFiles(List<Path> queryFiles) {
            this.queryFiles = queryFiles;
            return this;
        }

        public Builder databases(List<ReferenceDatabase> databases) {
            this.databases = databases;
            return this;
        }

        public Builder workDir(Path workDir) {
            this.workDir = workDir;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder hierarchyPath(Path hierarchyPath) {
            this.hierarchyPath = hierarchyPath;
            return this;
        }

        /** Supplies an already loaded hierarchy, mostly for tests. */
        public Builder hierarchy(TaxonomyHierarchy hierarchy) {
            this.hierarchy = hierarchy;
            return this;
        }

        public Builder sampleId(String sampleId) {
            this.sampleId = sampleId;
            return this;
        }

        public Builder refreshCache(boolean refreshCache) {
            this.refreshCache = refreshCache;
            return this;
        }

        public Builder screener(ISketchScreener screener) {
            this.screener = screener;
            return this;
        }

        public Builder cache(ReferenceCacheManager cache) {
            this.cache = cache;
            return this;
        }

        public Builder aligner(IAligner aligner) {
            this.aligner = aligner;
            return this;
        }

        public PipelineContext build() {
            return new PipelineContext(this);
        }
    }
}
