package org.metalineage.pipeline.stages;

import java.nio.file.Files;

import org.metalineage.pipeline.api.stages.IPipelineStage;
import org.metalineage.pipeline.cache.CacheEntry;

/**
 * Aligns the queries against the cached reference set, building its index if needed.
 */
public class AlignStage implements IPipelineStage {

    @Override
    public String getName() {
        return "align";
    }

    @Override
    public boolean isComplete(PipelineContext context) {
        return Files.isRegularFile(context.alignments());
    }

    @Override
    public void execute(PipelineContext context) {
        CacheEntry entry = context.getCache().ensureIndex(context.requireCacheEntry());
        context.getAligner().align(context.getQueryFiles(), entry.indexPath(), context.alignments());
    }
}
