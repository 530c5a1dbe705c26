package org.metalineage.pipeline.stages;

import org.metalineage.pipeline.api.stages.IPipelineStage;

/**
 * Makes sure the reference set of the limited candidates is in the cache.
 */
public class ReferenceStage implements IPipelineStage {

    @Override
    public String getName() {
        return "reference";
    }

    @Override
    public boolean isComplete(PipelineContext context) {
        return !context.isRefreshCache() && context.getCache().find(context.readLimitedCandidates()).isPresent();
    }

    @Override
    public void execute(PipelineContext context) {
        context.getCache().resolve(context.readLimitedCandidates(), context.isRefreshCache());
    }
}
