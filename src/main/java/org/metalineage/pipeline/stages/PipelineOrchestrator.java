package org.metalineage.pipeline.stages;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.metalineage.pipeline.api.errors.ConfigurationException;
import org.metalineage.pipeline.api.errors.ExternalToolException;
import org.metalineage.pipeline.api.errors.PipelineException;
import org.metalineage.pipeline.api.stages.IPipelineStage;
import org.metalineage.pipeline.api.stages.StageOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Runs pipeline stages in order.
 * <p>
 * A stage whose outputs already exist is skipped unless the run is forced or an earlier
 * stage of this run completed, since outputs derived from replaced inputs are stale. A stage failing
 * with {@link ExternalToolException} is retried with exponential backoff up to the
 * configured number of attempts; any other {@link PipelineException} fails it at once.
 * The first failed stage ends the run. Interrupting the running thread cancels the run:
 * the current stage fails and no further stage starts.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    /**
     * Waits between retries.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final List<IPipelineStage> stages;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Sleeper sleeper;

    public PipelineOrchestrator(List<IPipelineStage> stages, int maxAttempts, Duration initialBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new ConfigurationException("Maximum attempts must be >= 1, got " + maxAttempts);
        }
        this.stages = List.copyOf(stages);
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.sleeper = sleeper;
    }

    /**
     * Creates an orchestrator from the {@code metalineage.orchestrator} block.
     */
    public static PipelineOrchestrator fromConfig(List<IPipelineStage> stages, Config orchestrator) {
        try {
            return new PipelineOrchestrator(stages, orchestrator.getInt("max-attempts"),
                    orchestrator.getDuration("initial-backoff"), Thread::sleep);
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid orchestrator settings: " + e.getMessage(), e);
        }
    }

    /**
     * The stages of a full run, in order.
     */
    public static List<IPipelineStage> fullPipeline() {
        return List.of(new ScreenStage(), new SelectStage(), new LimitStage(), new ReferenceStage(),
                new AlignStage(), new ClassifyStage(), new ProfileStage());
    }

    /**
     * The stages that produce the limited candidate list.
     */
    public static List<IPipelineStage> selectionPipeline() {
        return List.of(new ScreenStage(), new SelectStage(), new LimitStage());
    }

    /**
     * @param context shared run state
     * @param force   execute stages even when their outputs exist; without it, every stage
     *                after the first completed one runs as well
     * @return the run report; check {@link RunReport#isSuccess()}
     */
    public RunReport run(PipelineContext context, boolean force) {
        List<StageResult> results = new ArrayList<>();
        String completedUpstream = null;
        for (IPipelineStage stage : stages) {
            StageResult result = runStage(stage, context, force, completedUpstream);
            results.add(result);
            if (result.outcome() == StageOutcome.FAILED) {
                break;
            }
            if (result.outcome() == StageOutcome.COMPLETED && completedUpstream == null) {
                completedUpstream = stage.getName();
            }
        }
        return new RunReport(List.copyOf(results), context.getWarnings());
    }

    private StageResult runStage(IPipelineStage stage, PipelineContext context, boolean force,
                                 String completedUpstream) {
        long start = System.nanoTime();
        if (!force && stage.isComplete(context)) {
            if (completedUpstream == null) {
                log.info("Stage '{}' skipped, outputs already present", stage.getName());
                return new StageResult(stage.getName(), StageOutcome.SKIPPED, 0, elapsed(start), null);
            }
            log.info("Stage '{}' rerun, its inputs changed when stage '{}' completed",
                    stage.getName(), completedUpstream);
        }

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                log.info("Stage '{}' started{}", stage.getName(), attempt > 1 ? " (attempt " + attempt + ")" : "");
                stage.execute(context);
                log.info("Stage '{}' completed in {} ms", stage.getName(), elapsed(start).toMillis());
                return new StageResult(stage.getName(), StageOutcome.COMPLETED, attempt, elapsed(start), null);
            } catch (ExternalToolException e) {
                if (attempt >= maxAttempts || Thread.currentThread().isInterrupted()) {
                    log.error("Stage '{}' failed after {} attempts: {}", stage.getName(), attempt, e.getMessage());
                    return new StageResult(stage.getName(), StageOutcome.FAILED, attempt, elapsed(start), e.getMessage());
                }
                long backoff = initialBackoff.toMillis() << (attempt - 1);
                log.warn("Stage '{}' attempt {} of {} failed: {}; retrying in {} ms",
                        stage.getName(), attempt, maxAttempts, e.getMessage(), backoff);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.error("Stage '{}' cancelled while waiting to retry", stage.getName());
                    return new StageResult(stage.getName(), StageOutcome.FAILED, attempt, elapsed(start),
                            "cancelled");
                }
            } catch (PipelineException e) {
                log.error("Stage '{}' failed: {}", stage.getName(), e.getMessage());
                return new StageResult(stage.getName(), StageOutcome.FAILED, attempt, elapsed(start), e.getMessage());
            }
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
