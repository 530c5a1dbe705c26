package org.metalineage.pipeline.consensus;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.metalineage.pipeline.alignment.PafParseStats;
import org.metalineage.pipeline.alignment.PafReader;
import org.metalineage.pipeline.api.errors.DegradedModeWarning;
import org.metalineage.pipeline.api.errors.PipelineException;
import org.metalineage.pipeline.api.model.AlignmentRecord;
import org.metalineage.pipeline.api.model.ClassificationResult;
import org.metalineage.pipeline.taxonomy.AccessionTaxonomyMap;
import org.metalineage.pipeline.taxonomy.TaxonomyHierarchy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies every query of a run from a PAF alignment file.
 * <p>
 * A producer thread parses the file and hands record batches through a bounded queue to
 * the calling thread, which folds them into one {@link QueryAccumulator} per query.
 * The sorted query list is then cut into contiguous shards resolved in parallel by a
 * {@link ShardWorkerPool}. If the run resolves no query although alignments exist, every
 * query is reassigned from its first alignment with lenient accession matching and a
 * {@link DegradedModeWarning} is raised.
 * <p>
 * Interrupting the calling thread stops the producer and aborts the run with a
 * {@link PipelineException}.
 */
public class ConsensusClassifier {

    private static final Logger log = LoggerFactory.getLogger(ConsensusClassifier.class);
    private static final List<AlignmentRecord> END_OF_STREAM = Collections.emptyList();

    private final TaxonomyHierarchy hierarchy;
    private final AccessionTaxonomyMap taxonomyMap;
    private final ConsensusSettings settings;
    private final LineageConsensusEngine engine;
    private final HitScorer scorer;

    public ConsensusClassifier(TaxonomyHierarchy hierarchy, AccessionTaxonomyMap taxonomyMap,
                               ConsensusSettings settings) {
        this.hierarchy = hierarchy;
        this.taxonomyMap = taxonomyMap;
        this.settings = settings;
        this.engine = new LineageConsensusEngine(hierarchy, settings);
        this.scorer = new HitScorer(settings);
    }

    /**
     * Runs the classification.
     *
     * @param alignments PAF source
     * @param querySet   queries to classify in output order, or {@code null} to classify
     *                   the distinct queries of the alignments in first-appearance order
     * @return exactly one result per query
     */
    public ClassificationReport classify(PafReader alignments, List<String> querySet) {
        List<DegradedModeWarning> warnings = new ArrayList<>();
        Map<String, QueryAccumulator> accumulators = new LinkedHashMap<>();
        boolean explicit = querySet != null;
        if (explicit) {
            for (String query : querySet) {
                accumulators.putIfAbsent(query, new QueryAccumulator(query));
            }
        }

        Set<String> ignored = new HashSet<>();
        long[] unmapped = new long[1];
        PafParseStats parseStats = consume(alignments, batch -> {
            for (AlignmentRecord record : batch) {
                QueryAccumulator acc = accumulators.get(record.queryId());
                if (acc == null) {
                    if (explicit) {
                        ignored.add(record.queryId());
                        continue;
                    }
                    acc = new QueryAccumulator(record.queryId());
                    accumulators.put(record.queryId(), acc);
                }
                int taxid = taxonomyMap.taxidOf(record.targetAccession());
                if (taxid != 0 && !hierarchy.contains(taxid)) {
                    taxid = 0;
                }
                if (taxid == 0) {
                    unmapped[0]++;
                }
                acc.add(record, scorer.score(record), taxid);
            }
        });
        if (!ignored.isEmpty()) {
            log.info("Ignored {} queries present only in the alignments", ignored.size());
        }
        if (unmapped[0] > 0) {
            log.info("Discarded {} alignments to targets without a known taxid", unmapped[0]);
        }

        List<QueryAccumulator> ordered = new ArrayList<>(accumulators.values());
        Map<String, ClassificationResult> byQuery = resolveAll(ordered);

        int resolved = countResolved(byQuery.values());
        boolean fallback = false;
        if (resolved == 0 && parseStats.getRecords() > 0) {
            DegradedModeWarning warning = DegradedModeWarning.of(DegradedModeWarning.Code.FIRST_HIT_FALLBACK,
                    "No query resolved from " + parseStats.getRecords() + " alignments; using first-hit assignment");
            log.warn(warning.message());
            warnings.add(warning);
            byQuery = firstHitFallback(ordered);
            resolved = countResolved(byQuery.values());
            fallback = true;
        }

        List<ClassificationResult> results = new ArrayList<>(ordered.size());
        for (QueryAccumulator acc : ordered) {
            results.add(byQuery.get(acc.getQueryId()));
        }
        ClassificationStats stats = new ClassificationStats(parseStats.getRecords(), parseStats.getMalformed(),
                unmapped[0], ignored.size(), results.size(), resolved, fallback);
        log.info("Classified {} queries: {} resolved, {} unresolved ({} alignments, {} malformed lines)",
                stats.queries(), stats.resolved(), stats.unresolved(), stats.records(), stats.malformed());
        return new ClassificationReport(List.copyOf(results), stats, List.copyOf(warnings));
    }

    /**
     * Streams record batches to {@code sink} on the calling thread. The producer is stopped
     * whenever this method leaves early, including when the sink throws.
     */
    PafParseStats consume(PafReader alignments, Consumer<List<AlignmentRecord>> sink) {
        BlockingQueue<List<AlignmentRecord>> queue = new ArrayBlockingQueue<>(settings.queueCapacity());
        AtomicReference<Throwable> producerFailure = new AtomicReference<>();
        PafReader.RecordIterator iterator = alignments.iterator();

        Thread producer = new Thread(() -> {
            try (iterator) {
                List<AlignmentRecord> batch = new ArrayList<>(settings.batchSize());
                while (iterator.hasNext()) {
                    if (Thread.currentThread().isInterrupted()) {
                        return;
                    }
                    batch.add(iterator.next());
                    if (batch.size() == settings.batchSize()) {
                        queue.put(batch);
                        batch = new ArrayList<>(settings.batchSize());
                    }
                }
                if (!batch.isEmpty()) {
                    queue.put(batch);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (IOException | RuntimeException e) {
                producerFailure.set(e);
            }
            try {
                queue.put(END_OF_STREAM);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "paf-producer-" + alignments.getFile().getFileName());
        producer.setDaemon(true);
        producer.start();

        boolean drained = false;
        try {
            while (true) {
                List<AlignmentRecord> batch = queue.take();
                if (batch == END_OF_STREAM) {
                    break;
                }
                sink.accept(batch);
            }
            producer.join();
            drained = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Classification interrupted while reading " + alignments.getFile(), e);
        } finally {
            if (!drained) {
                producer.interrupt();
            }
        }

        Throwable failure = producerFailure.get();
        if (failure != null) {
            throw new PipelineException("Failed to read alignments from " + alignments.getFile()
                    + ": " + failure.getMessage(), failure);
        }
        return iterator.stats();
    }

    private Map<String, ClassificationResult> resolveAll(List<QueryAccumulator> accumulators) {
        List<QueryAccumulator> sorted = new ArrayList<>(accumulators);
        sorted.sort((a, b) -> a.getQueryId().compareTo(b.getQueryId()));
        ClassificationResult[] results = new ClassificationResult[sorted.size()];

        try (ShardWorkerPool pool = new ShardWorkerPool(settings.workers())) {
            pool.dispatch(sorted.size(), (from, to) -> {
                for (int i = from; i < to; i++) {
                    QueryAccumulator acc = sorted.get(i);
                    ClassificationResult result = engine.resolve(acc.getQueryId(), acc.beginResolution());
                    acc.finish(result.isResolved());
                    results[i] = result;
                }
            });
        }

        Map<String, ClassificationResult> byQuery = new HashMap<>(results.length * 2);
        for (ClassificationResult result : results) {
            byQuery.put(result.queryId(), result);
        }
        return byQuery;
    }

    private Map<String, ClassificationResult> firstHitFallback(List<QueryAccumulator> accumulators) {
        Map<String, ClassificationResult> byQuery = new HashMap<>(accumulators.size() * 2);
        for (QueryAccumulator acc : accumulators) {
            ClassificationResult result = ClassificationResult.unclassified(acc.getQueryId());
            AlignmentRecord first = acc.getFirstRecord();
            if (first != null) {
                int taxid = taxonomyMap.taxidOfLenient(first.targetAccession());
                if (taxid != 0 && hierarchy.contains(taxid)) {
                    result = engine.assign(acc.getQueryId(), taxid, acc.getFirstScore());
                }
            }
            acc.finish(result.isResolved());
            byQuery.put(acc.getQueryId(), result);
        }
        return byQuery;
    }

    private static int countResolved(Iterable<ClassificationResult> results) {
        int count = 0;
        for (ClassificationResult result : results) {
            if (result.isResolved()) {
                count++;
            }
        }
        return count;
    }
}
