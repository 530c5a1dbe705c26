package org.metalineage.pipeline.selection;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

import org.metalineage.pipeline.api.errors.DegradedModeWarning;
import org.metalineage.pipeline.api.errors.InputException;
import org.metalineage.pipeline.api.model.CandidateGenome;
import org.metalineage.pipeline.api.model.ScreenHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects candidate reference genomes from similarity screen results using an adaptive
 * threshold.
 * <p>
 * Starting at the initial threshold, the threshold is lowered by the configured step
 * until the number of hits scoring strictly above it reaches the minimum candidate count,
 * or the minimum threshold has been passed. An exhausted search is not an error: the
 * fixed fallback threshold is applied, whatever number of candidates it yields, and a
 * {@link DegradedModeWarning} is emitted.
 * <p>
 * Each database is searched independently; the per-database selections are then unioned
 * with exact deduplication into one lexicographically sorted candidate list.
 */
public class CandidateSelector {

    private static final Logger log = LoggerFactory.getLogger(CandidateSelector.class);

    private final SelectionSettings settings;
    private final Consumer<DegradedModeWarning> warnings;

    public CandidateSelector(SelectionSettings settings, Consumer<DegradedModeWarning> warnings) {
        this.settings = settings;
        this.warnings = warnings;
    }

    /**
     * Screen results of one reference database.
     *
     * @param database         database name
     * @param initialThreshold database-specific starting threshold, or {@code null} for the default
     * @param hits             screen hits in any order
     */
    public record DatabaseScreen(String database, BigDecimal initialThreshold, List<ScreenHit> hits) {
    }

    /**
     * Selection made for one database.
     */
    public record DatabaseSelection(String database, ThresholdSearchResult search, List<CandidateGenome> candidates) {
    }

    /**
     * Unioned selection across all databases.
     *
     * @param candidates one candidate per id, sorted by id; best score across databases
     * @param perDatabase per-database selections in input order
     */
    public record SelectionResult(List<CandidateGenome> candidates, List<DatabaseSelection> perDatabase) {

        public List<String> candidateIds() {
            return candidates.stream().map(CandidateGenome::accessionId).toList();
        }
    }

    /**
     * Runs the adaptive threshold search over one table.
     *
     * @param hits          screen hits
     * @param minCandidates candidate count that ends the search
     * @return the chosen threshold; never {@code null}
     */
    public ThresholdSearchResult searchThreshold(Collection<ScreenHit> hits, int minCandidates) {
        return searchThreshold(hits, minCandidates, settings.initialThreshold());
    }

    ThresholdSearchResult searchThreshold(Collection<ScreenHit> hits, int minCandidates, BigDecimal initial) {
        BigDecimal current = initial;
        int iterations = 0;
        while (current.compareTo(settings.minThreshold()) >= 0) {
            iterations++;
            int count = countAbove(hits, current);
            log.debug("Threshold {}: {} candidates (need {})", current, count, minCandidates);
            if (count >= minCandidates) {
                return new ThresholdSearchResult(current, count, iterations, false);
            }
            current = current.subtract(settings.step());
        }

        BigDecimal fallback = settings.fallbackThreshold();
        int count = countAbove(hits, fallback);
        DegradedModeWarning warning = DegradedModeWarning.of(DegradedModeWarning.Code.THRESHOLD_FALLBACK,
                String.format("No threshold in [%s, %s] yields %d candidates; using fallback %s (%d candidates)",
                        settings.minThreshold(), initial, minCandidates, fallback, count));
        log.warn(warning.message());
        warnings.accept(warning);
        return new ThresholdSearchResult(fallback, count, iterations, true);
    }

    /**
     * Selects candidates from every database and unions them.
     *
     * @param screens           per-database screen results
     * @param numInputSequences number of query inputs, drives the minimum candidate count
     * @return the unioned selection
     * @throws InputException if no database yields any candidate
     */
    public SelectionResult select(List<DatabaseScreen> screens, int numInputSequences) {
        int minCandidates = settings.minCandidates(numInputSequences);
        List<DatabaseSelection> perDatabase = new ArrayList<>(screens.size());
        Map<String, CandidateGenome> union = new TreeMap<>();

        for (DatabaseScreen screen : screens) {
            BigDecimal initial = screen.initialThreshold() != null
                    ? screen.initialThreshold() : settings.initialThreshold();
            ThresholdSearchResult search = searchThreshold(screen.hits(), minCandidates, initial);
            List<CandidateGenome> selected = new ArrayList<>();
            for (ScreenHit hit : screen.hits()) {
                if (isAbove(hit, search.threshold())) {
                    selected.add(new CandidateGenome(hit.genomeId(), hit.genomeId(), screen.database(), hit.score()));
                }
            }
            log.info("Database '{}': threshold {} selected {} of {} screened genomes",
                    screen.database(), search.threshold(), selected.size(), screen.hits().size());
            perDatabase.add(new DatabaseSelection(screen.database(), search, List.copyOf(selected)));

            for (CandidateGenome candidate : selected) {
                union.merge(candidate.accessionId(), candidate, CandidateSelector::better);
            }
        }

        if (union.isEmpty()) {
            throw new InputException("No reference database yielded any candidate genome ("
                    + screens.size() + " databases screened)");
        }
        return new SelectionResult(List.copyOf(union.values()), List.copyOf(perDatabase));
    }

    private static CandidateGenome better(CandidateGenome a, CandidateGenome b) {
        if (a.bestScore() != b.bestScore()) {
            return a.bestScore() > b.bestScore() ? a : b;
        }
        return a.sourceDb().compareTo(b.sourceDb()) <= 0 ? a : b;
    }

    private static int countAbove(Collection<ScreenHit> hits, BigDecimal threshold) {
        int count = 0;
        for (ScreenHit hit : hits) {
            if (isAbove(hit, threshold)) {
                count++;
            }
        }
        return count;
    }

    private static boolean isAbove(ScreenHit hit, BigDecimal threshold) {
        return hit.score() > threshold.doubleValue();
    }
}
