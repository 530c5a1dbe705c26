package org.metalineage.pipeline.limiting;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.metalineage.pipeline.api.errors.ConfigurationException;
import org.metalineage.pipeline.api.model.CandidateGenome;
import org.metalineage.pipeline.api.model.LimitAudit;
import org.metalineage.pipeline.api.model.ScreenHit;
import org.metalineage.pipeline.selection.ScreenTableReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;

/**
 * Deduplicates candidates by species and caps the list size.
 * <p>
 * The result depends only on the inputs: with deduplication on, the best-scoring
 * candidate per species key survives; the cap keeps the highest-scoring candidates.
 * Every tie is broken by the lexicographically smallest identifier. Candidates missing
 * from all score tables score negative infinity.
 */
public class CandidateLimiter {

    private static final Logger log = LoggerFactory.getLogger(CandidateLimiter.class);
    private static final Gson GSON = new Gson();

    /** Highest score first, then smallest identifier. */
    static final Comparator<CandidateGenome> RANKING =
            Comparator.comparingDouble(CandidateGenome::bestScore).reversed()
                    .thenComparing(CandidateGenome::accessionId);

    private final Map<String, String> speciesKeys;

    /**
     * @param speciesKeys accession to species key; accessions without an entry are their own key
     */
    public CandidateLimiter(Map<String, String> speciesKeys) {
        this.speciesKeys = Map.copyOf(speciesKeys);
    }

    /**
     * Limits a candidate list.
     *
     * @param candidates    candidate identifiers, duplicates collapse
     * @param scoreTables   screen tables providing best observed scores
     * @param maxCandidates size cap, at least 1
     * @param dedupe        whether to keep a single candidate per species
     * @return the limited list and its audit
     * @throws ConfigurationException if {@code maxCandidates < 1} or no score table can be read
     */
    public LimitResult limit(Collection<String> candidates, List<Path> scoreTables, int maxCandidates, boolean dedupe) {
        if (maxCandidates < 1) {
            throw new ConfigurationException("Maximum candidate count must be >= 1, got " + maxCandidates);
        }
        Map<String, Double> scores = readScores(scoreTables);
        return limit(candidates, scores, maxCandidates, dedupe);
    }

    /**
     * Variant over already-collected best scores keyed by accession.
     */
    public LimitResult limit(Collection<String> candidates, Map<String, Double> scores, int maxCandidates, boolean dedupe) {
        if (maxCandidates < 1) {
            throw new ConfigurationException("Maximum candidate count must be >= 1, got " + maxCandidates);
        }
        List<CandidateGenome> pool = new ArrayList<>();
        for (String id : new LinkedHashSet<>(candidates)) {
            String accession = CandidateGenome.accessionOf(id);
            double score = scores.getOrDefault(accession, scores.getOrDefault(id, Double.NEGATIVE_INFINITY));
            pool.add(new CandidateGenome(id, speciesKeys.getOrDefault(accession, accession), "", score));
        }
        int inputCount = pool.size();

        List<CandidateGenome> deduped = dedupe ? dedupeBySpecies(pool) : pool;
        int postDedup = deduped.size();

        List<CandidateGenome> capped = new ArrayList<>(deduped);
        capped.sort(RANKING);
        if (capped.size() > maxCandidates) {
            capped = new ArrayList<>(capped.subList(0, maxCandidates));
        }
        capped.sort(Comparator.comparing(CandidateGenome::accessionId));

        LimitAudit audit = new LimitAudit(inputCount, postDedup, capped.size());
        log.info("Candidate limiting: {}", GSON.toJson(audit));
        return new LimitResult(List.copyOf(capped), audit);
    }

    private static List<CandidateGenome> dedupeBySpecies(List<CandidateGenome> pool) {
        Map<String, CandidateGenome> bySpecies = new TreeMap<>();
        for (CandidateGenome candidate : pool) {
            bySpecies.merge(candidate.speciesKey(), candidate,
                    (a, b) -> RANKING.compare(a, b) <= 0 ? a : b);
        }
        return new ArrayList<>(bySpecies.values());
    }

    /**
     * Reads the best score per accession over all tables.
     *
     * @throws ConfigurationException if none of the tables can be read
     */
    static Map<String, Double> readScores(List<Path> scoreTables) {
        Map<String, Double> scores = new HashMap<>();
        int readable = 0;
        for (Path table : scoreTables) {
            try {
                for (ScreenHit hit : ScreenTableReader.read(table).hits()) {
                    scores.merge(CandidateGenome.accessionOf(hit.genomeId()), hit.score(), Math::max);
                }
                readable++;
            } catch (IOException e) {
                log.warn("Score table {} is unreadable: {}", table, e.getMessage());
            }
        }
        if (readable == 0) {
            throw new ConfigurationException("None of the " + scoreTables.size() + " score tables could be read");
        }
        return scores;
    }
}
