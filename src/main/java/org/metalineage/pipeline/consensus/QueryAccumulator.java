package org.metalineage.pipeline.consensus;

import java.util.ArrayList;
import java.util.List;

import org.metalineage.pipeline.api.model.AlignmentRecord;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/**
 * Folds the alignments of one query into its best hit per taxon.
 * <p>
 * Memory stays proportional to the number of distinct taxa hit, not to the number of
 * alignments. The first alignment in file order is remembered for the first-hit fallback.
 * Not thread-safe: one accumulator is owned by one thread at a time.
 */
public final class QueryAccumulator {

    private final String queryId;
    private final Int2ObjectOpenHashMap<TaxonHit> bestByTaxon = new Int2ObjectOpenHashMap<>();
    private QueryState state = QueryState.NEW;
    private AlignmentRecord firstRecord;
    private double firstScore;
    private int records;
    private int unmapped;

    public QueryAccumulator(String queryId) {
        this.queryId = queryId;
    }

    public String getQueryId() {
        return queryId;
    }

    public QueryState getState() {
        return state;
    }

    /**
     * Records one alignment.
     *
     * @param record the alignment
     * @param score  its per-hit score
     * @param taxid  mapped taxon, or 0 when the target is unmapped
     */
    public void add(AlignmentRecord record, double score, int taxid) {
        if (state != QueryState.NEW && state != QueryState.COLLECTING) {
            throw new IllegalStateException("Query " + queryId + " is already " + state);
        }
        state = QueryState.COLLECTING;
        records++;
        if (firstRecord == null) {
            firstRecord = record;
            firstScore = score;
        }
        if (taxid == 0) {
            unmapped++;
            return;
        }
        TaxonHit hit = new TaxonHit(taxid, score, record.targetAccession());
        TaxonHit existing = bestByTaxon.get(taxid);
        if (existing == null || hit.beats(existing)) {
            bestByTaxon.put(taxid, hit);
        }
    }

    /**
     * Marks the start of resolution and returns the collected taxa.
     */
    public List<TaxonHit> beginResolution() {
        if (state.isTerminal() || state == QueryState.RESOLVING) {
            throw new IllegalStateException("Query " + queryId + " is already " + state);
        }
        state = QueryState.RESOLVING;
        return new ArrayList<>(bestByTaxon.values());
    }

    void finish(boolean resolved) {
        state = resolved ? QueryState.RESOLVED : QueryState.UNRESOLVED;
    }

    /** @return the first alignment in file order, or {@code null} */
    public AlignmentRecord getFirstRecord() {
        return firstRecord;
    }

    public double getFirstScore() {
        return firstScore;
    }

    public int getRecordCount() {
        return records;
    }

    public int getUnmappedCount() {
        return unmapped;
    }
}
