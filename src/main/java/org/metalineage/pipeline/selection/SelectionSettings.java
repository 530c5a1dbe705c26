package org.metalineage.pipeline.selection;

import java.math.BigDecimal;

import org.metalineage.pipeline.api.errors.ConfigurationException;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Parameters of the adaptive threshold search.
 * <p>
 * Thresholds are held as {@link BigDecimal} so that stepping 0.90 down by 0.02 lands
 * exactly on 0.70 instead of accumulating binary rounding error.
 *
 * @param initialThreshold      first threshold tried, unless a database overrides it
 * @param minThreshold          lowest threshold tried
 * @param step                  decrement between tries
 * @param fallbackThreshold     threshold used when the search is exhausted
 * @param candidatesPerSequence minimum candidates wanted per input sequence
 * @param minCandidatesFloor    lower bound on the minimum candidate count
 */
public record SelectionSettings(
        BigDecimal initialThreshold,
        BigDecimal minThreshold,
        BigDecimal step,
        BigDecimal fallbackThreshold,
        double candidatesPerSequence,
        int minCandidatesFloor) {

    public static final SelectionSettings DEFAULTS = new SelectionSettings(
            new BigDecimal("0.90"), new BigDecimal("0.70"), new BigDecimal("0.02"),
            new BigDecimal("0.71"), 3.25, 5);

    public SelectionSettings {
        if (step.signum() <= 0) {
            throw new ConfigurationException("Threshold step must be positive, got " + step);
        }
        if (minCandidatesFloor < 1) {
            throw new ConfigurationException("Minimum candidate floor must be >= 1, got " + minCandidatesFloor);
        }
        if (candidatesPerSequence < 0) {
            throw new ConfigurationException("Candidates per sequence must not be negative, got " + candidatesPerSequence);
        }
    }

    /**
     * Reads settings from the {@code metalineage.selection} block.
     *
     * @param selection the selection config block
     */
    public static SelectionSettings fromConfig(Config selection) {
        try {
            return new SelectionSettings(
                    new BigDecimal(selection.getString("initial-threshold")),
                    new BigDecimal(selection.getString("min-threshold")),
                    new BigDecimal(selection.getString("step")),
                    new BigDecimal(selection.getString("fallback-threshold")),
                    selection.getDouble("candidates-per-sequence"),
                    selection.getInt("min-candidates-floor"));
        } catch (ConfigException | NumberFormatException e) {
            throw new ConfigurationException("Invalid selection settings: " + e.getMessage(), e);
        }
    }

    /**
     * @param numInputSequences number of query inputs screened
     * @return {@code max(floor, ceil(numInputSequences × candidatesPerSequence))}
     */
    public int minCandidates(int numInputSequences) {
        int wanted = (int) Math.ceil(numInputSequences * candidatesPerSequence);
        return Math.max(minCandidatesFloor, wanted);
    }

    public SelectionSettings withInitialThreshold(BigDecimal threshold) {
        return new SelectionSettings(threshold, minThreshold, step, fallbackThreshold,
                candidatesPerSequence, minCandidatesFloor);
    }
}
