package org.metalineage.pipeline.selection;

import java.math.BigDecimal;

/**
 * Outcome of the adaptive threshold search for one reference database.
 *
 * @param threshold      threshold that selects the candidates (hits scoring strictly above it)
 * @param candidateCount number of hits above the threshold
 * @param iterations     thresholds tried before stopping
 * @param degraded       {@code true} when the search was exhausted and the fallback threshold applies
 */
public record ThresholdSearchResult(BigDecimal threshold, int candidateCount, int iterations, boolean degraded) {
}
