package org.metalineage.pipeline.api.errors;

import java.time.Instant;

/**
 * A recoverable condition under which the pipeline continued with reduced result quality.
 * <p>
 * Unlike the exceptions in this package, a warning never aborts a stage. Components that
 * enter a degraded mode log the warning at WARN level and hand it to the run report.
 *
 * @param code      stable identifier of the degraded mode
 * @param message   human-readable description
 * @param timestamp when the degraded mode was entered
 */
public record DegradedModeWarning(Code code, String message, Instant timestamp) {

    /**
     * The degraded modes the pipeline knows about.
     */
    public enum Code {
        /** Threshold search exhausted without reaching the minimum candidate count. */
        THRESHOLD_FALLBACK,
        /** The whole run resolved no query; first-hit assignment was used instead. */
        FIRST_HIT_FALLBACK,
        /** The accession-to-taxid map could not be read and was treated as empty. */
        TAXONOMY_MAP_UNAVAILABLE
    }

    public static DegradedModeWarning of(Code code, String message) {
        return new DegradedModeWarning(code, message, Instant.now());
    }
}
