package org.metalineage.pipeline.api.errors;

/**
 * Base class for all failures raised by the classification pipeline.
 * <p>
 * The pipeline uses unchecked exceptions throughout: every subclass signals a condition
 * that aborts the current stage. Per-record problems (malformed alignment lines, unmapped
 * accessions) never surface as exceptions; they are counted and logged instead.
 */
public class PipelineException extends RuntimeException {

    /**
     * Creates a PipelineException with the specified message.
     *
     * @param message Description of the failure
     */
    public PipelineException(String message) {
        super(message);
    }

    /**
     * Creates a PipelineException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
