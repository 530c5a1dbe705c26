package org.metalineage.pipeline.api.errors;

/**
 * Thrown when the data handed to a stage cannot produce a result, e.g. every reference
 * database screen came back empty.
 */
public class InputException extends PipelineException {

    public InputException(String message) {
        super(message);
    }

    public InputException(String message, Throwable cause) {
        super(message, cause);
    }
}
