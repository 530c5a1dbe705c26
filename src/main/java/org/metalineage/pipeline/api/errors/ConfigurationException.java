package org.metalineage.pipeline.api.errors;

/**
 * Thrown when a setting or a required input file makes the run impossible to start,
 * e.g. a non-positive candidate cap, a missing hierarchy file or an unparsable
 * configuration value. Always fatal.
 */
public class ConfigurationException extends PipelineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
