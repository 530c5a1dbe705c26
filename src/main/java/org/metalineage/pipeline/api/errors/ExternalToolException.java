package org.metalineage.pipeline.api.errors;

import java.util.List;

/**
 * Thrown when an external collaborator (screener, downloader, aligner) exits with a
 * nonzero status or cannot be started.
 * <p>
 * The orchestrator retries stages failing with this exception a bounded number of times
 * before the failure becomes fatal.
 */
public class ExternalToolException extends PipelineException {

    private final List<String> command;
    private final int exitCode;

    /**
     * @param message Description of the failure
     * @param command The command line that failed
     * @param exitCode The process exit code, or -1 if the process could not be started
     */
    public ExternalToolException(String message, List<String> command, int exitCode) {
        super(message);
        this.command = List.copyOf(command);
        this.exitCode = exitCode;
    }

    /**
     * @param message Description of the failure
     * @param command The command line that failed
     * @param cause The underlying I/O failure
     */
    public ExternalToolException(String message, List<String> command, Throwable cause) {
        super(message, cause);
        this.command = List.copyOf(command);
        this.exitCode = -1;
    }

    public List<String> getCommand() {
        return command;
    }

    public int getExitCode() {
        return exitCode;
    }
}
