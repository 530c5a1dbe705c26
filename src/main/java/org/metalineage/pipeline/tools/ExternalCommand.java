package org.metalineage.pipeline.tools;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.metalineage.pipeline.api.errors.ExternalToolException;
import org.metalineage.pipeline.api.errors.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external tool as a subprocess and waits for it.
 * <p>
 * Standard error is drained on a separate thread, logged at DEBUG and its last lines kept
 * for the failure message. A nonzero exit raises {@link ExternalToolException}.
 * Interrupting the waiting thread destroys the process.
 */
public class ExternalCommand {

    private static final Logger log = LoggerFactory.getLogger(ExternalCommand.class);
    private static final int STDERR_TAIL_LINES = 20;

    /**
     * Runs a command.
     *
     * @param command    executable and arguments
     * @param stdoutFile file receiving standard output, or {@code null} to discard it
     * @param workDir    working directory, or {@code null} for the current one
     * @throws ExternalToolException if the process cannot start or exits nonzero
     * @throws PipelineException     if the calling thread is interrupted
     */
    public void run(List<String> command, Path stdoutFile, Path workDir) {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workDir != null) {
            builder.directory(workDir.toFile());
        }
        builder.redirectOutput(stdoutFile != null
                ? ProcessBuilder.Redirect.to(stdoutFile.toFile())
                : ProcessBuilder.Redirect.DISCARD);
        builder.redirectInput(ProcessBuilder.Redirect.PIPE);

        log.debug("Running {}", String.join(" ", command));
        Process process;
        try {
            process = builder.start();
            process.getOutputStream().close();
        } catch (IOException e) {
            throw new ExternalToolException("Failed to start " + command.get(0) + ": " + e.getMessage(), command, e);
        }

        Deque<String> tail = new ArrayDeque<>();
        Thread drain = new Thread(() -> drainStderr(process, command.get(0), tail), "stderr-" + command.get(0));
        drain.setDaemon(true);
        drain.start();

        int exitCode;
        try {
            exitCode = process.waitFor();
            drain.join();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while running " + command.get(0), e);
        }

        if (exitCode != 0) {
            String stderr;
            synchronized (tail) {
                stderr = String.join(System.lineSeparator(), tail);
            }
            throw new ExternalToolException(command.get(0) + " exited with code " + exitCode
                    + (stderr.isEmpty() ? "" : ": " + stderr), command, exitCode);
        }
    }

    private static void drainStderr(Process process, String tool, Deque<String> tail) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[{}] {}", tool, line);
                synchronized (tail) {
                    if (tail.size() == STDERR_TAIL_LINES) {
                        tail.removeFirst();
                    }
                    tail.addLast(line);
                }
            }
        } catch (IOException e) {
            log.debug("Stopped reading stderr of {}: {}", tool, e.getMessage());
        }
    }
}
