package org.metalineage.pipeline.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.metalineage.pipeline.api.errors.ExternalToolException;

@Tag("integration")
@EnabledOnOs({OS.LINUX, OS.MAC})
class ExternalCommandTest {

    @TempDir
    Path tempDir;

    private final ExternalCommand runner = new ExternalCommand();

    @Test
    void redirectsStdoutToFileInWorkDir() {
        Path out = tempDir.resolve("out.txt");

        runner.run(List.of("sh", "-c", "pwd; echo hello"), out, tempDir);

        assertThat(out).content().contains("hello").contains(tempDir.getFileName().toString());
    }

    @Test
    void nonZeroExitCarriesCodeAndStderrTail() {
        assertThatThrownBy(() -> runner.run(List.of("sh", "-c", "echo bad input >&2; exit 3"), null, null))
                .isInstanceOf(ExternalToolException.class)
                .hasMessageContaining("exited with code 3")
                .hasMessageContaining("bad input")
                .satisfies(e -> assertThat(((ExternalToolException) e).getExitCode()).isEqualTo(3));
    }

    @Test
    void missingExecutableIsAToolFailure() {
        assertThatThrownBy(() -> runner.run(List.of("definitely-not-a-real-tool-4711"), null, null))
                .isInstanceOf(ExternalToolException.class)
                .satisfies(e -> assertThat(((ExternalToolException) e).getExitCode()).isEqualTo(-1));
    }
}
