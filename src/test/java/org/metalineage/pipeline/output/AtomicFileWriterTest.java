package org.metalineage.pipeline.output;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
class AtomicFileWriterTest {

    @TempDir
    Path tempDir;

    private long fileCount() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.count();
        }
    }

    @Test
    void writesContentAndCreatesParents() throws IOException {
        Path target = tempDir.resolve("nested/out.txt");

        AtomicFileWriter.write(target, out -> out.write("hello"));

        assertThat(target).hasContent("hello");
    }

    @Test
    void failedWriteKeepsPreviousContentAndNoTempFile() throws IOException {
        Path target = tempDir.resolve("out.txt");
        Files.writeString(target, "previous");

        assertThatThrownBy(() -> AtomicFileWriter.write(target, out -> {
            out.write("partial");
            throw new IOException("disk full");
        })).isInstanceOf(IOException.class).hasMessage("disk full");

        assertThat(target).hasContent("previous");
        assertThat(fileCount()).isEqualTo(1);
    }

    @Test
    void failedFirstWriteLeavesNoTarget() throws IOException {
        Path target = tempDir.resolve("out.txt");

        assertThatThrownBy(() -> AtomicFileWriter.write(target, out -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(target).doesNotExist();
        assertThat(fileCount()).isZero();
    }

    @Test
    @DisplayName("A failure in one file of a set leaves every target untouched")
    void failedSetWriteReplacesNothing() throws IOException {
        Path first = tempDir.resolve("classified_sequences.tsv");
        Path second = tempDir.resolve("profile.txt");
        Files.writeString(first, "old classification");
        Map<Path, AtomicFileWriter.ContentWriter> contents = new LinkedHashMap<>();
        contents.put(first, out -> out.write("new classification"));
        contents.put(second, out -> {
            throw new IOException("profile failed");
        });

        assertThatThrownBy(() -> AtomicFileWriter.writeAll(contents)).hasMessage("profile failed");

        assertThat(first).hasContent("old classification");
        assertThat(second).doesNotExist();
        assertThat(fileCount()).isEqualTo(1);
    }

    @Test
    void setWriteReplacesAllTargets() throws IOException {
        Map<Path, AtomicFileWriter.ContentWriter> contents = new LinkedHashMap<>();
        contents.put(tempDir.resolve("a.txt"), out -> out.write("a"));
        contents.put(tempDir.resolve("sub/b.txt"), out -> out.write("b"));

        AtomicFileWriter.writeAll(contents);

        assertThat(tempDir.resolve("a.txt")).hasContent("a");
        assertThat(tempDir.resolve("sub/b.txt")).hasContent("b");
    }
}
