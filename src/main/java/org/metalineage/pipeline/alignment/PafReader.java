package org.metalineage.pipeline.alignment;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.zip.GZIPInputStream;

import org.metalineage.pipeline.api.errors.InputException;
import org.metalineage.pipeline.api.model.AlignmentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams {@link AlignmentRecord}s from a PAF file in file order.
 * <p>
 * Every call to {@link #iterator()} reopens the file, so the reader can be iterated any
 * number of times. Files ending in {@code .gz} are decompressed on the fly. Blank lines
 * and lines starting with {@code #} are ignored; lines with fewer than 11 tab-separated
 * fields or with unparseable numbers are skipped and counted as malformed. A missing
 * mapping quality column yields {@link AlignmentRecord#MAPQ_UNAVAILABLE}.
 */
public class PafReader implements Iterable<AlignmentRecord> {

    private static final Logger log = LoggerFactory.getLogger(PafReader.class);

    static final int MIN_FIELDS = 11;

    private final Path file;
    private volatile PafParseStats lastStats = new PafParseStats();

    public PafReader(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    /**
     * @return counts of the most recently started pass
     */
    public PafParseStats lastStats() {
        return lastStats;
    }

    /**
     * Opens a new pass over the file. The returned iterator closes the file once exhausted;
     * callers that stop early should close it themselves.
     *
     * @throws InputException if the file cannot be opened
     */
    @Override
    public RecordIterator iterator() {
        PafParseStats stats = new PafParseStats();
        lastStats = stats;
        try {
            return new RecordIterator(open(file), stats);
        } catch (IOException e) {
            throw new InputException("Cannot read alignment file " + file + ": " + e.getMessage(), e);
        }
    }

    static BufferedReader open(Path file) throws IOException {
        InputStream in = Files.newInputStream(file);
        if (file.getFileName().toString().endsWith(".gz")) {
            try {
                in = new GZIPInputStream(in, 1 << 16);
            } catch (IOException e) {
                in.close();
                throw e;
            }
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), 1 << 16);
    }

    /**
     * Parses one PAF line.
     *
     * @return the record, or {@code null} if the line is malformed
     */
    static AlignmentRecord parseLine(String line) {
        String[] f = line.split("\t", -1);
        if (f.length < MIN_FIELDS) {
            return null;
        }
        try {
            int mapq = AlignmentRecord.MAPQ_UNAVAILABLE;
            if (f.length > MIN_FIELDS && !f[11].isBlank()) {
                mapq = Integer.parseInt(f[11].trim());
            }
            return new AlignmentRecord(
                    f[0],
                    Integer.parseInt(f[1].trim()),
                    Integer.parseInt(f[2].trim()),
                    Integer.parseInt(f[3].trim()),
                    AlignmentRecord.Strand.parse(f[4].trim()),
                    f[5],
                    Long.parseLong(f[6].trim()),
                    Long.parseLong(f[7].trim()),
                    Long.parseLong(f[8].trim()),
                    Integer.parseInt(f[9].trim()),
                    Integer.parseInt(f[10].trim()),
                    mapq);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * One pass over the file.
     */
    public final class RecordIterator implements Iterator<AlignmentRecord>, Closeable {

        private final BufferedReader reader;
        private final PafParseStats stats;
        private AlignmentRecord next;
        private boolean closed;

        RecordIterator(BufferedReader reader, PafParseStats stats) {
            this.reader = reader;
            this.stats = stats;
        }

        public PafParseStats stats() {
            return stats;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (closed) {
                return false;
            }
            try {
                String line;
                while ((line = reader.readLine()) != null) {
                    stats.line();
                    if (line.isBlank() || line.startsWith("#")) {
                        stats.ignored();
                        continue;
                    }
                    AlignmentRecord parsed = parseLine(line);
                    if (parsed == null) {
                        stats.malformed();
                        if (log.isTraceEnabled()) {
                            log.trace("Skipping malformed PAF line {} in {}", stats.getLines(), file);
                        }
                        continue;
                    }
                    stats.record();
                    next = parsed;
                    return true;
                }
                close();
                return false;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed reading " + file, e);
            }
        }

        @Override
        public AlignmentRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            AlignmentRecord result = next;
            next = null;
            return result;
        }

        @Override
        public void close() throws IOException {
            if (!closed) {
                closed = true;
                reader.close();
            }
        }
    }
}
