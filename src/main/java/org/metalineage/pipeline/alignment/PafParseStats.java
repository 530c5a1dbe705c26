package org.metalineage.pipeline.alignment;

/**
 * Line counts of one pass over a PAF source.
 * <p>
 * Updated by the single thread iterating the source; read once the pass has finished.
 */
public final class PafParseStats {

    private long lines;
    private long records;
    private long malformed;
    private long ignored;

    void line() {
        lines++;
    }

    void record() {
        records++;
    }

    void malformed() {
        malformed++;
    }

    void ignored() {
        ignored++;
    }

    /** @return every line read, including comments and blanks */
    public long getLines() {
        return lines;
    }

    public long getRecords() {
        return records;
    }

    /** @return lines with fewer than 11 fields or unparseable numbers */
    public long getMalformed() {
        return malformed;
    }

    /** @return comment and blank lines */
    public long getIgnored() {
        return ignored;
    }

    @Override
    public String toString() {
        return String.format("lines=%d records=%d malformed=%d ignored=%d", lines, records, malformed, ignored);
    }
}
