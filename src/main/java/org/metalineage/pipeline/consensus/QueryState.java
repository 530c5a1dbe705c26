package org.metalineage.pipeline.consensus;

/**
 * Per-query lifecycle: NEW → COLLECTING → RESOLVING → RESOLVED | UNRESOLVED.
 * A query without alignments goes from NEW straight to RESOLVING.
 */
public enum QueryState {
    NEW,
    COLLECTING,
    RESOLVING,
    RESOLVED,
    UNRESOLVED;

    public boolean isTerminal() {
        return this == RESOLVED || this == UNRESOLVED;
    }
}
