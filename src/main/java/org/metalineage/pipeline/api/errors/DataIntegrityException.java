package org.metalineage.pipeline.api.errors;

/**
 * Thrown when the taxonomy hierarchy violates its tree invariants: a parent taxid that is
 * not part of the hierarchy (orphan) or a parent chain that loops back on itself (cycle).
 * <p>
 * Always fatal: lineages and LCAs computed over a broken tree would be silently wrong.
 */
public class DataIntegrityException extends PipelineException {

    private final int taxid;

    /**
     * @param message Description of the violation
     * @param taxid The taxid at which the violation was detected
     */
    public DataIntegrityException(String message, int taxid) {
        super(message);
        this.taxid = taxid;
    }

    /**
     * @return the taxid at which the violation was detected
     */
    public int getTaxid() {
        return taxid;
    }
}
