/**
 *
 */
package org.pepextract.pipeline;

/**
 * States of a per-sample extraction task.  The terminal states map to a completion status.
 *
 * @author Bruce Parrello
 *
 */
public enum ExtractionState {
    PENDING(null),
    SCANNED(null),
    READS_SELECTED(null),
    SEQUENCES_RETRIEVED(null),
    /** no alignment table */
    NO_INPUT(CompletionStatus.NO_INPUT),
    /** no reads assigned to targets */
    NO_TARGET_READS(CompletionStatus.NO_TARGET_READS),
    /** no raw read file */
    INPUT_MISSING(CompletionStatus.INPUT_MISSING),
    COMPLETED(CompletionStatus.SUCCESS);

    /** completion status for a terminal state, NULL for an intermediate one */
    private final CompletionStatus status;

    private ExtractionState(CompletionStatus status) {
        this.status = status;
    }

    /**
     * @return TRUE if this is a terminal state
     */
    public boolean isTerminal() {
        return this.status != null;
    }

    /**
     * @return the completion status for this state (NULL if it is not terminal)
     */
    public CompletionStatus getStatus() {
        return this.status;
    }

}
