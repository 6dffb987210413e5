/**
 *
 */
package org.pepextract.pipeline;

/**
 * Terminal status of a unit of work.
 *
 * @author Bruce Parrello
 *
 */
public enum CompletionStatus {
    /** the unit produced output */
    SUCCESS(true),
    /** the sample had no reads assigned to targets; this is a normal, empty result */
    NO_TARGET_READS(true),
    /** the sample's alignment table was missing */
    NO_INPUT(false),
    /** the sample's raw read file was missing */
    INPUT_MISSING(false);

    /** TRUE if this status represents a successful outcome */
    private final boolean ok;

    private CompletionStatus(boolean ok) {
        this.ok = ok;
    }

    /**
     * @return TRUE if this status represents a successful outcome (possibly empty)
     */
    public boolean isOk() {
        return this.ok;
    }

}
