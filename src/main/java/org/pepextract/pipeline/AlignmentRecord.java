/**
 *
 */
package org.pepextract.pipeline;

/**
 * This object represents one read-to-reference assignment from an alignment table.
 *
 * @author Bruce Parrello
 *
 */
public class AlignmentRecord {

    // FIELDS
    /** read ID, possibly with an instrument suffix */
    private final String readId;
    /** raw reference ID */
    private final String referenceId;

    public AlignmentRecord(String readId, String referenceId) {
        this.readId = readId;
        this.referenceId = referenceId;
    }

    /**
     * @return the read ID as it appears in the alignment table
     */
    public String getReadId() {
        return this.readId;
    }

    /**
     * @return the raw reference ID
     */
    public String getReferenceId() {
        return this.referenceId;
    }

    /**
     * @return the canonical reference ID, for comparison to target IDs
     */
    public String getCanonicalReference() {
        return TargetSet.canonical(this.referenceId);
    }

}
