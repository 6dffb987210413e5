/**
 *
 */
package org.pepextract.sequence;

import java.util.Objects;

/**
 * This object represents a single sequence read from a FASTA or FASTQ file.  The label is the first word of the
 * header and the comment is the remainder.
 *
 * @author Bruce Parrello
 *
 */
public class Sequence {

    // FIELDS
    /** sequence identifier */
    private String label;
    /** comment text (may be empty) */
    private String comment;
    /** sequence letters */
    private String sequence;

    /**
     * Construct a new sequence.
     *
     * @param label		sequence ID
     * @param comment	comment string
     * @param sequence	sequence letters
     */
    public Sequence(String label, String comment, String sequence) {
        this.label = label;
        this.comment = (comment == null ? "" : comment);
        this.sequence = sequence;
    }

    /**
     * @return the sequence label
     */
    public String getLabel() {
        return this.label;
    }

    /**
     * @return the comment
     */
    public String getComment() {
        return this.comment;
    }

    /**
     * @return the sequence letters
     */
    public String getSequence() {
        return this.sequence;
    }

    /**
     * @return the length of the sequence
     */
    public int length() {
        return this.sequence.length();
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.comment, this.label, this.sequence);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Sequence))
            return false;
        Sequence other = (Sequence) obj;
        return Objects.equals(this.comment, other.comment) && Objects.equals(this.label, other.label)
                && Objects.equals(this.sequence, other.sequence);
    }

    @Override
    public String toString() {
        return this.label;
    }

}
