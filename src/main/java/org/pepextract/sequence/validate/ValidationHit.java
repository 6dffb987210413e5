/**
 *
 */
package org.pepextract.sequence.validate;

import java.io.IOException;

import org.pepextract.io.TabbedLineReader;
import org.pepextract.pipeline.TargetSet;

/**
 * This object represents a single hit from the validation engine.  The subject ID is kept exactly as the engine
 * reported it; use {@link #getCanonicalSubject()} for target comparisons.  A hit read from engine output also
 * keeps the original line, so that it can be written back unchanged.
 *
 * @author Bruce Parrello
 *
 */
public class ValidationHit {

    // FIELDS
    /** ID of the query (translated) sequence */
    private final String queryId;
    /** raw ID of the subject (reference) sequence */
    private final String subjectId;
    /** percent identity */
    private final double percentIdentity;
    /** alignment length */
    private final int length;
    /** expectation value */
    private final double evalue;
    /** bit score */
    private final double bitScore;
    /** output line for this hit */
    private final String text;

    /**
     * Construct a validation hit.
     *
     * @param queryId			query sequence ID
     * @param subjectId			raw subject sequence ID
     * @param percentIdentity	percent identity (0 to 100)
     * @param length			alignment length
     * @param evalue			expectation value
     * @param bitScore			bit score
     */
    public ValidationHit(String queryId, String subjectId, double percentIdentity, int length, double evalue, double bitScore) {
        this.queryId = queryId;
        this.subjectId = subjectId;
        this.percentIdentity = percentIdentity;
        this.length = length;
        this.evalue = evalue;
        this.bitScore = bitScore;
        this.text = String.format("%s\t%s\t%s\t%d\t%s\t%s", queryId, subjectId, formatNumber(percentIdentity),
                length, Double.toString(evalue), formatNumber(bitScore));
    }

    /**
     * Construct a validation hit from an engine output line.
     *
     * @param line		input line with the six standard columns
     *
     * @throws IOException
     */
    public ValidationHit(TabbedLineReader.Line line) throws IOException {
        this.queryId = line.get(0).strip();
        this.subjectId = line.get(1).strip();
        this.percentIdentity = line.getDouble(2);
        this.length = line.getInt(3);
        this.evalue = line.getDouble(4);
        this.bitScore = line.getDouble(5);
        this.text = line.getText();
    }

    /**
     * @return the query sequence ID
     */
    public String getQueryId() {
        return this.queryId;
    }

    /**
     * @return the raw subject sequence ID
     */
    public String getSubjectId() {
        return this.subjectId;
    }

    /**
     * @return the canonical subject ID
     */
    public String getCanonicalSubject() {
        return TargetSet.canonical(this.subjectId);
    }

    /**
     * @return the percent identity
     */
    public double getPercentIdentity() {
        return this.percentIdentity;
    }

    /**
     * @return the alignment length
     */
    public int getLength() {
        return this.length;
    }

    /**
     * @return the expectation value
     */
    public double getEvalue() {
        return this.evalue;
    }

    /**
     * @return the bit score
     */
    public double getBitScore() {
        return this.bitScore;
    }

    /**
     * @return this hit as an output line in the engine's format
     */
    public String toLine() {
        return this.text;
    }

    /**
     * @return a number formatted without a trailing ".0" when it is integral
     *
     * @param value		number to format
     */
    private static String formatNumber(double value) {
        String retVal;
        if (value == Math.rint(value) && ! Double.isInfinite(value))
            retVal = Long.toString((long) value);
        else
            retVal = Double.toString(value);
        return retVal;
    }

    @Override
    public String toString() {
        return this.queryId + "->" + this.subjectId;
    }

}
