/**
 *
 */
package org.pepextract.sequence.validate;

import java.io.File;

/**
 * This object contains the parameters for a validation-engine search.  The setters can be chained.
 *
 * @author Bruce Parrello
 *
 */
public class ValidationParms {

    // FIELDS
    /** reference database */
    private File database;
    /** maximum number of hits per query */
    private int maxTargets;
    /** maximum e-value */
    private double maxE;
    /** TRUE for sensitive mode, FALSE for fast mode */
    private boolean sensitive;
    /** number of worker threads */
    private int threads;

    /**
     * Construct the default parameters.
     */
    public ValidationParms() {
        this.database = null;
        this.maxTargets = 5;
        this.maxE = 1e-3;
        this.sensitive = true;
        this.threads = 8;
    }

    /**
     * Specify the reference database.
     *
     * @param database	database file
     */
    public ValidationParms database(File database) {
        this.database = database;
        return this;
    }

    /**
     * Specify the maximum number of hits per query.
     *
     * @param maxTargets	new maximum
     */
    public ValidationParms maxTargets(int maxTargets) {
        this.maxTargets = maxTargets;
        return this;
    }

    /**
     * Specify the maximum e-value.
     *
     * @param maxE	new maximum
     */
    public ValidationParms maxE(double maxE) {
        this.maxE = maxE;
        return this;
    }

    /**
     * Specify sensitive or fast mode.
     *
     * @param sensitive		TRUE for sensitive mode
     */
    public ValidationParms sensitive(boolean sensitive) {
        this.sensitive = sensitive;
        return this;
    }

    /**
     * Specify the number of worker threads.
     *
     * @param threads	thread count
     */
    public ValidationParms threads(int threads) {
        this.threads = threads;
        return this;
    }

    public File getDatabase() {
        return this.database;
    }

    public int getMaxTargets() {
        return this.maxTargets;
    }

    public double getMaxE() {
        return this.maxE;
    }

    public boolean isSensitive() {
        return this.sensitive;
    }

    public int getThreads() {
        return this.threads;
    }

    @Override
    public String toString() {
        return "max-targets=" + this.maxTargets + ", evalue=" + this.maxE + ", sensitive=" + this.sensitive;
    }

}
