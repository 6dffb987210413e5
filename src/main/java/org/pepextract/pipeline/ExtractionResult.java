/**
 *
 */
package org.pepextract.pipeline;

import java.io.File;
import java.time.Duration;

/**
 * This object describes the outcome of a per-sample extraction task.
 *
 * @author Bruce Parrello
 *
 */
public class ExtractionResult {

    // FIELDS
    /** ID of the sample */
    private final String sampleId;
    /** terminal state of the task */
    private final ExtractionState state;
    /** number of distinct reads assigned to targets */
    private final int readsAssigned;
    /** number of sequences actually retrieved */
    private final int sequencesExtracted;
    /** output FASTA file, or NULL if there is none */
    private final File outputFile;
    /** elapsed time */
    private final Duration duration;

    public ExtractionResult(String sampleId, ExtractionState state, int readsAssigned, int sequencesExtracted,
            File outputFile, Duration duration) {
        this.sampleId = sampleId;
        this.state = state;
        this.readsAssigned = readsAssigned;
        this.sequencesExtracted = sequencesExtracted;
        this.outputFile = outputFile;
        this.duration = duration;
    }

    /**
     * @return the sample ID
     */
    public String getSampleId() {
        return this.sampleId;
    }

    /**
     * @return the terminal state
     */
    public ExtractionState getState() {
        return this.state;
    }

    /**
     * @return the completion status
     */
    public CompletionStatus getStatus() {
        return this.state.getStatus();
    }

    /**
     * @return the number of distinct reads assigned to targets
     */
    public int getReadsAssigned() {
        return this.readsAssigned;
    }

    /**
     * @return the number of sequences retrieved
     */
    public int getSequencesExtracted() {
        return this.sequencesExtracted;
    }

    /**
     * @return the output FASTA file, or NULL if no sequences were written
     */
    public File getOutputFile() {
        return this.outputFile;
    }

    /**
     * @return the elapsed time
     */
    public Duration getDuration() {
        return this.duration;
    }

}
