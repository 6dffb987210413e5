/**
 *
 */
package org.pepextract.pipeline;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.time.DurationFormatUtils;
import org.pepextract.io.SafeFiles;
import org.pepextract.sequence.SequenceToolkit;
import org.pepextract.utils.DownstreamToolException;
import org.pepextract.utils.InputMissingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object extracts the reads for one sample.  It scans the sample's alignment table for reads assigned to
 * target IDs, then pulls those reads out of the sample's raw read file and writes them as DNA FASTA.  When it is
 * done, it publishes a completion record for the sample.
 *
 * The task owns the directory "XXXXXX_dna_seqs" in the output root, where XXXXXX is the sample ID.  It is safe to
 * run the task again for the same sample:  the old completion record is removed before any work is done.
 *
 * A sample with no reads assigned to targets is a normal outcome and produces a NO_TARGET_READS record with no
 * output.  A missing alignment table or raw read file produces a failure record and an {@link InputMissingException}.
 *
 * @author Bruce Parrello
 *
 */
public class ExtractionTask {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ExtractionTask.class);
    /** sample to process */
    private final Sample sample;
    /** target IDs */
    private final TargetSet targets;
    /** output root directory */
    private final File outRoot;
    /** sequence toolkit for read extraction */
    private final SequenceToolkit toolkit;
    /** completion record store */
    private final CompletionRecordStore store;
    /** current state */
    private ExtractionState state;
    /** start time in milliseconds */
    private long start;

    /** stage identifier for extraction records */
    public static final String STAGE = "EXTRACT";
    /** name of the output FASTA file in the sample directory */
    public static final String OUTPUT_NAME = "target_dna_sequences.fa";
    /** suffix for the sample output directory */
    public static final String SAMPLE_DIR_SUFFIX = "_dna_seqs";
    /** record field for the completion time */
    public static final String COMPLETED = "COMPLETED";
    /** record field for the target set size */
    public static final String TARGET_IDS = "TARGET_IDS_PROCESSED";
    /** record field for the number of reads assigned to targets */
    public static final String READS_ASSIGNED = "READS_ASSIGNED";
    /** record field for the number of sequences extracted */
    public static final String SEQUENCES_EXTRACTED = "SEQUENCES_EXTRACTED";
    /** record field for the duration in seconds */
    public static final String DURATION_SECONDS = "DURATION_SECONDS";
    /** record field for the formatted duration */
    public static final String DURATION_HUMAN = "DURATION_HUMAN";
    /** record field for the output file, relative to the output root */
    public static final String OUTPUT_FILE = "OUTPUT_FILE";
    /** record field for an error message */
    public static final String ERROR = "ERROR";

    /**
     * Construct an extraction task.
     *
     * @param sample	sample to process
     * @param targets	target ID set
     * @param outRoot	output root directory (also the completion record directory)
     * @param toolkit	sequence toolkit for read extraction
     * @param store		completion record store
     */
    public ExtractionTask(Sample sample, TargetSet targets, File outRoot, SequenceToolkit toolkit, CompletionRecordStore store) {
        this.sample = sample;
        this.targets = targets;
        this.outRoot = outRoot;
        this.toolkit = toolkit;
        this.store = store;
        this.state = ExtractionState.PENDING;
    }

    /**
     * @return the output directory for a sample
     *
     * @param outRoot	output root directory
     * @param sampleId	ID of the sample
     */
    public static File sampleDir(File outRoot, String sampleId) {
        return new File(outRoot, sampleId + SAMPLE_DIR_SUFFIX);
    }

    /**
     * Run the extraction.
     *
     * @return the result of the extraction
     *
     * @throws IOException
     * @throws InputMissingException if the alignment table or raw read file is missing
     * @throws DownstreamToolException if the sequence toolkit fails
     */
    public ExtractionResult run() throws IOException, InputMissingException, DownstreamToolException {
        this.start = System.currentTimeMillis();
        this.state = ExtractionState.PENDING;
        final String sampleId = this.sample.getId();
        log.info("Processing sample {} with {} target IDs.", sampleId, this.targets.size());
        this.store.reset(STAGE, sampleId);
        File sampleDir = sampleDir(this.outRoot, sampleId);
        // Verify that we have an alignment table.
        File alignFile = this.sample.getAlignmentFile();
        if (! SafeFiles.isNonEmpty(alignFile)) {
            String message = "Alignment table " + alignFile + " for sample " + sampleId + " is missing or empty.";
            this.fail(ExtractionState.NO_INPUT, 0, message);
        }
        // Find the reads assigned to targets.
        Set<String> readIds = new LinkedHashSet<String>();
        int recordCount = 0;
        try (AlignmentTable alignments = new AlignmentTable(alignFile)) {
            for (AlignmentRecord record : alignments) {
                recordCount++;
                if (this.targets.contains(record.getCanonicalReference()))
                    readIds.add(record.getReadId());
            }
        }
        this.advance(ExtractionState.SCANNED);
        final int readCount = readIds.size();
        log.info("{} of {} alignment records in sample {} were assigned to targets.", readCount, recordCount, sampleId);
        ExtractionResult retVal;
        if (readCount == 0) {
            // Nothing to extract.  Clear any output from a previous run.
            FileUtils.deleteDirectory(sampleDir);
            this.advance(ExtractionState.NO_TARGET_READS);
            retVal = this.finish(0, 0, null);
        } else {
            this.advance(ExtractionState.READS_SELECTED);
            File rawFile = this.sample.getRawFile();
            if (! SafeFiles.isNonEmpty(rawFile)) {
                String message = "Raw read file " + rawFile + " for sample " + sampleId + " is missing or empty.";
                this.fail(ExtractionState.INPUT_MISSING, readCount, message);
            }
            // Remove the instrument suffixes so the IDs match the raw read headers.
            Set<String> cleanIds = new LinkedHashSet<String>(readCount * 4 / 3 + 1);
            for (String readId : readIds)
                cleanIds.add(TargetSet.canonical(readId));
            FileUtils.forceMkdir(sampleDir);
            File outFile = new File(sampleDir, OUTPUT_NAME);
            File tempFile = SafeFiles.tempFor(outFile);
            int extracted = this.toolkit.extractReads(rawFile, cleanIds, tempFile);
            SafeFiles.commit(tempFile, outFile);
            this.advance(ExtractionState.SEQUENCES_RETRIEVED);
            if (extracted < cleanIds.size())
                log.warn("Only {} of {} assigned reads were found in {}.", extracted, cleanIds.size(), rawFile);
            this.advance(ExtractionState.COMPLETED);
            retVal = this.finish(readCount, extracted, outFile);
        }
        return retVal;
    }

    /**
     * Move to a new state.
     *
     * @param newState	state to enter
     */
    private void advance(ExtractionState newState) {
        log.debug("Sample {}: {} -> {}.", this.sample.getId(), this.state, newState);
        this.state = newState;
    }

    /**
     * Publish the completion record for a successful extraction.
     *
     * @param readCount		number of reads assigned
     * @param extracted		number of sequences extracted
     * @param outFile		output file, or NULL if there is none
     *
     * @return the extraction result
     *
     * @throws IOException
     */
    private ExtractionResult finish(int readCount, int extracted, File outFile) throws IOException {
        Duration duration = Duration.ofMillis(System.currentTimeMillis() - this.start);
        CompletionRecord.Builder builder = this.startRecord(readCount, extracted, duration);
        if (outFile != null)
            builder.put(OUTPUT_FILE, this.outRoot.toPath().relativize(outFile.toPath()).toString());
        this.store.write(builder.build());
        log.info("Sample {} finished with status {}: {} sequences extracted in {}.", this.sample.getId(),
                this.state.getStatus(), extracted, duration);
        return new ExtractionResult(this.sample.getId(), this.state, readCount, extracted, outFile, duration);
    }

    /**
     * Publish a failure record and throw the corresponding exception.
     *
     * @param failState		terminal failure state
     * @param readCount		number of reads assigned so far
     * @param message		description of the failure
     *
     * @throws IOException
     * @throws InputMissingException
     */
    private void fail(ExtractionState failState, int readCount, String message) throws IOException, InputMissingException {
        this.advance(failState);
        Duration duration = Duration.ofMillis(System.currentTimeMillis() - this.start);
        CompletionRecord record = this.startRecord(readCount, 0, duration).put(ERROR, message).build();
        this.store.write(record);
        throw new InputMissingException(message);
    }

    /**
     * @return a record builder filled with the common fields
     *
     * @param readCount		number of reads assigned
     * @param extracted		number of sequences extracted
     * @param duration		elapsed time
     */
    private CompletionRecord.Builder startRecord(int readCount, int extracted, Duration duration) {
        return new CompletionRecord.Builder(STAGE, this.sample.getId(), this.state.getStatus())
                .put(COMPLETED, LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME))
                .put(TARGET_IDS, this.targets.size())
                .put(READS_ASSIGNED, readCount)
                .put(SEQUENCES_EXTRACTED, extracted)
                .put(DURATION_SECONDS, duration.getSeconds())
                .put(DURATION_HUMAN, DurationFormatUtils.formatDuration(duration.toMillis(), "HH:mm:ss"));
    }

    /**
     * @return the current state of the task
     */
    public ExtractionState getState() {
        return this.state;
    }

    /**
     * @return the sample being processed
     */
    public Sample getSample() {
        return this.sample;
    }

}
