/**
 *
 */
package org.pepextract.pipeline;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.pepextract.io.SafeFiles;
import org.pepextract.sequence.FastaInputStream;
import org.pepextract.sequence.FastaOutputStream;
import org.pepextract.sequence.Sequence;
import org.pepextract.sequence.SequenceToolkit;
import org.pepextract.utils.DownstreamToolException;
import org.pepextract.utils.NoDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This stage combines the output of all the successful extraction tasks and removes duplicate sequences.  Samples
 * are combined in completion-record order, and only samples with a SUCCESS status and a nonzero sequence count are
 * used.  Duplicates are removed by sequence content, keeping the first header.
 *
 * @author Bruce Parrello
 *
 */
public class AggregationStage {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(AggregationStage.class);
    /** directory containing the extraction output */
    private final File inDir;
    /** directory for the combined output */
    private final File outDir;
    /** sequence toolkit for deduplication */
    private final SequenceToolkit toolkit;

    /** name of the combined DNA file */
    public static final String COMBINED_NAME = "combined_dna_sequences.fa";
    /** name of the deduplicated DNA file */
    public static final String DEDUP_NAME = "deduplicated_dna_sequences.fa";

    /**
     * This object contains the counts produced by the stage.
     */
    public static class Result {

        /** number of samples that contributed sequences */
        private final int samplesUsed;
        /** number of sequences combined */
        private final int combinedCount;
        /** number of unique sequences */
        private final int dedupCount;

        protected Result(int samplesUsed, int combinedCount, int dedupCount) {
            this.samplesUsed = samplesUsed;
            this.combinedCount = combinedCount;
            this.dedupCount = dedupCount;
        }

        /**
         * @return the number of samples that contributed sequences
         */
        public int getSamplesUsed() {
            return this.samplesUsed;
        }

        /**
         * @return the number of sequences combined
         */
        public int getCombinedCount() {
            return this.combinedCount;
        }

        /**
         * @return the number of unique sequences
         */
        public int getDedupCount() {
            return this.dedupCount;
        }

    }

    /**
     * Construct an aggregation stage.
     *
     * @param inDir		directory containing the extraction output and records
     * @param outDir	directory for the combined output
     * @param toolkit	sequence toolkit for deduplication
     */
    public AggregationStage(File inDir, File outDir, SequenceToolkit toolkit) {
        this.inDir = inDir;
        this.outDir = outDir;
        this.toolkit = toolkit;
    }

    /**
     * @return the extraction output file for a sample record
     *
     * @param record	extraction completion record
     */
    public File getSampleFile(CompletionRecord record) {
        String relName = record.get(ExtractionTask.OUTPUT_FILE);
        File retVal;
        if (relName != null)
            retVal = new File(this.inDir, relName);
        else
            retVal = new File(ExtractionTask.sampleDir(this.inDir, record.getUnit()), ExtractionTask.OUTPUT_NAME);
        return retVal;
    }

    /**
     * Combine and deduplicate the extraction output.
     *
     * @param records	extraction completion records, in processing order
     *
     * @return the counts for the stage
     *
     * @throws IOException
     * @throws NoDataException if there are no sequences to combine
     * @throws DownstreamToolException if deduplication fails
     */
    public Result run(List<CompletionRecord> records) throws IOException, NoDataException, DownstreamToolException {
        FileUtils.forceMkdir(this.outDir);
        File combinedFile = new File(this.outDir, COMBINED_NAME);
        File tempFile = SafeFiles.tempFor(combinedFile);
        int samplesUsed = 0;
        int combined = 0;
        try (FastaOutputStream outStream = new FastaOutputStream(tempFile)) {
            for (CompletionRecord record : records) {
                File sampleFile = this.getSampleFile(record);
                if (record.getStatus() != CompletionStatus.SUCCESS || record.getInt(ExtractionTask.SEQUENCES_EXTRACTED) == 0)
                    log.debug("Sample {} has no sequences ({}).", record.getUnit(), record.getStatus());
                else if (! SafeFiles.isNonEmpty(sampleFile))
                    log.warn("Sample {} reports sequences but {} is missing or empty.", record.getUnit(), sampleFile);
                else {
                    try (FastaInputStream inStream = new FastaInputStream(sampleFile)) {
                        for (Sequence seq : inStream) {
                            outStream.write(seq);
                            combined++;
                        }
                    }
                    samplesUsed++;
                }
            }
        }
        SafeFiles.commit(tempFile, combinedFile);
        log.info("{} DNA sequences combined from {} of {} samples.", combined, samplesUsed, records.size());
        if (combined == 0)
            throw new NoDataException("No DNA sequences found to process in " + records.size() + " samples.");
        File dedupFile = new File(this.outDir, DEDUP_NAME);
        File dedupTemp = SafeFiles.tempFor(dedupFile);
        int unique = this.toolkit.deduplicate(combinedFile, dedupTemp);
        SafeFiles.commit(dedupTemp, dedupFile);
        log.info("After deduplication: {} unique DNA sequences.", unique);
        return new Result(samplesUsed, combined, unique);
    }

}
