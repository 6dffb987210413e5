/**
 *
 */
package org.pepextract.pipeline;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.pepextract.io.SafeFilesTest;
import org.pepextract.sequence.SequenceToolkit;
import org.pepextract.sequence.SequenceToolkitTest;
import org.pepextract.utils.DownstreamToolException;
import org.pepextract.utils.NoDataException;

import junit.framework.TestCase;

/**
 * Test the combination and deduplication of extraction output.
 *
 * @author Bruce Parrello
 *
 */
public class AggregationStageTest extends TestCase {

    /**
     * Write a sample's extraction output and record.
     *
     * @param inDir		extraction directory
     * @param store		record store
     * @param sampleId	sample ID
     * @param fasta		FASTA text for the sample output, or NULL if there is none
     * @param status	completion status
     *
     * @throws IOException
     */
    public static void writeSample(File inDir, CompletionRecordStore store, String sampleId, String fasta,
            CompletionStatus status) throws IOException {
        int count = 0;
        CompletionRecord.Builder builder = new CompletionRecord.Builder(ExtractionTask.STAGE, sampleId, status);
        if (fasta != null) {
            File outFile = new File(ExtractionTask.sampleDir(inDir, sampleId), ExtractionTask.OUTPUT_NAME);
            SafeFilesTest.writeText(outFile, fasta);
            count = (int) fasta.chars().filter(c -> c == '>').count();
            builder.put(ExtractionTask.OUTPUT_FILE, sampleId + "_dna_seqs/" + ExtractionTask.OUTPUT_NAME);
        }
        builder.put(ExtractionTask.SEQUENCES_EXTRACTED, count);
        store.write(builder.build());
    }

    /**
     * test combining samples
     *
     * @throws IOException
     * @throws NoDataException
     * @throws DownstreamToolException
     */
    public void testAggregate() throws IOException, NoDataException, DownstreamToolException {
        File tempDir = SafeFilesTest.createTempDir();
        try {
            File inDir = new File(tempDir, "in");
            File outDir = new File(tempDir, "out");
            CompletionRecordStore store = new CompletionRecordStore(inDir);
            writeSample(inDir, store, "S1", ">r1\nACGTAC\n>r2\nGGGCCC\n", CompletionStatus.SUCCESS);
            writeSample(inDir, store, "S2", null, CompletionStatus.NO_TARGET_READS);
            writeSample(inDir, store, "S3", ">r3\nACGTAC\n>r4\nTTTAAA\n", CompletionStatus.SUCCESS);
            writeSample(inDir, store, "S4", null, CompletionStatus.INPUT_MISSING);
            List<CompletionRecord> records = store.list(ExtractionTask.STAGE);
            SequenceToolkit toolkit = SequenceToolkit.Type.NATIVE.create(outDir);
            AggregationStage aggregator = new AggregationStage(inDir, outDir, toolkit);
            assertThat(aggregator.getSampleFile(records.get(0)),
                    equalTo(new File(new File(inDir, "S1_dna_seqs"), "target_dna_sequences.fa")));
            AggregationStage.Result result = aggregator.run(records);
            assertThat(result.getSamplesUsed(), equalTo(2));
            assertThat(result.getCombinedCount(), equalTo(4));
            assertThat(result.getDedupCount(), equalTo(3));
            assertThat(SequenceToolkitTest.readLabels(new File(outDir, AggregationStage.COMBINED_NAME)),
                    contains("r1", "r2", "r3", "r4"));
            assertThat(SequenceToolkitTest.readLabels(new File(outDir, AggregationStage.DEDUP_NAME)),
                    contains("r1", "r2", "r4"));
        } finally {
            SafeFilesTest.deleteTempDir(tempDir);
        }
    }

    /**
     * test aggregation when no sample has sequences
     *
     * @throws IOException
     * @throws DownstreamToolException
     */
    public void testNoData() throws IOException, DownstreamToolException {
        File tempDir = SafeFilesTest.createTempDir();
        try {
            File inDir = new File(tempDir, "in");
            File outDir = new File(tempDir, "out");
            CompletionRecordStore store = new CompletionRecordStore(inDir);
            for (String sampleId : Arrays.asList("S1", "S2", "S3"))
                writeSample(inDir, store, sampleId, null, CompletionStatus.NO_TARGET_READS);
            AggregationStage aggregator = new AggregationStage(inDir, outDir,
                    SequenceToolkit.Type.NATIVE.create(outDir));
            try {
                aggregator.run(store.list(ExtractionTask.STAGE));
                fail("Aggregation succeeded with no sequences.");
            } catch (NoDataException e) {
                assertThat(e.getExitCode(), equalTo(4));
            }
        } finally {
            SafeFilesTest.deleteTempDir(tempDir);
        }
    }

}
