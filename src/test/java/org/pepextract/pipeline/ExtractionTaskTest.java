/**
 *
 */
package org.pepextract.pipeline;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import org.pepextract.io.SafeFilesTest;
import org.pepextract.sequence.SequenceToolkit;
import org.pepextract.sequence.SequenceToolkitTest;
import org.pepextract.utils.DownstreamToolException;
import org.pepextract.utils.InputMissingException;

import junit.framework.TestCase;

/**
 * Test the per-sample extraction task.
 *
 * @author Bruce Parrello
 *
 */
public class ExtractionTaskTest extends TestCase {

    /** alignment table for the test sample */
    private static final File ALIGN_FILE = new File("data", "S1_diamond_aligned.tsv");
    /** raw reads for the test sample */
    private static final File RAW_FILE = new File("data", "S1.fastq");

    /**
     * @return an extraction task for the test sample
     *
     * @param targets	target IDs
     * @param alignFile	alignment table
     * @param rawFile	raw read file
     * @param outDir	output directory
     *
     * @throws IOException
     */
    private static ExtractionTask createTask(TargetSet targets, File alignFile, File rawFile, File outDir) throws IOException {
        Sample sample = new Sample(1, "S1", alignFile, rawFile);
        return new ExtractionTask(sample, targets, outDir, SequenceToolkit.Type.NATIVE.create(outDir),
                new CompletionRecordStore(outDir));
    }

    /**
     * test a sample with target reads
     *
     * @throws IOException
     * @throws InputMissingException
     * @throws DownstreamToolException
     */
    public void testSuccess() throws IOException, InputMissingException, DownstreamToolException {
        File tempDir = SafeFilesTest.createTempDir();
        try {
            TargetSet targets = new TargetSet(Arrays.asList("X1", "X2"));
            ExtractionTask task = createTask(targets, ALIGN_FILE, RAW_FILE, tempDir);
            assertThat(task.getState(), equalTo(ExtractionState.PENDING));
            ExtractionResult result = task.run();
            assertThat(task.getState(), equalTo(ExtractionState.COMPLETED));
            assertThat(result.getStatus(), equalTo(CompletionStatus.SUCCESS));
            assertThat(result.getReadsAssigned(), equalTo(3));
            assertThat(result.getSequencesExtracted(), equalTo(3));
            File outFile = new File(new File(tempDir, "S1_dna_seqs"), "target_dna_sequences.fa");
            assertThat(result.getOutputFile(), equalTo(outFile));
            assertThat(SequenceToolkitTest.readLabels(outFile), contains("read1", "read2", "read3"));
            CompletionRecord record = new CompletionRecordStore(tempDir).read(ExtractionTask.STAGE, "S1").get();
            assertThat(record.getStatus(), equalTo(CompletionStatus.SUCCESS));
            assertThat(record.getInt(ExtractionTask.TARGET_IDS), equalTo(2));
            assertThat(record.getInt(ExtractionTask.READS_ASSIGNED), equalTo(3));
            assertThat(record.getInt(ExtractionTask.SEQUENCES_EXTRACTED), equalTo(3));
            assertThat(record.get(ExtractionTask.OUTPUT_FILE), equalTo("S1_dna_seqs" + File.separator + "target_dna_sequences.fa"));
            assertThat(record.get(ExtractionTask.DURATION_HUMAN), matchesPattern("\\d\\d:\\d\\d:\\d\\d"));
            // Rerun with targets that match nothing.  The old output and record are replaced.
            task = createTask(new TargetSet(Arrays.asList("X5")), ALIGN_FILE, RAW_FILE, tempDir);
            result = task.run();
            assertThat(result.getStatus(), equalTo(CompletionStatus.NO_TARGET_READS));
            assertFalse(outFile.getParentFile().exists());
            record = new CompletionRecordStore(tempDir).read(ExtractionTask.STAGE, "S1").get();
            assertThat(record.getStatus(), equalTo(CompletionStatus.NO_TARGET_READS));
        } finally {
            SafeFilesTest.deleteTempDir(tempDir);
        }
    }

    /**
     * test a sample with no target reads
     *
     * @throws IOException
     * @throws InputMissingException
     * @throws DownstreamToolException
     */
    public void testNoTargetReads() throws IOException, InputMissingException, DownstreamToolException {
        File tempDir = SafeFilesTest.createTempDir();
        try {
            // The raw read file is never opened when no reads are assigned.
            ExtractionTask task = createTask(new TargetSet(Arrays.asList("Q1")), ALIGN_FILE, new File(tempDir, "none.fq"), tempDir);
            ExtractionResult result = task.run();
            assertThat(task.getState(), equalTo(ExtractionState.NO_TARGET_READS));
            assertTrue(task.getState().isTerminal());
            assertThat(result.getSequencesExtracted(), equalTo(0));
            assertThat(result.getOutputFile(), nullValue());
            CompletionRecord record = new CompletionRecordStore(tempDir).read(ExtractionTask.STAGE, "S1").get();
            assertThat(record.getStatus(), equalTo(CompletionStatus.NO_TARGET_READS));
            assertThat(record.getInt(ExtractionTask.SEQUENCES_EXTRACTED), equalTo(0));
            assertThat(record.get(ExtractionTask.OUTPUT_FILE), nullValue());
        } finally {
            SafeFilesTest.deleteTempDir(tempDir);
        }
    }

    /**
     * test missing input files
     *
     * @throws IOException
     * @throws DownstreamToolException
     */
    public void testMissingInput() throws IOException, DownstreamToolException {
        File tempDir = SafeFilesTest.createTempDir();
        try {
            TargetSet targets = new TargetSet(Arrays.asList("X1"));
            CompletionRecordStore store = new CompletionRecordStore(tempDir);
            ExtractionTask task = createTask(targets, new File(tempDir, "missing.tsv"), RAW_FILE, tempDir);
            try {
                task.run();
                fail("Missing alignment table accepted.");
            } catch (InputMissingException e) {
                assertThat(e.getExitCode(), equalTo(3));
            }
            assertThat(task.getState(), equalTo(ExtractionState.NO_INPUT));
            CompletionRecord record = store.read(ExtractionTask.STAGE, "S1").get();
            assertThat(record.getStatus(), equalTo(CompletionStatus.NO_INPUT));
            assertThat(record.get(ExtractionTask.ERROR), containsString("missing.tsv"));
            // Now the raw reads are missing.
            task = createTask(targets, ALIGN_FILE, new File(tempDir, "missing.fastq"), tempDir);
            try {
                task.run();
                fail("Missing raw read file accepted.");
            } catch (InputMissingException e) {
                assertThat(e.getMessage(), containsString("missing.fastq"));
            }
            assertThat(task.getState(), equalTo(ExtractionState.INPUT_MISSING));
            record = store.read(ExtractionTask.STAGE, "S1").get();
            assertThat(record.getStatus(), equalTo(CompletionStatus.INPUT_MISSING));
            assertThat(record.getInt(ExtractionTask.READS_ASSIGNED), equalTo(3));
            assertThat(record.getInt(ExtractionTask.SEQUENCES_EXTRACTED), equalTo(0));
        } finally {
            SafeFilesTest.deleteTempDir(tempDir);
        }
    }

    /**
     * test the alignment table
     *
     * @throws IOException
     */
    public void testAlignmentTable() throws IOException {
        int count = 0;
        try (AlignmentTable table = new AlignmentTable(ALIGN_FILE)) {
            for (AlignmentRecord record : table) {
                count++;
                if (count == 1) {
                    assertThat(record.getReadId(), equalTo("read1|151"));
                    assertThat(record.getReferenceId(), equalTo("X1|foo"));
                    assertThat(record.getCanonicalReference(), equalTo("X1"));
                }
            }
        }
        assertThat(count, equalTo(5));
    }

}
