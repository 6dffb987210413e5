/**
 *
 */
package org.pepextract.peptides;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.pepextract.io.SafeFilesTest;
import org.pepextract.pipeline.CompletionRecordStore;
import org.pepextract.pipeline.CompletionStatus;
import org.pepextract.pipeline.ExtractionTask;
import org.pepextract.pipeline.SampleManifest;
import org.pepextract.pipeline.ValidationController;
import org.pepextract.utils.ConfigurationException;
import org.pepextract.utils.ParseFailureException;

import junit.framework.TestCase;

/**
 * Test the command processors.
 *
 * @author Bruce Parrello
 *
 */
public class CommandTest extends TestCase {

    /**
     * Set up an alignment root with two samples.  S1 uses the test data files, S2 has no alignment table.
     *
     * @param workDir	working directory
     *
     * @throws IOException
     */
    private static void setupWorkDir(File workDir) throws IOException {
        File alignRoot = new File(workDir, "align");
        File s1Dir = new File(alignRoot, "S1" + SampleManifest.SAMPLE_DIR_SUFFIX);
        FileUtils.copyFile(new File("data", "S1_diamond_aligned.tsv"), new File(s1Dir, "S1" + SampleManifest.ALIGNMENT_SUFFIX));
        FileUtils.forceMkdir(new File(alignRoot, "S2" + SampleManifest.SAMPLE_DIR_SUFFIX));
        FileUtils.copyFile(new File("data", "S1.fastq"), new File(new File(workDir, "fastq"), "S1.fastq"));
        FileUtils.copyFile(new File("data", "targets.txt"), new File(workDir, ExtractProcessor.DEFAULT_TARGETS));
    }

    /**
     * test the manifest, extract and summary commands
     *
     * @throws IOException
     * @throws ConfigurationException
     */
    public void testExtractCommands() throws IOException, ConfigurationException {
        File workDir = SafeFilesTest.createTempDir();
        try {
            setupWorkDir(workDir);
            String wd = workDir.getPath();
            ManifestProcessor manifestCmd = new ManifestProcessor();
            assertTrue(manifestCmd.parseCommand(new String[] { "-w", wd, "--fastqDir", "fastq", "--suffix", ".fastq", "align" }));
            manifestCmd.run();
            assertThat(manifestCmd.getExitCode(), equalTo(0));
            File manifestFile = new File(workDir, ManifestProcessor.DEFAULT_MANIFEST);
            assertThat(SampleManifest.load(manifestFile).getSampleIds(), contains("S1", "S2"));
            // Extract the first sample.
            ExtractProcessor extractCmd = new ExtractProcessor();
            assertTrue(extractCmd.parseCommand(new String[] { "-w", wd, "--index", "1" }));
            extractCmd.run();
            assertThat(extractCmd.getExitCode(), equalTo(0));
            File outDir = new File(workDir, ExtractProcessor.DEFAULT_OUT_DIR);
            CompletionRecordStore store = new CompletionRecordStore(outDir);
            assertThat(store.read(ExtractionTask.STAGE, "S1").get().getInt(ExtractionTask.SEQUENCES_EXTRACTED), equalTo(3));
            // The second sample has no alignment table.
            extractCmd = new ExtractProcessor();
            assertTrue(extractCmd.parseCommand(new String[] { "-w", wd, "--index", "2" }));
            extractCmd.run();
            assertThat(extractCmd.getExitCode(), equalTo(3));
            assertThat(store.read(ExtractionTask.STAGE, "S2").get().getStatus(), equalTo(CompletionStatus.NO_INPUT));
            // A bad index fails validation.
            extractCmd = new ExtractProcessor();
            assertFalse(extractCmd.parseCommand(new String[] { "-w", wd, "--index", "5" }));
            assertThat(extractCmd.getExitCode(), equalTo(2));
            // Summarize the records.
            SummaryProcessor summaryCmd = new SummaryProcessor();
            assertTrue(summaryCmd.parseCommand(new String[] { "-w", wd, "-o", "summary.tsv", ExtractProcessor.DEFAULT_OUT_DIR }));
            summaryCmd.run();
            assertThat(summaryCmd.getExitCode(), equalTo(0));
            List<String> lines = FileUtils.readLines(new File(workDir, "summary.tsv"), StandardCharsets.UTF_8);
            assertThat(lines.size(), equalTo(3));
            assertThat(lines.get(0), startsWith("SAMPLE\t"));
            assertThat(lines.get(1), startsWith("S1\t"));
            assertThat(lines.get(2), startsWith("S2\t"));
        } finally {
            SafeFilesTest.deleteTempDir(workDir);
        }
    }

    /**
     * test the validate command in rerun mode
     *
     * @throws IOException
     */
    public void testValidateRerun() throws IOException {
        File workDir = SafeFilesTest.createTempDir();
        try {
            FileUtils.copyFile(new File("data", "targets.txt"), new File(workDir, ExtractProcessor.DEFAULT_TARGETS));
            File outDir = new File(workDir, "peptides");
            FileUtils.forceMkdir(new File(workDir, ExtractProcessor.DEFAULT_OUT_DIR));
            // Without a database, a validation run is only possible as a rerun.
            ValidateProcessor validateCmd = new ValidateProcessor();
            assertFalse(validateCmd.parseCommand(new String[] { "-w", workDir.getPath() }));
            assertThat(validateCmd.getExitCode(), equalTo(2));
            // A rerun with no previous output becomes a full run, which still needs the database.
            validateCmd = new ValidateProcessor();
            assertTrue(validateCmd.parseCommand(new String[] { "-w", workDir.getPath(), "--rerun" }));
            validateCmd.run();
            assertThat(validateCmd.getExitCode(), equalTo(2));
            assertFalse(new File(outDir, ValidationController.FINAL_NAME).exists());
            // The search modes are exclusive.
            validateCmd = new ValidateProcessor();
            assertFalse(validateCmd.parseCommand(new String[] { "-w", workDir.getPath(), "--rerun", "--sensitive", "--fast" }));
            assertThat(validateCmd.getExitCode(), equalTo(2));
            // Set up a previous run's output.
            FileUtils.copyFile(new File("data", "hits.tsv"), new File(outDir, ValidationController.VALIDATION_NAME));
            SafeFilesTest.writeText(new File(outDir, ValidationController.TRANSLATED_NAME),
                    ">q1_frame=1\nMKPGF\n>q1_frame=2\nMQQ\n>q2_frame=1\nMRR\n");
            validateCmd = new ValidateProcessor();
            assertTrue(validateCmd.parseCommand(new String[] { "-w", workDir.getPath(), "--rerun" }));
            validateCmd.run();
            assertThat(validateCmd.getExitCode(), equalTo(0));
            String finalText = FileUtils.readFileToString(new File(outDir, ValidationController.FINAL_NAME), StandardCharsets.UTF_8);
            assertThat(finalText, equalTo(">X1_1 GN=X1_1\nMKPGF\n>X2_1 GN=X2_1\nMQQ\n"));
            CompletionRecordStore store = new CompletionRecordStore(outDir);
            assertThat(store.read(ValidationController.STAGE, null).get().get("MODE"), equalTo("RERUN"));
        } finally {
            SafeFilesTest.deleteTempDir(workDir);
        }
    }

    /**
     * test the array task index
     *
     * @throws ParseFailureException
     */
    public void testIndex() throws ParseFailureException {
        assertThat(ExtractProcessor.indexFromEnvironment(" 7 "), equalTo(7));
        try {
            ExtractProcessor.indexFromEnvironment(null);
            fail("Missing index accepted.");
        } catch (ParseFailureException e) {
            assertThat(e.getMessage(), containsString(ExtractProcessor.INDEX_VARIABLE));
        }
        try {
            ExtractProcessor.indexFromEnvironment("x");
            fail("Invalid index accepted.");
        } catch (ParseFailureException e) {
            assertThat(e.getExitCode(), equalTo(2));
        }
    }

}
