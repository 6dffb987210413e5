/**
 *
 */
package org.pepextract.pipeline;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;
import org.pepextract.io.SafeFilesTest;
import org.pepextract.utils.ConfigurationException;

import junit.framework.TestCase;

/**
 * Test the sample manifest.
 *
 * @author Bruce Parrello
 *
 */
public class SampleManifestTest extends TestCase {

    /**
     * test scanning, saving and reloading a manifest
     *
     * @throws IOException
     * @throws ConfigurationException
     */
    public void testScanAndSave() throws IOException, ConfigurationException {
        File tempDir = SafeFilesTest.createTempDir();
        try {
            File alignRoot = new File(tempDir, "align");
            // Create the sample directories out of order, plus some noise.
            for (String id : new String[] { "S3", "S1", "S2" })
                FileUtils.forceMkdir(new File(alignRoot, id + SampleManifest.SAMPLE_DIR_SUFFIX));
            FileUtils.forceMkdir(new File(alignRoot, "other_dir"));
            FileUtils.touch(new File(alignRoot, "S9" + SampleManifest.SAMPLE_DIR_SUFFIX + ".txt"));
            File fastqDir = new File(tempDir, "fastq");
            SampleManifest manifest = SampleManifest.scan(alignRoot, fastqDir, SampleManifest.DEFAULT_FASTQ_SUFFIX);
            assertThat(manifest.size(), equalTo(3));
            assertThat(manifest.getSampleIds(), contains("S1", "S2", "S3"));
            Sample sample = manifest.get(2);
            assertThat(sample.getIndex(), equalTo(2));
            assertThat(sample.getId(), equalTo("S2"));
            assertThat(sample.getAlignmentFile(), equalTo(new File(new File(alignRoot, "S2_humann_temp"), "S2_diamond_aligned.tsv")));
            assertThat(sample.getRawFile(), equalTo(new File(fastqDir, "S2.fastq.gz")));
            try {
                manifest.get(4);
                fail("Invalid index accepted.");
            } catch (ConfigurationException e) {
                assertThat(e.getMessage(), containsString("out of range"));
            }
            // Save and reload.
            File manifestFile = new File(tempDir, "samples.tbl");
            manifest.save(manifestFile);
            SampleManifest loaded = SampleManifest.load(manifestFile);
            assertThat(loaded.getSampleIds(), contains("S1", "S2", "S3"));
            for (int i = 1; i <= 3; i++) {
                Sample original = manifest.get(i);
                Sample copy = loaded.get(i);
                assertThat(copy.getIndex(), equalTo(i));
                assertThat(copy.getAlignmentFile().getAbsoluteFile(), equalTo(original.getAlignmentFile().getAbsoluteFile()));
                assertThat(copy.getRawFile().getAbsoluteFile(), equalTo(original.getRawFile().getAbsoluteFile()));
            }
            // The manifest does not change when the directory does.
            FileUtils.forceMkdir(new File(alignRoot, "S0" + SampleManifest.SAMPLE_DIR_SUFFIX));
            loaded = SampleManifest.load(manifestFile);
            assertThat(loaded.get(1).getId(), equalTo("S1"));
        } finally {
            SafeFilesTest.deleteTempDir(tempDir);
        }
    }

    /**
     * test invalid manifests
     *
     * @throws IOException
     */
    public void testErrors() throws IOException {
        File tempDir = SafeFilesTest.createTempDir();
        try {
            try {
                SampleManifest.scan(tempDir, tempDir, ".fq");
                fail("Empty alignment root accepted.");
            } catch (ConfigurationException e) {
                assertThat(e.getMessage(), containsString("No sample directories"));
            }
            File badFile = new File(tempDir, "bad.tbl");
            SafeFilesTest.writeText(badFile, "index\tsample_id\talignment_table\traw_sequences\n2\tS2\ta.tsv\tb.fq\n");
            try {
                SampleManifest.load(badFile);
                fail("Out-of-order manifest accepted.");
            } catch (ConfigurationException e) {
                assertThat(e.getMessage(), containsString("out of order"));
            }
            try {
                SampleManifest.load(new File(tempDir, "missing.tbl"));
                fail("Missing manifest accepted.");
            } catch (ConfigurationException e) {
                assertThat(e.getMessage(), containsString("not found"));
            }
        } finally {
            SafeFilesTest.deleteTempDir(tempDir);
        }
    }

}
