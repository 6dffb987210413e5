/**
 *
 */
package org.pepextract.pipeline;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

import org.pepextract.io.SafeFilesTest;

import junit.framework.TestCase;

/**
 * Test completion records, the record store, and the stage barrier.
 *
 * @author Bruce Parrello
 *
 */
public class CompletionRecordTest extends TestCase {

    /**
     * test building and parsing records
     */
    public void testRecord() {
        CompletionRecord record = new CompletionRecord.Builder("EXTRACT", "S1", CompletionStatus.SUCCESS)
                .put("READS_ASSIGNED", 12).put("NOTE", "two\nlines").build();
        assertThat(record.getStage(), equalTo("EXTRACT"));
        assertThat(record.getUnit(), equalTo("S1"));
        assertThat(record.getStatus(), equalTo(CompletionStatus.SUCCESS));
        assertThat(record.getInt("READS_ASSIGNED"), equalTo(12));
        assertThat(record.getInt("MISSING"), equalTo(0));
        assertThat(record.get("NOTE"), equalTo("two lines"));
        List<String> lines = record.toLines();
        assertThat(lines, contains("STAGE: EXTRACT", "SAMPLE: S1", "STATUS: SUCCESS", "READS_ASSIGNED: 12", "NOTE: two lines"));
        CompletionRecord copy = CompletionRecord.parse(lines).get();
        assertThat(copy.getFields(), equalTo(record.getFields()));
        assertThat(copy.getUnit(), equalTo("S1"));
        try {
            new CompletionRecord.Builder("EXTRACT", "S1", CompletionStatus.SUCCESS).put("STATUS", "x");
            fail("Reserved key accepted.");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("STATUS"));
        }
    }

    /**
     * test malformed records
     */
    public void testMalformed() {
        assertTrue(CompletionRecord.parse(Arrays.asList("STAGE: EXTRACT", "SAMPLE: S1")).isEmpty());
        assertTrue(CompletionRecord.parse(Arrays.asList("STAGE: EXTRACT", "STATUS: RUNNING")).isEmpty());
        assertTrue(CompletionRecord.parse(Arrays.asList("STAGE: EXTRACT", "garbage", "STATUS: SUCCESS")).isEmpty());
        assertTrue(CompletionRecord.parse(Arrays.asList("STATUS: SUCCESS")).isEmpty());
        Optional<CompletionRecord> record = CompletionRecord.parse(Arrays.asList("", "STAGE: EXTRACT", "STATUS: NO_INPUT", ""));
        assertTrue(record.isPresent());
        assertThat(record.get().getUnit(), nullValue());
        assertFalse(record.get().getStatus().isOk());
        assertTrue(CompletionStatus.NO_TARGET_READS.isOk());
    }

    /**
     * test the record store and barrier
     *
     * @throws IOException
     * @throws InterruptedException
     * @throws TimeoutException
     */
    public void testStore() throws IOException, TimeoutException, InterruptedException {
        File tempDir = SafeFilesTest.createTempDir();
        try {
            File recordDir = new File(tempDir, "flags");
            CompletionRecordStore store = new CompletionRecordStore(recordDir);
            assertTrue(recordDir.isDirectory());
            assertThat(store.getFile("EXTRACT", "S1").getName(), equalTo("S1_extract_completed.flag"));
            assertThat(store.getFile("VALIDATE", null).getName(), equalTo("validate_completed.flag"));
            List<String> units = Arrays.asList("S1", "S2", "S3");
            StageBarrier barrier = new StageBarrier(store, "EXTRACT", units);
            assertFalse(barrier.isOpen());
            store.write(new CompletionRecord.Builder("EXTRACT", "S2", CompletionStatus.NO_TARGET_READS).build());
            store.write(new CompletionRecord.Builder("EXTRACT", "S1", CompletionStatus.SUCCESS).put("N", 1).build());
            assertThat(store.getUnfinished("EXTRACT", units), contains("S3"));
            try {
                barrier.await(Duration.ofMillis(10), Duration.ZERO);
                fail("Barrier opened with an unfinished unit.");
            } catch (TimeoutException e) {
                assertThat(e.getMessage(), containsString("S3"));
            }
            // A partial record does not count.
            SafeFilesTest.writeText(store.getFile("EXTRACT", "S3"), "STAGE: EXTRACT\nSAMPLE: S3\n");
            assertFalse(barrier.isOpen());
            store.reset("EXTRACT", "S3");
            store.write(new CompletionRecord.Builder("EXTRACT", "S3", CompletionStatus.INPUT_MISSING).build());
            assertTrue(barrier.isOpen());
            barrier.await(Duration.ofMillis(10), Duration.ZERO);
            // Records cannot be overwritten without a reset.
            try {
                store.write(new CompletionRecord.Builder("EXTRACT", "S3", CompletionStatus.SUCCESS).build());
                fail("Record overwritten.");
            } catch (IllegalStateException e) {
                assertThat(e.getMessage(), containsString("already exists"));
            }
            // The stage-level record is not listed with the units.
            store.write(new CompletionRecord.Builder("EXTRACT", null, CompletionStatus.SUCCESS).build());
            List<CompletionRecord> records = store.list("EXTRACT");
            assertThat(records.size(), equalTo(3));
            assertThat(records.get(0).getUnit(), equalTo("S1"));
            assertThat(records.get(0).get("N"), equalTo("1"));
            assertThat(records.get(2).getStatus(), equalTo(CompletionStatus.INPUT_MISSING));
            assertTrue(store.read("EXTRACT", null).isPresent());
            assertTrue(store.read("VALIDATE", "S1").isEmpty());
            assertTrue(store.reset("EXTRACT", "S1"));
            assertFalse(store.reset("EXTRACT", "S1"));
            assertFalse(barrier.isOpen());
        } finally {
            SafeFilesTest.deleteTempDir(tempDir);
        }
    }

    /**
     * test a barrier that opens while waiting
     *
     * @throws Exception
     */
    public void testBarrierWait() throws Exception {
        File tempDir = SafeFilesTest.createTempDir();
        try {
            CompletionRecordStore store = new CompletionRecordStore(tempDir);
            StageBarrier barrier = new StageBarrier(store, "EXTRACT", Arrays.asList("S1"));
            Thread writer = new Thread(() -> {
                try {
                    Thread.sleep(100);
                    store.write(new CompletionRecord.Builder("EXTRACT", "S1", CompletionStatus.SUCCESS).build());
                } catch (Exception e) {
                    throw new RuntimeException(e);
                }
            });
            writer.start();
            barrier.await(Duration.ofMillis(20), Duration.ofSeconds(30));
            writer.join();
            assertTrue(barrier.isOpen());
        } finally {
            SafeFilesTest.deleteTempDir(tempDir);
        }
    }

}
