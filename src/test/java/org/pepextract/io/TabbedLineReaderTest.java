/**
 *
 */
package org.pepextract.io;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;

/**
 * Test the tab-delimited file reader.
 *
 * @author Bruce Parrello
 *
 */
public class TabbedLineReaderTest extends TestCase {

    /**
     * test a headerless file
     *
     * @throws IOException
     */
    public void testHeaderless() throws IOException {
        List<String> reads = new ArrayList<String>();
        List<Integer> lineNums = new ArrayList<Integer>();
        try (TabbedLineReader inStream = new TabbedLineReader(new File("data", "S1_diamond_aligned.tsv"), 2)) {
            for (TabbedLineReader.Line line : inStream) {
                reads.add(line.get(0));
                lineNums.add(line.getLineNum());
                assertThat(line.size(), equalTo(3));
                assertThat(line.get(5), equalTo(""));
            }
        }
        assertThat(reads, contains("read1|151", "read2|151", "read3", "read4", "read1|151"));
        assertThat(lineNums, contains(1, 2, 3, 4, 7));
    }

    /**
     * test a file with headers
     *
     * @throws IOException
     */
    public void testHeaders() throws IOException {
        File tempDir = SafeFilesTest.createTempDir();
        try {
            File inFile = new File(tempDir, "test.tbl");
            SafeFilesTest.writeText(inFile, "name\tcount\tscore\nalpha\t12\t1.5\nbeta\tx\t\n");
            try (TabbedLineReader inStream = new TabbedLineReader(inFile)) {
                int nameCol = inStream.findField("name");
                int countCol = inStream.findField("count");
                int scoreCol = inStream.findField("score");
                assertThat(countCol, equalTo(1));
                TabbedLineReader.Line line = inStream.next();
                assertThat(line.get(nameCol), equalTo("alpha"));
                assertThat(line.getInt(countCol), equalTo(12));
                assertThat(line.getDouble(scoreCol), closeTo(1.5, 1e-9));
                line = inStream.next();
                assertThat(line.get(scoreCol), equalTo(""));
                try {
                    line.getInt(countCol);
                    fail("Invalid integer accepted.");
                } catch (IOException e) {
                    assertThat(e.getMessage(), containsString("line 3"));
                }
                assertFalse(inStream.hasNext());
                try {
                    inStream.findField("missing");
                    fail("Missing field found.");
                } catch (IOException e) {
                    assertThat(e.getMessage(), containsString("missing"));
                }
            }
        } finally {
            SafeFilesTest.deleteTempDir(tempDir);
        }
    }

}
