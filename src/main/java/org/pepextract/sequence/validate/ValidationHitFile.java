/**
 *
 */
package org.pepextract.sequence.validate;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.pepextract.io.SafeFiles;
import org.pepextract.io.TabbedLineReader;

/**
 * This class reads and writes headerless validation-engine output files (query ID, subject ID, percent identity,
 * alignment length, e-value, bit score).
 *
 * @author Bruce Parrello
 *
 */
public class ValidationHitFile {

    /** number of columns in a hit line */
    public static final int COLUMNS = 6;

    /**
     * Read all the hits in a file, in file order.
     *
     * @param inFile	validation output file
     *
     * @return a list of the hits
     *
     * @throws IOException
     */
    public static List<ValidationHit> read(File inFile) throws IOException {
        List<ValidationHit> retVal = new ArrayList<ValidationHit>();
        try (TabbedLineReader inStream = new TabbedLineReader(inFile, COLUMNS)) {
            for (TabbedLineReader.Line line : inStream)
                retVal.add(new ValidationHit(line));
        }
        return retVal;
    }

    /**
     * Count the hit lines in a file.  A missing file has no hits.
     *
     * @param inFile	validation output file
     *
     * @return the number of non-blank lines
     *
     * @throws IOException
     */
    public static int count(File inFile) throws IOException {
        int retVal = 0;
        if (inFile.isFile()) {
            try (LineIterator iter = FileUtils.lineIterator(inFile, StandardCharsets.UTF_8.name())) {
                while (iter.hasNext()) {
                    if (! iter.next().isBlank())
                        retVal++;
                }
            }
        }
        return retVal;
    }

    /**
     * Write hits to a file.  The file is published atomically.
     *
     * @param outFile	output file
     * @param hits		hits to write
     *
     * @throws IOException
     */
    public static void write(File outFile, Collection<ValidationHit> hits) throws IOException {
        File tempFile = SafeFiles.tempFor(outFile);
        try (PrintWriter writer = new PrintWriter(tempFile, StandardCharsets.UTF_8)) {
            for (ValidationHit hit : hits)
                writer.println(hit.toLine());
        }
        SafeFiles.commit(tempFile, outFile);
    }

}
