/**
 *
 */
package org.pepextract.pipeline;

import java.io.File;
import java.io.IOException;
import java.util.Iterator;

import org.pepextract.io.TabbedLineReader;

/**
 * This class iterates through a headerless alignment table.  The first column is the read ID and the second is
 * the reference ID assigned by the alignment engine.  Any further columns are ignored.
 *
 * @author Bruce Parrello
 *
 */
public class AlignmentTable implements Iterable<AlignmentRecord>, Iterator<AlignmentRecord>, AutoCloseable {

    // FIELDS
    /** input stream */
    private final TabbedLineReader inStream;

    /**
     * Open an alignment table.
     *
     * @param inFile	alignment table file
     *
     * @throws IOException
     */
    public AlignmentTable(File inFile) throws IOException {
        this.inStream = new TabbedLineReader(inFile, 2);
    }

    @Override
    public Iterator<AlignmentRecord> iterator() {
        return this;
    }

    @Override
    public boolean hasNext() {
        return this.inStream.hasNext();
    }

    @Override
    public AlignmentRecord next() {
        TabbedLineReader.Line line = this.inStream.next();
        return new AlignmentRecord(line.get(0).strip(), line.get(1).strip());
    }

    @Override
    public void close() {
        this.inStream.close();
    }

}
