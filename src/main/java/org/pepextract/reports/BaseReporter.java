/**
 *
 */
package org.pepextract.reports;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * This is the base class for reports.  It provides simple formatted-output methods on top of a print writer.
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseReporter implements AutoCloseable {

    // FIELDS
    /** output writer */
    private final PrintWriter writer;
    /** TRUE if we own the writer and must close it */
    private final boolean owned;

    /**
     * Construct a report on an output stream.
     *
     * @param output	output stream
     */
    public BaseReporter(OutputStream output) {
        this.writer = new PrintWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
        this.owned = true;
    }

    /**
     * Construct a report on an existing writer.  The writer is flushed but not closed when the report closes.
     *
     * @param writer	output writer
     */
    public BaseReporter(PrintWriter writer) {
        this.writer = writer;
        this.owned = false;
    }

    /**
     * Write a line of text exactly as given.
     *
     * @param line	text to write
     */
    protected void println(String line) {
        this.writer.println(line);
    }

    @Override
    public void close() {
        if (this.owned)
            this.writer.close();
        else
            this.writer.flush();
    }

}
