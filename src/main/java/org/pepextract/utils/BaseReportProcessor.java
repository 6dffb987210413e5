/**
 *
 */
package org.pepextract.utils;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;

import org.kohsuke.args4j.Option;

/**
 * This is a base class for commands that produce a report.  The report goes to the standard output unless
 * an output file is specified.
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseReportProcessor extends BaseProcessor {

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "-o", aliases = { "--output" }, metaVar = "report.tbl", usage = "output file for report (if not STDOUT)")
    private File outFile;

    @Override
    protected final void setDefaults() {
        this.outFile = null;
        this.setReporterDefaults();
    }

    @Override
    protected final boolean validateParms() throws IOException, PipelineException {
        this.validateReporterParms();
        return true;
    }

    @Override
    protected final void runCommand() throws Exception {
        File realOut = this.resolve(this.outFile);
        if (realOut == null) {
            PrintWriter writer = new PrintWriter(System.out);
            this.runReporter(writer);
            writer.flush();
        } else {
            log.info("Report will be written to {}.", realOut);
            try (OutputStream outStream = new FileOutputStream(realOut);
                    PrintWriter writer = new PrintWriter(outStream)) {
                this.runReporter(writer);
            }
        }
    }

    /**
     * Set the defaults for the reporter's own parameters.
     */
    protected abstract void setReporterDefaults();

    /**
     * Validate the reporter's own parameters.
     *
     * @throws IOException
     * @throws PipelineException
     */
    protected abstract void validateReporterParms() throws IOException, PipelineException;

    /**
     * Produce the report.
     *
     * @param writer	output writer for the report
     *
     * @throws Exception
     */
    protected abstract void runReporter(PrintWriter writer) throws Exception;

}
