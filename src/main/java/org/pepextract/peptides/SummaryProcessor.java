/**
 *
 */
package org.pepextract.peptides;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.pepextract.pipeline.CompletionRecord;
import org.pepextract.pipeline.CompletionRecordStore;
import org.pepextract.pipeline.ExtractionTask;
import org.pepextract.reports.SummaryTableReporter;
import org.pepextract.utils.BaseReportProcessor;
import org.pepextract.utils.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This command produces a summary table from the completion records in a directory.  There is one row per record,
 * with the unit ID in the first column.
 *
 * The positional parameter is the name of the directory containing the completion records.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	show more detailed progress messages
 * -w	working directory for relative file names; the default is the current directory
 * -o	output file for the report, if not STDOUT
 *
 * --stage	stage whose records should be summarized; the default is "EXTRACT"
 *
 * @author Bruce Parrello
 *
 */
public class SummaryProcessor extends BaseReportProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SummaryProcessor.class);

    // COMMAND-LINE OPTIONS

    /** stage to summarize */
    @Option(name = "--stage", metaVar = "EXTRACT", usage = "stage whose completion records should be summarized")
    private String stage;

    /** completion record directory */
    @Argument(index = 0, metaVar = "recordDir", usage = "directory containing completion records", required = true)
    private File recordDir;

    @Override
    protected void setReporterDefaults() {
        this.stage = ExtractionTask.STAGE;
    }

    @Override
    protected void validateReporterParms() throws IOException, ConfigurationException {
        this.recordDir = this.resolve(this.recordDir);
        if (! this.recordDir.isDirectory())
            throw new ConfigurationException("Record directory " + this.recordDir + " is not found or invalid.");
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        CompletionRecordStore store = new CompletionRecordStore(this.recordDir);
        List<CompletionRecord> records = store.list(this.stage);
        if (records.isEmpty())
            throw new ConfigurationException("No " + this.stage + " completion records found in " + this.recordDir + ".");
        log.info("{} records found for stage {}.", records.size(), this.stage);
        try (SummaryTableReporter reporter = new SummaryTableReporter(writer)) {
            reporter.write(records);
        }
    }

}
