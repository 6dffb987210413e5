/**
 *
 */
package org.pepextract.peptides;

import java.io.File;
import java.io.IOException;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.pepextract.pipeline.SampleManifest;
import org.pepextract.utils.BaseProcessor;
import org.pepextract.utils.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This command scans an alignment root directory for sample directories and writes the sample manifest.  Each
 * sample directory is named "XXXX_humann_temp", where "XXXX" is the sample ID, and contains an alignment table named
 * "XXXX_diamond_aligned.tsv".  The manifest assigns each sample a 1-based index, which is used by the "extract"
 * command to select the sample to process.
 *
 * The positional parameter is the name of the alignment root directory.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	show more detailed progress messages
 * -w	working directory for relative file names; the default is the current directory
 * -o	name of the output manifest file; the default is "samples.tbl" in the working directory
 *
 * --fastqDir	directory containing the raw read files; the default is the alignment root
 * --suffix		suffix for raw read file names; the default is ".fastq.gz"
 *
 * @author Bruce Parrello
 *
 */
public class ManifestProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ManifestProcessor.class);

    /** default manifest file name */
    public static final String DEFAULT_MANIFEST = "samples.tbl";

    // COMMAND-LINE OPTIONS

    /** output manifest file */
    @Option(name = "-o", aliases = { "--output", "--manifest" }, metaVar = "samples.tbl", usage = "output manifest file")
    private File outFile;

    /** raw read file directory */
    @Option(name = "--fastqDir", metaVar = "fastq", usage = "directory containing the raw read files (default is alignment root)")
    private File fastqDir;

    /** raw read file suffix */
    @Option(name = "--suffix", metaVar = ".fastq.gz", usage = "suffix for raw read file names")
    private String fastqSuffix;

    /** alignment root directory */
    @Argument(index = 0, metaVar = "alignRoot", usage = "directory containing the sample alignment directories", required = true)
    private File alignRoot;

    @Override
    protected void setDefaults() {
        this.outFile = new File(DEFAULT_MANIFEST);
        this.fastqDir = null;
        this.fastqSuffix = SampleManifest.DEFAULT_FASTQ_SUFFIX;
    }

    @Override
    protected boolean validateParms() throws IOException, ConfigurationException {
        this.alignRoot = this.resolve(this.alignRoot);
        if (! this.alignRoot.isDirectory())
            throw new ConfigurationException("Alignment root " + this.alignRoot + " is not found or invalid.");
        if (this.fastqDir == null)
            this.fastqDir = this.alignRoot;
        else {
            this.fastqDir = this.resolve(this.fastqDir);
            if (! this.fastqDir.isDirectory())
                throw new ConfigurationException("Raw read directory " + this.fastqDir + " is not found or invalid.");
        }
        this.outFile = this.resolve(this.outFile);
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        SampleManifest manifest = SampleManifest.scan(this.alignRoot, this.fastqDir, this.fastqSuffix);
        manifest.save(this.outFile);
        log.info("Submit extraction tasks with indices 1-{}.", manifest.size());
    }

}
