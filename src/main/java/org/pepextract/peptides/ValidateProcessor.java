/**
 *
 */
package org.pepextract.peptides;

import java.io.File;
import java.io.IOException;

import org.kohsuke.args4j.Option;
import org.pepextract.pipeline.CompletionRecord;
import org.pepextract.pipeline.SampleManifest;
import org.pepextract.pipeline.ValidationController;
import org.pepextract.utils.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This command runs the validation stage.  The extracted DNA sequences from all the samples are combined and
 * deduplicated, translated in six frames, and searched against the validation database.  The hits are filtered,
 * and the sequences with acceptable hits are renamed by target and written as the final protein FASTA.  In rerun
 * mode, the existing search output is reused and only the filtering and output steps are performed.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	show more detailed progress messages
 * -w	working directory for relative file names; the default is the current directory
 * -t	name of the target ID file; the default is "target_ids.txt"
 * -d	output directory; the default is "peptides"
 * -i	directory containing the extraction output; the default is "dna_sequences"
 * -m	if specified, a sample manifest; all of its samples must finish extraction before validation can start
 *
 * --db				validation protein database (required unless --rerun is specified)
 * --diamond		validation search program; the default is "diamond"
 * --maxTargets		maximum number of database hits per query; the default is 5
 * --evalue			maximum e-value for a hit; the default is 1e-3
 * --pident			minimum percent identity for an accepted hit; the default is 90
 * --minLen			minimum alignment length for an accepted hit; the default is 7
 * --sensitive		use the sensitive search mode
 * --rerun			reuse the previous validation output if it exists
 * --threads		number of threads for the validation search; the default is 8
 * --translator		six-frame translation engine; the default is NATIVE
 * --toolkit		sequence toolkit for deduplication; the default is NATIVE
 * --wait			maximum seconds to wait for unfinished samples; the default is 0 (check once)
 * --poll			seconds between checks for unfinished samples; the default is 60
 *
 * @author Bruce Parrello
 *
 */
public class ValidateProcessor extends ValidationBaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ValidateProcessor.class);
    /** sample manifest, or NULL if there is none */
    private SampleManifest manifest;

    // COMMAND-LINE OPTIONS

    /** extraction output directory */
    @Option(name = "-i", aliases = { "--inDir" }, metaVar = "dna_sequences", usage = "directory containing the extraction output")
    private File inDir;

    /** sample manifest file */
    @Option(name = "-m", aliases = { "--manifest" }, metaVar = "samples.tbl", usage = "sample manifest to wait on")
    private File manifestFile;

    @Override
    protected void setDefaults() {
        this.setupDefaults();
        this.inDir = new File(ExtractProcessor.DEFAULT_OUT_DIR);
        this.manifestFile = null;
        this.manifest = null;
    }

    @Override
    protected boolean validateParms() throws IOException, ConfigurationException {
        this.validateCommonParms();
        this.inDir = this.resolve(this.inDir);
        if (! this.inDir.isDirectory())
            throw new ConfigurationException("Extraction directory " + this.inDir + " is not found or invalid.");
        if (this.manifestFile != null)
            this.manifest = SampleManifest.load(this.resolve(this.manifestFile));
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        ValidationController controller = this.buildController(this.inDir, this.getOutDir(), this.manifest);
        CompletionRecord record = controller.run();
        log.info("Final output is in {}.", new File(this.getOutDir(), record.get("FORMATTED_OUTPUT_FILE")));
    }

}
