/**
 *
 */
package org.pepextract.peptides;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.kohsuke.args4j.Option;
import org.pepextract.pipeline.CompletionRecordStore;
import org.pepextract.pipeline.ExtractionResult;
import org.pepextract.pipeline.ExtractionTask;
import org.pepextract.pipeline.Sample;
import org.pepextract.pipeline.SampleManifest;
import org.pepextract.pipeline.TargetSet;
import org.pepextract.sequence.SequenceToolkit;
import org.pepextract.utils.BaseProcessor;
import org.pepextract.utils.ConfigurationException;
import org.pepextract.utils.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This command runs the extraction task for a single sample.  The sample is selected by its 1-based index in the
 * sample manifest.  If no index is specified, it is taken from the SLURM_ARRAY_TASK_ID environment variable, so that
 * the command can be submitted directly as an array job.
 *
 * The reads assigned to target IDs in the sample's alignment table are pulled from its raw read file and written to
 * "XXXX_dna_seqs/target_dna_sequences.fa" in the output directory, where "XXXX" is the sample ID.  A completion record
 * for the sample is written to the output directory in all cases except an unexpected failure.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	show more detailed progress messages
 * -w	working directory for relative file names; the default is the current directory
 * -m	name of the sample manifest file; the default is "samples.tbl"
 * -t	name of the target ID file; the default is "target_ids.txt"
 * -d	output directory; the default is "dna_sequences"
 *
 * --index		1-based index of the sample to process
 * --toolkit	sequence toolkit for read extraction (NATIVE or SEQKIT)
 *
 * @author Bruce Parrello
 *
 */
public class ExtractProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ExtractProcessor.class);
    /** sample to process */
    private Sample sample;
    /** target ID set */
    private TargetSet targets;

    /** environment variable containing the array task index */
    public static final String INDEX_VARIABLE = "SLURM_ARRAY_TASK_ID";
    /** default target ID file name */
    public static final String DEFAULT_TARGETS = "target_ids.txt";
    /** default extraction output directory name */
    public static final String DEFAULT_OUT_DIR = "dna_sequences";

    // COMMAND-LINE OPTIONS

    /** sample manifest file */
    @Option(name = "-m", aliases = { "--manifest" }, metaVar = "samples.tbl", usage = "sample manifest file")
    private File manifestFile;

    /** target ID file */
    @Option(name = "-t", aliases = { "--targets" }, metaVar = "target_ids.txt", usage = "file of target reference IDs")
    private File targetFile;

    /** output directory */
    @Option(name = "-d", aliases = { "--outDir" }, metaVar = "outDir", usage = "extraction output directory")
    private File outDir;

    /** sample index */
    @Option(name = "--index", metaVar = "1", usage = "1-based index of the sample to process (default from " + INDEX_VARIABLE + ")")
    private int index;

    /** sequence toolkit */
    @Option(name = "--toolkit", usage = "sequence toolkit for read extraction")
    private SequenceToolkit.Type toolkitType;

    @Override
    protected void setDefaults() {
        this.manifestFile = new File(ManifestProcessor.DEFAULT_MANIFEST);
        this.targetFile = new File(DEFAULT_TARGETS);
        this.outDir = new File(DEFAULT_OUT_DIR);
        this.index = 0;
        this.toolkitType = SequenceToolkit.Type.NATIVE;
    }

    @Override
    protected boolean validateParms() throws IOException, ConfigurationException {
        if (this.index == 0)
            this.index = indexFromEnvironment(System.getenv(INDEX_VARIABLE));
        SampleManifest manifest = SampleManifest.load(this.resolve(this.manifestFile));
        this.sample = manifest.get(this.index);
        this.targets = TargetSet.load(this.resolve(this.targetFile));
        this.outDir = this.resolve(this.outDir);
        FileUtils.forceMkdir(this.outDir);
        log.info("Sample {} of {} is {}.", this.index, manifest.size(), this.sample.getId());
        return true;
    }

    /**
     * Compute the sample index from the value of the array task environment variable.
     *
     * @param value		value of the environment variable, or NULL if it is not set
     *
     * @return the sample index
     *
     * @throws ParseFailureException if the value is missing or invalid
     */
    public static int indexFromEnvironment(String value) throws ParseFailureException {
        if (StringUtils.isBlank(value))
            throw new ParseFailureException("No sample index specified and " + INDEX_VARIABLE + " is not set.");
        int retVal;
        try {
            retVal = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ParseFailureException("Invalid sample index \"" + value + "\" in " + INDEX_VARIABLE + ".");
        }
        return retVal;
    }

    @Override
    protected void runCommand() throws Exception {
        CompletionRecordStore store = new CompletionRecordStore(this.outDir);
        SequenceToolkit toolkit = this.toolkitType.create(this.outDir);
        ExtractionTask task = new ExtractionTask(this.sample, this.targets, this.outDir, toolkit, store);
        ExtractionResult result = task.run();
        log.info("Sample {}: {} reads assigned, {} sequences extracted.", result.getSampleId(), result.getReadsAssigned(),
                result.getSequencesExtracted());
    }

}
