/**
 *
 */
package org.pepextract.peptides;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.commons.io.FileUtils;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.pepextract.pipeline.CompletionRecord;
import org.pepextract.pipeline.CompletionRecordStore;
import org.pepextract.pipeline.ExtractionResult;
import org.pepextract.pipeline.ExtractionTask;
import org.pepextract.pipeline.Sample;
import org.pepextract.pipeline.SampleManifest;
import org.pepextract.pipeline.ValidationController;
import org.pepextract.sequence.SequenceToolkit;
import org.pepextract.utils.ConfigurationException;
import org.pepextract.utils.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This command runs the whole pipeline in a single process.  The alignment root is scanned to build the sample
 * manifest, the samples are extracted in parallel, and when all of them have finished, the validation stage is run.
 * A failure in one sample is logged and does not stop the others.  A sample with missing input still publishes a
 * completion record, so validation proceeds with the remaining samples.  A sample that fails without publishing a
 * record stops the pipeline at the extraction barrier.
 *
 * The output directory will contain the manifest "samples.tbl", the extraction output in "dna_sequences", and the
 * validation output in "peptides".
 *
 * The positional parameter is the name of the alignment root directory.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	show more detailed progress messages
 * -w	working directory for relative file names; the default is the current directory
 * -t	name of the target ID file; the default is "target_ids.txt"
 * -d	output directory; the default is "peptides"
 *
 * --fastqDir		directory containing the raw read files; the default is the alignment root
 * --suffix			suffix for raw read file names; the default is ".fastq.gz"
 * --workers		number of samples to extract in parallel; the default is 4
 *
 * The validation options are the same as for the "validate" command.
 *
 * @author Bruce Parrello
 *
 */
public class PipelineProcessor extends ValidationBaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(PipelineProcessor.class);

    /** name of the validation output subdirectory */
    public static final String VALIDATE_DIR = "peptides";

    // COMMAND-LINE OPTIONS

    /** raw read file directory */
    @Option(name = "--fastqDir", metaVar = "fastq", usage = "directory containing the raw read files (default is alignment root)")
    private File fastqDir;

    /** raw read file suffix */
    @Option(name = "--suffix", metaVar = ".fastq.gz", usage = "suffix for raw read file names")
    private String fastqSuffix;

    /** number of parallel extraction workers */
    @Option(name = "--workers", metaVar = "4", usage = "number of samples to extract in parallel")
    private int workers;

    /** alignment root directory */
    @Argument(index = 0, metaVar = "alignRoot", usage = "directory containing the sample alignment directories", required = true)
    private File alignRoot;

    @Override
    protected void setDefaults() {
        this.setupDefaults();
        this.fastqDir = null;
        this.fastqSuffix = SampleManifest.DEFAULT_FASTQ_SUFFIX;
        this.workers = 4;
    }

    @Override
    protected boolean validateParms() throws IOException, ConfigurationException {
        this.validateCommonParms();
        if (this.workers < 1)
            throw new ParseFailureException("Worker count must be at least 1.");
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
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        File outDir = this.getOutDir();
        // Build the manifest.
        SampleManifest manifest = SampleManifest.scan(this.alignRoot, this.fastqDir, this.fastqSuffix);
        manifest.save(new File(outDir, ManifestProcessor.DEFAULT_MANIFEST));
        // Run the extractions.
        File extractDir = new File(outDir, ExtractProcessor.DEFAULT_OUT_DIR);
        FileUtils.forceMkdir(extractDir);
        int failures = this.runExtractions(manifest, extractDir);
        if (failures > 0)
            log.warn("{} of {} samples failed extraction.", failures, manifest.size());
        // Run the validation.  All the samples have finished, so the barrier only needs to check once.
        File validateDir = new File(outDir, VALIDATE_DIR);
        ValidationController controller = this.buildController(extractDir, validateDir, manifest);
        CompletionRecord record = controller.run();
        log.info("Final output is in {}.", new File(validateDir, record.get("FORMATTED_OUTPUT_FILE")));
    }

    /**
     * Run the extraction tasks on a fixed thread pool.
     *
     * @param manifest		sample manifest
     * @param extractDir	extraction output directory
     *
     * @return the number of samples that failed
     *
     * @throws IOException
     * @throws InterruptedException
     */
    private int runExtractions(SampleManifest manifest, File extractDir) throws IOException, InterruptedException {
        CompletionRecordStore store = new CompletionRecordStore(extractDir);
        SequenceToolkit toolkit = this.getToolkitType().create(extractDir);
        log.info("Extracting {} samples with {} workers.", manifest.size(), this.workers);
        ExecutorService pool = Executors.newFixedThreadPool(this.workers);
        List<Future<ExtractionResult>> futures = new ArrayList<Future<ExtractionResult>>(manifest.size());
        List<String> sampleIds = new ArrayList<String>(manifest.size());
        try {
            for (Sample sample : manifest) {
                ExtractionTask task = new ExtractionTask(sample, this.getTargets(), extractDir, toolkit, store);
                futures.add(pool.submit(() -> task.run()));
                sampleIds.add(sample.getId());
            }
        } finally {
            pool.shutdown();
        }
        int retVal = 0;
        for (int i = 0; i < futures.size(); i++) {
            try {
                ExtractionResult result = futures.get(i).get();
                log.debug("Sample {} finished with status {}.", result.getSampleId(), result.getStatus());
            } catch (ExecutionException e) {
                log.error("Extraction failed for sample {}: {}", sampleIds.get(i), e.getCause().toString());
                retVal++;
            }
        }
        return retVal;
    }

}
