/**
 *
 */
package org.pepextract.peptides;

import java.io.File;
import java.io.IOException;
import java.time.Duration;

import org.apache.commons.io.FileUtils;
import org.kohsuke.args4j.Option;
import org.pepextract.pipeline.SampleManifest;
import org.pepextract.pipeline.TargetSet;
import org.pepextract.pipeline.ValidationController;
import org.pepextract.sequence.FrameTranslator;
import org.pepextract.sequence.SequenceToolkit;
import org.pepextract.sequence.validate.DiamondValidationEngine;
import org.pepextract.sequence.validate.ValidationParms;
import org.pepextract.utils.BaseProcessor;
import org.pepextract.utils.ConfigurationException;
import org.pepextract.utils.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is a base class for commands that run the validation stage.  It is used by both ValidateProcessor and
 * PipelineProcessor, and holds the options for the target set, the validation search, the hit filter and the
 * extraction barrier.
 *
 * @author Bruce Parrello
 *
 */
public abstract class ValidationBaseProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ValidationBaseProcessor.class);
    /** target ID set */
    private TargetSet targets;

    // COMMAND-LINE OPTIONS

    /** target ID file */
    @Option(name = "-t", aliases = { "--targets" }, metaVar = "target_ids.txt", usage = "file of target reference IDs")
    private File targetFile;

    /** output directory */
    @Option(name = "-d", aliases = { "--outDir" }, metaVar = "outDir", usage = "output directory")
    private File outDir;

    /** validation database */
    @Option(name = "--db", metaVar = "targets.dmnd", usage = "validation protein database")
    private File dbFile;

    /** validation program */
    @Option(name = "--diamond", metaVar = "diamond", usage = "validation search program")
    private String diamondProgram;

    /** maximum number of targets per query */
    @Option(name = "--maxTargets", metaVar = "5", usage = "maximum number of database hits per query")
    private int maxTargets;

    /** maximum e-value */
    @Option(name = "--evalue", aliases = { "--maxE" }, metaVar = "1e-3", usage = "maximum permissible e-value for a hit")
    private double eValue;

    /** minimum percent identity */
    @Option(name = "--pident", aliases = { "--minIdent" }, metaVar = "90", usage = "minimum percent identity for an accepted hit")
    private double minIdentity;

    /** minimum alignment length */
    @Option(name = "--minLen", metaVar = "7", usage = "minimum alignment length for an accepted hit")
    private int minLength;

    /** TRUE for a sensitive search (the default) */
    @Option(name = "--sensitive", usage = "use the sensitive search mode (default)")
    private boolean sensitive;

    /** TRUE for a fast search */
    @Option(name = "--fast", usage = "use the fast search mode instead of the sensitive one")
    private boolean fast;

    /** TRUE to reuse the previous search output */
    @Option(name = "--rerun", usage = "reuse the previous validation output if it exists")
    private boolean rerun;

    /** number of search threads */
    @Option(name = "--threads", metaVar = "8", usage = "number of threads for the validation search")
    private int threads;

    /** translation engine */
    @Option(name = "--translator", usage = "six-frame translation engine")
    private FrameTranslator.Type translatorType;

    /** sequence toolkit */
    @Option(name = "--toolkit", usage = "sequence toolkit for extraction and deduplication")
    private SequenceToolkit.Type toolkitType;

    /** barrier timeout in seconds */
    @Option(name = "--wait", metaVar = "0", usage = "maximum seconds to wait for unfinished samples (0 to check once)")
    private int waitSeconds;

    /** barrier poll interval in seconds */
    @Option(name = "--poll", metaVar = "60", usage = "seconds between checks for unfinished samples")
    private int pollSeconds;

    /**
     * Set the default values for the validation parameters.
     */
    protected void setupDefaults() {
        this.targetFile = new File(ExtractProcessor.DEFAULT_TARGETS);
        this.outDir = new File("peptides");
        this.dbFile = null;
        this.diamondProgram = "diamond";
        this.maxTargets = 5;
        this.eValue = 1e-3;
        this.minIdentity = 90.0;
        this.minLength = 7;
        this.sensitive = false;
        this.fast = false;
        this.rerun = false;
        this.threads = 8;
        this.translatorType = FrameTranslator.Type.NATIVE;
        this.toolkitType = SequenceToolkit.Type.NATIVE;
        this.waitSeconds = 0;
        this.pollSeconds = 60;
    }

    /**
     * Validate the common parameters for a validation run.
     *
     * @throws IOException
     * @throws ConfigurationException
     */
    protected void validateCommonParms() throws IOException, ConfigurationException {
        if (this.maxTargets < 1)
            throw new ParseFailureException("Maximum targets must be at least 1.");
        if (this.eValue <= 0.0)
            throw new ParseFailureException("Maximum e-value must be positive.");
        if (this.minIdentity < 0.0 || this.minIdentity > 100.0)
            throw new ParseFailureException("Minimum percent identity must be between 0 and 100.");
        if (this.minLength < 1)
            throw new ParseFailureException("Minimum alignment length must be at least 1.");
        if (this.threads < 1)
            throw new ParseFailureException("Thread count must be at least 1.");
        if (this.sensitive && this.fast)
            throw new ParseFailureException("Cannot specify both --sensitive and --fast.");
        if (this.waitSeconds < 0 || this.pollSeconds < 1)
            throw new ParseFailureException("Barrier wait cannot be negative and poll interval must be at least 1 second.");
        this.targets = TargetSet.load(this.resolve(this.targetFile));
        this.outDir = this.resolve(this.outDir);
        FileUtils.forceMkdir(this.outDir);
        if (this.dbFile != null) {
            this.dbFile = this.resolve(this.dbFile);
            if (! this.dbFile.canRead())
                throw new ConfigurationException("Validation database " + this.dbFile + " is not found or unreadable.");
        } else if (! this.rerun)
            throw new ConfigurationException("A validation database (--db) is required unless --rerun is specified.");
        log.info("{} target IDs loaded. Output will be in {}.", this.targets.size(), this.outDir);
    }

    /**
     * Create the validation controller for this command.
     *
     * @param inDir			directory containing the extraction output
     * @param validateDir	directory for the validation output
     * @param manifest		sample manifest for the barrier, or NULL if there is none
     *
     * @return a configured validation controller
     */
    protected ValidationController buildController(File inDir, File validateDir, SampleManifest manifest) {
        ValidationParms parms = new ValidationParms().database(this.dbFile).maxTargets(this.maxTargets)
                .maxE(this.eValue).sensitive(! this.fast).threads(this.threads);
        ValidationController retVal = new ValidationController(this.targets, inDir, validateDir)
                .manifest(manifest)
                .toolkit(this.toolkitType.create(validateDir))
                .translator(this.translatorType.create(validateDir))
                .engine(new DiamondValidationEngine(this.diamondProgram, validateDir), parms)
                .thresholds(this.minIdentity, this.minLength)
                .rerun(this.rerun)
                .barrier(Duration.ofSeconds(this.pollSeconds), Duration.ofSeconds(this.waitSeconds));
        return retVal;
    }

    /**
     * @return the target ID set
     */
    protected TargetSet getTargets() {
        return this.targets;
    }

    /**
     * @return the output directory
     */
    protected File getOutDir() {
        return this.outDir;
    }

    /**
     * @return the sequence toolkit type
     */
    protected SequenceToolkit.Type getToolkitType() {
        return this.toolkitType;
    }

}
