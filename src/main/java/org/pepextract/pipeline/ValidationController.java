/**
 *
 */
package org.pepextract.pipeline;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.time.DurationFormatUtils;
import org.pepextract.io.SafeFiles;
import org.pepextract.reports.SummaryTableReporter;
import org.pepextract.sequence.FastaInputStream;
import org.pepextract.sequence.FastaOutputStream;
import org.pepextract.sequence.FrameTranslator;
import org.pepextract.sequence.Sequence;
import org.pepextract.sequence.SequenceToolkit;
import org.pepextract.sequence.validate.HitFilter;
import org.pepextract.sequence.validate.HitStatistics;
import org.pepextract.sequence.validate.ValidationEngine;
import org.pepextract.sequence.validate.ValidationHit;
import org.pepextract.sequence.validate.ValidationHitFile;
import org.pepextract.sequence.validate.ValidationParms;
import org.pepextract.utils.ConfigurationException;
import org.pepextract.utils.DownstreamToolException;
import org.pepextract.utils.NoDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object runs the validation half of the pipeline.  In a full run, it waits for the extraction tasks to
 * finish, combines and deduplicates their output, translates the result in six frames, and searches the
 * translations with the validation engine.  In a rerun, it skips all of that and reuses the previous search output.
 * Either way, it then filters the hits, computes statistics, writes the final protein FASTA, and publishes a
 * stage-level completion record.
 *
 * The configuration methods can be chained.
 *
 * @author Bruce Parrello
 *
 */
public class ValidationController {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ValidationController.class);
    /** target IDs */
    private final TargetSet targets;
    /** directory containing the extraction output and records */
    private final File inDir;
    /** output directory */
    private final File outDir;
    /** sample manifest for the barrier, or NULL to use whatever records are present */
    private SampleManifest manifest;
    /** sequence toolkit */
    private SequenceToolkit toolkit;
    /** six-frame translator */
    private FrameTranslator translator;
    /** validation engine */
    private ValidationEngine engine;
    /** validation search parameters */
    private ValidationParms parms;
    /** minimum percent identity for an accepted hit */
    private double minIdentity;
    /** minimum alignment length for an accepted hit */
    private int minLength;
    /** TRUE if a rerun was requested */
    private boolean rerun;
    /** barrier poll interval */
    private Duration pollInterval;
    /** barrier timeout */
    private Duration barrierTimeout;

    /** stage identifier for the validation record */
    public static final String STAGE = "VALIDATE";
    /** name of the six-frame translation file */
    public static final String TRANSLATED_NAME = "six_frame_translated.fa";
    /** name of the validation engine output file */
    public static final String VALIDATION_NAME = "diamond_blast_results.tsv";
    /** name of the filtered hits file */
    public static final String FILTERED_NAME = "filtered_blast_hits.tsv";
    /** name of the matched-targets list */
    public static final String MATCHED_NAME = "matched_targets.txt";
    /** name of the accepted sequences file with original IDs */
    public static final String HIGH_QUALITY_NAME = "high_quality_aa_sequences.fa";
    /** name of the final output file */
    public static final String FINAL_NAME = "final_format_aa_sequences.faa";
    /** name of the extraction summary table */
    public static final String SUMMARY_NAME = "extract_samples_summary.tsv";
    /** record field for the search parameters */
    public static final String SEARCH_PARAMETERS = "SEARCH_PARAMETERS";

    /**
     * Construct a validation controller with default settings.
     *
     * @param targets	target ID set
     * @param inDir		directory containing the extraction output and records
     * @param outDir	output directory
     */
    public ValidationController(TargetSet targets, File inDir, File outDir) {
        this.targets = targets;
        this.inDir = inDir;
        this.outDir = outDir;
        this.manifest = null;
        this.toolkit = SequenceToolkit.Type.NATIVE.create(outDir);
        this.translator = FrameTranslator.Type.NATIVE.create(outDir);
        this.engine = null;
        this.parms = new ValidationParms();
        this.minIdentity = 90.0;
        this.minLength = 7;
        this.rerun = false;
        this.pollInterval = Duration.ofSeconds(60);
        this.barrierTimeout = Duration.ZERO;
    }

    /**
     * Specify the sample manifest.  All of its samples must finish extraction before a full run can proceed.
     *
     * @param manifest	sample manifest, or NULL to accept whatever records are present
     */
    public ValidationController manifest(SampleManifest manifest) {
        this.manifest = manifest;
        return this;
    }

    /**
     * Specify the sequence toolkit.
     *
     * @param toolkit	toolkit for deduplication
     */
    public ValidationController toolkit(SequenceToolkit toolkit) {
        this.toolkit = toolkit;
        return this;
    }

    /**
     * Specify the six-frame translator.
     *
     * @param translator	translation engine
     */
    public ValidationController translator(FrameTranslator translator) {
        this.translator = translator;
        return this;
    }

    /**
     * Specify the validation engine and its parameters.
     *
     * @param engine	validation engine
     * @param parms		search parameters
     */
    public ValidationController engine(ValidationEngine engine, ValidationParms parms) {
        this.engine = engine;
        this.parms = parms;
        return this;
    }

    /**
     * Specify the hit acceptance thresholds.
     *
     * @param minIdentity	minimum percent identity
     * @param minLength		minimum alignment length
     */
    public ValidationController thresholds(double minIdentity, int minLength) {
        this.minIdentity = minIdentity;
        this.minLength = minLength;
        return this;
    }

    /**
     * Specify whether a rerun is requested.
     *
     * @param rerun		TRUE to reuse the previous search output if possible
     */
    public ValidationController rerun(boolean rerun) {
        this.rerun = rerun;
        return this;
    }

    /**
     * Specify the barrier timing.
     *
     * @param pollInterval		time between checks for finished samples
     * @param timeout			maximum time to wait (zero to check once)
     */
    public ValidationController barrier(Duration pollInterval, Duration timeout) {
        this.pollInterval = pollInterval;
        this.barrierTimeout = timeout;
        return this;
    }

    /**
     * Run the validation stage.
     *
     * @return the completion record for the stage
     *
     * @throws IOException
     * @throws ConfigurationException if required input is missing
     * @throws NoDataException if there are no sequences to process
     * @throws DownstreamToolException if an external tool fails
     * @throws TimeoutException if the extraction tasks do not finish in time
     * @throws InterruptedException
     */
    public CompletionRecord run() throws IOException, ConfigurationException, NoDataException, DownstreamToolException,
            TimeoutException, InterruptedException {
        final long start = System.currentTimeMillis();
        FileUtils.forceMkdir(this.outDir);
        CompletionRecordStore outStore = new CompletionRecordStore(this.outDir);
        File validationFile = new File(this.outDir, VALIDATION_NAME);
        File translatedFile = new File(this.outDir, TRANSLATED_NAME);
        RunMode mode = RunMode.decide(this.rerun, validationFile);
        Optional<CompletionRecord> prior = outStore.read(STAGE, null);
        outStore.reset(STAGE, null);
        int samplesUsed;
        int combinedCount;
        int dedupCount;
        int translatedCount;
        int hitCount;
        if (mode == RunMode.FULL) {
            if (this.engine == null)
                throw new ConfigurationException("No validation engine configured for a full run.");
            if (this.parms.getDatabase() == null)
                throw new ConfigurationException("A validation database is required for a full run.");
            AggregationStage.Result aggregate = this.aggregate();
            samplesUsed = aggregate.getSamplesUsed();
            combinedCount = aggregate.getCombinedCount();
            dedupCount = aggregate.getDedupCount();
            // Translate the unique sequences.
            log.info("Performing six-frame translation.");
            File dedupFile = new File(this.outDir, AggregationStage.DEDUP_NAME);
            File translatedTemp = SafeFiles.tempFor(translatedFile);
            translatedCount = this.translator.translate(dedupFile, translatedTemp);
            SafeFiles.commit(translatedTemp, translatedFile);
            log.info("Translated to {} amino acid sequences.", translatedCount);
            // Search the translations.
            hitCount = this.engine.search(translatedFile, validationFile, this.parms);
            log.info("Validation search completed: {} hits.", hitCount);
        } else {
            // Recover whatever counts we can from the previous run's files.
            samplesUsed = (prior.isPresent() ? prior.get().getInt("SAMPLES_USED") : 0);
            combinedCount = FastaInputStream.count(new File(this.outDir, AggregationStage.COMBINED_NAME));
            dedupCount = FastaInputStream.count(new File(this.outDir, AggregationStage.DEDUP_NAME));
            translatedCount = FastaInputStream.count(translatedFile);
            hitCount = ValidationHitFile.count(validationFile);
            log.info("Rerun mode: using existing data (translated: {}, validation hits: {}).", translatedCount, hitCount);
            if (prior.isPresent()) {
                String oldParms = prior.get().get(SEARCH_PARAMETERS);
                if (oldParms != null && ! oldParms.equals(this.searchParameters()))
                    log.warn("Validation output was produced with different search parameters ({}); it is being reused anyway.",
                            oldParms);
            }
        }
        // Filter the hits.
        log.info("Filtering validation hits ({}% identity, {}+ AA length, target ID match).", this.minIdentity, this.minLength);
        HitFilter filter = new HitFilter(this.targets, this.minIdentity, this.minLength);
        List<ValidationHit> accepted = filter.filter(ValidationHitFile.read(validationFile));
        ValidationHitFile.write(new File(this.outDir, FILTERED_NAME), accepted);
        log.info("Filtered to {} high-quality hits.", accepted.size());
        // Compute the statistics.
        HitStatistics stats = new HitStatistics(accepted, this.targets, this.minLength, dedupCount);
        FileUtils.writeLines(new File(this.outDir, MATCHED_NAME), StandardCharsets.UTF_8.name(), stats.getMatchedTargets(), "\n");
        // Produce the final output.
        int finalCount = this.writeSequences(accepted, translatedFile);
        Duration duration = Duration.ofMillis(System.currentTimeMillis() - start);
        CompletionRecord retVal = new CompletionRecord.Builder(STAGE, null, CompletionStatus.SUCCESS)
                .put(ExtractionTask.COMPLETED, LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME))
                .put("MODE", mode)
                .put("PARAMETERS", this.searchParameters() + ", pident=" + this.minIdentity + ", min-length=" + this.minLength)
                .put(SEARCH_PARAMETERS, this.searchParameters())
                .put(ExtractionTask.TARGET_IDS, this.targets.size())
                .put("ORIGINAL_TARGETS_MATCHED", stats.getOriginalMatched().size())
                .put("NEW_TARGETS_DISCOVERED", stats.getNewlyDiscovered().size())
                .put("TOTAL_TARGETS_WITH_HITS", stats.getMatchedTargets().size())
                .put("SAMPLES_USED", samplesUsed)
                .put("DNA_SEQUENCES_COMBINED", combinedCount)
                .put("DNA_SEQUENCES_DEDUP", dedupCount)
                .put("FRAMES_SEARCHED", stats.getFramesSearched())
                .put("FRAMES_WITH_HITS", stats.getFramesWithHits())
                .put("SEQUENCES_WITH_HITS", stats.getSequencesWithHits())
                .put("AA_SEQUENCES_TRANSLATED", translatedCount)
                .put("VALIDATION_HITS", hitCount)
                .put("HIGH_QUALITY_HITS", stats.getHitCount())
                .put("PERFECT_HITS_100PCT", stats.getPerfectHits())
                .put("HIGH_QUALITY_HITS_95PCT", stats.getHighQualityHits())
                .put("FINAL_AA_SEQUENCES", finalCount)
                .put(ExtractionTask.DURATION_SECONDS, duration.getSeconds())
                .put(ExtractionTask.DURATION_HUMAN, DurationFormatUtils.formatDuration(duration.toMillis(), "HH:mm:ss"))
                .put("UNFORMATTED_OUTPUT_FILE", HIGH_QUALITY_NAME)
                .put("FORMATTED_OUTPUT_FILE", FINAL_NAME)
                .put("VALIDATION_OUTPUT", VALIDATION_NAME)
                .build();
        outStore.write(retVal);
        log.info("Validation stage complete in {} mode: {} final sequences for {} targets.", mode, finalCount,
                stats.getMatchedTargets().size());
        return retVal;
    }

    /**
     * Wait for the extraction tasks, write the extraction summary table, and combine the extraction output.
     *
     * @return the aggregation counts
     *
     * @throws IOException
     * @throws ConfigurationException
     * @throws NoDataException
     * @throws DownstreamToolException
     * @throws TimeoutException
     * @throws InterruptedException
     */
    private AggregationStage.Result aggregate() throws IOException, ConfigurationException, NoDataException,
            DownstreamToolException, TimeoutException, InterruptedException {
        CompletionRecordStore inStore = new CompletionRecordStore(this.inDir);
        if (this.manifest != null) {
            StageBarrier barrier = new StageBarrier(inStore, ExtractionTask.STAGE, this.manifest.getSampleIds());
            barrier.await(this.pollInterval, this.barrierTimeout);
        }
        List<CompletionRecord> records = inStore.list(ExtractionTask.STAGE);
        if (this.manifest != null) {
            // Only the samples in the manifest belong to this run.
            Set<String> sampleIds = new HashSet<String>(this.manifest.getSampleIds());
            int oldSize = records.size();
            records = records.stream().filter(x -> sampleIds.contains(x.getUnit())).collect(Collectors.toList());
            if (records.size() < oldSize)
                log.info("{} extraction records for samples outside the manifest ignored.", oldSize - records.size());
        }
        if (records.isEmpty())
            throw new ConfigurationException("No extraction completion records found in " + this.inDir + ".");
        log.info("Found {} extraction completion records.", records.size());
        writeSummary(records, new File(this.outDir, SUMMARY_NAME));
        if (records.stream().allMatch(x -> x.getInt(ExtractionTask.SEQUENCES_EXTRACTED) == 0))
            throw new NoDataException("None of the " + records.size() + " samples produced DNA sequences.");
        AggregationStage aggregator = new AggregationStage(this.inDir, this.outDir, this.toolkit);
        return aggregator.run(records);
    }

    /**
     * Write the final protein sequences.  The accepted sequences are written with their original IDs to one file
     * and in final format to another.
     *
     * @param accepted			accepted hits
     * @param translatedFile	translated protein FASTA file
     *
     * @return the number of final sequences
     *
     * @throws IOException
     * @throws ConfigurationException if the translated sequences are missing or do not match the hits
     */
    private int writeSequences(List<ValidationHit> accepted, File translatedFile) throws IOException, ConfigurationException {
        File rawFile = new File(this.outDir, HIGH_QUALITY_NAME);
        File finalFile = new File(this.outDir, FINAL_NAME);
        List<Sequence> finalSeqs = List.of();
        File rawTemp = SafeFiles.tempFor(rawFile);
        try (FastaOutputStream rawStream = new FastaOutputStream(rawTemp)) {
            if (accepted.isEmpty())
                log.info("No high-quality hits found.");
            else {
                if (! translatedFile.canRead())
                    throw new ConfigurationException("Translated sequence file " + translatedFile + " is required but not found.");
                SequenceRenumberer renumberer = new SequenceRenumberer(accepted);
                List<Sequence> mapped = renumberer.mapSequences(translatedFile, rawStream);
                if (mapped.isEmpty())
                    throw new ConfigurationException("None of the accepted queries were found in " + translatedFile + ".");
                finalSeqs = SequenceRenumberer.renumber(mapped);
            }
        }
        SafeFiles.commit(rawTemp, rawFile);
        File finalTemp = SafeFiles.tempFor(finalFile);
        try (FastaOutputStream finalStream = new FastaOutputStream(finalTemp)) {
            finalStream.write(finalSeqs);
        }
        SafeFiles.commit(finalTemp, finalFile);
        log.info("{} sequences written to {}.", finalSeqs.size(), finalFile);
        return finalSeqs.size();
    }

    /**
     * Write a summary table for a set of completion records.
     *
     * @param records	records to summarize
     * @param outFile	output file
     *
     * @throws IOException
     */
    public static void writeSummary(List<CompletionRecord> records, File outFile) throws IOException {
        File tempFile = SafeFiles.tempFor(outFile);
        try (OutputStream outStream = new FileOutputStream(tempFile);
                SummaryTableReporter reporter = new SummaryTableReporter(outStream)) {
            reporter.write(records);
        }
        SafeFiles.commit(tempFile, outFile);
        log.info("Summary table for {} samples written to {}.", records.size(), outFile);
    }

    /**
     * @return a description of the search parameters that determine the validation output
     */
    private String searchParameters() {
        File db = this.parms.getDatabase();
        return this.parms.toString() + ", db=" + (db == null ? "none" : db.getName());
    }

}
