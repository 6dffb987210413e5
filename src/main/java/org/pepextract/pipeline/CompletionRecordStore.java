/**
 *
 */
package org.pepextract.pipeline;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.apache.commons.io.FileUtils;
import org.pepextract.io.SafeFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object manages a directory of completion records.  Each unit of work has its own record file, named
 * "UUU_sss_completed.flag" for unit UUU of stage SSS, or "sss_completed.flag" for a stage-level record.
 *
 * Records are published by writing a hidden temporary file and renaming it, so a reader never sees a partial
 * record.  A record is never overwritten; a unit that is being redone must be reset first.
 *
 * @author Bruce Parrello
 *
 */
public class CompletionRecordStore {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CompletionRecordStore.class);
    /** directory containing the records */
    private final File recordDir;

    /** suffix for record files */
    public static final String FLAG_SUFFIX = "_completed.flag";

    /**
     * Open a record store.  The directory is created if it does not exist.
     *
     * @param recordDir		directory containing the records
     *
     * @throws IOException
     */
    public CompletionRecordStore(File recordDir) throws IOException {
        this.recordDir = recordDir;
        FileUtils.forceMkdir(recordDir);
    }

    /**
     * @return the file for the record of a unit
     *
     * @param stage		stage identifier
     * @param unit		unit identifier, or NULL for a stage-level record
     */
    public File getFile(String stage, String unit) {
        String stageName = stage.toLowerCase(Locale.ROOT);
        String name = (unit == null ? stageName + FLAG_SUFFIX : unit + "_" + stageName + FLAG_SUFFIX);
        return new File(this.recordDir, name);
    }

    /**
     * Publish a record.
     *
     * @param record	record to publish
     *
     * @throws IOException
     * @throws IllegalStateException if the unit already has a record
     */
    public void write(CompletionRecord record) throws IOException {
        File target = this.getFile(record.getStage(), record.getUnit());
        if (target.exists())
            throw new IllegalStateException("Completion record " + target + " already exists.");
        File tempFile = SafeFiles.tempFor(target);
        FileUtils.writeLines(tempFile, StandardCharsets.UTF_8.name(), record.toLines(), "\n");
        SafeFiles.commit(tempFile, target);
        log.debug("Completion record {} written to {}.", record, target);
    }

    /**
     * Remove the record for a unit, so that the unit can be redone.
     *
     * @param stage		stage identifier
     * @param unit		unit identifier, or NULL for a stage-level record
     *
     * @return TRUE if a record was removed
     *
     * @throws IOException
     */
    public boolean reset(String stage, String unit) throws IOException {
        File target = this.getFile(stage, unit);
        boolean retVal = target.exists();
        if (retVal) {
            FileUtils.delete(target);
            log.info("Prior completion record {} removed.", target);
        }
        return retVal;
    }

    /**
     * Read the record for a unit.
     *
     * @param stage		stage identifier
     * @param unit		unit identifier, or NULL for a stage-level record
     *
     * @return the record, or an empty result if there is no terminal record for the unit
     *
     * @throws IOException
     */
    public Optional<CompletionRecord> read(String stage, String unit) throws IOException {
        return this.readFile(this.getFile(stage, unit), stage);
    }

    /**
     * Read a record file.
     *
     * @param file		record file
     * @param stage		expected stage identifier
     *
     * @return the record, or an empty result if the file is missing, malformed, or for the wrong stage
     *
     * @throws IOException
     */
    private Optional<CompletionRecord> readFile(File file, String stage) throws IOException {
        Optional<CompletionRecord> retVal = Optional.empty();
        if (file.isFile()) {
            List<String> lines = FileUtils.readLines(file, StandardCharsets.UTF_8);
            retVal = CompletionRecord.parse(lines).filter(x -> x.getStage().equals(stage));
            if (retVal.isEmpty())
                log.warn("Completion record {} is incomplete or invalid.", file);
        }
        return retVal;
    }

    /**
     * @return all the terminal unit records for a stage, sorted by unit ID
     *
     * @param stage		stage identifier
     *
     * @throws IOException
     */
    public List<CompletionRecord> list(String stage) throws IOException {
        final String suffix = "_" + stage.toLowerCase(Locale.ROOT) + FLAG_SUFFIX;
        File[] files = this.recordDir.listFiles((dir, name) -> name.endsWith(suffix) && ! name.startsWith("."));
        List<CompletionRecord> retVal = new ArrayList<CompletionRecord>();
        if (files != null) {
            for (File file : files) {
                Optional<CompletionRecord> record = this.readFile(file, stage);
                record.filter(x -> x.getUnit() != null).ifPresent(x -> retVal.add(x));
            }
        }
        retVal.sort(Comparator.comparing(CompletionRecord::getUnit));
        return retVal;
    }

    /**
     * @return the units in a collection that do not yet have a terminal record
     *
     * @param stage		stage identifier
     * @param units		units expected to finish
     *
     * @throws IOException
     */
    public List<String> getUnfinished(String stage, Collection<String> units) throws IOException {
        List<String> retVal = new ArrayList<String>();
        for (String unit : units) {
            if (this.read(stage, unit).isEmpty())
                retVal.add(unit);
        }
        return retVal;
    }

    /**
     * @return TRUE if every unit in a collection has a terminal record
     *
     * @param stage		stage identifier
     * @param units		units expected to finish
     *
     * @throws IOException
     */
    public boolean isTerminal(String stage, Collection<String> units) throws IOException {
        return this.getUnfinished(stage, units).isEmpty();
    }

}
