/**
 *
 */
package org.pepextract.pipeline;

import java.io.File;

import org.pepextract.io.SafeFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run modes for the validation stage.  A full run does everything; a rerun reuses the output of a previous
 * validation-engine search and only redoes the filtering and formatting.
 *
 * @author Bruce Parrello
 *
 */
public enum RunMode {
    FULL, RERUN;

    /** logging facility */
    private static final Logger log = LoggerFactory.getLogger(RunMode.class);

    /**
     * Decide the effective run mode.  A rerun is only possible if the previous search output exists and is not
     * empty; otherwise the run silently becomes a full run.  Only existence is checked:  the output is reused even
     * if the targets, database or sequences have changed since it was produced.
     *
     * @param rerun			TRUE if a rerun was requested
     * @param priorOutput	validation output file from the previous run
     *
     * @return the mode to use
     */
    public static RunMode decide(boolean rerun, File priorOutput) {
        RunMode retVal = FULL;
        if (rerun) {
            if (SafeFiles.isNonEmpty(priorOutput)) {
                log.info("Rerun mode:  using existing validation output {} for filtering.", priorOutput);
                retVal = RERUN;
            } else
                log.info("Validation output {} is missing or empty:  rerun request changed to full run.", priorOutput);
        }
        return retVal;
    }

}
