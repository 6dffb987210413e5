/**
 *
 */
package org.pepextract.sequence.validate;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.pepextract.io.SafeFiles;
import org.pepextract.utils.DownstreamToolException;
import org.pepextract.utils.ToolRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This validation engine runs DIAMOND "blastp".  The hits are written to a temporary file that is moved into place
 * only if DIAMOND succeeds, so a failed search never leaves a usable-looking output file behind.
 *
 * @author Bruce Parrello
 *
 */
public class DiamondValidationEngine implements ValidationEngine {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(DiamondValidationEngine.class);
    /** name of the DIAMOND executable */
    private final String program;
    /** log file for error output */
    private final File logFile;

    /**
     * Construct a DIAMOND validation engine.
     *
     * @param program	name or path of the DIAMOND executable
     * @param logDir	directory for the tool log
     */
    public DiamondValidationEngine(String program, File logDir) {
        this.program = program;
        this.logFile = new File(logDir, "diamond.log");
    }

    /**
     * @return the command line for a search
     *
     * @param queryFile		protein FASTA file of query sequences
     * @param outFile		output file for the hits
     * @param parms			search parameters
     */
    protected List<String> buildCommand(File queryFile, File outFile, ValidationParms parms) {
        List<String> retVal = new ArrayList<String>(30);
        retVal.add(this.program);
        retVal.add("blastp");
        retVal.add("--db");
        retVal.add(parms.getDatabase().getPath());
        retVal.add("--query");
        retVal.add(queryFile.getPath());
        retVal.add("--out");
        retVal.add(outFile.getPath());
        retVal.addAll(List.of("--outfmt", "6", "qseqid", "sseqid", "pident", "length", "evalue", "bitscore"));
        retVal.add("--max-target-seqs");
        retVal.add(Integer.toString(parms.getMaxTargets()));
        retVal.add("--evalue");
        retVal.add(Double.toString(parms.getMaxE()));
        retVal.add("--threads");
        retVal.add(Integer.toString(parms.getThreads()));
        retVal.add(parms.isSensitive() ? "--sensitive" : "--fast");
        return retVal;
    }

    @Override
    public int search(File queryFile, File outFile, ValidationParms parms) throws IOException, DownstreamToolException {
        File tempFile = SafeFiles.tempFor(outFile);
        FileUtils.deleteQuietly(tempFile);
        log.info("Searching {} against {} ({}).", queryFile, parms.getDatabase(), parms);
        try {
            ToolRunner.run(this.buildCommand(queryFile, tempFile, parms), this.logFile);
        } catch (DownstreamToolException e) {
            FileUtils.deleteQuietly(tempFile);
            throw e;
        }
        // Insure there is an output file even if nothing was written.
        if (! tempFile.exists())
            FileUtils.touch(tempFile);
        SafeFiles.commit(tempFile, outFile);
        int retVal = ValidationHitFile.count(outFile);
        log.info("{} hits returned by DIAMOND.", retVal);
        return retVal;
    }

}
