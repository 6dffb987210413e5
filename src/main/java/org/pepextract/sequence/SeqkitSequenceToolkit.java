/**
 *
 */
package org.pepextract.sequence;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.pepextract.utils.DownstreamToolException;
import org.pepextract.utils.ToolRunner;

/**
 * This toolkit uses the seqkit program.  Reads are subset with "seqkit grep" and converted with "seqkit fq2fa";
 * duplicates are removed with "seqkit rmdup -s".
 *
 * @author Bruce Parrello
 *
 */
public class SeqkitSequenceToolkit extends SequenceToolkit {

    // FIELDS
    /** directory for intermediate files */
    private final File tempDir;
    /** log file for tool error output */
    private final File logFile;

    /**
     * Construct a seqkit toolkit.
     *
     * @param tempDir	directory for intermediate files and the tool log
     */
    public SeqkitSequenceToolkit(File tempDir) {
        this.tempDir = tempDir;
        this.logFile = new File(tempDir, "seqkit.log");
    }

    @Override
    public int extractReads(File fastqFile, Set<String> readIds, File fastaFile) throws IOException, DownstreamToolException {
        File idFile = File.createTempFile("ids", ".txt", this.tempDir);
        File fastqOut = File.createTempFile("reads", ".fq", this.tempDir);
        try {
            FileUtils.writeLines(idFile, StandardCharsets.UTF_8.name(), readIds);
            ToolRunner.run(List.of("seqkit", "grep", "-f", idFile.getPath(), fastqFile.getPath(),
                    "-o", fastqOut.getPath()), this.logFile);
            ToolRunner.run(List.of("seqkit", "fq2fa", fastqOut.getPath(), "-o", fastaFile.getPath()), this.logFile);
        } finally {
            FileUtils.deleteQuietly(idFile);
            FileUtils.deleteQuietly(fastqOut);
        }
        return FastaInputStream.count(fastaFile);
    }

    @Override
    public int deduplicate(File inFile, File outFile) throws IOException, DownstreamToolException {
        ToolRunner.run(List.of("seqkit", "rmdup", "-s", inFile.getPath(), "-o", outFile.getPath()), this.logFile);
        return FastaInputStream.count(outFile);
    }

}
