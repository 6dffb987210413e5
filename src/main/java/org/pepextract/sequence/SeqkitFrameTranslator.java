/**
 *
 */
package org.pepextract.sequence;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.pepextract.utils.DownstreamToolException;
import org.pepextract.utils.ToolRunner;

/**
 * This translator uses "seqkit translate" with six frames, frame tags appended to the IDs, and
 * the bacterial genetic code.
 *
 * @author Bruce Parrello
 *
 */
public class SeqkitFrameTranslator extends FrameTranslator {

    // FIELDS
    /** log file for tool error output */
    private final File logFile;

    public SeqkitFrameTranslator(File tempDir) {
        this.logFile = new File(tempDir, "seqkit.log");
    }

    @Override
    public int translate(File dnaFile, File aaFile) throws IOException, DownstreamToolException {
        ToolRunner.run(List.of("seqkit", "translate", "-f", "6", "-F", "-T", Integer.toString(GENETIC_CODE),
                dnaFile.getPath(), "-o", aaFile.getPath()), this.logFile);
        return FastaInputStream.count(aaFile);
    }

}
