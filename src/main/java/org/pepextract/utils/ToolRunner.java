/**
 *
 */
package org.pepextract.utils;

import java.io.File;
import java.io.IOException;
import java.lang.ProcessBuilder.Redirect;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class runs an external program and waits for it to finish.  The program's error output goes to a log
 * file, and its standard output is discarded.  A non-zero exit code is fatal.
 *
 * @author Bruce Parrello
 *
 */
public class ToolRunner {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ToolRunner.class);

    /**
     * Run a command.
     *
     * @param command	command and arguments
     * @param logFile	file to receive the command's error output
     *
     * @throws DownstreamToolException if the command cannot be started or fails
     */
    public static void run(List<String> command, File logFile) throws DownstreamToolException {
        log.info("Running: {}", String.join(" ", command));
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectError(Redirect.appendTo(logFile));
        pb.redirectOutput(Redirect.DISCARD);
        int exitStatus;
        try {
            Process process = pb.start();
            exitStatus = process.waitFor();
        } catch (IOException e) {
            throw new DownstreamToolException("Could not start " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownstreamToolException("Interrupted while waiting for " + command.get(0) + ".", e);
        }
        if (exitStatus != 0)
            throw new DownstreamToolException(command, exitStatus);
        log.debug("{} completed normally.", command.get(0));
    }

}
