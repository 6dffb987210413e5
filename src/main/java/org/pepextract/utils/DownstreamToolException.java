/**
 *
 */
package org.pepextract.utils;

import java.util.List;

/**
 * This exception is thrown when an external tool (translator, validation engine, sequence toolkit) exits
 * abnormally.  It is never retried.
 *
 * @author Bruce Parrello
 *
 */
public class DownstreamToolException extends PipelineException {

    /** serialization ID */
    private static final long serialVersionUID = 5541097853072219853L;

    public DownstreamToolException(String message) {
        super(message);
    }

    public DownstreamToolException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Construct an exception for a command that returned a bad exit code.
     *
     * @param command	command line that was run
     * @param exitCode	exit code returned
     */
    public DownstreamToolException(List<String> command, int exitCode) {
        super("Command \"" + String.join(" ", command) + "\" failed with exit code " + exitCode + ".");
    }

    @Override
    public int getExitCode() {
        return 5;
    }

}
