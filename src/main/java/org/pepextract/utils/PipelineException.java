/**
 *
 */
package org.pepextract.utils;

/**
 * This is the base class for the fatal conditions raised by the pipeline stages.  Each subclass
 * carries the process exit code used when it aborts a command.
 *
 * @author Bruce Parrello
 *
 */
public abstract class PipelineException extends Exception {

    /** serialization ID */
    private static final long serialVersionUID = 3402948823145116721L;

    /**
     * Construct a pipeline exception with a message.
     *
     * @param message	description of the failure
     */
    public PipelineException(String message) {
        super(message);
    }

    /**
     * Construct a pipeline exception with a message and a cause.
     *
     * @param message	description of the failure
     * @param cause		underlying exception
     */
    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the process exit code for this type of failure
     */
    public abstract int getExitCode();

}
