/**
 *
 */
package org.pepextract.utils;

/**
 * This exception is thrown when a required input is missing or unreadable, or a parameter is out of range.
 * It aborts the invoking stage immediately.
 *
 * @author Bruce Parrello
 *
 */
public class ConfigurationException extends PipelineException {

    /** serialization ID */
    private static final long serialVersionUID = -6109212297386525148L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return 2;
    }

}
