/**
 *
 */
package org.pepextract.utils;

/**
 * This exception is thrown when a stage that cannot work on empty input receives no usable records.
 *
 * @author Bruce Parrello
 *
 */
public class NoDataException extends PipelineException {

    /** serialization ID */
    private static final long serialVersionUID = -2878470305136690414L;

    public NoDataException(String message) {
        super(message);
    }

    @Override
    public int getExitCode() {
        return 4;
    }

}
