/**
 *
 */
package org.pepextract.utils;

/**
 * This exception is thrown when a sample's alignment table or raw sequence file is absent.  It is fatal
 * to the sample's own task, but sibling samples are unaffected.
 *
 * @author Bruce Parrello
 *
 */
public class InputMissingException extends PipelineException {

    /** serialization ID */
    private static final long serialVersionUID = 1190457261735823903L;

    public InputMissingException(String message) {
        super(message);
    }

    @Override
    public int getExitCode() {
        return 3;
    }

}
