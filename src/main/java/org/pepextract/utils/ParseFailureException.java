/**
 *
 */
package org.pepextract.utils;

/**
 * This exception is thrown when a command-line parameter is invalid.
 *
 * @author Bruce Parrello
 *
 */
public class ParseFailureException extends ConfigurationException {

    /** serialization ID */
    private static final long serialVersionUID = 8143006411957231096L;

    public ParseFailureException(String message) {
        super(message);
    }

}
