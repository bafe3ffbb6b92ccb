package org.pn2ccs.exceptions;

/**
 * Malformed id, name index, token count, label, weight or term component.
 */
public class InvalidArgumentException extends PetriNetException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "INVALID_ARGUMENT";

    public InvalidArgumentException(String message) {
        super(message, ERROR_CODE);
    }

    public InvalidArgumentException(String message, String elementName) {
        super(message, ERROR_CODE, elementName);
    }
}
