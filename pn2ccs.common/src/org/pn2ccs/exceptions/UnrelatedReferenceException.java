package org.pn2ccs.exceptions;

/**
 * A node or edge handed to a net does not belong to that net instance.
 */
public class UnrelatedReferenceException extends PetriNetException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "UNRELATED_REFERENCE";

    public UnrelatedReferenceException(String message, String elementName) {
        super(message, ERROR_CODE, elementName);
    }
}
