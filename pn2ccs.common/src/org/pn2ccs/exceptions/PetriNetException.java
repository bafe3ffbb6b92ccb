package org.pn2ccs.exceptions;

/**
 * Base exception for all Petri net model, classification and encoding errors.
 * Carries an error code so callers can react to the failure kind without
 * inspecting the concrete class.
 */
public class PetriNetException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;
    private final String elementName;

    public PetriNetException(String message, String errorCode, String elementName) {
        super(message);
        this.errorCode = errorCode;
        this.elementName = elementName;
    }

    public PetriNetException(String message, String errorCode) {
        this(message, errorCode, null);
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Display name of the offending place/transition/edge, when known.
     */
    public String getElementName() {
        return elementName;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        if (errorCode != null) {
            sb.append(" [").append(errorCode);
            if (elementName != null) {
                sb.append(":").append(elementName);
            }
            sb.append("]");
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}
