package org.pn2ccs.pnml;

/**
 * Failure to read a PNML document into a Petri net: malformed XML, missing or
 * duplicate ids, dangling arc references, or values the net rejects.
 */
public class PnmlImportException extends Exception {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "PNML_IMPORT_ERROR";

    private final String elementId;

    public PnmlImportException(String message) {
        this(message, null, null);
    }

    public PnmlImportException(String message, String elementId) {
        this(message, elementId, null);
    }

    public PnmlImportException(String message, String elementId, Throwable cause) {
        super(message, cause);
        this.elementId = elementId;
    }

    /**
     * PNML id of the offending element, when known.
     */
    public String getElementId() {
        return elementId;
    }

    public String getErrorCode() {
        return ERROR_CODE;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("PnmlImportException");
        if (elementId != null) {
            sb.append(" [").append(elementId).append("]");
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}
