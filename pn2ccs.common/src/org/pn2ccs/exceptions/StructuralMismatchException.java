package org.pn2ccs.exceptions;

/**
 * The net does not belong to the structural class an operation requires,
 * e.g. encoding a net that is not a 2-τ-synchronisation net.
 */
public class StructuralMismatchException extends PetriNetException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "STRUCTURAL_MISMATCH";

    private final String requiredClass;

    public StructuralMismatchException(String message, String requiredClass) {
        super(message, ERROR_CODE);
        this.requiredClass = requiredClass;
    }

    public String getRequiredClass() {
        return requiredClass;
    }
}
