package org.pn2ccs.exceptions;

/**
 * An edge already connects the requested ordered pair of nodes.
 * Multiplicity is expressed through the edge weight, never through parallel edges.
 */
public class DuplicateEdgeException extends PetriNetException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "DUPLICATE_EDGE";

    public DuplicateEdgeException(String message, String elementName) {
        super(message, ERROR_CODE, elementName);
    }
}
