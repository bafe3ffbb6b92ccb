package org.pn2ccs.model;

/**
 * The two node variants of a bipartite Petri net graph.
 */
public enum NodeKind {
    PLACE("p"),
    TRANSITION("t");

    private final String namePrefix;

    NodeKind(String namePrefix) {
        this.namePrefix = namePrefix;
    }

    /**
     * Prefix of the display name, {@code p} for places and {@code t} for transitions.
     */
    public String getNamePrefix() {
        return namePrefix;
    }
}
