package org.pn2ccs.analysis;

/**
 * Structural net classes, from the most general to the most specific.
 */
public enum NetClass {
    PETRI_NET("Petri net"),
    GROUP_CHOICE("Group-choice net"),
    TWO_TAU_SYNCHRONISATION("2-τ-synchronisation net"),
    CCS("CCS net"),
    FREE_CHOICE("Free-choice net"),
    WORKFLOW("Workflow net"),
    FREE_CHOICE_WORKFLOW("Free-choice workflow net");

    private final String displayName;

    NetClass(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
