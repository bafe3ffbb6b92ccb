package org.pn2ccs.model;

import java.util.regex.Pattern;

public final class Transition extends Node {

    /** Label of internal (silent) transitions. */
    public static final String TAU = "τ";

    static final Pattern LABEL_PATTERN = Pattern.compile("^([a-z][a-zA-Z0-9]*|τ)$");

    String label;

    Transition(int id, int nameId, String label) {
        super(id, nameId);
        this.label = label;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TRANSITION;
    }

    public String getLabel() {
        return label;
    }

    public boolean isTau() {
        return TAU.equals(label);
    }

    /**
     * Visible action names start lowercase and are alphanumeric; τ marks an internal step.
     */
    public static boolean isValidLabel(String label) {
        return label != null && LABEL_PATTERN.matcher(label).matches();
    }

    @Override
    public String toString() {
        return String.format("Transition{%s, id=%d, label=%s}", getName(), id, label);
    }
}
