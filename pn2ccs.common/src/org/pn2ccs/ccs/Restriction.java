package org.pn2ccs.ccs;

import java.util.Objects;

import org.pn2ccs.exceptions.InvalidArgumentException;

/**
 * {@code (νa)process}: hides channel {@code a} so it can only fire as a synchronisation.
 */
public final class Restriction extends Process {

    private final Action action;
    private final Process process;

    public Restriction(Action action, Process process) {
        if (action == null || action.getKind() != Action.Kind.INPUT) {
            throw new InvalidArgumentException("Restriction action must be an input action.");
        }
        this.action = action;
        this.process = Objects.requireNonNull(process, "process cannot be null");
    }

    public Action getAction() {
        return action;
    }

    public Process getProcess() {
        return process;
    }

    @Override
    public <R> R accept(ProcessVisitor<R> visitor) {
        return visitor.visitRestriction(this);
    }
}
