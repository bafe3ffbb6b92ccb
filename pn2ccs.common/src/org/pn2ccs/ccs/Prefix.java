package org.pn2ccs.ccs;

import java.util.Objects;

/**
 * {@code action.process}
 */
public final class Prefix extends Process {

    private final Action action;
    private final Process process;

    public Prefix(Action action, Process process) {
        this.action = Objects.requireNonNull(action, "action cannot be null");
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
        return visitor.visitPrefix(this);
    }
}
