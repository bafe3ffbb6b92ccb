package org.pn2ccs.ccs;

import java.util.Objects;

import org.pn2ccs.exceptions.InvalidArgumentException;

/**
 * {@code process^count}: {@code count} copies of a process in parallel.
 */
public final class Exponent extends Process {

    private final Process process;
    private final int count;

    public Exponent(Process process, int count) {
        this.process = Objects.requireNonNull(process, "process cannot be null");
        if (count < 0) {
            throw new InvalidArgumentException("Exponent must be a non-negative integer.");
        }
        this.count = count;
    }

    public Process getProcess() {
        return process;
    }

    public int getCount() {
        return count;
    }

    @Override
    public <R> R accept(ProcessVisitor<R> visitor) {
        return visitor.visitExponent(this);
    }
}
