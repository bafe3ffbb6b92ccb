package org.pn2ccs.ccs;

import java.util.List;

import org.pn2ccs.exceptions.InvalidArgumentException;

/**
 * Parallel composition of at least two processes.
 */
public final class Parallel extends Process {

    private final List<Process> processes;

    public Parallel(List<? extends Process> processes) {
        if (processes == null || processes.size() < 2) {
            throw new InvalidArgumentException("Parallel composition needs a list of at least two processes.");
        }
        for (Process element : processes) {
            if (element == null) {
                throw new InvalidArgumentException("Parallel composition needs a list of at least two processes.");
            }
        }
        this.processes = List.copyOf(processes);
    }

    public List<Process> getProcesses() {
        return processes;
    }

    @Override
    public <R> R accept(ProcessVisitor<R> visitor) {
        return visitor.visitParallel(this);
    }
}
