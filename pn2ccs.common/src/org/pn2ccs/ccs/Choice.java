package org.pn2ccs.ccs;

import java.util.List;

import org.pn2ccs.exceptions.InvalidArgumentException;

/**
 * Guarded choice between at least two prefixes.
 */
public final class Choice extends Process {

    private final List<Prefix> choices;

    public Choice(List<Prefix> choices) {
        if (choices == null || choices.size() < 2) {
            throw new InvalidArgumentException("Choices must be given a list of at least two prefixes.");
        }
        for (Prefix element : choices) {
            if (element == null) {
                throw new InvalidArgumentException("Choices must be given a list of at least two prefixes.");
            }
        }
        this.choices = List.copyOf(choices);
    }

    public List<Prefix> getChoices() {
        return choices;
    }

    @Override
    public <R> R accept(ProcessVisitor<R> visitor) {
        return visitor.visitChoice(this);
    }
}
