package org.pn2ccs.ccs;

/**
 * The terminated process {@code 0}.
 */
public final class Inaction extends Process {

    public static final Inaction INSTANCE = new Inaction();

    private Inaction() {
    }

    @Override
    public <R> R accept(ProcessVisitor<R> visitor) {
        return visitor.visitInaction(this);
    }
}
