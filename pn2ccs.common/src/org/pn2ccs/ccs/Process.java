package org.pn2ccs.ccs;

/**
 * CCS process term. The set of subclasses is closed (package-private constructor);
 * consumers dispatch through {@link ProcessVisitor}.
 */
public abstract class Process {

    Process() {
    }

    public abstract <R> R accept(ProcessVisitor<R> visitor);

    @Override
    public String toString() {
        return PlainTextRenderer.render(this);
    }
}
