package org.pn2ccs.ccs;

/**
 * Exhaustive dispatch over the closed set of CCS process terms.
 */
public interface ProcessVisitor<R> {

    R visitInaction(Inaction inaction);

    R visitPrefix(Prefix prefix);

    R visitChoice(Choice choice);

    R visitParallel(Parallel parallel);

    R visitExponent(Exponent exponent);

    R visitRestriction(Restriction restriction);

    R visitConstant(Constant constant);
}
