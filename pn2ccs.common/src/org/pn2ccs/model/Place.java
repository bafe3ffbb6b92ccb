package org.pn2ccs.model;

public final class Place extends Node {

    int tokens;

    Place(int id, int nameId, int tokens) {
        super(id, nameId);
        this.tokens = tokens;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PLACE;
    }

    public int getTokens() {
        return tokens;
    }

    @Override
    public String toString() {
        return String.format("Place{%s, id=%d, tokens=%d}", getName(), id, tokens);
    }
}
