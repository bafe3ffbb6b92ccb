package org.pn2ccs.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A slot in one of the two node arenas of a {@link PetriNet}.
 * 
 * The adjacency lists hold edge ids, not edge objects. They are maintained
 * exclusively by the owning net so that {@code e in out <=> source(e) == this}
 * and {@code e in in <=> target(e) == this} hold after every mutation.
 */
public abstract class Node {

    int id;
    int nameId;
    final List<Integer> in = new ArrayList<>();
    final List<Integer> out = new ArrayList<>();

    Node(int id, int nameId) {
        this.id = id;
        this.nameId = nameId;
    }

    public abstract NodeKind getKind();

    public int getId() {
        return id;
    }

    public int getNameId() {
        return nameId;
    }

    /**
     * Display name, {@code p<nameId>} or {@code t<nameId>}.
     */
    public String getName() {
        return getKind().getNamePrefix() + nameId;
    }

    /**
     * Ids of the edges ending in this node.
     */
    public List<Integer> getIn() {
        return Collections.unmodifiableList(in);
    }

    /**
     * Ids of the edges starting in this node.
     */
    public List<Integer> getOut() {
        return Collections.unmodifiableList(out);
    }

    public int inDegree() {
        return in.size();
    }

    public int outDegree() {
        return out.size();
    }

    @Override
    public String toString() {
        return getName() + "#" + id;
    }
}
