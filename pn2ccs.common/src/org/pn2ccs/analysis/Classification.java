package org.pn2ccs.analysis;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Snapshot of the classes a net belonged to when it was classified.
 */
public final class Classification {

    private final Set<NetClass> classes;

    Classification(EnumSet<NetClass> classes) {
        this.classes = Collections.unmodifiableSet(EnumSet.copyOf(classes));
    }

    public boolean is(NetClass netClass) {
        return classes.contains(netClass);
    }

    public Set<NetClass> getClasses() {
        return classes;
    }

    /**
     * A net can be turned into CCS when it is group-choice (after synchronisation)
     * or already a 2-τ-synchronisation net.
     */
    public boolean isEncodable() {
        return is(NetClass.GROUP_CHOICE) || is(NetClass.TWO_TAU_SYNCHRONISATION);
    }

    public boolean needsSynchronisation() {
        return isEncodable() && !is(NetClass.TWO_TAU_SYNCHRONISATION);
    }

    @Override
    public String toString() {
        return "Classification" + classes;
    }
}
