package org.pn2ccs.ccs;

import java.util.Objects;
import java.util.regex.Pattern;

import org.pn2ccs.exceptions.InvalidArgumentException;

/**
 * CCS action: an input action {@code a?}, its co-action {@code a!}, or the internal action τ.
 */
public final class Action {

    public enum Kind {
        INPUT,
        CO,
        INTERNAL
    }

    static final Pattern NAME_PATTERN = Pattern.compile("^[a-z][a-zA-Z0-9_]*$");

    private static final Action INTERNAL = new Action(Kind.INTERNAL, null);

    private final Kind kind;
    private final String name;

    private Action(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    public static Action input(String name) {
        return new Action(Kind.INPUT, validName(name));
    }

    public static Action co(String name) {
        return new Action(Kind.CO, validName(name));
    }

    public static Action internal() {
        return INTERNAL;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Channel name, {@code null} for the internal action.
     */
    public String getName() {
        return name;
    }

    private static String validName(String name) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new InvalidArgumentException("Action name must be a non-empty camelCase string, got: " + name);
        }
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Action that = (Action) o;
        return kind == that.kind && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return PlainTextRenderer.render(this);
    }
}
