package org.pn2ccs.ccs;

import java.util.regex.Pattern;

import org.pn2ccs.exceptions.InvalidArgumentException;

/**
 * Reference to a named process definition.
 */
public final class Constant extends Process {

    static final Pattern NAME_PATTERN = Pattern.compile("^[A-Z][a-zA-Z0-9_]*$");

    private final String name;

    public Constant(String name) {
        if (!isValidName(name)) {
            throw new InvalidArgumentException("Constant name must be a PascalCase string, got: " + name);
        }
        this.name = name;
    }

    public static boolean isValidName(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(ProcessVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((Constant) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
