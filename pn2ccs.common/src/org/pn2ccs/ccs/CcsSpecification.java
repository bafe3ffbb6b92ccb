package org.pn2ccs.ccs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.pn2ccs.exceptions.InvalidArgumentException;

/**
 * A set of named process definitions ({@code X := P}) together with the initial process.
 * Definition order is preserved for rendering.
 */
public final class CcsSpecification {

    private final Map<String, Process> definitions;
    private final Process process;

    public CcsSpecification(Map<String, ? extends Process> definitions, Process process) {
        Objects.requireNonNull(definitions, "definitions cannot be null");
        for (Map.Entry<String, ? extends Process> entry : definitions.entrySet()) {
            if (!Constant.isValidName(entry.getKey())) {
                throw new InvalidArgumentException("Definition name is not PascalCase: " + entry.getKey());
            }
            if (entry.getValue() == null) {
                throw new InvalidArgumentException("Definition " + entry.getKey() + " is not a process.");
            }
        }
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
        this.process = Objects.requireNonNull(process, "initial process cannot be null");
    }

    public Map<String, Process> getDefinitions() {
        return definitions;
    }

    public Process getDefinition(String name) {
        return definitions.get(name);
    }

    /**
     * The initial process the definitions are started from.
     */
    public Process getProcess() {
        return process;
    }

    public String toHtml() {
        return HtmlRenderer.render(this);
    }

    @Override
    public String toString() {
        return PlainTextRenderer.render(this);
    }
}
