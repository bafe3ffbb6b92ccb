package org.pn2ccs.ccs;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders CCS terms in plain text: {@code a?.P}, {@code a!.P}, {@code τ.P}, {@code (P + Q)},
 * {@code (P | Q)}, {@code P^n}, {@code (νa)P} and {@code 0}.
 */
public final class PlainTextRenderer implements ProcessVisitor<String> {

    private static final PlainTextRenderer INSTANCE = new PlainTextRenderer();

    private PlainTextRenderer() {
    }

    public static String render(Process process) {
        return process.accept(INSTANCE);
    }

    public static String render(Action action) {
        switch (action.getKind()) {
            case INPUT:
                return action.getName() + "?";
            case CO:
                return action.getName() + "!";
            case INTERNAL:
            default:
                return "τ";
        }
    }

    /**
     * One {@code NAME := term} line per definition, a blank line, then the initial process.
     */
    public static String render(CcsSpecification specification) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Process> entry : specification.getDefinitions().entrySet()) {
            sb.append(entry.getKey()).append(" := ").append(render(entry.getValue())).append("\n");
        }
        sb.append("\n").append(render(specification.getProcess()));
        return sb.toString();
    }

    @Override
    public String visitInaction(Inaction inaction) {
        return "0";
    }

    @Override
    public String visitPrefix(Prefix prefix) {
        return render(prefix.getAction()) + "." + prefix.getProcess().accept(this);
    }

    @Override
    public String visitChoice(Choice choice) {
        return "(" + join(choice.getChoices(), " + ") + ")";
    }

    @Override
    public String visitParallel(Parallel parallel) {
        return "(" + join(parallel.getProcesses(), " | ") + ")";
    }

    @Override
    public String visitExponent(Exponent exponent) {
        return exponent.getProcess().accept(this) + "^" + exponent.getCount();
    }

    @Override
    public String visitRestriction(Restriction restriction) {
        return "(ν" + restriction.getAction().getName() + ")" + restriction.getProcess().accept(this);
    }

    @Override
    public String visitConstant(Constant constant) {
        return constant.getName();
    }

    private String join(List<? extends Process> processes, String separator) {
        List<String> parts = new ArrayList<>(processes.size());
        for (Process process : processes) {
            parts.add(process.accept(this));
        }
        return String.join(separator, parts);
    }
}
