package org.pn2ccs.ccs;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders CCS terms as annotated HTML fragments: node-name suffixes become subscripts,
 * co-actions are overlined, exponents are superscripts and {@code 0} is bold.
 */
public final class HtmlRenderer implements ProcessVisitor<String> {

    private static final HtmlRenderer INSTANCE = new HtmlRenderer();

    private HtmlRenderer() {
    }

    public static String render(Process process) {
        return process.accept(INSTANCE);
    }

    public static String render(Action action) {
        switch (action.getKind()) {
            case INPUT:
                return subscriptTransition(action.getName());
            case CO:
                return "<span class=\"overline\">" + subscriptTransition(action.getName()) + "</span>";
            case INTERNAL:
            default:
                return "τ";
        }
    }

    public static String render(CcsSpecification specification) {
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, Process> entry : specification.getDefinitions().entrySet()) {
            lines.add(subscriptNode(entry.getKey()) + " := " + render(entry.getValue()));
        }
        return String.join("<br>", lines) + "<br><br>" + render(specification.getProcess());
    }

    @Override
    public String visitInaction(Inaction inaction) {
        return "<b>0</b>";
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
        return exponent.getProcess().accept(this) + "<sup>" + exponent.getCount() + "</sup>";
    }

    @Override
    public String visitRestriction(Restriction restriction) {
        return "(ν" + render(restriction.getAction()) + ")" + restriction.getProcess().accept(this);
    }

    @Override
    public String visitConstant(Constant constant) {
        return subscriptNode(constant.getName());
    }

    private String join(List<? extends Process> processes, String separator) {
        List<String> parts = new ArrayList<>(processes.size());
        for (Process process : processes) {
            parts.add(process.accept(this));
        }
        return String.join(separator, parts);
    }

    private static String subscriptTransition(String name) {
        return name.replaceAll("_(t\\d+)$", "<sub>$1</sub>");
    }

    private static String subscriptNode(String name) {
        return name.replaceAll("_([pt]\\d+)$", "<sub>$1</sub>");
    }
}
