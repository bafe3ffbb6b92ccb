package org.pn2ccs.ccs;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

public class RendererTest {

    private static final Constant P1 = new Constant("X_p1");
    private static final Constant P2 = new Constant("X_p2");
    private static final Constant P3 = new Constant("X_p3");

    /** Encoding of two marked places synchronising over τ into a third. */
    private static CcsSpecification synchronisation() {
        Map<String, Process> definitions = new LinkedHashMap<>();
        definitions.put("X_p1", new Prefix(Action.co("s_t1"), Inaction.INSTANCE));
        definitions.put("X_p2", new Prefix(Action.input("s_t1"), P3));
        definitions.put("X_p3", Inaction.INSTANCE);
        Process initial = new Restriction(Action.input("s_t1"), new Parallel(Arrays.asList(P1, P2)));
        return new CcsSpecification(definitions, initial);
    }

    @Test
    public void plainTextSpecification() {
        assertEquals("X_p1 := s_t1!.0\nX_p2 := s_t1?.X_p3\nX_p3 := 0\n\n(νs_t1)(X_p1 | X_p2)",
                synchronisation().toString());
    }

    @Test
    public void htmlSpecification() {
        assertEquals("X<sub>p1</sub> := <span class=\"overline\">s<sub>t1</sub></span>.<b>0</b><br>"
                + "X<sub>p2</sub> := s<sub>t1</sub>.X<sub>p3</sub><br>"
                + "X<sub>p3</sub> := <b>0</b><br><br>"
                + "(νs<sub>t1</sub>)(X<sub>p1</sub> | X<sub>p2</sub>)",
                synchronisation().toHtml());
    }

    @Test
    public void plainTextTerms() {
        Process choice = new Choice(Arrays.asList(
                new Prefix(Action.input("a"), P2),
                new Prefix(Action.internal(), new Exponent(P3, 2))));

        assertEquals("(a?.X_p2 + τ.X_p3^2)", PlainTextRenderer.render(choice));
        assertEquals("0", Inaction.INSTANCE.toString());
        assertEquals("a!", Action.co("a").toString());
        assertEquals("τ", Action.internal().toString());
    }

    @Test
    public void htmlTerms() {
        Process generator = new Prefix(Action.input("go"),
                new Parallel(Arrays.asList(new Constant("X_t2"), new Exponent(P1, 3))));

        assertEquals("go.(X<sub>t2</sub> | X<sub>p1</sub><sup>3</sup>)", HtmlRenderer.render(generator));
        assertEquals("τ", HtmlRenderer.render(Action.internal()));
    }

    @Test
    public void htmlLeavesOtherNamesAlone() {
        Process term = new Prefix(Action.co("send_x"), new Constant("Idle"));

        assertEquals("<span class=\"overline\">send_x</span>.Idle", HtmlRenderer.render(term));
    }

    @Test
    public void emptySpecificationStillSeparatesProcess() {
        CcsSpecification specification = new CcsSpecification(new LinkedHashMap<>(), Inaction.INSTANCE);

        assertEquals("\n0", specification.toString());
        assertEquals("<br><br><b>0</b>", specification.toHtml());
    }
}
