package org.pn2ccs.ccs;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;
import org.pn2ccs.exceptions.InvalidArgumentException;

public class ProcessTest {

    @Test
    public void actionsCompareByKindAndName() {
        assertEquals(Action.input("a"), Action.input("a"));
        assertNotEquals(Action.input("a"), Action.co("a"));
        assertSame(Action.internal(), Action.internal());
        assertNull(Action.internal().getName());
    }

    @Test(expected = InvalidArgumentException.class)
    public void actionNameMustStartLowercase() {
        Action.input("Send");
    }

    @Test(expected = InvalidArgumentException.class)
    public void actionNameMustNotBeEmpty() {
        Action.co("");
    }

    @Test
    public void constantNames() {
        assertTrue(Constant.isValidName("X_p1"));
        assertTrue(Constant.isValidName("Idle"));
        assertFalse(Constant.isValidName("x"));
        assertFalse(Constant.isValidName(null));
        assertEquals(new Constant("X_p1"), new Constant("X_p1"));
    }

    @Test(expected = InvalidArgumentException.class)
    public void constantRejectsLowercase() {
        new Constant("idle");
    }

    @Test(expected = InvalidArgumentException.class)
    public void choiceNeedsTwoPrefixes() {
        new Choice(Collections.singletonList(new Prefix(Action.input("a"), Inaction.INSTANCE)));
    }

    @Test(expected = InvalidArgumentException.class)
    public void choiceRejectsNullPrefix() {
        new Choice(Arrays.asList(new Prefix(Action.input("a"), Inaction.INSTANCE), null));
    }

    @Test(expected = InvalidArgumentException.class)
    public void parallelNeedsTwoProcesses() {
        new Parallel(Collections.singletonList(Inaction.INSTANCE));
    }

    @Test
    public void parallelCopiesItsProcesses() {
        List<Process> processes = new ArrayList<>(Arrays.asList(Inaction.INSTANCE, new Constant("A")));
        Parallel parallel = new Parallel(processes);
        processes.clear();

        assertEquals(2, parallel.getProcesses().size());
    }

    @Test(expected = InvalidArgumentException.class)
    public void exponentMustNotBeNegative() {
        new Exponent(Inaction.INSTANCE, -1);
    }

    @Test
    public void zeroExponentIsAllowed() {
        assertEquals("A^0", new Exponent(new Constant("A"), 0).toString());
    }

    @Test(expected = InvalidArgumentException.class)
    public void restrictionNeedsInputAction() {
        new Restriction(Action.co("a"), Inaction.INSTANCE);
    }

    @Test(expected = InvalidArgumentException.class)
    public void definitionNamesMustBeConstants() {
        Map<String, Process> definitions = new LinkedHashMap<>();
        definitions.put("x_p1", Inaction.INSTANCE);
        new CcsSpecification(definitions, Inaction.INSTANCE);
    }

    @Test
    public void specificationKeepsDefinitionOrder() {
        Map<String, Process> definitions = new LinkedHashMap<>();
        definitions.put("B", Inaction.INSTANCE);
        definitions.put("A", new Constant("B"));
        CcsSpecification specification = new CcsSpecification(definitions, new Constant("A"));
        definitions.clear();

        assertEquals(Arrays.asList("B", "A"), new ArrayList<>(specification.getDefinitions().keySet()));
        assertEquals(new Constant("B"), specification.getDefinition("A"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void specificationDefinitionsAreReadOnly() {
        new CcsSpecification(new LinkedHashMap<>(), Inaction.INSTANCE).getDefinitions().put("A", Inaction.INSTANCE);
    }
}
