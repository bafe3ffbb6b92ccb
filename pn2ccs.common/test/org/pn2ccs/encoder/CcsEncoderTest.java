package org.pn2ccs.encoder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;
import org.pn2ccs.ccs.Action;
import org.pn2ccs.ccs.CcsSpecification;
import org.pn2ccs.ccs.Choice;
import org.pn2ccs.ccs.Constant;
import org.pn2ccs.ccs.Exponent;
import org.pn2ccs.ccs.Inaction;
import org.pn2ccs.ccs.Parallel;
import org.pn2ccs.ccs.Prefix;
import org.pn2ccs.ccs.Process;
import org.pn2ccs.ccs.ProcessVisitor;
import org.pn2ccs.ccs.Restriction;
import org.pn2ccs.exceptions.StructuralMismatchException;
import org.pn2ccs.model.PetriNet;
import org.pn2ccs.model.Place;
import org.pn2ccs.model.Transition;
import org.pn2ccs.synchronizer.TwoTauSynchronizer;

public class CcsEncoderTest {

    private PetriNet net;
    private CcsEncoder encoder;

    @Before
    public void setUp() {
        net = new PetriNet();
        encoder = new CcsEncoder();
    }

    private Place place(int tokens) {
        return net.addPlace(PetriNet.AUTO_NAME, tokens);
    }

    private Transition transition(String label) {
        return net.addTransition(PetriNet.AUTO_NAME, label);
    }

    @Test
    public void singleMarkedPlace() {
        place(1);

        CcsSpecification specification = encoder.encode(net);

        assertEquals("X_p1 := 0\n\nX_p1", specification.toString());
    }

    @Test
    public void sequentialStep() {
        Place p1 = place(1);
        Place p2 = place(0);
        Transition t1 = transition("a");
        net.addEdge(p1, t1, 1);
        net.addEdge(t1, p2, 1);

        CcsSpecification specification = encoder.encode(net);

        assertEquals("X_p1 := a?.X_p2\nX_p2 := 0\n\nX_p1", specification.toString());
    }

    @Test
    public void tauSynchronisationUsesRestrictedChannel() {
        Place p1 = place(1);
        Place p2 = place(1);
        Place p3 = place(0);
        Transition t1 = transition(Transition.TAU);
        net.addEdge(p1, t1, 1);
        net.addEdge(p2, t1, 1);
        net.addEdge(t1, p3, 1);

        CcsSpecification specification = encoder.encode(net);

        assertEquals("X_p1 := s_t1!.0\n"
                + "X_p2 := s_t1?.X_p3\n"
                + "X_p3 := 0\n"
                + "\n"
                + "(νs_t1)(X_p1 | X_p2)", specification.toString());
    }

    @Test
    public void generatorIsDefinedFirstAndStarted() {
        Place p1 = place(0);
        Transition t1 = transition("a");
        net.addEdge(t1, p1, 2);

        CcsSpecification specification = encoder.encode(net);

        assertEquals("X_t1 := a?.(X_t1 | X_p1^2)\nX_p1 := 0\n\nX_t1", specification.toString());
        assertEquals("X_t1", specification.getDefinitions().keySet().iterator().next());
    }

    @Test
    public void markingBecomesExponent() {
        place(3);
        place(0);

        assertEquals("X_p1^3", encoder.encode(net).getProcess().toString());
    }

    @Test
    public void emptyMarkingStartsInaction() {
        place(0);

        assertEquals(Inaction.INSTANCE, encoder.encode(net).getProcess());
    }

    @Test
    public void sharedPlaceOffersChoice() {
        Place p1 = place(1);
        Transition t1 = transition("a");
        Transition t2 = transition("b");
        net.addEdge(p1, t1, 1);
        net.addEdge(p1, t2, 1);
        net.addEdge(t1, place(0), 1);
        net.addEdge(t2, place(0), 1);

        CcsSpecification specification = encoder.encode(net);

        assertEquals("(a?.X_p2 + b?.X_p3)", specification.getDefinition("X_p1").toString());
    }

    @Test
    public void channelsAreRestrictedInNameOrder() {
        Transition t1 = transition(Transition.TAU);
        Transition t2 = transition(Transition.TAU);
        net.addEdge(place(1), t1, 1);
        net.addEdge(place(1), t1, 1);
        net.addEdge(place(1), t2, 1);
        net.addEdge(place(1), t2, 1);

        CcsSpecification specification = encoder.encode(net);

        assertEquals("(νs_t1)(νs_t2)(X_p1 | X_p2 | X_p3 | X_p4)", specification.getProcess().toString());
    }

    @Test
    public void singleInputTauIsInternalPrefix() {
        Place p1 = place(1);
        Transition t1 = transition(Transition.TAU);
        net.addEdge(p1, t1, 1);
        net.addEdge(t1, place(0), 1);
        Transition t2 = transition("end");
        net.addEdge(place(0), t2, 1);

        CcsSpecification specification = encoder.encode(net);

        assertEquals("τ.X_p2", specification.getDefinition("X_p1").toString());
        assertEquals("end?.0", specification.getDefinition("X_p3").toString());
    }

    @Test
    public void weightedOutputsAreComposedInParallel() {
        Place p1 = place(1);
        Transition t1 = transition("fork");
        net.addEdge(p1, t1, 1);
        net.addEdge(t1, place(0), 1);
        net.addEdge(t1, place(0), 2);

        assertEquals("fork?.(X_p2 | X_p3^2)", encoder.encode(net).getDefinition("X_p1").toString());
    }

    @Test
    public void everyChannelIsOfferedOnceOnEachSide() {
        Transition t1 = net.addTransition(PetriNet.AUTO_NAME, "a");
        Transition t2 = net.addTransition(PetriNet.AUTO_NAME, "b");
        for (int i = 0; i < 4; i++) {
            Place input = place(1);
            net.addEdge(input, t1, 1);
            net.addEdge(input, t2, 1);
        }
        net.addEdge(t1, place(0), 1);
        PetriNet synchronised = new TwoTauSynchronizer(17L).synchronize(net);

        CcsSpecification specification = encoder.encode(synchronised);

        ActionCounter counter = new ActionCounter();
        for (Process definition : specification.getDefinitions().values()) {
            definition.accept(counter);
        }
        List<String> restricted = new ArrayList<>();
        Process process = specification.getProcess();
        while (process instanceof Restriction) {
            restricted.add(((Restriction) process).getAction().getName());
            process = ((Restriction) process).getProcess();
        }

        assertEquals(3, restricted.size());
        for (String channel : restricted) {
            assertTrue(channel.startsWith("s_t"));
            assertEquals(Integer.valueOf(1), counter.inputs.get(channel));
            assertEquals(Integer.valueOf(1), counter.coActions.get(channel));
        }
        assertEquals(3, counter.coActions.size());
    }

    @Test
    public void unsynchronisedNetIsRejected() {
        Transition t1 = transition("a");
        net.addEdge(place(1), t1, 1);
        net.addEdge(place(1), t1, 1);

        try {
            encoder.encode(net);
            fail("expected StructuralMismatchException");
        } catch (StructuralMismatchException e) {
            assertEquals(StructuralMismatchException.ERROR_CODE, e.getErrorCode());
            assertEquals("2-τ-synchronisation", e.getRequiredClass());
        }
    }

    private static final class ActionCounter implements ProcessVisitor<Void> {

        final Map<String, Integer> inputs = new HashMap<>();
        final Map<String, Integer> coActions = new HashMap<>();

        @Override
        public Void visitInaction(Inaction inaction) {
            return null;
        }

        @Override
        public Void visitPrefix(Prefix prefix) {
            Action action = prefix.getAction();
            if (action.getKind() == Action.Kind.INPUT) {
                inputs.merge(action.getName(), 1, Integer::sum);
            } else if (action.getKind() == Action.Kind.CO) {
                coActions.merge(action.getName(), 1, Integer::sum);
            }
            return prefix.getProcess().accept(this);
        }

        @Override
        public Void visitChoice(Choice choice) {
            for (Prefix prefix : choice.getChoices()) {
                prefix.accept(this);
            }
            return null;
        }

        @Override
        public Void visitParallel(Parallel parallel) {
            for (Process process : parallel.getProcesses()) {
                process.accept(this);
            }
            return null;
        }

        @Override
        public Void visitExponent(Exponent exponent) {
            return exponent.getProcess().accept(this);
        }

        @Override
        public Void visitRestriction(Restriction restriction) {
            return restriction.getProcess().accept(this);
        }

        @Override
        public Void visitConstant(Constant constant) {
            return null;
        }
    }
}
