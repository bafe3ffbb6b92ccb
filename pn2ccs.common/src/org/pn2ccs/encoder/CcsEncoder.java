package org.pn2ccs.encoder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.apache.log4j.Logger;
import org.pn2ccs.analysis.PetriNetClassifier;
import org.pn2ccs.ccs.Action;
import org.pn2ccs.ccs.CcsSpecification;
import org.pn2ccs.ccs.Choice;
import org.pn2ccs.ccs.Constant;
import org.pn2ccs.ccs.Exponent;
import org.pn2ccs.ccs.Inaction;
import org.pn2ccs.ccs.Parallel;
import org.pn2ccs.ccs.Prefix;
import org.pn2ccs.ccs.Process;
import org.pn2ccs.ccs.Restriction;
import org.pn2ccs.exceptions.StructuralMismatchException;
import org.pn2ccs.model.Edge;
import org.pn2ccs.model.Node;
import org.pn2ccs.model.PetriNet;
import org.pn2ccs.model.Place;
import org.pn2ccs.model.Transition;

/**
 * Encodes a 2-τ-synchronisation net as a CCS specification.
 *
 * Each place {@code pN} becomes a constant {@code X_pN} whose definition offers a
 * choice over the transitions it feeds. Transitions map by their number of inputs:
 * - 0 inputs: a self-regenerating generator {@code X_tN := a.(outputs | X_tN)}
 * - 1 input: the prefix {@code a.outputs}, inlined into the feeding place
 * - 2 inputs (τ): a fresh restricted channel {@code s_tN}; the first feeding place
 *   (in place order) offers {@code s_tN!.0}, the second {@code s_tN?.outputs}
 *
 * The encoder keeps no state between calls.
 */
public class CcsEncoder {

    private static final Logger logger = Logger.getLogger(CcsEncoder.class);

    private static final String CONSTANT_PREFIX = "X_";
    private static final String SYNCHRONISATION_PREFIX = "s_";

    /**
     * @throws StructuralMismatchException if the net is not a 2-τ-synchronisation net
     */
    public CcsSpecification encode(PetriNet net) {
        if (!PetriNetClassifier.is2TauSynchronisationNet(net)) {
            throw new StructuralMismatchException("Petri net is not a 2-τ-synchronisation net.",
                    "2-τ-synchronisation");
        }

        Map<String, Process> definitions = new LinkedHashMap<>();
        List<Constant> placeConstants = new ArrayList<>();
        for (Place place : net.getPlaces()) {
            placeConstants.add(constantFor(place));
        }

        int transitionCount = net.getTransitions().size();
        Prefix[] replacements = new Prefix[transitionCount];
        String[] synchronisations = new String[transitionCount];
        List<Process> generators = new ArrayList<>();
        TreeSet<String> channels = new TreeSet<>();

        for (Transition transition : net.getTransitions()) {
            List<Process> outputs = outputsOf(net, transition, placeConstants);
            switch (transition.inDegree()) {
                case 0: {
                    Constant generator = constantFor(transition);
                    outputs.add(0, generator);
                    definitions.put(generator.getName(), new Prefix(actionFor(transition), compose(outputs)));
                    generators.add(generator);
                    break;
                }
                case 1:
                    replacements[transition.getId()] = new Prefix(actionFor(transition), compose(outputs));
                    break;
                default: {
                    String channel = SYNCHRONISATION_PREFIX + transition.getName();
                    replacements[transition.getId()] = new Prefix(Action.input(channel), compose(outputs));
                    synchronisations[transition.getId()] = channel;
                    channels.add(channel);
                    break;
                }
            }
        }

        boolean[] coActionIssued = new boolean[transitionCount];
        for (Place place : net.getPlaces()) {
            List<Prefix> choices = new ArrayList<>();
            for (Edge edge : net.outEdges(place)) {
                int t = edge.getTransition();
                if (synchronisations[t] != null && !coActionIssued[t]) {
                    coActionIssued[t] = true;
                    choices.add(new Prefix(Action.co(synchronisations[t]), Inaction.INSTANCE));
                } else {
                    choices.add(replacements[t]);
                }
            }
            definitions.put(placeConstants.get(place.getId()).getName(), choose(choices));
        }

        List<Process> initial = new ArrayList<>();
        for (Place place : net.getPlaces()) {
            if (place.getTokens() == 1) {
                initial.add(placeConstants.get(place.getId()));
            } else if (place.getTokens() > 1) {
                initial.add(new Exponent(placeConstants.get(place.getId()), place.getTokens()));
            }
        }
        initial.addAll(generators);

        // smallest channel outermost
        Process process = compose(initial);
        for (String channel : channels.descendingSet()) {
            process = new Restriction(Action.input(channel), process);
        }

        logger.debug("Encoded " + net + " into " + definitions.size() + " definitions and "
                + channels.size() + " synchronisation channels");
        return new CcsSpecification(definitions, process);
    }

    // === HELPER METHODS ===

    private static List<Process> outputsOf(PetriNet net, Transition transition, List<Constant> placeConstants) {
        List<Process> outputs = new ArrayList<>();
        for (Edge edge : net.outEdges(transition)) {
            Constant target = placeConstants.get(edge.getPlace());
            outputs.add(edge.getWeight() == 1 ? target : new Exponent(target, edge.getWeight()));
        }
        return outputs;
    }

    private static Action actionFor(Transition transition) {
        return transition.isTau() ? Action.internal() : Action.input(transition.getLabel());
    }

    private static Constant constantFor(Node node) {
        return new Constant(CONSTANT_PREFIX + node.getName());
    }

    /** 0 processes → 0, one → itself, more → parallel composition. */
    private static Process compose(List<Process> processes) {
        if (processes.isEmpty()) {
            return Inaction.INSTANCE;
        }
        if (processes.size() == 1) {
            return processes.get(0);
        }
        return new Parallel(processes);
    }

    private static Process choose(List<Prefix> choices) {
        if (choices.isEmpty()) {
            return Inaction.INSTANCE;
        }
        if (choices.size() == 1) {
            return choices.get(0);
        }
        return new Choice(choices);
    }
}
