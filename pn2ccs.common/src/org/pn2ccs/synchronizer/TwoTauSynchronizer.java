package org.pn2ccs.synchronizer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

import org.apache.log4j.Logger;
import org.pn2ccs.analysis.PetriNetClassifier;
import org.pn2ccs.exceptions.StructuralMismatchException;
import org.pn2ccs.model.Edge;
import org.pn2ccs.model.PetriNet;
import org.pn2ccs.model.Place;
import org.pn2ccs.model.Transition;

/**
 * Turns a group-choice net into an equivalent 2-τ-synchronisation net.
 *
 * Every transition with more inputs than a 2-τ-synchronisation net allows has its
 * input fan replaced by a randomly shaped binary tree of fresh τ-transitions, each
 * merging two places into a fresh place. Because the input is group-choice, all
 * transitions of the group share the same input places, so the whole group is
 * rewired at once to the root(s) of the tree.
 *
 * The input net is never modified; the result is an independent copy. Randomness is
 * drawn only from the {@link Random} given at construction, so a seeded instance
 * reproduces the exact pairing sequence.
 */
public class TwoTauSynchronizer {

    private static final Logger logger = Logger.getLogger(TwoTauSynchronizer.class);

    private final Random random;

    public TwoTauSynchronizer(Random random) {
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    public TwoTauSynchronizer(long seed) {
        this(new Random(seed));
    }

    /**
     * @throws StructuralMismatchException if the net is neither a 2-τ-synchronisation
     *         net nor a group-choice net
     */
    public PetriNet synchronize(PetriNet source) {
        boolean alreadySynchronised = PetriNetClassifier.is2TauSynchronisationNet(source);
        if (!alreadySynchronised && !PetriNetClassifier.isGroupChoiceNet(source)) {
            throw new StructuralMismatchException(
                    "Petri net is neither a 2-τ-synchronisation net nor a group-choice net as required.",
                    "group-choice");
        }

        PetriNet net = copy(source);
        if (alreadySynchronised) {
            logger.debug("Net is already a 2-τ-synchronisation net, returning copy");
            return net;
        }

        int originalTransitions = net.getTransitions().size();
        for (int t = 0; t < originalTransitions; t++) {
            Transition transition = net.getTransition(t);
            if (transition.inDegree() > inputLimit(transition)) {
                synchronizeGroup(net, transition);
            }
        }

        if (!PetriNetClassifier.is2TauSynchronisationNet(net)) {
            throw new IllegalStateException("Synchronisation did not produce a 2-τ-synchronisation net");
        }
        logger.debug("Synchronised " + source + " into " + net);
        return net;
    }

    /**
     * Random merge order for {@code size} places of which {@code done} stay unmerged.
     * Each consecutive pair of entries names two distinct slots of the shrinking
     * working list, smaller slot first.
     */
    List<Integer> pairingOrder(int size, int done) {
        List<Integer> order = new ArrayList<>();
        for (int i = size - 1; i >= done; i--) {
            int first = draw(i);
            int second = draw(i - 1);
            order.add(Math.min(first, second));
            order.add(Math.max(first, second + (first <= second ? 1 : 0)));
        }
        return order;
    }

    // === GROUP REWRITING ===

    private void synchronizeGroup(PetriNet net, Transition transition) {
        List<Place> places = new ArrayList<>();
        for (Edge edge : net.inEdges(transition)) {
            places.add(net.placeOf(edge));
        }
        // group-choice: every feeding place has this very post-set
        List<Transition> transitions = new ArrayList<>();
        for (Edge edge : net.outEdges(places.get(0))) {
            transitions.add(net.transitionOf(edge));
        }

        int done = 2;
        for (Transition member : transitions) {
            if (!member.isTau()) {
                done = 1;
                break;
            }
        }

        List<Integer> order = pairingOrder(places.size(), done);
        logger.debug("Synchronising " + places.size() + " inputs of " + transition.getName()
                + " (group of " + transitions.size() + ", keeping " + done + "), order " + order);

        Set<Edge> fan = new LinkedHashSet<>();
        for (Place place : places) {
            fan.addAll(net.outEdges(place));
        }
        for (Transition member : transitions) {
            fan.addAll(net.inEdges(member));
        }
        for (Edge edge : fan) {
            net.removeEdge(edge);
        }

        for (int i = 0; i < order.size(); i += 2) {
            int first = order.get(i);
            int second = order.get(i + 1);
            Transition merge = net.addTransition(PetriNet.AUTO_NAME, Transition.TAU);
            Place merged = net.addPlace(PetriNet.AUTO_NAME, 0);
            net.addEdge(places.get(first), merge, 1);
            net.addEdge(places.get(second), merge, 1);
            net.addEdge(merge, merged, 1);
            places.set(first, merged);
            int last = places.size() - 1;
            places.set(second, places.get(last));
            places.remove(last);
        }

        for (Place place : places) {
            for (Transition member : transitions) {
                net.addEdge(place, member, 1);
            }
        }
    }

    // === HELPER METHODS ===

    /**
     * Deep copy preserving ids, name indices, tokens, labels and weights.
     */
    private static PetriNet copy(PetriNet source) {
        PetriNet net = new PetriNet();
        for (Place place : source.getPlaces()) {
            net.addPlace(place.getNameId(), place.getTokens());
        }
        for (Transition transition : source.getTransitions()) {
            net.addTransition(transition.getNameId(), transition.getLabel());
        }
        for (Place place : source.getPlaces()) {
            for (Edge edge : source.outEdges(place)) {
                net.addEdge(net.getPlace(edge.getPlace()), net.getTransition(edge.getTransition()), edge.getWeight());
            }
        }
        for (Transition transition : source.getTransitions()) {
            for (Edge edge : source.outEdges(transition)) {
                net.addEdge(net.getTransition(edge.getTransition()), net.getPlace(edge.getPlace()), edge.getWeight());
            }
        }
        return net;
    }

    private static int inputLimit(Transition transition) {
        return transition.isTau() ? 2 : 1;
    }

    private int draw(int bound) {
        return bound > 0 ? random.nextInt(bound) : 0;
    }
}
