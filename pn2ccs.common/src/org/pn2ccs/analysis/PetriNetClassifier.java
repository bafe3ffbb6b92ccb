package org.pn2ccs.analysis;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;
import org.pn2ccs.model.Edge;
import org.pn2ccs.model.Node;
import org.pn2ccs.model.NodeKind;
import org.pn2ccs.model.PetriNet;
import org.pn2ccs.model.Place;
import org.pn2ccs.model.Transition;

/**
 * Structural classification of Petri nets.
 *
 * All predicates are pure: they only read the net and never mutate it.
 */
public final class PetriNetClassifier {

    private static final Logger logger = Logger.getLogger(PetriNetClassifier.class);

    private PetriNetClassifier() {
    }

    /**
     * Evaluates every predicate once and folds the class implications in, e.g. a
     * free-choice net is always reported as group-choice too.
     */
    public static Classification classify(PetriNet net) {
        boolean workflow = isWorkflowNet(net);
        boolean freeChoice = isFreeChoiceNet(net);
        boolean ccs = isCCSNet(net);

        EnumSet<NetClass> classes = EnumSet.of(NetClass.PETRI_NET);
        if (freeChoice || isGroupChoiceNet(net)) {
            classes.add(NetClass.GROUP_CHOICE);
        }
        if (ccs || is2TauSynchronisationNet(net)) {
            classes.add(NetClass.TWO_TAU_SYNCHRONISATION);
        }
        if (ccs) {
            classes.add(NetClass.CCS);
        }
        if (freeChoice) {
            classes.add(NetClass.FREE_CHOICE);
        }
        if (workflow) {
            classes.add(NetClass.WORKFLOW);
        }
        if (workflow && freeChoice) {
            classes.add(NetClass.FREE_CHOICE_WORKFLOW);
        }

        Classification classification = new Classification(classes);
        logger.debug("Classified " + net + " as " + classification.getClasses());
        return classification;
    }

    // === IN-DEGREE BOUNDED CLASSES ===

    /**
     * Every transition has exactly one input, or exactly two inputs and label τ.
     */
    public static boolean isCCSNet(PetriNet net) {
        for (Transition transition : net.getTransitions()) {
            int inputs = transition.inDegree();
            if (!(inputs == 1 || (inputs == 2 && transition.isTau()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Every transition has fewer than two inputs, or exactly two inputs and label τ.
     * Unlike CCS nets, input-free generator transitions are allowed.
     */
    public static boolean is2TauSynchronisationNet(PetriNet net) {
        for (Transition transition : net.getTransitions()) {
            int inputs = transition.inDegree();
            if (!(inputs < 2 || (inputs == 2 && transition.isTau()))) {
                return false;
            }
        }
        return true;
    }

    // === CHOICE CLASSES ===

    /**
     * Every transition with more than one input is fed only by places that have
     * that transition as their single output.
     */
    public static boolean isFreeChoiceNet(PetriNet net) {
        for (Transition transition : net.getTransitions()) {
            if (transition.inDegree() <= 1) {
                continue;
            }
            for (Edge edge : net.inEdges(transition)) {
                if (net.placeOf(edge).outDegree() != 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Places whose post-sets overlap must have identical post-sets.
     *
     * For each place not yet confirmed, every other place feeding a transition of
     * its post-set must have exactly the same post-set. Places reached this way
     * are confirmed and never validated again.
     */
    public static boolean isGroupChoiceNet(PetriNet net) {
        boolean[] confirmed = new boolean[net.getPlaces().size()];
        for (Place place : net.getPlaces()) {
            if (confirmed[place.getId()]) {
                continue;
            }
            Set<Integer> postSet = postSet(net, place);
            for (int transitionId : postSet) {
                Transition transition = net.getTransition(transitionId);
                for (Edge edge : net.inEdges(transition)) {
                    Place other = net.placeOf(edge);
                    confirmed[other.getId()] = true;
                    if (other.outDegree() != postSet.size() || !postSet.equals(postSet(net, other))) {
                        logger.debug("Not group-choice: post-sets of " + place.getName() + " and "
                                + other.getName() + " overlap at " + transition.getName() + " but differ");
                        return false;
                    }
                }
            }
        }
        return true;
    }

    // === WORKFLOW NETS ===

    /**
     * Exactly one source place, exactly one sink place, every node reachable from
     * the source and every node co-reachable from the sink.
     */
    public static boolean isWorkflowNet(PetriNet net) {
        Place source = null;
        Place sink = null;
        int sources = 0;
        int sinks = 0;
        for (Place place : net.getPlaces()) {
            if (place.inDegree() == 0) {
                source = place;
                sources++;
            }
            if (place.outDegree() == 0) {
                sink = place;
                sinks++;
            }
        }
        if (sources != 1 || sinks != 1) {
            return false;
        }
        return coversNet(net, source, false) && coversNet(net, sink, true);
    }

    /**
     * Breadth-first traversal from {@code start}; with {@code reverse} every edge is
     * followed against its direction.
     *
     * @return true when every place and every transition was visited
     */
    private static boolean coversNet(PetriNet net, Place start, boolean reverse) {
        boolean[] visitedPlaces = new boolean[net.getPlaces().size()];
        boolean[] visitedTransitions = new boolean[net.getTransitions().size()];
        int visitedCount = 1;
        Deque<Node> pending = new ArrayDeque<>();
        visitedPlaces[start.getId()] = true;
        pending.add(start);

        while (!pending.isEmpty()) {
            Node node = pending.poll();
            List<Edge> edges = reverse ? net.inEdges(node) : net.outEdges(node);
            for (Edge edge : edges) {
                Node next = reverse ? net.sourceOf(edge) : net.targetOf(edge);
                boolean[] visited = next.getKind() == NodeKind.PLACE ? visitedPlaces : visitedTransitions;
                if (!visited[next.getId()]) {
                    visited[next.getId()] = true;
                    visitedCount++;
                    pending.add(next);
                }
            }
        }
        return visitedCount == net.getPlaces().size() + net.getTransitions().size();
    }

    private static Set<Integer> postSet(PetriNet net, Place place) {
        Set<Integer> transitions = new HashSet<>();
        for (Edge edge : net.outEdges(place)) {
            transitions.add(edge.getTransition());
        }
        return transitions;
    }
}
