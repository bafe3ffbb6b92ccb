package org.pn2ccs.model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.pn2ccs.exceptions.DuplicateEdgeException;
import org.pn2ccs.exceptions.InvalidArgumentException;
import org.pn2ccs.exceptions.UnrelatedReferenceException;

/**
 * Place/Transition net stored as three dense arenas (places, transitions, edges).
 *
 * Invariants kept by every mutation:
 * - ids of each arena form the range {@code 0..n-1}
 * - adjacency lists of every node are symmetric with the edge arena
 * - at most one edge per ordered (from, to) pair, place-to-transition edges weigh 1
 * - display-name indices are unique per arena
 *
 * Every operation validates its arguments before touching any state, so a failed
 * call leaves the net exactly as it was. Removal swaps the last element of an
 * arena into the freed slot.
 *
 * Instances are not thread-safe; callers serialise mutation per net.
 */
public class PetriNet {

    private static final Logger logger = Logger.getLogger(PetriNet.class);

    /** Name hint asking the net to pick the next free display-name index. */
    public static final int AUTO_NAME = 0;

    private final List<Place> places = new ArrayList<>();
    private final List<Transition> transitions = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();

    // bit 0 stays set so that index 0 is never handed out
    private final BitSet placeNames = new BitSet();
    private final BitSet transitionNames = new BitSet();

    public PetriNet() {
        placeNames.set(0);
        transitionNames.set(0);
    }

    // === NODE CREATION ===

    public Place addPlace(int nameHint, int tokens) {
        validateNameHint(nameHint);
        validateTokens(tokens, null);
        int nameId = allocateName(placeNames, nameHint);
        Place place = new Place(places.size(), nameId, tokens);
        places.add(place);
        logger.debug("Added " + place);
        return place;
    }

    public Transition addTransition(int nameHint, String label) {
        validateNameHint(nameHint);
        validateLabel(label, null);
        int nameId = allocateName(transitionNames, nameHint);
        Transition transition = new Transition(transitions.size(), nameId, label);
        transitions.add(transition);
        logger.debug("Added " + transition);
        return transition;
    }

    /**
     * Connects a place and a transition.
     *
     * @param weight 1 for place-to-transition edges, at least 1 for transition-to-place edges
     */
    public Edge addEdge(Node from, Node to, int weight) {
        requireOwned(from, "from-node");
        requireOwned(to, "to-node");
        if (from.getKind() == to.getKind()) {
            throw new InvalidArgumentException("Edge must be between a place and a transition.",
                    from.getName() + "->" + to.getName());
        }
        Edge.Direction direction = from.getKind() == NodeKind.PLACE
                ? Edge.Direction.PLACE_TO_TRANSITION
                : Edge.Direction.TRANSITION_TO_PLACE;
        validateWeight(direction, weight, from.getName() + "->" + to.getName());
        for (int edgeId : from.out) {
            if (targetOf(edges.get(edgeId)) == to) {
                String message = direction == Edge.Direction.PLACE_TO_TRANSITION
                        ? "Multiple edges are not allowed from places to transitions."
                        : "Multiple edges are not supported from transitions to places (use the edge weight).";
                throw new DuplicateEdgeException(message, from.getName() + "->" + to.getName());
            }
        }

        int placeId = direction == Edge.Direction.PLACE_TO_TRANSITION ? from.id : to.id;
        int transitionId = direction == Edge.Direction.PLACE_TO_TRANSITION ? to.id : from.id;
        Edge edge = new Edge(edges.size(), direction, placeId, transitionId, weight);
        edges.add(edge);
        from.out.add(edge.id);
        to.in.add(edge.id);
        logger.debug("Added edge " + from.getName() + " -> " + to.getName() + " (weight " + weight + ")");
        return edge;
    }

    // === ATTRIBUTE UPDATES ===

    public void setTokens(Place place, int tokens) {
        requireOwned(place, "place");
        validateTokens(tokens, place.getName());
        place.tokens = tokens;
    }

    public void setLabel(Transition transition, String label) {
        requireOwned(transition, "transition");
        validateLabel(label, transition.getName());
        transition.label = label;
    }

    public void setWeight(Edge edge, int weight) {
        requireOwned(edge);
        validateWeight(edge.direction, weight, describe(edge));
        edge.weight = weight;
    }

    // === REMOVAL ===

    public void removePlace(Place place) {
        requireOwned(place, "place");
        removeIncidentEdges(place);

        int last = places.size() - 1;
        Place moved = places.get(last);
        if (moved != place) {
            moved.id = place.id;
            places.set(place.id, moved);
            for (int edgeId : moved.in) {
                edges.get(edgeId).place = moved.id;
            }
            for (int edgeId : moved.out) {
                edges.get(edgeId).place = moved.id;
            }
        }
        places.remove(last);
        placeNames.clear(place.nameId);
        logger.debug("Removed " + place.getName());
    }

    public void removeTransition(Transition transition) {
        requireOwned(transition, "transition");
        removeIncidentEdges(transition);

        int last = transitions.size() - 1;
        Transition moved = transitions.get(last);
        if (moved != transition) {
            moved.id = transition.id;
            transitions.set(transition.id, moved);
            for (int edgeId : moved.in) {
                edges.get(edgeId).transition = moved.id;
            }
            for (int edgeId : moved.out) {
                edges.get(edgeId).transition = moved.id;
            }
        }
        transitions.remove(last);
        transitionNames.clear(transition.nameId);
        logger.debug("Removed " + transition.getName());
    }

    public void removeEdge(Edge edge) {
        requireOwned(edge);
        Node source = sourceOf(edge);
        Node target = targetOf(edge);
        swapRemove(source.out, edge.id);
        swapRemove(target.in, edge.id);

        int last = edges.size() - 1;
        Edge moved = edges.get(last);
        if (moved != edge) {
            replace(sourceOf(moved).out, last, edge.id);
            replace(targetOf(moved).in, last, edge.id);
            moved.id = edge.id;
            edges.set(edge.id, moved);
        }
        edges.remove(last);
    }

    /**
     * Drops every node and edge and releases all display-name indices.
     */
    public void clear() {
        places.clear();
        transitions.clear();
        edges.clear();
        placeNames.clear();
        transitionNames.clear();
        placeNames.set(0);
        transitionNames.set(0);
    }

    // === ACCESSORS ===

    public List<Place> getPlaces() {
        return Collections.unmodifiableList(places);
    }

    public List<Transition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public Place getPlace(int id) {
        return places.get(id);
    }

    public Transition getTransition(int id) {
        return transitions.get(id);
    }

    public Edge getEdge(int id) {
        return edges.get(id);
    }

    public Place placeOf(Edge edge) {
        return places.get(edge.place);
    }

    public Transition transitionOf(Edge edge) {
        return transitions.get(edge.transition);
    }

    public Node sourceOf(Edge edge) {
        return edge.isInput() ? places.get(edge.place) : transitions.get(edge.transition);
    }

    public Node targetOf(Edge edge) {
        return edge.isInput() ? transitions.get(edge.transition) : places.get(edge.place);
    }

    public List<Edge> inEdges(Node node) {
        return resolve(node.in);
    }

    public List<Edge> outEdges(Node node) {
        return resolve(node.out);
    }

    public boolean contains(Node node) {
        if (node == null) {
            return false;
        }
        List<? extends Node> arena = node.getKind() == NodeKind.PLACE ? places : transitions;
        return node.id >= 0 && node.id < arena.size() && arena.get(node.id) == node;
    }

    public boolean contains(Edge edge) {
        return edge != null && edge.id >= 0 && edge.id < edges.size() && edges.get(edge.id) == edge;
    }

    public boolean isEmpty() {
        return places.isEmpty() && transitions.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("PetriNet{places=%d, transitions=%d, edges=%d}",
                places.size(), transitions.size(), edges.size());
    }

    // === HELPER METHODS ===

    private List<Edge> resolve(List<Integer> edgeIds) {
        List<Edge> resolved = new ArrayList<>(edgeIds.size());
        for (int edgeId : edgeIds) {
            resolved.add(edges.get(edgeId));
        }
        return resolved;
    }

    private void removeIncidentEdges(Node node) {
        // resolve first: ids shift while edges are removed
        List<Edge> incident = resolve(node.in);
        incident.addAll(resolve(node.out));
        for (Edge edge : incident) {
            removeEdge(edge);
        }
    }

    private static void swapRemove(List<Integer> list, int value) {
        int index = list.indexOf(value);
        int last = list.size() - 1;
        list.set(index, list.get(last));
        list.remove(last);
    }

    private static void replace(List<Integer> list, int oldValue, int newValue) {
        list.set(list.indexOf(oldValue), newValue);
    }

    private static int allocateName(BitSet names, int nameHint) {
        int nameId = nameHint == AUTO_NAME || names.get(nameHint) ? names.length() : nameHint;
        names.set(nameId);
        return nameId;
    }

    private String describe(Edge edge) {
        return sourceOf(edge).getName() + "->" + targetOf(edge).getName();
    }

    private void requireOwned(Node node, String role) {
        if (node == null) {
            throw new InvalidArgumentException("The " + role + " must not be null.");
        }
        if (!contains(node)) {
            throw new UnrelatedReferenceException("Unrelated " + role + " cannot be used.", node.getName());
        }
    }

    private void requireOwned(Edge edge) {
        if (edge == null) {
            throw new InvalidArgumentException("The edge must not be null.");
        }
        if (!contains(edge)) {
            throw new UnrelatedReferenceException("Unrelated edge cannot be used.", "edge#" + edge.id);
        }
    }

    private static void validateNameHint(int nameHint) {
        if (nameHint < 0) {
            throw new InvalidArgumentException("Name index must be a positive integer (or 0 for automatic naming).");
        }
    }

    private static void validateTokens(int tokens, String elementName) {
        if (tokens < 0) {
            throw new InvalidArgumentException("Place tokens must be a non-negative integer.", elementName);
        }
    }

    private static void validateLabel(String label, String elementName) {
        if (!Transition.isValidLabel(label)) {
            throw new InvalidArgumentException(
                    "Transition label must be a non-empty camelCase string or " + Transition.TAU + ", got: " + label,
                    elementName);
        }
    }

    private static void validateWeight(Edge.Direction direction, int weight, String elementName) {
        if (direction == Edge.Direction.PLACE_TO_TRANSITION && weight != 1) {
            throw new InvalidArgumentException("Weighted edges are not allowed from places to transitions.", elementName);
        }
        if (weight < 1) {
            throw new InvalidArgumentException("Only positive weights are allowed.", elementName);
        }
    }
}
