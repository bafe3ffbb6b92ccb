package org.pn2ccs.model;

/**
 * Weighted arc between a place and a transition.
 * 
 * Endpoints are stored as slot indices into the owning net's arenas, never as
 * object references; the net rewrites them when it compacts a node arena.
 */
public final class Edge {

    public enum Direction {
        PLACE_TO_TRANSITION,
        TRANSITION_TO_PLACE
    }

    int id;
    final Direction direction;
    int place;
    int transition;
    int weight;

    Edge(int id, Direction direction, int place, int transition, int weight) {
        this.id = id;
        this.direction = direction;
        this.place = place;
        this.transition = transition;
        this.weight = weight;
    }

    public int getId() {
        return id;
    }

    public Direction getDirection() {
        return direction;
    }

    /**
     * Slot index of the place endpoint, whichever direction the edge has.
     */
    public int getPlace() {
        return place;
    }

    /**
     * Slot index of the transition endpoint, whichever direction the edge has.
     */
    public int getTransition() {
        return transition;
    }

    public int getWeight() {
        return weight;
    }

    /** True when the edge feeds a transition (consumes from its place). */
    public boolean isInput() {
        return direction == Direction.PLACE_TO_TRANSITION;
    }

    @Override
    public String toString() {
        if (isInput()) {
            return String.format("Edge{#%d: place %d -> transition %d}", id, place, transition);
        }
        return String.format("Edge{#%d: transition %d -> place %d, weight=%d}", id, transition, place, weight);
    }
}
