package de.dreamcube.mazesolver.pathfinding;

/**
 * Thrown when a node is requested from a frontier that holds none.
 */
public final class EmptyFrontierException extends IllegalStateException {

    public EmptyFrontierException() {
        super("empty frontier");
    }
}
