package de.dreamcube.mazesolver.pathfinding;

/**
 * Thrown when a grid handed to a search cannot be searched at all: it has no cells, or its start
 * or goal lies outside the grid or on a wall.
 */
public final class InvalidGridException extends IllegalArgumentException {

    public InvalidGridException(String message) {
        super(message);
    }
}
