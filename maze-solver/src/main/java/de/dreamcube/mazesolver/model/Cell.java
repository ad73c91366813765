package de.dreamcube.mazesolver.model;

import lombok.Getter;

/**
 * A single grid square: where it is and whether it is a wall.
 */
@Getter
public final class Cell {

    private final Coordinate coordinate;
    private final boolean blocked;

    /**
     * Creates a new cell.
     */
    public Cell(Coordinate coordinate, boolean blocked) {
        this.coordinate = coordinate;
        this.blocked = blocked;
    }
}
