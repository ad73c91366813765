package de.dreamcube.mazesolver.model;

/**
 * Immutable (row, column) position of a maze cell.
 *
 * <p>Row 0 is the top line of the maze, column 0 the leftmost character. Two coordinates
 * are equal when both fields are equal.</p>
 */
public final class Coordinate {

    private final int row;
    private final int column;

    /**
     * Creates a new coordinate.
     */
    public Coordinate(int row, int column) {
        this.row = row;
        this.column = column;
    }

    /**
     * Returns the row index.
     */
    public int row() {
        return row;
    }

    /**
     * Returns the column index.
     */
    public int column() {
        return column;
    }

    /**
     * Returns the neighbouring coordinate reached by the given action.
     *
     * <p>The result is not bounds-checked and may lie outside the maze.</p>
     */
    public Coordinate step(Action action) {
        return new Coordinate(row + action.deltaRow(), column + action.deltaColumn());
    }

    /**
     * Returns |row1 - row2| + |col1 - col2|.
     */
    public int manhattanDistance(Coordinate other) {
        return Math.abs(row - other.row) + Math.abs(column - other.column);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Coordinate)) return false;
        Coordinate other = (Coordinate) obj;
        return row == other.row && column == other.column;
    }

    @Override
    public int hashCode() {
        return 31 * row + column;
    }

    @Override
    public String toString() {
        return "(" + row + "," + column + ")";
    }
}
