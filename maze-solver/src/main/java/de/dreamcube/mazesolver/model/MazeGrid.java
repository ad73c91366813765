package de.dreamcube.mazesolver.model;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;

/**
 * Represents the static structure of a maze as a rectangular grid of open and blocked cells,
 * together with the start and goal coordinates.
 *
 * <p>Coordinate system:</p>
 * <ul>
 *     <li>row: vertical coordinate, increasing from top to bottom (0 to height-1)</li>
 *     <li>column: horizontal coordinate, increasing from left to right (0 to width-1)</li>
 * </ul>
 *
 * <p>Instances are immutable once constructed and may be shared between concurrently running
 * searches. The constructor only enforces a rectangular shape; whether start and goal are usable
 * is checked by the search before it runs.</p>
 */
public final class MazeGrid {

    @Getter
    private final int height;

    @Getter
    private final int width;

    @Getter
    private final Coordinate start;

    @Getter
    private final Coordinate goal;

    private final Cell[][] cells;

    /**
     * Builds a grid from a row-major wall map.
     *
     * @param blocked {@code blocked[row][column]} is true for walls; all rows must have the same length
     * @param start the start coordinate
     * @param goal the goal coordinate
     * @throws IllegalArgumentException if the rows differ in length
     */
    public MazeGrid(@NotNull boolean[][] blocked, @NotNull Coordinate start, @NotNull Coordinate goal) {
        this.height = blocked.length;
        this.width = height == 0 ? 0 : blocked[0].length;
        this.start = start;
        this.goal = goal;

        Cell[][] newCells = new Cell[height][width];
        for (int row = 0; row < height; row++) {
            if (blocked[row].length != width) {
                throw new IllegalArgumentException(
                        "Row " + row + " has " + blocked[row].length + " columns, expected " + width);
            }
            for (int column = 0; column < width; column++) {
                newCells[row][column] = new Cell(new Coordinate(row, column), blocked[row][column]);
            }
        }
        this.cells = newCells;
    }

    /**
     * Checks if the grid has positive dimensions.
     */
    public boolean hasCells() {
        return height > 0 && width > 0;
    }

    /**
     * Checks if the given coordinates lie within the grid boundaries.
     *
     * @param row the row to check
     * @param column the column to check
     * @return true if both coordinates are non-negative and within bounds
     */
    public boolean isWithinBounds(int row, int column) {
        return row >= 0 && column >= 0 && row < height && column < width;
    }

    /**
     * Checks if the coordinate lies within the grid boundaries.
     */
    public boolean isWithinBounds(@NotNull Coordinate coordinate) {
        return isWithinBounds(coordinate.row(), coordinate.column());
    }

    /**
     * Checks if a cell can be entered.
     *
     * @param coordinate the cell to check
     * @return true if the cell is inside the grid and not a wall
     */
    public boolean isOpen(@NotNull Coordinate coordinate) {
        return isWithinBounds(coordinate) && !cells[coordinate.row()][coordinate.column()].isBlocked();
    }

    /**
     * Returns the cell at the given coordinate.
     *
     * @throws IndexOutOfBoundsException if the coordinate lies outside the grid
     */
    public @NotNull Cell cellAt(@NotNull Coordinate coordinate) {
        if (!isWithinBounds(coordinate)) {
            throw new IndexOutOfBoundsException("Coordinate " + coordinate + " outside " + height + "x" + width + " grid");
        }
        return cells[coordinate.row()][coordinate.column()];
    }

    /**
     * Counts the cells that are not walls.
     */
    public int countOpenCells() {
        int count = 0;
        for (Cell[] row : cells) {
            for (Cell cell : row) {
                if (!cell.isBlocked()) count++;
            }
        }
        return count;
    }
}
