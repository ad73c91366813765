package de.dreamcube.mazesolver.render;

import de.dreamcube.mazesolver.model.Coordinate;
import de.dreamcube.mazesolver.model.MazeGrid;
import de.dreamcube.mazesolver.pathfinding.SearchResult;
import org.jetbrains.annotations.NotNull;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Renders a maze and a search result as text.
 *
 * <p>One character per cell: walls as a block, the start as {@code A}, the goal as
 * {@code B}, cells on the solution path as {@code *}. If explored cells are shown, explored cells off
 * the path are drawn as {@code .}; all other open cells are blank.</p>
 */
public final class SolutionRenderer {

    static final char WALL_SYMBOL = '▉';
    static final char START_SYMBOL = 'A';
    static final char GOAL_SYMBOL = 'B';
    static final char PATH_SYMBOL = '*';
    static final char EXPLORED_SYMBOL = '.';
    static final char OPEN_SYMBOL = ' ';

    private final boolean showExplored;

    /**
     * Creates a renderer that draws only the solution path.
     */
    public SolutionRenderer() {
        this(false);
    }

    /**
     * Creates a renderer.
     *
     * @param showExplored whether explored cells off the path are marked
     */
    public SolutionRenderer(boolean showExplored) {
        this.showExplored = showExplored;
    }

    /**
     * Renders the grid with the result drawn on top, one line per row, each ending in a newline.
     */
    public @NotNull String render(@NotNull MazeGrid grid, @NotNull SearchResult result) {
        Set<Coordinate> path = new HashSet<>(result.getSolution().getCoordinates());
        Set<Coordinate> explored = showExplored ? new HashSet<>(result.getExploredCoordinates()) : Set.of();

        StringBuilder builder = new StringBuilder((grid.getWidth() + 1) * grid.getHeight());
        for (int row = 0; row < grid.getHeight(); row++) {
            for (int column = 0; column < grid.getWidth(); column++) {
                Coordinate coordinate = new Coordinate(row, column);
                builder.append(symbolAt(grid, coordinate, path, explored));
            }
            builder.append('\n');
        }
        return builder.toString();
    }

    /**
     * Formats the statistics printed after a run.
     *
     * @param result the search result
     * @param elapsedNanos wall-clock time the search took
     * @return lines describing the outcome, each ending in a newline
     */
    public @NotNull String summarize(@NotNull SearchResult result, long elapsedNanos) {
        StringBuilder builder = new StringBuilder();
        if (result.isSolved()) {
            builder.append("Solution is ").append(result.getSolution().length()).append(" steps.\n");
            builder.append("Time to solve: ").append(formatElapsed(elapsedNanos)).append('\n');
        } else {
            builder.append("No solution found\n");
        }
        builder.append("Explored ").append(result.getExploredCount()).append(" nodes\n");
        return builder.toString();
    }

    /**
     * Formats a duration with a unit that keeps the number readable.
     */
    static @NotNull String formatElapsed(long elapsedNanos) {
        if (elapsedNanos < 1_000L) {
            return elapsedNanos + "ns";
        }
        if (elapsedNanos < 1_000_000L) {
            return String.format(Locale.ROOT, "%.3fµs", elapsedNanos / 1_000.0);
        }
        if (elapsedNanos < 1_000_000_000L) {
            return String.format(Locale.ROOT, "%.3fms", elapsedNanos / 1_000_000.0);
        }
        return String.format(Locale.ROOT, "%.3fs", elapsedNanos / 1_000_000_000.0);
    }

    private char symbolAt(MazeGrid grid, Coordinate coordinate, Set<Coordinate> path, Set<Coordinate> explored) {
        if (grid.cellAt(coordinate).isBlocked()) {
            return WALL_SYMBOL;
        }
        if (coordinate.equals(grid.getStart())) {
            return START_SYMBOL;
        }
        if (coordinate.equals(grid.getGoal())) {
            return GOAL_SYMBOL;
        }
        if (path.contains(coordinate)) {
            return PATH_SYMBOL;
        }
        if (explored.contains(coordinate)) {
            return EXPLORED_SYMBOL;
        }
        return OPEN_SYMBOL;
    }
}
