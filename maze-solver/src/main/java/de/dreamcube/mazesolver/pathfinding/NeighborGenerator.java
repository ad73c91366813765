package de.dreamcube.mazesolver.pathfinding;

import de.dreamcube.mazesolver.model.Action;
import de.dreamcube.mazesolver.model.Coordinate;
import de.dreamcube.mazesolver.model.MazeGrid;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Produces the enterable cells next to a coordinate.
 *
 * <p>Candidates are generated in {@link Action} declaration order (up, left, right, down). A
 * candidate is kept when it lies inside the grid and is not a wall. If a {@link Random} is
 * supplied, the kept candidates are shuffled before they are returned.</p>
 */
public final class NeighborGenerator {

    private final MazeGrid grid;
    private final @Nullable Random shuffleRandom;

    /**
     * Creates a generator that returns neighbours in generation order.
     *
     * @param grid the grid to read walls from
     * @throws InvalidGridException if the grid has no cells
     */
    public NeighborGenerator(@NotNull MazeGrid grid) {
        this(grid, null);
    }

    /**
     * Creates a generator that shuffles valid neighbours with the given random source.
     *
     * @param grid the grid to read walls from
     * @param shuffleRandom the source used for shuffling, or null to keep generation order
     * @throws InvalidGridException if the grid has no cells
     */
    public NeighborGenerator(@NotNull MazeGrid grid, @Nullable Random shuffleRandom) {
        if (!grid.hasCells()) {
            throw new InvalidGridException("Grid has no cells: " + grid.getHeight() + "x" + grid.getWidth());
        }
        this.grid = grid;
        this.shuffleRandom = shuffleRandom;
    }

    /**
     * Returns the valid moves out of {@code from}.
     *
     * @param from the cell to expand
     * @return up to four neighbours
     */
    public @NotNull List<Neighbor> neighborsOf(@NotNull Coordinate from) {
        List<Neighbor> neighbors = new ArrayList<>(Action.values().length);

        for (Action action : Action.values()) {
            Coordinate candidate = from.step(action);
            if (grid.isOpen(candidate)) {
                neighbors.add(new Neighbor(candidate, action));
            }
        }

        if (shuffleRandom != null) {
            shuffle(neighbors, shuffleRandom);
        }
        return neighbors;
    }

    /**
     * Inside-out Fisher-Yates: position {@code i} swaps with a uniformly chosen {@code j <= i}.
     */
    private static void shuffle(List<Neighbor> neighbors, Random random) {
        for (int i = 0; i < neighbors.size(); i++) {
            int j = random.nextInt(i + 1);
            Collections.swap(neighbors, i, j);
        }
    }

    /**
     * A cell reachable in one move, and the move that reaches it.
     */
    public static final class Neighbor {

        private final Coordinate coordinate;
        private final Action action;

        Neighbor(Coordinate coordinate, Action action) {
            this.coordinate = coordinate;
            this.action = action;
        }

        public Coordinate coordinate() {
            return coordinate;
        }

        public Action action() {
            return action;
        }

        @Override
        public String toString() {
            return action.label() + "->" + coordinate;
        }
    }
}
