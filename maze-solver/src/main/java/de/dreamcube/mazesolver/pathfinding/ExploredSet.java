package de.dreamcube.mazesolver.pathfinding;

import de.dreamcube.mazesolver.model.Coordinate;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Coordinates already processed by a search, kept in the order they were first marked.
 */
public final class ExploredSet {

    private final Set<Coordinate> explored = new LinkedHashSet<>();

    /**
     * Records a coordinate as visited. Marking it again has no effect.
     */
    public void markExplored(@NotNull Coordinate coordinate) {
        explored.add(coordinate);
    }

    public boolean isExplored(@NotNull Coordinate coordinate) {
        return explored.contains(coordinate);
    }

    /**
     * Returns a copy of the explored coordinates in marking order.
     */
    public @NotNull List<Coordinate> inOrder() {
        return new ArrayList<>(explored);
    }
}
