package de.dreamcube.mazesolver.pathfinding;

import de.dreamcube.mazesolver.model.Coordinate;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Discovered but not yet processed nodes.
 *
 * <p>The removal order of the implementation decides the search strategy.</p>
 */
public interface Frontier {

    /**
     * Adds a node.
     */
    void push(@NotNull SearchNode node);

    /**
     * Removes the next node to process.
     *
     * @throws EmptyFrontierException if no node remains
     */
    @NotNull SearchNode pop();

    boolean isEmpty();

    /**
     * Returns true when a queued node stands for the given coordinate.
     */
    boolean containsCoordinate(@NotNull Coordinate coordinate);

    /**
     * Returns the queued nodes in insertion order.
     */
    @NotNull List<SearchNode> snapshot();
}
