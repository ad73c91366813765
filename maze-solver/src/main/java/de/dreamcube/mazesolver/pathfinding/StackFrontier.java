package de.dreamcube.mazesolver.pathfinding;

import de.dreamcube.mazesolver.model.Coordinate;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Last-in, first-out frontier; the removal order that makes a search depth-first.
 *
 * <p>Queued coordinates are counted in a map next to the deque, so {@link #containsCoordinate}
 * answers in constant time with the same result as scanning the queued nodes.</p>
 *
 * <p>Thread safety: This class is not thread-safe.</p>
 */
public final class StackFrontier implements Frontier {

    private final ArrayDeque<SearchNode> stack = new ArrayDeque<>();
    private final Map<Coordinate, Integer> queuedCoordinates = new HashMap<>();

    @Override
    public void push(@NotNull SearchNode node) {
        stack.addLast(node);
        queuedCoordinates.merge(node.getCoordinate(), 1, Integer::sum);
    }

    @Override
    public @NotNull SearchNode pop() {
        SearchNode node = stack.pollLast();
        if (node == null) {
            throw new EmptyFrontierException();
        }
        queuedCoordinates.computeIfPresent(node.getCoordinate(), (coordinate, count) -> count == 1 ? null : count - 1);
        return node;
    }

    @Override
    public boolean isEmpty() {
        return stack.isEmpty();
    }

    @Override
    public boolean containsCoordinate(@NotNull Coordinate coordinate) {
        return queuedCoordinates.containsKey(coordinate);
    }

    @Override
    public @NotNull List<SearchNode> snapshot() {
        return new ArrayList<>(stack);
    }
}
