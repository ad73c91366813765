package de.dreamcube.mazesolver.model;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * A path found through the maze, in start-to-goal order.
 *
 * <p>{@link #getActions()} holds the moves taken and {@link #getCoordinates()} the cells visited,
 * starting with the start cell. A path of {@code k} moves therefore has {@code k + 1} coordinates.
 * The {@linkplain #none() absent} solution has neither.</p>
 */
public final class Solution {

    private static final Solution NONE = new Solution(List.of(), List.of());

    @Getter
    private final List<Action> actions;

    @Getter
    private final List<Coordinate> coordinates;

    /**
     * Creates a new solution.
     *
     * @throws IllegalArgumentException if a non-empty coordinate list does not have one more entry than the action list
     */
    public Solution(@NotNull List<Action> actions, @NotNull List<Coordinate> coordinates) {
        if (!coordinates.isEmpty() && coordinates.size() != actions.size() + 1) {
            throw new IllegalArgumentException("Expected " + (actions.size() + 1)
                    + " coordinates for " + actions.size() + " actions, got " + coordinates.size());
        }
        this.actions = List.copyOf(actions);
        this.coordinates = List.copyOf(coordinates);
    }

    /**
     * Returns the solution reported when no path exists.
     */
    public static @NotNull Solution none() {
        return NONE;
    }

    /**
     * Returns true when this solution describes a path (possibly of length zero).
     */
    public boolean isPresent() {
        return !coordinates.isEmpty();
    }

    /**
     * Returns the number of moves in the path.
     */
    public int length() {
        return actions.size();
    }

    /**
     * Returns true when the path passes through the given cell.
     */
    public boolean contains(@NotNull Coordinate coordinate) {
        return coordinates.contains(coordinate);
    }

    /**
     * Returns the action labels ("up", "down", ...) in order.
     */
    public @NotNull List<String> actionLabels() {
        List<String> labels = new ArrayList<>(actions.size());
        for (Action action : actions) {
            labels.add(action.label());
        }
        return labels;
    }

    /**
     * Applies every action in order, starting at {@code from}, and returns where it ends.
     */
    public @NotNull Coordinate replay(@NotNull Coordinate from) {
        Coordinate current = from;
        for (Action action : actions) {
            current = current.step(action);
        }
        return current;
    }
}
