package de.dreamcube.mazesolver.pathfinding;

import de.dreamcube.mazesolver.model.Coordinate;
import de.dreamcube.mazesolver.model.Solution;
import lombok.Getter;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Outcome of one search run.
 *
 * <p>Besides the solution, the result keeps the explored coordinates in processing order for
 * visualization. When the goal was found it is the last explored coordinate.</p>
 */
@Getter
public final class SearchResult {

    private final SearchState state;
    private final Solution solution;
    private final List<Coordinate> exploredCoordinates;
    private final int exploredCount;

    SearchResult(@NotNull SearchState state,
                 @NotNull Solution solution,
                 @NotNull List<Coordinate> exploredCoordinates,
                 int exploredCount) {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Result state must be terminal: " + state);
        }
        this.state = state;
        this.solution = solution;
        this.exploredCoordinates = List.copyOf(exploredCoordinates);
        this.exploredCount = exploredCount;
    }

    /**
     * Returns true when a path to the goal was found.
     */
    public boolean isSolved() {
        return state == SearchState.SOLVED;
    }
}
