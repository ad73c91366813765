package de.dreamcube.mazesolver.pathfinding;

import de.dreamcube.mazesolver.model.Action;
import de.dreamcube.mazesolver.model.Coordinate;
import de.dreamcube.mazesolver.model.MazeGrid;
import de.dreamcube.mazesolver.model.Solution;
import de.dreamcube.mazesolver.planning.SearchConfig;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Finds a path from the start to the goal of a {@link MazeGrid} by depth-first search.
 *
 * <p>The most recently discovered node is always expanded first. Each run:</p>
 * <ol>
 *     <li>pushes a root node at the start coordinate,</li>
 *     <li>pops the newest node; if it stands on the goal, rebuilds the path and stops,</li>
 *     <li>otherwise marks its coordinate explored and pushes every valid neighbour that is
 *         neither explored nor already queued,</li>
 *     <li>reports {@link SearchState#EXHAUSTED} once the frontier runs empty.</li>
 * </ol>
 *
 * <p>The path found is not necessarily the shortest. Every reachable cell is processed at most
 * once, so a run terminates after at most {@code height * width} iterations.</p>
 *
 * <p>Frontier, explored set and nodes are local to one {@link #solve()} call, so repeated calls
 * on an unchanged grid return equal results when shuffling is off. Thread safety: a single
 * instance must not be solved from several threads at once; separate instances may share a grid.</p>
 *
 * @see StackFrontier
 * @see NeighborGenerator
 */
public final class DepthFirstSearch {

    private static final Logger LOG = LoggerFactory.getLogger(DepthFirstSearch.class);

    private final MazeGrid grid;
    private final SearchConfig config;
    private final Supplier<Frontier> frontierFactory;

    private volatile SearchState state = SearchState.READY;

    /**
     * Creates a deterministic search over the given grid.
     *
     * @param grid the maze to solve
     */
    public DepthFirstSearch(@NotNull MazeGrid grid) {
        this(grid, SearchConfig.defaults());
    }

    /**
     * Creates a search over the given grid.
     *
     * @param grid the maze to solve
     * @param config shuffling and tracing options
     */
    public DepthFirstSearch(@NotNull MazeGrid grid, @NotNull SearchConfig config) {
        this(grid, config, StackFrontier::new);
    }

    DepthFirstSearch(@NotNull MazeGrid grid, @NotNull SearchConfig config, @NotNull Supplier<Frontier> frontierFactory) {
        this.grid = grid;
        this.config = config;
        this.frontierFactory = frontierFactory;
    }

    /**
     * Returns the state of the most recent run, or {@link SearchState#READY} before the first.
     */
    public @NotNull SearchState getState() {
        return state;
    }

    /**
     * Runs the search.
     *
     * <p>An unreachable goal is not an error: the result is {@link SearchState#EXHAUSTED} with
     * {@link Solution#none()}.</p>
     *
     * @return the terminal state, the solution and the explored coordinates
     * @throws InvalidGridException if the grid has no cells, or start or goal is outside the grid or on a wall
     */
    public @NotNull SearchResult solve() {
        validateGrid();
        state = SearchState.RUNNING;

        Frontier frontier = frontierFactory.get();
        ExploredSet explored = new ExploredSet();
        NodeArena arena = new NodeArena();
        NeighborGenerator neighborGenerator = createNeighborGenerator();
        int exploredCount = 0;

        Coordinate goal = grid.getGoal();
        frontier.push(arena.root(grid.getStart()));
        trace("Solving {}x{} maze from {} to {}", grid.getHeight(), grid.getWidth(), grid.getStart(), goal);

        while (!frontier.isEmpty()) {
            if (isTracing()) {
                LOG.debug("Frontier before remove: {}", frontier.snapshot());
            }
            SearchNode current = frontier.pop();
            exploredCount++;
            trace("Removed {}", current);

            if (current.getCoordinate().equals(goal)) {
                List<Coordinate> history = explored.inOrder();
                history.add(current.getCoordinate());

                Solution solution = reconstructSolution(arena, current);
                trace("Goal reached after {} removals, path of {} moves", exploredCount, solution.length());
                return finish(SearchState.SOLVED, solution, history, exploredCount);
            }

            explored.markExplored(current.getCoordinate());
            expand(current, frontier, explored, arena, neighborGenerator);
        }

        trace("Frontier exhausted after {} removals", exploredCount);
        return finish(SearchState.EXHAUSTED, Solution.none(), explored.inOrder(), exploredCount);
    }

    /**
     * Pushes every neighbour of {@code current} that is neither explored nor queued.
     */
    private void expand(SearchNode current, Frontier frontier, ExploredSet explored,
                        NodeArena arena, NeighborGenerator neighborGenerator) {
        for (NeighborGenerator.Neighbor neighbor : neighborGenerator.neighborsOf(current.getCoordinate())) {
            Coordinate coordinate = neighbor.coordinate();
            if (frontier.containsCoordinate(coordinate) || explored.isExplored(coordinate)) {
                continue;
            }
            SearchNode child = arena.child(current, coordinate, neighbor.action());
            frontier.push(child);
            trace("Pushed {}", child);
        }
    }

    /**
     * Follows parent links from the goal node back to the root.
     *
     * @param arena the arena holding every node of this run
     * @param goalNode the node standing on the goal
     * @return the moves and cells from start to goal; the root contributes its cell but no move
     */
    private static Solution reconstructSolution(NodeArena arena, SearchNode goalNode) {
        List<SearchNode> chain = arena.chainTo(goalNode);
        List<Action> actions = new ArrayList<>(chain.size() - 1);
        List<Coordinate> coordinates = new ArrayList<>(chain.size());

        for (SearchNode node : chain) {
            coordinates.add(node.getCoordinate());
            if (!node.isRoot()) {
                actions.add(node.getAction());
            }
        }
        return new Solution(actions, coordinates);
    }

    private SearchResult finish(SearchState terminalState, Solution solution,
                                List<Coordinate> exploredCoordinates, int exploredCount) {
        state = terminalState;
        return new SearchResult(terminalState, solution, exploredCoordinates, exploredCount);
    }

    private NeighborGenerator createNeighborGenerator() {
        if (config.shuffleNeighbors()) {
            return new NeighborGenerator(grid, new Random(config.seed()));
        }
        return new NeighborGenerator(grid);
    }

    private void validateGrid() {
        if (!grid.hasCells()) {
            throw new InvalidGridException("Grid has no cells: " + grid.getHeight() + "x" + grid.getWidth());
        }
        checkEndpoint("Start", grid.getStart());
        checkEndpoint("Goal", grid.getGoal());
    }

    private void checkEndpoint(String name, Coordinate coordinate) {
        if (!grid.isWithinBounds(coordinate)) {
            throw new InvalidGridException(name + " " + coordinate + " is outside the "
                    + grid.getHeight() + "x" + grid.getWidth() + " grid");
        }
        if (grid.cellAt(coordinate).isBlocked()) {
            throw new InvalidGridException(name + " " + coordinate + " is on a wall");
        }
    }

    private boolean isTracing() {
        return config.verbose() && LOG.isDebugEnabled();
    }

    private void trace(String format, Object... arguments) {
        if (isTracing()) {
            LOG.debug(format, arguments);
        }
    }
}
