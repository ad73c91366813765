package de.dreamcube.mazesolver.render;

import de.dreamcube.mazesolver.io.MazeParser;
import de.dreamcube.mazesolver.model.MazeGrid;
import de.dreamcube.mazesolver.pathfinding.DepthFirstSearch;
import de.dreamcube.mazesolver.pathfinding.SearchResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SolutionRendererTest {

    private static MazeGrid parse(String... rows) throws IOException {
        return new MazeParser().parse(List.of(rows));
    }

    @Test
    public void drawsPathBetweenStartAndGoal() throws IOException {
        MazeGrid grid = parse(
                "A  ",
                "## ",
                "  B");
        SearchResult result = new DepthFirstSearch(grid).solve();

        String rendered = new SolutionRenderer().render(grid, result);

        assertEquals("A**\n▉▉*\n  B\n", rendered);
    }

    @Test
    public void marksExploredCellsWhenRequested() throws IOException {
        MazeGrid grid = parse(
                "A # ",
                "  #B");
        SearchResult result = new DepthFirstSearch(grid).solve();

        assertEquals("A ▉ \n  ▉B\n", new SolutionRenderer(false).render(grid, result));
        assertEquals("A.▉ \n..▉B\n", new SolutionRenderer(true).render(grid, result));
    }

    @Test
    public void summaryReportsStepsTimeAndExploredCount() throws IOException {
        MazeGrid grid = parse(
                "A  ",
                "## ",
                "  B");
        SearchResult result = new DepthFirstSearch(grid).solve();

        String summary = new SolutionRenderer().summarize(result, 1_500_000L);

        assertEquals("Solution is 4 steps.\nTime to solve: 1.500ms\nExplored 5 nodes\n", summary);
    }

    @Test
    public void summaryReportsMissingSolution() throws IOException {
        MazeGrid grid = parse("A#B");
        SearchResult result = new DepthFirstSearch(grid).solve();

        String summary = new SolutionRenderer().summarize(result, 10L);

        assertEquals("No solution found\nExplored 1 nodes\n", summary);
    }

    @Test
    public void elapsedTimeUsesReadableUnits() {
        assertEquals("999ns", SolutionRenderer.formatElapsed(999L));
        assertEquals("2.500µs", SolutionRenderer.formatElapsed(2_500L));
        assertEquals("3.000s", SolutionRenderer.formatElapsed(3_000_000_000L));
    }
}
