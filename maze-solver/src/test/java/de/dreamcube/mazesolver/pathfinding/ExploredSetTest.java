package de.dreamcube.mazesolver.pathfinding;

import de.dreamcube.mazesolver.model.Coordinate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExploredSetTest {

    @Test
    public void markingIsIdempotent() {
        ExploredSet explored = new ExploredSet();
        explored.markExplored(new Coordinate(1, 2));
        explored.markExplored(new Coordinate(1, 2));

        assertEquals(List.of(new Coordinate(1, 2)), explored.inOrder());
        assertTrue(explored.isExplored(new Coordinate(1, 2)), "Equal coordinates match by value");
        assertFalse(explored.isExplored(new Coordinate(2, 1)));
    }

    @Test
    public void inOrderKeepsFirstMarkingOrder() {
        ExploredSet explored = new ExploredSet();
        explored.markExplored(new Coordinate(0, 0));
        explored.markExplored(new Coordinate(0, 1));
        explored.markExplored(new Coordinate(0, 0));
        explored.markExplored(new Coordinate(1, 1));

        assertEquals(List.of(new Coordinate(0, 0), new Coordinate(0, 1), new Coordinate(1, 1)), explored.inOrder());
    }
}
