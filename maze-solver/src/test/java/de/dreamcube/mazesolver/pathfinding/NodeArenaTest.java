package de.dreamcube.mazesolver.pathfinding;

import de.dreamcube.mazesolver.model.Action;
import de.dreamcube.mazesolver.model.Coordinate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NodeArenaTest {

    @Test
    public void childrenReferenceParentByIndex() {
        NodeArena arena = new NodeArena();
        SearchNode root = arena.root(new Coordinate(0, 0));
        SearchNode child = arena.child(root, new Coordinate(1, 0), Action.DOWN);

        assertTrue(root.isRoot());
        assertNull(root.getAction(), "Root has no action");
        assertEquals(SearchNode.NO_PARENT, root.getParentIndex());
        assertEquals(root.getIndex(), child.getParentIndex());
        assertEquals(0, root.getIndex());
        assertEquals(1, child.getIndex(), "Indices follow allocation order");
    }

    @Test
    public void chainToWalksBackToRoot() {
        NodeArena arena = new NodeArena();
        SearchNode root = arena.root(new Coordinate(0, 0));
        SearchNode sideBranch = arena.child(root, new Coordinate(1, 0), Action.DOWN);
        SearchNode right = arena.child(root, new Coordinate(0, 1), Action.RIGHT);
        SearchNode rightDown = arena.child(right, new Coordinate(1, 1), Action.DOWN);

        List<SearchNode> chain = arena.chainTo(rightDown);

        assertEquals(List.of(root, right, rightDown), chain);
        assertFalse(chain.contains(sideBranch));
        assertEquals(List.of(root), arena.chainTo(root));
    }
}
