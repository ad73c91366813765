package de.dreamcube.mazesolver.pathfinding;

import de.dreamcube.mazesolver.model.Action;
import de.dreamcube.mazesolver.model.Coordinate;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Growable store owning every node created during one search.
 *
 * <p>Parents are always allocated before their children, so following parent indices from
 * any node terminates at the root.</p>
 */
final class NodeArena {

    private final List<SearchNode> nodes = new ArrayList<>();

    /**
     * Allocates the root node at the given coordinate.
     */
    @NotNull SearchNode root(@NotNull Coordinate coordinate) {
        return allocate(coordinate, SearchNode.NO_PARENT, null);
    }

    /**
     * Allocates a node reached from {@code parent} by {@code action}.
     */
    @NotNull SearchNode child(@NotNull SearchNode parent, @NotNull Coordinate coordinate, @NotNull Action action) {
        return allocate(coordinate, parent.getIndex(), action);
    }

    /**
     * Walks parent links from {@code node} to the root and returns the chain in root-first order.
     *
     * @param node the last node of the chain
     * @return the nodes from the root to {@code node}, both included
     */
    @NotNull List<SearchNode> chainTo(@NotNull SearchNode node) {
        List<SearchNode> reversedChain = new ArrayList<>();
        SearchNode current = node;
        reversedChain.add(current);

        while (!current.isRoot()) {
            current = nodes.get(current.getParentIndex());
            reversedChain.add(current);
        }

        Collections.reverse(reversedChain);
        return reversedChain;
    }

    private SearchNode allocate(Coordinate coordinate, int parentIndex, Action action) {
        SearchNode node = new SearchNode(nodes.size(), coordinate, parentIndex, action);
        nodes.add(node);
        return node;
    }
}
