package de.dreamcube.mazesolver.pathfinding;

import de.dreamcube.mazesolver.model.Action;
import de.dreamcube.mazesolver.model.Coordinate;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

/**
 * A point reached during a search, with the move and predecessor that reached it.
 *
 * <p>Nodes live in a {@link NodeArena}; the predecessor is referenced by its arena index, and
 * {@link #NO_PARENT} marks the root. The root carries no action.</p>
 */
@Getter
public final class SearchNode {

    public static final int NO_PARENT = -1;

    private final int index;
    private final Coordinate coordinate;
    private final int parentIndex;
    private final @Nullable Action action;

    SearchNode(int index, Coordinate coordinate, int parentIndex, @Nullable Action action) {
        this.index = index;
        this.coordinate = coordinate;
        this.parentIndex = parentIndex;
        this.action = action;
    }

    /**
     * Returns true for the start node of a search.
     */
    public boolean isRoot() {
        return parentIndex == NO_PARENT;
    }

    @Override
    public String toString() {
        return "Node" + coordinate + (action == null ? "" : " via " + action.label());
    }
}
