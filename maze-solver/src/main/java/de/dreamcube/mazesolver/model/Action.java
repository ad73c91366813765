package de.dreamcube.mazesolver.model;

import org.jetbrains.annotations.Nullable;

/**
 * The four moves available between orthogonally adjacent cells.
 *
 * <p>Declaration order is the neighbour generation order used by the search: up, left,
 * right, down. Changing it changes which path a depth-first search finds.</p>
 */
public enum Action {
    UP("up", -1, 0),
    LEFT("left", 0, -1),
    RIGHT("right", 0, 1),
    DOWN("down", 1, 0);

    private final String label;
    private final int deltaRow;
    private final int deltaColumn;

    Action(String label, int deltaRow, int deltaColumn) {
        this.label = label;
        this.deltaRow = deltaRow;
        this.deltaColumn = deltaColumn;
    }

    /**
     * Returns the lower-case name of this move ("up", "left", ...).
     */
    public String label() {
        return label;
    }

    /**
     * Returns the row change applied by this move.
     */
    public int deltaRow() {
        return deltaRow;
    }

    /**
     * Returns the column change applied by this move.
     */
    public int deltaColumn() {
        return deltaColumn;
    }

    /**
     * Maps a label back to its action, ignoring case.
     */
    public static @Nullable Action fromLabel(String label) {
        for (Action action : values()) {
            if (action.label.equalsIgnoreCase(label)) return action;
        }
        return null;
    }
}
