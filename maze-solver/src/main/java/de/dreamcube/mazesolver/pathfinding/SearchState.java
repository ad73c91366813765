package de.dreamcube.mazesolver.pathfinding;

/**
 * Lifecycle of a search engine.
 */
public enum SearchState {
    /** Constructed, no run started. */
    READY,
    /** Inside {@code solve()}. */
    RUNNING,
    /** The last run reached the goal. */
    SOLVED,
    /** The last run emptied the frontier without reaching the goal. */
    EXHAUSTED;

    /**
     * Returns true for the two states a run can end in.
     */
    public boolean isTerminal() {
        return this == SOLVED || this == EXHAUSTED;
    }
}
