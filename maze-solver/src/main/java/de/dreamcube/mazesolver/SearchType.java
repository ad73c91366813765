package de.dreamcube.mazesolver;

import org.jetbrains.annotations.Nullable;

/**
 * Search strategies selectable from the command line.
 */
public enum SearchType {
    DFS("dfs");

    private final String flag;

    SearchType(String flag) {
        this.flag = flag;
    }

    /**
     * Returns the value accepted by {@code -search}.
     */
    public String flag() {
        return flag;
    }

    /**
     * Maps a {@code -search} value to its strategy, ignoring case.
     */
    public static @Nullable SearchType fromFlag(@Nullable String value) {
        if (value == null) return null;
        for (SearchType type : values()) {
            if (type.flag.equalsIgnoreCase(value.trim())) return type;
        }
        return null;
    }
}
