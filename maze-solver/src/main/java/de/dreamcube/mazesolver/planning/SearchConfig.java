package de.dreamcube.mazesolver.planning;

import org.jetbrains.annotations.NotNull;

import java.util.Properties;

/**
 * Tuning parameters for the maze search.
 */
public final class SearchConfig {

    public static final long DEFAULT_SEED = 42L;

    static final String SHUFFLE_KEY = "search.shuffle";
    static final String SEED_KEY = "search.seed";
    static final String VERBOSE_KEY = "search.verbose";

    private static final SearchConfig DEFAULTS = new SearchConfig(false, DEFAULT_SEED, false);

    private final boolean shuffleNeighbors;
    private final long seed;
    private final boolean verbose;

    /**
     * Creates a new search config.
     */
    public SearchConfig(boolean shuffleNeighbors,
                        long seed,
                        boolean verbose) {
        this.shuffleNeighbors = shuffleNeighbors;
        this.seed = seed;
        this.verbose = verbose;
    }

    /**
     * Returns the deterministic configuration: no shuffling, no trace.
     */
    public static @NotNull SearchConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Reads {@code search.shuffle}, {@code search.seed} and {@code search.verbose}; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if the seed is not a number
     */
    public static @NotNull SearchConfig fromProperties(@NotNull Properties properties) {
        boolean shuffle = Boolean.parseBoolean(properties.getProperty(SHUFFLE_KEY, "false").trim());
        boolean verbose = Boolean.parseBoolean(properties.getProperty(VERBOSE_KEY, "false").trim());

        String rawSeed = properties.getProperty(SEED_KEY);
        long seed = DEFAULT_SEED;
        if (rawSeed != null) {
            try {
                seed = Long.parseLong(rawSeed.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + SEED_KEY + ": " + rawSeed, e);
            }
        }
        return new SearchConfig(shuffle, seed, verbose);
    }

    /**
     * Returns true when valid neighbours are shuffled before being pushed.
     */
    public boolean shuffleNeighbors() {
        return shuffleNeighbors;
    }

    /**
     * Returns the random seed used for shuffling.
     */
    public long seed() {
        return seed;
    }

    /**
     * Returns true when each search step is traced at debug level.
     */
    public boolean verbose() {
        return verbose;
    }

    /**
     * Returns a copy with shuffling enabled under the given seed.
     */
    public @NotNull SearchConfig withShuffle(long newSeed) {
        return new SearchConfig(true, newSeed, verbose);
    }

    /**
     * Returns a copy with the step trace switched on or off.
     */
    public @NotNull SearchConfig withVerbose(boolean newVerbose) {
        return new SearchConfig(shuffleNeighbors, seed, newVerbose);
    }
}
