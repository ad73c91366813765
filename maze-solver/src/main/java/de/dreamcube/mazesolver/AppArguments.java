package de.dreamcube.mazesolver;

import de.dreamcube.mazesolver.planning.SearchConfig;
import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * Parsed command-line options of {@link MazeSolverApp}.
 *
 * <pre>
 *   [-file &lt;path&gt;] [-search dfs] [-config &lt;path&gt;] [-shuffle] [-seed &lt;n&gt;] [-explored] [-debug] [-help]
 * </pre>
 *
 * <p>Search options from {@code -config} are the base; {@code -shuffle}, {@code -seed} and {@code -debug}
 * override them.</p>
 */
@Getter
public final class AppArguments {

    static final String USAGE =
            "Usage: maze-solver [OPTIONS]\n"
                    + "Options:\n"
                    + "  -file <path>     Maze file to solve (default: maze.txt)\n"
                    + "  -search <type>   Search type: dfs (default: dfs)\n"
                    + "  -config <path>   Properties file with search.shuffle, search.seed, search.verbose\n"
                    + "  -shuffle         Shuffle neighbours before pushing them\n"
                    + "  -seed <n>        Seed for -shuffle (default: " + SearchConfig.DEFAULT_SEED + ")\n"
                    + "  -explored        Mark explored cells in the printed maze\n"
                    + "  -debug           Trace every search step\n"
                    + "  -help            Show this help message and exit";

    private static final String DEFAULT_FILE = "maze.txt";

    private Path mazeFile = Path.of(DEFAULT_FILE);
    private String searchType = SearchType.DFS.flag();
    private boolean shuffle;
    private @Nullable Path configFile;
    private @Nullable Long seed;
    private boolean showExplored;
    private boolean debug;
    private boolean helpRequested;

    private AppArguments() {
    }

    /**
     * Parses command-line arguments. Flags may be written with one or two leading dashes.
     *
     * @param args arguments from {@code main()}
     * @return the parsed options
     * @throws IllegalArgumentException if a flag is unknown or lacks its value
     */
    public static @NotNull AppArguments parse(@NotNull String[] args) {
        AppArguments parsed = new AppArguments();

        for (int i = 0; i < args.length; i++) {
            String flag = normalize(args[i]);
            switch (flag) {
                case "-file":
                    parsed.mazeFile = Path.of(requireValue(args, ++i, flag));
                    break;
                case "-search":
                    parsed.searchType = requireValue(args, ++i, flag);
                    break;
                case "-config":
                    parsed.configFile = Path.of(requireValue(args, ++i, flag));
                    break;
                case "-shuffle":
                    parsed.shuffle = true;
                    break;
                case "-seed":
                    parsed.seed = parseSeed(requireValue(args, ++i, flag));
                    break;
                case "-explored":
                    parsed.showExplored = true;
                    break;
                case "-debug":
                    parsed.debug = true;
                    break;
                case "-help":
                case "-h":
                    parsed.helpRequested = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown argument: " + args[i] + "\n" + USAGE);
            }
        }
        return parsed;
    }

    /**
     * Builds the search configuration selected by the flags alone.
     */
    public @NotNull SearchConfig toSearchConfig() {
        return toSearchConfig(SearchConfig.defaults());
    }

    /**
     * Applies the flags on top of a base configuration, usually the one read from {@code -config}.
     *
     * @param base settings used where no flag was given
     * @return the merged configuration
     */
    public @NotNull SearchConfig toSearchConfig(@NotNull SearchConfig base) {
        return new SearchConfig(
                base.shuffleNeighbors() || shuffle,
                seed != null ? seed : base.seed(),
                base.verbose() || debug);
    }

    private static String normalize(String flag) {
        return flag.startsWith("--") ? flag.substring(1) : flag;
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[index];
    }

    private static long parseSeed(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid seed: " + value, e);
        }
    }
}
