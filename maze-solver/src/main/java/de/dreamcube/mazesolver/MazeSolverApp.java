package de.dreamcube.mazesolver;

import de.dreamcube.mazesolver.io.MazeParser;
import de.dreamcube.mazesolver.model.MazeGrid;
import de.dreamcube.mazesolver.pathfinding.DepthFirstSearch;
import de.dreamcube.mazesolver.pathfinding.SearchResult;
import de.dreamcube.mazesolver.planning.SearchConfig;
import de.dreamcube.mazesolver.render.SolutionRenderer;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Command-line entry point: loads a maze file, solves it and prints the maze with the path drawn in.
 *
 * <p>Exit codes: 0 after a run (whether or not a path exists), 1 if the maze or config file cannot be
 * read, 2 for invalid arguments, an invalid config value or an unknown search type. Output is written as
 * UTF-8 regardless of the platform charset.</p>
 */
public final class MazeSolverApp {

    static final int EXIT_OK = 0;
    static final int EXIT_LOAD_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger LOG = LoggerFactory.getLogger(MazeSolverApp.class);

    private final MazeParser parser;
    private final PrintStream out;

    MazeSolverApp(@NotNull MazeParser parser, @NotNull PrintStream out) {
        this.parser = parser;
        this.out = out;
    }

    public static void main(String[] args) {
        PrintStream out = utf8(new FileOutputStream(FileDescriptor.out));
        System.exit(new MazeSolverApp(new MazeParser(), out).run(args));
    }

    /**
     * Wraps a sink in an auto-flushing UTF-8 print stream, so wall blocks and units survive a non-UTF-8 locale.
     */
    static @NotNull PrintStream utf8(@NotNull OutputStream sink) {
        return new PrintStream(sink, true, StandardCharsets.UTF_8);
    }

    /**
     * Runs the solver for the given arguments.
     *
     * @return the process exit code
     */
    int run(@NotNull String[] args) {
        AppArguments arguments;
        try {
            arguments = AppArguments.parse(args);
        } catch (IllegalArgumentException e) {
            LOG.error(e.getMessage());
            return EXIT_USAGE;
        }
        if (arguments.isHelpRequested()) {
            out.println(AppArguments.USAGE);
            return EXIT_OK;
        }

        SearchType searchType = SearchType.fromFlag(arguments.getSearchType());
        if (searchType == null) {
            LOG.error("Unknown search type: {}", arguments.getSearchType());
            return EXIT_USAGE;
        }

        SearchConfig config;
        try {
            config = arguments.toSearchConfig(loadBaseConfig(arguments.getConfigFile()));
        } catch (IOException e) {
            LOG.error("Cannot read config {}: {}", arguments.getConfigFile(), e.getMessage());
            return EXIT_LOAD_FAILED;
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid config {}: {}", arguments.getConfigFile(), e.getMessage());
            return EXIT_USAGE;
        }

        MazeGrid grid;
        try {
            grid = parser.parse(arguments.getMazeFile());
        } catch (IOException e) {
            LOG.error("Cannot load maze {}: {}", arguments.getMazeFile(), e.getMessage());
            return EXIT_LOAD_FAILED;
        }

        LOG.info("Solving {} with {} search, goal is {}", arguments.getMazeFile(), searchType, grid.getGoal());
        long startNanos = System.nanoTime();
        SearchResult result = solve(searchType, grid, config);
        long elapsedNanos = System.nanoTime() - startNanos;

        SolutionRenderer renderer = new SolutionRenderer(arguments.isShowExplored());
        if (result.isSolved()) {
            out.println("Solution: ");
            out.print(renderer.render(grid, result));
        }
        out.print(renderer.summarize(result, elapsedNanos));
        return EXIT_OK;
    }

    private SearchResult solve(SearchType searchType, MazeGrid grid, SearchConfig config) {
        return switch (searchType) {
            case DFS -> new DepthFirstSearch(grid, config).solve();
        };
    }

    private static SearchConfig loadBaseConfig(Path configFile) throws IOException {
        if (configFile == null) {
            return SearchConfig.defaults();
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return SearchConfig.fromProperties(properties);
    }
}
