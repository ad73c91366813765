package de.dreamcube.mazesolver.io;

import de.dreamcube.mazesolver.model.Coordinate;
import de.dreamcube.mazesolver.model.MazeGrid;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a maze from its text form.
 *
 * <p>Each line is one row, read from top to bottom. Within a line, characters are read from left
 * to right:</p>
 * <ul>
 *     <li>{@code A}: the start cell (open)</li>
 *     <li>{@code B}: the goal cell (open)</li>
 *     <li>space: an open cell</li>
 *     <li>{@code #}: a wall</li>
 * </ul>
 *
 * <p>The maze is as wide as its longest line. Shorter lines are padded with walls. Trailing empty
 * lines and a byte order mark at the start of the input are ignored.</p>
 */
public final class MazeParser {

    public static final char START = 'A';
    public static final char GOAL = 'B';
    public static final char OPEN = ' ';
    public static final char WALL = '#';

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Parses the maze file at the given path as UTF-8.
     */
    public @NotNull MazeGrid parse(@NotNull Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    /**
     * Parses every line the reader supplies. The reader is not closed.
     */
    public @NotNull MazeGrid parse(@NotNull Reader reader) throws IOException {
        BufferedReader buffered = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = buffered.readLine()) != null) {
            lines.add(line);
        }
        return parse(lines);
    }

    /**
     * Parses the given rows.
     *
     * @param lines the maze rows from top to bottom, without line terminators
     * @return the grid with start and goal set
     * @throws MazeFormatException if there are no rows, start or goal is missing or repeated, or
     *                             a character is not part of the maze alphabet
     */
    public @NotNull MazeGrid parse(@NotNull List<String> lines) throws MazeFormatException {
        int height = lines.size();
        while (height > 0 && lines.get(height - 1).isEmpty()) {
            height--;
        }
        if (height == 0) {
            throw new MazeFormatException("Maze is empty");
        }

        int width = stripByteOrderMark(lines.get(0)).length();
        for (int row = 1; row < height; row++) {
            width = Math.max(width, lines.get(row).length());
        }

        boolean[][] blocked = new boolean[height][width];
        Coordinate start = null;
        Coordinate goal = null;

        for (int row = 0; row < height; row++) {
            String line = row == 0 ? stripByteOrderMark(lines.get(row)) : lines.get(row);
            for (int column = 0; column < width; column++) {
                if (column >= line.length()) {
                    blocked[row][column] = true;
                    continue;
                }

                char symbol = line.charAt(column);
                switch (symbol) {
                    case START:
                        if (start != null) {
                            throw new MazeFormatException("More than one start point '" + START + "' at row "
                                    + row + ", column " + column);
                        }
                        start = new Coordinate(row, column);
                        break;
                    case GOAL:
                        if (goal != null) {
                            throw new MazeFormatException("More than one end point '" + GOAL + "' at row "
                                    + row + ", column " + column);
                        }
                        goal = new Coordinate(row, column);
                        break;
                    case OPEN:
                        break;
                    case WALL:
                        blocked[row][column] = true;
                        break;
                    default:
                        throw new MazeFormatException("Unexpected character '" + symbol + "' at row "
                                + row + ", column " + column);
                }
            }
        }

        if (start == null) {
            throw new MazeFormatException("No start point '" + START + "' found in the maze");
        }
        if (goal == null) {
            throw new MazeFormatException("No end point '" + GOAL + "' found in the maze");
        }
        return new MazeGrid(blocked, start, goal);
    }

    /**
     * Drops a leading UTF-8 byte order mark left in the first line by some editors.
     */
    private static String stripByteOrderMark(String line) {
        return !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK ? line.substring(1) : line;
    }
}
