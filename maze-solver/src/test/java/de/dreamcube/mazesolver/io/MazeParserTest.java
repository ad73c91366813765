package de.dreamcube.mazesolver.io;

import de.dreamcube.mazesolver.model.Coordinate;
import de.dreamcube.mazesolver.model.MazeGrid;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MazeParserTest {

    private final MazeParser parser = new MazeParser();

    @Test
    public void parsesStartGoalWallsAndOpenCells() throws IOException {
        MazeGrid grid = parser.parse(List.of(
                "A  ",
                "## ",
                "  B"));

        assertEquals(3, grid.getHeight());
        assertEquals(3, grid.getWidth());
        assertEquals(new Coordinate(0, 0), grid.getStart());
        assertEquals(new Coordinate(2, 2), grid.getGoal());
        assertTrue(grid.cellAt(new Coordinate(1, 0)).isBlocked());
        assertTrue(grid.cellAt(new Coordinate(1, 1)).isBlocked());
        assertFalse(grid.cellAt(new Coordinate(1, 2)).isBlocked());
        assertEquals(7, grid.countOpenCells());
    }

    @Test
    public void readerInputStripsLineTerminatorsAndTrailingBlankLines() throws IOException {
        MazeGrid grid = parser.parse(new StringReader("##A\r\n#  \nB #\n\n"));

        assertEquals(3, grid.getHeight());
        assertEquals(3, grid.getWidth());
        assertEquals(new Coordinate(0, 2), grid.getStart());
        assertEquals(new Coordinate(2, 0), grid.getGoal());
    }

    @Test
    public void shortRowsArePaddedWithWalls() throws IOException {
        MazeGrid grid = parser.parse(List.of(
                "A   ",
                "B"));

        assertEquals(4, grid.getWidth());
        assertTrue(grid.cellAt(new Coordinate(1, 3)).isBlocked());
        assertFalse(grid.cellAt(new Coordinate(1, 0)).isBlocked());
    }

    @Test
    public void parsesFile(@TempDir Path directory) throws IOException {
        Path file = directory.resolve("maze.txt");
        Files.writeString(file, "#####B#\n##### #\n#A    #\n#######\n", StandardCharsets.UTF_8);

        MazeGrid grid = parser.parse(file);

        assertEquals(4, grid.getHeight());
        assertEquals(7, grid.getWidth());
        assertEquals(new Coordinate(2, 1), grid.getStart());
        assertEquals(new Coordinate(0, 5), grid.getGoal());
    }

    @Test
    public void leadingByteOrderMarkIsSkipped(@TempDir Path directory) throws IOException {
        Path file = directory.resolve("bom.txt");
        Files.writeString(file, "\uFEFFA #\n  B\n", StandardCharsets.UTF_8);

        MazeGrid grid = parser.parse(file);

        assertEquals(3, grid.getWidth(), "Byte order mark does not count as a column");
        assertEquals(new Coordinate(0, 0), grid.getStart());
        assertEquals(new Coordinate(1, 2), grid.getGoal());
    }

    @Test
    public void missingStartIsRejected() {
        MazeFormatException e = assertThrows(MazeFormatException.class, () -> parser.parse(List.of("  B")));
        assertTrue(e.getMessage().contains("start"));
    }

    @Test
    public void missingGoalIsRejected() {
        MazeFormatException e = assertThrows(MazeFormatException.class, () -> parser.parse(List.of("A  ")));
        assertTrue(e.getMessage().contains("end"));
    }

    @Test
    public void repeatedStartIsRejected() {
        assertThrows(MazeFormatException.class, () -> parser.parse(List.of("A B", "A  ")));
    }

    @Test
    public void unknownCharacterIsRejectedWithPosition() {
        MazeFormatException e = assertThrows(MazeFormatException.class, () -> parser.parse(List.of("A x B")));
        assertTrue(e.getMessage().contains("column 2"), e.getMessage());
    }

    @Test
    public void emptyInputIsRejected() {
        assertThrows(MazeFormatException.class, () -> parser.parse(List.of()));
        assertThrows(MazeFormatException.class, () -> parser.parse(new StringReader("\n\n")));
    }

    @Test
    public void missingFileSurfacesAsIoException(@TempDir Path directory) {
        assertThrows(IOException.class, () -> parser.parse(directory.resolve("absent.txt")));
    }
}
