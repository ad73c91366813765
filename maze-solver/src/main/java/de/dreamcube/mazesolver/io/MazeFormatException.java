package de.dreamcube.mazesolver.io;

import java.io.IOException;

/**
 * Thrown when maze text does not describe a usable maze.
 */
public final class MazeFormatException extends IOException {

    public MazeFormatException(String message) {
        super(message);
    }
}
