package org.ls8.loader;

import java.nio.file.Path;

/**
 * Thrown when the program file does not exist.
 */
public class ProgramFileNotFoundException extends ProgramLoadException {

    private final Path path;

    /**
     * Creates a new ProgramFileNotFoundException.
     *
     * @param path the path that was looked up.
     */
    public ProgramFileNotFoundException(Path path) {
        super("Could not find file: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
