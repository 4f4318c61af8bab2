package org.ls8.loader;

/**
 * An exception that is thrown when a program file cannot be turned into a memory image.
 */
public class ProgramLoadException extends Exception {

    /**
     * Constructs a new load exception with the specified detail message.
     * @param message The detail message.
     */
    public ProgramLoadException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new load exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ProgramLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
