package org.ls8.loader;

/**
 * Thrown when a line of a program file is not valid UTF-8 text.
 */
public class ProgramEncodingException extends ProgramLoadException {

    private final int lineNumber;

    /**
     * Creates a new ProgramEncodingException.
     *
     * @param source the name of the program file.
     * @param lineNumber the 1-based number of the undecodable line.
     */
    public ProgramEncodingException(String source, int lineNumber) {
        super(String.format("Invalid UTF-8 at %s:%d", source, lineNumber));
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
