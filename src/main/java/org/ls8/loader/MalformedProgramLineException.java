package org.ls8.loader;

/**
 * Thrown when a line of a program file is neither blank, a comment, nor a binary byte literal.
 */
public class MalformedProgramLineException extends ProgramLoadException {

    private final int lineNumber;
    private final String line;

    /**
     * Creates a new MalformedProgramLineException.
     *
     * @param source the name of the program file.
     * @param lineNumber the 1-based number of the offending line.
     * @param line the offending line with its comment stripped.
     */
    public MalformedProgramLineException(String source, int lineNumber, String line) {
        super(String.format("Invalid number '%s' at %s:%d", line, source, lineNumber));
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
