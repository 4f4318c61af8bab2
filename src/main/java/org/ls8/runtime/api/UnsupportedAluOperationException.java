package org.ls8.runtime.api;

/**
 * Thrown when the ALU is asked to perform an operation it does not implement.
 */
public class UnsupportedAluOperationException extends MachineFault {

    private final String operation;

    /**
     * Creates a new UnsupportedAluOperationException.
     *
     * @param operation the name of the requested operation.
     */
    public UnsupportedAluOperationException(String operation) {
        super("Unsupported ALU operation: " + operation);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
