package org.ls8.runtime.api;

/**
 * Base class for all unrecoverable errors raised while the machine executes a program.
 * <p>
 * A fault always stops the engine. It is unchecked because every fault indicates either
 * a broken program image or a defect in the engine itself.
 */
public class MachineFault extends RuntimeException {

    /**
     * Constructs a new machine fault with the specified detail message.
     * @param message The detail message.
     */
    public MachineFault(String message) {
        super(message);
    }
}
