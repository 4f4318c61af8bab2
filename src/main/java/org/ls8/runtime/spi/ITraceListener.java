package org.ls8.runtime.spi;

import org.ls8.runtime.api.TraceSnapshot;

/**
 * Receives the machine state before every executed instruction.
 * Implementations are called synchronously from the run loop.
 */
@FunctionalInterface
public interface ITraceListener {

    /**
     * Called once per instruction, before it executes.
     *
     * @param snapshot the state at the program counter
     */
    void onInstruction(TraceSnapshot snapshot);
}
