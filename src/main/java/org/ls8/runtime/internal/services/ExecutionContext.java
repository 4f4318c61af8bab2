package org.ls8.runtime.internal.services;

import org.ls8.runtime.Alu;
import org.ls8.runtime.Config;
import org.ls8.runtime.model.Memory;
import org.ls8.runtime.model.RegisterFile;

import java.io.PrintWriter;

/**
 * Encapsulates everything an instruction may touch while it executes.
 * A fresh context is created by the ExecutionEngine for every step and handed to the
 * instruction. Control-flow requests (jumps, halting) are recorded here and applied by
 * the engine once the instruction has finished.
 */
public class ExecutionContext {

    private final Memory memory;
    private final RegisterFile registers;
    private final Alu alu;
    private final PrintWriter out;
    private final int instructionAddress;

    private boolean skipPcAdvance = false;
    private int nextPc;
    private boolean haltRequested = false;

    /**
     * Constructs a new ExecutionContext.
     * @param memory The machine memory.
     * @param registers The register file.
     * @param alu The arithmetic/logic unit.
     * @param out The sink for PRN output.
     * @param instructionAddress The address of the instruction being executed.
     */
    public ExecutionContext(Memory memory, RegisterFile registers, Alu alu, PrintWriter out, int instructionAddress) {
        this.memory = memory;
        this.registers = registers;
        this.alu = alu;
        this.out = out;
        this.instructionAddress = instructionAddress;
        this.nextPc = instructionAddress;
    }

    public Memory getMemory() {
        return memory;
    }

    public RegisterFile getRegisters() {
        return registers;
    }

    public Alu getAlu() {
        return alu;
    }

    /**
     * Returns the address the current instruction was fetched from.
     * @return The program counter before execution.
     */
    public int getInstructionAddress() {
        return instructionAddress;
    }

    /**
     * Redirects the program counter. The engine will not advance it past the current instruction.
     * @param address The new program counter, masked to 0-255.
     */
    public void jumpTo(int address) {
        this.nextPc = Config.toByte(address);
        this.skipPcAdvance = true;
    }

    public boolean shouldSkipPcAdvance() {
        return skipPcAdvance;
    }

    public int getNextPc() {
        return nextPc;
    }

    /**
     * Asks the engine to stop after the current instruction.
     */
    public void requestHalt() {
        this.haltRequested = true;
    }

    public boolean isHaltRequested() {
        return haltRequested;
    }

    /**
     * Prints a value as a decimal number on its own line.
     * @param value The value to print.
     */
    public void emit(int value) {
        out.println(value);
        out.flush();
    }

    /**
     * Returns a stack view over the memory, addressed through the stack pointer register.
     * @return The stack handler.
     */
    public StackHandler getStack() {
        return new StackHandler(memory, registers);
    }
}
