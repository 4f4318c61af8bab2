package org.ls8.runtime.model;

import org.ls8.runtime.Config;

import java.util.Arrays;

/**
 * The eight general-purpose registers of the machine.
 * <p>
 * This is the single place where raw operand bytes become register indices and register values:
 * indices are reduced to their low three bits and values to their low eight bits. Out-of-range
 * indices therefore alias onto valid registers instead of failing. Register 7 doubles as the
 * stack pointer.
 */
public class RegisterFile {

    private final int[] registers = new int[Config.NUM_REGISTERS];

    /**
     * Reads a register.
     * @param index The register index, masked to 0-7.
     * @return The unsigned byte held by the register.
     */
    public int get(int index) {
        return registers[Config.toRegisterIndex(index)];
    }

    /**
     * Writes a register.
     * @param index The register index, masked to 0-7.
     * @param value The value, masked to 0-255.
     */
    public void set(int index, int value) {
        registers[Config.toRegisterIndex(index)] = Config.toByte(value);
    }

    public int getStackPointer() {
        return get(Config.SP_REGISTER);
    }

    public void setStackPointer(int value) {
        set(Config.SP_REGISTER, value);
    }

    /**
     * Returns a copy of all register values, indexed by register number.
     * @return The register values.
     */
    public int[] snapshot() {
        return Arrays.copyOf(registers, registers.length);
    }

    /**
     * Resets every register to zero.
     */
    public void clear() {
        Arrays.fill(registers, 0);
    }

    @Override
    public String toString() {
        return Arrays.toString(registers);
    }
}
