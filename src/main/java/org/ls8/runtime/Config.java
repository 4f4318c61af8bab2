package org.ls8.runtime;

/**
 * Provides the fixed architectural constants of the LS-8 machine.
 * This final class contains static constants that define the memory size, the register layout
 * and the masks used to keep indices and values inside their 8-bit and 3-bit ranges.
 * It is not meant to be instantiated.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The number of addressable memory cells.
     */
    public static final int MEMORY_SIZE = 256;

    /**
     * The number of distinct instruction bytes, i.e. the size of the opcode space.
     */
    public static final int OPCODE_SPACE = 256;

    /**
     * The number of general-purpose registers.
     */
    public static final int NUM_REGISTERS = 8;

    /**
     * The register that holds the stack pointer.
     */
    public static final int SP_REGISTER = 7;

    /**
     * The stack pointer value a freshly loaded machine starts with.
     */
    public static final int DEFAULT_INITIAL_STACK_POINTER = 0xF4;

    /**
     * A bitmask that reduces any value to an unsigned byte.
     */
    public static final int VALUE_MASK = 0xFF;

    /**
     * A bitmask that reduces any register index to 0-7.
     */
    public static final int REGISTER_INDEX_MASK = 0x07;

    /**
     * Reduces an arbitrary integer to an unsigned byte.
     * @param value The raw value.
     * @return The value modulo 256.
     */
    public static int toByte(int value) {
        return value & VALUE_MASK;
    }

    /**
     * Reduces an arbitrary integer to a register index.
     * @param index The raw index.
     * @return The index modulo 8.
     */
    public static int toRegisterIndex(int index) {
        return index & REGISTER_INDEX_MASK;
    }
}
