package org.ls8.runtime.api;

import org.ls8.runtime.Config;

/**
 * A single operand of a disassembled instruction.
 *
 * @param type How the raw byte is interpreted.
 * @param value The raw operand byte.
 */
public record DisassembledArgument(
        Type type,
        int value
) {

    /**
     * The interpretation of an operand byte.
     */
    public enum Type {
        /** A register index, shown masked as {@code R0}-{@code R7}. */
        REGISTER,
        /** An immediate value, shown in decimal. */
        IMMEDIATE,
        /** A data byte that is not an instruction, shown in hexadecimal. */
        DATA
    }

    /**
     * Renders the operand as written in assembly.
     * @return e.g. "R3", "42" or "0xFF".
     */
    public String display() {
        return switch (type) {
            case REGISTER -> "R" + Config.toRegisterIndex(value);
            case IMMEDIATE -> Integer.toString(value);
            case DATA -> String.format("0x%02X", value);
        };
    }
}
