package org.ls8.runtime.api;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Represents a single instruction decoded from memory.
 *
 * @param address The address of the opcode byte.
 * @param opcodeName The mnemonic, or "DB" for a byte that is not an instruction.
 * @param arguments The decoded operands.
 * @param length The number of bytes the instruction occupies.
 */
public record DisassembledInstruction(
        int address,
        String opcodeName,
        List<DisassembledArgument> arguments,
        int length
) {

    /**
     * Renders the instruction in assembly syntax, e.g. {@code LDI R0, 8}.
     * @return The assembly text without the address.
     */
    public String toAssembly() {
        if (arguments.isEmpty()) {
            return opcodeName;
        }
        return opcodeName + " " + arguments.stream()
                .map(DisassembledArgument::display)
                .collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return String.format("%02X: %s", address, toAssembly());
    }
}
