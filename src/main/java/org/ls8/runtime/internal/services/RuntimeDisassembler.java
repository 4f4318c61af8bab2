package org.ls8.runtime.internal.services;

import org.ls8.runtime.api.DisassembledArgument;
import org.ls8.runtime.api.DisassembledInstruction;
import org.ls8.runtime.isa.Opcode;
import org.ls8.runtime.model.Memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes instructions straight from memory into their assembly form.
 * Bytes that are not instructions are rendered as {@code DB 0x..} and take up one byte,
 * so a listing never stops at data.
 */
public class RuntimeDisassembler {

    public static final RuntimeDisassembler INSTANCE = new RuntimeDisassembler();
    private RuntimeDisassembler() {}

    /**
     * Decodes the instruction at an address.
     * @param memory The memory to read from.
     * @param address The address of the opcode byte.
     * @return The decoded instruction.
     */
    public DisassembledInstruction disassemble(Memory memory, int address) {
        int code = memory.read(address);
        Optional<Opcode> opcodeOpt = Opcode.fromCode(code);
        if (opcodeOpt.isEmpty()) {
            return new DisassembledInstruction(address, "DB", List.of(new DisassembledArgument(DisassembledArgument.Type.DATA, code)), 1);
        }

        Opcode opcode = opcodeOpt.get();
        List<DisassembledArgument> arguments = new ArrayList<>();
        for (int i = 0; i < opcode.getOperandCount(); i++) {
            int value = memory.read((address + 1 + i) % memory.size());
            // LDI is the only instruction with an immediate; everything else addresses registers.
            DisassembledArgument.Type type = opcode == Opcode.LDI && i == 1
                    ? DisassembledArgument.Type.IMMEDIATE
                    : DisassembledArgument.Type.REGISTER;
            arguments.add(new DisassembledArgument(type, value));
        }
        return new DisassembledInstruction(address, opcode.name(), arguments, opcode.getLength());
    }

    /**
     * Decodes a contiguous range of memory, instruction by instruction.
     * @param memory The memory to read from.
     * @param start The first address.
     * @param length The number of bytes to cover.
     * @return The decoded instructions in address order.
     */
    public List<DisassembledInstruction> disassembleRange(Memory memory, int start, int length) {
        List<DisassembledInstruction> listing = new ArrayList<>();
        int end = Math.min(start + length, memory.size());
        int address = start;
        while (address < end) {
            DisassembledInstruction instruction = disassemble(memory, address);
            listing.add(instruction);
            address += instruction.length();
        }
        return listing;
    }
}
