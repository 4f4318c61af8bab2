package org.ls8.runtime.api;

/**
 * Thrown when the byte at the program counter is not a known instruction.
 */
public class InvalidOpcodeException extends MachineFault {

    private final int opcode;
    private final int address;

    /**
     * Creates a new InvalidOpcodeException.
     *
     * @param opcode the unrecognized byte.
     * @param address the address it was fetched from.
     */
    public InvalidOpcodeException(int opcode, int address) {
        super(String.format("Invalid opcode 0x%02X (%s) at address 0x%02X",
                opcode, toBinaryLiteral(opcode), address));
        this.opcode = opcode;
        this.address = address;
    }

    private static String toBinaryLiteral(int value) {
        String bits = Integer.toBinaryString(value & 0xFF);
        return "0".repeat(8 - bits.length()) + bits;
    }

    public int getOpcode() {
        return opcode;
    }

    public int getAddress() {
        return address;
    }
}
