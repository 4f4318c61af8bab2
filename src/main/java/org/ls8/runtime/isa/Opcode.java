package org.ls8.runtime.isa;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of LS-8 instructions.
 * <p>
 * The encoding follows the LS-8 layout {@code AABCDDDD}: {@code AA} is the number of operands,
 * {@code B} marks ALU operations and {@code C} marks instructions that set the program counter.
 */
public enum Opcode {
    HLT(0b00000001, 0),
    LDI(0b10000010, 2),
    PRN(0b01000111, 1),
    ADD(0b10100000, 2),
    SUB(0b10100001, 2),
    MUL(0b10100010, 2),
    INC(0b01100101, 1),
    DEC(0b01100110, 1),
    PUSH(0b01000101, 1),
    POP(0b01000110, 1),
    CALL(0b01010000, 1),
    RET(0b00010001, 0),
    CMP(0b10100111, 2),
    JMP(0b01010100, 1),
    JEQ(0b01010101, 1),
    JNE(0b01010110, 1);

    private static final Map<Integer, Opcode> BY_CODE = new HashMap<>();
    private static final Map<String, Opcode> BY_NAME = new HashMap<>();

    static {
        for (Opcode opcode : values()) {
            BY_CODE.put(opcode.code, opcode);
            BY_NAME.put(opcode.name(), opcode);
        }
    }

    private final int code;
    private final int operandCount;

    Opcode(int code, int operandCount) {
        this.code = code;
        this.operandCount = operandCount;
    }

    /**
     * Looks up an opcode by its instruction byte.
     * @param code The instruction byte.
     * @return The opcode, or empty if the byte is not an instruction.
     */
    public static Optional<Opcode> fromCode(int code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }

    /**
     * Looks up an opcode by its mnemonic, ignoring case.
     * @param mnemonic The mnemonic, e.g. "LDI".
     * @return The opcode, or empty if the mnemonic is unknown.
     */
    public static Optional<Opcode> fromMnemonic(String mnemonic) {
        if (mnemonic == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(mnemonic.toUpperCase()));
    }

    public int getCode() {
        return code;
    }

    public int getOperandCount() {
        return operandCount;
    }

    /**
     * Returns the number of bytes the instruction occupies in memory.
     * @return 1 plus the operand count.
     */
    public int getLength() {
        return 1 + operandCount;
    }

    /**
     * Checks the ALU bit of the encoding.
     * @return true if the instruction is executed by the ALU.
     */
    public boolean isAluOperation() {
        return (code & 0b00100000) != 0;
    }

    /**
     * Checks the PC-mutator bit of the encoding.
     * @return true if the instruction may set the program counter itself.
     */
    public boolean setsProgramCounter() {
        return (code & 0b00010000) != 0;
    }
}
