package org.ls8.runtime.isa;

import org.ls8.runtime.internal.services.ExecutionContext;

/**
 * The abstract base class for all instructions of the LS-8 machine.
 * <p>
 * Instructions are grouped into families: one subclass implements several opcodes and
 * switches on {@link #getName()}. Instances are stateless, so a single instance per opcode
 * is registered in the {@link org.ls8.runtime.Dispatcher} and reused for every execution.
 */
public abstract class Instruction {

    protected final Opcode opcode;

    /**
     * Constructs a new instruction.
     * @param opcode The opcode this instance executes.
     */
    public Instruction(Opcode opcode) {
        this.opcode = opcode;
    }

    /**
     * Executes the instruction.
     * @param context The execution context.
     * @param operands Exactly {@link #getOperandCount()} raw operand bytes.
     */
    public abstract void execute(ExecutionContext context, int[] operands);

    /**
     * Gets the opcode of this instruction.
     * @return The opcode.
     */
    public final Opcode getOpcode() { return opcode; }

    /**
     * Gets the mnemonic of this instruction.
     * @return The instruction's name, e.g. "LDI".
     */
    public final String getName() { return opcode.name(); }

    /**
     * Gets the number of operand bytes following the opcode.
     * @return 0, 1 or 2.
     */
    public final int getOperandCount() { return opcode.getOperandCount(); }

    /**
     * Gets the length of the instruction in memory.
     * @return The length in bytes, including the opcode.
     */
    public final int getLength() { return opcode.getLength(); }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getName() + "]";
    }
}
