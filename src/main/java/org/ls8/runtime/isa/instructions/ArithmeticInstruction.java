package org.ls8.runtime.isa.instructions;

import org.ls8.runtime.internal.services.ExecutionContext;
import org.ls8.runtime.isa.Instruction;
import org.ls8.runtime.isa.Opcode;

/**
 * Handles the arithmetic instructions ADD, SUB, MUL, INC and DEC by forwarding them to the ALU.
 * The ALU operation is selected by the instruction's mnemonic.
 */
public class ArithmeticInstruction extends Instruction {

    /**
     * Constructs a new ArithmeticInstruction.
     * @param opcode The opcode of the instruction.
     */
    public ArithmeticInstruction(Opcode opcode) {
        super(opcode);
    }

    @Override
    public void execute(ExecutionContext context, int[] operands) {
        // INC and DEC carry a single operand; the ALU ignores the second register for them.
        int regB = operands.length > 1 ? operands[1] : operands[0];
        context.getAlu().execute(getName(), operands[0], regB);
    }
}
