package org.ls8.runtime.isa.instructions;

import org.ls8.runtime.internal.services.ExecutionContext;
import org.ls8.runtime.isa.Instruction;
import org.ls8.runtime.isa.Opcode;

/**
 * Handles CMP, which compares two registers and records the outcome in the compare flag
 * consumed by JEQ and JNE.
 */
public class ConditionalInstruction extends Instruction {

    /**
     * Constructs a new ConditionalInstruction.
     * @param opcode The opcode of the instruction.
     */
    public ConditionalInstruction(Opcode opcode) {
        super(opcode);
    }

    @Override
    public void execute(ExecutionContext context, int[] operands) {
        context.getAlu().execute(getName(), operands[0], operands[1]);
    }
}
