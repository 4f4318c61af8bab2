package org.ls8.runtime.isa.instructions;

import org.ls8.runtime.api.MachineFault;
import org.ls8.runtime.internal.services.ExecutionContext;
import org.ls8.runtime.isa.Instruction;
import org.ls8.runtime.isa.Opcode;
import org.ls8.runtime.model.RegisterFile;

/**
 * Handles instructions that move data between immediates, registers and the stack:
 * LDI, PUSH and POP.
 */
public class DataInstruction extends Instruction {

    /**
     * Constructs a new DataInstruction.
     * @param opcode The opcode of the instruction.
     */
    public DataInstruction(Opcode opcode) {
        super(opcode);
    }

    @Override
    public void execute(ExecutionContext context, int[] operands) {
        RegisterFile registers = context.getRegisters();
        switch (getName()) {
            case "LDI" -> registers.set(operands[0], operands[1]);
            case "PUSH" -> context.getStack().push(registers.get(operands[0]));
            case "POP" -> registers.set(operands[0], context.getStack().pop());
            default -> throw new MachineFault("Unknown data instruction: " + getName());
        }
    }
}
