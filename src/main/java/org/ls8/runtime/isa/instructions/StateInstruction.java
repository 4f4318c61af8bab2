package org.ls8.runtime.isa.instructions;

import org.ls8.runtime.api.MachineFault;
import org.ls8.runtime.internal.services.ExecutionContext;
import org.ls8.runtime.isa.Instruction;
import org.ls8.runtime.isa.Opcode;

/**
 * Handles instructions that act on the machine as a whole: HLT stops the run loop and
 * PRN prints a register as a decimal number.
 */
public class StateInstruction extends Instruction {

    /**
     * Constructs a new StateInstruction.
     * @param opcode The opcode of the instruction.
     */
    public StateInstruction(Opcode opcode) {
        super(opcode);
    }

    @Override
    public void execute(ExecutionContext context, int[] operands) {
        switch (getName()) {
            case "HLT" -> context.requestHalt();
            case "PRN" -> context.emit(context.getRegisters().get(operands[0]));
            default -> throw new MachineFault("Unknown state instruction: " + getName());
        }
    }
}
