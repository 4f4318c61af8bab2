package org.ls8.runtime.isa.instructions;

import org.ls8.runtime.Config;
import org.ls8.runtime.api.MachineFault;
import org.ls8.runtime.internal.services.ExecutionContext;
import org.ls8.runtime.internal.services.ProcedureCallHandler;
import org.ls8.runtime.isa.Instruction;
import org.ls8.runtime.isa.Opcode;
import org.ls8.runtime.model.CompareFlag;

/**
 * Handles control flow instructions: JMP, JEQ, JNE, CALL and RET.
 * All jump targets are read from a register. It uses a ProcedureCallHandler for CALL and RET.
 * A conditional jump that is not taken leaves the program counter to the engine, which moves
 * on to the next instruction.
 */
public class ControlFlowInstruction extends Instruction {

    /**
     * Constructs a new ControlFlowInstruction.
     * @param opcode The opcode of the instruction.
     */
    public ControlFlowInstruction(Opcode opcode) {
        super(opcode);
    }

    @Override
    public void execute(ExecutionContext context, int[] operands) {
        switch (getName()) {
            case "JMP" -> context.jumpTo(target(context, operands));
            case "JEQ" -> {
                if (isEqual(context)) {
                    context.jumpTo(target(context, operands));
                }
            }
            case "JNE" -> {
                if (!isEqual(context)) {
                    context.jumpTo(target(context, operands));
                }
            }
            case "CALL" -> new ProcedureCallHandler(context).executeCall(target(context, operands),
                    Config.toByte(context.getInstructionAddress() + getLength()));
            case "RET" -> new ProcedureCallHandler(context).executeReturn();
            default -> throw new MachineFault("Unknown control flow instruction: " + getName());
        }
    }

    private int target(ExecutionContext context, int[] operands) {
        return context.getRegisters().get(operands[0]);
    }

    // Before the first CMP no flag is set, which counts as "not equal".
    private boolean isEqual(ExecutionContext context) {
        return context.getAlu().getCompareFlag().map(flag -> flag == CompareFlag.EQUAL).orElse(false);
    }
}
