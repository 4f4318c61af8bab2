package org.ls8.runtime.internal.services;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles the logic for procedure calls (CALL) and returns (RET).
 * Return addresses share the memory stack with PUSH/POP data, so a RET only works if the
 * subroutine left the stack balanced.
 */
public class ProcedureCallHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ProcedureCallHandler.class);

    private final ExecutionContext context;

    /**
     * Constructs a new ProcedureCallHandler.
     * @param context The execution context of the calling instruction.
     */
    public ProcedureCallHandler(ExecutionContext context) {
        this.context = context;
    }

    /**
     * Pushes the return address and jumps to the subroutine.
     * @param targetAddress The address of the subroutine.
     * @param returnAddress The address of the instruction following the CALL.
     */
    public void executeCall(int targetAddress, int returnAddress) {
        context.getStack().push(returnAddress);
        context.jumpTo(targetAddress);
        if (LOG.isDebugEnabled()) {
            LOG.debug("CALL 0x{} -> 0x{}, return to 0x{}", hex(context.getInstructionAddress()), hex(targetAddress), hex(returnAddress));
        }
    }

    /**
     * Pops the return address and jumps back to it.
     */
    public void executeReturn() {
        int returnAddress = context.getStack().pop();
        context.jumpTo(returnAddress);
        if (LOG.isDebugEnabled()) {
            LOG.debug("RET 0x{} -> 0x{}", hex(context.getInstructionAddress()), hex(returnAddress));
        }
    }

    private static String hex(int value) {
        return String.format("%02X", value);
    }
}
