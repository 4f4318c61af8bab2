package org.ls8.runtime;

import org.ls8.runtime.api.InvalidOpcodeException;
import org.ls8.runtime.isa.Instruction;
import org.ls8.runtime.isa.Opcode;
import org.ls8.runtime.isa.instructions.ArithmeticInstruction;
import org.ls8.runtime.isa.instructions.ConditionalInstruction;
import org.ls8.runtime.isa.instructions.ControlFlowInstruction;
import org.ls8.runtime.isa.instructions.DataInstruction;
import org.ls8.runtime.isa.instructions.StateInstruction;

import java.util.Optional;
import java.util.function.Function;

/**
 * Lookup table from instruction byte to instruction handler.
 * <p>
 * The table has one slot per possible byte value. It is filled once, family by family, and
 * afterwards only read, which keeps dispatch a single array access.
 */
public class Dispatcher {

    private final Instruction[] table = new Instruction[Config.OPCODE_SPACE];

    /**
     * Creates a dispatcher wired with the complete LS-8 instruction set.
     * @return The dispatcher.
     */
    public static Dispatcher createDefault() {
        Dispatcher dispatcher = new Dispatcher();
        // State-Family
        dispatcher.registerFamily(StateInstruction::new, Opcode.HLT, Opcode.PRN);
        // Data-Family
        dispatcher.registerFamily(DataInstruction::new, Opcode.LDI, Opcode.PUSH, Opcode.POP);
        // Arithmetic-Family
        dispatcher.registerFamily(ArithmeticInstruction::new, Opcode.ADD, Opcode.SUB, Opcode.MUL, Opcode.INC, Opcode.DEC);
        // Conditional-Family
        dispatcher.registerFamily(ConditionalInstruction::new, Opcode.CMP);
        // ControlFlow-Family
        dispatcher.registerFamily(ControlFlowInstruction::new, Opcode.JMP, Opcode.JEQ, Opcode.JNE, Opcode.CALL, Opcode.RET);
        return dispatcher;
    }

    /**
     * Registers one handler instance per opcode, created by the family's constructor.
     * @param family The constructor of the instruction family.
     * @param opcodes The opcodes the family implements.
     * @throws IllegalStateException if an opcode is already registered.
     */
    public void registerFamily(Function<Opcode, ? extends Instruction> family, Opcode... opcodes) {
        for (Opcode opcode : opcodes) {
            if (table[opcode.getCode()] != null) {
                throw new IllegalStateException("Opcode " + opcode + " is already registered by "
                        + table[opcode.getCode()]);
            }
            table[opcode.getCode()] = family.apply(opcode);
        }
    }

    /**
     * Finds the handler for an instruction byte.
     * @param code The instruction byte.
     * @return The handler, or empty if the byte is not a registered instruction.
     */
    public Optional<Instruction> find(int code) {
        if (code < 0 || code >= table.length) {
            return Optional.empty();
        }
        return Optional.ofNullable(table[code]);
    }

    /**
     * Returns the handler for the instruction byte fetched from the given address.
     * @param code The instruction byte.
     * @param address The address the byte was fetched from, used for the diagnostic.
     * @return The handler.
     * @throws InvalidOpcodeException if the byte is not a registered instruction.
     */
    public Instruction lookup(int code, int address) {
        return find(code).orElseThrow(() -> new InvalidOpcodeException(code, address));
    }

    /**
     * Returns the handler registered for a mnemonic.
     * @param mnemonic The mnemonic, e.g. "CALL".
     * @return The handler, or empty if the mnemonic is unknown or not registered.
     */
    public Optional<Instruction> findByName(String mnemonic) {
        return Opcode.fromMnemonic(mnemonic).flatMap(opcode -> find(opcode.getCode()));
    }
}
