package org.ls8.runtime;

import org.ls8.runtime.api.UnsupportedAluOperationException;
import org.ls8.runtime.model.CompareFlag;
import org.ls8.runtime.model.RegisterFile;

import java.util.Optional;

/**
 * The arithmetic/logic unit. Every operation works on two registers identified by index,
 * writes its result back into the first one and keeps every result inside 0-255.
 * CMP does not touch the registers but records a {@link CompareFlag} instead.
 */
public class Alu {

    private final RegisterFile registers;
    private CompareFlag compareFlag;

    /**
     * Creates an ALU operating on the given register file.
     * @param registers The registers the ALU reads and writes.
     */
    public Alu(RegisterFile registers) {
        this.registers = registers;
    }

    /**
     * Performs an ALU operation.
     * @param operation The operation name: ADD, SUB, MUL, INC, DEC or CMP.
     * @param regA The destination (and left-hand) register index.
     * @param regB The right-hand register index, ignored by INC and DEC.
     * @throws UnsupportedAluOperationException if the operation is unknown.
     */
    public void execute(String operation, int regA, int regB) {
        int a = registers.get(regA);
        int b = registers.get(regB);
        switch (operation) {
            case "ADD" -> registers.set(regA, a + b);
            case "SUB" -> registers.set(regA, a - b);
            case "MUL" -> registers.set(regA, a * b);
            case "INC" -> registers.set(regA, a + 1);
            case "DEC" -> registers.set(regA, a - 1);
            case "CMP" -> compareFlag = CompareFlag.of(a, b);
            default -> throw new UnsupportedAluOperationException(operation);
        }
    }

    /**
     * Returns the result of the last CMP, or empty if no comparison ran since the last reset.
     * @return The compare flag.
     */
    public Optional<CompareFlag> getCompareFlag() {
        return Optional.ofNullable(compareFlag);
    }

    /**
     * Forgets the result of the last comparison.
     */
    public void reset() {
        this.compareFlag = null;
    }
}
