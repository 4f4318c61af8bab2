package org.ls8.runtime.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * Machine state captured right before an instruction executes.
 *
 * @param pc The program counter.
 * @param opcode The byte at the program counter.
 * @param operandA The first prefetched byte.
 * @param operandB The second prefetched byte.
 * @param registers The eight register values.
 */
public record TraceSnapshot(int pc, int opcode, int operandA, int operandB, int[] registers) {

    public TraceSnapshot {
        registers = Arrays.copyOf(registers, registers.length);
    }

    @Override
    public int[] registers() {
        return Arrays.copyOf(registers, registers.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceSnapshot that)) return false;
        return pc == that.pc && opcode == that.opcode && operandA == that.operandA
                && operandB == that.operandB && Arrays.equals(registers, that.registers);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(pc, opcode, operandA, operandB);
        return 31 * result + Arrays.hashCode(registers);
    }

    @Override
    public String toString() {
        return "TraceSnapshot[pc=" + pc + ", opcode=" + opcode + ", operandA=" + operandA
                + ", operandB=" + operandB + ", registers=" + Arrays.toString(registers) + "]";
    }
}
