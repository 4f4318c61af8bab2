package org.ls8.runtime.isa;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class OpcodeTest {

    @ParameterizedTest
    @EnumSource(Opcode.class)
    void operandCountMatchesTheTwoHighBitsOfTheEncoding(Opcode opcode) {
        assertThat(opcode.getOperandCount()).isEqualTo(opcode.getCode() >>> 6);
        assertThat(opcode.getLength()).isEqualTo(opcode.getOperandCount() + 1);
    }

    @ParameterizedTest
    @EnumSource(Opcode.class)
    void lookupByCodeAndMnemonicRoundTrips(Opcode opcode) {
        assertThat(Opcode.fromCode(opcode.getCode())).contains(opcode);
        assertThat(Opcode.fromMnemonic(opcode.name().toLowerCase())).contains(opcode);
    }

    @Test
    void codesAreDistinct() {
        long distinct = Arrays.stream(Opcode.values()).mapToInt(Opcode::getCode).distinct().count();
        assertThat(distinct).isEqualTo(Opcode.values().length);
    }

    @Test
    void unknownCodesAndNamesAreEmpty() {
        assertThat(Opcode.fromCode(0)).isEmpty();
        assertThat(Opcode.fromCode(0xFF)).isEmpty();
        assertThat(Opcode.fromMnemonic("NOP")).isEmpty();
        assertThat(Opcode.fromMnemonic(null)).isEmpty();
    }

    @Test
    void encodingBitsIdentifyAluAndControlFlowInstructions() {
        Set<Opcode> alu = EnumSet.of(Opcode.ADD, Opcode.SUB, Opcode.MUL, Opcode.INC, Opcode.DEC, Opcode.CMP);
        Set<Opcode> pcMutators = EnumSet.of(Opcode.CALL, Opcode.RET, Opcode.JMP, Opcode.JEQ, Opcode.JNE);

        for (Opcode opcode : Opcode.values()) {
            assertThat(opcode.isAluOperation()).as("ALU bit of %s", opcode).isEqualTo(alu.contains(opcode));
            assertThat(opcode.setsProgramCounter()).as("PC bit of %s", opcode).isEqualTo(pcMutators.contains(opcode));
        }
    }
}
