package org.ls8.runtime;

import org.ls8.runtime.api.UnsupportedAluOperationException;
import org.ls8.runtime.model.CompareFlag;
import org.ls8.runtime.model.RegisterFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the ALU operations, including the 8-bit wraparound of every result.
 */
@Tag("unit")
class AluTest {

    private RegisterFile registers;
    private Alu alu;

    @BeforeEach
    void setUp() {
        registers = new RegisterFile();
        alu = new Alu(registers);
    }

    @ParameterizedTest
    @CsvSource({
            "ADD, 8, 9, 17",
            "ADD, 200, 100, 44",
            "SUB, 9, 8, 1",
            "SUB, 0, 1, 255",
            "MUL, 8, 9, 72",
            "MUL, 16, 16, 0",
            "MUL, 20, 20, 144"
    })
    void binaryOperationsStoreMaskedResultInFirstRegister(String operation, int a, int b, int expected) {
        registers.set(0, a);
        registers.set(1, b);

        alu.execute(operation, 0, 1);

        assertThat(registers.get(0)).isEqualTo(expected);
        assertThat(registers.get(1)).isEqualTo(b);
    }

    @Test
    void incrementWrapsAt255() {
        registers.set(3, 255);
        alu.execute("INC", 3, 3);
        assertThat(registers.get(3)).isZero();
    }

    @Test
    void decrementWrapsAtZero() {
        alu.execute("DEC", 4, 4);
        assertThat(registers.get(4)).isEqualTo(255);
    }

    @Test
    void registerIndicesAreMasked() {
        registers.set(1, 5);
        registers.set(2, 6);

        alu.execute("ADD", 9, 10);

        assertThat(registers.get(1)).isEqualTo(11);
    }

    @ParameterizedTest
    @CsvSource({
            "5, 5, EQUAL",
            "4, 5, LESS_THAN",
            "6, 5, GREATER_THAN",
            "0, 255, LESS_THAN"
    })
    void compareSetsFlagWithoutTouchingRegisters(int a, int b, CompareFlag expected) {
        registers.set(0, a);
        registers.set(1, b);

        alu.execute("CMP", 0, 1);

        assertThat(alu.getCompareFlag()).contains(expected);
        assertThat(registers.get(0)).isEqualTo(a);
        assertThat(registers.get(1)).isEqualTo(b);
    }

    @Test
    void flagIsUnsetUntilFirstCompareAndAfterReset() {
        assertThat(alu.getCompareFlag()).isEmpty();
        alu.execute("CMP", 0, 1);
        assertThat(alu.getCompareFlag()).contains(CompareFlag.EQUAL);

        alu.reset();
        assertThat(alu.getCompareFlag()).isEmpty();
    }

    @Test
    void unsupportedOperationFails() {
        assertThatThrownBy(() -> alu.execute("DIV", 0, 1))
                .isInstanceOf(UnsupportedAluOperationException.class)
                .hasMessageContaining("DIV")
                .satisfies(e -> assertThat(((UnsupportedAluOperationException) e).getOperation()).isEqualTo("DIV"));
    }
}
