package org.ls8.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class RegisterFileTest {

    private final RegisterFile registers = new RegisterFile();

    @Test
    void setThenGetWrapsIndexAndValue() {
        for (int index = 0; index <= 1000; index++) {
            for (int value = 0; value <= 1000; value++) {
                registers.set(index, value);
                assertThat(registers.get(index % 8)).isEqualTo(value % 256);
            }
        }
    }

    @Test
    void negativeValuesWrapToUnsignedBytes() {
        registers.set(0, -1);
        assertThat(registers.get(0)).isEqualTo(255);
    }

    @Test
    void outOfRangeIndexAliasesOntoLowThreeBits() {
        registers.set(9, 55);
        assertThat(registers.get(1)).isEqualTo(55);
        assertThat(registers.get(17)).isEqualTo(55);
    }

    @Test
    void stackPointerIsRegisterSeven() {
        registers.setStackPointer(0xF4);
        assertThat(registers.get(7)).isEqualTo(0xF4);

        registers.set(7, 0x10);
        assertThat(registers.getStackPointer()).isEqualTo(0x10);
    }

    @Test
    void snapshotIsADetachedCopy() {
        registers.set(2, 3);
        int[] snapshot = registers.snapshot();
        snapshot[2] = 99;

        assertThat(snapshot).hasSize(8);
        assertThat(registers.get(2)).isEqualTo(3);
    }
}
