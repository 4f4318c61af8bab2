package org.ls8.runtime.model;

/**
 * Result of the last CMP instruction.
 * Each constant carries the bit it occupies in the LS-8 flags register ({@code 00000LGE}).
 */
public enum CompareFlag {
    EQUAL(0b001),
    GREATER_THAN(0b010),
    LESS_THAN(0b100);

    private final int bits;

    CompareFlag(int bits) {
        this.bits = bits;
    }

    /**
     * Returns the flag matching the comparison of two values.
     * @param a The left-hand value.
     * @param b The right-hand value.
     * @return EQUAL, LESS_THAN or GREATER_THAN.
     */
    public static CompareFlag of(int a, int b) {
        if (a == b) {
            return EQUAL;
        }
        return a < b ? LESS_THAN : GREATER_THAN;
    }

    public int getBits() {
        return bits;
    }
}
