package org.ls8.runtime.model;

import org.ls8.runtime.Config;
import org.ls8.runtime.api.AddressOutOfRangeException;

import java.util.Arrays;

/**
 * Flat, byte-addressable main memory of the machine.
 * Every cell holds an unsigned 8-bit value. Accesses outside of the address range fail fast
 * instead of wrapping, so that addressing bugs in the engine surface immediately.
 */
public class Memory {

    private final int[] cells;

    /**
     * Creates a zero-initialized memory with {@link Config#MEMORY_SIZE} cells.
     */
    public Memory() {
        this.cells = new int[Config.MEMORY_SIZE];
    }

    /**
     * Reads the cell at the given address.
     * @param address The address to read.
     * @return The unsigned byte stored at the address.
     * @throws AddressOutOfRangeException if the address is outside of the memory.
     */
    public int read(int address) {
        checkAddress(address);
        return cells[address];
    }

    /**
     * Stores a value at the given address. The value is reduced modulo 256.
     * @param address The address to write.
     * @param value The value to store.
     * @throws AddressOutOfRangeException if the address is outside of the memory.
     */
    public void write(int address, int value) {
        checkAddress(address);
        cells[address] = Config.toByte(value);
    }

    /**
     * Copies a program image into memory, starting at address 0.
     * Cells beyond the image keep their previous content.
     * @param image The bytes to copy.
     * @throws IllegalArgumentException if the image does not fit into memory.
     */
    public void load(int[] image) {
        if (image.length > cells.length) {
            throw new IllegalArgumentException("Program of " + image.length + " bytes does not fit into "
                    + cells.length + " bytes of memory");
        }
        for (int address = 0; address < image.length; address++) {
            write(address, image[address]);
        }
    }

    /**
     * Resets every cell to zero.
     */
    public void clear() {
        Arrays.fill(cells, 0);
    }

    /**
     * Returns the number of addressable cells.
     * @return The memory size.
     */
    public int size() {
        return cells.length;
    }

    private void checkAddress(int address) {
        if (address < 0 || address >= cells.length) {
            throw new AddressOutOfRangeException(address, cells.length);
        }
    }
}
