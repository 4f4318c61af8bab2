package org.ls8.runtime.api;

/**
 * Thrown when memory is accessed outside of its address range.
 * All addresses are derived by the engine itself, so this always points at an engine bug.
 */
public class AddressOutOfRangeException extends MachineFault {

    private final int address;

    /**
     * Creates a new AddressOutOfRangeException.
     *
     * @param address the offending address.
     * @param size the size of the memory that was accessed.
     */
    public AddressOutOfRangeException(int address, int size) {
        super("Address " + address + " is outside of memory range [0, " + (size - 1) + "]");
        this.address = address;
    }

    public int getAddress() {
        return address;
    }
}
