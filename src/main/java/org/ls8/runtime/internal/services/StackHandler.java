package org.ls8.runtime.internal.services;

import org.ls8.runtime.model.Memory;
import org.ls8.runtime.model.RegisterFile;

/**
 * Implements the downward-growing stack that lives in main memory.
 * The top of the stack is the address held in the stack pointer register. A push decrements
 * the stack pointer and then writes; a pop reads and then increments. Over- and underflow
 * are not detected, the stack pointer simply wraps around.
 */
public class StackHandler {

    private final Memory memory;
    private final RegisterFile registers;

    /**
     * Creates a stack view.
     * @param memory The memory that backs the stack.
     * @param registers The registers holding the stack pointer.
     */
    public StackHandler(Memory memory, RegisterFile registers) {
        this.memory = memory;
        this.registers = registers;
    }

    /**
     * Pushes a value onto the stack.
     * @param value The value to push, masked to 0-255.
     */
    public void push(int value) {
        registers.setStackPointer(registers.getStackPointer() - 1);
        memory.write(registers.getStackPointer(), value);
    }

    /**
     * Pops the top value off the stack.
     * @return The popped value.
     */
    public int pop() {
        int value = memory.read(registers.getStackPointer());
        registers.setStackPointer(registers.getStackPointer() + 1);
        return value;
    }
}
