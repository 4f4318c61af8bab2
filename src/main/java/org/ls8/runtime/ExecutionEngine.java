package org.ls8.runtime;

import org.ls8.runtime.api.MachineFault;
import org.ls8.runtime.api.TraceSnapshot;
import org.ls8.runtime.internal.services.ExecutionContext;
import org.ls8.runtime.internal.services.RuntimeDisassembler;
import org.ls8.runtime.isa.Instruction;
import org.ls8.runtime.model.CompareFlag;
import org.ls8.runtime.model.Memory;
import org.ls8.runtime.model.RegisterFile;
import org.ls8.runtime.spi.ITraceListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.Optional;

/**
 * The core of the LS-8 machine.
 * This class owns memory, registers, ALU and program counter and drives the
 * fetch-decode-execute loop. Callers load a program and then either single-step with
 * {@link #step()} or run it to completion with {@link #runToHalt()}.
 * <p>
 * Each step fetches the opcode at the program counter together with the next two bytes,
 * looks up the handler in the {@link Dispatcher}, executes it with as many operands as the
 * opcode declares and finally advances the program counter past the instruction, unless
 * the instruction redirected it. Any {@link MachineFault} halts the engine and is rethrown.
 */
public class ExecutionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutionEngine.class);

    private final Memory memory = new Memory();
    private final RegisterFile registers = new RegisterFile();
    private final Alu alu = new Alu(registers);
    private final Dispatcher dispatcher;
    private final PrintWriter out;
    private final int initialStackPointer;

    private ITraceListener traceListener;
    private int pc;
    private EngineState state;
    private long executedInstructions;
    private int programLength;

    /**
     * Creates an engine with the default initial stack pointer.
     * @param out The sink for PRN output.
     */
    public ExecutionEngine(PrintWriter out) {
        this(out, Config.DEFAULT_INITIAL_STACK_POINTER);
    }

    /**
     * Creates an engine with the full instruction set.
     * @param out The sink for PRN output.
     * @param initialStackPointer The value register 7 holds after every load.
     */
    public ExecutionEngine(PrintWriter out, int initialStackPointer) {
        this(out, initialStackPointer, Dispatcher.createDefault());
    }

    /**
     * Creates an engine with a custom dispatcher.
     * @param out The sink for PRN output.
     * @param initialStackPointer The value register 7 holds after every load.
     * @param dispatcher The opcode table to execute with.
     */
    public ExecutionEngine(PrintWriter out, int initialStackPointer, Dispatcher dispatcher) {
        if (initialStackPointer < 0 || initialStackPointer >= Config.MEMORY_SIZE) {
            throw new IllegalArgumentException("Initial stack pointer must be in [0, "
                    + (Config.MEMORY_SIZE - 1) + "], was " + initialStackPointer);
        }
        this.out = out;
        this.initialStackPointer = initialStackPointer;
        this.dispatcher = dispatcher;
        reset();
    }

    /**
     * Replaces the memory content with a program image and resets the machine state.
     * @param program The program bytes, placed from address 0.
     * @throws IllegalArgumentException if the program does not fit into memory.
     */
    public void load(int[] program) {
        if (program.length > memory.size()) {
            throw new IllegalArgumentException("Program of " + program.length + " bytes does not fit into "
                    + memory.size() + " bytes of memory");
        }
        memory.clear();
        memory.load(program);
        this.programLength = program.length;
        reset();
        LOG.debug("Loaded program of {} bytes, SP=0x{}", program.length, hex(initialStackPointer));
    }

    /**
     * Executes exactly one instruction.
     * @throws IllegalStateException if the engine is already halted.
     * @throws MachineFault if the instruction cannot be executed; the engine is halted afterwards.
     */
    public void step() {
        if (state == EngineState.HALTED) {
            throw new IllegalStateException("Engine is halted at PC 0x" + hex(pc));
        }
        try {
            int opcode = memory.read(pc);
            int operandA = memory.read(Config.toByte(pc + 1));
            int operandB = memory.read(Config.toByte(pc + 2));

            if (traceListener != null) {
                traceListener.onInstruction(new TraceSnapshot(pc, opcode, operandA, operandB, registers.snapshot()));
            }

            Instruction instruction = dispatcher.lookup(opcode, pc);
            int[] operands = Arrays.copyOf(new int[]{operandA, operandB}, instruction.getOperandCount());

            if (LOG.isDebugEnabled()) {
                LOG.debug("PC=0x{} {} REG={}", hex(pc), RuntimeDisassembler.INSTANCE.disassemble(memory, pc).toAssembly(), registers);
            }

            ExecutionContext context = new ExecutionContext(memory, registers, alu, out, pc);
            instruction.execute(context, operands);
            executedInstructions++;

            if (context.isHaltRequested()) {
                state = EngineState.HALTED;
                LOG.debug("Halted at PC=0x{} after {} instructions", hex(pc), executedInstructions);
            } else if (context.shouldSkipPcAdvance()) {
                pc = context.getNextPc();
            } else {
                pc = Config.toByte(pc + instruction.getLength());
            }
        } catch (MachineFault e) {
            state = EngineState.HALTED;
            LOG.error("Machine fault at PC=0x{}: {}", hex(pc), e.getMessage());
            throw e;
        }
    }

    /**
     * Steps until the engine halts.
     * @return The number of instructions executed by this call, including the final HLT.
     * @throws MachineFault if an instruction fails; the engine is halted afterwards.
     */
    public long runToHalt() {
        long before = executedInstructions;
        while (state == EngineState.RUNNING) {
            step();
        }
        return executedInstructions - before;
    }

    private void reset() {
        registers.clear();
        registers.setStackPointer(initialStackPointer);
        alu.reset();
        pc = 0;
        executedInstructions = 0;
        state = EngineState.RUNNING;
    }

    private static String hex(int value) {
        return String.format("%02X", value);
    }

    /**
     * Installs a listener that receives a snapshot before every instruction.
     * @param traceListener The listener, or null to disable tracing.
     */
    public void setTraceListener(ITraceListener traceListener) {
        this.traceListener = traceListener;
    }

    public Memory getMemory() { return memory; }

    public RegisterFile getRegisters() { return registers; }

    public int getProgramCounter() { return pc; }

    public EngineState getState() { return state; }

    public boolean isRunning() { return state == EngineState.RUNNING; }

    /**
     * Returns the result of the last CMP since the last load.
     * @return The compare flag, or empty if no CMP has run yet.
     */
    public Optional<CompareFlag> getCompareFlag() { return alu.getCompareFlag(); }

    /**
     * Returns the flags register in its LS-8 layout {@code 00000LGE}.
     * @return The bits of the last comparison, or 0 if no CMP has run yet.
     */
    public int getFlags() {
        return alu.getCompareFlag().map(CompareFlag::getBits).orElse(0);
    }

    public long getExecutedInstructions() { return executedInstructions; }

    /**
     * Returns the size of the last loaded program image.
     * @return The number of bytes written by the last {@link #load(int[])}.
     */
    public int getProgramLength() { return programLength; }
}
