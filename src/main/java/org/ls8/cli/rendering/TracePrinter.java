package org.ls8.cli.rendering;

import org.ls8.runtime.api.TraceSnapshot;
import org.ls8.runtime.spi.ITraceListener;

import java.io.PrintWriter;

/**
 * Prints one line per executed instruction:
 * <pre>
 * TRACE: 00 | 82 00 08 | 00 00 00 00 00 00 00 F4
 * </pre>
 * The columns are the program counter, the opcode with both prefetched operand bytes, and
 * the eight registers, all in hexadecimal.
 */
public class TracePrinter implements ITraceListener {

    private final PrintWriter writer;

    public TracePrinter(PrintWriter writer) {
        this.writer = writer;
    }

    @Override
    public void onInstruction(TraceSnapshot snapshot) {
        writer.println(format(snapshot));
        writer.flush();
    }

    /**
     * Formats a snapshot as a trace line.
     * @param snapshot The machine state.
     * @return The line, without a trailing newline.
     */
    public static String format(TraceSnapshot snapshot) {
        StringBuilder sb = new StringBuilder(String.format("TRACE: %02X | %02X %02X %02X |",
                snapshot.pc(), snapshot.opcode(), snapshot.operandA(), snapshot.operandB()));
        for (int value : snapshot.registers()) {
            sb.append(String.format(" %02X", value));
        }
        return sb.toString();
    }
}
