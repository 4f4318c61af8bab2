package org.ls8.loader;

import org.ls8.runtime.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads LS-8 program files into memory images.
 * <p>
 * A program file holds one byte per line, written as a binary literal of up to eight digits.
 * A {@code #} starts a comment that runs to the end of the line; blank and comment-only lines
 * are skipped. Bytes are placed from address 0 in file order.
 * <pre>
 * 10000010 # LDI R0,8
 * 00000000
 * 00001000
 * </pre>
 */
public class ProgramLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramLoader.class);
    private static final Pattern BINARY_BYTE = Pattern.compile("[01]{1,8}");
    private static final char COMMENT_START = '#';

    /**
     * Loads a program file.
     * @param path The file to read.
     * @return The program bytes.
     * @throws ProgramFileNotFoundException if the file does not exist.
     * @throws ProgramEncodingException if a line is not valid UTF-8.
     * @throws MalformedProgramLineException if a line is not a binary byte literal.
     * @throws ProgramLoadException if the file cannot be read or the program does not fit into memory.
     */
    public int[] load(Path path) throws ProgramLoadException {
        if (!Files.isRegularFile(path)) {
            throw new ProgramFileNotFoundException(path);
        }
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ProgramLoadException("Failed to read program file " + path + ": " + e.getMessage(), e);
        }
        String sourceName = path.getFileName().toString();
        int[] program = parse(decodeLines(content, sourceName), sourceName);
        LOG.info("Loaded {} bytes from {}", program.length, path);
        return program;
    }

    /**
     * Parses the lines of a program.
     * @param lines The raw lines.
     * @param sourceName The name used in diagnostics.
     * @return The program bytes.
     * @throws MalformedProgramLineException if a line is not a binary byte literal.
     * @throws ProgramLoadException if the program does not fit into memory.
     */
    public int[] parse(List<String> lines, String sourceName) throws ProgramLoadException {
        List<Integer> bytes = new ArrayList<>();
        int lineNumber = 0;
        for (String rawLine : lines) {
            lineNumber++;
            String line = stripComment(rawLine).strip();
            if (line.isEmpty()) {
                continue;
            }
            if (!BINARY_BYTE.matcher(line).matches()) {
                throw new MalformedProgramLineException(sourceName, lineNumber, line);
            }
            bytes.add(Integer.parseInt(line, 2));
        }

        if (bytes.size() > Config.MEMORY_SIZE) {
            throw new ProgramLoadException(String.format("Program %s has %d bytes but memory holds only %d",
                    sourceName, bytes.size(), Config.MEMORY_SIZE));
        }
        return bytes.stream().mapToInt(Integer::intValue).toArray();
    }

    // Lines are decoded one by one so that an encoding error can name its line.
    // A '\n' byte never occurs inside a multi-byte UTF-8 sequence.
    private static List<String> decodeLines(byte[] content, String sourceName) throws ProgramEncodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= content.length; i++) {
            boolean endOfContent = i == content.length;
            if (!endOfContent && content[i] != '\n') {
                continue;
            }
            if (endOfContent && start == i) {
                break;
            }
            try {
                lines.add(decoder.decode(ByteBuffer.wrap(content, start, i - start)).toString());
            } catch (CharacterCodingException e) {
                throw new ProgramEncodingException(sourceName, lines.size() + 1);
            }
            start = i + 1;
        }
        return lines;
    }

    private static String stripComment(String line) {
        int commentStart = line.indexOf(COMMENT_START);
        return commentStart >= 0 ? line.substring(0, commentStart) : line;
    }
}
