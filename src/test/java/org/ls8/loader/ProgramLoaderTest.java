package org.ls8.loader;

import org.ls8.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests parsing of program files: comments, blank lines, malformed lines and size limits.
 */
@ExtendWith(LogWatchExtension.class)
class ProgramLoaderTest {

    private final ProgramLoader loader = new ProgramLoader();

    @TempDir
    Path tempDir;

    private static Path resource(String name) throws URISyntaxException {
        return Paths.get(ProgramLoaderTest.class.getResource("/org/ls8/programs/" + name).toURI());
    }

    @Test
    @Tag("unit")
    void skipsCommentsAndBlankLines() throws Exception {
        int[] program = loader.parse(List.of(
                "# header",
                "",
                "10000010 # LDI R0,8",
                "   00000000   ",
                "00001000",
                "   # indented comment",
                "1"), "inline");

        assertThat(program).containsExactly(0b10000010, 0, 8, 1);
    }

    @Test
    @Tag("unit")
    void loadsProgramFile() throws Exception {
        int[] program = loader.load(resource("print8.ls8"));

        assertThat(program).startsWith(0b10000010, 0b00000000, 0b00001000);
        assertThat(program[program.length - 1]).isEqualTo(0b00000001);
    }

    @Test
    @Tag("unit")
    void reportsMalformedLineWithLineNumber() {
        assertThatThrownBy(() -> loader.load(resource("malformed.ls8")))
                .isInstanceOf(MalformedProgramLineException.class)
                .hasMessage("Invalid number '12' at malformed.ls8:7")
                .satisfies(e -> {
                    MalformedProgramLineException malformed = (MalformedProgramLineException) e;
                    assertThat(malformed.getLineNumber()).isEqualTo(7);
                    assertThat(malformed.getLine()).isEqualTo("12");
                });
    }

    @Test
    @Tag("unit")
    void rejectsLiteralsLongerThanOneByte() {
        assertThatThrownBy(() -> loader.parse(List.of("100000000"), "inline"))
                .isInstanceOf(MalformedProgramLineException.class);
    }

    @Test
    @Tag("unit")
    void rejectsProgramsLargerThanMemory() {
        List<String> lines = new ArrayList<>(Collections.nCopies(257, "00000001"));

        assertThatThrownBy(() -> loader.parse(lines, "big"))
                .isInstanceOf(ProgramLoadException.class)
                .hasMessageContaining("257");
    }

    @Test
    @Tag("unit")
    void acceptsProgramFillingAllOfMemory() throws Exception {
        List<String> lines = new ArrayList<>(Collections.nCopies(256, "00000001"));

        assertThat(loader.parse(lines, "full")).hasSize(256);
    }

    @Test
    @Tag("unit")
    void missingFileIsReported() {
        Path missing = tempDir.resolve("nope.ls8");

        assertThatThrownBy(() -> loader.load(missing))
                .isInstanceOf(ProgramFileNotFoundException.class)
                .hasMessageContaining("Could not find file")
                .satisfies(e -> assertThat(((ProgramFileNotFoundException) e).getPath()).isEqualTo(missing));
    }

    @Test
    @Tag("unit")
    void invalidUtf8IsReportedWithLineNumber() throws Exception {
        byte[] content = {
                '1', '0', '0', '0', '0', '0', '1', '0', '\n',
                '0', '0', '0', '0', '0', '0', '0', '0', '\n',
                (byte) 0xFF, (byte) 0xFE, '\n',
                '0', '0', '0', '0', '0', '0', '0', '1', '\n'
        };
        Path file = Files.write(tempDir.resolve("binary.ls8"), content);

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ProgramEncodingException.class)
                .hasMessage("Invalid UTF-8 at binary.ls8:3")
                .satisfies(e -> assertThat(((ProgramEncodingException) e).getLineNumber()).isEqualTo(3));
    }

    @Test
    @Tag("unit")
    void windowsLineEndingsAreAccepted() throws Exception {
        Path file = Files.writeString(tempDir.resolve("crlf.ls8"), "10000010 # LDI\r\n00000001\r\n00000101\r\n");

        assertThat(loader.load(file)).containsExactly(0b10000010, 1, 5);
    }

    @Test
    @Tag("unit")
    void emptyFileYieldsEmptyProgram() throws Exception {
        Path file = Files.writeString(tempDir.resolve("empty.ls8"), "# nothing here\n\n");

        assertThat(loader.load(file)).isEmpty();
    }
}
