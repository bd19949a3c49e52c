package club.ppmc.dbgp.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.dbgp.exception.FixMismatchException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceFixServiceTest {

    @TempDir
    Path tempDir;

    private final SourceFixService service = new SourceFixService();

    @Test
    void replacesLineAndKeepsIndentation() throws IOException {
        Path script = Files.writeString(tempDir.resolve("a.ahk"), "Greet() {\n    MsgBox(\"Hi\"\n}\n");

        Map<String, Object> result = service.applyFix(script.toString(), 2, "MsgBox(\"Hi\"", "MsgBox(\"Hi\")");

        assertThat(Files.readString(script)).isEqualTo("Greet() {\n    MsgBox(\"Hi\")\n}\n");
        assertThat(result)
                .containsEntry("line", 2)
                .containsEntry("old", "MsgBox(\"Hi\"")
                .containsEntry("new", "MsgBox(\"Hi\")");
    }

    @Test
    void comparisonIgnoresSurroundingWhitespace() throws IOException {
        Path script = Files.writeString(tempDir.resolve("b.ahk"), "x := 1\n\ty := x +\n");

        service.applyFix(script.toString(), 2, "  y := x +  ", "y := x + 1");

        assertThat(Files.readString(script)).isEqualTo("x := 1\n\ty := x + 1\n");
    }

    @Test
    void mismatchLeavesFileUnchanged() throws IOException {
        String original = "MsgBox(\"Hi\")\nExitApp\n";
        Path script = Files.writeString(tempDir.resolve("c.ahk"), original);

        assertThatThrownBy(() -> service.applyFix(script.toString(), 1, "MsgBox('Hi')", "MsgBox('Bye')"))
                .isInstanceOfSatisfying(FixMismatchException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo("MsgBox('Hi')");
                    assertThat(e.getActual()).isEqualTo("MsgBox(\"Hi\")");
                });
        assertThat(Files.readString(script)).isEqualTo(original);
    }

    @Test
    void preservesCrlfLineEndings() throws IOException {
        Path script = Files.writeString(tempDir.resolve("d.ahk"), "a := 1\r\nb := a +\r\nc := b\r\n");

        service.applyFix(script.toString(), 2, "b := a +", "b := a + 2");

        assertThat(Files.readString(script)).isEqualTo("a := 1\r\nb := a + 2\r\nc := b\r\n");
    }

    @Test
    void rejectsLineOutsideFile() throws IOException {
        Path script = Files.writeString(tempDir.resolve("e.ahk"), "only line");

        assertThatThrownBy(() -> service.applyFix(script.toString(), 5, "x", "y"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.applyFix(script.toString(), 0, "x", "y"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingFileFailsWithIoException() {
        assertThatThrownBy(() -> service.applyFix(tempDir.resolve("nope.ahk").toString(), 1, "x", "y"))
                .isInstanceOf(IOException.class);
    }
}
