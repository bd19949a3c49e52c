package club.ppmc.dbgp.service;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.dbgp.config.DbgpSettings;
import club.ppmc.dbgp.model.dbgp.SourceLine;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceContextServiceTest {

    @TempDir
    Path tempDir;

    private final SourceContextService service = new SourceContextService(DbgpSettings.defaults());

    @Test
    void returnsLinesAroundErrorWithMarker() throws IOException {
        Path script = write("a.ahk", "line1\nline2\nline3\nline4\nline5\nline6\nline7");

        List<SourceLine> context = service.getSourceContext(script.toString(), 4, 2);

        assertThat(context).containsExactly(
                new SourceLine(2, "line2", false),
                new SourceLine(3, "line3", false),
                new SourceLine(4, "line4", true),
                new SourceLine(5, "line5", false),
                new SourceLine(6, "line6", false));
    }

    @Test
    void clampsRangeToFileBounds() throws IOException {
        Path script = write("short.ahk", "first\nsecond\nthird");

        List<SourceLine> context = service.getSourceContext(script.toString(), 1);

        assertThat(context).extracting(SourceLine::line).containsExactly(1, 2, 3);
        assertThat(context.get(0).errorLine()).isTrue();
    }

    @Test
    void handlesCrlfLineEndingsAndBom() throws IOException {
        Path script = tempDir.resolve("crlf.ahk");
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = "x := 1\r\ny := x + 1\r\nMsgBox(y)\r\n".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, content, 0, bom.length);
        System.arraycopy(body, 0, content, bom.length, body.length);
        Files.write(script, content);

        List<SourceLine> context = service.getSourceContext(script.toString(), 1, 1);

        assertThat(context).containsExactly(
                new SourceLine(1, "x := 1", true),
                new SourceLine(2, "y := x + 1", false));
    }

    @Test
    void missingFileYieldsPlaceholder() {
        List<SourceLine> context = service.getSourceContext(tempDir.resolve("missing.ahk").toString(), 12, 5);

        assertThat(context).containsExactly(new SourceLine(12, SourceContextService.SOURCE_UNAVAILABLE, true));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }
}
