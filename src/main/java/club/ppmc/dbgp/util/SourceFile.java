/**
 * SourceFile.java
 *
 * 被调试脚本的文本内容，按行拆分。
 * 读取时同时识别 \n 与 \r\n 换行，并记住文件原本使用的换行符和 UTF-8 BOM，
 * 以便修复后写回时保持文件格式不变。
 */
package club.ppmc.dbgp.util;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.io.ByteOrderMark;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BOMInputStream;

public record SourceFile(Path path, List<String> lines, String lineSeparator, boolean hasBom) {

    public SourceFile {
        lines = List.copyOf(lines);
    }

    /**
     * 读取文件并按行拆分。
     *
     * @param path 文件路径。
     * @return 文件内容。
     * @throws IOException 如果文件不存在或无法读取。
     */
    public static SourceFile read(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            throw new IOException("无法读取目录的内容: " + path);
        }
        try (BOMInputStream in = BOMInputStream.builder().setPath(path).get()) {
            boolean hasBom = in.hasBOM();
            String content = IOUtils.toString(in, StandardCharsets.UTF_8);
            String separator = content.contains("\r\n") ? "\r\n" : "\n";
            return new SourceFile(path, Arrays.asList(content.split("\\r?\\n", -1)), separator, hasBom);
        }
    }

    public int lineCount() {
        return lines.size();
    }

    /** 返回第 lineNumber 行 (从1开始)。 */
    public String line(int lineNumber) {
        return lines.get(lineNumber - 1);
    }

    public SourceFile withLine(int lineNumber, String text) {
        String[] copy = lines.toArray(new String[0]);
        copy[lineNumber - 1] = text;
        return new SourceFile(path, Arrays.asList(copy), lineSeparator, hasBom);
    }

    public void write() throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            if (hasBom) {
                out.write(ByteOrderMark.UTF_8.getBytes());
            }
            out.write(String.join(lineSeparator, lines).getBytes(StandardCharsets.UTF_8));
        }
    }
}
