/**
 * SourceFixService.java
 *
 * 将单行修复写回源文件。
 * 写入前校验目标行的当前内容与调用方预期的“修复前”内容一致（忽略首尾空白），
 * 防止把过期的修复应用到已被修改的文件上；替换后的行沿用原行的缩进。
 */
package club.ppmc.dbgp.service;

import club.ppmc.dbgp.exception.FixMismatchException;
import club.ppmc.dbgp.util.SourceFile;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class SourceFixService {

    /**
     * 替换文件中的一行。
     *
     * @param file 目标文件。
     * @param line 行号 (从1开始)。
     * @param original 预期的当前内容。
     * @param replacement 新内容。
     * @return 修复摘要，包含新旧内容。
     * @throws IOException 文件无法读取或写入时。
     * @throws IllegalArgumentException 行号超出文件范围时。
     * @throws FixMismatchException 当前内容与预期不一致时，文件保持不变。
     */
    public Map<String, Object> applyFix(String file, int line, String original, String replacement)
            throws IOException {
        SourceFile source = SourceFile.read(Paths.get(file));
        if (line < 1 || line > source.lineCount()) {
            throw new IllegalArgumentException(
                    String.format("行号 %d 超出范围 (文件共有 %d 行)", line, source.lineCount()));
        }

        String actual = source.line(line);
        if (!actual.trim().equals(original.trim())) {
            log.warn("拒绝应用修复: {}:{} 的内容已变化。", file, line);
            throw new FixMismatchException(line, original.trim(), actual.trim());
        }

        String updated = leadingWhitespace(actual) + replacement.trim();
        source.withLine(line, updated).write();
        log.info("已在 {}:{} 应用修复。", file, line);
        return Map.of(
                "file", file,
                "line", line,
                "old", original.trim(),
                "new", replacement.trim());
    }

    private static String leadingWhitespace(String text) {
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return text.substring(0, i);
    }
}
