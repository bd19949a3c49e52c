/**
 * SourceContextService.java
 *
 * 读取引擎报告的源文件，截取错误行上下若干行作为错误上下文。
 * 文件不存在或不可读时返回单行占位内容，而不是让错误捕获失败。
 */
package club.ppmc.dbgp.service;

import club.ppmc.dbgp.config.DbgpSettings;
import club.ppmc.dbgp.model.dbgp.SourceLine;
import club.ppmc.dbgp.util.SourceFile;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SourceContextService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceContextService.class);
    static final String SOURCE_UNAVAILABLE = "(source unavailable)";

    private final DbgpSettings settings;

    public SourceContextService(DbgpSettings settings) {
        this.settings = settings;
    }

    public List<SourceLine> getSourceContext(String file, int line) {
        return getSourceContext(file, line, settings.sourceContextRadius());
    }

    /**
     * 截取 [line - radius, line + radius] 范围内的源代码行，范围超出文件时自动截断。
     *
     * @param file 源文件路径。
     * @param line 错误行号 (从1开始)。
     * @param radius 上下各取的行数。
     * @return 带行号的源代码行，错误行被标记。
     */
    public List<SourceLine> getSourceContext(String file, int line, int radius) {
        SourceFile source;
        try {
            source = SourceFile.read(Paths.get(file));
        } catch (IOException | InvalidPathException e) {
            LOGGER.debug("无法读取源文件 {}: {}", file, e.getMessage());
            return List.of(new SourceLine(line, SOURCE_UNAVAILABLE, true));
        }

        int start = Math.max(0, line - radius - 1);
        int end = Math.min(source.lineCount(), line + radius);
        List<SourceLine> result = new ArrayList<>();
        for (int i = start; i < end; i++) {
            result.add(new SourceLine(i + 1, source.lines().get(i), i + 1 == line));
        }
        return result;
    }
}
