/**
 * FixMismatchException.java
 *
 * 应用修复时，磁盘上目标行的内容与预期的“修复前”内容不一致时抛出。
 * 文件保持不变；异常同时携带预期内容和实际内容，供调用方判断修复是否已过期。
 */
package club.ppmc.dbgp.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class FixMismatchException extends RuntimeException {

    private final int line;
    private final String expected;
    private final String actual;

    public FixMismatchException(int line, String expected, String actual) {
        super(String.format("第 %d 行内容不匹配。%n预期: \"%s\"%n实际: \"%s\"", line, expected, actual));
        this.line = line;
        this.expected = expected;
        this.actual = actual;
    }

    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "FIX_MISMATCH",
                "message", getMessage(),
                "line", line,
                "expected", expected,
                "actual", actual);
    }
}
