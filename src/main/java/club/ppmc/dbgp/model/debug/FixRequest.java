/**
 * FixRequest.java
 *
 * 应用单行修复的请求体。只有当目标行的当前内容与 original 一致时才会替换。
 */
package club.ppmc.dbgp.model.debug;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * @param file 目标文件路径。
 * @param line 要替换的行号 (从1开始)。
 * @param original 预期的修复前内容 (比较时忽略首尾空白)。
 * @param replacement 替换后的内容，缩进沿用原行。
 */
public record FixRequest(
        @NotBlank String file, @Min(1) int line, @NotNull String original, @NotNull String replacement) {}
