/**
 * BreakpointRequest.java
 *
 * 设置行断点的请求体，由 DbgpController 接收并转交给 DbgpSession。
 */
package club.ppmc.dbgp.model.debug;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * @param file 要设置断点的文件路径。
 * @param line 断点所在的行号 (从1开始)。
 * @param condition (可选) 条件表达式。
 */
public record BreakpointRequest(@NotBlank String file, @Min(1) int line, String condition) {}
