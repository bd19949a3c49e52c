/**
 * Breakpoint.java
 *
 * 调试引擎断点表中一条断点的镜像。
 * 客户端不缓存断点，每次列出断点时都从引擎重新获取。
 */
package club.ppmc.dbgp.model.dbgp;

/**
 * @param id 引擎分配的断点ID。
 * @param file 源文件路径 (已去除 file:// 前缀)。
 * @param line 断点所在的行号 (从1开始)。
 * @param condition 条件表达式，无条件时为 null。
 * @param state 断点状态，"enabled" 或 "disabled"。
 */
public record Breakpoint(String id, String file, int line, String condition, String state) {}
