/**
 * SourceLine.java
 *
 * 错误位置附近的一行源代码。
 */
package club.ppmc.dbgp.model.dbgp;

/**
 * @param line 行号 (从1开始)。
 * @param text 该行的文本内容。
 * @param errorLine 是否为出错的那一行。
 */
public record SourceLine(int line, String text, boolean errorLine) {}
