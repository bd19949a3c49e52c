/**
 * StackFrame.java
 *
 * stack_get 响应中的一个栈帧。level 为 0 表示最内层帧。
 */
package club.ppmc.dbgp.model.dbgp;

public record StackFrame(int level, String type, String filename, int lineNumber, String where) {}
