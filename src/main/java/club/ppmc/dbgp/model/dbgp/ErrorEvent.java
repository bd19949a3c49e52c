/**
 * ErrorEvent.java
 *
 * 一次被捕获的运行时错误及其完整上下文。
 * 由 DbgpSession 在收到引擎的故障通知（或显式的捕获请求）时创建，并放入 ErrorQueue 中，
 * 供自动修复流程通过 waitForError 逐个取出。
 */
package club.ppmc.dbgp.model.dbgp;

import java.util.List;

/**
 * @param errorType 错误类型，例如 "Error"、"TypeError"。
 * @param message 错误消息。
 * @param file 出错的源文件。
 * @param line 出错的行号。
 * @param sourceContext 出错行附近的源代码。
 * @param stackTrace 捕获时的调用栈，不可用时为空列表。
 * @param localVariables 局部变量快照，不可用时为空列表。
 * @param globalVariables 全局变量快照，不可用时为空列表。
 * @param timestamp 捕获时间 (epoch 毫秒)。
 */
public record ErrorEvent(
        String errorType,
        String message,
        String file,
        int line,
        List<SourceLine> sourceContext,
        List<StackFrame> stackTrace,
        List<Variable> localVariables,
        List<Variable> globalVariables,
        long timestamp) {}
