/**
 * ExceptionBreakpointRequest.java
 *
 * 设置异常断点的请求体。exception 为空时表示在所有错误处中断。
 */
package club.ppmc.dbgp.model.debug;

public record ExceptionBreakpointRequest(String exception) {}
