/**
 * FaultNotice.java
 *
 * 引擎报告的一次运行时错误（xdebug:message 元素），用于触发自动错误捕获。
 */
package club.ppmc.dbgp.protocol;

public record FaultNotice(String file, int line, String errorType, String message) {}
