/**
 * DbgpErrorType.java
 *
 * 调试会话可能出现的错误类别。
 * Controller 层根据类别选择 HTTP 状态码，调用方据此区分“超时”与“传输故障”。
 */
package club.ppmc.dbgp.exception;

public enum DbgpErrorType {
    /** 当前没有已连接的调试引擎。 */
    NOT_CONNECTED,
    /** 在超时时间内没有收到匹配的响应。 */
    TIMEOUT,
    /** 套接字绑定、读写失败或连接中途断开。 */
    TRANSPORT,
    /** 端口冲突重试次数用尽。 */
    NO_AVAILABLE_PORT,
    /** 调试引擎在响应中返回了 error 元素。 */
    ENGINE_ERROR
}
