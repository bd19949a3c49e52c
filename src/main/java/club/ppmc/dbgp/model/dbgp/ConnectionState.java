/**
 * ConnectionState.java
 *
 * 调试会话的连接状态。
 */
package club.ppmc.dbgp.model.dbgp;

public enum ConnectionState {
    DISCONNECTED,
    LISTENING,
    CONNECTED
}
