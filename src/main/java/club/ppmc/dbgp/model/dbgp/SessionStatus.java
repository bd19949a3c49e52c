/**
 * SessionStatus.java
 *
 * 当前调试会话的状态快照，由 status 操作返回。
 */
package club.ppmc.dbgp.model.dbgp;

/**
 * @param connected 是否已有调试引擎连接。
 * @param state 连接状态。
 * @param port 当前（或将要）监听的端口。
 * @param errorsQueued 错误队列中的条目数。
 * @param init 引擎握手信息，尚未收到 init 包时为 null。
 */
public record SessionStatus(
        boolean connected, ConnectionState state, int port, int errorsQueued, DbgpInitInfo init) {}
