/**
 * WsDebugEvent.java
 *
 * 通过WebSocket推送的调试会话事件的通用包装。
 * 订阅方根据 'type' 字段分发处理，例如 "CONNECTED"、"INIT"、"ERROR_CAPTURED"、"DISCONNECTED"。
 */
package club.ppmc.dbgp.model.debug;

/**
 * @param type 事件类型。
 * @param data 事件相关的数据负载，简单通知事件可以为 null。
 * @param <T> 数据负载的泛型类型。
 */
public record WsDebugEvent<T>(String type, T data) {}
