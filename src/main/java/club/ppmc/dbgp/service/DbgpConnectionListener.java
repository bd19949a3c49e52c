/**
 * DbgpConnectionListener.java
 *
 * DbgpConnectionManager 的事件回调。
 * 除 onListening 外，所有回调都在连接的读取线程上执行，实现方不得在回调中阻塞等待命令响应。
 */
package club.ppmc.dbgp.service;

public interface DbgpConnectionListener {

    default void onListening(int port) {}

    void onConnected(String remoteAddress);

    void onInit(String xml);

    void onMessage(String xml);

    void onDisconnected();
}
