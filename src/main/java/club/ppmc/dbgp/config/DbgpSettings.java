/**
 * DbgpSettings.java
 *
 * DBGp 调试会话的配置项，由 AppConfig 从 application.properties 中读取。
 */
package club.ppmc.dbgp.config;

/**
 * @param port 默认监听端口。端口被占用时依次尝试下一个端口。
 * @param commandTimeoutMs 每条命令等待响应的超时时间。
 * @param maxPortAttempts 端口冲突时最多尝试的端口数。
 * @param errorQueueSize 错误队列的最大长度，超出时丢弃最旧的条目。
 * @param sourceContextRadius 错误行上下各取的源代码行数。
 * @param waitTimeoutMs 等待下一个错误的默认超时时间。
 */
public record DbgpSettings(
        int port,
        long commandTimeoutMs,
        int maxPortAttempts,
        int errorQueueSize,
        int sourceContextRadius,
        long waitTimeoutMs) {

    public static DbgpSettings defaults() {
        return new DbgpSettings(9000, 10_000, 100, 100, 5, 30_000);
    }
}
