/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 定义应用级别的Bean：用于WebSocket事件序列化的 Gson，以及调试会话的配置 DbgpSettings。
 */
package club.ppmc.dbgp.config;

import com.google.gson.Gson;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    /**
     * 定义一个全局的 Gson Bean。
     * 在WebSocket服务中用于将事件对象转换为JSON字符串。
     *
     * @return 一个新的 Gson 实例。
     */
    @Bean
    public Gson gson() {
        return new Gson();
    }

    /**
     * 从 application.properties 读取调试会话配置，未配置的项使用默认值。
     */
    @Bean
    public DbgpSettings dbgpSettings(
            @Value("${dbgp.port:9000}") int port,
            @Value("${dbgp.command-timeout-ms:10000}") long commandTimeoutMs,
            @Value("${dbgp.max-port-attempts:100}") int maxPortAttempts,
            @Value("${dbgp.error-queue-size:100}") int errorQueueSize,
            @Value("${dbgp.source-context-radius:5}") int sourceContextRadius,
            @Value("${dbgp.wait-timeout-ms:30000}") long waitTimeoutMs) {
        return new DbgpSettings(
                port, commandTimeoutMs, maxPortAttempts, errorQueueSize, sourceContextRadius, waitTimeoutMs);
    }
}
