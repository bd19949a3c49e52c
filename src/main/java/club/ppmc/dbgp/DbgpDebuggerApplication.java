/**
 * DbgpDebuggerApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 启动后通过 /api/dbgp 提供 DBGp 调试命令，并通过 WebSocket 推送调试事件。
 */
package club.ppmc.dbgp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DbgpDebuggerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DbgpDebuggerApplication.class, args);
    }
}
