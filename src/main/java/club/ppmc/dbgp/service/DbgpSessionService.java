/**
 * DbgpSessionService.java
 *
 * 进程内唯一的调试会话的持有者。
 * 会话在首次访问时创建；reset() 关闭并丢弃当前会话，下一次访问会得到一个全新的会话（新的事务ID序列、空的错误队列）。
 * 应用关闭时自动释放监听端口。
 */
package club.ppmc.dbgp.service;

import club.ppmc.dbgp.config.DbgpSettings;
import club.ppmc.dbgp.model.debug.WsDebugEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DbgpSessionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DbgpSessionService.class);

    private final DbgpSettings settings;
    private final SourceContextService sourceContextService;
    private final WebSocketNotificationService notificationService;

    private DbgpSession session;

    public DbgpSessionService(
            DbgpSettings settings,
            SourceContextService sourceContextService,
            WebSocketNotificationService notificationService) {
        this.settings = settings;
        this.sourceContextService = sourceContextService;
        this.notificationService = notificationService;
    }

    public synchronized DbgpSession getSession() {
        if (session == null) {
            session = new DbgpSession(settings, sourceContextService, notificationService::sendDebugEvent);
            LOGGER.info("已创建新的 DBGp 调试会话。");
        }
        return session;
    }

    /**
     * 确保会话正在监听。
     *
     * @param port 首选端口，为 null 时使用配置的默认端口。
     * @return 正在监听的会话。
     */
    public synchronized DbgpSession start(Integer port) {
        DbgpSession current = getSession();
        current.listen(port != null ? port : settings.port());
        return current;
    }

    /**
     * 关闭并丢弃当前会话。
     *
     * @return 是否确实关闭了一个会话。
     */
    public synchronized boolean reset() {
        if (session == null) {
            return false;
        }
        LOGGER.info("正在关闭 DBGp 调试会话 (端口 {})...", session.getPort());
        session.close();
        session = null;
        notificationService.sendDebugEvent(new WsDebugEvent<>("STOPPED", null));
        return true;
    }

    @PreDestroy
    public void shutdown() {
        reset();
    }
}
