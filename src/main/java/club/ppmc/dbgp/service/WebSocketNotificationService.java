/**
 * WebSocketNotificationService.java
 *
 * 统一的WebSocket消息发送服务。
 * 封装 SimpMessagingTemplate 的使用细节，将调试会话事件序列化后发送到 /topic/dbgp-events。
 */
package club.ppmc.dbgp.service;

import club.ppmc.dbgp.model.debug.WsDebugEvent;
import com.google.gson.Gson;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class WebSocketNotificationService {

    static final String DEBUG_EVENTS_TOPIC = "/topic/dbgp-events";

    private final SimpMessagingTemplate messagingTemplate;
    private final Gson gson;

    public WebSocketNotificationService(SimpMessagingTemplate messagingTemplate, Gson gson) {
        this.messagingTemplate = messagingTemplate;
        this.gson = gson;
    }

    /**
     * 发送调试事件。事件由读取线程产生，推送失败只记录日志，不影响调试会话。
     *
     * @param event 要发送的调试事件对象。
     */
    public void sendDebugEvent(WsDebugEvent<?> event) {
        // 使用Gson手动序列化，便于控制泛型记录类型的JSON输出
        String payload = gson.toJson(event);
        try {
            sendMessage(DEBUG_EVENTS_TOPIC, payload);
        } catch (MessagingException e) {
            log.warn("推送调试事件 {} 失败: {}", event.type(), e.getMessage());
        }
    }

    /**
     * 向指定的WebSocket主题发送一个通用载荷(payload)。
     *
     * @param destination 目标WebSocket主题
     * @param payload 要发送的对象
     */
    public void sendMessage(String destination, Object payload) {
        messagingTemplate.convertAndSend(destination, payload);
    }
}
