/**
 * DbgpFrame.java
 *
 * 从引擎字节流中切分出的一个完整消息帧。
 */
package club.ppmc.dbgp.protocol;

/**
 * @param kind 帧类型。
 * @param payload 帧内容 (XML 文本)。
 */
public record DbgpFrame(Kind kind, String payload) {

    public enum Kind {
        /** 引擎连接后发送的握手包。 */
        INIT,
        /** 命令响应或异步通知。 */
        MESSAGE
    }
}
