/**
 * DbgpInitInfo.java
 *
 * 调试引擎连接后发送的 init 包中的握手信息。
 */
package club.ppmc.dbgp.model.dbgp;

/**
 * @param file 被调试的主脚本路径 (由 fileuri 转换而来)。
 * @param language 引擎报告的语言，例如 "AutoHotkey"。
 * @param protocolVersion DBGp 协议版本。
 * @param appId 引擎进程标识。
 * @param ideKey IDE 密钥。
 * @param thread 线程标识。
 */
public record DbgpInitInfo(
        String file, String language, String protocolVersion, String appId, String ideKey, String thread) {}
