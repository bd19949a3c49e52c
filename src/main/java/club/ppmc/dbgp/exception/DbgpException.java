/**
 * DbgpException.java
 *
 * DBGp 调试会话的统一运行时异常。
 * 所有命令 API 的失败都以该异常结束对应的 CompletableFuture，
 * 它携带错误类别和（可选的）引擎错误码，便于 Controller 层转换为结构化的 JSON 响应。
 */
package club.ppmc.dbgp.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

@Getter
public class DbgpException extends RuntimeException {

    /** 错误类别。 */
    private final DbgpErrorType type;

    /** 引擎返回的错误码，仅在 ENGINE_ERROR 时有值。 */
    private final String engineCode;

    public DbgpException(DbgpErrorType type, String message) {
        this(type, message, null, null);
    }

    public DbgpException(DbgpErrorType type, String message, Throwable cause) {
        this(type, message, null, cause);
    }

    private DbgpException(DbgpErrorType type, String message, String engineCode, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.engineCode = engineCode;
    }

    public static DbgpException notConnected() {
        return new DbgpException(DbgpErrorType.NOT_CONNECTED, "未连接到调试引擎 (Not connected to debugger engine)");
    }

    public static DbgpException timeout(int transactionId, String command, long timeoutMs) {
        return new DbgpException(
                DbgpErrorType.TIMEOUT,
                String.format("命令超时: '%s' (transaction_id=%d) 在 %d ms 内未收到响应", command, transactionId, timeoutMs));
    }

    public static DbgpException engineError(String code, String message) {
        return new DbgpException(
                DbgpErrorType.ENGINE_ERROR, "调试引擎返回错误 (code " + code + "): " + message, code, null);
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含结构化错误信息的Map。
     */
    public Map<String, Object> toErrorData() {
        var data = new LinkedHashMap<String, Object>();
        data.put("type", type.name());
        data.put("message", getMessage());
        if (engineCode != null) {
            data.put("engineCode", engineCode);
        }
        return data;
    }
}
