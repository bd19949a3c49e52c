/**
 * DbgpResponse.java
 *
 * 解析后的通用响应：顶层 response 标签的全部属性，以及原始 XML（供子元素解析器使用）。
 */
package club.ppmc.dbgp.protocol;

import java.util.Map;

public record DbgpResponse(Map<String, String> attributes, String raw) {

    public DbgpResponse {
        attributes = Map.copyOf(attributes);
    }

    public String attribute(String name) {
        return attributes.get(name);
    }

    public String command() {
        return attributes.getOrDefault("command", "");
    }

    public String transactionId() {
        return attributes.getOrDefault("transaction_id", "");
    }

    public String status() {
        return attributes.get("status");
    }

    public String reason() {
        return attributes.get("reason");
    }
}
