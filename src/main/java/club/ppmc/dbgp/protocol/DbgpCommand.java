/**
 * DbgpCommand.java
 *
 * 发往调试引擎的一条 DBGp 命令。
 * 线上格式为 "&lt;命令&gt; &lt;参数...&gt; -i &lt;事务ID&gt; [-- base64数据]"，以单个 NUL 字节结尾，不带长度前缀。
 * 数据段（条件表达式、求值表达式）必须位于命令行末尾，因此总是放在 -i 之后。
 */
package club.ppmc.dbgp.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

public record DbgpCommand(String verb, List<String> args, String data) {

    public DbgpCommand {
        args = List.copyOf(args);
    }

    public static DbgpCommand of(String verb, String... args) {
        return new DbgpCommand(verb, List.of(args), null);
    }

    /**
     * 附加数据段。数据会按协议约定进行 base64 编码。
     *
     * @param rawData 原始文本，例如条件表达式。
     * @return 带数据段的新命令。
     */
    public DbgpCommand withData(String rawData) {
        String encoded = Base64.getEncoder().encodeToString(rawData.getBytes(StandardCharsets.UTF_8));
        return new DbgpCommand(verb, args, encoded);
    }

    public String toCommandLine(int transactionId) {
        var sb = new StringBuilder(verb);
        for (String arg : args) {
            sb.append(' ').append(arg);
        }
        sb.append(" -i ").append(transactionId);
        if (data != null) {
            sb.append(" -- ").append(data);
        }
        return sb.toString();
    }

    public byte[] encode(int transactionId) {
        return (toCommandLine(transactionId) + '\0').getBytes(StandardCharsets.UTF_8);
    }

    /** 用于日志的简短描述，不包含数据段。 */
    public String describe() {
        return args.isEmpty() ? verb : verb + " " + String.join(" ", args);
    }
}
