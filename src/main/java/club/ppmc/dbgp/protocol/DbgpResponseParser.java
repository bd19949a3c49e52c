/**
 * DbgpResponseParser.java
 *
 * 将引擎返回的 XML 文本转换为类型化的记录。
 * DBGp 的属性语法受限（双引号、无嵌套），因此这里使用针对性的正则提取，而不是完整的 XML 解析器。
 * 所有解析方法在输入为空或没有匹配时都返回空集合，不会抛出异常。
 */
package club.ppmc.dbgp.protocol;

import club.ppmc.dbgp.model.dbgp.Breakpoint;
import club.ppmc.dbgp.model.dbgp.DbgpInitInfo;
import club.ppmc.dbgp.model.dbgp.StackFrame;
import club.ppmc.dbgp.model.dbgp.Variable;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.web.util.UriUtils;

public final class DbgpResponseParser {

    private static final Pattern ATTRIBUTE = Pattern.compile("([\\w:-]+)=\"([^\"]*)\"");
    private static final Pattern RESPONSE_TAG = Pattern.compile("<response\\b([^>]*)>");
    private static final Pattern TRANSACTION_ID =
            Pattern.compile("<response\\b[^>]*?\\stransaction_id=\"(\\d+)\"");
    private static final Pattern INIT_TAG = Pattern.compile("<init\\b([^>]*)>");
    private static final Pattern PROPERTY = Pattern.compile(
            "<property\\b([^>]*?)(?:/>|>((?:<!\\[CDATA\\[.*?\\]\\]>|[^<])*)</property>)", Pattern.DOTALL);
    private static final Pattern STACK = Pattern.compile("<stack\\b([^>]*?)/?>");
    private static final Pattern BREAKPOINT =
            Pattern.compile("<breakpoint\\b([^>]*?)(?:/>|>(.*?)</breakpoint>)", Pattern.DOTALL);
    private static final Pattern EXPRESSION =
            Pattern.compile("<expression\\b[^>]*>(.*?)</expression>", Pattern.DOTALL);
    private static final Pattern ERROR =
            Pattern.compile("<error\\b([^>]*?)(?:/>|>(.*?)</error>)", Pattern.DOTALL);
    private static final Pattern MESSAGE = Pattern.compile("<message\\b[^>]*>(.*?)</message>", Pattern.DOTALL);
    private static final Pattern FAULT_MESSAGE =
            Pattern.compile("<xdebug:message\\b([^>]*?)(?:/>|>(.*?)</xdebug:message>)", Pattern.DOTALL);
    private static final Pattern CDATA = Pattern.compile("<!\\[CDATA\\[(.*?)\\]\\]>", Pattern.DOTALL);
    private static final Pattern WINDOWS_DRIVE_URI_PATH = Pattern.compile("^/[A-Za-z]:.*");

    private static final String FILE_SCHEME = "file://";

    private DbgpResponseParser() {}

    /**
     * 提取顶层 response 标签上的全部属性。
     *
     * @param xml 原始响应。
     * @return 属性表和原始 XML；找不到 response 标签时属性表为空。
     */
    public static DbgpResponse parseResponse(String xml) {
        String source = xml == null ? "" : xml;
        Matcher m = RESPONSE_TAG.matcher(source);
        Map<String, String> attributes = m.find() ? parseAttributes(m.group(1)) : Map.of();
        return new DbgpResponse(attributes, source);
    }

    /** 从响应中取出事务ID，非 response 消息（例如 notify、stream）没有事务ID。 */
    public static OptionalInt transactionId(String xml) {
        if (xml == null) {
            return OptionalInt.empty();
        }
        Matcher m = TRANSACTION_ID.matcher(xml);
        if (!m.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * 提取所有 property 元素。文本内容按 base64 解码，解码失败时保留原文。
     */
    public static List<Variable> parseProperties(String xml) {
        List<Variable> variables = new ArrayList<>();
        if (xml == null) {
            return variables;
        }
        Matcher m = PROPERTY.matcher(xml);
        while (m.find()) {
            Map<String, String> attrs = parseAttributes(m.group(1));
            String text = stripCdata(m.group(2) == null ? "" : m.group(2));
            String value;
            if (text.isEmpty()) {
                value = "";
            } else if ("none".equals(attrs.get("encoding"))) {
                value = text;
            } else {
                value = decodeBase64OrRaw(text);
            }
            variables.add(new Variable(attrs.get("name"), attrs.get("fullname"), attrs.get("type"), value));
        }
        return variables;
    }

    /**
     * 提取所有 stack 元素。level 与 lineno 转换为整数，其余字段保持字符串。
     */
    public static List<StackFrame> parseStack(String xml) {
        List<StackFrame> frames = new ArrayList<>();
        if (xml == null) {
            return frames;
        }
        Matcher m = STACK.matcher(xml);
        while (m.find()) {
            Map<String, String> attrs = parseAttributes(m.group(1));
            frames.add(new StackFrame(
                    parseIntOrZero(attrs.get("level")),
                    attrs.get("type"),
                    attrs.get("filename"),
                    parseIntOrZero(attrs.get("lineno")),
                    attrs.get("where")));
        }
        return frames;
    }

    /**
     * 提取 breakpoint_list 响应中的断点。缺少 id 或 filename 的条目会被跳过。
     */
    public static List<Breakpoint> parseBreakpoints(String xml) {
        List<Breakpoint> breakpoints = new ArrayList<>();
        if (xml == null) {
            return breakpoints;
        }
        Matcher m = BREAKPOINT.matcher(xml);
        while (m.find()) {
            Map<String, String> attrs = parseAttributes(m.group(1));
            String id = attrs.get("id");
            String filename = attrs.get("filename");
            if (id == null || id.isEmpty() || filename == null || filename.isEmpty()) {
                continue;
            }
            String condition = null;
            if (m.group(2) != null) {
                Matcher expr = EXPRESSION.matcher(m.group(2));
                if (expr.find()) {
                    condition = decodeBase64OrRaw(stripCdata(expr.group(1).trim()));
                }
            }
            breakpoints.add(new Breakpoint(
                    id, fileUriToPath(filename), parseIntOrZero(attrs.get("lineno")), condition, attrs.get("state")));
        }
        return breakpoints;
    }

    /**
     * 提取响应中的 error 元素。
     *
     * @return 错误码和消息；响应正常时为空。
     */
    public static Optional<EngineError> parseEngineError(String xml) {
        if (xml == null) {
            return Optional.empty();
        }
        Matcher m = ERROR.matcher(xml);
        if (!m.find()) {
            return Optional.empty();
        }
        String code = parseAttributes(m.group(1)).getOrDefault("code", "");
        String message = "";
        if (m.group(2) != null) {
            Matcher msg = MESSAGE.matcher(m.group(2));
            if (msg.find()) {
                message = stripCdata(msg.group(1)).trim();
            }
        }
        return Optional.of(new EngineError(code, message));
    }

    /**
     * 识别引擎报告的运行时错误。
     * 错误可能出现在 status="break" 的继续执行响应中，也可能出现在异步的 notify 消息中。
     */
    public static Optional<FaultNotice> parseFault(String xml) {
        if (xml == null) {
            return Optional.empty();
        }
        Matcher m = FAULT_MESSAGE.matcher(xml);
        if (!m.find()) {
            return Optional.empty();
        }
        Map<String, String> attrs = parseAttributes(m.group(1));
        String filename = attrs.get("filename");
        if (filename == null || filename.isEmpty()) {
            return Optional.empty();
        }
        String text = m.group(2) == null ? "" : stripCdata(m.group(2)).trim();
        if ("base64".equals(attrs.get("encoding"))) {
            text = decodeBase64OrRaw(text);
        }
        String type = attrs.getOrDefault("exception", "Error");
        return Optional.of(new FaultNotice(fileUriToPath(filename), parseIntOrZero(attrs.get("lineno")), type, text));
    }

    public static DbgpInitInfo parseInit(String xml) {
        Matcher m = INIT_TAG.matcher(xml == null ? "" : xml);
        Map<String, String> attrs = m.find() ? parseAttributes(m.group(1)) : Map.of();
        String fileUri = attrs.get("fileuri");
        return new DbgpInitInfo(
                fileUri == null ? null : fileUriToPath(fileUri),
                attrs.get("language"),
                attrs.get("protocol_version"),
                attrs.get("appid"),
                attrs.get("idekey"),
                attrs.get("thread"));
    }

    /**
     * 将本地路径转换为 DBGp 使用的 file URI，反斜杠统一为正斜杠，空格、% 等字符按 URI 路径规则进行百分号编码，
     * 保证 URI 在命令行中是单个参数。
     * "C:\My Scripts\a.ahk" 转换为 "file:///C:/My%20Scripts/a.ahk"，"/home/a.ahk" 转换为 "file:///home/a.ahk"。
     */
    public static String pathToFileUri(String path) {
        String normalized = path.replace('\\', '/');
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        return FILE_SCHEME + UriUtils.encodePath(normalized, StandardCharsets.UTF_8);
    }

    /** pathToFileUri 的逆操作。没有 file:// 前缀的值原样返回。 */
    public static String fileUriToPath(String uri) {
        if (!uri.startsWith(FILE_SCHEME)) {
            return uri;
        }
        String path = uri.substring(FILE_SCHEME.length());
        if (path.indexOf('%') >= 0) {
            path = percentDecodeOrRaw(path);
        }
        if (WINDOWS_DRIVE_URI_PATH.matcher(path).matches()) {
            path = path.substring(1);
        }
        return path;
    }

    /**
     * 按 base64 解码文本；若不是合法的 base64 或解码结果不是合法的 UTF-8，则原样返回。
     */
    public static String decodeBase64OrRaw(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty() || !looksLikeBase64(trimmed)) {
            return text;
        }
        try {
            byte[] bytes = Base64.getMimeDecoder().decode(trimmed);
            return StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (IllegalArgumentException | CharacterCodingException e) {
            return text;
        }
    }

    // 非法的百分号序列保留原文
    private static String percentDecodeOrRaw(String path) {
        try {
            return UriUtils.decode(path, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return path;
        }
    }

    static Map<String, String> parseAttributes(String attrs) {
        Map<String, String> result = new LinkedHashMap<>();
        if (attrs == null) {
            return result;
        }
        Matcher m = ATTRIBUTE.matcher(attrs);
        while (m.find()) {
            result.put(m.group(1), unescape(m.group(2)));
        }
        return result;
    }

    // MIME 解码器会静默跳过非法字符，这里要求整段文本都由 base64 字符组成
    private static boolean looksLikeBase64(String text) {
        int significant = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' || c == '\n') {
                continue;
            }
            boolean valid = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '+' || c == '/' || c == '=';
            if (!valid) {
                return false;
            }
            significant++;
        }
        return significant % 4 == 0;
    }

    private static String stripCdata(String text) {
        Matcher m = CDATA.matcher(text);
        if (!m.find()) {
            return text;
        }
        var sb = new StringBuilder();
        do {
            sb.append(m.group(1));
        } while (m.find());
        return sb.toString();
    }

    private static String unescape(String value) {
        if (value.indexOf('&') < 0) {
            return value;
        }
        return value.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }

    private static int parseIntOrZero(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /** 响应中 error 元素的内容。 */
    public record EngineError(String code, String message) {}
}
