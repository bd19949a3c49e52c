/**
 * DbgpSession.java
 *
 * 一个 DBGp 调试会话：监听调试引擎的连接，发出执行控制、断点和检查命令，并维护错误捕获队列。
 * 所有命令都返回 CompletableFuture；未连接时立即以 NOT_CONNECTED 失败，不会等待超时。
 * 引擎报告运行时错误时，会话会自动收集源代码上下文、调用栈和变量快照并放入错误队列。
 *
 * 命令响应在连接的读取线程上完成，链接在返回的 Future 上的回调不得阻塞等待其他命令。
 */
package club.ppmc.dbgp.service;

import club.ppmc.dbgp.config.DbgpSettings;
import club.ppmc.dbgp.exception.DbgpErrorType;
import club.ppmc.dbgp.exception.DbgpException;
import club.ppmc.dbgp.model.dbgp.Breakpoint;
import club.ppmc.dbgp.model.dbgp.ConnectionState;
import club.ppmc.dbgp.model.dbgp.DbgpInitInfo;
import club.ppmc.dbgp.model.dbgp.ErrorEvent;
import club.ppmc.dbgp.model.dbgp.SessionStatus;
import club.ppmc.dbgp.model.dbgp.SourceLine;
import club.ppmc.dbgp.model.dbgp.StackFrame;
import club.ppmc.dbgp.model.dbgp.Variable;
import club.ppmc.dbgp.model.debug.WsDebugEvent;
import club.ppmc.dbgp.protocol.DbgpCommand;
import club.ppmc.dbgp.protocol.DbgpResponse;
import club.ppmc.dbgp.protocol.DbgpResponseParser;
import club.ppmc.dbgp.protocol.FaultNotice;
import club.ppmc.dbgp.protocol.TransactionRouter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DbgpSession implements DbgpConnectionListener, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DbgpSession.class);

    /** context_get 的局部变量上下文。 */
    public static final int LOCAL_CONTEXT = 0;
    /** context_get 的全局变量上下文。 */
    public static final int GLOBAL_CONTEXT = 1;

    private final DbgpSettings settings;
    private final SourceContextService sourceContextService;
    private final Consumer<WsDebugEvent<?>> eventSink;
    private final DbgpConnectionManager connection;
    private final TransactionRouter router;
    private final ErrorQueue errorQueue;

    private volatile DbgpInitInfo initInfo;

    public DbgpSession(
            DbgpSettings settings, SourceContextService sourceContextService, Consumer<WsDebugEvent<?>> eventSink) {
        this.settings = settings;
        this.sourceContextService = sourceContextService;
        this.eventSink = eventSink;
        this.connection = new DbgpConnectionManager(this, settings.maxPortAttempts());
        this.router = new TransactionRouter(connection, settings.commandTimeoutMs());
        this.errorQueue = new ErrorQueue(settings.errorQueueSize());
    }

    // --- 连接管理 ---

    public int listen() {
        return listen(settings.port());
    }

    /**
     * 开始监听调试引擎的连接。
     *
     * @param port 首选端口，被占用时自动尝试后续端口。
     * @return 实际监听的端口。
     */
    public int listen(int port) {
        return connection.listen(port);
    }

    public boolean isConnected() {
        return connection.isConnected();
    }

    public int getPort() {
        int port = connection.getPort();
        return port > 0 ? port : settings.port();
    }

    public ConnectionState getState() {
        return connection.getState();
    }

    public DbgpInitInfo getInitInfo() {
        return initInfo;
    }

    public SessionStatus status() {
        return new SessionStatus(isConnected(), getState(), getPort(), errorQueue.size(), initInfo);
    }

    @Override
    public void close() {
        connection.close();
        router.failAll(new DbgpException(DbgpErrorType.TRANSPORT, "调试会话已关闭"));
    }

    // --- 执行控制 ---

    public CompletableFuture<String> run() {
        return sendForStatus("run");
    }

    public CompletableFuture<String> stepInto() {
        return sendForStatus("step_into");
    }

    public CompletableFuture<String> stepOver() {
        return sendForStatus("step_over");
    }

    public CompletableFuture<String> stepOut() {
        return sendForStatus("step_out");
    }

    public CompletableFuture<String> stop() {
        return sendForStatus("stop");
    }

    public CompletableFuture<String> getStatus() {
        return sendForStatus("status");
    }

    private CompletableFuture<String> sendForStatus(String verb) {
        return send(DbgpCommand.of(verb)).thenApply(response -> Objects.requireNonNullElse(response.status(), ""));
    }

    // --- 断点 ---

    /**
     * 设置行断点。文件路径以 file:// URI 发送，反斜杠统一为正斜杠；条件表达式以 base64 附加在命令末尾。
     *
     * @param file 源文件路径。
     * @param line 行号 (从1开始)。
     * @param condition (可选) 条件表达式。
     * @return 带有引擎分配ID的断点。
     */
    public CompletableFuture<Breakpoint> setBreakpoint(String file, int line, String condition) {
        DbgpCommand command = DbgpCommand.of(
                "breakpoint_set", "-t", "line", "-f", DbgpResponseParser.pathToFileUri(file), "-n", String.valueOf(line));
        boolean conditional = condition != null && !condition.isBlank();
        if (conditional) {
            command = command.withData(condition);
        }
        return send(command).thenApply(response -> new Breakpoint(
                Objects.requireNonNullElse(response.attribute("id"), ""),
                file,
                line,
                conditional ? condition : null,
                response.attribute("state")));
    }

    /**
     * 设置异常断点，使引擎在抛出错误时中断，从而触发自动错误捕获。
     *
     * @param exceptionName 异常名称，为空时使用 "*" 表示所有错误。
     */
    public CompletableFuture<Breakpoint> setExceptionBreakpoint(String exceptionName) {
        String name = exceptionName == null || exceptionName.isBlank() ? "*" : exceptionName;
        return send(DbgpCommand.of("breakpoint_set", "-t", "exception", "-x", name))
                .thenApply(response -> new Breakpoint(
                        Objects.requireNonNullElse(response.attribute("id"), ""),
                        null,
                        0,
                        null,
                        response.attribute("state")));
    }

    public CompletableFuture<Void> removeBreakpoint(String id) {
        return send(DbgpCommand.of("breakpoint_remove", "-d", id)).thenAccept(response -> {});
    }

    /** 从引擎重新获取断点表。 */
    public CompletableFuture<List<Breakpoint>> listBreakpoints() {
        return send(DbgpCommand.of("breakpoint_list"))
                .thenApply(response -> DbgpResponseParser.parseBreakpoints(response.raw()));
    }

    // --- 检查 ---

    /**
     * 获取变量。
     *
     * @param contextId 0 为局部变量，1 为全局变量。
     */
    public CompletableFuture<List<Variable>> getVariables(int contextId) {
        if (contextId < 0) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("无效的变量上下文: " + contextId));
        }
        return send(DbgpCommand.of("context_get", "-c", String.valueOf(contextId)))
                .thenApply(response -> DbgpResponseParser.parseProperties(response.raw()));
    }

    /**
     * 在当前断点上下文中求值。
     *
     * @return 第一个返回属性的解码值，没有返回属性时为空字符串。
     */
    public CompletableFuture<String> evaluateExpression(String expression) {
        return send(DbgpCommand.of("eval").withData(expression)).thenApply(response -> {
            List<Variable> properties = DbgpResponseParser.parseProperties(response.raw());
            return properties.isEmpty() ? "" : properties.get(0).value();
        });
    }

    /** 获取调用栈，最内层帧在前。 */
    public CompletableFuture<List<StackFrame>> getStackTrace() {
        return send(DbgpCommand.of("stack_get"))
                .thenApply(response -> DbgpResponseParser.parseStack(response.raw()));
    }

    private CompletableFuture<DbgpResponse> send(DbgpCommand command) {
        return router.send(command).thenApply(DbgpSession::checkEngineError);
    }

    private static DbgpResponse checkEngineError(DbgpResponse response) {
        Optional<DbgpResponseParser.EngineError> error = DbgpResponseParser.parseEngineError(response.raw());
        if (error.isPresent()) {
            throw DbgpException.engineError(error.get().code(), error.get().message());
        }
        return response;
    }

    // --- 错误捕获 ---

    /**
     * 生成一个带完整上下文的错误并放入错误队列。
     * 调用栈和变量的获取各自独立、尽力而为：引擎不处于中断状态时对应字段为空列表，捕获本身不会失败。
     *
     * @param file 出错文件。
     * @param line 出错行号。
     * @param errorType 错误类型。
     * @param message 错误消息。
     * @return 已入队的错误。
     */
    public CompletableFuture<ErrorEvent> captureErrorContext(String file, int line, String errorType, String message) {
        List<SourceLine> sourceContext = sourceContextService.getSourceContext(file, line);

        return orEmpty(getStackTrace(), "调用栈").thenCompose(stack ->
                orEmpty(getVariables(LOCAL_CONTEXT), "局部变量").thenCompose(locals ->
                        orEmpty(getVariables(GLOBAL_CONTEXT), "全局变量").thenApply(globals -> {
                            var event = new ErrorEvent(
                                    errorType,
                                    message,
                                    file,
                                    line,
                                    sourceContext,
                                    stack,
                                    locals,
                                    globals,
                                    System.currentTimeMillis());
                            errorQueue.enqueue(event);
                            LOGGER.info("已捕获错误 [{}] {} 于 {}:{}", errorType, message, file, line);
                            publish("ERROR_CAPTURED", event);
                            return event;
                        })));
    }

    public CompletableFuture<Optional<ErrorEvent>> waitForError() {
        return waitForError(settings.waitTimeoutMs());
    }

    /**
     * 等待下一个错误。队列中已有错误时立即返回最早的一个。
     *
     * @param timeoutMs 最长等待时间。
     * @return 超时时为 Optional.empty()。
     */
    public CompletableFuture<Optional<ErrorEvent>> waitForError(long timeoutMs) {
        return errorQueue.waitForError(timeoutMs);
    }

    /** 将已取出但未能交付的错误放回队首。 */
    public void requeueError(ErrorEvent event) {
        errorQueue.requeue(event);
    }

    public List<ErrorEvent> getQueuedErrors() {
        return errorQueue.snapshot();
    }

    public int clearErrorQueue() {
        return errorQueue.clear();
    }

    public List<SourceLine> getSourceContext(String file, int line, int radius) {
        return sourceContextService.getSourceContext(file, line, radius);
    }

    private <T> CompletableFuture<List<T>> orEmpty(CompletableFuture<List<T>> future, String what) {
        return future.exceptionally(ex -> {
            LOGGER.debug("捕获错误时无法获取{}: {}", what, rootMessage(ex));
            return List.of();
        });
    }

    // --- 连接事件 ---

    @Override
    public void onListening(int port) {
        publish("LISTENING", Map.of("port", port));
    }

    @Override
    public void onConnected(String remoteAddress) {
        initInfo = null;
        publish("CONNECTED", Map.of("remote", remoteAddress));
    }

    @Override
    public void onInit(String xml) {
        DbgpInitInfo info = DbgpResponseParser.parseInit(xml);
        initInfo = info;
        LOGGER.info("收到引擎握手: language={}, file={}", info.language(), info.file());
        publish("INIT", info);
    }

    @Override
    public void onMessage(String xml) {
        if (!router.dispatch(xml)) {
            LOGGER.debug("收到未关联命令的消息: {}", xml);
        }
        DbgpResponseParser.parseFault(xml).ifPresent(this::captureFault);
    }

    @Override
    public void onDisconnected() {
        router.failAll(new DbgpException(DbgpErrorType.TRANSPORT, "调试连接已断开"));
        publish("DISCONNECTED", null);
    }

    private void captureFault(FaultNotice fault) {
        LOGGER.warn("引擎报告错误 [{}] {} 于 {}:{}", fault.errorType(), fault.message(), fault.file(), fault.line());
        captureErrorContext(fault.file(), fault.line(), fault.errorType(), fault.message())
                .exceptionally(ex -> {
                    LOGGER.error("自动捕获错误上下文失败: {}", rootMessage(ex), ex);
                    return null;
                });
    }

    private void publish(String type, Object data) {
        try {
            eventSink.accept(new WsDebugEvent<>(type, data));
        } catch (RuntimeException e) {
            LOGGER.warn("发送调试事件 {} 失败: {}", type, e.getMessage());
        }
    }

    static String rootMessage(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return cause.getMessage();
    }
}
