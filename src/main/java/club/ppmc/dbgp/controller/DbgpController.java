/**
 * DbgpController.java
 *
 * 该控制器负责处理所有与 DBGp 调试功能相关的HTTP请求。
 * 它是上层工具与 DbgpSession 之间的桥梁：启动/停止监听、执行控制、断点、变量检查、错误捕获与修复。
 * 需要等待引擎响应的端点返回 CompletableFuture（等待错误的端点返回 DeferredResult），由 Spring MVC 异步完成请求。
 * 所有失败都转换为带有 type 和 message 字段的 JSON 响应体。
 */
package club.ppmc.dbgp.controller;

import club.ppmc.dbgp.config.DbgpSettings;
import club.ppmc.dbgp.exception.DbgpException;
import club.ppmc.dbgp.exception.FixMismatchException;
import club.ppmc.dbgp.model.dbgp.ErrorEvent;
import club.ppmc.dbgp.model.debug.BreakpointRequest;
import club.ppmc.dbgp.model.debug.CaptureRequest;
import club.ppmc.dbgp.model.debug.EvaluateRequest;
import club.ppmc.dbgp.model.debug.ExceptionBreakpointRequest;
import club.ppmc.dbgp.model.debug.FixRequest;
import club.ppmc.dbgp.service.DbgpSession;
import club.ppmc.dbgp.service.DbgpSessionService;
import club.ppmc.dbgp.service.ErrorAnalysisService;
import club.ppmc.dbgp.service.SourceFixService;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

@RestController
@RequestMapping("/api/dbgp")
public class DbgpController {

    private static final Logger LOGGER = LoggerFactory.getLogger(DbgpController.class);

    /** /errors/next 的异步请求超时比等待时间多出的余量。 */
    static final long ASYNC_GRACE_MS = 5_000;

    private final DbgpSessionService sessionService;
    private final SourceFixService sourceFixService;
    private final ErrorAnalysisService errorAnalysisService;
    private final DbgpSettings settings;

    public DbgpController(
            DbgpSessionService sessionService,
            SourceFixService sourceFixService,
            ErrorAnalysisService errorAnalysisService,
            DbgpSettings settings) {
        this.sessionService = sessionService;
        this.sourceFixService = sourceFixService;
        this.errorAnalysisService = errorAnalysisService;
        this.settings = settings;
    }

    /**
     * 启动 DBGp 监听，等待以调试模式运行的脚本连接。
     *
     * @param port (可选) 首选端口，被占用时自动尝试后续端口。
     */
    @PostMapping("/start")
    public ResponseEntity<Object> start(@RequestParam(required = false) Integer port) {
        DbgpSession session = sessionService.getSession();
        if (session.isConnected()) {
            return ResponseEntity.ok(Map.of("message", "已连接到调试引擎。", "port", session.getPort()));
        }
        try {
            int actualPort = sessionService.start(port).getPort();
            return ResponseEntity.ok(Map.of(
                    "message",
                    String.format(
                            "DBGp 监听已启动，端口 %d。请以调试模式运行脚本，例如: AutoHotkey64.exe /Debug=127.0.0.1:%d your_script.ahk",
                            actualPort, actualPort),
                    "port", actualPort));
        } catch (DbgpException e) {
            return errorResponse(e);
        }
    }

    /**
     * 停止监听并丢弃当前会话（包括错误队列）。
     */
    @PostMapping("/stop")
    public ResponseEntity<Map<String, String>> stop() {
        sessionService.reset();
        return ResponseEntity.ok(Map.of("message", "DBGp 监听已停止。"));
    }

    @GetMapping("/status")
    public ResponseEntity<Object> status() {
        return ResponseEntity.ok(sessionService.getSession().status());
    }

    // --- 执行控制 ---

    @PostMapping("/run")
    public CompletableFuture<ResponseEntity<Object>> run() {
        return respond(session().run(), status -> Map.of("status", status));
    }

    @PostMapping("/step-into")
    public CompletableFuture<ResponseEntity<Object>> stepInto() {
        return respond(session().stepInto(), status -> Map.of("status", status));
    }

    @PostMapping("/step-over")
    public CompletableFuture<ResponseEntity<Object>> stepOver() {
        return respond(session().stepOver(), status -> Map.of("status", status));
    }

    @PostMapping("/step-out")
    public CompletableFuture<ResponseEntity<Object>> stepOut() {
        return respond(session().stepOut(), status -> Map.of("status", status));
    }

    /**
     * 让引擎终止被调试的脚本 (DBGp stop 命令)，监听保持不变。
     */
    @PostMapping("/halt")
    public CompletableFuture<ResponseEntity<Object>> halt() {
        return respond(session().stop(), status -> Map.of("status", status));
    }

    // --- 错误捕获 ---

    /**
     * 等待下一个错误。超时不是失败：返回 captured=false。
     * 请求的异步超时总是比等待时间长 ASYNC_GRACE_MS；请求提前结束（超时、客户端断开）时取消等待，
     * 之后捕获的错误仍然进入队列。已取到但无法写回的错误会被放回队首。
     *
     * @param timeout (可选) 等待毫秒数，默认取配置值。
     */
    @GetMapping("/errors/next")
    public DeferredResult<ResponseEntity<Object>> nextError(@RequestParam(required = false) Long timeout) {
        long timeoutMs = timeout != null ? timeout : settings.waitTimeoutMs();
        DbgpSession session = session();
        CompletableFuture<Optional<ErrorEvent>> waiter = session.waitForError(timeoutMs);

        var result = new DeferredResult<ResponseEntity<Object>>(timeoutMs + ASYNC_GRACE_MS);
        result.onTimeout(() -> {
            waiter.cancel(false);
            result.setResult(ResponseEntity.ok(noErrorBody()));
        });
        result.onCompletion(() -> waiter.cancel(false));

        waiter.whenComplete((error, ex) -> {
            if (ex != null) {
                if (!waiter.isCancelled()) {
                    result.setResult(errorResponse(ex));
                }
                return;
            }
            Object body = error.<Object>map(e -> Map.of("captured", true, "error", e))
                    .orElseGet(DbgpController::noErrorBody);
            if (!result.setResult(ResponseEntity.ok(body)) && error.isPresent()) {
                LOGGER.warn("等待错误的请求已结束，错误放回队列: {}:{}", error.get().file(), error.get().line());
                session.requeueError(error.get());
            }
        });
        return result;
    }

    private static Map<String, Object> noErrorBody() {
        return Map.of("captured", false, "reason", "timeout");
    }

    /**
     * 按调用方给出的位置立即捕获当前状态。
     */
    @PostMapping("/errors/capture")
    public CompletableFuture<ResponseEntity<Object>> capture(@Valid @RequestBody CaptureRequest request) {
        String type = request.errorType() == null || request.errorType().isBlank() ? "Error" : request.errorType();
        String message = request.message() == null ? "" : request.message();
        return respond(
                session().captureErrorContext(request.file(), request.line(), type, message), event -> event);
    }

    @PostMapping("/errors/analyze")
    public ResponseEntity<Object> analyze(@RequestBody ErrorEvent error) {
        if (error == null || error.file() == null) {
            return ResponseEntity.badRequest().body(Map.of("message", "未提供要分析的错误。"));
        }
        return ResponseEntity.ok(Map.of("prompt", errorAnalysisService.buildAnalysisPrompt(error)));
    }

    /**
     * 列出队列中尚未被取走的错误。直接交给等待中的 /errors/next 请求的错误已被消费，不会出现在这里。
     */
    @GetMapping("/errors")
    public ResponseEntity<Object> listErrors() {
        List<ErrorEvent> errors = sessionService.getSession().getQueuedErrors();
        List<Map<String, Object>> summaries = errors.stream().map(DbgpController::summarize).toList();
        return ResponseEntity.ok(Map.of("count", errors.size(), "errors", summaries));
    }

    @DeleteMapping("/errors")
    public ResponseEntity<Object> clearErrors() {
        int cleared = sessionService.getSession().clearErrorQueue();
        return ResponseEntity.ok(Map.of("message", "已从队列中清除 " + cleared + " 个错误。", "cleared", cleared));
    }

    @GetMapping("/source")
    public ResponseEntity<Object> source(
            @RequestParam String file, @RequestParam int line, @RequestParam(required = false) Integer radius) {
        int r = radius != null ? radius : settings.sourceContextRadius();
        return ResponseEntity.ok(Map.of(
                "file", file, "line", line, "context", sessionService.getSession().getSourceContext(file, line, r)));
    }

    /**
     * 应用单行修复。目标行的当前内容必须与 original 一致，否则文件保持不变并返回预期与实际内容。
     */
    @PostMapping("/fix")
    public ResponseEntity<Object> applyFix(@Valid @RequestBody FixRequest request) {
        try {
            return ResponseEntity.ok(sourceFixService.applyFix(
                    request.file(), request.line(), request.original(), request.replacement()));
        } catch (FixMismatchException e) {
            return ResponseEntity.badRequest().body(e.toErrorData());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        } catch (IOException e) {
            LOGGER.error("应用修复失败: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("message", "应用修复失败: " + e.getMessage()));
        }
    }

    // --- 断点 ---

    @PostMapping("/breakpoints")
    public CompletableFuture<ResponseEntity<Object>> setBreakpoint(@Valid @RequestBody BreakpointRequest request) {
        return respond(
                session().setBreakpoint(request.file(), request.line(), request.condition()), breakpoint -> breakpoint);
    }

    @PostMapping("/breakpoints/exception")
    public CompletableFuture<ResponseEntity<Object>> setExceptionBreakpoint(
            @RequestBody(required = false) ExceptionBreakpointRequest request) {
        String exception = request != null ? request.exception() : null;
        return respond(session().setExceptionBreakpoint(exception), breakpoint -> breakpoint);
    }

    @DeleteMapping("/breakpoints/{id}")
    public CompletableFuture<ResponseEntity<Object>> removeBreakpoint(@PathVariable String id) {
        return respond(session().removeBreakpoint(id), ignored -> Map.of("message", "断点 " + id + " 已移除。"));
    }

    @GetMapping("/breakpoints")
    public CompletableFuture<ResponseEntity<Object>> listBreakpoints() {
        return respond(
                session().listBreakpoints(),
                breakpoints -> Map.of("count", breakpoints.size(), "breakpoints", breakpoints));
    }

    // --- 检查 ---

    /**
     * @param context 0 为局部变量，1 为全局变量。
     */
    @GetMapping("/variables")
    public CompletableFuture<ResponseEntity<Object>> variables(@RequestParam(defaultValue = "0") int context) {
        return respond(session().getVariables(context), variables -> Map.of(
                "context", context == DbgpSession.LOCAL_CONTEXT ? "local" : "global",
                "count", variables.size(),
                "variables", variables));
    }

    @PostMapping("/evaluate")
    public CompletableFuture<ResponseEntity<Object>> evaluate(@Valid @RequestBody EvaluateRequest request) {
        return respond(
                session().evaluateExpression(request.expression()),
                result -> Map.of("expression", request.expression(), "result", result));
    }

    @GetMapping("/stack")
    public CompletableFuture<ResponseEntity<Object>> stack() {
        return respond(session().getStackTrace(), frames -> Map.of("count", frames.size(), "frames", frames));
    }

    private DbgpSession session() {
        return sessionService.getSession();
    }

    private static <T> CompletableFuture<ResponseEntity<Object>> respond(
            CompletableFuture<T> future, Function<T, Object> body) {
        return future.handle((result, ex) -> ex == null ? ResponseEntity.ok(body.apply(result)) : errorResponse(ex));
    }

    static ResponseEntity<Object> errorResponse(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof DbgpException dbgp) {
            HttpStatus status = switch (dbgp.getType()) {
                case NOT_CONNECTED -> HttpStatus.CONFLICT;
                case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
                case ENGINE_ERROR -> HttpStatus.BAD_GATEWAY;
                case TRANSPORT, NO_AVAILABLE_PORT -> HttpStatus.INTERNAL_SERVER_ERROR;
            };
            return ResponseEntity.status(status).body(dbgp.toErrorData());
        }
        if (cause instanceof IllegalArgumentException) {
            return ResponseEntity.badRequest().body(Map.of("message", cause.getMessage()));
        }
        LOGGER.error("调试命令执行失败: {}", cause.getMessage(), cause);
        return ResponseEntity.internalServerError()
                .body(Map.of("message", "调试命令执行失败: " + cause.getMessage()));
    }

    private static Map<String, Object> summarize(ErrorEvent error) {
        var summary = new LinkedHashMap<String, Object>();
        summary.put("errorType", error.errorType());
        summary.put("message", error.message());
        summary.put("file", error.file());
        summary.put("line", error.line());
        summary.put("timestamp", error.timestamp());
        return summary;
    }
}
