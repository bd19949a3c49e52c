/**
 * TransactionRouter.java
 *
 * 为发出的命令分配事务ID，并将异步到达的响应关联回发起命令的调用方。
 * 每个事务ID只对应一个等待中的请求，且只会被完成一次：收到匹配的响应、超时或连接断开，先发生者生效。
 * 事务ID从1开始单调递增，会话内永不复用。响应按事务ID匹配而不是按到达顺序，因此支持多个调用方并发发出命令。
 */
package club.ppmc.dbgp.protocol;

import club.ppmc.dbgp.exception.DbgpErrorType;
import club.ppmc.dbgp.exception.DbgpException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TransactionRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransactionRouter.class);

    private final DbgpTransport transport;
    private final long timeoutMs;
    private final AtomicInteger nextTransactionId = new AtomicInteger(1);
    private final Map<Integer, PendingRequest> pending = new ConcurrentHashMap<>();

    public TransactionRouter(DbgpTransport transport, long timeoutMs) {
        this.transport = transport;
        this.timeoutMs = timeoutMs;
    }

    /**
     * 发送一条命令并返回在收到匹配响应时完成的 Future。
     * 未连接时立即以 NOT_CONNECTED 失败，不排队。
     *
     * @param command 要发送的命令。
     * @return 解析后的响应；超时以 TIMEOUT 失败，写出失败或连接断开以 TRANSPORT 失败。
     */
    public CompletableFuture<DbgpResponse> send(DbgpCommand command) {
        if (!transport.isOpen()) {
            return CompletableFuture.failedFuture(DbgpException.notConnected());
        }

        int transactionId = nextTransactionId.getAndIncrement();
        var future = new CompletableFuture<DbgpResponse>();
        var request = new PendingRequest(
                transactionId, command.describe(), future, System.currentTimeMillis() + timeoutMs);
        // 先登记再写出，避免响应先于登记到达
        pending.put(transactionId, request);

        CompletableFuture.delayedExecutor(timeoutMs, TimeUnit.MILLISECONDS).execute(() -> expire(request));

        try {
            transport.write(command.encode(transactionId));
            LOGGER.debug("-> [{}] {}", transactionId, command.describe());
        } catch (IOException e) {
            pending.remove(transactionId, request);
            future.completeExceptionally(
                    new DbgpException(DbgpErrorType.TRANSPORT, "写出命令失败: " + e.getMessage(), e));
        }
        return future;
    }

    /**
     * 将一条消息交给等待中的请求。
     *
     * @param xml 引擎发来的消息。
     * @return 消息是否匹配到了等待中的请求；未匹配的消息（异步通知、已超时请求的迟到响应）返回 false。
     */
    public boolean dispatch(String xml) {
        OptionalInt transactionId = DbgpResponseParser.transactionId(xml);
        if (transactionId.isEmpty()) {
            return false;
        }
        PendingRequest request = pending.remove(transactionId.getAsInt());
        if (request == null) {
            LOGGER.debug("收到无人等待的响应 (transaction_id={})，可能已超时。", transactionId.getAsInt());
            return false;
        }
        LOGGER.debug("<- [{}] {}", request.transactionId(), request.command());
        request.future().complete(DbgpResponseParser.parseResponse(xml));
        return true;
    }

    /**
     * 以给定原因结束所有等待中的请求，用于连接断开时立即通知调用方。
     *
     * @return 被结束的请求数。
     */
    public int failAll(DbgpException cause) {
        List<Integer> ids = List.copyOf(pending.keySet());
        int failed = 0;
        for (Integer id : ids) {
            PendingRequest request = pending.remove(id);
            if (request != null && request.future().completeExceptionally(cause)) {
                failed++;
            }
        }
        if (failed > 0) {
            LOGGER.warn("连接断开，已拒绝 {} 个等待中的命令。", failed);
        }
        return failed;
    }

    public int pendingCount() {
        return pending.size();
    }

    private void expire(PendingRequest request) {
        if (pending.remove(request.transactionId(), request)) {
            LOGGER.warn("命令 '{}' (transaction_id={}) 超时。", request.command(), request.transactionId());
            request.future()
                    .completeExceptionally(DbgpException.timeout(request.transactionId(), request.command(), timeoutMs));
        }
    }

    /**
     * 一个等待响应的命令。
     *
     * @param transactionId 发送时分配的事务ID。
     * @param command 命令描述，用于日志和错误消息。
     * @param future 收到响应时完成的句柄。
     * @param deadline 超时时刻 (epoch 毫秒)。
     */
    record PendingRequest(
            int transactionId, String command, CompletableFuture<DbgpResponse> future, long deadline) {}
}
