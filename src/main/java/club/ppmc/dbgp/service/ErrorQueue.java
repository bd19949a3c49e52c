/**
 * ErrorQueue.java
 *
 * 捕获到的错误的有界 FIFO 队列，以及“等待下一个错误”的等待者列表。
 * 队列满时静默丢弃最旧的条目；有等待者时新错误直接交给最早的等待者，不再入队。
 * 队列和等待者列表由同一个监视器保护，可以被读取线程和请求线程并发访问。
 */
package club.ppmc.dbgp.service;

import club.ppmc.dbgp.model.dbgp.ErrorEvent;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public class ErrorQueue {

    private final int maxSize;
    private final Deque<ErrorEvent> queue = new ArrayDeque<>();
    private final Deque<CompletableFuture<Optional<ErrorEvent>>> waiters = new ArrayDeque<>();

    public ErrorQueue(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("错误队列长度必须大于0: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    /**
     * 放入一个错误。若有等待者则直接交付给最早的等待者。
     */
    public void enqueue(ErrorEvent event) {
        while (true) {
            CompletableFuture<Optional<ErrorEvent>> waiter;
            synchronized (this) {
                waiter = waiters.pollFirst();
                if (waiter == null) {
                    queue.addLast(event);
                    while (queue.size() > maxSize) {
                        queue.removeFirst();
                    }
                    return;
                }
            }
            // 等待者可能恰好已超时，此时交给下一个
            if (waiter.complete(Optional.of(event))) {
                return;
            }
        }
    }

    /**
     * 将已取出但未能交付给调用方的错误放回。有等待者时交给最早的等待者，否则放在队首，
     * 下一次 waitForError 会最先取到它。
     */
    public void requeue(ErrorEvent event) {
        while (true) {
            CompletableFuture<Optional<ErrorEvent>> waiter;
            synchronized (this) {
                waiter = waiters.pollFirst();
                if (waiter == null) {
                    queue.addFirst(event);
                    while (queue.size() > maxSize) {
                        queue.removeLast();
                    }
                    return;
                }
            }
            if (waiter.complete(Optional.of(event))) {
                return;
            }
        }
    }

    /**
     * 取出下一个错误。队列非空时立即返回最旧的条目，否则等待新错误或超时。
     *
     * @param timeoutMs 最长等待时间。
     * @return 超时时以 Optional.empty() 完成，不会以异常结束。调用方不再等待时应取消该 Future，
     *     取消后的等待者不会再收到错误。
     */
    public CompletableFuture<Optional<ErrorEvent>> waitForError(long timeoutMs) {
        var waiter = new CompletableFuture<Optional<ErrorEvent>>();
        synchronized (this) {
            ErrorEvent head = queue.pollFirst();
            if (head != null) {
                return CompletableFuture.completedFuture(Optional.of(head));
            }
            waiters.addLast(waiter);
        }
        waiter.completeOnTimeout(Optional.empty(), timeoutMs, TimeUnit.MILLISECONDS);
        waiter.whenComplete((result, ex) -> removeWaiter(waiter));
        return waiter;
    }

    public synchronized List<ErrorEvent> snapshot() {
        return List.copyOf(queue);
    }

    /**
     * 清空队列。
     *
     * @return 被清除的条目数。
     */
    public synchronized int clear() {
        int count = queue.size();
        queue.clear();
        return count;
    }

    public synchronized int size() {
        return queue.size();
    }

    synchronized int waiterCount() {
        return waiters.size();
    }

    private synchronized void removeWaiter(CompletableFuture<Optional<ErrorEvent>> waiter) {
        waiters.remove(waiter);
    }
}
