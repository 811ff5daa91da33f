package com.smartsense.core.bus;

import com.smartsense.api.event.Event;
import com.smartsense.core.config.BackpressurePolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 订阅者专属的有界 FIFO 队列
 * <p>
 * 同一时刻最多只有一个派发任务在消费本队列，因此单个订阅者内严格按入队顺序处理，
 * 不同订阅者之间互不阻塞。
 */
@Slf4j
final class SubscriberMailbox {

    // 单次派发任务最多处理的事件数，超过后重新提交以让出线程
    private static final int MAX_BATCH = 64;

    private final String subscriberId;
    private final int capacity;
    private final BackpressurePolicy policy;
    private final long blockTimeoutMs;
    private final Executor executor;
    private final Dispatcher dispatcher;

    private final Deque<Delivery> queue = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();

    // guarded by lock
    private boolean scheduled = false;
    private boolean closed = false;

    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private volatile boolean degraded = false;

    // 正在处理的投递及其开始时间 (nanoTime)，供看门狗检查
    private volatile Delivery inFlight;
    private volatile long inFlightSince;
    private volatile boolean stallReported;

    SubscriberMailbox(String subscriberId, int capacity, BackpressurePolicy policy, long blockTimeoutMs,
                      Executor executor, Dispatcher dispatcher) {
        this.subscriberId = subscriberId;
        this.capacity = capacity;
        this.policy = policy;
        this.blockTimeoutMs = blockTimeoutMs;
        this.executor = executor;
        this.dispatcher = dispatcher;
    }

    /**
     * 入队
     *
     * @return 本次发布的事件是否进入队列
     */
    boolean offer(Delivery delivery) {
        List<Delivery> dropped = new ArrayList<>(1);
        boolean rejectNewest = false;
        boolean accepted = false;
        boolean schedule = false;

        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (queue.size() >= capacity) {
                switch (policy) {
                    case DROP_OLDEST -> dropped.add(queue.pollFirst());
                    case DROP_NEWEST -> rejectNewest = true;
                    case BLOCK -> rejectNewest = !awaitSpace();
                }
            }
            if (rejectNewest) {
                dropped.add(delivery);
            } else if (!closed) {
                queue.addLast(delivery);
                accepted = true;
                if (!scheduled) {
                    scheduled = true;
                    schedule = true;
                }
            }
        } finally {
            lock.unlock();
        }

        // 诊断与调度都放在锁外，避免回调重入
        for (Delivery d : dropped) {
            dispatcher.onDropped(subscriberId, d, dropReason(rejectNewest));
        }
        if (schedule) {
            submitDrain();
        }
        return accepted;
    }

    private boolean awaitSpace() {
        long nanos = TimeUnit.MILLISECONDS.toNanos(blockTimeoutMs);
        try {
            while (queue.size() >= capacity && !closed) {
                if (nanos <= 0L) {
                    return false;
                }
                nanos = notFull.awaitNanos(nanos);
            }
            return !closed;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String dropReason(boolean newest) {
        return switch (policy) {
            case DROP_OLDEST -> "queue full (capacity " + capacity + "), dropped oldest";
            case DROP_NEWEST -> "queue full (capacity " + capacity + "), dropped newest";
            case BLOCK -> newest
                    ? "queue full after waiting " + blockTimeoutMs + "ms, dropped newest"
                    : "queue full";
        };
    }

    private void submitDrain() {
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            // 无法再派发，积压的事件按丢弃处理，避免队列永远非空
            List<Delivery> stranded;
            lock.lock();
            try {
                scheduled = false;
                stranded = new ArrayList<>(queue);
                queue.clear();
                notFull.signalAll();
            } finally {
                lock.unlock();
            }
            log.warn("[{}] Dispatch executor rejected drain task, dropping {} queued events",
                    subscriberId, stranded.size());
            for (Delivery d : stranded) {
                dispatcher.onDropped(subscriberId, d, "dispatch executor rejected");
            }
        }
    }

    private void drain() {
        int processed = 0;
        while (true) {
            Delivery delivery;
            lock.lock();
            try {
                if (closed || queue.isEmpty()) {
                    scheduled = false;
                    return;
                }
                if (processed >= MAX_BATCH) {
                    break;
                }
                delivery = queue.pollFirst();
                notFull.signal();
            } finally {
                lock.unlock();
            }
            processed++;
            inFlightSince = System.nanoTime();
            stallReported = false;
            inFlight = delivery;
            try {
                dispatcher.dispatch(this, delivery);
            } finally {
                inFlight = null;
            }
        }
        // 仍有积压，重新排队让出线程
        submitDrain();
    }

    /**
     * 关闭队列，未派发的事件直接丢弃
     *
     * @return 丢弃的事件数
     */
    int close() {
        lock.lock();
        try {
            closed = true;
            int discarded = queue.size();
            queue.clear();
            notFull.signalAll();
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 队列为空且没有派发任务在运行
     */
    boolean isIdle() {
        lock.lock();
        try {
            return queue.isEmpty() && !scheduled;
        } finally {
            lock.unlock();
        }
    }

    // ==================== 健康计数 ====================

    int recordFailure() {
        return consecutiveFailures.incrementAndGet();
    }

    /**
     * @return 之前是否处于降级状态
     */
    boolean recordSuccess() {
        consecutiveFailures.set(0);
        boolean wasDegraded = degraded;
        degraded = false;
        return wasDegraded;
    }

    void markDegraded() {
        degraded = true;
    }

    /**
     * 当前投递处理时间超过阈值且尚未上报时返回该投递，每次投递至多返回一次
     */
    Delivery pollStalled(long timeoutNanos, long now) {
        Delivery current = inFlight;
        if (current == null || stallReported || now - inFlightSince < timeoutNanos) {
            return null;
        }
        stallReported = true;
        return current;
    }

    /**
     * 当前投递已处理的毫秒数，空闲时为 0
     */
    long inFlightMillis(long now) {
        return inFlight == null ? 0L : TimeUnit.NANOSECONDS.toMillis(now - inFlightSince);
    }

    String getSubscriberId() {
        return subscriberId;
    }

    /**
     * 队列中的一次投递
     */
    record Delivery(Event event, SubscriptionEntry entry) {
    }

    /**
     * 派发回调（由 MessageBus 实现）
     */
    interface Dispatcher {

        void dispatch(SubscriberMailbox mailbox, Delivery delivery);

        void onDropped(String subscriberId, Delivery delivery, String reason);
    }
}
