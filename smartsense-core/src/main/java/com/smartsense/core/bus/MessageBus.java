package com.smartsense.core.bus;

import com.smartsense.api.context.EventHandler;
import com.smartsense.api.context.EventSubscription;
import com.smartsense.api.event.Event;
import com.smartsense.api.event.EventType;
import com.smartsense.api.exception.ConfigurationException;
import com.smartsense.core.config.ShutdownPolicy;
import com.smartsense.core.config.SmartSenseConfig.BusSettings;
import com.smartsense.core.diagnostic.DiagnosticBus;
import com.smartsense.core.diagnostic.DiagnosticEvent;
import jakarta.annotation.Nonnull;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * 异步发布/订阅消息总线
 * <p>
 * 特点：
 * - 每个订阅者独占一个有界 FIFO 队列，慢订阅者不影响其他订阅者
 * - publish 只负责入队，不等待处理完成
 * - 处理器异常被隔离并计数，连续失败达到阈值时上报 DEGRADED
 * - 看门狗检查单次处理时长，超过 handlerTimeoutMs 时上报 DEGRADED
 * - 订阅表读无锁（CopyOnWrite），写操作串行化
 */
@Slf4j
public class MessageBus {

    private final BusSettings settings;
    private final DiagnosticBus diagnostics;
    private final Executor dispatchExecutor;
    private final boolean ownsExecutor;
    private final ScheduledExecutorService watchdog; // handlerTimeoutMs 为 0 时为 null

    // 订阅表：Key=EventType, Value=按订阅顺序排列的订阅
    private final Map<EventType, List<SubscriptionEntry>> subscriptions = new ConcurrentHashMap<>();

    // 订阅者队列：Key=subscriberId
    private final Map<String, SubscriberMailbox> mailboxes = new ConcurrentHashMap<>();

    private final ReentrantLock subscriptionLock = new ReentrantLock();
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    // 有界事件历史（仅用于诊断回放，不做持久化）
    private final Deque<Event> history = new ArrayDeque<>();

    // 队列回调，派发逻辑不对外暴露
    private final SubscriberMailbox.Dispatcher dispatcher = new SubscriberMailbox.Dispatcher() {
        @Override
        public void dispatch(SubscriberMailbox mailbox, SubscriberMailbox.Delivery delivery) {
            deliver(mailbox, delivery);
        }

        @Override
        public void onDropped(String subscriberId, SubscriberMailbox.Delivery delivery, String reason) {
            recordDrop(subscriberId, delivery, reason);
        }
    };

    @Setter
    private volatile SubscriberHealthListener healthListener; // 可选，由生命周期管理器注入

    // ================= 统计 =================
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong stalled = new AtomicLong();

    private static final AtomicInteger THREAD_NUMBER = new AtomicInteger(1);

    public MessageBus(BusSettings settings, DiagnosticBus diagnostics) {
        this(settings, diagnostics, newDispatchExecutor(settings.getDispatchThreads()), true);
    }

    /**
     * 使用外部执行器（调用方负责其生命周期）
     */
    public MessageBus(BusSettings settings, DiagnosticBus diagnostics, Executor dispatchExecutor) {
        this(settings, diagnostics, dispatchExecutor, false);
    }

    private MessageBus(BusSettings settings, DiagnosticBus diagnostics, Executor dispatchExecutor,
                       boolean ownsExecutor) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.diagnostics = diagnostics != null ? diagnostics : new DiagnosticBus();
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.ownsExecutor = ownsExecutor;
        this.watchdog = startWatchdog(settings.getHandlerTimeoutMs());
        log.info("Message bus ready (queueCapacity={}, backpressure={}, failureThreshold={})",
                settings.getQueueCapacity(), settings.getBackpressure(), settings.getFailureThreshold());
    }

    private static ExecutorService newDispatchExecutor(int threads) {
        // 每个订阅者同一时刻至多一个派发任务，线程数以订阅者数量为上限；
        // 阻塞的处理器只占用自己的线程，其他订阅者照常派发
        return new ThreadPoolExecutor(
                threads,
                Integer.MAX_VALUE,
                60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                r -> {
                    Thread t = new Thread(r, "smartsense-bus-" + THREAD_NUMBER.getAndIncrement());
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((thread, e) ->
                            log.error("Dispatch thread {} crashed: {}", thread.getName(), e.getMessage(), e));
                    return t;
                });
    }

    private ScheduledExecutorService startWatchdog(long timeoutMs) {
        if (timeoutMs <= 0) {
            return null;
        }
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "smartsense-bus-watchdog");
            t.setDaemon(true);
            return t;
        });
        long period = Math.max(10L, timeoutMs / 4);
        scheduler.scheduleWithFixedDelay(this::checkStalledHandlers, period, period, TimeUnit.MILLISECONDS);
        return scheduler;
    }

    // ==================== 订阅 ====================

    public EventSubscription subscribe(EventType eventType, String subscriberId, EventHandler handler) {
        return subscribe(eventType, subscriberId, handler, null);
    }

    /**
     * 订阅事件
     * 同一 (subscriberId, eventType) 重复订阅会替换原处理器，不会重复投递
     *
     * @param filter 可选过滤器，返回 false 的事件不入队
     */
    public EventSubscription subscribe(EventType eventType, String subscriberId, EventHandler handler,
                                       Predicate<Event> filter) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        if (subscriberId == null || subscriberId.isBlank()) {
            throw new IllegalArgumentException("subscriberId cannot be blank");
        }
        checkAccepting();

        subscriptionLock.lock();
        try {
            mailboxes.computeIfAbsent(subscriberId, this::newMailbox);
            List<SubscriptionEntry> entries =
                    subscriptions.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>());

            for (SubscriptionEntry existing : entries) {
                if (existing.getSubscriberId().equals(subscriberId)) {
                    existing.replace(handler, filter);
                    log.warn("[{}] Re-subscribed to {}, previous handler replaced", subscriberId, eventType);
                    return new BusSubscription(this, existing);
                }
            }

            SubscriptionEntry entry = new SubscriptionEntry(
                    UUID.randomUUID().toString(), subscriberId, eventType, handler, filter);
            entries.add(entry);
            log.debug("[{}] Subscribed to {} ({})", subscriberId, eventType, entry.getSubscriptionId());
            return new BusSubscription(this, entry);
        } finally {
            subscriptionLock.unlock();
        }
    }

    /**
     * 取消订阅
     * 已出队的投递照常完成；仍在队列中的投递在出队时被跳过
     */
    public void unsubscribe(EventSubscription subscription) {
        if (subscription == null) {
            return;
        }
        subscriptionLock.lock();
        try {
            List<SubscriptionEntry> entries = subscriptions.get(subscription.eventType());
            if (entries == null) {
                return;
            }
            for (SubscriptionEntry entry : entries) {
                if (entry.getSubscriptionId().equals(subscription.subscriptionId())) {
                    entry.deactivate();
                    entries.remove(entry);
                    log.debug("[{}] Unsubscribed from {}", entry.getSubscriberId(), entry.getEventType());
                    return;
                }
            }
        } finally {
            subscriptionLock.unlock();
        }
    }

    /**
     * 移除订阅者的全部订阅，并丢弃其队列中尚未派发的事件
     *
     * @return 被丢弃的事件数
     */
    public int removeSubscriber(String subscriberId) {
        SubscriberMailbox mailbox;
        int removed = 0;
        subscriptionLock.lock();
        try {
            for (List<SubscriptionEntry> entries : subscriptions.values()) {
                for (SubscriptionEntry entry : entries) {
                    if (entry.getSubscriberId().equals(subscriberId)) {
                        entry.deactivate();
                        entries.remove(entry);
                        removed++;
                    }
                }
            }
            mailbox = mailboxes.remove(subscriberId);
        } finally {
            subscriptionLock.unlock();
        }

        int discarded = mailbox != null ? mailbox.close() : 0;
        if (removed > 0 || discarded > 0) {
            log.debug("[{}] Removed {} subscriptions, discarded {} pending events", subscriberId, removed, discarded);
        }
        return discarded;
    }

    // ==================== 发布 ====================

    /**
     * 发布事件
     * 只负责入队，不等待任何订阅者处理完成
     *
     * @return 接收该事件的订阅者数量
     */
    public int publish(Event event) {
        Objects.requireNonNull(event, "event");
        checkAccepting();

        published.incrementAndGet();
        remember(event);

        List<SubscriptionEntry> entries = subscriptions.get(event.type());
        if (entries == null || entries.isEmpty()) {
            log.debug("No subscribers for {}", event);
            return 0;
        }

        // 每个订阅者每次发布至多投递一次
        Set<String> seen = new HashSet<>();
        int count = 0;
        for (SubscriptionEntry entry : entries) {
            if (!entry.isActive() || !seen.add(entry.getSubscriberId())) {
                continue;
            }
            if (!entry.accepts(event)) {
                continue;
            }
            SubscriberMailbox mailbox = mailboxes.get(entry.getSubscriberId());
            if (mailbox != null && mailbox.offer(new SubscriberMailbox.Delivery(event, entry))) {
                count++;
            }
        }
        log.debug("Published {} to {} subscribers", event, count);
        return count;
    }

    /**
     * 从历史中回放事件
     *
     * @param eventType 为 null 时回放全部类型
     * @param since     为 null 时不限时间
     * @return 回放的事件数
     */
    public int replay(EventType eventType, Instant since) {
        List<Event> snapshot;
        synchronized (history) {
            snapshot = new ArrayList<>(history);
        }
        int replayed = 0;
        for (Event event : snapshot) {
            if (eventType != null && !eventType.equals(event.type())) {
                continue;
            }
            if (since != null && event.timestamp().isBefore(since)) {
                continue;
            }
            publish(event);
            replayed++;
        }
        log.info("Replayed {} events", replayed);
        return replayed;
    }

    private void remember(Event event) {
        int limit = settings.getHistorySize();
        if (limit <= 0) {
            return;
        }
        synchronized (history) {
            history.addLast(event);
            while (history.size() > limit) {
                history.pollFirst();
            }
        }
    }

    // ==================== 派发 ====================

    private void deliver(SubscriberMailbox mailbox, SubscriberMailbox.Delivery delivery) {
        SubscriptionEntry entry = delivery.entry();
        Event event = delivery.event();
        String subscriberId = mailbox.getSubscriberId();

        if (!entry.isActive()) {
            log.debug("[{}] Skipping {} for cancelled subscription", subscriberId, event);
            return;
        }

        Optional<Event> response;
        try {
            response = entry.getHandler().handle(event);
        } catch (ConfigurationException e) {
            failed.incrementAndGet();
            log.error("[{}] Contract violation while handling {}: {}", subscriberId, event, e.getMessage());
            diagnostics.publish(new DiagnosticEvent.HandlerFailed(subscriberId, event, 0, e));
            SubscriberHealthListener listener = healthListener;
            if (listener != null) {
                listener.onContractViolation(subscriberId, e);
            }
            return;
        } catch (Exception e) {
            onHandlerFailure(mailbox, event, e);
            return;
        }

        delivered.incrementAndGet();
        if (mailbox.recordSuccess()) {
            log.info("[{}] Handler recovered", subscriberId);
            SubscriberHealthListener listener = healthListener;
            if (listener != null) {
                listener.onSubscriberRecovered(subscriberId);
            }
        }

        if (response != null && response.isPresent()) {
            publishResponse(subscriberId, response.get());
        }
    }

    private void onHandlerFailure(SubscriberMailbox mailbox, Event event, Exception e) {
        String subscriberId = mailbox.getSubscriberId();
        failed.incrementAndGet();
        int failures = mailbox.recordFailure();
        log.error("[{}] Handler failed on {} (consecutive failures: {}): {}",
                subscriberId, event, failures, e.getMessage(), e);
        diagnostics.publish(new DiagnosticEvent.HandlerFailed(subscriberId, event, failures, e));

        // 只在达到阈值的那一次上报，避免重复迁移
        if (failures == settings.getFailureThreshold()) {
            mailbox.markDegraded();
            SubscriberHealthListener listener = healthListener;
            if (listener != null) {
                listener.onSubscriberDegraded(subscriberId, failures + " consecutive handler failures");
            }
        }
    }

    /**
     * 检查正在处理的投递，超过 handlerTimeoutMs 的订阅者上报降级
     * 处理线程不会被中断，处理最终成功时按正常流程上报恢复
     *
     * @return 本次新发现的超时订阅者数量
     */
    int checkStalledHandlers() {
        long timeoutMs = settings.getHandlerTimeoutMs();
        if (timeoutMs <= 0) {
            return 0;
        }
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        int found = 0;
        for (SubscriberMailbox mailbox : mailboxes.values()) {
            long now = System.nanoTime();
            SubscriberMailbox.Delivery delivery = mailbox.pollStalled(timeoutNanos, now);
            if (delivery == null) {
                continue;
            }
            found++;
            stalled.incrementAndGet();
            String subscriberId = mailbox.getSubscriberId();
            long elapsedMs = mailbox.inFlightMillis(now);
            log.warn("[{}] Handler still running on {} after {}ms (timeout {}ms)",
                    subscriberId, delivery.event(), elapsedMs, timeoutMs);
            diagnostics.publish(new DiagnosticEvent.HandlerTimeout(subscriberId, delivery.event(), elapsedMs, timeoutMs));

            mailbox.markDegraded();
            SubscriberHealthListener listener = healthListener;
            if (listener != null) {
                listener.onSubscriberDegraded(subscriberId, "handler exceeded " + timeoutMs + "ms");
            }
        }
        return found;
    }

    private void publishResponse(String subscriberId, Event response) {
        if (!accepting.get()) {
            log.debug("[{}] Bus shut down, response {} discarded", subscriberId, response);
            return;
        }
        try {
            publish(response);
        } catch (IllegalStateException e) {
            log.debug("[{}] Bus shut down, response {} discarded", subscriberId, response);
        }
    }

    private void recordDrop(String subscriberId, SubscriberMailbox.Delivery delivery, String reason) {
        dropped.incrementAndGet();
        log.warn("[{}] Dropped {}: {}", subscriberId, delivery.event(), reason);
        diagnostics.publish(new DiagnosticEvent.EventDropped(subscriberId, delivery.event(), reason));
    }

    private SubscriberMailbox newMailbox(String subscriberId) {
        return new SubscriberMailbox(
                subscriberId,
                settings.getQueueCapacity(),
                settings.getBackpressure(),
                settings.getBlockTimeoutMs(),
                dispatchExecutor,
                dispatcher);
    }

    // ==================== 关闭 ====================

    /**
     * 关闭总线：停止接收发布，按策略排空或丢弃积压事件，释放派发线程
     */
    public void shutdown() {
        if (!accepting.compareAndSet(true, false)) {
            return; // 已经关闭
        }
        log.info("Shutting down message bus ({})", settings.getShutdownPolicy());
        if (watchdog != null) {
            watchdog.shutdownNow();
        }

        if (settings.getShutdownPolicy() == ShutdownPolicy.DRAIN) {
            awaitDrained(settings.getDrainTimeoutMs());
        }

        int discarded = 0;
        subscriptionLock.lock();
        try {
            for (SubscriberMailbox mailbox : mailboxes.values()) {
                discarded += mailbox.close();
            }
            mailboxes.clear();
            subscriptions.values().forEach(entries -> entries.forEach(SubscriptionEntry::deactivate));
            subscriptions.clear();
        } finally {
            subscriptionLock.unlock();
        }
        if (discarded > 0) {
            log.warn("Discarded {} undelivered events on shutdown", discarded);
        }

        if (ownsExecutor && dispatchExecutor instanceof ExecutorService executorService) {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(settings.getDrainTimeoutMs(), TimeUnit.MILLISECONDS)) {
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Message bus shut down");
    }

    private void awaitDrained(long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (mailboxes.values().stream().allMatch(SubscriberMailbox::isIdle)) {
                return;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        log.warn("Drain timed out after {}ms", timeoutMs);
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    private void checkAccepting() {
        if (!accepting.get()) {
            throw new IllegalStateException("Message bus is shut down");
        }
    }

    // ==================== 统计信息 ====================

    /**
     * 订阅者当前积压数量
     */
    public int getQueueSize(String subscriberId) {
        SubscriberMailbox mailbox = mailboxes.get(subscriberId);
        return mailbox != null ? mailbox.size() : 0;
    }

    public int getSubscriptionCount(EventType eventType) {
        List<SubscriptionEntry> entries = subscriptions.get(eventType);
        return entries != null ? entries.size() : 0;
    }

    public BusStats getStats() {
        int active = subscriptions.values().stream().mapToInt(List::size).sum();
        int historySize;
        synchronized (history) {
            historySize = history.size();
        }
        return new BusStats(published.get(), delivered.get(), dropped.get(), failed.get(), stalled.get(),
                active, mailboxes.size(), historySize);
    }

    public record BusStats(long published,
                           long delivered,
                           long dropped,
                           long failed,
                           long stalled,
                           int activeSubscriptions,
                           int subscribers,
                           int historySize) {
        @Override
        @Nonnull
        public String toString() {
            return String.format("BusStats{published=%d, delivered=%d, dropped=%d, failed=%d, stalled=%d, subscriptions=%d, subscribers=%d}",
                    published, delivered, dropped, failed, stalled, activeSubscriptions, subscribers);
        }
    }
}
