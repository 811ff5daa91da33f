package com.smartsense.core.bus;

import com.smartsense.api.context.EventSubscription;
import com.smartsense.api.event.Event;
import com.smartsense.api.event.EventType;
import com.smartsense.api.exception.ConfigurationException;
import com.smartsense.core.config.BackpressurePolicy;
import com.smartsense.core.config.ShutdownPolicy;
import com.smartsense.core.config.SmartSenseConfig.BusSettings;
import com.smartsense.core.diagnostic.DiagnosticBus;
import com.smartsense.core.diagnostic.DiagnosticEvent;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("MessageBus 单元测试")
public class MessageBusTest {

    private static final EventType TYPE = EventType.of("TEST_EVENT");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private SubscriberHealthListener healthListener;

    private DiagnosticBus diagnostics;
    private List<DiagnosticEvent.EventDropped> drops;
    private List<DiagnosticEvent.HandlerFailed> failures;
    private MessageBus bus;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticBus();
        drops = new CopyOnWriteArrayList<>();
        failures = new CopyOnWriteArrayList<>();
        diagnostics.subscribe(DiagnosticEvent.EventDropped.class, drops::add);
        diagnostics.subscribe(DiagnosticEvent.HandlerFailed.class, failures::add);

        bus = new MessageBus(new BusSettings(), diagnostics);
        bus.setHealthListener(healthListener);
    }

    @AfterEach
    void tearDown() {
        if (bus != null && bus.isAccepting()) {
            bus.shutdown();
        }
    }

    // ==================== 辅助方法 ====================

    private static Event event(int seq) {
        return Event.of(TYPE, "publisher", Map.of("seq", seq));
    }

    private static int seq(Event event) {
        return event.get("seq", Integer.class).orElseThrow();
    }

    private static BusSettings settings(int capacity, BackpressurePolicy policy) {
        BusSettings settings = new BusSettings();
        settings.setQueueCapacity(capacity);
        settings.setBackpressure(policy);
        return settings;
    }

    /**
     * 手动驱动的执行器：任务只在 runAll() 时执行
     */
    private static class ManualExecutor implements Executor {
        private final Queue<Runnable> tasks = new ArrayDeque<>();

        @Override
        public void execute(Runnable command) {
            tasks.add(command);
        }

        void runAll() {
            Runnable task;
            while ((task = tasks.poll()) != null) {
                task.run();
            }
        }
    }

    // ==================== 发布与订阅 ====================

    @Nested
    @DisplayName("发布与订阅")
    class PublishSubscribeTests {

        @Test
        @DisplayName("没有订阅者时返回 0")
        void publishWithoutSubscribersShouldReturnZero() {
            assertEquals(0, bus.publish(event(1)));
        }

        @Test
        @DisplayName("返回接收事件的订阅者数量")
        void publishShouldReturnDeliveryCount() {
            bus.subscribe(TYPE, "a", e -> Optional.empty());
            bus.subscribe(TYPE, "b", e -> Optional.empty());
            bus.subscribe(EventType.of("OTHER"), "c", e -> Optional.empty());

            assertEquals(2, bus.publish(event(1)));
        }

        @Test
        @DisplayName("同一订阅者内严格按发布顺序处理")
        void deliveryShouldBeFifoPerSubscriber() {
            List<Integer> received = new CopyOnWriteArrayList<>();
            bus.subscribe(TYPE, "ordered", e -> {
                received.add(seq(e));
                return Optional.empty();
            });

            for (int i = 0; i < 200; i++) {
                bus.publish(event(i));
            }

            await().atMost(TIMEOUT).until(() -> received.size() == 200);
            for (int i = 0; i < 200; i++) {
                assertEquals(i, received.get(i));
            }
        }

        @Test
        @DisplayName("重复订阅替换原处理器，不会重复投递")
        void resubscribeShouldReplaceHandler() {
            AtomicInteger first = new AtomicInteger();
            AtomicInteger second = new AtomicInteger();
            bus.subscribe(TYPE, "dup", e -> {
                first.incrementAndGet();
                return Optional.empty();
            });
            bus.subscribe(TYPE, "dup", e -> {
                second.incrementAndGet();
                return Optional.empty();
            });

            assertEquals(1, bus.publish(event(1)));

            await().atMost(TIMEOUT).until(() -> second.get() == 1);
            assertEquals(0, first.get());
            assertEquals(1, bus.getSubscriptionCount(TYPE));
        }

        @Test
        @DisplayName("投递集合在发布时确定，之后的订阅收不到")
        void lateSubscriberShouldNotReceiveEarlierEvent() {
            List<Integer> early = new CopyOnWriteArrayList<>();
            List<Integer> late = new CopyOnWriteArrayList<>();
            bus.subscribe(TYPE, "early", e -> {
                early.add(seq(e));
                return Optional.empty();
            });

            bus.publish(event(1));
            bus.subscribe(TYPE, "late", e -> {
                late.add(seq(e));
                return Optional.empty();
            });
            bus.publish(event(2));

            await().atMost(TIMEOUT).until(() -> early.size() == 2 && late.size() == 1);
            assertEquals(List.of(2), late);
        }

        @Test
        @DisplayName("处理器返回的响应事件会继续发布并保留 correlationId")
        void responseEventShouldBePublished() {
            EventType replyType = EventType.of("TEST_REPLY");
            List<Event> replies = new CopyOnWriteArrayList<>();
            bus.subscribe(TYPE, "responder", e -> Optional.of(e.reply(replyType, "responder", Map.of("ok", true))));
            bus.subscribe(replyType, "listener", e -> {
                replies.add(e);
                return Optional.empty();
            });

            Event request = event(1);
            bus.publish(request);

            await().atMost(TIMEOUT).until(() -> replies.size() == 1);
            assertEquals(request.correlationId(), replies.get(0).correlationId());
            assertEquals("responder", replies.get(0).sourceComponentId());
        }
    }

    // ==================== 过滤器 ====================

    @Nested
    @DisplayName("过滤器")
    class FilterTests {

        @Test
        @DisplayName("被过滤的事件不入队")
        void filteredEventShouldNotBeEnqueued() {
            List<Integer> received = new CopyOnWriteArrayList<>();
            bus.subscribe(TYPE, "even", e -> {
                received.add(seq(e));
                return Optional.empty();
            }, e -> seq(e) % 2 == 0);

            assertEquals(0, bus.publish(event(1)));
            assertEquals(1, bus.publish(event(2)));

            await().atMost(TIMEOUT).until(() -> received.size() == 1);
            assertEquals(List.of(2), received);
        }

        @Test
        @DisplayName("过滤器抛异常时照常投递")
        void throwingFilterShouldStillDeliver() {
            List<Integer> received = new CopyOnWriteArrayList<>();
            bus.subscribe(TYPE, "broken-filter", e -> {
                received.add(seq(e));
                return Optional.empty();
            }, e -> {
                throw new IllegalStateException("filter bug");
            });

            assertEquals(1, bus.publish(event(7)));
            await().atMost(TIMEOUT).until(() -> received.equals(List.of(7)));
        }
    }

    // ==================== 取消订阅 ====================

    @Nested
    @DisplayName("取消订阅")
    class UnsubscribeTests {

        @Test
        @DisplayName("处理中取消订阅：当前事件完成，排队事件被跳过")
        void unsubscribeDuringDispatchShouldSkipQueuedEvents() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            List<Integer> received = new CopyOnWriteArrayList<>();

            EventSubscription subscription = bus.subscribe(TYPE, "slow", e -> {
                received.add(seq(e));
                if (seq(e) == 1) {
                    entered.countDown();
                    release.await(5, TimeUnit.SECONDS);
                }
                return Optional.empty();
            });

            bus.publish(event(1));
            bus.publish(event(2));
            bus.publish(event(3));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            subscription.unsubscribe();
            release.countDown();

            await().pollDelay(Duration.ofMillis(200)).atMost(TIMEOUT)
                    .untilAsserted(() -> assertEquals(List.of(1), received));
            assertEquals(0, bus.getSubscriptionCount(TYPE));
        }

        @Test
        @DisplayName("取消订阅后不再收到新事件")
        void unsubscribedHandlerShouldNotReceiveNewEvents() {
            EventSubscription subscription = bus.subscribe(TYPE, "gone", e -> Optional.empty());
            subscription.unsubscribe();

            assertEquals(0, bus.publish(event(1)));
        }

        @Test
        @DisplayName("移除订阅者会丢弃其积压事件")
        void removeSubscriberShouldDiscardPendingEvents() {
            ManualExecutor executor = new ManualExecutor();
            MessageBus manualBus = new MessageBus(new BusSettings(), diagnostics, executor);
            List<Integer> received = new ArrayList<>();
            manualBus.subscribe(TYPE, "pending", e -> {
                received.add(seq(e));
                return Optional.empty();
            });
            manualBus.subscribe(EventType.of("OTHER"), "pending", e -> Optional.empty());

            manualBus.publish(event(1));
            manualBus.publish(event(2));

            assertEquals(2, manualBus.removeSubscriber("pending"));
            executor.runAll();

            assertTrue(received.isEmpty());
            assertEquals(0, manualBus.getSubscriptionCount(TYPE));
            assertEquals(0, manualBus.getSubscriptionCount(EventType.of("OTHER")));
            manualBus.shutdown();
        }
    }

    // ==================== 隔离与故障 ====================

    @Nested
    @DisplayName("故障隔离")
    class FailureIsolationTests {

        @Test
        @DisplayName("慢订阅者不阻塞其他订阅者")
        void slowSubscriberShouldNotBlockOthers() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            List<Integer> fast = new CopyOnWriteArrayList<>();
            bus.subscribe(TYPE, "slow", e -> {
                release.await(5, TimeUnit.SECONDS);
                return Optional.empty();
            });
            bus.subscribe(TYPE, "fast", e -> {
                fast.add(seq(e));
                return Optional.empty();
            });

            for (int i = 0; i < 10; i++) {
                bus.publish(event(i));
            }

            await().atMost(TIMEOUT).until(() -> fast.size() == 10);
            release.countDown();
        }

        @Test
        @DisplayName("多个订阅者同时阻塞时，其余订阅者照常收到事件")
        void blockedSubscribersShouldNotStarveOthers() {
            CountDownLatch release = new CountDownLatch(1);
            try {
                for (int i = 0; i < new BusSettings().getDispatchThreads(); i++) {
                    bus.subscribe(TYPE, "blocked-" + i, e -> {
                        release.await(10, TimeUnit.SECONDS);
                        return Optional.empty();
                    });
                }
                List<Integer> fast = new CopyOnWriteArrayList<>();
                bus.subscribe(TYPE, "fast", e -> {
                    fast.add(seq(e));
                    return Optional.empty();
                });

                bus.publish(event(1));

                await().atMost(Duration.ofSeconds(2)).until(() -> fast.size() == 1);
            } finally {
                release.countDown();
            }
        }

        @Test
        @DisplayName("处理超时：上报一次降级并发出诊断，处理完成后恢复")
        void stalledHandlerShouldBeReportedOnce() {
            List<DiagnosticEvent.HandlerTimeout> stalls = new CopyOnWriteArrayList<>();
            diagnostics.subscribe(DiagnosticEvent.HandlerTimeout.class, stalls::add);
            BusSettings settings = new BusSettings();
            settings.setHandlerTimeoutMs(100);
            MessageBus watchedBus = new MessageBus(settings, diagnostics);
            watchedBus.setHealthListener(healthListener);
            CountDownLatch release = new CountDownLatch(1);
            try {
                watchedBus.subscribe(TYPE, "stuck", e -> {
                    release.await(10, TimeUnit.SECONDS);
                    return Optional.empty();
                });

                watchedBus.publish(event(1));

                verify(healthListener, timeout(5000)).onSubscriberDegraded(eq("stuck"), contains("100ms"));
                await().atMost(TIMEOUT).until(() -> stalls.size() == 1);
                assertEquals("stuck", stalls.get(0).componentId());
                assertTrue(stalls.get(0).elapsedMs() >= 100);

                release.countDown();
                verify(healthListener, timeout(5000)).onSubscriberRecovered("stuck");
                verify(healthListener, times(1)).onSubscriberDegraded(eq("stuck"), anyString());
                assertEquals(1, stalls.size());
                assertEquals(1, watchedBus.getStats().stalled());
            } finally {
                release.countDown();
                watchedBus.shutdown();
            }
        }

        @Test
        @DisplayName("处理器异常不影响发布方与其他订阅者")
        void handlerFailureShouldBeContained() {
            List<Integer> healthy = new CopyOnWriteArrayList<>();
            bus.subscribe(TYPE, "broken", e -> {
                throw new IllegalStateException("boom");
            });
            bus.subscribe(TYPE, "healthy", e -> {
                healthy.add(seq(e));
                return Optional.empty();
            });

            assertDoesNotThrow(() -> bus.publish(event(1)));

            await().atMost(TIMEOUT).until(() -> healthy.size() == 1 && failures.size() == 1);
            assertEquals("broken", failures.get(0).componentId());
            assertEquals(1, failures.get(0).consecutiveFailures());
        }

        @Test
        @DisplayName("连续失败达到阈值时上报一次降级，订阅保留")
        void consecutiveFailuresShouldReportDegradedOnce() {
            AtomicBoolean failing = new AtomicBoolean(true);
            bus.subscribe(TYPE, "flaky", e -> {
                if (failing.get()) {
                    throw new IllegalStateException("boom");
                }
                return Optional.empty();
            });

            for (int i = 0; i < 4; i++) {
                bus.publish(event(i));
            }
            await().atMost(TIMEOUT).until(() -> failures.size() == 4);

            verify(healthListener, times(1)).onSubscriberDegraded(eq("flaky"), anyString());
            assertEquals(1, bus.getSubscriptionCount(TYPE));

            failing.set(false);
            bus.publish(event(5));
            verify(healthListener, timeout(5000)).onSubscriberRecovered("flaky");
        }

        @Test
        @DisplayName("成功处理会重置失败计数")
        void successShouldResetFailureCount() {
            AtomicInteger calls = new AtomicInteger();
            bus.subscribe(TYPE, "alternating", e -> {
                if (calls.incrementAndGet() % 2 == 1) {
                    throw new IllegalStateException("odd call");
                }
                return Optional.empty();
            });

            for (int i = 0; i < 6; i++) {
                bus.publish(event(i));
            }
            await().atMost(TIMEOUT).until(() -> calls.get() == 6);

            verify(healthListener, never()).onSubscriberDegraded(anyString(), anyString());
            verify(healthListener, never()).onSubscriberRecovered(anyString());
        }

        @Test
        @DisplayName("契约违规上报给健康监听器")
        void contractViolationShouldBeReported() {
            bus.subscribe(TYPE, "violator", e -> {
                throw new ConfigurationException("not initialized");
            });

            bus.publish(event(1));

            verify(healthListener, timeout(5000)).onContractViolation(eq("violator"), any(ConfigurationException.class));
        }
    }

    // ==================== 背压 ====================

    @Nested
    @DisplayName("背压")
    class BackpressureTests {

        @Test
        @DisplayName("DROP_OLDEST：队列满时丢弃最旧事件，每次丢弃都有诊断")
        void dropOldestShouldKeepNewestEvents() {
            ManualExecutor executor = new ManualExecutor();
            MessageBus manualBus = new MessageBus(settings(2, BackpressurePolicy.DROP_OLDEST), diagnostics, executor);
            List<Integer> received = new ArrayList<>();
            manualBus.subscribe(TYPE, "slow", e -> {
                received.add(seq(e));
                return Optional.empty();
            });

            for (int i = 1; i <= 4; i++) {
                assertEquals(1, manualBus.publish(event(i)));
            }
            executor.runAll();

            assertEquals(List.of(3, 4), received);
            assertEquals(2, drops.size());
            assertEquals(1, seq(drops.get(0).event()));
            assertEquals(2, seq(drops.get(1).event()));
            assertEquals(2, manualBus.getStats().dropped());
            manualBus.shutdown();
        }

        @Test
        @DisplayName("DROP_NEWEST：队列满时拒绝新事件")
        void dropNewestShouldKeepOldestEvents() {
            ManualExecutor executor = new ManualExecutor();
            MessageBus manualBus = new MessageBus(settings(2, BackpressurePolicy.DROP_NEWEST), diagnostics, executor);
            List<Integer> received = new ArrayList<>();
            manualBus.subscribe(TYPE, "slow", e -> {
                received.add(seq(e));
                return Optional.empty();
            });

            assertEquals(1, manualBus.publish(event(1)));
            assertEquals(1, manualBus.publish(event(2)));
            assertEquals(0, manualBus.publish(event(3)));
            assertEquals(0, manualBus.publish(event(4)));
            executor.runAll();

            assertEquals(List.of(1, 2), received);
            assertEquals(2, drops.size());
            assertEquals(3, seq(drops.get(0).event()));
            manualBus.shutdown();
        }

        @Test
        @DisplayName("BLOCK：等待超时后丢弃新事件")
        void blockShouldDropAfterTimeout() {
            BusSettings blockSettings = settings(1, BackpressurePolicy.BLOCK);
            blockSettings.setBlockTimeoutMs(50);
            ManualExecutor executor = new ManualExecutor();
            MessageBus manualBus = new MessageBus(blockSettings, diagnostics, executor);
            manualBus.subscribe(TYPE, "stuck", e -> Optional.empty());

            assertEquals(1, manualBus.publish(event(1)));
            long start = System.nanoTime();
            assertEquals(0, manualBus.publish(event(2)));
            long waitedMs = (System.nanoTime() - start) / 1_000_000;

            assertTrue(waitedMs >= 40, "publisher should wait for space, waited " + waitedMs + "ms");
            assertEquals(1, drops.size());
            assertEquals(2, seq(drops.get(0).event()));
            manualBus.shutdown();
        }

        @Test
        @DisplayName("BLOCK：有空间后继续入队")
        void blockShouldResumeWhenSpaceFreed() {
            BusSettings blockSettings = settings(1, BackpressurePolicy.BLOCK);
            blockSettings.setBlockTimeoutMs(5000);
            MessageBus blockingBus = new MessageBus(blockSettings, diagnostics);
            List<Integer> received = new CopyOnWriteArrayList<>();
            blockingBus.subscribe(TYPE, "steady", e -> {
                Thread.sleep(20);
                received.add(seq(e));
                return Optional.empty();
            });

            for (int i = 0; i < 5; i++) {
                assertEquals(1, blockingBus.publish(event(i)));
            }

            await().atMost(TIMEOUT).until(() -> received.size() == 5);
            assertEquals(List.of(0, 1, 2, 3, 4), received);
            assertTrue(drops.isEmpty());
            blockingBus.shutdown();
        }
    }

    // ==================== 关闭 ====================

    @Nested
    @DisplayName("关闭")
    class ShutdownTests {

        @Test
        @DisplayName("关闭后发布抛出 IllegalStateException")
        void publishAfterShutdownShouldFail() {
            bus.shutdown();

            assertFalse(bus.isAccepting());
            assertThrows(IllegalStateException.class, () -> bus.publish(event(1)));
        }

        @Test
        @DisplayName("重复关闭无副作用")
        void shutdownShouldBeIdempotent() {
            bus.shutdown();
            assertDoesNotThrow(() -> bus.shutdown());
        }

        @Test
        @DisplayName("DISCARD：未派发的事件被丢弃")
        void discardPolicyShouldDropQueuedEvents() {
            BusSettings discard = new BusSettings();
            discard.setShutdownPolicy(ShutdownPolicy.DISCARD);
            ManualExecutor executor = new ManualExecutor();
            MessageBus manualBus = new MessageBus(discard, diagnostics, executor);
            List<Integer> received = new ArrayList<>();
            manualBus.subscribe(TYPE, "late", e -> {
                received.add(seq(e));
                return Optional.empty();
            });
            manualBus.publish(event(1));
            manualBus.publish(event(2));

            manualBus.shutdown();
            executor.runAll();

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("派发任务被拒绝时积压事件按丢弃处理，DRAIN 关闭不会空等")
        void rejectedDrainTaskShouldDropQueuedEvents() {
            BusSettings drain = new BusSettings();
            drain.setShutdownPolicy(ShutdownPolicy.DRAIN);
            drain.setDrainTimeoutMs(5000);
            Executor rejecting = task -> {
                throw new RejectedExecutionException("executor closed");
            };
            MessageBus rejectingBus = new MessageBus(drain, diagnostics, rejecting);
            rejectingBus.subscribe(TYPE, "orphan", e -> Optional.empty());

            rejectingBus.publish(event(1));
            rejectingBus.publish(event(2));

            assertEquals(2, drops.size());
            assertEquals(0, rejectingBus.getQueueSize("orphan"));
            long start = System.nanoTime();
            rejectingBus.shutdown();
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 2000);
        }

        @Test
        @DisplayName("DRAIN：关闭前派发完积压事件")
        void drainPolicyShouldDeliverQueuedEvents() {
            BusSettings drain = new BusSettings();
            drain.setShutdownPolicy(ShutdownPolicy.DRAIN);
            MessageBus drainingBus = new MessageBus(drain, diagnostics);
            List<Integer> received = new CopyOnWriteArrayList<>();
            drainingBus.subscribe(TYPE, "steady", e -> {
                Thread.sleep(10);
                received.add(seq(e));
                return Optional.empty();
            });
            for (int i = 0; i < 10; i++) {
                drainingBus.publish(event(i));
            }

            drainingBus.shutdown();

            assertEquals(10, received.size());
        }
    }

    // ==================== 历史与统计 ====================

    @Nested
    @DisplayName("历史与统计")
    class HistoryTests {

        @Test
        @DisplayName("回放指定类型的历史事件")
        void replayShouldRepublishMatchingEvents() {
            Instant before = Instant.now().minusSeconds(1);
            bus.publish(event(1));
            bus.publish(Event.of(EventType.of("OTHER"), "publisher", Map.of()));
            bus.publish(event(2));

            List<Integer> received = new CopyOnWriteArrayList<>();
            bus.subscribe(TYPE, "auditor", e -> {
                received.add(seq(e));
                return Optional.empty();
            });

            assertEquals(2, bus.replay(TYPE, before));
            await().atMost(TIMEOUT).until(() -> received.size() == 2);
            assertEquals(List.of(1, 2), received);
        }

        @Test
        @DisplayName("历史容量有界")
        void historyShouldBeBounded() {
            BusSettings small = new BusSettings();
            small.setHistorySize(3);
            MessageBus smallBus = new MessageBus(small, diagnostics);
            for (int i = 0; i < 10; i++) {
                smallBus.publish(event(i));
            }

            assertEquals(3, smallBus.getStats().historySize());
            assertEquals(3, smallBus.replay(null, null));
            smallBus.shutdown();
        }

        @Test
        @DisplayName("统计发布、投递与失败次数")
        void statsShouldCountDeliveries() {
            bus.subscribe(TYPE, "ok", e -> Optional.empty());
            bus.subscribe(TYPE, "broken", e -> {
                throw new IllegalStateException("boom");
            });

            bus.publish(event(1));
            bus.publish(event(2));

            await().atMost(TIMEOUT).until(() -> bus.getStats().delivered() == 2 && bus.getStats().failed() == 2);
            MessageBus.BusStats stats = bus.getStats();
            assertEquals(2, stats.published());
            assertEquals(2, stats.activeSubscriptions());
            assertEquals(2, stats.subscribers());
            assertTrue(stats.toString().contains("published=2"));
        }
    }
}
