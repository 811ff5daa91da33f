package com.smartsense.core.component;

import com.smartsense.api.component.ComponentRole;
import com.smartsense.api.context.ComponentContext;
import com.smartsense.api.event.Event;
import com.smartsense.api.event.EventType;
import com.smartsense.core.spi.InferenceStrategy;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 处理器组件：在自己的工作线程池上运行推理策略，结果以相同 correlationId 发布
 * <p>
 * 派发线程只负责把事件交给工作线程，推理再慢也不会占用总线线程
 */
@Slf4j
public class ProcessorComponent extends AbstractComponent {

    private static final int DEFAULT_QUEUE_CAPACITY = 100;
    // 连续推理失败多少次后上报不健康
    private static final int UNHEALTHY_THRESHOLD = 3;

    private final EventType outputType;
    private final InferenceStrategy strategy;
    private final int workerThreads;
    private final int queueCapacity;

    private volatile ThreadPoolExecutor workers;

    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private volatile boolean reportedUnhealthy = false;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public ProcessorComponent(String id, Set<EventType> inputTypes, EventType outputType,
                              InferenceStrategy strategy) {
        this(id, inputTypes, outputType, strategy, Set.of(), 1, DEFAULT_QUEUE_CAPACITY);
    }

    /**
     * @param workerThreads 工作线程数；为 1 时结果顺序与输入顺序一致
     */
    public ProcessorComponent(String id, Set<EventType> inputTypes, EventType outputType,
                              InferenceStrategy strategy, Set<String> dependencies,
                              int workerThreads, int queueCapacity) {
        super(id, ComponentRole.PROCESSOR, inputTypes, dependencies);
        if (workerThreads < 1 || queueCapacity < 1) {
            throw new IllegalArgumentException("workerThreads and queueCapacity must be positive");
        }
        this.outputType = Objects.requireNonNull(outputType, "outputType");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.workerThreads = workerThreads;
        this.queueCapacity = queueCapacity;
    }

    @Override
    protected boolean doInitialize(ComponentContext context) {
        AtomicInteger threadNumber = new AtomicInteger(1);
        workers = new ThreadPoolExecutor(
                workerThreads,
                workerThreads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity), // 有界队列
                r -> {
                    Thread t = new Thread(r, "smartsense-" + id() + "-worker-" + threadNumber.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy() // 满载时快速失败
        );
        return true;
    }

    @Override
    protected void doShutdown() {
        ThreadPoolExecutor pool = workers;
        if (pool == null) {
            return;
        }
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[{}] Worker pool did not terminate in time", id());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    protected Optional<Event> onEvent(Event event) {
        try {
            workers.execute(() -> process(event));
        } catch (RejectedExecutionException e) {
            rejected.incrementAndGet();
            log.warn("[{}] Worker queue full, dropping {}", id(), event);
        }
        return Optional.empty();
    }

    private void process(Event input) {
        Optional<Map<String, Object>> result;
        try {
            result = strategy.infer(input);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[{}] Interrupted while processing {}", id(), input);
            return;
        } catch (Exception e) {
            onFailure(input, e);
            return;
        }

        processed.incrementAndGet();
        consecutiveFailures.set(0);
        if (reportedUnhealthy) {
            reportedUnhealthy = false;
            context().reportHealth(true, "inference succeeded");
        }
        result.ifPresent(payload -> publish(input.reply(outputType, id(), payload)));
    }

    private void onFailure(Event input, Exception e) {
        failed.incrementAndGet();
        int failures = consecutiveFailures.incrementAndGet();
        log.error("[{}] Inference failed on {}: {}", id(), input, e.getMessage(), e);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component_id", id());
        payload.put("source_event_id", input.eventId());
        payload.put("error", String.valueOf(e.getMessage()));
        publish(input.reply(EventType.ERROR, id(), payload));

        if (failures >= UNHEALTHY_THRESHOLD && !reportedUnhealthy) {
            reportedUnhealthy = true;
            context().reportHealth(false, failures + " consecutive inference failures");
        }
    }

    @Override
    public boolean isHealthy() {
        ThreadPoolExecutor pool = workers;
        return pool != null && !pool.isShutdown();
    }

    public EventType getOutputType() {
        return outputType;
    }

    public long getProcessedCount() {
        return processed.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    public long getRejectedCount() {
        return rejected.get();
    }
}
