package com.smartsense.core.lifecycle;

import com.smartsense.api.component.Component;
import com.smartsense.api.component.ComponentState;
import com.smartsense.api.event.Event;
import com.smartsense.api.event.EventType;
import com.smartsense.api.exception.ConfigurationException;
import com.smartsense.api.exception.InitializationException;
import com.smartsense.api.exception.InitializationException.InitializationFailure;
import com.smartsense.core.bus.MessageBus;
import com.smartsense.core.bus.SubscriberHealthListener;
import com.smartsense.core.config.SmartSenseConfig;
import com.smartsense.core.context.DefaultComponentContext;
import com.smartsense.core.diagnostic.DiagnosticBus;
import com.smartsense.core.diagnostic.DiagnosticEvent;
import com.smartsense.core.lifecycle.ComponentRecord.DegradationSource;
import com.smartsense.core.locator.ServiceLocator;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 组件生命周期管理器
 * 职责：注册校验、按依赖分层启动、健康监督、逆序关闭
 * <p>
 * 状态迁移统一经过 {@link #transition}，每次迁移都会：
 * 1. 写日志
 * 2. 发布 ComponentStateChanged 诊断事件
 * 3. 在总线上发布 SYSTEM_STATUS 事件
 */
@Slf4j
public class LifecycleManager implements SubscriberHealthListener {

    /**
     * SYSTEM_STATUS 事件的来源 ID
     */
    public static final String SOURCE_ID = "lifecycle-manager";

    private final MessageBus messageBus;
    private final ServiceLocator serviceLocator;
    private final DiagnosticBus diagnostics;
    private final SmartSenseConfig config;

    // 执行 initialize()/shutdown()，调用方按超时等待
    private final ExecutorService lifecycleExecutor;
    private final ScheduledExecutorService healthScheduler;
    private volatile ScheduledFuture<?> healthTask;

    // 注册顺序即迭代顺序
    private final Map<String, ComponentRecord> records = new LinkedHashMap<>();
    // 实际完成启动的顺序，关闭时逆序
    private final List<String> startOrder = new ArrayList<>();

    private final ReentrantLock stateLock = new ReentrantLock();
    // 串行化 start() 与 shutdown()
    private final ReentrantLock operationLock = new ReentrantLock();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private static final AtomicInteger THREAD_NUMBER = new AtomicInteger(1);

    public LifecycleManager(MessageBus messageBus,
                            ServiceLocator serviceLocator,
                            DiagnosticBus diagnostics,
                            SmartSenseConfig config) {
        this.messageBus = Objects.requireNonNull(messageBus, "messageBus");
        this.serviceLocator = Objects.requireNonNull(serviceLocator, "serviceLocator");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.config = Objects.requireNonNull(config, "config");

        this.lifecycleExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "smartsense-lifecycle-" + THREAD_NUMBER.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        this.healthScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "smartsense-health");
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((thread, e) ->
                    log.error("Health check thread {} crashed: {}", thread.getName(), e.getMessage()));
            return t;
        });

        messageBus.setHealthListener(this);
    }

    // ==================== 注册 ====================

    /**
     * 注册组件
     *
     * @throws ConfigurationException ID 重复，或加入后依赖图出现环（此时组件不会被注册）
     */
    public void register(Component component) {
        Objects.requireNonNull(component, "component");
        String id = component.id();
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Component id cannot be blank");
        }

        ComponentRecord record = new ComponentRecord(component);
        stateLock.lock();
        try {
            if (started.get() || shutdown.get()) {
                throw new IllegalStateException("Components must be registered before start(): " + id);
            }
            if (records.containsKey(id)) {
                throw new ConfigurationException("Duplicate component id: " + id);
            }

            Map<String, Set<String>> graph = dependencyGraph();
            graph.put(id, record.getDependencies());
            Optional<List<String>> cycle = DependencyResolver.findCycle(graph);
            if (cycle.isPresent()) {
                throw new ConfigurationException("Dependency cycle detected: " + String.join(" -> ", cycle.get()));
            }
            records.put(id, record);
        } finally {
            stateLock.unlock();
        }
        log.info("[{}] Registered {} component, dependencies: {}", id, component.role(), record.getDependencies());
    }

    // 调用方持有 stateLock
    private Map<String, Set<String>> dependencyGraph() {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        records.forEach((id, record) -> graph.put(id, record.getDependencies()));
        return graph;
    }

    // ==================== 启动 ====================

    /**
     * 按依赖分层启动全部组件
     * 每层全部完成后才启动下一层；层内按注册顺序。任一组件失败即中止，
     * 已启动的组件按启动逆序停止
     *
     * @throws ConfigurationException  存在未注册的依赖（不启动任何组件）
     * @throws InitializationException 有组件初始化失败
     */
    public void start() {
        operationLock.lock();
        try {
            if (shutdown.get()) {
                throw new IllegalStateException("Lifecycle manager is shut down");
            }
            if (!started.compareAndSet(false, true)) {
                throw new IllegalStateException("Components already started");
            }

            List<List<String>> layers;
            stateLock.lock();
            try {
                layers = DependencyResolver.resolveLayers(dependencyGraph());
            } catch (ConfigurationException e) {
                started.set(false);
                log.error("Cannot start components: {}", e.getMessage());
                throw e;
            } finally {
                stateLock.unlock();
            }
            log.info("Starting components in {} layers: {}", layers.size(), layers);

            for (List<String> layer : layers) {
                for (String id : layer) {
                    InitializationFailure failure = startComponent(record(id));
                    if (failure != null) {
                        log.error("Startup aborted at [{}], stopping {} started components",
                                id, startOrder.size());
                        stopInReverseOrder();
                        throw new InitializationException(List.of(failure));
                    }
                }
            }

            scheduleHealthChecks();
            log.info("All {} components running", startOrder.size());
        } finally {
            operationLock.unlock();
        }
    }

    /**
     * 启动单个组件
     *
     * @return 失败记录，成功时为 null
     */
    private InitializationFailure startComponent(ComponentRecord record) {
        String id = record.getId();
        Component component = record.getComponent();
        transition(record, ComponentState.INITIALIZING, null);

        DefaultComponentContext context =
                new DefaultComponentContext(id, messageBus, serviceLocator, this::onHealthReport);
        stateLock.lock();
        try {
            record.setContext(context);
        } finally {
            stateLock.unlock();
        }

        long timeoutMs = config.initTimeoutMs(id);
        String failure = null;
        Throwable cause = null;

        Future<Boolean> future = lifecycleExecutor.submit(() -> component.initialize(context));
        try {
            Boolean initialized = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (!Boolean.TRUE.equals(initialized)) {
                failure = "initialize() returned false";
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            failure = "initialize() timed out after " + timeoutMs + "ms";
            cause = e;
            diagnostics.publish(new DiagnosticEvent.LifecycleTimeout(id, "initialize", timeoutMs));
        } catch (ExecutionException e) {
            cause = e.getCause() != null ? e.getCause() : e;
            failure = "initialize() threw " + cause;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            failure = "interrupted while waiting for initialize()";
            cause = e;
        }

        if (failure == null) {
            try {
                for (EventType type : component.subscribedTypes()) {
                    context.subscribe(type, component::handleEvent);
                }
            } catch (RuntimeException e) {
                failure = "subscription failed: " + e.getMessage();
                cause = e;
            }
        }

        if (failure == null) {
            // 初始化期间组件可能已被判定失败（例如契约违规），此时不能进入 RUNNING
            ComponentState previous = null;
            stateLock.lock();
            try {
                if (record.getState() == ComponentState.INITIALIZING) {
                    previous = record.transitionTo(ComponentState.RUNNING);
                    record.setStartedAt(Instant.now());
                    startOrder.add(id);
                } else {
                    failure = "became " + record.getState() + " during initialization"
                            + (record.getFailureReason() != null ? ": " + record.getFailureReason() : "");
                    cause = record.getFailureCause();
                }
            } finally {
                stateLock.unlock();
            }
            if (previous != null) {
                announce(record, previous, ComponentState.RUNNING, null);
                return null;
            }
        }

        log.error("[{}] Initialization failed: {}", id, failure, cause);
        context.close();
        messageBus.removeSubscriber(id);
        stateLock.lock();
        try {
            if (record.getState() != ComponentState.FAILED) {
                record.fail(failure, cause);
            }
        } finally {
            stateLock.unlock();
        }
        transition(record, ComponentState.FAILED, failure);
        return new InitializationFailure(id, failure, cause);
    }

    // ==================== 关闭 ====================

    /**
     * 按启动逆序停止全部组件
     * 单个组件超时或出错只记录日志，不阻塞其余组件
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return; // 已经关闭
        }
        operationLock.lock();
        try {
            cancelHealthChecks();
            stopInReverseOrder();
            healthScheduler.shutdownNow();
            lifecycleExecutor.shutdownNow();
            log.info("Lifecycle manager shut down");
        } finally {
            operationLock.unlock();
        }
    }

    private void stopInReverseOrder() {
        List<String> order;
        stateLock.lock();
        try {
            order = new ArrayList<>(startOrder);
        } finally {
            stateLock.unlock();
        }
        Collections.reverse(order);
        log.info("Stopping {} components: {}", order.size(), order);
        for (String id : order) {
            stopComponent(record(id));
        }
    }

    private void stopComponent(ComponentRecord record) {
        String id = record.getId();
        if (!transition(record, ComponentState.STOPPING, null)) {
            log.debug("[{}] Not active ({}), skipping stop", id, record.getState());
            return;
        }

        // 先取消排队中的投递，再调用 shutdown()
        int discarded = messageBus.removeSubscriber(id);
        if (discarded > 0) {
            log.info("[{}] Discarded {} pending events", id, discarded);
        }
        closeContext(record);

        long timeoutMs = config.shutdownTimeoutMs(id);
        Future<?> future = lifecycleExecutor.submit(record.getComponent()::shutdown);
        try {
            future.get(timeoutMs, TimeUnit.MILLISECONDS);
            markStopped(record, null);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[{}] shutdown() timed out after {}ms, forcing stop", id, timeoutMs);
            diagnostics.publish(new DiagnosticEvent.LifecycleTimeout(id, "shutdown", timeoutMs));
            markStopped(record, "shutdown timed out, forced");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[{}] shutdown() failed: {}", id, cause.getMessage(), cause);
            String reason = "shutdown() threw " + cause;
            stateLock.lock();
            try {
                record.fail(reason, cause);
            } finally {
                stateLock.unlock();
            }
            transition(record, ComponentState.FAILED, reason);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            markStopped(record, "interrupted while waiting for shutdown()");
        }
    }

    private void markStopped(ComponentRecord record, String reason) {
        stateLock.lock();
        try {
            record.setStoppedAt(Instant.now());
        } finally {
            stateLock.unlock();
        }
        transition(record, ComponentState.STOPPED, reason);
    }

    private void closeContext(ComponentRecord record) {
        DefaultComponentContext context = record.getContext();
        if (context != null) {
            context.close();
        }
    }

    // ==================== 健康监督 ====================

    private void scheduleHealthChecks() {
        long interval = config.getLifecycle().getHealthCheckIntervalSeconds();
        if (interval <= 0) {
            log.info("Periodic health checks disabled");
            return;
        }
        healthTask = healthScheduler.scheduleAtFixedRate(this::runHealthCheck, interval, interval, TimeUnit.SECONDS);
    }

    private void cancelHealthChecks() {
        ScheduledFuture<?> task = healthTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    /**
     * 对所有活跃组件执行一次健康检查
     */
    public void runHealthCheck() {
        for (ComponentRecord record : activeRecords()) {
            boolean healthy;
            try {
                healthy = record.getComponent().isHealthy();
            } catch (Exception e) {
                log.warn("[{}] Health check threw: {}", record.getId(), e.getMessage());
                healthy = false;
            }
            if (healthy) {
                recover(record, DegradationSource.HEALTH_CHECK, "health check passed");
            } else {
                degrade(record, DegradationSource.HEALTH_CHECK, "health check failed");
            }
        }
    }

    private List<ComponentRecord> activeRecords() {
        stateLock.lock();
        try {
            return records.values().stream()
                    .filter(r -> r.getState().isActive())
                    .toList();
        } finally {
            stateLock.unlock();
        }
    }

    private void onHealthReport(String componentId, boolean healthy, String reason) {
        ComponentRecord record = findRecord(componentId);
        if (record == null) {
            return;
        }
        if (healthy) {
            recover(record, DegradationSource.REPORTED, reason);
        } else {
            degrade(record, DegradationSource.REPORTED, reason);
        }
    }

    @Override
    public void onSubscriberDegraded(String subscriberId, String reason) {
        ComponentRecord record = findRecord(subscriberId);
        if (record == null) {
            log.warn("[{}] Degraded subscriber is not a managed component: {}", subscriberId, reason);
            return;
        }
        degrade(record, DegradationSource.HANDLER_FAILURES, reason);
    }

    @Override
    public void onSubscriberRecovered(String subscriberId) {
        ComponentRecord record = findRecord(subscriberId);
        if (record != null) {
            recover(record, DegradationSource.HANDLER_FAILURES, "handler succeeded");
        }
    }

    @Override
    public void onContractViolation(String subscriberId, Exception violation) {
        messageBus.removeSubscriber(subscriberId);
        ComponentRecord record = findRecord(subscriberId);
        if (record == null) {
            log.error("[{}] Contract violation by unmanaged subscriber: {}", subscriberId, violation.getMessage());
            return;
        }

        String reason = "contract violation: " + violation.getMessage();
        ComponentState previous;
        stateLock.lock();
        try {
            if (!record.getState().canTransitionTo(ComponentState.FAILED)) {
                log.error("[{}] Contract violation in state {}: {}", subscriberId, record.getState(),
                        violation.getMessage());
                return;
            }
            record.fail(reason, violation);
            previous = record.transitionTo(ComponentState.FAILED);
        } finally {
            stateLock.unlock();
        }
        announce(record, previous, ComponentState.FAILED, reason);
        closeContext(record);

        // 尽力释放组件资源，不等待结果
        lifecycleExecutor.execute(() -> {
            try {
                record.getComponent().shutdown();
            } catch (Exception e) {
                log.warn("[{}] shutdown() after failure threw: {}", subscriberId, e.getMessage());
            }
        });
    }

    private void degrade(ComponentRecord record, DegradationSource source, String reason) {
        ComponentState previous = null;
        stateLock.lock();
        try {
            if (!record.getState().isActive()) {
                return;
            }
            record.addDegradation(source);
            if (record.getState() == ComponentState.RUNNING) {
                previous = record.transitionTo(ComponentState.DEGRADED);
            }
        } finally {
            stateLock.unlock();
        }
        if (previous != null) {
            announce(record, previous, ComponentState.DEGRADED, reason);
        }
    }

    private void recover(ComponentRecord record, DegradationSource source, String reason) {
        ComponentState previous = null;
        stateLock.lock();
        try {
            if (!record.isDegradedBy(source)) {
                return;
            }
            boolean clean = record.clearDegradation(source);
            if (clean && record.getState() == ComponentState.DEGRADED) {
                previous = record.transitionTo(ComponentState.RUNNING);
            }
        } finally {
            stateLock.unlock();
        }
        if (previous != null) {
            announce(record, previous, ComponentState.RUNNING, reason);
        }
    }

    // ==================== 状态迁移 ====================

    /**
     * @return 迁移是否发生
     */
    private boolean transition(ComponentRecord record, ComponentState target, String reason) {
        ComponentState previous;
        stateLock.lock();
        try {
            if (!record.getState().canTransitionTo(target)) {
                return false;
            }
            previous = record.transitionTo(target);
        } finally {
            stateLock.unlock();
        }
        announce(record, previous, target, reason);
        return true;
    }

    private void announce(ComponentRecord record, ComponentState from, ComponentState to, String reason) {
        String id = record.getId();
        if (to == ComponentState.FAILED || to == ComponentState.DEGRADED) {
            log.warn("[{}] {} -> {}{}", id, from, to, reason != null ? " (" + reason + ")" : "");
        } else {
            log.info("[{}] {} -> {}{}", id, from, to, reason != null ? " (" + reason + ")" : "");
        }

        diagnostics.publish(new DiagnosticEvent.ComponentStateChanged(id, from, to, reason));

        if (!messageBus.isAccepting()) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component_id", id);
        payload.put("role", record.getComponent().role().name());
        payload.put("previous_state", from.name());
        payload.put("state", to.name());
        if (reason != null) {
            payload.put("reason", reason);
        }
        try {
            messageBus.publish(Event.of(EventType.SYSTEM_STATUS, SOURCE_ID, payload));
        } catch (IllegalStateException e) {
            log.debug("[{}] Bus shut down, status event not published", id);
        }
    }

    // ==================== 查询 ====================

    private ComponentRecord record(String id) {
        ComponentRecord record = findRecord(id);
        if (record == null) {
            throw new ConfigurationException("Unknown component: " + id);
        }
        return record;
    }

    private ComponentRecord findRecord(String id) {
        stateLock.lock();
        try {
            return records.get(id);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * 全部组件的状态快照，按注册顺序
     */
    public List<ComponentStatus> getStatus() {
        stateLock.lock();
        try {
            return records.values().stream().map(ComponentRecord::toStatus).toList();
        } finally {
            stateLock.unlock();
        }
    }

    public Optional<ComponentStatus> getStatus(String componentId) {
        return Optional.ofNullable(findRecord(componentId)).map(r -> {
            stateLock.lock();
            try {
                return r.toStatus();
            } finally {
                stateLock.unlock();
            }
        });
    }

    public Optional<ComponentState> getState(String componentId) {
        return getStatus(componentId).map(ComponentStatus::state);
    }

    /**
     * 实际完成启动的顺序
     */
    public List<String> getStartOrder() {
        stateLock.lock();
        try {
            return List.copyOf(startOrder);
        } finally {
            stateLock.unlock();
        }
    }

    public boolean isStarted() {
        return started.get();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }
}
