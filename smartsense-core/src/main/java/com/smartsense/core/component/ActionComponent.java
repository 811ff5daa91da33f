package com.smartsense.core.component;

import com.smartsense.api.action.ActionOutcome;
import com.smartsense.api.action.ActionRequest;
import com.smartsense.api.action.ActionResult;
import com.smartsense.api.component.ComponentRole;
import com.smartsense.api.context.ComponentContext;
import com.smartsense.api.event.Event;
import com.smartsense.api.event.EventType;
import com.smartsense.api.exception.PermissionDeniedException;
import com.smartsense.api.security.ActionPermissionPolicy;
import com.smartsense.core.spi.ActionExecutor;
import jakarta.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 动作组件：执行 EXECUTE_ACTION 请求，并以 ACTION_RESULT 响应（相同 correlationId）
 * <p>
 * 执行前必须通过权限策略；被拒绝的请求不会到达执行器，结果为 PERMISSION_DENIED。
 * 动作在组件自己的单线程工作池上按到达顺序执行，不占用总线派发线程；
 * 每个请求都会得到一个 ACTION_RESULT，包括队列已满被拒绝的请求。
 */
@Slf4j
public class ActionComponent extends AbstractComponent {

    private static final int DEFAULT_HISTORY_SIZE = 1000;
    private static final int DEFAULT_QUEUE_CAPACITY = 100;

    private final ActionExecutor executor;
    private final ActionPermissionPolicy permissionPolicy;
    private final int historySize;

    private volatile ThreadPoolExecutor worker;

    // guarded by itself
    private final Deque<ActionRecord> history = new ArrayDeque<>();

    public ActionComponent(String id, ActionExecutor executor, ActionPermissionPolicy permissionPolicy) {
        this(id, executor, permissionPolicy, Set.of(), DEFAULT_HISTORY_SIZE);
    }

    public ActionComponent(String id, ActionExecutor executor, ActionPermissionPolicy permissionPolicy,
                           Set<String> dependencies, int historySize) {
        super(id, ComponentRole.ACTION, Set.of(EventType.EXECUTE_ACTION), dependencies);
        this.executor = Objects.requireNonNull(executor, "executor");
        this.permissionPolicy = Objects.requireNonNull(permissionPolicy, "permissionPolicy");
        this.historySize = historySize;
    }

    @Override
    protected boolean doInitialize(ComponentContext context) {
        worker = new ThreadPoolExecutor(
                1,
                1,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(DEFAULT_QUEUE_CAPACITY), // 有界队列
                r -> {
                    Thread t = new Thread(r, "smartsense-" + id() + "-action");
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
        return true;
    }

    @Override
    protected void doShutdown() {
        ThreadPoolExecutor pool = worker;
        if (pool == null) {
            return;
        }
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[{}] Action worker did not terminate in time", id());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    protected Optional<Event> onEvent(Event event) {
        try {
            worker.execute(() -> {
                ActionResult result;
                try {
                    result = execute(event);
                } catch (RuntimeException e) {
                    log.error("[{}] Action processing failed on {}: {}", id(), event, e.getMessage(), e);
                    result = ActionResult.failed(event.getString(ActionRequest.KEY_COMMAND).orElse("unknown"),
                            String.valueOf(e.getMessage()), 0L);
                }
                respond(event, result);
            });
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Action queue full, rejecting {}", id(), event);
            respond(event, ActionResult.failed(event.getString(ActionRequest.KEY_COMMAND).orElse("unknown"),
                    "Action queue full", 0L));
        }
        return Optional.empty();
    }

    private void respond(Event event, ActionResult result) {
        record(event, result);
        publish(event.reply(EventType.ACTION_RESULT, id(), result.toPayload()));
    }

    private ActionResult execute(Event event) {
        ActionRequest request;
        try {
            request = ActionRequest.fromEvent(event);
        } catch (RuntimeException e) {
            log.warn("[{}] Malformed action request {}: {}", id(), event, e.getMessage());
            return ActionResult.failed(event.getString(ActionRequest.KEY_COMMAND).orElse("unknown"),
                    "Malformed action request: " + e.getMessage(), 0L);
        }

        String command = request.command();
        try {
            permissionPolicy.check(id(), command, request.permissionLevel());
        } catch (PermissionDeniedException e) {
            log.warn("[{}] Action [{}] denied: {}", id(), command, e.getMessage());
            return ActionResult.denied(command, e.getMessage());
        }

        if (!executor.supports(command)) {
            log.warn("[{}] Unknown command: {}", id(), command);
            return ActionResult.failed(command, "Unknown command: " + command, 0L);
        }

        log.info("[{}] Executing action: {}", id(), command);
        long start = System.nanoTime();
        try {
            Map<String, Object> data = executor.execute(request);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.info("[{}] Action [{}] succeeded in {}ms", id(), command, elapsedMs);
            return ActionResult.success(command, data, elapsedMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ActionResult.failed(command, "Interrupted", (System.nanoTime() - start) / 1_000_000);
        } catch (Exception e) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.error("[{}] Action [{}] failed: {}", id(), command, e.getMessage(), e);
            return ActionResult.failed(command, String.valueOf(e.getMessage()), elapsedMs);
        }
    }

    @Override
    public boolean isHealthy() {
        ThreadPoolExecutor pool = worker;
        return pool != null && !pool.isShutdown();
    }

    // ==================== 历史与统计 ====================

    private void record(Event event, ActionResult result) {
        if (historySize <= 0) {
            return;
        }
        synchronized (history) {
            history.addLast(new ActionRecord(Instant.now(), event.eventId(), event.correlationId(), result));
            while (history.size() > historySize) {
                history.pollFirst();
            }
        }
    }

    /**
     * 最近的动作记录，按时间先后
     *
     * @param limit 最多返回条数，小于等于 0 表示全部
     */
    public List<ActionRecord> getHistory(int limit) {
        synchronized (history) {
            List<ActionRecord> all = new ArrayList<>(history);
            if (limit <= 0 || limit >= all.size()) {
                return all;
            }
            return new ArrayList<>(all.subList(all.size() - limit, all.size()));
        }
    }

    public ActionStats getStats() {
        List<ActionRecord> snapshot = getHistory(0);
        int total = snapshot.size();
        int succeeded = 0;
        int denied = 0;
        long totalTimeMs = 0;
        for (ActionRecord record : snapshot) {
            ActionOutcome outcome = record.result().outcome();
            if (outcome == ActionOutcome.SUCCESS) {
                succeeded++;
            } else if (outcome == ActionOutcome.PERMISSION_DENIED) {
                denied++;
            }
            totalTimeMs += record.result().executionTimeMs();
        }
        double successRate = total == 0 ? 0.0 : (double) succeeded / total;
        double averageTimeMs = total == 0 ? 0.0 : (double) totalTimeMs / total;
        return new ActionStats(total, succeeded, total - succeeded - denied, denied, successRate, averageTimeMs);
    }

    public record ActionRecord(Instant timestamp, String eventId, String correlationId, ActionResult result) {
    }

    public record ActionStats(int totalActions,
                              int successfulActions,
                              int failedActions,
                              int deniedActions,
                              double successRate,
                              double averageExecutionTimeMs) {
        @Override
        @Nonnull
        public String toString() {
            return String.format("ActionStats{total=%d, success=%d, failed=%d, denied=%d, successRate=%.2f}",
                    totalActions, successfulActions, failedActions, deniedActions, successRate);
        }
    }
}
