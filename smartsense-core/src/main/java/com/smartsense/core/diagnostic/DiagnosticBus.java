package com.smartsense.core.diagnostic;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 诊断事件总线
 * <p>
 * 特点：
 * - 同步派发（保证顺序）
 * - 监听器异常被隔离，不影响内核
 * - 轻量级
 */
@Slf4j
public class DiagnosticBus {

    private final List<Listener<?>> listeners = new CopyOnWriteArrayList<>();

    /**
     * 订阅诊断事件，传入 {@code DiagnosticEvent.class} 可接收全部类型
     */
    public <E extends DiagnosticEvent> Subscription subscribe(Class<E> eventType, Consumer<E> handler) {
        Listener<E> listener = new Listener<>(eventType, handler);
        listeners.add(listener);
        log.debug("Diagnostic listener subscribed to {}", eventType.getSimpleName());
        return () -> listeners.remove(listener);
    }

    /**
     * 发布诊断事件
     */
    @SuppressWarnings("unchecked")
    public void publish(DiagnosticEvent event) {
        for (Listener<?> listener : listeners) {
            if (listener.eventType.isInstance(event)) {
                try {
                    ((Listener<DiagnosticEvent>) listener).handler.accept(event);
                } catch (Exception e) {
                    log.error("[{}] Diagnostic listener failed on {}: {}",
                            event.componentId(), event.getClass().getSimpleName(), e.getMessage(), e);
                }
            }
        }
    }

    public void clear() {
        listeners.clear();
    }

    public int getSubscriptionCount() {
        return listeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private record Listener<E extends DiagnosticEvent>(Class<E> eventType, Consumer<E> handler) {
    }
}
