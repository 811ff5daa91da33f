package com.smartsense.core.context;

import com.smartsense.api.context.ComponentContext;
import com.smartsense.api.context.EventHandler;
import com.smartsense.api.context.EventSubscription;
import com.smartsense.api.event.Event;
import com.smartsense.api.event.EventType;
import com.smartsense.core.bus.MessageBus;
import com.smartsense.core.locator.ServiceLocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * 组件上下文的默认实现
 * 组件只能通过它访问总线和共享服务；组件停止后上下文被关闭，之后的发布被忽略
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultComponentContext implements ComponentContext {

    private final String componentId;
    private final MessageBus messageBus;
    private final ServiceLocator serviceLocator;
    private final ComponentHealthReporter healthReporter;

    // 通过本上下文建立的订阅，关闭时统一取消
    private final List<EventSubscription> subscriptions = new CopyOnWriteArrayList<>();

    private volatile boolean closed = false;

    @Override
    public String getComponentId() {
        return componentId;
    }

    @Override
    public int publish(Event event) {
        if (closed) {
            log.debug("[{}] Context closed, event not published: {}", componentId, event);
            return 0;
        }
        try {
            return messageBus.publish(event);
        } catch (IllegalStateException e) {
            log.debug("[{}] Bus shut down, event not published: {}", componentId, event);
            return 0;
        }
    }

    @Override
    public EventSubscription subscribe(EventType type, EventHandler handler) {
        return subscribe(type, handler, null);
    }

    @Override
    public EventSubscription subscribe(EventType type, EventHandler handler, Predicate<Event> filter) {
        if (closed) {
            throw new IllegalStateException("Context of component [" + componentId + "] is closed");
        }
        EventSubscription subscription = messageBus.subscribe(type, componentId, handler, filter);
        subscriptions.add(subscription);
        return subscription;
    }

    @Override
    public <T> Optional<T> getService(Class<T> serviceClass) {
        return serviceLocator.get(serviceClass);
    }

    @Override
    public <T> Optional<T> getService(String name, Class<T> serviceClass) {
        return serviceLocator.get(name, serviceClass);
    }

    @Override
    public void reportHealth(boolean healthy, String reason) {
        if (closed) {
            return;
        }
        healthReporter.report(componentId, healthy, reason);
    }

    /**
     * 关闭上下文并取消其全部订阅
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (messageBus.isAccepting()) {
            subscriptions.forEach(EventSubscription::unsubscribe);
        }
        subscriptions.clear();
        log.debug("[{}] Component context closed", componentId);
    }

    public boolean isClosed() {
        return closed;
    }
}
