package com.smartsense.core.bus;

import com.smartsense.api.context.EventHandler;
import com.smartsense.api.event.Event;
import com.smartsense.api.event.EventType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Predicate;

/**
 * 订阅表中的一条记录
 * 同一 (subscriberId, eventType) 重复订阅时原地替换处理器，已排队的事件交给新处理器
 */
@Slf4j
@Getter
final class SubscriptionEntry {

    private final String subscriptionId;
    private final String subscriberId;
    private final EventType eventType;

    private volatile EventHandler handler;
    private volatile Predicate<Event> filter;
    private volatile boolean active = true;

    SubscriptionEntry(String subscriptionId, String subscriberId, EventType eventType,
                      EventHandler handler, Predicate<Event> filter) {
        this.subscriptionId = subscriptionId;
        this.subscriberId = subscriberId;
        this.eventType = eventType;
        this.handler = handler;
        this.filter = filter;
    }

    void replace(EventHandler newHandler, Predicate<Event> newFilter) {
        this.handler = newHandler;
        this.filter = newFilter;
    }

    void deactivate() {
        this.active = false;
    }

    /**
     * 过滤器本身抛异常时照常投递
     */
    boolean accepts(Event event) {
        Predicate<Event> current = filter;
        if (current == null) {
            return true;
        }
        try {
            return current.test(event);
        } catch (RuntimeException e) {
            log.warn("[{}] Subscription filter failed on {}, delivering anyway: {}",
                    subscriberId, event, e.getMessage());
            return true;
        }
    }
}
