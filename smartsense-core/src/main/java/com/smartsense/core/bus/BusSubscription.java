package com.smartsense.core.bus;

import com.smartsense.api.context.EventSubscription;
import com.smartsense.api.event.EventType;

/**
 * 订阅句柄：只保存订阅 ID 与总线的弱关联，不持有订阅表
 */
final class BusSubscription implements EventSubscription {

    private final MessageBus bus;
    private final String subscriptionId;
    private final String subscriberId;
    private final EventType eventType;

    BusSubscription(MessageBus bus, SubscriptionEntry entry) {
        this.bus = bus;
        this.subscriptionId = entry.getSubscriptionId();
        this.subscriberId = entry.getSubscriberId();
        this.eventType = entry.getEventType();
    }

    @Override
    public String subscriptionId() {
        return subscriptionId;
    }

    @Override
    public String subscriberId() {
        return subscriberId;
    }

    @Override
    public EventType eventType() {
        return eventType;
    }

    @Override
    public void unsubscribe() {
        bus.unsubscribe(this);
    }

    @Override
    public String toString() {
        return "Subscription{" + subscriberId + " -> " + eventType + ", id=" + subscriptionId + "}";
    }
}
