package com.smartsense.api.context;

import com.smartsense.api.event.EventType;

/**
 * 订阅句柄
 * 只是指向总线订阅表的索引，持有者不拥有总线。
 */
public interface EventSubscription {

    String subscriptionId();

    String subscriberId();

    EventType eventType();

    void unsubscribe();
}
