package com.smartsense.api.context;

import com.smartsense.api.event.Event;
import com.smartsense.api.event.EventType;

import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 组件上下文
 * 组件与运行时交互的唯一入口：发布/订阅事件、获取共享服务、上报健康状态。
 * 组件之间不持有彼此的引用。
 */
public interface ComponentContext {

    /**
     * 当前组件 ID
     */
    String getComponentId();

    /**
     * 发布事件
     *
     * @return 接收该事件的订阅者数量
     */
    int publish(Event event);

    /**
     * 以当前组件为来源创建新事件并发布
     */
    default int publish(EventType type, Map<String, Object> payload) {
        return publish(Event.of(type, getComponentId(), payload));
    }

    /**
     * 以当前组件身份订阅事件
     *
     * @return 订阅句柄，取消订阅时使用
     */
    EventSubscription subscribe(EventType type, EventHandler handler);

    /**
     * 带过滤条件的订阅
     */
    EventSubscription subscribe(EventType type, EventHandler handler, Predicate<Event> filter);

    /**
     * 按类型获取共享服务
     */
    <T> Optional<T> getService(Class<T> serviceClass);

    /**
     * 按名称获取共享服务
     */
    <T> Optional<T> getService(String name, Class<T> serviceClass);

    /**
     * 上报组件健康状态变化（DEGRADED / 恢复 RUNNING）
     */
    void reportHealth(boolean healthy, String reason);
}
