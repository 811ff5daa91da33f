package com.smartsense.api.event;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 总线上流转的不可变事件
 * <p>
 * 负载在创建时被深度复制为只读结构（嵌套的 Map / List / Set 同样只读），
 * 发布后任何组件都无法修改，订阅者之间也不会共享可变状态。
 * correlationId 用于在异步边界上关联请求与响应，响应事件必须原样携带。
 * </p>
 */
public record Event(String eventId,
                    EventType type,
                    Map<String, Object> payload,
                    String sourceComponentId,
                    String correlationId,
                    Instant timestamp) {

    public Event {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sourceComponentId, "sourceComponentId");
        eventId = eventId != null ? eventId : UUID.randomUUID().toString();
        correlationId = correlationId != null ? correlationId : UUID.randomUUID().toString();
        timestamp = timestamp != null ? timestamp : Instant.now();
        payload = payload == null || payload.isEmpty()
                ? Collections.emptyMap()
                : freezeMap(payload);
    }

    // ==================== 只读复制 ====================

    private static <K> Map<K, Object> freezeMap(Map<K, ?> source) {
        Map<K, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(freeze(item)));
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            set.forEach(item -> copy.add(freeze(item)));
            return Collections.unmodifiableSet(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(item -> copy.add(freeze(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * 创建新的请求链起点（生成新的 correlationId）
     */
    public static Event of(EventType type, String source, Map<String, Object> payload) {
        return new Event(null, type, payload, source, null, null);
    }

    /**
     * 在已有请求链上创建事件
     */
    public static Event correlated(EventType type, String source, Map<String, Object> payload,
                                   String correlationId) {
        return new Event(null, type, payload, source, correlationId, null);
    }

    /**
     * 创建因果相关的响应事件，correlationId 保持不变
     */
    public Event reply(EventType replyType, String source, Map<String, Object> replyPayload) {
        return new Event(null, replyType, replyPayload, source, correlationId, null);
    }

    /**
     * 读取负载字段
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key, Class<T> valueType) {
        Object value = payload.get(key);
        if (valueType.isInstance(value)) {
            return Optional.of((T) value);
        }
        return Optional.empty();
    }

    public Optional<String> getString(String key) {
        return get(key, String.class);
    }

    @Override
    public String toString() {
        return String.format("Event{id=%s, type=%s, source=%s, correlation=%s}",
                eventId, type, sourceComponentId, correlationId);
    }
}
