package com.smartsense.core.locator;

import com.smartsense.api.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 共享服务定位器
 * 职责：按类型或名称登记单例服务（总线、配置、权限策略、共享缓存等），供组件通过上下文查找
 * <p>
 * 读无锁，写串行；由运行时显式创建，不是全局单例
 */
@Slf4j
public class ServiceLocator {

    // 类型 -> 实例
    private final Map<Class<?>, Object> byType = new ConcurrentHashMap<>();

    // 名称 -> 实例
    private final Map<String, Object> byName = new ConcurrentHashMap<>();

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile boolean sealed = false;

    // ==================== 注册 ====================

    /**
     * 按类型注册
     *
     * @throws ConfigurationException 类型已注册或已封存
     */
    public <T> void register(Class<T> type, T instance) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(instance, "instance");
        writeLock.lock();
        try {
            checkNotSealed(type.getName());
            if (byType.containsKey(type)) {
                throw new ConfigurationException("Service already registered for type " + type.getName());
            }
            byType.put(type, instance);
            log.debug("Registered service: {}", type.getName());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 按名称注册
     *
     * @throws ConfigurationException 名称已注册或已封存
     */
    public void register(String name, Object instance) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Service name cannot be blank");
        }
        Objects.requireNonNull(instance, "instance");
        writeLock.lock();
        try {
            checkNotSealed(name);
            if (byName.containsKey(name)) {
                throw new ConfigurationException("Service already registered under name [" + name + "]");
            }
            byName.put(name, instance);
            log.debug("Registered service: {}", name);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 封存：引导阶段结束后不再接受注册
     */
    public void seal() {
        writeLock.lock();
        try {
            sealed = true;
        } finally {
            writeLock.unlock();
        }
        log.info("Service locator sealed with {} typed and {} named services", byType.size(), byName.size());
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkNotSealed(String key) {
        if (sealed) {
            throw new ConfigurationException("Service locator is sealed, cannot register " + key);
        }
    }

    // ==================== 查询 ====================

    public <T> Optional<T> get(Class<T> type) {
        return Optional.ofNullable(byType.get(type)).map(type::cast);
    }

    /**
     * 按名称查找，实例类型不匹配时视为不存在
     */
    public <T> Optional<T> get(String name, Class<T> type) {
        Object instance = byName.get(name);
        if (instance == null) {
            return Optional.empty();
        }
        if (!type.isInstance(instance)) {
            log.warn("Service [{}] is a {}, not a {}", name, instance.getClass().getName(), type.getName());
            return Optional.empty();
        }
        return Optional.of(type.cast(instance));
    }

    /**
     * 获取服务（必须存在）
     */
    public <T> T getRequired(Class<T> type) {
        return get(type).orElseThrow(() ->
                new ConfigurationException("Required service not registered: " + type.getName()));
    }

    public <T> T getRequired(String name, Class<T> type) {
        return get(name, type).orElseThrow(() ->
                new ConfigurationException("Required service not registered: " + name));
    }

    public Set<String> getServiceNames() {
        return Set.copyOf(byName.keySet());
    }

    public int size() {
        return byType.size() + byName.size();
    }
}
