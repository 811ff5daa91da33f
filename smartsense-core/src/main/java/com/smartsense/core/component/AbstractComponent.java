package com.smartsense.core.component;

import com.smartsense.api.component.Component;
import com.smartsense.api.component.ComponentRole;
import com.smartsense.api.context.ComponentContext;
import com.smartsense.api.event.Event;
import com.smartsense.api.event.EventType;
import com.smartsense.api.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 组件基类
 * <p>
 * 负责契约检查：
 * - initialize() 成功之前收到事件属于契约违规，抛出 ConfigurationException
 * - shutdown() 之后收到的事件直接忽略
 * - initialize() / shutdown() 重复调用无副作用
 */
@Slf4j
public abstract class AbstractComponent implements Component {

    private final String id;
    private final ComponentRole role;
    private final Set<EventType> subscribedTypes;
    private final Set<String> dependencies;

    private volatile ComponentContext context;
    private volatile boolean initialized = false;
    private volatile boolean stopped = false;

    protected AbstractComponent(String id, ComponentRole role, Set<EventType> subscribedTypes,
                                Set<String> dependencies) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Component id cannot be blank");
        }
        this.id = id;
        this.role = Objects.requireNonNull(role, "role");
        this.subscribedTypes = subscribedTypes == null ? Set.of() : Set.copyOf(subscribedTypes);
        this.dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ComponentRole role() {
        return role;
    }

    @Override
    public Set<String> declaredDependencies() {
        return dependencies;
    }

    @Override
    public Set<EventType> subscribedTypes() {
        return subscribedTypes;
    }

    @Override
    public final boolean initialize(ComponentContext context) {
        if (initialized) {
            log.debug("[{}] Already initialized", id);
            return true;
        }
        this.context = Objects.requireNonNull(context, "context");
        boolean ok = doInitialize(context);
        if (ok) {
            initialized = true;
            log.info("[{}] Initialized", id);
            onInitialized();
        } else {
            log.warn("[{}] Initialization reported failure", id);
        }
        return ok;
    }

    @Override
    public final void shutdown() {
        if (stopped) {
            return;
        }
        stopped = true;
        doShutdown();
        log.info("[{}] Shut down", id);
    }

    @Override
    public final Optional<Event> handleEvent(Event event) throws Exception {
        if (!initialized) {
            throw new ConfigurationException(
                    "Component [" + id + "] received " + event.type() + " before initialize()");
        }
        if (stopped) {
            log.debug("[{}] Stopped, ignoring {}", id, event);
            return Optional.empty();
        }
        return onEvent(event);
    }

    // ==================== 子类扩展点 ====================

    /**
     * 初始化资源
     *
     * @return 是否成功
     */
    protected boolean doInitialize(ComponentContext context) {
        return true;
    }

    /**
     * initialize() 成功之后调用，此时组件已可以发布事件
     */
    protected void onInitialized() {
    }

    protected void doShutdown() {
    }

    /**
     * 处理事件，只在已初始化且未停止时调用
     */
    protected abstract Optional<Event> onEvent(Event event) throws Exception;

    // ==================== 辅助方法 ====================

    protected ComponentContext context() {
        ComponentContext current = context;
        if (current == null) {
            throw new IllegalStateException("Component [" + id + "] is not initialized");
        }
        return current;
    }

    /**
     * 发布事件，未初始化或已停止时忽略
     *
     * @return 接收该事件的订阅者数量
     */
    protected int publish(Event event) {
        if (!isRunning()) {
            log.debug("[{}] Not running, event not published: {}", id, event);
            return 0;
        }
        return context.publish(event);
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isStopped() {
        return stopped;
    }

    public boolean isRunning() {
        return initialized && !stopped;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", role=" + role + "}";
    }
}
