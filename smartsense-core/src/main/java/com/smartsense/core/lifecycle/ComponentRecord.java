package com.smartsense.core.lifecycle;

import com.smartsense.api.component.Component;
import com.smartsense.api.component.ComponentState;
import com.smartsense.core.context.DefaultComponentContext;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * 生命周期管理器持有的组件记录
 * 所有可变字段只在 LifecycleManager 的状态锁内修改
 */
@Getter
final class ComponentRecord {

    /**
     * 降级来源：全部清除后才回到 RUNNING
     */
    enum DegradationSource {
        HANDLER_FAILURES,
        HEALTH_CHECK,
        REPORTED
    }

    private final Component component;
    private final Set<String> dependencies;
    private final Instant registeredAt = Instant.now();

    private ComponentState state = ComponentState.REGISTERED;
    private Instant lastTransitionAt = registeredAt;

    @Setter(AccessLevel.PACKAGE)
    private Instant startedAt;

    @Setter(AccessLevel.PACKAGE)
    private Instant stoppedAt;

    private String failureReason;
    private Throwable failureCause;

    @Setter(AccessLevel.PACKAGE)
    private DefaultComponentContext context;

    @Getter(AccessLevel.NONE)
    private final Set<DegradationSource> degradation = EnumSet.noneOf(DegradationSource.class);

    ComponentRecord(Component component) {
        this.component = component;
        Set<String> declared = component.declaredDependencies();
        this.dependencies = declared == null ? Set.of() : Set.copyOf(declared);
    }

    String getId() {
        return component.id();
    }

    /**
     * 状态迁移
     *
     * @return 迁移前的状态
     * @throws IllegalStateException 非法迁移
     */
    ComponentState transitionTo(ComponentState target) {
        ComponentState previous = state;
        if (!previous.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Illegal transition for component [" + getId() + "]: " + previous + " -> " + target);
        }
        state = target;
        lastTransitionAt = Instant.now();
        return previous;
    }

    void fail(String reason, Throwable cause) {
        this.failureReason = reason;
        this.failureCause = cause;
    }

    void addDegradation(DegradationSource source) {
        degradation.add(source);
    }

    /**
     * @return 移除后是否已无任何降级来源
     */
    boolean clearDegradation(DegradationSource source) {
        return degradation.remove(source) && degradation.isEmpty();
    }

    boolean isDegradedBy(DegradationSource source) {
        return degradation.contains(source);
    }

    ComponentStatus toStatus() {
        return new ComponentStatus(getId(), component.role(), state, dependencies,
                registeredAt, startedAt, stoppedAt, lastTransitionAt, failureReason);
    }
}
