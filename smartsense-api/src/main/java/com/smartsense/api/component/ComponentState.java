package com.smartsense.api.component;

import java.util.EnumSet;
import java.util.Set;

/**
 * 组件生命周期状态
 * <pre>
 * REGISTERED → INITIALIZING → RUNNING → STOPPING → STOPPED
 *                    ↓           ↕ DEGRADED
 *                  FAILED
 * </pre>
 */
public enum ComponentState {
    REGISTERED,
    INITIALIZING,
    RUNNING,
    DEGRADED,
    STOPPING,
    STOPPED,
    FAILED;

    private Set<ComponentState> next;

    static {
        REGISTERED.next = EnumSet.of(INITIALIZING);
        INITIALIZING.next = EnumSet.of(RUNNING, FAILED);
        RUNNING.next = EnumSet.of(DEGRADED, STOPPING, FAILED);
        DEGRADED.next = EnumSet.of(RUNNING, STOPPING, FAILED);
        STOPPING.next = EnumSet.of(STOPPED, FAILED);
        STOPPED.next = EnumSet.noneOf(ComponentState.class);
        FAILED.next = EnumSet.noneOf(ComponentState.class);
    }

    public boolean canTransitionTo(ComponentState target) {
        return next.contains(target);
    }

    /**
     * 是否处于活跃状态（订阅仍然有效）
     */
    public boolean isActive() {
        return this == RUNNING || this == DEGRADED;
    }

    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
