package com.smartsense.core.lifecycle;

import com.smartsense.api.component.ComponentRole;
import com.smartsense.api.component.ComponentState;
import jakarta.annotation.Nonnull;

import java.time.Instant;
import java.util.Set;

/**
 * 组件状态快照（只读）
 */
public record ComponentStatus(String componentId,
                              ComponentRole role,
                              ComponentState state,
                              Set<String> dependencies,
                              Instant registeredAt,
                              Instant startedAt,
                              Instant stoppedAt,
                              Instant lastTransitionAt,
                              String failureReason) {

    @Override
    @Nonnull
    public String toString() {
        return String.format("ComponentStatus{id=%s, role=%s, state=%s, dependencies=%s%s}",
                componentId, role, state, dependencies,
                failureReason != null ? ", failure=" + failureReason : "");
    }
}
