package com.smartsense.core.diagnostic;

import com.smartsense.api.component.ComponentState;
import com.smartsense.api.event.Event;
import com.smartsense.api.security.PermissionLevel;

/**
 * 运行时诊断事件（可观测性出口）
 * 注意：这是内核内部信号，不经过消息总线，也不投递给业务组件
 */
public sealed interface DiagnosticEvent {

    String componentId();

    // ===== 生命周期 =====

    /**
     * 组件状态迁移
     */
    record ComponentStateChanged(String componentId, ComponentState from, ComponentState to,
                                 String reason) implements DiagnosticEvent {
    }

    /**
     * initialize / shutdown 超时
     */
    record LifecycleTimeout(String componentId, String phase, long timeoutMs) implements DiagnosticEvent {
    }

    // ===== 投递 =====

    /**
     * 订阅者队列已满，事件被丢弃
     */
    record EventDropped(String componentId, Event event, String reason) implements DiagnosticEvent {
    }

    /**
     * 订阅者处理事件失败
     */
    record HandlerFailed(String componentId, Event event, int consecutiveFailures,
                         Throwable error) implements DiagnosticEvent {
    }

    /**
     * 订阅者单次处理超时（处理仍在进行）
     */
    record HandlerTimeout(String componentId, Event event, long elapsedMs, long timeoutMs) implements DiagnosticEvent {
    }

    // ===== 安全 =====

    /**
     * 动作权限判定
     */
    record PermissionDecision(String componentId, String command, PermissionLevel level,
                              boolean allowed, String reason) implements DiagnosticEvent {
    }
}
