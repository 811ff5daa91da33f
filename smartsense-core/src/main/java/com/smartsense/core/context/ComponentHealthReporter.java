package com.smartsense.core.context;

/**
 * 组件主动上报健康状态的回调（由生命周期管理器实现）
 */
@FunctionalInterface
public interface ComponentHealthReporter {

    void report(String componentId, boolean healthy, String reason);
}
