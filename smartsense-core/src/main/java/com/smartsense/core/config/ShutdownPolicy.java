package com.smartsense.core.config;

/**
 * 总线关闭时对积压事件的处理方式
 */
public enum ShutdownPolicy {
    /**
     * 在 drainTimeoutMs 内继续派发积压事件
     */
    DRAIN,
    /**
     * 直接丢弃积压事件（默认）
     */
    DISCARD
}
