package com.smartsense.core.config;

/**
 * 订阅者队列已满时的处理策略
 */
public enum BackpressurePolicy {
    /**
     * 丢弃队首最旧的事件，保证新输入能进入（默认）
     */
    DROP_OLDEST,
    /**
     * 丢弃刚发布的事件
     */
    DROP_NEWEST,
    /**
     * 阻塞发布方，超过 blockTimeoutMs 后丢弃刚发布的事件
     */
    BLOCK
}
