package com.smartsense.core.bus;

/**
 * 订阅者健康回调（由生命周期管理器实现）
 */
public interface SubscriberHealthListener {

    /**
     * 连续失败次数达到阈值
     */
    void onSubscriberDegraded(String subscriberId, String reason);

    /**
     * 降级后的订阅者再次成功处理事件
     */
    void onSubscriberRecovered(String subscriberId);

    /**
     * 订阅者违反组件契约（例如未初始化就收到事件），属于致命配置错误
     */
    void onContractViolation(String subscriberId, Exception violation);
}
