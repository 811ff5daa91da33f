package com.smartsense.core.config;

import com.smartsense.api.exception.ConfigurationException;
import com.smartsense.api.security.PermissionLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SmartSense 全局配置 (对应 smartsense.yml 根节点)
 * <p>
 * 启动时加载一次，之后在进程生命周期内视为不可变。包含：
 * 1. 消息总线参数 (队列容量、背压策略、失败阈值)
 * 2. 生命周期参数 (超时、健康检查间隔)
 * 3. 动作安全策略
 * 4. 组件开关与单组件超时
 */
@Getter
@Setter
@ToString
public class SmartSenseConfig {

    private String name = "SmartSense";

    private BusSettings bus = new BusSettings();

    private LifecycleSettings lifecycle = new LifecycleSettings();

    private SecuritySettings security = new SecuritySettings();

    // Key=组件 ID
    private Map<String, ComponentSettings> components = new LinkedHashMap<>();

    public static SmartSenseConfig defaults() {
        return new SmartSenseConfig();
    }

    /**
     * 组件是否启用（未配置的组件默认启用）
     */
    public boolean isComponentEnabled(String componentId) {
        ComponentSettings settings = components.get(componentId);
        return settings == null || settings.isEnabled();
    }

    /**
     * 组件 initialize() 超时，未单独配置时取全局默认值
     */
    public long initTimeoutMs(String componentId) {
        ComponentSettings settings = components.get(componentId);
        if (settings != null && settings.getInitTimeoutMs() > 0) {
            return settings.getInitTimeoutMs();
        }
        return lifecycle.getInitTimeoutMs();
    }

    /**
     * 组件 shutdown() 超时，未单独配置时取全局默认值
     */
    public long shutdownTimeoutMs(String componentId) {
        ComponentSettings settings = components.get(componentId);
        if (settings != null && settings.getShutdownTimeoutMs() > 0) {
            return settings.getShutdownTimeoutMs();
        }
        return lifecycle.getShutdownTimeoutMs();
    }

    /**
     * 校验
     */
    public void validate() {
        if (bus == null || lifecycle == null || security == null) {
            throw new ConfigurationException("bus, lifecycle and security sections are required");
        }
        if (bus.getQueueCapacity() < 1 || bus.getQueueCapacity() > 10_000) {
            throw new ConfigurationException("bus.queueCapacity must be within [1, 10000]: " + bus.getQueueCapacity());
        }
        if (bus.getFailureThreshold() < 1) {
            throw new ConfigurationException("bus.failureThreshold must be positive: " + bus.getFailureThreshold());
        }
        if (bus.getDispatchThreads() < 1) {
            throw new ConfigurationException("bus.dispatchThreads must be positive: " + bus.getDispatchThreads());
        }
        if (bus.getHandlerTimeoutMs() < 0) {
            throw new ConfigurationException("bus.handlerTimeoutMs must not be negative: " + bus.getHandlerTimeoutMs());
        }
        if (bus.getBackpressure() == null) {
            throw new ConfigurationException("bus.backpressure is required");
        }
        if (lifecycle.getInitTimeoutMs() <= 0 || lifecycle.getShutdownTimeoutMs() <= 0) {
            throw new ConfigurationException("lifecycle timeouts must be positive");
        }
        for (String level : security.getAllowList().keySet()) {
            try {
                PermissionLevel.parse(level);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown permission level in security.allowList: " + level, e);
            }
        }
        if (components == null) {
            components = new LinkedHashMap<>();
        }
    }

    // ==================== 嵌套类 ====================

    /**
     * 消息总线配置
     */
    @Getter
    @Setter
    @ToString
    public static class BusSettings {

        /**
         * 每个订阅者队列容量
         */
        private int queueCapacity = 1000;

        private BackpressurePolicy backpressure = BackpressurePolicy.DROP_OLDEST;

        /**
         * BLOCK 策略下发布方最长等待时间
         */
        private long blockTimeoutMs = 500;

        /**
         * 连续失败多少次后标记为 DEGRADED
         */
        private int failureThreshold = 3;

        /**
         * 常驻派发线程数；处理器阻塞时线程池会按需扩容，上限为订阅者数量
         */
        private int dispatchThreads = 4;

        /**
         * 单次处理超过该时长时上报订阅者降级（0 表示关闭看门狗）
         */
        private long handlerTimeoutMs = 30_000;

        /**
         * 事件历史容量（用于回放，0 表示关闭）
         */
        private int historySize = 1000;

        private ShutdownPolicy shutdownPolicy = ShutdownPolicy.DISCARD;

        private long drainTimeoutMs = 5000;
    }

    /**
     * 生命周期配置
     */
    @Getter
    @Setter
    @ToString
    public static class LifecycleSettings {

        private long initTimeoutMs = 30_000;

        private long shutdownTimeoutMs = 30_000;

        /**
         * 健康检查间隔（秒），0 表示关闭
         */
        private long healthCheckIntervalSeconds = 60;
    }

    /**
     * 动作安全配置
     */
    @Getter
    @Setter
    @ToString
    public static class SecuritySettings {

        private PermissionLevel permissionLevel = PermissionLevel.MODERATE;

        private boolean allowListEnabled = true;

        /**
         * 是否审计被放行的动作（拒绝的动作总是审计）
         */
        private boolean auditLogging = true;

        // Key=权限级别名称, Value=命令列表（支持 "window_*" 前缀通配）
        private Map<String, List<String>> allowList = new LinkedHashMap<>();

        public SecuritySettings allow(PermissionLevel level, String... commands) {
            List<String> list = allowList.computeIfAbsent(level.name(), k -> new ArrayList<>());
            list.addAll(List.of(commands));
            return this;
        }
    }

    /**
     * 单个组件的配置
     */
    @Getter
    @Setter
    @ToString
    public static class ComponentSettings {

        private boolean enabled = true;

        /**
         * 0 表示使用 lifecycle.initTimeoutMs
         */
        private long initTimeoutMs;

        /**
         * 0 表示使用 lifecycle.shutdownTimeoutMs
         */
        private long shutdownTimeoutMs;
    }
}
