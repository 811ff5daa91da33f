package com.smartsense.runtime;

import com.smartsense.api.component.Component;
import com.smartsense.api.exception.ConfigurationException;
import com.smartsense.api.security.ActionPermissionPolicy;
import com.smartsense.core.bus.MessageBus;
import com.smartsense.core.config.SmartSenseConfig;
import com.smartsense.core.config.SmartSenseConfigLoader;
import com.smartsense.core.diagnostic.AuditLogListener;
import com.smartsense.core.diagnostic.DiagnosticBus;
import com.smartsense.core.lifecycle.ComponentStatus;
import com.smartsense.core.lifecycle.LifecycleManager;
import com.smartsense.core.locator.ServiceLocator;
import com.smartsense.core.security.AllowListPermissionPolicy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SmartSense 运行时
 * 宿主应用通过此类组装总线、服务定位器、权限策略和生命周期管理器，并注册组件
 * <p>
 * 每个实例独立，不使用全局静态状态
 */
@Slf4j
public class SmartSenseRuntime implements AutoCloseable {

    @Getter
    private final SmartSenseConfig config;
    @Getter
    private final DiagnosticBus diagnosticBus;
    @Getter
    private final MessageBus messageBus;
    @Getter
    private final ServiceLocator serviceLocator;
    @Getter
    private final AllowListPermissionPolicy permissionPolicy;
    @Getter
    private final LifecycleManager lifecycleManager;

    private final DiagnosticBus.Subscription auditSubscription;

    // 配置中被禁用、未注册的组件
    private final Set<String> disabledComponents = new LinkedHashSet<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Thread shutdownHook;

    /**
     * 使用类路径上的 smartsense.yml（不存在时使用默认配置）
     */
    public static SmartSenseRuntime fromClasspath() {
        return new SmartSenseRuntime(SmartSenseConfigLoader.loadFromClasspath(SmartSenseConfigLoader.DEFAULT_RESOURCE));
    }

    public SmartSenseRuntime(SmartSenseConfig config) {
        config.validate();
        this.config = config;

        // 准备基础设施
        this.diagnosticBus = new DiagnosticBus();
        this.auditSubscription = new AuditLogListener(config.getSecurity().isAuditLogging()).attach(diagnosticBus);
        this.messageBus = new MessageBus(config.getBus(), diagnosticBus);
        this.serviceLocator = new ServiceLocator();
        this.permissionPolicy = AllowListPermissionPolicy.fromSettings(config.getSecurity(), diagnosticBus);
        this.lifecycleManager = new LifecycleManager(messageBus, serviceLocator, diagnosticBus, config);

        // 核心服务
        serviceLocator.register(SmartSenseConfig.class, config);
        serviceLocator.register(MessageBus.class, messageBus);
        serviceLocator.register(DiagnosticBus.class, diagnosticBus);
        serviceLocator.register(ActionPermissionPolicy.class, permissionPolicy);

        log.info("SmartSense runtime [{}] created", config.getName());
    }

    /**
     * 注册共享服务，只能在 start() 之前调用
     */
    public <T> SmartSenseRuntime registerService(Class<T> type, T instance) {
        serviceLocator.register(type, instance);
        return this;
    }

    /**
     * 注册组件；配置中禁用的组件会被跳过
     */
    public SmartSenseRuntime register(Component component) {
        if (!config.isComponentEnabled(component.id())) {
            log.info("[{}] Disabled by configuration, not registered", component.id());
            disabledComponents.add(component.id());
            return this;
        }
        lifecycleManager.register(component);
        return this;
    }

    /**
     * 启动全部组件
     *
     * @throws ConfigurationException 依赖缺失或依赖了被禁用的组件
     * @throws com.smartsense.api.exception.InitializationException 组件初始化失败
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Runtime is closed");
        }
        if (!started.compareAndSet(false, true)) {
            log.warn("SmartSense runtime is already started");
            return;
        }

        long start = System.currentTimeMillis();
        log.info("Starting SmartSense runtime [{}]...", config.getName());

        checkDisabledDependencies();
        serviceLocator.seal();
        lifecycleManager.start();

        log.info("SmartSense runtime started in {} ms", System.currentTimeMillis() - start);
    }

    private void checkDisabledDependencies() {
        for (ComponentStatus status : lifecycleManager.getStatus()) {
            Set<String> missing = new HashSet<>(status.dependencies());
            missing.retainAll(disabledComponents);
            if (!missing.isEmpty()) {
                throw new ConfigurationException("Component [" + status.componentId()
                        + "] depends on disabled components " + missing);
            }
        }
    }

    /**
     * 注册 JVM 关闭钩子
     */
    public SmartSenseRuntime registerShutdownHook() {
        if (shutdownHook == null) {
            Thread hook = new Thread(() -> {
                log.info("SmartSense shutting down...");
                close();
            }, "smartsense-shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);
            shutdownHook = hook;
        }
        return this;
    }

    /**
     * 先按启动逆序停止组件，再关闭总线
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        lifecycleManager.shutdown();
        messageBus.shutdown();
        auditSubscription.unsubscribe();
        log.info("SmartSense runtime [{}] closed, bus stats: {}", config.getName(), messageBus.getStats());

        Thread hook = shutdownHook;
        if (hook != null && Thread.currentThread() != hook) {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, hook not removed");
            }
        }
    }

    public Set<String> getDisabledComponents() {
        return Set.copyOf(disabledComponents);
    }

    public boolean isStarted() {
        return started.get();
    }

    public boolean isClosed() {
        return closed.get();
    }
}
