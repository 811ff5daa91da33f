package com.smartsense.api.component;

import com.smartsense.api.context.ComponentContext;
import com.smartsense.api.event.Event;
import com.smartsense.api.event.EventType;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;

/**
 * 组件能力契约
 * 所有输入、处理、输出、动作组件都实现此接口，运行时不关心其内部实现。
 */
public interface Component {

    /**
     * 组件唯一标识
     */
    String id();

    ComponentRole role();

    /**
     * 声明的依赖组件 ID，依赖全部进入 RUNNING 之后本组件才会启动
     */
    default Set<String> declaredDependencies() {
        return Collections.emptySet();
    }

    /**
     * 启动成功后由运行时代为订阅的事件类型，投递目标为 {@link #handleEvent(Event)}
     */
    default Set<EventType> subscribedTypes() {
        return Collections.emptySet();
    }

    /**
     * 初始化组件，仅调用一次
     *
     * @param context 组件上下文，提供总线和共享服务的访问入口
     * @return 初始化是否成功
     */
    boolean initialize(ComponentContext context);

    /**
     * 停止组件并释放资源
     */
    void shutdown();

    /**
     * 处理一个投递过来的事件
     *
     * @return 可选的响应事件，由总线继续发布
     */
    Optional<Event> handleEvent(Event event) throws Exception;

    /**
     * 健康检查，返回 false 时组件被标记为 DEGRADED
     */
    default boolean isHealthy() {
        return true;
    }
}
