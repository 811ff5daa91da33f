package com.smartsense.core.component;

import com.smartsense.api.component.ComponentRole;
import com.smartsense.api.event.Event;
import com.smartsense.api.event.EventType;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 输入组件：把外部输入（文本、语音、图像）转换为事件发布到总线，不订阅任何事件
 */
@Slf4j
public class InputComponent extends AbstractComponent {

    private final EventType inputType;

    public InputComponent(String id, EventType inputType) {
        this(id, inputType, Set.of());
    }

    public InputComponent(String id, EventType inputType, Set<String> dependencies) {
        super(id, ComponentRole.INPUT, Set.of(), dependencies);
        this.inputType = Objects.requireNonNull(inputType, "inputType");
    }

    /**
     * 以默认输入类型提交一条输入
     *
     * @return 接收该事件的订阅者数量，组件未运行时为 0
     */
    public int submit(Map<String, Object> payload) {
        return submit(inputType, payload);
    }

    public int submit(EventType type, Map<String, Object> payload) {
        if (!isRunning()) {
            log.warn("[{}] Not running, input dropped", id());
            return 0;
        }
        int delivered = publish(Event.of(type, id(), payload));
        log.debug("[{}] Submitted {} to {} subscribers", id(), type, delivered);
        return delivered;
    }

    public EventType getInputType() {
        return inputType;
    }

    @Override
    protected Optional<Event> onEvent(Event event) {
        // 输入组件不订阅事件
        return Optional.empty();
    }
}
