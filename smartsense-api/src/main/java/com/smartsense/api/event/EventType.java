package com.smartsense.api.event;

import java.util.Objects;

/**
 * 事件类型
 * <p>
 * 预定义了助手管线中使用的类型，组件也可以通过 {@link #of(String)} 自行扩展，
 * 消息总线只按名称路由，不关心类型是否预定义。
 * </p>
 */
public record EventType(String name) {

    // ===== 输入事件 =====
    public static final EventType TEXT_INPUT = new EventType("text_input");
    public static final EventType VOICE_INPUT = new EventType("voice_input");
    public static final EventType IMAGE_INPUT = new EventType("image_input");

    // ===== AI 处理结果 =====
    public static final EventType NLP_RESPONSE = new EventType("nlp_response");
    public static final EventType VISION_RESPONSE = new EventType("vision_response");
    public static final EventType CONTEXT_UPDATE = new EventType("context_update");

    // ===== 输出 =====
    public static final EventType SPEAK = new EventType("speak");
    public static final EventType DISPLAY_TEXT = new EventType("display_text");

    // ===== 动作 =====
    public static final EventType EXECUTE_ACTION = new EventType("execute_action");
    public static final EventType ACTION_RESULT = new EventType("action_result");

    // ===== 系统 =====
    /**
     * 组件生命周期信号（由生命周期管理器发布）
     */
    public static final EventType SYSTEM_STATUS = new EventType("system_status");
    public static final EventType ERROR = new EventType("error");

    public EventType {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Event type name cannot be blank");
        }
    }

    public static EventType of(String name) {
        return new EventType(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
