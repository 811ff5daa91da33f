package com.smartsense.api.context;

import com.smartsense.api.event.Event;

import java.util.Optional;

/**
 * 事件处理器
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * @return 可选的响应事件
     */
    Optional<Event> handle(Event event) throws Exception;
}
