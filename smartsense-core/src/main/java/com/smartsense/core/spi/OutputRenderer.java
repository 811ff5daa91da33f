package com.smartsense.core.spi;

import com.smartsense.api.event.Event;

/**
 * 输出渲染（控制台、语音、界面等）
 */
@FunctionalInterface
public interface OutputRenderer {

    void render(Event event) throws Exception;
}
