package com.smartsense.core.component;

import com.smartsense.api.component.ComponentRole;
import com.smartsense.api.event.Event;
import com.smartsense.api.event.EventType;
import com.smartsense.core.spi.OutputRenderer;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 输出组件：纯接收端，把事件交给渲染器，不产生响应事件
 * 渲染异常交由总线计数，连续失败会使组件进入 DEGRADED
 */
@Slf4j
public class OutputComponent extends AbstractComponent {

    private final OutputRenderer renderer;
    private final AtomicLong rendered = new AtomicLong();

    public OutputComponent(String id, Set<EventType> outputTypes, OutputRenderer renderer) {
        this(id, outputTypes, renderer, Set.of());
    }

    public OutputComponent(String id, Set<EventType> outputTypes, OutputRenderer renderer,
                           Set<String> dependencies) {
        super(id, ComponentRole.OUTPUT, outputTypes, dependencies);
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    @Override
    protected Optional<Event> onEvent(Event event) throws Exception {
        renderer.render(event);
        rendered.incrementAndGet();
        return Optional.empty();
    }

    public long getRenderedCount() {
        return rendered.get();
    }
}
