package com.smartsense.core.spi;

import com.smartsense.api.event.Event;

import java.util.Map;
import java.util.Optional;

/**
 * 推理策略（NLP、视觉等模型的接入点）
 * 由处理器组件在自己的工作线程上调用，可以阻塞
 */
@FunctionalInterface
public interface InferenceStrategy {

    /**
     * @param input 输入事件
     * @return 结果负载；为空表示该输入不产生响应
     */
    Optional<Map<String, Object>> infer(Event input) throws Exception;
}
