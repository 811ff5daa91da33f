package com.smartsense.api.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 启动失败
 * 某个组件 initialize() 返回失败、抛出异常或超时后，启动被整体中止。
 */
public class InitializationException extends SmartSenseException {

    private final List<InitializationFailure> failures;

    public InitializationException(List<InitializationFailure> failures) {
        super("Startup aborted: " + failures.stream()
                .map(f -> f.componentId() + " (" + f.reason() + ")")
                .collect(Collectors.joining(", ")));
        this.failures = List.copyOf(failures);
    }

    public List<InitializationFailure> getFailures() {
        return failures;
    }

    /**
     * 单个组件的初始化失败记录
     */
    public record InitializationFailure(String componentId, String reason, Throwable cause) {
    }
}
