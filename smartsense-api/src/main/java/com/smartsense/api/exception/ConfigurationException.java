package com.smartsense.api.exception;

/**
 * 配置错误
 * 依赖图非法、缺少必需组件、违反组件契约等，属于致命错误，会中止启动。
 */
public class ConfigurationException extends SmartSenseException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
