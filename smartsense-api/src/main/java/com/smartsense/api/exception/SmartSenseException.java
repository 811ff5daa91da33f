package com.smartsense.api.exception;

/**
 * SmartSense 基础异常
 */
public class SmartSenseException extends RuntimeException {

    public SmartSenseException(String message) {
        super(message);
    }

    public SmartSenseException(String message, Throwable cause) {
        super(message, cause);
    }
}
