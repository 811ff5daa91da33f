package com.smartsense.api.exception;

import lombok.Getter;

/**
 * 权限拒绝异常
 * 当动作请求的命令不在当前权限级别的白名单中时抛出。
 */
@Getter
public class PermissionDeniedException extends SmartSenseException {

    private final String command;

    public PermissionDeniedException(String command, String message) {
        super(message);
        this.command = command;
    }
}
