package com.smartsense.api.action;

/**
 * 动作执行结果类型
 */
public enum ActionOutcome {
    SUCCESS,
    FAILED,
    PERMISSION_DENIED
}
