package com.smartsense.api.security;

import com.smartsense.api.exception.PermissionDeniedException;

/**
 * 动作权限策略
 * 判定一个执行动作请求能否放行，并记录审计。
 */
public interface ActionPermissionPolicy {

    /**
     * 当前生效的权限级别
     */
    PermissionLevel getPermissionLevel();

    /**
     * 检查命令是否允许执行
     *
     * @param componentId 发起检查的动作组件
     * @param command     请求的命令
     * @param requested   请求声明的权限级别
     * @return 允许返回 true
     */
    boolean isAllowed(String componentId, String command, PermissionLevel requested);

    /**
     * 检查并在拒绝时抛出异常
     */
    default void check(String componentId, String command, PermissionLevel requested) {
        if (!isAllowed(componentId, command, requested)) {
            throw new PermissionDeniedException(command,
                    "Command [" + command + "] is not allowed at level " + getPermissionLevel());
        }
    }
}
