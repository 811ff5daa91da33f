package com.smartsense.api.security;

import java.util.Locale;

/**
 * 动作权限级别
 * SAFE、MODERATE、ELEVATED 逐级放宽；RESTRICTED 为锁定模式，只允许显式列出的命令。
 */
public enum PermissionLevel {
    SAFE(0),
    MODERATE(1),
    ELEVATED(2),
    RESTRICTED(-1);

    private final int rank;

    PermissionLevel(int rank) {
        this.rank = rank;
    }

    /**
     * 当前级别是否涵盖 required 级别
     */
    public boolean covers(PermissionLevel required) {
        if (this == RESTRICTED || required == RESTRICTED) {
            return this == required;
        }
        return rank >= required.rank;
    }

    public static PermissionLevel parse(String value) {
        if (value == null || value.isBlank()) {
            return MODERATE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
