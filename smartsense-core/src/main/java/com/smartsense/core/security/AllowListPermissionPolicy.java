package com.smartsense.core.security;

import com.smartsense.api.security.ActionPermissionPolicy;
import com.smartsense.api.security.PermissionLevel;
import com.smartsense.core.config.SmartSenseConfig.SecuritySettings;
import com.smartsense.core.diagnostic.DiagnosticBus;
import com.smartsense.core.diagnostic.DiagnosticEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于白名单的动作权限策略
 * <p>
 * 规则：
 * 1. SAFE、MODERATE、ELEVATED 逐级累加：高级别同时拥有低级别的白名单
 * 2. RESTRICTED 只看自己的白名单，忽略请求声明的级别
 * 3. 请求声明的级别高于当前级别时拒绝
 * 4. 以 * 结尾的条目按前缀匹配
 * 5. 关闭白名单后全部放行（RESTRICTED 除外）
 */
@Slf4j
public class AllowListPermissionPolicy implements ActionPermissionPolicy {

    private static final String WILDCARD = "*";

    private final PermissionLevel permissionLevel;
    private final boolean allowListEnabled;
    private final DiagnosticBus diagnostics;

    // 级别 -> 命令白名单
    private final Map<PermissionLevel, Set<String>> allowList = new ConcurrentHashMap<>();

    public AllowListPermissionPolicy(PermissionLevel permissionLevel, boolean allowListEnabled,
                                     DiagnosticBus diagnostics) {
        this.permissionLevel = Objects.requireNonNull(permissionLevel, "permissionLevel");
        this.allowListEnabled = allowListEnabled;
        this.diagnostics = diagnostics;
    }

    /**
     * 按安全配置构建
     */
    public static AllowListPermissionPolicy fromSettings(SecuritySettings settings, DiagnosticBus diagnostics) {
        AllowListPermissionPolicy policy = new AllowListPermissionPolicy(
                settings.getPermissionLevel(), settings.isAllowListEnabled(), diagnostics);
        for (Map.Entry<String, List<String>> entry : settings.getAllowList().entrySet()) {
            List<String> commands = entry.getValue();
            if (commands != null) {
                policy.grant(PermissionLevel.parse(entry.getKey()), commands.toArray(new String[0]));
            }
        }
        return policy;
    }

    /**
     * 把命令加入指定级别的白名单
     */
    public AllowListPermissionPolicy grant(PermissionLevel level, String... commands) {
        Set<String> set = allowList.computeIfAbsent(level, k -> ConcurrentHashMap.newKeySet());
        for (String command : commands) {
            if (command != null && !command.isBlank()) {
                set.add(command.trim());
            }
        }
        return this;
    }

    @Override
    public PermissionLevel getPermissionLevel() {
        return permissionLevel;
    }

    @Override
    public boolean isAllowed(String componentId, String command, PermissionLevel requested) {
        PermissionLevel required = requested != null ? requested : PermissionLevel.MODERATE;
        String denyReason = evaluate(command, required);
        audit(componentId, command, denyReason == null, denyReason);
        return denyReason == null;
    }

    /**
     * @return 拒绝原因，放行时为 null
     */
    private String evaluate(String command, PermissionLevel required) {
        if (command == null || command.isBlank()) {
            return "empty command";
        }

        if (permissionLevel == PermissionLevel.RESTRICTED) {
            // 锁定模式：白名单开关无效，只认 RESTRICTED 列表
            return matches(PermissionLevel.RESTRICTED, command)
                    ? null
                    : "command not in RESTRICTED allow-list";
        }

        if (!permissionLevel.covers(required)) {
            return "requested level " + required + " exceeds current level " + permissionLevel;
        }

        if (!allowListEnabled) {
            return null;
        }

        for (PermissionLevel level : PermissionLevel.values()) {
            if (level != PermissionLevel.RESTRICTED && permissionLevel.covers(level) && matches(level, command)) {
                return null;
            }
        }
        return "command not in allow-list for level " + permissionLevel;
    }

    private boolean matches(PermissionLevel level, String command) {
        Set<String> commands = allowList.get(level);
        if (commands == null) {
            return false;
        }
        if (commands.contains(command)) {
            return true;
        }
        for (String entry : commands) {
            if (entry.endsWith(WILDCARD)
                    && command.startsWith(entry.substring(0, entry.length() - WILDCARD.length()))) {
                return true;
            }
        }
        return false;
    }

    private void audit(String componentId, String command, boolean allowed, String reason) {
        if (!allowed) {
            log.warn("[{}] DENY: command [{}] at level {}: {}", componentId, command, permissionLevel, reason);
        } else {
            log.debug("[{}] ALLOW: command [{}] at level {}", componentId, command, permissionLevel);
        }
        if (diagnostics != null) {
            diagnostics.publish(new DiagnosticEvent.PermissionDecision(
                    componentId, command, permissionLevel, allowed, reason));
        }
    }

    public boolean isAllowListEnabled() {
        return allowListEnabled;
    }
}
