package com.smartsense.api.action;

import com.smartsense.api.event.Event;
import com.smartsense.api.security.PermissionLevel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * EXECUTE_ACTION 事件负载
 */
public record ActionRequest(String command, Map<String, Object> parameters, PermissionLevel permissionLevel) {

    public static final String KEY_COMMAND = "command";
    public static final String KEY_PARAMETERS = "parameters";
    public static final String KEY_PERMISSION_LEVEL = "permission_level";

    public ActionRequest {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Action command cannot be blank");
        }
        // 参数值允许为 null，不能用 Map.copyOf
        parameters = parameters == null || parameters.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        permissionLevel = permissionLevel == null ? PermissionLevel.MODERATE : permissionLevel;
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(KEY_COMMAND, command);
        payload.put(KEY_PARAMETERS, parameters);
        payload.put(KEY_PERMISSION_LEVEL, permissionLevel.name());
        return payload;
    }

    @SuppressWarnings("unchecked")
    public static ActionRequest fromEvent(Event event) {
        String command = event.getString(KEY_COMMAND).orElse(null);
        Map<String, Object> parameters = event.get(KEY_PARAMETERS, Map.class).orElse(null);
        PermissionLevel level = PermissionLevel.parse(event.getString(KEY_PERMISSION_LEVEL).orElse(null));
        return new ActionRequest(command, parameters, level);
    }
}
