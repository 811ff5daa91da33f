package com.smartsense.runtime.demo;

import com.smartsense.api.action.ActionRequest;
import com.smartsense.core.spi.ActionExecutor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 系统控制动作（占位实现，不真正操作窗口、鼠标、键盘）
 */
@Slf4j
public class PlaceholderSystemActions implements ActionExecutor {

    private static final List<String> PREFIXES = List.of("window_", "mouse_", "keyboard_", "launch_");

    @Override
    public boolean supports(String command) {
        return PREFIXES.stream().anyMatch(command::startsWith);
    }

    @Override
    public Map<String, Object> execute(ActionRequest request) {
        String command = request.command();
        String category = command.substring(0, command.indexOf('_'));
        log.info("{} command: {} {}", category, command, request.parameters());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", "Command '" + command + "' executed (placeholder)");
        data.put("category", category);
        return data;
    }
}
