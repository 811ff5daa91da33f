package com.smartsense.runtime.demo;

import com.smartsense.api.action.ActionRequest;
import com.smartsense.api.event.EventType;
import com.smartsense.api.security.PermissionLevel;
import com.smartsense.core.component.InputComponent;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 命令行文本输入
 * <p>
 * - 普通文本作为 TEXT_INPUT 发布
 * - "/action 命令 [级别]" 作为 EXECUTE_ACTION 发布
 * - quit / exit / q 结束输入
 */
@Slf4j
public class ConsoleTextInput extends InputComponent {

    static final String ACTION_COMMAND = "/action";
    private static final int MAX_LENGTH = 10_000;

    private final InputStream in;
    private final Runnable onQuit;

    private volatile Thread readerThread;
    private volatile boolean running = false;

    public ConsoleTextInput(String id, InputStream in, Runnable onQuit, Set<String> dependencies) {
        super(id, EventType.TEXT_INPUT, dependencies);
        this.in = in;
        this.onQuit = onQuit;
    }

    @Override
    protected void onInitialized() {
        running = true;
        Thread t = new Thread(this::readLoop, "smartsense-console-input");
        t.setDaemon(true);
        readerThread = t;
        t.start();
    }

    @Override
    protected void doShutdown() {
        running = false;
        Thread t = readerThread;
        if (t != null) {
            t.interrupt();
        }
    }

    private void readLoop() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        try {
            String line;
            while (running && (line = reader.readLine()) != null) {
                if (!handleLine(line)) {
                    break;
                }
            }
        } catch (IOException e) {
            if (running) {
                log.error("[{}] Console input failed: {}", id(), e.getMessage(), e);
            }
        }
        if (running) {
            log.info("[{}] Console input ended", id());
            onQuit.run();
        }
    }

    /**
     * 处理一行输入
     *
     * @return 是否继续读取
     */
    boolean handleLine(String line) {
        String text = line.strip();
        if (text.isEmpty()) {
            return true;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.equals("quit") || lower.equals("exit") || lower.equals("q")) {
            return false;
        }

        if (text.equals(ACTION_COMMAND) || text.startsWith(ACTION_COMMAND + " ")) {
            String arguments = text.substring(ACTION_COMMAND.length()).trim();
            if (arguments.isEmpty()) {
                log.warn("[{}] Usage: /action <command> [level]", id());
                return true;
            }
            String[] parts = arguments.split("\\s+");
            PermissionLevel level;
            try {
                level = parts.length > 1 ? PermissionLevel.parse(parts[1]) : PermissionLevel.SAFE;
            } catch (IllegalArgumentException e) {
                log.warn("[{}] Unknown permission level: {}", id(), parts[1]);
                return true;
            }
            submit(EventType.EXECUTE_ACTION, new ActionRequest(parts[0], Map.of(), level).toPayload());
            return true;
        }

        if (text.length() > MAX_LENGTH) {
            log.warn("[{}] Text truncated to {} characters", id(), MAX_LENGTH);
            text = text.substring(0, MAX_LENGTH);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", text);
        payload.put("source", "cli");
        payload.put("original_length", line.length());
        submit(payload);
        return true;
    }
}
