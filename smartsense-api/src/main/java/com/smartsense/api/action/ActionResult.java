package com.smartsense.api.action;

import com.smartsense.api.event.Event;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ACTION_RESULT 事件负载
 */
public record ActionResult(String command,
                           ActionOutcome outcome,
                           Map<String, Object> resultData,
                           String errorMessage,
                           long executionTimeMs) {

    public static final String KEY_COMMAND = "command";
    public static final String KEY_OUTCOME = "outcome";
    public static final String KEY_SUCCESS = "success";
    public static final String KEY_RESULT_DATA = "result_data";
    public static final String KEY_ERROR_MESSAGE = "error_message";
    public static final String KEY_EXECUTION_TIME_MS = "execution_time_ms";

    public static ActionResult success(String command, Map<String, Object> data, long elapsedMs) {
        return new ActionResult(command, ActionOutcome.SUCCESS, data, null, elapsedMs);
    }

    public static ActionResult failed(String command, String error, long elapsedMs) {
        return new ActionResult(command, ActionOutcome.FAILED, null, error, elapsedMs);
    }

    public static ActionResult denied(String command, String reason) {
        return new ActionResult(command, ActionOutcome.PERMISSION_DENIED, null, reason, 0L);
    }

    public boolean isSuccess() {
        return outcome == ActionOutcome.SUCCESS;
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(KEY_COMMAND, command);
        payload.put(KEY_OUTCOME, outcome.name());
        payload.put(KEY_SUCCESS, isSuccess());
        if (resultData != null) {
            payload.put(KEY_RESULT_DATA, resultData);
        }
        if (errorMessage != null) {
            payload.put(KEY_ERROR_MESSAGE, errorMessage);
        }
        payload.put(KEY_EXECUTION_TIME_MS, executionTimeMs);
        return payload;
    }

    @SuppressWarnings("unchecked")
    public static ActionResult fromEvent(Event event) {
        return new ActionResult(
                event.getString(KEY_COMMAND).orElse("unknown"),
                ActionOutcome.valueOf(event.getString(KEY_OUTCOME).orElse(ActionOutcome.FAILED.name())),
                event.get(KEY_RESULT_DATA, Map.class).orElse(null),
                event.getString(KEY_ERROR_MESSAGE).orElse(null),
                event.get(KEY_EXECUTION_TIME_MS, Long.class).orElse(0L));
    }
}
