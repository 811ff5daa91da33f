package com.smartsense.runtime.demo;

import com.smartsense.api.action.ActionResult;
import com.smartsense.api.event.Event;
import com.smartsense.api.event.EventType;
import com.smartsense.core.spi.OutputRenderer;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;

/**
 * 控制台输出
 */
@Slf4j
public class ConsoleOutputRenderer implements OutputRenderer {

    private final PrintStream out;

    public ConsoleOutputRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public void render(Event event) {
        String line = format(event);
        if (line == null) {
            log.debug("Nothing to render for {}", event);
            return;
        }
        out.println(line);
        out.flush();
    }

    String format(Event event) {
        EventType type = event.type();
        if (EventType.NLP_RESPONSE.equals(type)) {
            return event.getString("processed_text")
                    .map(text -> "SmartSense> " + text)
                    .orElse(null);
        }
        if (EventType.DISPLAY_TEXT.equals(type)) {
            return event.getString("text").orElse(null);
        }
        if (EventType.ACTION_RESULT.equals(type)) {
            ActionResult result = ActionResult.fromEvent(event);
            StringBuilder sb = new StringBuilder("[action] ")
                    .append(result.command()).append(" -> ").append(result.outcome());
            if (result.errorMessage() != null) {
                sb.append(": ").append(result.errorMessage());
            } else if (result.resultData() != null && result.resultData().get("message") != null) {
                sb.append(": ").append(result.resultData().get("message"));
            }
            return sb.toString();
        }
        if (EventType.ERROR.equals(type)) {
            return "[error] " + event.getString("error").orElse("unknown error");
        }
        return null;
    }
}
