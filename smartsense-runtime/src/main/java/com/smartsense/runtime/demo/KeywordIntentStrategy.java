package com.smartsense.runtime.demo;

import com.smartsense.api.event.Event;
import com.smartsense.core.spi.InferenceStrategy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于关键词的意图识别（占位实现，用于端到端演示）
 * 输出 NLP_RESPONSE 负载：意图、置信度、实体、情感、回复文本
 */
public class KeywordIntentStrategy implements InferenceStrategy {

    static final String UNKNOWN = "unknown";

    private static final Pattern NUMBER = Pattern.compile("\\b\\d+\\b");
    private static final Pattern TIME = Pattern.compile("\\b\\d{1,2}:\\d{2}\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // 按优先级匹配
    private static final Map<String, List<String>> INTENTS = new LinkedHashMap<>();
    private static final Map<String, String> RESPONSES = new LinkedHashMap<>();

    private static final List<String> POSITIVE_WORDS =
            List.of("good", "great", "excellent", "happy", "love", "wonderful", "amazing");
    private static final List<String> NEGATIVE_WORDS =
            List.of("bad", "terrible", "hate", "awful", "horrible", "sad", "angry");

    static {
        INTENTS.put("greeting", List.of("hello", "hi", "hey", "good morning", "good evening"));
        INTENTS.put("goodbye", List.of("bye", "goodbye", "see you", "farewell"));
        INTENTS.put("question", List.of("what", "how", "why", "when", "where", "who"));
        INTENTS.put("command", List.of("open", "close", "start", "stop", "launch", "exit"));
        INTENTS.put("help", List.of("help", "assist", "support", "guide"));

        RESPONSES.put("greeting", "Hello! How can I help you today?");
        RESPONSES.put("goodbye", "Goodbye! Have a great day!");
        RESPONSES.put("question", "That's an interesting question. Let me think about that.");
        RESPONSES.put("command", "I understand you want me to do something. Try /action <command> to run it.");
        RESPONSES.put("help", "You can ask me questions, give me commands, or just chat with me!");
        RESPONSES.put(UNKNOWN, "I'm not sure I understand. Could you please rephrase that?");
    }

    @Override
    public Optional<Map<String, Object>> infer(Event input) {
        String text = input.getString("text")
                .or(() -> input.getString("transcribed_text"))
                .orElse("");
        if (text.isBlank()) {
            return Optional.empty();
        }

        String cleaned = WHITESPACE.matcher(text.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
        String intent = UNKNOWN;
        double confidence = 0.0;
        for (Map.Entry<String, List<String>> entry : INTENTS.entrySet()) {
            long matches = entry.getValue().stream().filter(cleaned::contains).count();
            if (matches > 0) {
                intent = entry.getKey();
                confidence = Math.min((double) matches / entry.getValue().size(), 1.0);
                break;
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("original_text", text);
        result.put("intent", intent);
        result.put("confidence", confidence);
        result.put("entities", extractEntities(cleaned));
        result.put("sentiment", sentiment(cleaned));
        result.put("processed_text", RESPONSES.get(intent));
        result.put("language", "en");
        return Optional.of(result);
    }

    private List<Map<String, Object>> extractEntities(String text) {
        List<Map<String, Object>> entities = new ArrayList<>();
        collect(entities, TIME.matcher(text), "time");
        collect(entities, NUMBER.matcher(text), "number");
        return entities;
    }

    private void collect(List<Map<String, Object>> entities, Matcher matcher, String type) {
        while (matcher.find()) {
            Map<String, Object> entity = new LinkedHashMap<>();
            entity.put("entity_type", type);
            entity.put("entity_value", matcher.group());
            entity.put("start_position", matcher.start());
            entity.put("end_position", matcher.end());
            entities.add(entity);
        }
    }

    private String sentiment(String text) {
        long positive = POSITIVE_WORDS.stream().filter(text::contains).count();
        long negative = NEGATIVE_WORDS.stream().filter(text::contains).count();
        if (positive > negative) {
            return "positive";
        }
        if (negative > positive) {
            return "negative";
        }
        return "neutral";
    }
}
