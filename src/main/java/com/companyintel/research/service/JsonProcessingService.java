package com.companyintel.research.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the small JSON objects the chat model is asked to answer with.
 * <p>
 * Models wrap the object in prose or a markdown code fence and sometimes add fields nobody asked for.
 * The first complete top-level object is taken, unknown fields are ignored, and the caller's check
 * decides whether the typed value is usable.
 */
@Service
@Slf4j
public class JsonProcessingService {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);
    private static final int LOG_SNIPPET_LENGTH = 240;

    private final ObjectMapper objectMapper;
    private final ObjectReader lenientReader;

    public JsonProcessingService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.lenientReader = objectMapper.reader().without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public <T> Optional<T> readModelObject(String purpose, @Nullable String raw, Class<T> type) {
        return readModelObject(purpose, raw, type, value -> true);
    }

    /**
     * Parses the model answer into {@code type}. Empty when there is no object, when it does not bind,
     * or when {@code usable} rejects the bound value.
     */
    public <T> Optional<T> readModelObject(String purpose, @Nullable String raw, Class<T> type,
                                           Predicate<? super T> usable) {
        if (!StringUtils.hasText(raw)) {
            log.warn("Model returned nothing for {}.", purpose);
            return Optional.empty();
        }
        Optional<String> json = firstObject(unfence(raw));
        if (json.isEmpty()) {
            log.warn("No JSON object in the {} answer: {}", purpose, snippet(raw));
            return Optional.empty();
        }
        T value;
        try {
            value = lenientReader.forType(type).readValue(json.get());
        } catch (JsonProcessingException ex) {
            log.warn("The {} answer did not bind to {} ({}): {}", purpose, type.getSimpleName(),
                    ex.getOriginalMessage(), snippet(raw));
            return Optional.empty();
        }
        if (value == null || !usable.test(value)) {
            log.warn("The {} answer was parsed but is missing required content: {}", purpose, snippet(raw));
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Unable to serialize " + value.getClass().getSimpleName(), ex);
        }
    }

    static String unfence(String raw) {
        Matcher matcher = CODE_FENCE.matcher(raw);
        return matcher.find() ? matcher.group(1) : raw;
    }

    /**
     * Finds the first balanced top-level object, skipping braces inside string literals.
     */
    static Optional<String> firstObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = closingBrace(text, start);
            if (end > 0) {
                return Optional.of(text.substring(start, end + 1));
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private static int closingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static String snippet(String raw) {
        return StringUtils.truncate(raw.replaceAll("\\s+", " ").trim(), LOG_SNIPPET_LENGTH);
    }
}
