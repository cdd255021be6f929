package com.cratepilot.app.service;

import com.cratepilot.app.exception.LlmResponseParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Pulls a JSON object out of free-form model text and binds it to a payload type.
 *
 * <p>Every pipeline stage pairs a shape check with either a fallback producer or a hard failure.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmResponseParser {

    private final ObjectMapper objectMapper;

    public <T> Optional<T> parse(String text, Class<T> type, Predicate<? super T> shapeValidator) {
        String json = extractJson(text);
        if (json == null) {
            return Optional.empty();
        }
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null || !shapeValidator.test(value)) {
                log.debug("Model response parsed as {} but failed the shape check", type.getSimpleName());
                return Optional.empty();
            }
            return Optional.of(value);
        } catch (JsonProcessingException e) {
            log.debug("Model response is not valid {} JSON: {}", type.getSimpleName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Parses and converts a model answer. The fallback runs when the text does not parse, fails the
     * shape check, or the converter rejects it with an empty result.
     */
    public <T, R> R parseOrFallback(String text, Class<T> type, Predicate<? super T> shapeValidator,
                                    Function<? super T, Optional<R>> converter, Supplier<R> fallback) {
        return parse(text, type, shapeValidator)
                .flatMap(converter)
                .orElseGet(() -> {
                    log.warn("Unusable {} from model, using fallback", type.getSimpleName());
                    return fallback.get();
                });
    }

    public <T> T parseOrThrow(String text, Class<T> type, Predicate<? super T> shapeValidator) {
        return parse(text, type, shapeValidator)
                .orElseThrow(() -> new LlmResponseParseException(
                        "Model response could not be parsed as " + type.getSimpleName()));
    }

    /**
     * Strips markdown code fences and returns the outermost {...} span, or null if there is none.
     */
    static String extractJson(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String cleaned = text.replaceAll("```(?:json)?", "").trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return cleaned.substring(start, end + 1);
    }
}
