package com.cratepilot.app.service;

import com.cratepilot.app.exception.LlmException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class GeminiLlmClient implements LlmClient {

    private final WebClient.Builder webClientBuilder;

    @Value("${app.gemini.base-url:https://generativelanguage.googleapis.com/v1beta}")
    private String baseUrl;

    @Value("${app.gemini.api-key:}")
    private String apiKey;

    @Value("${app.gemini.model:gemini-2.5-flash}")
    private String model;

    @Value("${app.gemini.timeout-ms:30000}")
    private int timeout;

    @Value("${app.gemini.temperature:0.7}")
    private double temperature;

    @Value("${app.gemini.max-output-tokens:4096}")
    private int maxOutputTokens;

    @Override
    public String execute(String prompt) {
        if (!StringUtils.hasText(apiKey)) {
            throw new LlmException("Gemini API key is not configured");
        }
        log.debug("Sending prompt to Gemini model {}. Length: {} chars", model, prompt.length());

        WebClient webClient = webClientBuilder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();

        Map<String, Object> request = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))),
                "generationConfig", Map.of(
                        "temperature", temperature,
                        "maxOutputTokens", maxOutputTokens,
                        "topP", 0.95,
                        "topK", 40));

        Map<String, Object> response;
        try {
            response = webClient.post()
                    .uri(uriBuilder -> uriBuilder
                            .path("/models/{model}:generateContent")
                            .queryParam("key", apiKey)
                            .build(model))
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(Duration.ofMillis(timeout))
                    .block();
        } catch (WebClientResponseException e) {
            log.error("Gemini API error: {} - Body: {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmException("Gemini request failed with status " + e.getStatusCode().value(), e);
        } catch (Exception e) {
            log.error("Error calling Gemini: {}", e.getMessage());
            throw new LlmException("Gemini request failed: " + e.getMessage(), e);
        }

        String text = extractText(response);
        if (!StringUtils.hasText(text)) {
            throw new LlmException("Gemini returned no text candidates");
        }
        log.debug("Gemini response received. Length: {} chars", text.length());
        return text;
    }

    static String extractText(Map<String, Object> response) {
        if (response == null || !(response.get("candidates") instanceof List<?> candidates) || candidates.isEmpty()) {
            return null;
        }
        if (!(candidates.get(0) instanceof Map<?, ?> candidate)
                || !(candidate.get("content") instanceof Map<?, ?> content)
                || !(content.get("parts") instanceof List<?> parts)) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (Object part : parts) {
            if (part instanceof Map<?, ?> partMap && partMap.get("text") instanceof String partText) {
                text.append(partText);
            }
        }
        return text.toString();
    }
}
