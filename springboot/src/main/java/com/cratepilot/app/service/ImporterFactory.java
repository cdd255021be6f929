package com.cratepilot.app.service;

import com.cratepilot.app.exception.InvalidInputException;
import com.cratepilot.app.exception.MetadataSourceException;
import com.cratepilot.app.model.ExternalSourceConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Validates source settings and wires a ready-to-use {@link SpotifyImporter} with its own token
 * cache, rate limiter (counter starting at zero) and retry policy.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImporterFactory {

    private final WebClient.Builder webClientBuilder;
    private final TrackNormalizer normalizer;
    private final TrackCatalog catalog;
    private final ConstraintValidator validator;
    private final Validator beanValidator;
    private final Clock clock;

    public SpotifyImporter configure(ExternalSourceConfig config) {
        validate(config);

        SpotifyClient client = new SpotifyClient(webClientBuilder, config.getBaseUrl(), config.getAccountsUrl(), config.getTimeout());
        SpotifyTokenManager tokenManager = new SpotifyTokenManager(
                client, config.getClientId(), config.getClientSecret(), config.getApiKey(), clock);
        RequestRateLimiter rateLimiter = new RequestRateLimiter(config.getRequestsPerSecond(), config.getRequestsPerMinute());

        Retry retry = Retry.of("spotify", RetryConfig.custom()
                .maxAttempts(config.getRetryAttempts())
                .waitDuration(config.getRetryDelay())
                .retryOnException(e -> e instanceof MetadataSourceException source && source.isRetryable())
                .build());
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying Spotify request (attempt {}): {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));

        log.info("Spotify importer configured for {} ({} req/s, {} req/min, {} attempts)",
                config.getBaseUrl(), config.getRequestsPerSecond(), config.getRequestsPerMinute(), config.getRetryAttempts());
        return new SpotifyImporter(client, tokenManager, rateLimiter, retry, normalizer, catalog, validator);
    }

    void validate(ExternalSourceConfig config) {
        List<String> errors = new ArrayList<>();
        if (!isHttpUrl(config.getBaseUrl())) {
            errors.add("Base URL must be an absolute http(s) URL: " + config.getBaseUrl());
        }
        if (!StringUtils.hasText(config.getApiKey())) {
            if (!isHttpUrl(config.getAccountsUrl())) {
                errors.add("Accounts URL must be an absolute http(s) URL: " + config.getAccountsUrl());
            }
            if (!StringUtils.hasText(config.getClientId()) || !StringUtils.hasText(config.getClientSecret())) {
                errors.add("Client id and secret are required when no API key is configured");
            }
        }
        errors.addAll(beanValidator.validate(config).stream()
                .map(ConstraintViolation::getMessage)
                .sorted()
                .distinct()
                .collect(Collectors.toList()));
        if (!errors.isEmpty()) {
            throw new InvalidInputException("Invalid external source configuration: " + String.join("; ", errors), errors);
        }
    }

    private static boolean isHttpUrl(String value) {
        if (!StringUtils.hasText(value)) {
            return false;
        }
        try {
            URI uri = new URI(value);
            return uri.isAbsolute()
                    && ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))
                    && StringUtils.hasText(uri.getHost());
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
