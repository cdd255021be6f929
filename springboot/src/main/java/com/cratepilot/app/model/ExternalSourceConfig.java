package com.cratepilot.app.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import org.hibernate.validator.constraints.time.DurationMin;

import java.time.Duration;

/**
 * Connection and quota settings for one external metadata source. Quota, retry and timeout bounds
 * are Bean Validation constraints; URLs and credentials are checked by {@code ImporterFactory}.
 */
@Value
@Builder(toBuilder = true)
public class ExternalSourceConfig {

    String baseUrl;

    @Builder.Default
    String accountsUrl = "https://accounts.spotify.com";

    String clientId;
    String clientSecret;

    /** Pre-issued bearer token; skips the client-credentials exchange when set. */
    String apiKey;

    @NotNull(message = "Timeout is required")
    @DurationMin(millis = 1, message = "Timeout must be positive")
    @Builder.Default
    Duration timeout = Duration.ofSeconds(10);

    @Positive(message = "Rate limits must be positive")
    @Builder.Default
    int requestsPerSecond = 10;

    @Positive(message = "Rate limits must be positive")
    @Builder.Default
    int requestsPerMinute = 180;

    @Min(value = 1, message = "Retry attempts must be at least 1")
    @Builder.Default
    int retryAttempts = 3;

    @NotNull(message = "Retry delay is required")
    @DurationMin(millis = 1, message = "Retry delay must be at least 1 ms")
    @Builder.Default
    Duration retryDelay = Duration.ofMillis(1000);
}
