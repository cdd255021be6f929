package com.cratepilot.app.config;

import com.cratepilot.app.model.ExternalSourceConfig;
import com.cratepilot.app.service.ImporterFactory;
import com.cratepilot.app.service.SpotifyImporter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Registers the Spotify importer only when {@code app.spotify.enabled=true}; without it the planner
 * builds candidate pools from the local catalog.
 */
@Configuration
public class SpotifyImportConfig {

    @Bean
    @ConditionalOnProperty(prefix = "app.spotify", name = "enabled", havingValue = "true")
    public SpotifyImporter spotifyImporter(
            ImporterFactory importerFactory,
            @Value("${app.spotify.api-url:https://api.spotify.com/v1}") String apiUrl,
            @Value("${app.spotify.accounts-url:https://accounts.spotify.com}") String accountsUrl,
            @Value("${app.spotify.client-id:}") String clientId,
            @Value("${app.spotify.client-secret:}") String clientSecret,
            @Value("${app.spotify.api-key:}") String apiKey,
            @Value("${app.spotify.timeout-ms:10000}") long timeoutMs,
            @Value("${app.spotify.rate-limit.requests-per-second:10}") int requestsPerSecond,
            @Value("${app.spotify.rate-limit.requests-per-minute:180}") int requestsPerMinute,
            @Value("${app.spotify.rate-limit.retry-attempts:3}") int retryAttempts,
            @Value("${app.spotify.rate-limit.retry-delay-ms:1000}") long retryDelayMs) {

        return importerFactory.configure(ExternalSourceConfig.builder()
                .baseUrl(apiUrl)
                .accountsUrl(accountsUrl)
                .clientId(clientId)
                .clientSecret(clientSecret)
                .apiKey(apiKey)
                .timeout(Duration.ofMillis(timeoutMs))
                .requestsPerSecond(requestsPerSecond)
                .requestsPerMinute(requestsPerMinute)
                .retryAttempts(retryAttempts)
                .retryDelay(Duration.ofMillis(retryDelayMs))
                .build());
    }
}
