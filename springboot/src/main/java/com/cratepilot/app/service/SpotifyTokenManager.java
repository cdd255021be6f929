package com.cratepilot.app.service;

import com.cratepilot.app.dto.spotify.SpotifyPage;
import com.cratepilot.app.exception.MetadataSourceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Client-credentials bearer token cache. A token is refreshed when missing, expired or within
 * {@link #REFRESH_BUFFER} of expiry. A pre-issued static token, when configured, is used as is.
 */
@Slf4j
public class SpotifyTokenManager {

    static final Duration REFRESH_BUFFER = Duration.ofMinutes(5);

    private final SpotifyClient client;
    private final String clientId;
    private final String clientSecret;
    private final String staticToken;
    private final Clock clock;

    private String accessToken;
    private Instant expiresAt;

    public SpotifyTokenManager(SpotifyClient client, String clientId, String clientSecret, String staticToken, Clock clock) {
        this.client = client;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.staticToken = StringUtils.hasText(staticToken) ? staticToken : null;
        this.clock = clock;
    }

    public synchronized String getValidToken() {
        if (staticToken != null) {
            return staticToken;
        }
        if (accessToken != null && expiresAt != null && expiresAt.isAfter(clock.instant().plus(REFRESH_BUFFER))) {
            return accessToken;
        }
        refresh();
        return accessToken;
    }

    public synchronized void invalidate() {
        if (accessToken != null) {
            log.warn("Discarding cached Spotify access token");
        }
        accessToken = null;
        expiresAt = null;
    }

    public synchronized boolean hasValidToken() {
        return staticToken != null
                || (accessToken != null && expiresAt != null && expiresAt.isAfter(clock.instant()));
    }

    private void refresh() {
        log.info("Requesting new Spotify access token");
        SpotifyPage.TokenResponse response = client.requestClientToken(clientId, clientSecret);
        if (response == null || !StringUtils.hasText(response.getAccessToken())) {
            throw MetadataSourceException.fromStatus("token exchange", 502, "response carried no access token", null);
        }
        long lifetime = response.getExpiresIn() != null ? response.getExpiresIn() : 3600L;
        accessToken = response.getAccessToken();
        expiresAt = clock.instant().plusSeconds(lifetime);
        log.debug("Spotify access token valid until {}", expiresAt);
    }
}
