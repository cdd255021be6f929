package com.cratepilot.app.service;

import com.cratepilot.app.dto.spotify.AudioAnalysis;
import com.cratepilot.app.dto.spotify.AudioFeatures;
import com.cratepilot.app.dto.spotify.SpotifyArtist;
import com.cratepilot.app.dto.spotify.SpotifyPage;
import com.cratepilot.app.dto.spotify.SpotifyTrack;
import com.cratepilot.app.exception.MetadataSourceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Thin typed wrapper over the Spotify Web API. Every call blocks with a timeout and reports failures
 * as {@link MetadataSourceException}; quota and token handling live in {@link SpotifyImporter}.
 */
@Slf4j
public class SpotifyClient {

    private final WebClient apiClient;
    private final WebClient accountsClient;
    private final Duration timeout;

    public SpotifyClient(WebClient.Builder webClientBuilder, String apiUrl, String accountsUrl, Duration timeout) {
        this.apiClient = webClientBuilder.clone().baseUrl(apiUrl).build();
        this.accountsClient = webClientBuilder.clone().baseUrl(accountsUrl).build();
        this.timeout = timeout;
    }

    public SpotifyPage.TokenResponse requestClientToken(String clientId, String clientSecret) {
        String credentials = Base64.getEncoder()
                .encodeToString((clientId + ":" + clientSecret).getBytes(StandardCharsets.UTF_8));
        try {
            return accountsClient.post()
                    .uri("/api/token")
                    .header(HttpHeaders.AUTHORIZATION, "Basic " + credentials)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .bodyValue("grant_type=client_credentials")
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> MetadataSourceException.fromStatus("token exchange",
                                    response.statusCode().value(), body, retryAfter(response.headers()), null)))
                    .bodyToMono(SpotifyPage.TokenResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (MetadataSourceException e) {
            throw e;
        } catch (Exception e) {
            throw MetadataSourceException.transientFailure("token exchange", e);
        }
    }

    public List<SpotifyTrack> searchTracks(String token, String query, int limit) {
        SpotifyPage.SearchResponse response = get("track search", token, uri -> uri
                .path("/search")
                .queryParam("q", "{q}")
                .queryParam("type", "track")
                .queryParam("limit", limit)
                .build(query), SpotifyPage.SearchResponse.class);
        if (response == null || response.getTracks() == null) {
            return List.of();
        }
        return nonNull(response.getTracks().getItems());
    }

    public List<SpotifyArtist> searchArtists(String token, String query, int limit) {
        SpotifyPage.SearchResponse response = get("artist search", token, uri -> uri
                .path("/search")
                .queryParam("q", "{q}")
                .queryParam("type", "artist")
                .queryParam("limit", limit)
                .build(query), SpotifyPage.SearchResponse.class);
        if (response == null || response.getArtists() == null) {
            return List.of();
        }
        return nonNull(response.getArtists().getItems());
    }

    public SpotifyTrack getTrack(String token, String trackId) {
        return get("track lookup", token, uri -> uri.path("/tracks/{id}").build(trackId), SpotifyTrack.class);
    }

    public List<SpotifyTrack> getTracks(String token, List<String> trackIds) {
        SpotifyPage.Tracks response = get("track batch lookup", token, uri -> uri
                .path("/tracks")
                .queryParam("ids", String.join(",", trackIds))
                .build(), SpotifyPage.Tracks.class);
        return response == null ? List.of() : nonNull(response.getTracks());
    }

    /**
     * Positional with {@code trackIds}: an entry is null where the provider has no features.
     */
    public List<AudioFeatures> getAudioFeatures(String token, List<String> trackIds) {
        SpotifyPage.AudioFeaturesList response = get("audio features", token, uri -> uri
                .path("/audio-features")
                .queryParam("ids", String.join(",", trackIds))
                .build(), SpotifyPage.AudioFeaturesList.class);
        if (response == null || response.getAudioFeatures() == null) {
            return Collections.nCopies(trackIds.size(), null);
        }
        return response.getAudioFeatures();
    }

    public AudioAnalysis getAudioAnalysis(String token, String trackId) {
        return get("audio analysis", token, uri -> uri.path("/audio-analysis/{id}").build(trackId), AudioAnalysis.class);
    }

    public List<SpotifyTrack> getRecommendations(String token, Map<String, String> params) {
        SpotifyPage.Tracks response = get("recommendations", token, uri -> {
            uri.path("/recommendations");
            params.forEach(uri::queryParam);
            return uri.build();
        }, SpotifyPage.Tracks.class);
        return response == null ? List.of() : nonNull(response.getTracks());
    }

    public List<String> getGenreSeeds(String token) {
        SpotifyPage.GenreSeeds response = get("genre seeds", token,
                uri -> uri.path("/recommendations/available-genre-seeds").build(), SpotifyPage.GenreSeeds.class);
        return response == null ? List.of() : nonNull(response.getGenres());
    }

    public SpotifyPage.PlaylistTracks getPlaylistTracks(String token, String playlistId, int offset, int limit) {
        return get("playlist tracks", token, uri -> uri
                .path("/playlists/{id}/tracks")
                .queryParam("offset", offset)
                .queryParam("limit", limit)
                .build(playlistId), SpotifyPage.PlaylistTracks.class);
    }

    private <T> T get(String operation, String token, Function<UriBuilder, URI> uri, Class<T> type) {
        try {
            T body = apiClient.get()
                    .uri(uri)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(errorBody -> MetadataSourceException.fromStatus(operation,
                                    response.statusCode().value(), errorBody, retryAfter(response.headers()), null)))
                    .bodyToMono(type)
                    .timeout(timeout)
                    .block();
            log.debug("Spotify {} succeeded", operation);
            return body;
        } catch (MetadataSourceException e) {
            throw e;
        } catch (Exception e) {
            throw MetadataSourceException.transientFailure(operation, e);
        }
    }

    /**
     * {@code Retry-After} in delta-seconds form; HTTP-date values are ignored.
     */
    static Duration retryAfter(ClientResponse.Headers headers) {
        String value = headers.asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || !value.trim().matches("\\d{1,6}")) {
            return null;
        }
        return Duration.ofSeconds(Long.parseLong(value.trim()));
    }

    private static <T> List<T> nonNull(List<T> items) {
        if (items == null) {
            return List.of();
        }
        return items.stream().filter(Objects::nonNull).toList();
    }
}
