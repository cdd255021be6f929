package com.cratepilot.app.service;

import com.cratepilot.app.dto.response.ImportResult;
import com.cratepilot.app.dto.response.ValidationResult;
import com.cratepilot.app.dto.spotify.AudioAnalysis;
import com.cratepilot.app.dto.spotify.AudioFeatures;
import com.cratepilot.app.dto.spotify.RawTrackRecord;
import com.cratepilot.app.dto.spotify.RecommendationRequest;
import com.cratepilot.app.dto.spotify.SpotifyArtist;
import com.cratepilot.app.dto.spotify.SpotifyPage;
import com.cratepilot.app.dto.spotify.SpotifyTrack;
import com.cratepilot.app.entity.Track;
import com.cratepilot.app.exception.InvalidInputException;
import com.cratepilot.app.exception.MetadataSourceException;
import com.cratepilot.app.util.SpotifyKeyConverter;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Imports Spotify tracks into the catalog. Every provider call goes through the token cache, the
 * rate limiter and a retry policy that only repeats transient failures. Upstream failures are
 * reported in the returned {@link ImportResult}, never thrown.
 */
@Slf4j
public class SpotifyImporter {

    static final int MAX_SEARCH_LIMIT = 50;
    static final int TRACK_BATCH_SIZE = 50;
    static final int FEATURE_BATCH_SIZE = 100;
    static final int PLAYLIST_PAGE_SIZE = 100;
    static final int MAX_SEEDS = 5;
    static final Duration MAX_RETRY_AFTER = Duration.ofSeconds(30);

    static final List<String> FALLBACK_GENRE_SEEDS = List.of(
            "house", "tech-house", "deep-house", "progressive-house", "electro-house",
            "techno", "minimal-techno", "detroit-techno", "trance", "progressive-trance",
            "psytrance", "drum-and-bass", "dubstep", "trap", "bass", "ambient", "downtempo",
            "chill", "disco", "funk", "soul", "indie", "indie-pop", "alternative", "electronic",
            "edm", "dance", "hip-hop", "rap", "r-n-b", "pop", "rock", "indie-rock");

    private final SpotifyClient client;
    private final SpotifyTokenManager tokenManager;
    private final RequestRateLimiter rateLimiter;
    private final Retry retry;
    private final TrackNormalizer normalizer;
    private final TrackCatalog catalog;
    private final ConstraintValidator validator;

    private volatile List<String> genreSeedCache;

    public SpotifyImporter(SpotifyClient client, SpotifyTokenManager tokenManager, RequestRateLimiter rateLimiter,
                           Retry retry, TrackNormalizer normalizer, TrackCatalog catalog, ConstraintValidator validator) {
        this.client = client;
        this.tokenManager = tokenManager;
        this.rateLimiter = rateLimiter;
        this.retry = retry;
        this.normalizer = normalizer;
        this.catalog = catalog;
        this.validator = validator;
    }

    public ImportResult searchAndImport(String query, int limit) {
        if (!StringUtils.hasText(query)) {
            throw new InvalidInputException("Search query must not be blank");
        }
        int searchLimit = Math.max(1, Math.min(limit, MAX_SEARCH_LIMIT));
        log.info("Spotify search: '{}' (limit {})", query, searchLimit);

        try {
            List<SpotifyTrack> hits = execute("track search", token -> client.searchTracks(token, query, searchLimit));
            if (hits.isEmpty()) {
                return ImportResult.warning("No tracks found for query: " + query);
            }
            return importRecords(enrich(hits, query, false));
        } catch (MetadataSourceException e) {
            log.error("Spotify search '{}' failed", query, e);
            return ImportResult.failure(e.getMessage(), 0);
        }
    }

    public ImportResult importById(String externalId) {
        if (!StringUtils.hasText(externalId)) {
            throw new InvalidInputException("Track id must not be blank");
        }
        String id = TrackNormalizer.toExternalId(externalId);
        try {
            SpotifyTrack track = execute("track lookup", token -> client.getTrack(token, id));
            if (track == null) {
                return ImportResult.failure("Track not found: " + id, 1);
            }
            return importRecords(enrich(List.of(track), null, true));
        } catch (MetadataSourceException e) {
            log.error("Spotify import of track {} failed", id, e);
            return ImportResult.failure(e.getMessage(), 1);
        }
    }

    public ImportResult importByIds(List<String> externalIds) {
        if (externalIds == null || externalIds.isEmpty()) {
            return ImportResult.empty();
        }
        List<String> ids = externalIds.stream().map(TrackNormalizer::toExternalId).distinct().toList();
        try {
            List<RawTrackRecord> records = new ArrayList<>();
            for (List<String> batch : partition(ids, TRACK_BATCH_SIZE)) {
                List<SpotifyTrack> tracks = execute("track batch lookup", token -> client.getTracks(token, batch));
                records.addAll(enrich(tracks, null, false));
            }
            return importRecords(records);
        } catch (MetadataSourceException e) {
            log.error("Spotify batch import of {} tracks failed", ids.size(), e);
            return ImportResult.failure(e.getMessage(), ids.size());
        }
    }

    /**
     * @param limit maximum number of tracks to import, or null for the whole playlist
     */
    public ImportResult importFromPlaylist(String playlistId, Integer limit) {
        if (!StringUtils.hasText(playlistId)) {
            throw new InvalidInputException("Playlist id must not be blank");
        }
        try {
            List<SpotifyTrack> tracks = new ArrayList<>();
            int offset = 0;
            while (true) {
                int pageOffset = offset;
                SpotifyPage.PlaylistTracks page = execute("playlist tracks",
                        token -> client.getPlaylistTracks(token, playlistId, pageOffset, PLAYLIST_PAGE_SIZE));
                if (page == null || page.getItems() == null) {
                    break;
                }
                page.getItems().stream()
                        .map(SpotifyPage.PlaylistItem::getTrack)
                        .filter(track -> track != null && track.getId() != null)
                        .forEach(tracks::add);

                if (page.getNext() == null || (limit != null && tracks.size() >= limit)) {
                    break;
                }
                offset += PLAYLIST_PAGE_SIZE;
            }

            List<SpotifyTrack> selected = limit != null && tracks.size() > limit ? tracks.subList(0, limit) : tracks;
            log.info("Playlist {} yielded {} tracks", playlistId, selected.size());
            return importRecords(enrich(selected, null, false));
        } catch (MetadataSourceException e) {
            log.error("Spotify playlist import {} failed", playlistId, e);
            return ImportResult.failure(e.getMessage(), 0);
        }
    }

    /**
     * Artist and track seeds are given by name and resolved to provider ids first. At most
     * {@value #MAX_SEEDS} seeds are sent, genres first.
     */
    public ImportResult importRecommendations(RecommendationRequest request) {
        List<String> genres = new ArrayList<>(request.getSeedGenres());
        List<String> artistIds = new ArrayList<>();
        List<String> trackIds = new ArrayList<>();

        int remaining = MAX_SEEDS - Math.min(genres.size(), MAX_SEEDS);
        genres = genres.subList(0, Math.min(genres.size(), MAX_SEEDS));
        for (String artist : request.getSeedArtists()) {
            if (remaining == 0) break;
            List<String> found = searchArtistIds(artist, 1);
            if (!found.isEmpty()) {
                artistIds.add(found.get(0));
                remaining--;
            }
        }
        for (String title : request.getSeedTracks()) {
            if (remaining == 0) break;
            List<String> found = searchTrackIds(title, 1);
            if (!found.isEmpty()) {
                trackIds.add(found.get(0));
                remaining--;
            }
        }

        if (genres.isEmpty() && artistIds.isEmpty() && trackIds.isEmpty()) {
            return ImportResult.failure("At least one seed (artist, track, or genre) is required", 0);
        }

        Map<String, String> params = new LinkedHashMap<>();
        if (!genres.isEmpty()) params.put("seed_genres", String.join(",", genres));
        if (!artistIds.isEmpty()) params.put("seed_artists", String.join(",", artistIds));
        if (!trackIds.isEmpty()) params.put("seed_tracks", String.join(",", trackIds));
        int limit = request.getLimit() == null ? 20 : Math.max(1, Math.min(request.getLimit(), 100));
        params.put("limit", String.valueOf(limit));
        if (request.getMinTempo() != null) params.put("min_tempo", String.valueOf(request.getMinTempo()));
        if (request.getMaxTempo() != null) params.put("max_tempo", String.valueOf(request.getMaxTempo()));
        if (request.getTargetEnergy() != null) params.put("target_energy", String.valueOf(request.getTargetEnergy()));
        if (request.getMinPopularity() != null) params.put("min_popularity", String.valueOf(request.getMinPopularity()));
        if (request.getTargetKeyCamelot() != null) {
            SpotifyKeyConverter.asRecommendationTunables(request.getTargetKeyCamelot())
                    .forEach((name, value) -> params.put(name, String.valueOf(value)));
        }

        String context = "recommendations:" + String.join(",", genres);
        try {
            List<SpotifyTrack> tracks = execute("recommendations", token -> client.getRecommendations(token, params));
            if (tracks.isEmpty()) {
                return ImportResult.warning("No recommendations returned");
            }
            return importRecords(enrich(tracks, context, false));
        } catch (MetadataSourceException e) {
            log.error("Spotify recommendations failed", e);
            return ImportResult.failure(e.getMessage(), 0);
        }
    }

    public List<String> listGenreSeeds() {
        List<String> cached = genreSeedCache;
        if (cached != null) {
            return cached;
        }
        try {
            List<String> genres = execute("genre seeds", client::getGenreSeeds);
            if (!genres.isEmpty()) {
                genreSeedCache = List.copyOf(genres);
                return genreSeedCache;
            }
        } catch (MetadataSourceException e) {
            log.warn("Genre seeds endpoint unavailable ({}), using built-in list", e.getMessage());
        }
        return FALLBACK_GENRE_SEEDS;
    }

    public List<String> searchArtistIds(String artistName, int limit) {
        if (!StringUtils.hasText(artistName)) {
            return List.of();
        }
        try {
            return execute("artist search", token -> client.searchArtists(token, artistName, limit)).stream()
                    .map(SpotifyArtist::getId)
                    .toList();
        } catch (MetadataSourceException e) {
            log.warn("Failed to search artist '{}': {}", artistName, e.getMessage());
            return List.of();
        }
    }

    public List<String> searchTrackIds(String trackName, int limit) {
        if (!StringUtils.hasText(trackName)) {
            return List.of();
        }
        try {
            return execute("track search", token -> client.searchTracks(token, trackName, limit)).stream()
                    .map(SpotifyTrack::getId)
                    .toList();
        } catch (MetadataSourceException e) {
            log.warn("Failed to search track '{}': {}", trackName, e.getMessage());
            return List.of();
        }
    }

    public long getRequestCount() {
        return rateLimiter.getRequestCount();
    }

    public void resetRequestCount() {
        rateLimiter.reset();
    }

    /**
     * Token, quota and retry around one provider call. A 401 drops the cached token so the next
     * request exchanges a fresh one. A 429 with {@code Retry-After} holds the limiter for that long,
     * capped at {@link #MAX_RETRY_AFTER}.
     */
    <T> T execute(String operation, Function<String, T> call) {
        return Retry.decorateSupplier(retry, () -> {
            String token = tokenManager.getValidToken();
            rateLimiter.acquire();
            try {
                return call.apply(token);
            } catch (MetadataSourceException e) {
                if (e.getStatus() == 401) {
                    tokenManager.invalidate();
                }
                if (e.isRateLimited() && e.getRetryAfter() != null) {
                    Duration pause = e.getRetryAfter().compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : e.getRetryAfter();
                    rateLimiter.backOff(pause);
                }
                if (e.isRetryable()) {
                    log.warn("Spotify {} failed transiently: {}", operation, e.getMessage());
                }
                throw e;
            }
        }).get();
    }

    private List<RawTrackRecord> enrich(List<SpotifyTrack> tracks, String searchContext, boolean withAnalysis) {
        List<SpotifyTrack> usable = tracks.stream().filter(t -> t != null && t.getId() != null).toList();
        if (usable.isEmpty()) {
            return List.of();
        }

        Map<String, AudioFeatures> featuresById = new HashMap<>();
        int unavailable = 0;
        for (List<SpotifyTrack> batch : partition(usable, FEATURE_BATCH_SIZE)) {
            List<String> ids = batch.stream().map(SpotifyTrack::getId).toList();
            try {
                List<AudioFeatures> features = execute("audio features", token -> client.getAudioFeatures(token, ids));
                for (int i = 0; i < ids.size() && i < features.size(); i++) {
                    if (features.get(i) != null) {
                        featuresById.put(ids.get(i), features.get(i));
                    }
                }
            } catch (MetadataSourceException e) {
                if (!e.isFeatureUnavailable()) {
                    throw e;
                }
                unavailable += ids.size();
            }
        }
        if (unavailable > 0) {
            log.warn("Audio features unavailable for {} track(s), falling back to inference", unavailable);
        }

        List<RawTrackRecord> records = new ArrayList<>(usable.size());
        for (SpotifyTrack track : usable) {
            records.add(RawTrackRecord.builder()
                    .track(track)
                    .features(featuresById.get(track.getId()))
                    .analysis(withAnalysis ? fetchAnalysis(track.getId()) : null)
                    .searchContext(searchContext)
                    .build());
        }
        return records;
    }

    private AudioAnalysis fetchAnalysis(String trackId) {
        try {
            return execute("audio analysis", token -> client.getAudioAnalysis(token, trackId));
        } catch (MetadataSourceException e) {
            log.warn("Audio analysis for {} unavailable: {}", trackId, e.getMessage());
            return null;
        }
    }

    private ImportResult importRecords(List<RawTrackRecord> records) {
        ImportResult result = ImportResult.empty();
        for (RawTrackRecord record : records) {
            Track track;
            try {
                track = normalizer.normalize(record);
            } catch (InvalidInputException e) {
                result.recordFailure(e.getMessage());
                continue;
            }

            ValidationResult validation = validator.validateTrack(track);
            if (!validation.isValid()) {
                result.recordFailure("Track " + track.getId() + " is invalid: " + String.join("; ", validation.getErrors()));
                continue;
            }

            if (catalog.insertIfAbsent(track)) {
                result.recordImported(track.getId());
            } else {
                log.warn("Track already exists: {}", track.getId());
                result.recordDuplicate(track.getId());
            }
        }
        log.info("Import finished: {} imported, {} failed, {} warnings",
                result.getImported(), result.getFailed(), result.getWarnings().size());
        return result;
    }

    private static <T> List<List<T>> partition(List<T> items, int size) {
        if (items.isEmpty()) {
            return Collections.emptyList();
        }
        List<List<T>> batches = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            batches.add(items.subList(start, Math.min(start + size, items.size())));
        }
        return batches;
    }
}
