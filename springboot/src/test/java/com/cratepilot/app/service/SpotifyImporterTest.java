package com.cratepilot.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cratepilot.app.config.GenreProfileConfig;
import com.cratepilot.app.dto.response.ImportResult;
import com.cratepilot.app.dto.spotify.AudioFeatures;
import com.cratepilot.app.dto.spotify.RecommendationRequest;
import com.cratepilot.app.dto.spotify.SpotifyAlbum;
import com.cratepilot.app.dto.spotify.SpotifyArtist;
import com.cratepilot.app.dto.spotify.SpotifyPage;
import com.cratepilot.app.dto.spotify.SpotifyTrack;
import com.cratepilot.app.entity.FeatureSource;
import com.cratepilot.app.entity.Track;
import com.cratepilot.app.exception.InvalidInputException;
import com.cratepilot.app.exception.MetadataSourceException;
import com.cratepilot.app.support.InMemoryTrackCatalog;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SpotifyImporterTest {

    private SpotifyClient client;
    private SpotifyTokenManager tokenManager;
    private InMemoryTrackCatalog catalog;
    private SpotifyImporter importer;
    private final List<Duration> sleeps = new ArrayList<>();
    private Retry retry;
    private TrackNormalizer normalizer;

    @BeforeEach
    void setUp() {
        client = mock(SpotifyClient.class);
        tokenManager = mock(SpotifyTokenManager.class);
        when(tokenManager.getValidToken()).thenReturn("tok");
        catalog = new InMemoryTrackCatalog();

        retry = Retry.of("spotify-test", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryOnException(e -> e instanceof MetadataSourceException source && source.isRetryable())
                .build());
        Clock clock = Clock.systemUTC();
        normalizer = new TrackNormalizer(
                new FeatureInferenceService(new GenreProfileConfig().genreProfiles(), new Random(3)), clock);
        RequestRateLimiter limiter = new RequestRateLimiter(1000, 100_000, clock, sleeps::add);

        importer = new SpotifyImporter(client, tokenManager, limiter, retry, normalizer, catalog,
                new ConstraintValidator(clock));
    }

    private static SpotifyTrack spotifyTrack(String id, String name) {
        return SpotifyTrack.builder()
                .id(id)
                .name(name)
                .artists(List.of(new SpotifyArtist("a-" + id, "Artist " + id, null)))
                .album(new SpotifyAlbum("al-" + id, "Album", "2022-05-01", null))
                .durationMs(300_000)
                .popularity(50)
                .build();
    }

    private static AudioFeatures features(String id, double tempo) {
        return AudioFeatures.builder().id(id).tempo(tempo).energy(0.7).key(0).mode(1).build();
    }

    private static MetadataSourceException status(int code) {
        return MetadataSourceException.fromStatus("test", code, "", null);
    }

    @Nested
    @DisplayName("Search import")
    class SearchImport {

        @Test
        @DisplayName("Imports hits once and reports the repeat as duplicates")
        void duplicateOnSecondImport() {
            when(client.searchTracks("tok", "deep house", 10))
                    .thenReturn(List.of(spotifyTrack("s1", "One"), spotifyTrack("s2", "Two")));
            when(client.getAudioFeatures(eq("tok"), anyList()))
                    .thenReturn(List.of(features("s1", 122.4), features("s2", 124.0)));

            ImportResult first = importer.searchAndImport("deep house", 10);
            ImportResult second = importer.searchAndImport("deep house", 10);

            assertThat(first.getImported()).isEqualTo(2);
            assertThat(first.getImportedTrackIds()).containsExactly("spotify-s1", "spotify-s2");
            assertThat(second.getImported()).isZero();
            assertThat(second.isSuccess()).isTrue();
            assertThat(second.getWarnings()).containsExactly(
                    "Track already exists: spotify-s1", "Track already exists: spotify-s2");
            assertThat(second.getResolvedTrackIds()).containsExactly("spotify-s1", "spotify-s2");
            assertThat(catalog.size()).isEqualTo(2);

            Track stored = catalog.findById("spotify-s1").orElseThrow();
            assertThat(stored.getBpm()).isEqualTo(122.0);
            assertThat(stored.getCamelotKey()).isEqualTo("8B");
            assertThat(stored.getGenre()).isEqualTo("house");
        }

        @Test
        @DisplayName("Limit is clamped to the provider maximum")
        void limitClamped() {
            when(client.searchTracks(anyString(), anyString(), anyInt())).thenReturn(List.of());

            ImportResult result = importer.searchAndImport("techno", 500);

            verify(client).searchTracks("tok", "techno", 50);
            assertThat(result.getWarnings()).containsExactly("No tracks found for query: techno");
        }

        @Test
        @DisplayName("Blank query is rejected before any request")
        void blankQuery() {
            assertThatThrownBy(() -> importer.searchAndImport("  ", 10)).isInstanceOf(InvalidInputException.class);
            assertThat(importer.getRequestCount()).isZero();
        }

        @Test
        @DisplayName("Forbidden audio features fall back to inference")
        void featuresForbidden() {
            when(client.searchTracks("tok", "techno", 5)).thenReturn(List.of(spotifyTrack("s1", "One")));
            when(client.getAudioFeatures(eq("tok"), anyList())).thenThrow(status(403));

            ImportResult result = importer.searchAndImport("techno", 5);

            assertThat(result.getImported()).isEqualTo(1);
            Track stored = catalog.findById("spotify-s1").orElseThrow();
            assertThat(stored.getFeatureSource()).isEqualTo(FeatureSource.INFERRED);
            assertThat(stored.getGenre()).isEqualTo("techno");
            verify(client, times(1)).getAudioFeatures(eq("tok"), anyList());
        }
    }

    @Nested
    @DisplayName("Retry policy")
    class RetryPolicy {

        @Test
        @DisplayName("Client errors are not retried")
        void clientErrorNotRetried() {
            when(client.getTrack("tok", "missing")).thenThrow(status(404));

            ImportResult result = importer.importById("spotify-missing");

            verify(client, times(1)).getTrack("tok", "missing");
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getFailed()).isEqualTo(1);
            assertThat(result.getErrors()).singleElement().asString().contains("404");
        }

        @Test
        @DisplayName("Server errors are retried until the call succeeds")
        void serverErrorRetried() {
            when(client.searchTracks("tok", "house", 1))
                    .thenThrow(status(503))
                    .thenThrow(status(502))
                    .thenReturn(List.of(spotifyTrack("s9", "Nine")));
            when(client.getAudioFeatures(eq("tok"), anyList())).thenReturn(List.of(features("s9", 126.0)));

            ImportResult result = importer.searchAndImport("house", 1);

            verify(client, times(3)).searchTracks("tok", "house", 1);
            assertThat(result.getImported()).isEqualTo(1);
            assertThat(importer.getRequestCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("Exhausted retries are reported, not thrown")
        void retriesExhausted() {
            when(client.searchTracks("tok", "house", 1)).thenThrow(status(500));

            ImportResult result = importer.searchAndImport("house", 1);

            verify(client, times(3)).searchTracks("tok", "house", 1);
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getFailed()).isZero();
        }

        @Test
        @DisplayName("Too-many-requests answers are retried after the requested pause")
        void rateLimitedRetried() {
            when(client.searchTracks("tok", "house", 1))
                    .thenThrow(MetadataSourceException.fromStatus("track search", 429, "", Duration.ofSeconds(2), null))
                    .thenReturn(List.of(spotifyTrack("s7", "Seven")));
            when(client.getAudioFeatures(eq("tok"), anyList())).thenReturn(List.of(features("s7", 125.0)));

            ImportResult result = importer.searchAndImport("house", 1);

            verify(client, times(2)).searchTracks("tok", "house", 1);
            assertThat(result.getImported()).isEqualTo(1);
            assertThat(result.getErrors()).isEmpty();
            assertThat(sleeps).anySatisfy(pause -> assertThat(pause.toMillis()).isBetween(1_000L, 2_000L));
        }

        @Test
        @DisplayName("Requested pause is capped")
        void rateLimitPauseCapped() {
            when(client.searchTracks("tok", "house", 1))
                    .thenThrow(MetadataSourceException.fromStatus("track search", 429, "", Duration.ofMinutes(10), null))
                    .thenReturn(List.of());

            importer.searchAndImport("house", 1);

            assertThat(sleeps).anySatisfy(pause -> assertThat(pause).isLessThanOrEqualTo(SpotifyImporter.MAX_RETRY_AFTER)
                    .isGreaterThan(Duration.ofSeconds(25)));
        }

        @Test
        @DisplayName("Interrupted quota wait is reported as a failed import")
        void interruptedWait() {
            RequestRateLimiter interrupting = new RequestRateLimiter(10, 100, Clock.systemUTC(), duration -> {
                throw new InterruptedException("shutdown");
            });
            interrupting.backOff(Duration.ofSeconds(5));
            SpotifyImporter stopping = new SpotifyImporter(client, tokenManager, interrupting, retry, normalizer, catalog,
                    new ConstraintValidator(Clock.systemUTC()));

            ImportResult result = stopping.searchAndImport("house", 1);

            assertThat(Thread.interrupted()).isTrue();
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrors()).singleElement().asString().contains("interrupted");
            verify(client, never()).searchTracks(anyString(), anyString(), anyInt());
        }

        @Test
        @DisplayName("Unauthorized answer drops the cached token")
        void unauthorizedInvalidatesToken() {
            when(client.getTrack("tok", "t1")).thenThrow(status(401));

            importer.importById("t1");

            verify(tokenManager).invalidate();
            verify(client, times(1)).getTrack("tok", "t1");
        }
    }

    @Nested
    @DisplayName("Batch import by id")
    class BatchImport {

        @Test
        @DisplayName("Ids are normalized, deduplicated and looked up in batches of fifty")
        void batchesOfFifty() {
            List<Integer> batchSizes = new ArrayList<>();
            when(client.getTracks(eq("tok"), anyList())).thenAnswer(invocation -> {
                List<String> batch = invocation.getArgument(1);
                batchSizes.add(batch.size());
                return batch.stream().map(id -> spotifyTrack(id, "Track " + id)).toList();
            });
            when(client.getAudioFeatures(eq("tok"), anyList())).thenAnswer(invocation -> {
                List<String> batch = invocation.getArgument(1);
                return batch.stream().map(id -> features(id, 124.0)).toList();
            });
            List<String> ids = new ArrayList<>(IntStream.range(0, 120).mapToObj(i -> "spotify-t" + i).toList());
            ids.add("t0");
            ids.add("spotify-t1");

            ImportResult result = importer.importByIds(ids);

            assertThat(batchSizes).containsExactly(50, 50, 20);
            assertThat(result.getImported()).isEqualTo(120);
            assertThat(result.getImportedTrackIds()).startsWith("spotify-t0", "spotify-t1");
            assertThat(catalog.size()).isEqualTo(120);
        }

        @Test
        @DisplayName("Empty id list imports nothing without calling the provider")
        void emptyIds() {
            ImportResult result = importer.importByIds(List.of());

            assertThat(result.getImported()).isZero();
            assertThat(result.isSuccess()).isTrue();
            verify(tokenManager, never()).getValidToken();
        }

        @Test
        @DisplayName("Rejected lookup fails every requested id")
        void rejectedLookup() {
            when(client.getTracks(eq("tok"), anyList())).thenThrow(status(400));

            ImportResult result = importer.importByIds(List.of("spotify-a", "b"));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getFailed()).isEqualTo(2);
            verify(client, times(1)).getTracks("tok", List.of("a", "b"));
        }
    }

    @Nested
    @DisplayName("Recommendations")
    class Recommendations {

        @Test
        @DisplayName("No seeds is a failure without a provider call")
        void noSeeds() {
            ImportResult result = importer.importRecommendations(RecommendationRequest.builder().build());

            assertThat(result.getErrors()).containsExactly("At least one seed (artist, track, or genre) is required");
            verify(client, never()).getRecommendations(anyString(), anyMap());
        }

        @Test
        @DisplayName("Genres take seed slots first and artist names are resolved to ids")
        @SuppressWarnings("unchecked")
        void seedsAndTunables() {
            when(client.searchArtists("tok", "Bicep", 1)).thenReturn(List.of(new SpotifyArtist("art-1", "Bicep", null)));
            when(client.getRecommendations(eq("tok"), anyMap())).thenReturn(List.of());

            importer.importRecommendations(RecommendationRequest.builder()
                    .seedGenres(List.of("house", "techno", "trance", "ambient"))
                    .seedArtists(List.of("Bicep", "Overflow"))
                    .targetKeyCamelot("8A")
                    .limit(30)
                    .build());

            ArgumentCaptor<Map<String, String>> params = ArgumentCaptor.forClass(Map.class);
            verify(client).getRecommendations(eq("tok"), params.capture());
            assertThat(params.getValue())
                    .containsEntry("seed_genres", "house,techno,trance,ambient")
                    .containsEntry("seed_artists", "art-1")
                    .containsEntry("limit", "30")
                    .containsEntry("target_key", "9")
                    .containsEntry("target_mode", "0");
            verify(client, never()).searchArtists("tok", "Overflow", 1);
        }
    }

    @Test
    @DisplayName("Playlist import pages until the limit is reached")
    void playlistPaging() {
        List<SpotifyPage.PlaylistItem> firstPage = IntStream.range(0, 100)
                .mapToObj(i -> new SpotifyPage.PlaylistItem(spotifyTrack("p" + i, "Track " + i)))
                .toList();
        when(client.getPlaylistTracks("tok", "pl", 0, 100))
                .thenReturn(new SpotifyPage.PlaylistTracks(firstPage, "next-url", 250));
        when(client.getAudioFeatures(eq("tok"), anyList())).thenAnswer(invocation -> {
            List<String> ids = invocation.getArgument(1);
            return ids.stream().map(id -> features(id, 120.0)).toList();
        });

        ImportResult result = importer.importFromPlaylist("pl", 40);

        assertThat(result.getImported()).isEqualTo(40);
        verify(client, never()).getPlaylistTracks("tok", "pl", 100, 100);
    }

    @Test
    @DisplayName("Genre seeds fall back to the built-in list and cache a live answer")
    void genreSeeds() {
        when(client.getGenreSeeds("tok")).thenThrow(status(404)).thenReturn(List.of("house", "techno"));

        assertThat(importer.listGenreSeeds()).isEqualTo(SpotifyImporter.FALLBACK_GENRE_SEEDS);
        assertThat(importer.listGenreSeeds()).containsExactly("house", "techno");
        assertThat(importer.listGenreSeeds()).containsExactly("house", "techno");
        verify(client, times(2)).getGenreSeeds("tok");
    }
}
