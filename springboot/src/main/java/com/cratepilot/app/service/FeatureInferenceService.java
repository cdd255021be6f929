package com.cratepilot.app.service;

import com.cratepilot.app.config.GenreProfileConfig;
import com.cratepilot.app.dto.spotify.GenreProfile;
import com.cratepilot.app.dto.spotify.SpotifyArtist;
import com.cratepilot.app.dto.spotify.SpotifyTrack;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Approximates tempo, energy and key for tracks the provider returned without audio features.
 * Results are heuristics; callers flag them as inferred.
 */
@Service
@Slf4j
public class FeatureInferenceService {

    private static final int DEFAULT_RELEASE_YEAR = 2020;

    /** Checked in order; the first keyword found in the search context wins. */
    private static final Map<String, List<String>> CONTEXT_KEYWORDS = new LinkedHashMap<>();

    private static final Map<String, List<String>> ARTIST_HINTS = new LinkedHashMap<>();

    static {
        // "trap" contains "rap", so it is checked first
        CONTEXT_KEYWORDS.put("trap", List.of("trap"));
        CONTEXT_KEYWORDS.put("rap", List.of("rap", "hip-hop", "hip hop"));
        CONTEXT_KEYWORDS.put("house", List.of("house"));
        CONTEXT_KEYWORDS.put("techno", List.of("techno"));
        CONTEXT_KEYWORDS.put("trance", List.of("trance"));
        CONTEXT_KEYWORDS.put("drum and bass", List.of("drum and bass", "dnb"));
        CONTEXT_KEYWORDS.put("ambient", List.of("ambient"));
        CONTEXT_KEYWORDS.put("dubstep", List.of("dubstep"));
        CONTEXT_KEYWORDS.put("pop", List.of("pop"));
        CONTEXT_KEYWORDS.put("rock", List.of("rock"));
        CONTEXT_KEYWORDS.put("indie", List.of("indie"));
        CONTEXT_KEYWORDS.put("r&b", List.of("r&b", "rnb"));

        ARTIST_HINTS.put("rap", List.of("drake", "kendrick", "kanye", "jay-z", "eminem", "travis scott", "post malone"));
        ARTIST_HINTS.put("house", List.of("deadmau5", "skrillex", "calvin harris", "avicii", "swedish house mafia"));
        ARTIST_HINTS.put("techno", List.of("richie hawtin", "jeff mills", "adam beyer", "amelie lens"));
    }

    public record InferredFeatures(String genre, double bpm, int energy, String camelotKey) {
    }

    private final Map<String, GenreProfile> genreProfiles;
    private final Random random;

    @Autowired
    public FeatureInferenceService(Map<String, GenreProfile> genreProfiles) {
        this(genreProfiles, new Random());
    }

    public FeatureInferenceService(Map<String, GenreProfile> genreProfiles, Random random) {
        this.genreProfiles = genreProfiles;
        this.random = random;
    }

    public InferredFeatures infer(SpotifyTrack track, String searchContext) {
        String genre = detectGenre(track, searchContext);
        InferredFeatures features = new InferredFeatures(genre, inferBpm(track, genre), inferEnergy(track, genre), inferKey(genre));
        log.debug("Inferred features for '{}': {}", track.getName(), features);
        return features;
    }

    /**
     * Search-context keywords first, then a short list of well-known artists, else {@code unknown}.
     */
    public String detectGenre(SpotifyTrack track, String searchContext) {
        String context = searchContext == null ? "" : searchContext.toLowerCase();
        for (Map.Entry<String, List<String>> entry : CONTEXT_KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(context::contains)) {
                return entry.getKey();
            }
        }

        String artist = primaryArtist(track).toLowerCase();
        for (Map.Entry<String, List<String>> entry : ARTIST_HINTS.entrySet()) {
            if (entry.getValue().stream().anyMatch(artist::contains)) {
                return entry.getKey();
            }
        }
        return GenreProfileConfig.UNKNOWN_GENRE;
    }

    public double inferBpm(SpotifyTrack track, String genre) {
        GenreProfile profile = profileFor(genre);
        int min = profile.getMinBpm();
        int max = profile.getMaxBpm();

        int shift = 0;
        if (profile.isElectronic() && releaseYear(track) > 2015) {
            shift += 5;
        }
        String title = title(track);
        if (title.contains("fast") || title.contains("speed") || title.contains("upbeat")) {
            shift += 10;
        }
        if (title.contains("slow") || title.contains("chill") || title.contains("ambient")) {
            shift -= 15;
        }

        return Math.round(min + shift + random.nextDouble() * (max - min));
    }

    public int inferEnergy(SpotifyTrack track, String genre) {
        GenreProfile profile = profileFor(genre);
        int energy = profile.getBaseEnergy();

        if (profile.isPopularityBoost() && track.getPopularity() != null && track.getPopularity() > 70) {
            energy++;
        }
        String title = title(track);
        if (title.contains("energy") || title.contains("power") || title.contains("boost")) {
            energy++;
        }
        if (title.contains("chill") || title.contains("ambient") || title.contains("relax")) {
            energy--;
        }
        return Math.max(1, Math.min(5, energy));
    }

    public String inferKey(String genre) {
        List<String> keys = profileFor(genre).getDjKeys();
        return keys.get(random.nextInt(keys.size()));
    }

    private GenreProfile profileFor(String genre) {
        GenreProfile profile = genreProfiles.get(genre);
        return profile != null ? profile : genreProfiles.get(GenreProfileConfig.UNKNOWN_GENRE);
    }

    private static String primaryArtist(SpotifyTrack track) {
        List<SpotifyArtist> artists = track.getArtists();
        if (artists == null || artists.isEmpty() || artists.get(0).getName() == null) {
            return "";
        }
        return artists.get(0).getName();
    }

    private static String title(SpotifyTrack track) {
        return track.getName() == null ? "" : track.getName().toLowerCase();
    }

    static int releaseYear(SpotifyTrack track) {
        Integer year = TrackNormalizer.parseYear(track.getAlbum() != null ? track.getAlbum().getReleaseDate() : null);
        return year != null ? year : DEFAULT_RELEASE_YEAR;
    }
}
