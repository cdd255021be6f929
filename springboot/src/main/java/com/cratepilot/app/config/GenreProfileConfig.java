package com.cratepilot.app.config;

import com.cratepilot.app.dto.spotify.GenreProfile;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Genre priors used when the provider withholds audio features.
 */
@Configuration
public class GenreProfileConfig {

    public static final String UNKNOWN_GENRE = "unknown";

    private static final List<String> URBAN_KEYS = List.of("8A", "9A", "10A", "11A", "1A", "2A");
    private static final List<String> DANCE_KEYS = List.of("8A", "8B", "9A", "9B", "10A", "10B");
    private static final List<String> DEFAULT_KEYS = List.of("8A", "9A", "10A");

    @Bean
    public Map<String, GenreProfile> genreProfiles() {
        Map<String, GenreProfile> profiles = new LinkedHashMap<>();

        // Urban
        profiles.put("rap", profile(75, 95, 3, URBAN_KEYS, false, false));
        profiles.put("hip-hop", profile(75, 95, 3, URBAN_KEYS, false, false));
        profiles.put("trap", profile(140, 160, 4, DEFAULT_KEYS, false, false));
        profiles.put("r&b", profile(70, 100, 2, DEFAULT_KEYS, false, false));

        // Club
        profiles.put("house", profile(120, 130, 4, DANCE_KEYS, true, true));
        profiles.put("techno", profile(125, 135, 4, List.of("8A", "9A", "10A", "11A", "12A"), true, true));
        profiles.put("trance", profile(130, 140, 5, List.of("8A", "8B", "9A", "9B", "10A"), true, true));
        profiles.put("drum and bass", profile(160, 180, 5, DEFAULT_KEYS, false, false));
        profiles.put("dubstep", profile(140, 150, 5, DEFAULT_KEYS, true, false));

        profiles.put("ambient", profile(60, 90, 1, List.of("5A", "6A", "7A", "8A", "9A"), false, false));
        profiles.put("pop", profile(100, 130, 3, DANCE_KEYS, false, true));
        profiles.put("rock", profile(110, 140, 4, DEFAULT_KEYS, false, false));
        profiles.put("indie", profile(90, 120, 2, DEFAULT_KEYS, false, false));

        profiles.put(UNKNOWN_GENRE, profile(100, 130, 3, DEFAULT_KEYS, false, false));
        return profiles;
    }

    private static GenreProfile profile(int minBpm, int maxBpm, int baseEnergy, List<String> djKeys,
                                        boolean electronic, boolean popularityBoost) {
        return GenreProfile.builder()
                .minBpm(minBpm)
                .maxBpm(maxBpm)
                .baseEnergy(baseEnergy)
                .djKeys(djKeys)
                .electronic(electronic)
                .popularityBoost(popularityBoost)
                .build();
    }
}
