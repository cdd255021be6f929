package com.cratepilot.app.util;

import java.util.Map;
import java.util.Optional;

/**
 * Maps Spotify pitch-class/mode pairs (key 0-11 with C = 0, mode 1 = major) to Camelot notation and back.
 */
public final class SpotifyKeyConverter {

    private static final String[] MINOR = {"5A", "12A", "7A", "2A", "9A", "4A", "11A", "6A", "1A", "8A", "3A", "10A"};
    private static final String[] MAJOR = {"8B", "3B", "10B", "5B", "12B", "7B", "2B", "9B", "4B", "11B", "6B", "1B"};
    private static final String[] PITCH_CLASSES = {"C", "C#", "D", "D#", "E", "F", "F#", "G", "G#", "A", "A#", "B"};

    private SpotifyKeyConverter() {
    }

    public static boolean isValidSpotifyKey(int key, int mode) {
        return key >= 0 && key <= 11 && (mode == 0 || mode == 1);
    }

    /**
     * Spotify reports -1 when no key was detected.
     */
    public static Optional<String> toCamelot(int key, int mode) {
        if (!isValidSpotifyKey(key, mode)) {
            return Optional.empty();
        }
        return Optional.of(mode == 1 ? MAJOR[key] : MINOR[key]);
    }

    public static Optional<SpotifyKey> fromCamelot(String camelotKey) {
        if (!CamelotWheel.isValidKey(camelotKey)) {
            return Optional.empty();
        }
        String[] table = camelotKey.endsWith("B") ? MAJOR : MINOR;
        for (int pitch = 0; pitch < table.length; pitch++) {
            if (table[pitch].equals(camelotKey)) {
                return Optional.of(new SpotifyKey(pitch, camelotKey.endsWith("B") ? 1 : 0));
            }
        }
        return Optional.empty();
    }

    public static Optional<String> toStandardNotation(int key, int mode) {
        if (!isValidSpotifyKey(key, mode)) {
            return Optional.empty();
        }
        return Optional.of(PITCH_CLASSES[key] + (mode == 1 ? " major" : " minor"));
    }

    public static Map<String, Object> asRecommendationTunables(String camelotKey) {
        return fromCamelot(camelotKey)
                .<Map<String, Object>>map(k -> Map.of("target_key", k.key(), "target_mode", k.mode()))
                .orElse(Map.of());
    }

    public record SpotifyKey(int key, int mode) {
    }
}
