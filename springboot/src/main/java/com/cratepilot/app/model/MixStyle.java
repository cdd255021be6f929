package com.cratepilot.app.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum MixStyle {
    SMOOTH("smooth", 2, 0.3),
    ENERGETIC("energetic", 4, 0.3),
    ECLECTIC("eclectic", 3, 0.4);

    private final String value;
    /** Energy (1-5) assumed for tracks that carry none. */
    private final int defaultEnergy;
    /** Allowed distance on the 0-1 energy scale. */
    private final double energyTolerance;

    public static Optional<MixStyle> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values()).filter(style -> style.value.equals(normalized)).findFirst();
    }
}
