package com.cratepilot.app.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum EnergyCurve {
    LINEAR("linear"),
    WAVE("wave"),
    PEAK("peak");

    private final String value;

    public static Optional<EnergyCurve> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values()).filter(curve -> curve.value.equals(normalized)).findFirst();
    }
}
