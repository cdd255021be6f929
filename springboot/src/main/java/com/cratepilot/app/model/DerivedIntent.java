package com.cratepilot.app.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Structured restatement of a prompt. The builder materializes every list, so none is ever null.
 */
@Value
@Builder(toBuilder = true)
public class DerivedIntent {

    TempoRange tempoRange;

    @Singular(ignoreNullCollections = true)
    List<String> allowedKeys;

    @Singular(ignoreNullCollections = true)
    List<String> targetGenres;

    int durationSec;

    @Builder.Default
    MixStyle mixStyle = MixStyle.SMOOTH;

    @Singular(ignoreNullCollections = true)
    List<String> mustIncludeArtists;

    @Singular(ignoreNullCollections = true)
    List<String> avoidArtists;

    @Singular(ignoreNullCollections = true)
    List<String> mustIncludeTracks;

    @Singular(ignoreNullCollections = true)
    List<String> avoidTracks;

    EnergyCurve energyCurve;

    /** 0-1, only meaningful when the candidate source exposes energy. */
    Double targetEnergy;

    /** 0-100, only meaningful when the candidate source exposes popularity. */
    Integer minPopularity;

    String targetKeyCamelot;

    public EnergyCurve energyCurveOrDefault() {
        return energyCurve != null ? energyCurve : EnergyCurve.LINEAR;
    }
}
