package com.cratepilot.app.model;

import lombok.Builder;
import lombok.Value;

/**
 * Effective planner configuration. Immutable; {@code CratePlanner.updateSettings} swaps in a new value.
 */
@Value
@Builder(toBuilder = true)
public class PlannerSettings {

    @Builder.Default
    int durationToleranceSec = 300;

    @Builder.Default
    int defaultDurationSec = 3600;

    @Builder.Default
    double defaultTempoMin = 118;

    @Builder.Default
    double defaultTempoMax = 130;

    @Builder.Default
    int revisionMinChars = 5;

    @Builder.Default
    int revisionMaxChars = 500;

    @Builder.Default
    int revisionDriftWarnSec = 600;

    /** Upper bound on tracks listed inside a single model prompt. */
    @Builder.Default
    int maxPromptTracks = 80;

    @Builder.Default
    boolean useLlmQueryPlan = true;

    @Builder.Default
    int searchLimit = 20;

    public static PlannerSettings defaults() {
        return PlannerSettings.builder().build();
    }
}
