package com.cratepilot.app.dto.ai;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IntentPayload {

    private Range tempoRange;
    private List<String> allowedKeys;
    private List<String> targetGenres;

    @JsonAlias({"durationSec", "duration_sec"})
    private Double duration;

    private String mixStyle;
    private List<String> mustIncludeArtists;
    private List<String> avoidArtists;
    private List<String> mustIncludeTracks;
    private List<String> avoidTracks;
    private String energyCurve;
    private Double targetEnergy;
    private Integer minPopularity;
    private String targetKeyCamelot;

    public boolean hasRequiredShape() {
        return tempoRange != null && tempoRange.getMin() != null && tempoRange.getMax() != null
                && duration != null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Range {
        private Double min;
        private Double max;
    }
}
