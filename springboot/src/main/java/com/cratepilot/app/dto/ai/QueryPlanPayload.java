package com.cratepilot.app.dto.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Search and recommendation plan for the external source, produced by the model or by the fallback builder.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryPlanPayload {

    @Builder.Default
    private List<String> searchQueries = new ArrayList<>();

    @Builder.Default
    private List<String> seedGenres = new ArrayList<>();

    @Builder.Default
    private List<String> seedArtists = new ArrayList<>();

    @Builder.Default
    private List<String> seedTracks = new ArrayList<>();

    private Tunables tunables;
    private String reasoning;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Tunables {
        @JsonProperty("min_tempo")
        private Double minTempo;

        @JsonProperty("max_tempo")
        private Double maxTempo;

        @JsonProperty("target_energy")
        private Double targetEnergy;

        @JsonProperty("min_popularity")
        private Integer minPopularity;
    }
}
