package com.cratepilot.app.dto.spotify;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Seeds are names (artists, tracks) or genre-seed strings; the importer resolves names to ids.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationRequest {

    @Builder.Default
    private List<String> seedGenres = new ArrayList<>();

    @Builder.Default
    private List<String> seedArtists = new ArrayList<>();

    @Builder.Default
    private List<String> seedTracks = new ArrayList<>();

    private Double minTempo;
    private Double maxTempo;
    private Double targetEnergy;     // 0.0-1.0
    private Integer minPopularity;   // 0-100
    private String targetKeyCamelot;

    @Builder.Default
    private Integer limit = 20;
}
