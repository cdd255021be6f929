package com.cratepilot.app.dto.spotify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AudioFeatures {
    private String id;
    private Double tempo;        // BPM
    private Double energy;       // 0.0 - 1.0
    private Integer key;         // pitch class 0-11, -1 when undetected
    private Integer mode;        // 1 major, 0 minor
    private Double valence;
    private Double danceability;

    @JsonProperty("duration_ms")
    private Integer durationMs;
}
