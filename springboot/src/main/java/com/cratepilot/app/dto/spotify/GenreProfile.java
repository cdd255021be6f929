package com.cratepilot.app.dto.spotify;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenreProfile {
    private Integer minBpm;
    private Integer maxBpm;
    private Integer baseEnergy;      // 1-5
    private List<String> djKeys;     // Camelot keys that mix well in the genre
    private boolean electronic;      // modern production pushes tempo up
    private boolean popularityBoost; // hits in this genre skew higher energy
}
