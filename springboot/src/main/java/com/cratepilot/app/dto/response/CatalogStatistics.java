package com.cratepilot.app.dto.response;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CatalogStatistics {
    long totalTracks;
    Map<String, Long> tracksByGenre;
    Map<String, Long> tracksByKey;
    double averageBpm;
    long totalDurationSec;
    long inferredTracks;
}
