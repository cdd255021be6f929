package com.cratepilot.app.dto.spotify;

import lombok.Builder;
import lombok.Value;

/**
 * A provider track plus whatever audio data could be fetched for it.
 */
@Value
@Builder(toBuilder = true)
public class RawTrackRecord {
    SpotifyTrack track;
    AudioFeatures features;
    AudioAnalysis analysis;
    /** Query text the record was found with, used as a genre hint. */
    String searchContext;
}
