package com.cratepilot.app.service;

import com.cratepilot.app.entity.CratePrompt;
import com.cratepilot.app.model.DerivedIntent;
import com.cratepilot.app.util.TrackFormatter;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Prompt texts for every model-assisted planning stage. Each one ends with the exact JSON shape the
 * matching payload class binds to.
 */
@Component
public class CratePromptFactory {

    private static final int REVISION_TOLERANCE_MINUTES = 5;

    public String deriveIntent(CratePrompt prompt, String seedTrackInfo) {
        String tempo = prompt.hasTempoRange()
                ? prompt.getTempoMin().intValue() + "-" + prompt.getTempoMax().intValue() + " BPM"
                : "Any";
        String duration = prompt.hasTargetDuration()
                ? prompt.getTargetDurationSec() / 60 + " minutes"
                : "Not specified";
        return """
                You are an expert DJ assistant analyzing an event prompt to create a structured crate plan.

                EVENT PROMPT:
                %s

                CONSTRAINTS:
                - Tempo Range: %s
                - Target Genre: %s
                - Target Duration: %s
                - Target Key: %s

                SEED TRACKS:
                %s

                Based on this information, derive a detailed intent for track selection. Return ONLY a JSON object with this structure:
                {
                  "tempoRange": { "min": number, "max": number },
                  "allowedKeys": ["8A", "9A", ...],
                  "targetGenres": ["Tech House", ...],
                  "duration": seconds,
                  "mixStyle": "smooth" | "energetic" | "eclectic",
                  "mustIncludeArtists": [],
                  "avoidArtists": [],
                  "mustIncludeTracks": [],
                  "avoidTracks": [],
                  "energyCurve": "linear" | "wave" | "peak",
                  "targetEnergy": 0.6,
                  "minPopularity": 30,
                  "targetKeyCamelot": "8A"
                }

                Guidelines:
                - For tempoRange, use the specified range or infer from context (sunset = 120-124, club = 125-130)
                - For allowedKeys, include harmonically compatible keys (same, adjacent, relative); "8A" means 8A, 7A, 9A, 8B
                - For targetGenres, extract genres from the prompt ("sunset vibes" = Tech House, Deep House)
                - For mixStyle, infer from the event description (sunset = smooth, club = energetic, peak hour = energetic)
                - For energyCurve, infer from event type (sunset = linear/wave, peak hour = peak, club = wave)
                - For targetEnergy (0-1): smooth/chill = 0.4-0.6, energetic = 0.7-0.9, peak = 0.8-1.0
                - For minPopularity (0-100): underground = 20-40, balanced = 30-60, mainstream = 50-80
                - For targetKeyCamelot: match the user's specified key if provided, otherwise omit
                - Keep artist and track arrays empty unless explicitly mentioned in the prompt
                - If no BPM is specified, infer it from genre and event type
                """.formatted(
                orDefault(prompt.getNotes(), "No description provided"),
                tempo,
                orDefault(prompt.getTargetGenre(), "Any"),
                duration,
                orDefault(prompt.getTargetKey(), "Any"),
                orDefault(seedTrackInfo, "None provided"));
    }

    public String queryPlan(DerivedIntent intent, List<String> availableGenreSeeds) {
        List<String> shownSeeds = availableGenreSeeds.subList(0, Math.min(30, availableGenreSeeds.size()));
        return """
                You are generating a Spotify Query Plan to find tracks matching a user's intent.

                USER INTENT:
                - Tempo Range: %s
                - Target Genres: %s
                - Mix Style: %s
                - Energy Curve: %s
                - Target Energy: %s
                - Min Popularity: %s
                - Must Include Artists: %s

                SPOTIFY API CONSTRAINTS (STRICT):
                1. Search queries can only use: artist:"...", track:"...", year:YYYY-YYYY
                2. Use plain text for genres (e.g., "tech house", "deep house")
                3. Do NOT use: bpm:, tempo:, key:, mood:, energy:, genre:, tag:

                AVAILABLE GENRE SEEDS for Recommendations:
                %s... (%d total)

                Return ONLY a JSON object:
                {
                  "searchQueries": ["tech house year:2021-2024", "artist:\\"Charlotte de Witte\\" year:2021-2024"],
                  "seedGenres": ["tech-house", "deep-house"],
                  "seedArtists": ["Charlotte de Witte"],
                  "seedTracks": [],
                  "tunables": { "min_tempo": 120, "max_tempo": 124, "target_energy": 0.6, "min_popularity": 30 },
                  "reasoning": "Brief explanation of the query strategy"
                }

                Guidelines:
                - searchQueries: 3-5 queries using plain text genres, year ranges and optional artist/track filters
                - seedGenres: pick 1-3 exact strings from the available genre seeds
                - seedArtists: 0-2 popular artists in the target genres
                - Total seeds (genres + artists + tracks) must not exceed 5
                """.formatted(
                intent.getTempoRange(),
                String.join(", ", intent.getTargetGenres()),
                intent.getMixStyle().getValue(),
                intent.energyCurveOrDefault().getValue(),
                intent.getTargetEnergy() != null ? intent.getTargetEnergy() : 0.6,
                intent.getMinPopularity() != null ? intent.getMinPopularity() : 30,
                joinOrNone(intent.getMustIncludeArtists()),
                String.join(", ", shownSeeds),
                availableGenreSeeds.size());
    }

    public String candidatePool(DerivedIntent intent, String trackList) {
        return """
                You are an expert DJ selecting tracks for a crate based on the user's intent and available tracks.

                USER INTENT:
                - Tempo Range: %s
                - Allowed Keys: %s
                - Target Genres: %s
                - Mix Style: %s
                - Energy Curve: %s
                - Must Include Artists: %s
                - Avoid Artists: %s

                AVAILABLE TRACKS:
                %s

                Your task: Select tracks that best match the user's intent and create a cohesive crate.

                Selection criteria:
                1. Prioritize tracks within the tempo range
                2. Consider harmonic compatibility (same key, adjacent keys, or relative keys)
                3. Match the mix style and energy curve
                4. Avoid tracks from the artists to avoid
                5. Limit to 2 tracks per artist
                6. Select 15-25 tracks

                Return ONLY a JSON object:
                {
                  "selectedTrackIds": ["track-id-1", "track-id-2", ...],
                  "reasoning": "Brief explanation of your selection strategy"
                }

                Only use track IDs that exist in the available tracks list above.
                """.formatted(
                intent.getTempoRange(),
                intent.getAllowedKeys().isEmpty() ? "Any key" : TrackFormatter.keyList(intent.getAllowedKeys()),
                String.join(", ", intent.getTargetGenres()),
                intent.getMixStyle().getValue(),
                intent.energyCurveOrDefault().getValue(),
                joinOrNone(intent.getMustIncludeArtists()),
                joinOrNone(intent.getAvoidArtists()),
                trackList);
    }

    public String sequencePlan(DerivedIntent intent, String trackInfo, String seedInfo) {
        int minutes = intent.getDurationSec() / 60;
        return """
                You are sequencing tracks for a DJ set to create optimal flow and energy progression.

                INTENT:
                - Duration Target: %d minutes (%d seconds)
                - Mix Style: %s
                - Energy Curve: %s
                - Avoid Artists: %s

                SEED TRACKS (must include):
                %s

                AVAILABLE TRACKS:
                %s

                Create an ordered tracklist that:
                1. Includes all seed tracks in good positions
                2. Considers harmonic compatibility (same key, adjacent keys, relative keys)
                3. Prefers gradual BPM changes over sudden jumps
                4. Follows the energy curve
                5. Limits each artist to 2 tracks
                6. Reaches approximately %d minutes total

                Return ONLY a JSON object:
                {
                  "orderedTrackIds": ["track-id-1", "track-id-2", ...],
                  "reasoning": "Brief explanation of sequencing strategy"
                }
                """.formatted(
                minutes, intent.getDurationSec(),
                intent.getMixStyle().getValue(),
                intent.energyCurveOrDefault().getValue(),
                joinOrNone(intent.getAvoidArtists()),
                seedInfo,
                trackInfo,
                minutes);
    }

    public String explainPlan(String trackDetails, int totalDurationSec) {
        return """
                You are explaining why a DJ crate works well for the given event.

                CRATE:
                %s

                Total Duration: %s

                Provide a concise explanation of:
                1. Overall flow and energy progression
                2. Track selection and sequencing strategy
                3. How the BPM and key progression supports the vibe
                4. How it fits the event atmosphere

                Keep it under 200 words and focus on DJ-relevant details.
                """.formatted(trackDetails, TrackFormatter.durationLong(totalDurationSec));
    }

    public String revision(String trackDetails, String instructions, String availableTrackInfo, int targetDurationSec) {
        int targetMinutes = targetDurationSec / 60;
        return """
                You are revising a DJ crate based on user feedback.

                CURRENT CRATE:
                %s

                USER INSTRUCTIONS:
                %s

                AVAILABLE TRACKS FOR REPLACEMENT:
                %s

                Revise the crate to address the user's feedback while keeping good energy flow, compatible keys
                and smooth BPM changes where possible.
                Target duration: %d minutes (%d seconds). Keep the total within ±%d minutes of the target.
                Only use track IDs from the current crate or the available tracks list.

                Return ONLY a JSON object:
                {
                  "revisedTrackIds": ["track-id-1", "track-id-2", ...],
                  "changesExplanation": "Which tracks were added, removed or reordered, and why"
                }
                """.formatted(trackDetails, instructions, availableTrackInfo,
                targetMinutes, targetDurationSec, REVISION_TOLERANCE_MINUTES);
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    private static String joinOrNone(List<String> values) {
        return values.isEmpty() ? "None" : String.join(", ", values);
    }
}
