package com.cratepilot.app.service;

import com.cratepilot.app.dto.response.ValidationResult;
import com.cratepilot.app.entity.CratePlan;
import com.cratepilot.app.entity.CratePrompt;
import com.cratepilot.app.entity.Track;
import com.cratepilot.app.entity.TrackSection;
import com.cratepilot.app.model.DerivedIntent;
import com.cratepilot.app.model.TempoRange;
import com.cratepilot.app.model.TrackFilter;
import com.cratepilot.app.util.CamelotWheel;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Stateless checks over tracks, prompts, intents, filters and plans.
 *
 * <p>Problems that must block a transition are errors; oddities a DJ may accept are warnings.
 * Nothing here throws for a failed check.
 */
@Component
public class ConstraintValidator {

    public static final int DEFAULT_DURATION_TOLERANCE_SEC = 300;

    private static final double TYPICAL_BPM_MIN = 60;
    private static final double TYPICAL_BPM_MAX = 200;
    private static final double WIDE_BPM_RANGE = 40;
    private static final int SHORT_TRACK_SEC = 30;
    private static final int LONG_TRACK_SEC = 900;
    private static final int SHORT_SET_SEC = 600;
    private static final int LONG_SET_SEC = 14_400;
    private static final int FEW_TRACKS = 5;
    private static final int MANY_TRACKS = 50;

    private final Clock clock;

    public ConstraintValidator(Clock clock) {
        this.clock = clock;
    }

    public ValidationResult validateTrack(Track track) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (!StringUtils.hasText(track.getId())) errors.add("Track ID is required");
        if (!StringUtils.hasText(track.getArtist())) errors.add("Artist is required");
        if (!StringUtils.hasText(track.getTitle())) errors.add("Title is required");

        if (track.getBpm() == null || track.getBpm() <= 0) {
            errors.add("BPM is required");
        } else if (track.getBpm() < TYPICAL_BPM_MIN || track.getBpm() > TYPICAL_BPM_MAX) {
            warnings.add("BPM " + track.getBpm() + " is outside typical range (60-200)");
        }

        if (!StringUtils.hasText(track.getCamelotKey())) {
            errors.add("Key is required");
        } else if (!CamelotWheel.isValidKey(track.getCamelotKey())) {
            errors.add("Invalid Camelot key: " + track.getCamelotKey());
        }

        if (track.getDurationSec() == null || track.getDurationSec() < 0) {
            errors.add("Duration is required");
        } else if (track.getDurationSec() < SHORT_TRACK_SEC) {
            warnings.add("Track duration is very short (< 30 seconds)");
        } else if (track.getDurationSec() > LONG_TRACK_SEC) {
            warnings.add("Track duration is very long (> 15 minutes)");
        }

        if (track.getEnergy() != null && (track.getEnergy() < 1 || track.getEnergy() > 5)) {
            errors.add("Energy must be between 1 and 5");
        }

        int nextYear = Year.now(clock).getValue() + 1;
        if (track.getReleaseYear() != null && (track.getReleaseYear() < 1900 || track.getReleaseYear() > nextYear)) {
            warnings.add("Year " + track.getReleaseYear() + " seems unusual");
        }

        if (track.getSections() != null) {
            for (TrackSection section : track.getSections()) {
                if (section.getStartTime() == null || section.getEndTime() == null
                        || section.getEndTime() < section.getStartTime()) {
                    errors.add("Section " + section.getType() + " must end at or after its start");
                }
            }
        }

        return ValidationResult.of(errors, warnings);
    }

    public ValidationResult validateTrackForExport(Track track) {
        if (!StringUtils.hasText(track.getFilePath())) {
            return ValidationResult.of(List.of("Track " + track.getId() + " has no file path"), List.of());
        }
        return ValidationResult.ok();
    }

    public ValidationResult validatePrompt(CratePrompt prompt) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (prompt.getTempoMin() != null || prompt.getTempoMax() != null) {
            if (!prompt.hasTempoRange()) {
                errors.add("Tempo range needs both a minimum and a maximum");
            } else if (prompt.getTempoMin() <= 0 || prompt.getTempoMax() <= 0) {
                errors.add("BPM values must be positive");
            } else if (prompt.getTempoMin() > prompt.getTempoMax()) {
                errors.add("Minimum BPM cannot be greater than maximum BPM");
            } else {
                if (prompt.getTempoMin() < TYPICAL_BPM_MIN || prompt.getTempoMax() > TYPICAL_BPM_MAX) {
                    warnings.add("BPM range is outside typical DJ range (60-200)");
                }
                if (prompt.getTempoMax() - prompt.getTempoMin() > WIDE_BPM_RANGE) {
                    warnings.add("Wide BPM range may make mixing difficult");
                }
            }
        }

        if (StringUtils.hasText(prompt.getTargetKey()) && !CamelotWheel.isValidKey(prompt.getTargetKey())) {
            errors.add("Invalid target key: " + prompt.getTargetKey());
        }

        if (prompt.getTargetDurationSec() != null) {
            if (prompt.getTargetDurationSec() < 0) {
                errors.add("Target duration must not be negative");
            } else if (prompt.getTargetDurationSec() > 0 && prompt.getTargetDurationSec() < SHORT_SET_SEC) {
                warnings.add("Target duration is very short (< 10 minutes)");
            } else if (prompt.getTargetDurationSec() > LONG_SET_SEC) {
                warnings.add("Target duration is very long (> 4 hours)");
            }
        }

        return ValidationResult.of(errors, warnings);
    }

    public ValidationResult validateIntent(DerivedIntent intent) {
        List<String> errors = new ArrayList<>();

        TempoRange range = intent.getTempoRange();
        if (range == null || !range.isWellFormed()) {
            errors.add("Invalid tempo range in derived intent");
        }
        if (intent.getDurationSec() <= 0) {
            errors.add("Invalid duration in derived intent");
        }
        for (String key : intent.getAllowedKeys()) {
            if (!CamelotWheel.isValidKey(key)) {
                errors.add("Invalid key in allowedKeys: " + key);
            }
        }
        if (intent.getMixStyle() == null) {
            errors.add("Invalid mix style: null");
        }
        if (intent.getTargetKeyCamelot() != null && !CamelotWheel.isValidKey(intent.getTargetKeyCamelot())) {
            errors.add("Invalid targetKeyCamelot: " + intent.getTargetKeyCamelot());
        }
        if (intent.getTargetEnergy() != null && (intent.getTargetEnergy() < 0 || intent.getTargetEnergy() > 1)) {
            errors.add("targetEnergy must be between 0 and 1");
        }
        if (intent.getMinPopularity() != null && (intent.getMinPopularity() < 0 || intent.getMinPopularity() > 100)) {
            errors.add("minPopularity must be between 0 and 100");
        }

        return ValidationResult.of(errors, List.of());
    }

    public ValidationResult validateFilter(TrackFilter filter) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        TempoRange range = filter.getBpmRange();
        if (range != null) {
            if (range.getMin() > range.getMax()) {
                errors.add("BPM range min cannot be greater than max");
            }
            if (range.getMin() <= 0 || range.getMax() <= 0) {
                errors.add("BPM values must be positive");
            }
        }
        if (filter.getEnergyMin() != null || filter.getEnergyMax() != null) {
            int min = filter.getEnergyMin() != null ? filter.getEnergyMin() : 1;
            int max = filter.getEnergyMax() != null ? filter.getEnergyMax() : 5;
            if (min < 1 || max > 5) {
                errors.add("Energy range must be between 1 and 5");
            }
            if (min > max) {
                errors.add("Energy range min cannot be greater than max");
            }
        }
        if (filter.getDurationMin() != null && filter.getDurationMax() != null
                && filter.getDurationMin() > filter.getDurationMax()) {
            errors.add("Duration range min cannot be greater than max");
        }
        if ((filter.getDurationMin() != null && filter.getDurationMin() < 0)
                || (filter.getDurationMax() != null && filter.getDurationMax() < 0)) {
            errors.add("Duration values must be positive");
        }
        for (String key : filter.getKeys()) {
            if (!CamelotWheel.isValidKey(key)) {
                errors.add("Invalid key in keys array: " + key);
            }
        }
        if (filter.getArtist() != null && filter.getExcludeArtists().stream()
                .anyMatch(excluded -> excluded.equalsIgnoreCase(filter.getArtist()))) {
            warnings.add("Artist filter conflicts with exclude list");
        }

        return ValidationResult.of(errors, warnings);
    }

    public ValidationResult validatePlan(CratePlan plan) {
        return validatePlan(plan, DEFAULT_DURATION_TOLERANCE_SEC, null);
    }

    /**
     * @param resolvableIds ids known to the catalog, or null to skip the resolvability check
     */
    public ValidationResult validatePlan(CratePlan plan, int toleranceSec, Set<String> resolvableIds) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> trackList = plan.getTrackList();

        if (trackList == null || trackList.isEmpty()) {
            errors.add("Plan has no tracks");
            return ValidationResult.of(errors, warnings);
        }

        if (new HashSet<>(trackList).size() != trackList.size()) {
            errors.add("Duplicate tracks found in plan");
        }

        if (resolvableIds != null) {
            List<String> missing = trackList.stream().filter(id -> !resolvableIds.contains(id)).distinct().toList();
            if (!missing.isEmpty()) {
                errors.add("Tracks not found in catalog: " + String.join(", ", missing));
            }
        }

        CratePrompt prompt = plan.getPrompt();
        if (prompt != null && prompt.hasTargetDuration()) {
            int target = prompt.getTargetDurationSec();
            int diff = Math.abs(plan.getTotalDurationSec() - target);
            if (diff > toleranceSec) {
                errors.add("Duration " + plan.getTotalDurationSec() / 60 + "min is outside tolerance (target: "
                        + target / 60 + "min ± " + toleranceSec / 60 + "min)");
            } else if (diff > toleranceSec * 0.5) {
                warnings.add("Duration is close to tolerance limit");
            }
        }

        if (plan.getTotalDurationSec() < SHORT_SET_SEC) {
            warnings.add("Set is very short (< 10 minutes)");
        }

        if (trackList.size() < FEW_TRACKS) {
            warnings.add("Very few tracks in plan (< 5)");
        } else if (trackList.size() > MANY_TRACKS) {
            warnings.add("Very many tracks in plan (> 50)");
        }

        return ValidationResult.of(errors, warnings);
    }

    public ValidationResult validateForFinalization(CratePlan plan, int toleranceSec, Set<String> resolvableIds) {
        List<String> errors = new ArrayList<>();
        if (plan.isFinalized()) {
            errors.add("Plan is already finalized");
        }
        ValidationResult basic = validatePlan(plan, toleranceSec, resolvableIds);
        errors.addAll(basic.getErrors());
        return ValidationResult.of(errors, basic.getWarnings());
    }

    public boolean satisfiesAllConstraints(Track track, TrackFilter filter) {
        return filter.matches(track);
    }

    public List<String> getConstraintViolations(Track track, TrackFilter filter) {
        List<String> violations = new ArrayList<>();
        TempoRange range = filter.getBpmRange();
        if (range != null && (track.getBpm() == null || !range.contains(track.getBpm()))) {
            violations.add("BPM " + track.getBpm() + " is outside range " + range);
        }
        if (!filter.getGenres().isEmpty() && (track.getGenre() == null
                || filter.getGenres().stream().noneMatch(g -> g.equalsIgnoreCase(track.getGenre())))) {
            violations.add("Genre \"" + track.getGenre() + "\" does not match required " + filter.getGenres());
        }
        if (!filter.getKeys().isEmpty() && !filter.getKeys().contains(track.getCamelotKey())) {
            violations.add("Key \"" + track.getCamelotKey() + "\" is not one of " + filter.getKeys());
        }
        if ((filter.getEnergyMin() != null && (track.getEnergy() == null || track.getEnergy() < filter.getEnergyMin()))
                || (filter.getEnergyMax() != null && (track.getEnergy() == null || track.getEnergy() > filter.getEnergyMax()))) {
            violations.add("Energy " + track.getEnergy() + " is outside range "
                    + filter.getEnergyMin() + "-" + filter.getEnergyMax());
        }
        return violations;
    }
}
