package com.cratepilot.app.service;

import com.cratepilot.app.dto.ai.IntentPayload;
import com.cratepilot.app.dto.ai.PoolSelectionPayload;
import com.cratepilot.app.dto.ai.RevisionPayload;
import com.cratepilot.app.dto.ai.SequencePayload;
import com.cratepilot.app.dto.response.FinalizationResult;
import com.cratepilot.app.dto.response.RevisionResult;
import com.cratepilot.app.dto.response.ValidationResult;
import com.cratepilot.app.entity.CratePlan;
import com.cratepilot.app.entity.CratePrompt;
import com.cratepilot.app.entity.PlanDetails;
import com.cratepilot.app.entity.Track;
import com.cratepilot.app.exception.InvalidInputException;
import com.cratepilot.app.exception.LlmException;
import com.cratepilot.app.exception.LlmResponseParseException;
import com.cratepilot.app.exception.PlanningException;
import com.cratepilot.app.exception.ResourceNotFoundException;
import com.cratepilot.app.model.CandidatePool;
import com.cratepilot.app.model.DerivedIntent;
import com.cratepilot.app.model.EnergyCurve;
import com.cratepilot.app.model.MixStyle;
import com.cratepilot.app.model.PlannerSettings;
import com.cratepilot.app.model.TempoRange;
import com.cratepilot.app.model.TrackFilter;
import com.cratepilot.app.util.CamelotWheel;
import com.cratepilot.app.util.TrackFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Crate planning pipeline: prompt, intent, candidate pool, sequence, then explain, revise, validate
 * and finalize. Each model-assisted stage has a deterministic twin it falls back to, except revision,
 * which fails with {@link PlanningException}.
 */
@Service
@Slf4j
public class CratePlanner {

    private final TrackCatalog catalog;
    private final ConstraintValidator validator;
    private final SearchOrchestrator searchOrchestrator;
    private final LlmClient llmClient;
    private final LlmResponseParser responseParser;
    private final CratePromptFactory promptFactory;

    private volatile PlannerSettings settings;

    public CratePlanner(TrackCatalog catalog,
                        ConstraintValidator validator,
                        SearchOrchestrator searchOrchestrator,
                        LlmClient llmClient,
                        LlmResponseParser responseParser,
                        CratePromptFactory promptFactory,
                        PlannerSettings settings) {
        this.catalog = catalog;
        this.validator = validator;
        this.searchOrchestrator = searchOrchestrator;
        this.llmClient = llmClient;
        this.responseParser = responseParser;
        this.promptFactory = promptFactory;
        this.settings = settings;
    }

    public PlannerSettings getSettings() {
        return settings;
    }

    public synchronized PlannerSettings updateSettings(UnaryOperator<PlannerSettings> update) {
        settings = update.apply(settings);
        log.info("Planner settings updated: {}", settings);
        return settings;
    }

    /**
     * Runs validation, intent derivation, pool generation and sequencing, and returns a draft.
     */
    public CratePlan plan(CratePrompt prompt, List<String> seedTrackIds, boolean useLlm) {
        log.info("Planning crate (model-assisted: {}, seeds: {})", useLlm, seedTrackIds.size());
        requireValidPrompt(prompt);
        resolveSeeds(seedTrackIds);

        DerivedIntent intent = useLlm ? deriveIntentWithLlm(prompt, seedTrackIds) : deriveIntent(prompt, seedTrackIds);
        CandidatePool pool = useLlm ? generateCandidatePoolWithLlm(intent, prompt) : generateCandidatePool(intent, prompt);
        log.info("Candidate pool: {} tracks ({})", pool.size(), pool.getOrigin());

        CratePlan plan = useLlm ? sequencePlanWithLlm(intent, pool, seedTrackIds) : sequencePlan(intent, pool, seedTrackIds);
        log.info("Draft plan with {} tracks, {}s", plan.getTrackList().size(), plan.getTotalDurationSec());
        return plan;
    }

    // ---- intent ----

    public DerivedIntent deriveIntent(CratePrompt prompt, List<String> seedTrackIds) {
        requireValidPrompt(prompt);
        List<Track> seeds = resolveSeeds(seedTrackIds);
        PlannerSettings current = settings;

        TempoRange tempo = prompt.hasTempoRange()
                ? TempoRange.of(prompt.getTempoMin(), prompt.getTempoMax())
                : TempoRange.of(current.getDefaultTempoMin(), current.getDefaultTempoMax());

        DerivedIntent.DerivedIntentBuilder intent = DerivedIntent.builder()
                .tempoRange(tempo)
                .durationSec(prompt.hasTargetDuration() ? prompt.getTargetDurationSec() : current.getDefaultDurationSec())
                .mixStyle(MixStyle.SMOOTH)
                .mustIncludeTracks(seeds.stream().map(Track::getId).toList());

        if (StringUtils.hasText(prompt.getTargetKey())) {
            intent.allowedKeys(CamelotWheel.compatibleKeys(prompt.getTargetKey()))
                    .targetKeyCamelot(prompt.getTargetKey());
        }
        if (StringUtils.hasText(prompt.getTargetGenre())) {
            intent.targetGenre(prompt.getTargetGenre());
        }
        return intent.build();
    }

    /**
     * Asks the model for an intent and falls back to {@link #deriveIntent} when the model fails or
     * its answer is unparseable, misshapen or rejected by the validator.
     */
    public DerivedIntent deriveIntentWithLlm(CratePrompt prompt, List<String> seedTrackIds) {
        DerivedIntent fallback = deriveIntent(prompt, seedTrackIds);
        List<Track> seeds = resolveSeeds(seedTrackIds);

        String response;
        try {
            response = llmClient.execute(promptFactory.deriveIntent(prompt, TrackFormatter.seedTracks(seeds)));
        } catch (LlmException e) {
            log.warn("Intent derivation failed ({}), using deterministic intent", e.getMessage());
            return fallback;
        }

        return responseParser.parseOrFallback(response, IntentPayload.class, IntentPayload::hasRequiredShape,
                payload -> toIntent(payload, fallback).filter(this::acceptedByValidator),
                () -> fallback);
    }

    private boolean acceptedByValidator(DerivedIntent intent) {
        ValidationResult validation = validator.validateIntent(intent);
        if (!validation.isValid()) {
            log.warn("Model intent rejected ({})", validation.getErrors());
        }
        return validation.isValid();
    }

    // ---- candidate pool ----

    public CandidatePool generateCandidatePool(DerivedIntent intent, CratePrompt prompt) {
        return searchOrchestrator.findCandidates(intent, prompt, false, settings.getSearchLimit());
    }

    /**
     * Orchestrator results narrowed by a model selection. The selection may only name ids from the
     * raw pool; an unusable or empty selection keeps the raw pool.
     */
    public CandidatePool generateCandidatePoolWithLlm(DerivedIntent intent, CratePrompt prompt) {
        PlannerSettings current = settings;
        CandidatePool raw = searchOrchestrator.findCandidates(intent, prompt, current.isUseLlmQueryPlan(), current.getSearchLimit());
        if (raw.isEmpty()) {
            return raw;
        }

        List<Track> tracks = catalog.findAllById(raw.getTrackIds());
        List<Track> shown = tracks.subList(0, Math.min(tracks.size(), current.getMaxPromptTracks()));

        String response;
        try {
            response = llmClient.execute(promptFactory.candidatePool(intent, TrackFormatter.trackList(shown, false)));
        } catch (LlmException e) {
            log.warn("Pool selection failed ({}), keeping all {} candidates", e.getMessage(), raw.size());
            return raw;
        }

        return responseParser.parseOrFallback(response, PoolSelectionPayload.class,
                payload -> payload.getSelectedTrackIds() != null,
                payload -> narrow(raw, payload, prompt),
                () -> raw);
    }

    private static Optional<CandidatePool> narrow(CandidatePool raw, PoolSelectionPayload payload, CratePrompt prompt) {
        Set<String> selected = payload.getSelectedTrackIds().stream()
                .filter(raw::contains)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (selected.isEmpty()) {
            return Optional.empty();
        }
        log.info("Model selected {} of {} candidates", selected.size(), raw.size());
        return Optional.of(CandidatePool.of(prompt, selected, raw.getFiltersApplied() + "; model selection",
                CandidatePool.Origin.LLM_SELECTION));
    }

    // ---- sequencing ----

    /**
     * Seeds first, then pool tracks in ascending BPM until the target duration is reached.
     */
    public CratePlan sequencePlan(DerivedIntent intent, CandidatePool pool, List<String> seedTrackIds) {
        List<Track> seeds = resolveSeeds(seedTrackIds);
        List<String> trackList = new ArrayList<>();
        int total = 0;
        for (Track seed : seeds) {
            trackList.add(seed.getId());
            total += duration(seed);
        }

        List<Track> remaining = new ArrayList<>(catalog.findAllById(pool.getTrackIds()).stream()
                .filter(track -> !trackList.contains(track.getId()))
                .filter(track -> !isAvoided(track, intent))
                .toList());
        remaining.sort(Comparator.comparingDouble(track -> track.getBpm() != null ? track.getBpm() : 0.0));

        for (Track track : remaining) {
            if (total >= intent.getDurationSec()) {
                break;
            }
            trackList.add(track.getId());
            total += duration(track);
        }

        return CratePlan.builder()
                .prompt(pool.getSourcePrompt())
                .trackList(trackList)
                .totalDurationSec(total)
                .annotations("Sequenced by ascending BPM from " + pool.size() + " candidates")
                .details(PlanDetails.deterministic("seeds: " + seeds.size() + ", pool: " + pool.getFiltersApplied()))
                .finalized(false)
                .build();
    }

    /**
     * Model ordering restricted to catalog ids, deduplicated, with missing seeds put in front.
     * Falls back to {@link #sequencePlan} when the answer is unusable.
     */
    public CratePlan sequencePlanWithLlm(DerivedIntent intent, CandidatePool pool, List<String> seedTrackIds) {
        List<Track> seeds = resolveSeeds(seedTrackIds);
        List<Track> tracks = catalog.findAllById(pool.getTrackIds());
        List<Track> shown = tracks.subList(0, Math.min(tracks.size(), settings.getMaxPromptTracks()));

        String response;
        try {
            response = llmClient.execute(promptFactory.sequencePlan(intent,
                    TrackFormatter.trackList(shown, true), TrackFormatter.seedTrackIds(seeds)));
        } catch (LlmException e) {
            log.warn("Sequencing failed ({}), using deterministic order", e.getMessage());
            return sequencePlan(intent, pool, seedTrackIds);
        }

        return responseParser.parseOrFallback(response, SequencePayload.class,
                payload -> payload.getOrderedTrackIds() != null && !payload.getOrderedTrackIds().isEmpty(),
                payload -> orderedPlan(payload, seeds, pool),
                () -> sequencePlan(intent, pool, seedTrackIds));
    }

    private Optional<CratePlan> orderedPlan(SequencePayload payload, List<Track> seeds, CandidatePool pool) {
        Set<String> existing = catalog.findExistingIds(payload.getOrderedTrackIds());
        LinkedHashSet<String> ordered = new LinkedHashSet<>();
        seeds.stream().map(Track::getId)
                .filter(id -> !payload.getOrderedTrackIds().contains(id))
                .forEach(ordered::add);
        payload.getOrderedTrackIds().stream().filter(existing::contains).forEach(ordered::add);

        if (ordered.isEmpty()) {
            return Optional.empty();
        }

        List<String> trackList = new ArrayList<>(ordered);
        return Optional.of(CratePlan.builder()
                .prompt(pool.getSourcePrompt())
                .trackList(trackList)
                .totalDurationSec(totalDuration(trackList))
                .annotations(payload.getReasoning())
                .details(new PlanDetails(true, payload.getReasoning()))
                .finalized(false)
                .build());
    }

    // ---- explain / revise ----

    /**
     * Replaces the annotations with the model's explanation. On model failure the plan is returned unchanged.
     */
    public CratePlan explainPlan(CratePlan plan) {
        requireDraft(plan, "explain");
        List<Track> tracks = catalog.findAllById(plan.getTrackList());
        try {
            String explanation = llmClient.execute(
                    promptFactory.explainPlan(TrackFormatter.crateTracks(tracks, false), plan.getTotalDurationSec()));
            if (!StringUtils.hasText(explanation)) {
                return plan;
            }
            return plan.toBuilder()
                    .trackList(new ArrayList<>(plan.getTrackList()))
                    .annotations(explanation.trim())
                    .details(new PlanDetails(true, plan.getDetails() != null ? plan.getDetails().getTrace() : null))
                    .build();
        } catch (LlmException e) {
            log.warn("Explanation failed ({}), keeping existing annotations", e.getMessage());
            return plan;
        }
    }

    /**
     * Produces a successor plan from free-text instructions. Instruction length and the draft state
     * are checked before the model is called.
     */
    public RevisionResult revisePlan(CratePlan plan, String instructions) {
        PlannerSettings current = settings;
        String trimmed = instructions == null ? "" : instructions.trim();
        if (trimmed.length() < current.getRevisionMinChars() || trimmed.length() > current.getRevisionMaxChars()) {
            throw new InvalidInputException("Revision instructions must be between " + current.getRevisionMinChars()
                    + " and " + current.getRevisionMaxChars() + " characters");
        }
        if (plan.isFinalized()) {
            throw new PlanningException("Cannot revise a finalized plan", plan.getId());
        }

        List<Track> currentTracks = catalog.findAllById(plan.getTrackList());
        List<Track> available = replacementCandidates(plan, current);
        int target = plan.getPrompt() != null && plan.getPrompt().hasTargetDuration()
                ? plan.getPrompt().getTargetDurationSec()
                : current.getDefaultDurationSec();

        RevisionPayload payload;
        try {
            String response = llmClient.execute(promptFactory.revision(
                    TrackFormatter.crateTracks(currentTracks, true), trimmed,
                    TrackFormatter.trackList(available, true), target));
            payload = responseParser.parseOrThrow(response, RevisionPayload.class,
                    revision -> revision.getRevisedTrackIds() != null);
        } catch (LlmException | LlmResponseParseException e) {
            throw new PlanningException("Plan revision failed: " + e.getMessage(), e);
        }

        Set<String> known = catalog.findExistingIds(payload.getRevisedTrackIds());
        List<String> revised = payload.getRevisedTrackIds().stream()
                .filter(known::contains)
                .distinct()
                .collect(Collectors.toCollection(ArrayList::new));
        if (revised.isEmpty()) {
            throw new PlanningException("Revision produced no valid tracks", plan.getId());
        }

        List<String> warnings = new ArrayList<>();
        List<String> dropped = payload.getRevisedTrackIds().stream().filter(id -> !known.contains(id)).distinct().toList();
        if (!dropped.isEmpty()) {
            warnings.add("Ignored unknown tracks: " + String.join(", ", dropped));
        }

        int total = totalDuration(revised);
        int drift = Math.abs(total - plan.getTotalDurationSec());
        if (drift > current.getRevisionDriftWarnSec()) {
            warnings.add("Revised duration " + TrackFormatter.mmss(total) + " drifts " + drift / 60
                    + " minutes from the previous " + TrackFormatter.mmss(plan.getTotalDurationSec()));
        }

        String explanation = StringUtils.hasText(payload.getChangesExplanation())
                ? payload.getChangesExplanation()
                : "No explanation provided";
        CratePlan successor = CratePlan.builder()
                .prompt(plan.getPrompt())
                .trackList(revised)
                .totalDurationSec(total)
                .annotations(plan.getAnnotations())
                .details(new PlanDetails(true, explanation))
                .finalized(false)
                .revisedFromId(plan.getId())
                .build();
        log.info("Revised plan {}: {} -> {} tracks", plan.getId(), plan.getTrackList().size(), revised.size());
        return new RevisionResult(successor, explanation, warnings);
    }

    // ---- validate / finalize ----

    public ValidationResult validate(CratePlan plan) {
        return validate(plan, settings.getDurationToleranceSec());
    }

    public ValidationResult validate(CratePlan plan, int toleranceSec) {
        return validator.validatePlan(plan, toleranceSec, catalog.findExistingIds(plan.getTrackList()));
    }

    /**
     * Sets the finalized flag on a copy, and only when validation reports no errors.
     */
    public FinalizationResult finalizePlan(CratePlan plan) {
        ValidationResult validation = validator.validateForFinalization(
                plan, settings.getDurationToleranceSec(), catalog.findExistingIds(plan.getTrackList()));
        if (!validation.isValid()) {
            log.warn("Plan {} not finalized: {}", plan.getId(), validation.getErrors());
            return FinalizationResult.rejected(plan, validation);
        }
        CratePlan finalized = plan.toBuilder()
                .trackList(new ArrayList<>(plan.getTrackList()))
                .finalized(true)
                .build();
        return FinalizationResult.finalized(finalized, validation.getWarnings());
    }

    // ---- helpers ----

    private void requireValidPrompt(CratePrompt prompt) {
        ValidationResult validation = validator.validatePrompt(prompt);
        if (!validation.isValid()) {
            throw new InvalidInputException("Invalid prompt: " + String.join("; ", validation.getErrors()),
                    validation.getErrors());
        }
        validation.getWarnings().forEach(warning -> log.warn("Prompt warning: {}", warning));
    }

    private void requireDraft(CratePlan plan, String action) {
        if (plan.isFinalized()) {
            throw new PlanningException("Cannot " + action + " a finalized plan", plan.getId());
        }
    }

    /**
     * Seeds in the given order without repeats; an unknown seed aborts planning.
     */
    List<Track> resolveSeeds(List<String> seedTrackIds) {
        List<Track> seeds = new ArrayList<>();
        for (String id : new LinkedHashSet<>(seedTrackIds)) {
            seeds.add(catalog.findById(id).orElseThrow(() -> new ResourceNotFoundException("Track", id)));
        }
        return seeds;
    }

    private List<Track> replacementCandidates(CratePlan plan, PlannerSettings current) {
        CratePrompt prompt = plan.getPrompt();
        TrackFilter.TrackFilterBuilder filter = TrackFilter.builder().excludeIds(plan.getTrackList());
        if (prompt != null && prompt.hasTempoRange()) {
            filter.bpmRange(TempoRange.of(prompt.getTempoMin(), prompt.getTempoMax()));
        }
        List<Track> candidates = catalog.findMany(filter.build());
        return candidates.subList(0, Math.min(candidates.size(), current.getMaxPromptTracks()));
    }

    private Optional<DerivedIntent> toIntent(IntentPayload payload, DerivedIntent fallback) {
        MixStyle mixStyle = MixStyle.SMOOTH;
        if (payload.getMixStyle() != null) {
            Optional<MixStyle> parsed = MixStyle.fromValue(payload.getMixStyle());
            if (parsed.isEmpty()) {
                log.warn("Unknown mix style from model: {}", payload.getMixStyle());
                return Optional.empty();
            }
            mixStyle = parsed.get();
        }

        List<String> mustInclude = new ArrayList<>(fallback.getMustIncludeTracks());
        nullSafe(payload.getMustIncludeTracks()).stream()
                .filter(id -> !mustInclude.contains(id))
                .forEach(mustInclude::add);

        return Optional.of(DerivedIntent.builder()
                .tempoRange(TempoRange.of(payload.getTempoRange().getMin(), payload.getTempoRange().getMax()))
                .allowedKeys(nullSafe(payload.getAllowedKeys()).stream().map(key -> key.trim().toUpperCase(Locale.ROOT)).toList())
                .targetGenres(nullSafe(payload.getTargetGenres()))
                .durationSec((int) Math.round(payload.getDuration()))
                .mixStyle(mixStyle)
                .mustIncludeArtists(nullSafe(payload.getMustIncludeArtists()))
                .avoidArtists(nullSafe(payload.getAvoidArtists()))
                .mustIncludeTracks(mustInclude)
                .avoidTracks(nullSafe(payload.getAvoidTracks()))
                .energyCurve(EnergyCurve.fromValue(payload.getEnergyCurve()).orElse(null))
                .targetEnergy(payload.getTargetEnergy())
                .minPopularity(payload.getMinPopularity())
                .targetKeyCamelot(StringUtils.hasText(payload.getTargetKeyCamelot())
                        ? payload.getTargetKeyCamelot().trim().toUpperCase(Locale.ROOT)
                        : fallback.getTargetKeyCamelot())
                .build());
    }

    private static boolean isAvoided(Track track, DerivedIntent intent) {
        if (intent.getAvoidTracks().contains(track.getId())) {
            return true;
        }
        String artist = track.getArtist() == null ? "" : track.getArtist().toLowerCase(Locale.ROOT);
        return intent.getAvoidArtists().stream().anyMatch(avoided -> artist.contains(avoided.toLowerCase(Locale.ROOT)));
    }

    private int totalDuration(List<String> trackIds) {
        return catalog.findAllById(trackIds).stream().mapToInt(CratePlanner::duration).sum();
    }

    private static int duration(Track track) {
        return track.getDurationSec() != null ? track.getDurationSec() : 0;
    }

    private static List<String> nullSafe(List<String> values) {
        return values == null ? List.of() : values.stream().filter(StringUtils::hasText).toList();
    }
}
