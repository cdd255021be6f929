package com.cratepilot.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cratepilot.app.dto.response.FinalizationResult;
import com.cratepilot.app.dto.response.RevisionResult;
import com.cratepilot.app.entity.CratePlan;
import com.cratepilot.app.entity.CratePrompt;
import com.cratepilot.app.entity.PlanDetails;
import com.cratepilot.app.exception.InvalidInputException;
import com.cratepilot.app.exception.PlanningException;
import com.cratepilot.app.exception.ResourceNotFoundException;
import com.cratepilot.app.model.CandidatePool;
import com.cratepilot.app.model.DerivedIntent;
import com.cratepilot.app.model.EnergyCurve;
import com.cratepilot.app.model.MixStyle;
import com.cratepilot.app.model.PlannerSettings;
import com.cratepilot.app.model.TempoRange;
import com.cratepilot.app.support.InMemoryTrackCatalog;
import com.cratepilot.app.support.ScriptedLlmClient;
import com.cratepilot.app.support.TestTracks;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class CratePlannerTest {

    private static final CratePrompt PROMPT = CratePrompt.builder()
            .tempoMin(120.0)
            .tempoMax(130.0)
            .targetDurationSec(900)
            .notes("warm-up set")
            .build();

    private InMemoryTrackCatalog catalog;
    private ScriptedLlmClient llm;
    private CratePlanner planner;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryTrackCatalog(
                TestTracks.track("A", 118, "8A", 300),
                TestTracks.track("B", 122, "8A", 300),
                TestTracks.track("C", 125, "9A", 300),
                TestTracks.track("D", 128, "8B", 300));
        llm = new ScriptedLlmClient();
        LlmResponseParser parser = new LlmResponseParser(new ObjectMapper());
        CratePromptFactory prompts = new CratePromptFactory();
        SearchOrchestrator orchestrator = new SearchOrchestrator(Optional.empty(), catalog, llm, parser, prompts, 5_000);
        planner = new CratePlanner(catalog, new ConstraintValidator(Clock.systemUTC()), orchestrator, llm, parser,
                prompts, PlannerSettings.defaults());
    }

    private static CratePlan draft(Long id, List<String> trackIds, int totalDurationSec) {
        return CratePlan.builder()
                .id(id)
                .prompt(PROMPT)
                .trackList(trackIds)
                .totalDurationSec(totalDurationSec)
                .annotations("original notes")
                .details(PlanDetails.deterministic("test"))
                .build();
    }

    @Nested
    @DisplayName("Deterministic pipeline")
    class Deterministic {

        @Test
        @DisplayName("Seed first, then candidates by ascending tempo until the target duration")
        void seedThenTempoOrder() {
            CratePlan plan = planner.plan(PROMPT, List.of("A"), false);

            assertThat(plan.getTrackList()).containsExactly("A", "B", "C");
            assertThat(plan.getTotalDurationSec()).isEqualTo(900);
            assertThat(plan.isFinalized()).isFalse();
            assertThat(plan.getDetails().isLlmAssisted()).isFalse();
            assertThat(plan.getPrompt()).isEqualTo(PROMPT);
            assertThat(llm.prompts()).isEmpty();
        }

        @Test
        @DisplayName("Unknown seed aborts planning")
        void unknownSeed() {
            assertThatThrownBy(() -> planner.plan(PROMPT, List.of("ghost"), false))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Invalid prompt is rejected before any stage runs")
        void invalidPrompt() {
            CratePrompt inverted = PROMPT.toBuilder().tempoMin(140.0).build();

            assertThatThrownBy(() -> planner.plan(inverted, List.of(), true))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("Minimum BPM");
            assertThat(llm.prompts()).isEmpty();
        }

        @Test
        @DisplayName("Intent fills defaults and expands the target key")
        void intentDefaults() {
            DerivedIntent intent = planner.deriveIntent(CratePrompt.builder().targetKey("8A").build(), List.of("B"));

            assertThat(intent.getTempoRange()).isEqualTo(TempoRange.of(118, 130));
            assertThat(intent.getDurationSec()).isEqualTo(3600);
            assertThat(intent.getAllowedKeys()).containsExactly("8A", "8B", "9A", "7A");
            assertThat(intent.getTargetKeyCamelot()).isEqualTo("8A");
            assertThat(intent.getMustIncludeTracks()).containsExactly("B");
            assertThat(intent.getMixStyle()).isEqualTo(MixStyle.SMOOTH);
            assertThat(intent.getTargetGenres()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Model-assisted intent")
    class ModelIntent {

        @Test
        @DisplayName("Well-formed answer is converted")
        void usesModelIntent() {
            llm.respond(ScriptedLlmClient.INTENT, """
                    {"tempoRange": {"min": 122, "max": 126}, "duration": 1800, "mixStyle": "energetic",
                     "allowedKeys": ["8a", "9A"], "targetGenres": ["Tech House"], "energyCurve": "peak",
                     "targetEnergy": 0.8}
                    """);

            DerivedIntent intent = planner.deriveIntentWithLlm(PROMPT, List.of("A"));

            assertThat(intent.getTempoRange()).isEqualTo(TempoRange.of(122, 126));
            assertThat(intent.getDurationSec()).isEqualTo(1800);
            assertThat(intent.getMixStyle()).isEqualTo(MixStyle.ENERGETIC);
            assertThat(intent.getAllowedKeys()).containsExactly("8A", "9A");
            assertThat(intent.getEnergyCurve()).isEqualTo(EnergyCurve.PEAK);
            assertThat(intent.getMustIncludeTracks()).containsExactly("A");
        }

        @Test
        @DisplayName("Unknown mix style falls back to the deterministic intent")
        void unknownMixStyle() {
            llm.respond(ScriptedLlmClient.INTENT,
                    "{\"tempoRange\": {\"min\": 122, \"max\": 126}, \"duration\": 1800, \"mixStyle\": \"chaotic\"}");

            assertThat(planner.deriveIntentWithLlm(PROMPT, List.of()))
                    .isEqualTo(planner.deriveIntent(PROMPT, List.of()));
        }

        @Test
        @DisplayName("Answer rejected by the validator falls back")
        void rejectedIntent() {
            llm.respond(ScriptedLlmClient.INTENT,
                    "{\"tempoRange\": {\"min\": 130, \"max\": 120}, \"duration\": 1800}");

            assertThat(planner.deriveIntentWithLlm(PROMPT, List.of()).getTempoRange()).isEqualTo(TempoRange.of(120, 130));
        }

        @Test
        @DisplayName("Model outage falls back")
        void outage() {
            assertThat(planner.deriveIntentWithLlm(PROMPT, List.of()).getDurationSec()).isEqualTo(900);
        }
    }

    @Nested
    @DisplayName("Model-assisted pool and sequence")
    class ModelPoolAndSequence {

        private DerivedIntent intent;

        @BeforeEach
        void deriveIntent() {
            intent = planner.deriveIntent(PROMPT, List.of("A"));
        }

        @Test
        @DisplayName("Unparseable pool selection keeps the full raw set")
        void unparseableSelection() {
            llm.respond(ScriptedLlmClient.POOL, "Sure! Here are some great tracks for you.");

            CandidatePool pool = planner.generateCandidatePoolWithLlm(intent, PROMPT);

            assertThat(pool.getTrackIds()).containsExactlyInAnyOrder("A", "B", "C", "D");
            assertThat(pool.getOrigin()).isEqualTo(CandidatePool.Origin.CATALOG_QUERY);
        }

        @Test
        @DisplayName("Selection is limited to ids from the raw set")
        void selectionFiltered() {
            llm.respond(ScriptedLlmClient.POOL, "{\"selectedTrackIds\": [\"C\", \"Z\", \"B\", \"C\"]}");

            CandidatePool pool = planner.generateCandidatePoolWithLlm(intent, PROMPT);

            assertThat(pool.getTrackIds()).containsExactly("C", "B");
            assertThat(pool.getOrigin()).isEqualTo(CandidatePool.Origin.LLM_SELECTION);
        }

        @Test
        @DisplayName("Selection naming only unknown ids keeps the raw set")
        void selectionEmpty() {
            llm.respond(ScriptedLlmClient.POOL, "{\"selectedTrackIds\": [\"Z\"]}");

            assertThat(planner.generateCandidatePoolWithLlm(intent, PROMPT).size()).isEqualTo(4);
        }

        @Test
        @DisplayName("Model order keeps known ids once and puts a missing seed first")
        void modelSequence() {
            llm.respond(ScriptedLlmClient.SEQUENCE,
                    "{\"orderedTrackIds\": [\"D\", \"B\", \"ghost\", \"B\"], \"reasoning\": \"build up\"}");
            CandidatePool pool = planner.generateCandidatePool(intent, PROMPT);

            CratePlan plan = planner.sequencePlanWithLlm(intent, pool, List.of("A"));

            assertThat(plan.getTrackList()).containsExactly("A", "D", "B");
            assertThat(plan.getTotalDurationSec()).isEqualTo(900);
            assertThat(plan.getDetails().isLlmAssisted()).isTrue();
            assertThat(plan.getAnnotations()).isEqualTo("build up");
        }

        @Test
        @DisplayName("Unusable sequence falls back to tempo order")
        void unusableSequence() {
            llm.respond(ScriptedLlmClient.SEQUENCE, "{\"orderedTrackIds\": []}");
            CandidatePool pool = planner.generateCandidatePool(intent, PROMPT);

            assertThat(planner.sequencePlanWithLlm(intent, pool, List.of("A")).getTrackList())
                    .containsExactly("A", "B", "C");
        }
    }

    @Nested
    @DisplayName("Explain and revise")
    class ExplainAndRevise {

        @Test
        @DisplayName("Explanation replaces annotations")
        void explain() {
            llm.respond(ScriptedLlmClient.EXPLAIN, "  Gentle climb from 122 to 125 BPM.  ");

            CratePlan explained = planner.explainPlan(draft(1L, List.of("B", "C"), 600));

            assertThat(explained.getAnnotations()).isEqualTo("Gentle climb from 122 to 125 BPM.");
            assertThat(explained.getDetails().isLlmAssisted()).isTrue();
            assertThat(explained.getTrackList()).containsExactly("B", "C");
        }

        @Test
        @DisplayName("Explanation outage leaves the plan unchanged")
        void explainOutage() {
            CratePlan plan = draft(1L, List.of("B", "C"), 600);

            assertThat(planner.explainPlan(plan)).isSameAs(plan);
        }

        @Test
        @DisplayName("Too-short instructions are rejected without calling the model")
        void shortInstructions() {
            assertThatThrownBy(() -> planner.revisePlan(draft(1L, List.of("B"), 300), "abc"))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> planner.revisePlan(draft(1L, List.of("B"), 300), "x".repeat(501)))
                    .isInstanceOf(InvalidInputException.class);
            assertThat(llm.prompts()).isEmpty();
        }

        @Test
        @DisplayName("Finalized plans cannot be revised or explained")
        void finalizedPlan() {
            CratePlan finalized = draft(3L, List.of("B"), 300).toBuilder().finalized(true).build();

            assertThatThrownBy(() -> planner.revisePlan(finalized, "more energy please"))
                    .isInstanceOf(PlanningException.class);
            assertThatThrownBy(() -> planner.explainPlan(finalized))
                    .isInstanceOf(PlanningException.class);
            assertThat(llm.prompts()).isEmpty();
        }

        @Test
        @DisplayName("Revision produces a linked successor and reports dropped ids")
        void revision() {
            llm.respond(ScriptedLlmClient.REVISION,
                    "{\"revisedTrackIds\": [\"A\", \"D\", \"ghost\"], \"changesExplanation\": \"Swapped B for D\"}");
            CratePlan original = draft(7L, List.of("A", "B"), 600);

            RevisionResult result = planner.revisePlan(original, "  swap the second track for something faster ");

            CratePlan successor = result.getPlan();
            assertThat(successor.getId()).isNull();
            assertThat(successor.getRevisedFromId()).isEqualTo(7L);
            assertThat(successor.getTrackList()).containsExactly("A", "D");
            assertThat(successor.getTotalDurationSec()).isEqualTo(600);
            assertThat(successor.isFinalized()).isFalse();
            assertThat(result.getChangesExplanation()).isEqualTo("Swapped B for D");
            assertThat(result.getWarnings()).containsExactly("Ignored unknown tracks: ghost");
            assertThat(original.getTrackList()).containsExactly("A", "B");
            assertThat(llm.prompts()).singleElement().asString()
                    .contains("swap the second track for something faster")
                    .contains("C: Artist C - Title C");
        }

        @Test
        @DisplayName("Unparseable revision is a planning failure")
        void unparseableRevision() {
            llm.respond(ScriptedLlmClient.REVISION, "I moved some tracks around.");

            assertThatThrownBy(() -> planner.revisePlan(draft(7L, List.of("A", "B"), 600), "more energy please"))
                    .isInstanceOf(PlanningException.class);
        }

        @Test
        @DisplayName("Revision naming no known tracks is a planning failure")
        void emptyRevision() {
            llm.respond(ScriptedLlmClient.REVISION, "{\"revisedTrackIds\": [\"ghost\"]}");

            assertThatThrownBy(() -> planner.revisePlan(draft(7L, List.of("A", "B"), 600), "more energy please"))
                    .isInstanceOf(PlanningException.class)
                    .hasMessageContaining("no valid tracks");
        }

        @Test
        @DisplayName("Growing far beyond the previous plan is a warning even when it lands on the target")
        void driftFromPreviousPlan() {
            llm.respond(ScriptedLlmClient.REVISION, "{\"revisedTrackIds\": [\"A\", \"B\", \"C\", \"D\"]}");

            RevisionResult result = planner.revisePlan(draft(7L, List.of("A"), 300), "make it a full warm-up set");

            assertThat(result.getPlan().getTotalDurationSec()).isEqualTo(1200);
            assertThat(result.getWarnings()).singleElement().asString()
                    .contains("drifts 15 minutes from the previous 5:00");
            assertThat(result.getChangesExplanation()).isEqualTo("No explanation provided");
        }

        @Test
        @DisplayName("Drift is measured against the previous plan, not the target")
        void driftIgnoresTarget() {
            planner.updateSettings(settings -> settings.toBuilder().revisionDriftWarnSec(200).build());
            llm.respond(ScriptedLlmClient.REVISION, "{\"revisedTrackIds\": [\"A\", \"B\", \"C\"]}");

            RevisionResult result = planner.revisePlan(draft(7L, List.of("A", "B", "C", "D"), 1200), "drop the last track");

            assertThat(result.getPlan().getTotalDurationSec()).isEqualTo(PROMPT.getTargetDurationSec());
            assertThat(result.getWarnings()).singleElement().asString().contains("drifts 5 minutes");
        }

        @Test
        @DisplayName("Small change from the previous plan gives no drift warning")
        void noDrift() {
            llm.respond(ScriptedLlmClient.REVISION, "{\"revisedTrackIds\": [\"A\", \"B\"]}");

            RevisionResult result = planner.revisePlan(draft(7L, List.of("A"), 300), "add one more track");

            assertThat(result.getWarnings()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Finalization")
    class Finalization {

        static Stream<CratePlan> plans() {
            return Stream.of(
                    draft(1L, List.of("A", "B", "C"), 900),
                    draft(2L, List.of("A", "B", "A"), 900),
                    draft(3L, List.of("A", "B", "C", "D"), 1300),
                    draft(4L, List.of("A", "ghost"), 900),
                    draft(5L, List.of(), 0));
        }

        @ParameterizedTest
        @MethodSource("plans")
        @DisplayName("Finalize succeeds exactly when validation reports no errors")
        void finalizeIffValid(CratePlan plan) {
            boolean valid = planner.validate(plan).isValid();

            FinalizationResult result = planner.finalizePlan(plan);

            assertThat(result.isSuccess()).isEqualTo(valid);
            assertThat(result.getPlan().isFinalized()).isEqualTo(valid);
            assertThat(plan.isFinalized()).isFalse();
        }

        @Test
        @DisplayName("Finalized copy keeps id and tracks")
        void finalizedCopy() {
            FinalizationResult result = planner.finalizePlan(draft(1L, List.of("A", "B", "C"), 900));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getPlan().getId()).isEqualTo(1L);
            assertThat(result.getPlan().getTrackList()).containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("Duplicates block finalization")
        void duplicatesBlock() {
            FinalizationResult result = planner.finalizePlan(draft(2L, List.of("A", "B", "A"), 900));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrors()).contains("Duplicate tracks found in plan");
        }
    }

    @Test
    @DisplayName("Settings update returns the new effective settings")
    void updateSettings() {
        PlannerSettings updated = planner.updateSettings(settings -> settings.toBuilder().durationToleranceSec(60).build());

        assertThat(updated.getDurationToleranceSec()).isEqualTo(60);
        assertThat(planner.getSettings()).isSameAs(updated);
        assertThat(planner.validate(draft(1L, List.of("A", "B", "C"), 1000)).isValid()).isFalse();
    }
}
