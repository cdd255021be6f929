package com.cratepilot.app.service;

import com.cratepilot.app.dto.ai.QueryPlanPayload;
import com.cratepilot.app.dto.response.ImportResult;
import com.cratepilot.app.dto.spotify.RecommendationRequest;
import com.cratepilot.app.entity.CratePrompt;
import com.cratepilot.app.entity.Track;
import com.cratepilot.app.exception.LlmException;
import com.cratepilot.app.model.CandidatePool;
import com.cratepilot.app.model.DerivedIntent;
import com.cratepilot.app.model.MixStyle;
import com.cratepilot.app.model.TrackFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns an intent into a candidate pool. With an external source configured it fans out search and
 * recommendation requests, then post-filters what was imported; otherwise, or when nothing survives,
 * it queries the local catalog. Must-include tracks present in the catalog join the pool on either path.
 */
@Service
@Slf4j
public class SearchOrchestrator {

    static final String DEFAULT_YEAR_FILTER = "year:2018-2025";
    static final String FALLBACK_QUERY = "house " + DEFAULT_YEAR_FILTER;
    static final String PLAN_YEAR_FILTER = "year:2021-2024";

    static final double INFERRED_BPM_TOLERANCE = 20;
    static final int RECOMMENDATION_LIMIT = 50;

    private static final List<String> UNSUPPORTED_FILTERS = List.of(
            "bpm", "tempo", "key", "camelot", "mood", "energy", "danceability",
            "duration", "popularity", "valence", "loudness", "tag");
    private static final List<Pattern> UNSUPPORTED_PATTERNS = UNSUPPORTED_FILTERS.stream()
            .map(token -> Pattern.compile("\\b" + token + "\\s*:\\s*(\"[^\"]*\"|\\S+)", Pattern.CASE_INSENSITIVE))
            .toList();
    private static final Pattern GENRE_FILTER = Pattern.compile("\\bgenre\\s*:\\s*(\"[^\"]*\"|\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR_FILTER = Pattern.compile("\\byear:\\s*\\d{4}(?:-\\d{4})?", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIELD_FILTER = Pattern.compile("\\b(artist|track)\\s*:", Pattern.CASE_INSENSITIVE);

    private static final List<String> SAFE_SEED_GENRES = List.of("house", "techno", "electronic", "dance", "deep-house");

    private final Optional<SpotifyImporter> importer;
    private final TrackCatalog catalog;
    private final LlmClient llmClient;
    private final LlmResponseParser responseParser;
    private final CratePromptFactory promptFactory;
    private final Duration branchDeadline;

    public SearchOrchestrator(Optional<SpotifyImporter> importer,
                              TrackCatalog catalog,
                              LlmClient llmClient,
                              LlmResponseParser responseParser,
                              CratePromptFactory promptFactory,
                              @Value("${app.planner.search-deadline-ms:45000}") long branchDeadlineMs) {
        this.importer = importer;
        this.catalog = catalog;
        this.llmClient = llmClient;
        this.responseParser = responseParser;
        this.promptFactory = promptFactory;
        this.branchDeadline = Duration.ofMillis(branchDeadlineMs);
    }

    public CandidatePool findCandidates(DerivedIntent intent, CratePrompt sourcePrompt, boolean useLlmQueryPlan, int searchLimit) {
        if (importer.isEmpty()) {
            return queryCatalog(intent, sourcePrompt);
        }
        SpotifyImporter source = importer.get();

        List<String> genreSeeds = source.listGenreSeeds();
        QueryPlanPayload plan = buildQueryPlan(intent, genreSeeds, useLlmQueryPlan);
        log.info("Query plan: {} searches, seed genres {}, seed artists {} ({})",
                plan.getSearchQueries().size(), plan.getSeedGenres(), plan.getSeedArtists(), plan.getReasoning());

        List<Supplier<ImportResult>> branches = new ArrayList<>();
        for (String query : plan.getSearchQueries()) {
            String sanitized = sanitizeQuery(query);
            branches.add(() -> source.searchAndImport(sanitized, searchLimit));
        }
        recommendationRequest(plan, intent, genreSeeds)
                .ifPresent(request -> branches.add(() -> source.importRecommendations(request)));

        Set<String> fetchedIds = runConcurrently(branches);
        List<Track> fetched = catalog.findAllById(fetchedIds);
        List<Track> accepted = fetched.stream().filter(track -> passesPostFilter(track, intent)).toList();
        log.info("External search returned {} tracks, {} pass the post-filter", fetched.size(), accepted.size());

        if (accepted.isEmpty()) {
            log.warn("No external candidates survived filtering, falling back to the catalog");
            return queryCatalog(intent, sourcePrompt);
        }

        Set<String> ids = accepted.stream().map(Track::getId).collect(Collectors.toCollection(LinkedHashSet::new));
        catalog.findAllById(intent.getMustIncludeTracks()).forEach(track -> ids.add(track.getId()));
        return CandidatePool.of(sourcePrompt, ids,
                "external search (" + branches.size() + " requests); " + describe(intent),
                CandidatePool.Origin.EXTERNAL_SEARCH);
    }

    /**
     * Tempo range, genres, allowed keys and avoid lists against the local catalog. Must-include
     * tracks that exist are always added.
     */
    public CandidatePool queryCatalog(DerivedIntent intent, CratePrompt sourcePrompt) {
        TrackFilter filter = TrackFilter.builder()
                .bpmRange(intent.getTempoRange())
                .genres(intent.getTargetGenres())
                .keys(intent.getAllowedKeys())
                .excludeIds(intent.getAvoidTracks())
                .excludeArtists(intent.getAvoidArtists())
                .build();

        Set<String> ids = catalog.findMany(filter).stream()
                .map(Track::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        catalog.findAllById(intent.getMustIncludeTracks()).forEach(track -> ids.add(track.getId()));

        log.info("Catalog query matched {} tracks", ids.size());
        return CandidatePool.of(sourcePrompt, ids, "catalog query; " + describe(intent), CandidatePool.Origin.CATALOG_QUERY);
    }

    QueryPlanPayload buildQueryPlan(DerivedIntent intent, List<String> genreSeeds, boolean useLlm) {
        if (!useLlm) {
            return fallbackQueryPlan(intent, genreSeeds);
        }
        String response;
        try {
            response = llmClient.execute(promptFactory.queryPlan(intent, genreSeeds));
        } catch (LlmException e) {
            log.warn("Query plan generation failed ({}), using fallback plan", e.getMessage());
            return fallbackQueryPlan(intent, genreSeeds);
        }
        return responseParser.parseOrFallback(response, QueryPlanPayload.class,
                plan -> plan.getSearchQueries() != null && !plan.getSearchQueries().isEmpty(),
                plan -> Optional.of(trimSeeds(plan)),
                () -> fallbackQueryPlan(intent, genreSeeds));
    }

    static QueryPlanPayload fallbackQueryPlan(DerivedIntent intent, List<String> genreSeeds) {
        List<String> queries = new ArrayList<>();
        intent.getTargetGenres().stream().limit(3).forEach(genre -> queries.add(genre + " " + PLAN_YEAR_FILTER));
        List<String> artists = intent.getMustIncludeArtists().stream().limit(2).toList();
        artists.forEach(artist -> queries.add("artist:\"" + artist.replace("\"", "") + "\" " + PLAN_YEAR_FILTER));
        if (queries.isEmpty()) {
            String genre = intent.getTargetGenres().isEmpty() ? "electronic" : intent.getTargetGenres().get(0);
            queries.add(genre + " " + PLAN_YEAR_FILTER);
        }

        List<String> seedGenres = intent.getTargetGenres().stream()
                .limit(3)
                .map(genre -> genre.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", "-"))
                .filter(genreSeeds::contains)
                .toList();

        return QueryPlanPayload.builder()
                .searchQueries(queries)
                .seedGenres(new ArrayList<>(seedGenres))
                .seedArtists(new ArrayList<>(artists))
                .seedTracks(new ArrayList<>())
                .tunables(QueryPlanPayload.Tunables.builder()
                        .minTempo(intent.getTempoRange().getMin())
                        .maxTempo(intent.getTempoRange().getMax())
                        .targetEnergy(intent.getTargetEnergy() != null ? intent.getTargetEnergy() : 0.6)
                        .minPopularity(intent.getMinPopularity() != null ? intent.getMinPopularity() : 30)
                        .build())
                .reasoning("Fallback query plan")
                .build();
    }

    /**
     * Removes filters the search endpoint rejects, turns {@code genre:} into plain text and adds a
     * year range to free-text queries.
     */
    static String sanitizeQuery(String query) {
        String q = query == null ? "" : query;
        for (Pattern pattern : UNSUPPORTED_PATTERNS) {
            q = pattern.matcher(q).replaceAll("").trim();
        }
        q = GENRE_FILTER.matcher(q)
                .replaceAll(match -> Matcher.quoteReplacement(match.group(1).replace("\"", "")))
                .trim();
        q = q.replaceAll("\\s{2,}", " ").trim();

        if (!q.isEmpty() && !YEAR_FILTER.matcher(q).find() && !FIELD_FILTER.matcher(q).find()) {
            q = q + " " + DEFAULT_YEAR_FILTER;
        }
        return q.isEmpty() ? FALLBACK_QUERY : q;
    }

    /**
     * Inferred tracks get a wider tempo window and double the energy tolerance.
     */
    static boolean passesPostFilter(Track track, DerivedIntent intent) {
        boolean inferred = track.isFeaturesInferred();

        if (intent.getAvoidTracks().contains(track.getId())) {
            return false;
        }
        if (intent.getAvoidArtists().stream().anyMatch(artist -> containsIgnoreCase(track.getArtist(), artist))) {
            return false;
        }

        if (track.getBpm() == null) {
            return false;
        }
        boolean bpmMatch = intent.getTempoRange().contains(track.getBpm())
                || (inferred && intent.getTempoRange().widen(INFERRED_BPM_TOLERANCE).contains(track.getBpm()));
        if (!bpmMatch) {
            return false;
        }

        if (!intent.getAllowedKeys().isEmpty() && !intent.getAllowedKeys().contains(track.getCamelotKey())) {
            return false;
        }

        MixStyle style = intent.getMixStyle();
        double trackEnergy = (track.getEnergy() != null ? track.getEnergy() : style.getDefaultEnergy()) / 5.0;
        double targetEnergy = intent.getTargetEnergy() != null ? intent.getTargetEnergy() : style.getDefaultEnergy() / 5.0;
        double tolerance = style.getEnergyTolerance() * (inferred ? 2 : 1);
        return Math.abs(trackEnergy - targetEnergy) < tolerance;
    }

    private Optional<RecommendationRequest> recommendationRequest(QueryPlanPayload plan, DerivedIntent intent, List<String> genreSeeds) {
        List<String> genres = nullSafe(plan.getSeedGenres()).stream()
                .map(genre -> genre.toLowerCase(Locale.ROOT))
                .filter(genreSeeds::contains)
                .collect(Collectors.toCollection(ArrayList::new));
        List<String> artists = nullSafe(plan.getSeedArtists());
        List<String> tracks = nullSafe(plan.getSeedTracks());

        if (genres.isEmpty() && artists.isEmpty() && tracks.isEmpty()) {
            SAFE_SEED_GENRES.stream().filter(genreSeeds::contains).limit(2).forEach(genres::add);
        }
        if (genres.isEmpty() && artists.isEmpty() && tracks.isEmpty()) {
            log.warn("No usable recommendation seeds, skipping recommendations");
            return Optional.empty();
        }

        QueryPlanPayload.Tunables tunables = plan.getTunables() != null ? plan.getTunables() : new QueryPlanPayload.Tunables();
        return Optional.of(RecommendationRequest.builder()
                .seedGenres(genres)
                .seedArtists(new ArrayList<>(artists))
                .seedTracks(new ArrayList<>(tracks))
                .minTempo(tunables.getMinTempo() != null ? tunables.getMinTempo() : intent.getTempoRange().getMin())
                .maxTempo(tunables.getMaxTempo() != null ? tunables.getMaxTempo() : intent.getTempoRange().getMax())
                .targetEnergy(tunables.getTargetEnergy() != null ? tunables.getTargetEnergy() : intent.getTargetEnergy())
                .minPopularity(tunables.getMinPopularity() != null ? tunables.getMinPopularity() : intent.getMinPopularity())
                .targetKeyCamelot(intent.getTargetKeyCamelot())
                .limit(RECOMMENDATION_LIMIT)
                .build());
    }

    /**
     * Runs every branch on the bounded-elastic scheduler under its own deadline. A branch that fails
     * or times out contributes nothing.
     */
    private Set<String> runConcurrently(List<Supplier<ImportResult>> branches) {
        List<Set<String>> results = Flux.fromIterable(branches)
                .flatMapSequential(branch -> Mono.fromSupplier(branch)
                        .subscribeOn(Schedulers.boundedElastic())
                        .timeout(branchDeadline)
                        .map(result -> (Set<String>) new LinkedHashSet<>(result.getResolvedTrackIds()))
                        .onErrorResume(e -> {
                            log.warn("Search branch failed: {}", e.getMessage());
                            return Mono.empty();
                        }))
                .collectList()
                .block();

        Set<String> merged = new LinkedHashSet<>();
        if (results != null) {
            results.forEach(merged::addAll);
        }
        return merged;
    }

    private static QueryPlanPayload trimSeeds(QueryPlanPayload plan) {
        plan.setSeedGenres(limit(plan.getSeedGenres(), 3));
        plan.setSeedArtists(limit(plan.getSeedArtists(), 2));
        plan.setSeedTracks(limit(plan.getSeedTracks(), 2));
        return plan;
    }

    private static List<String> limit(List<String> values, int max) {
        return nullSafe(values).stream().limit(max).collect(Collectors.toCollection(ArrayList::new));
    }

    private static List<String> nullSafe(List<String> values) {
        return values == null ? List.of() : values.stream().filter(v -> v != null && !v.isBlank()).toList();
    }

    private static boolean containsIgnoreCase(String value, String fragment) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
    }

    private static String describe(DerivedIntent intent) {
        StringBuilder description = new StringBuilder("tempo ").append(intent.getTempoRange());
        if (!intent.getTargetGenres().isEmpty()) {
            description.append("; genres ").append(String.join(", ", intent.getTargetGenres()));
        }
        if (!intent.getAllowedKeys().isEmpty()) {
            description.append("; keys ").append(String.join(", ", intent.getAllowedKeys()));
        }
        if (!intent.getAvoidArtists().isEmpty() || !intent.getAvoidTracks().isEmpty()) {
            description.append("; excluding ")
                    .append(intent.getAvoidArtists().size() + intent.getAvoidTracks().size())
                    .append(" artists/tracks");
        }
        return description.toString();
    }
}
