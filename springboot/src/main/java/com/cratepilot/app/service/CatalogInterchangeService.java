package com.cratepilot.app.service;

import com.cratepilot.app.dto.response.CatalogStatistics;
import com.cratepilot.app.entity.Track;
import com.cratepilot.app.exception.InvalidInputException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * JSON dump and restore of the whole catalog, plus summary counts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogInterchangeService {

    private static final String NO_GENRE = "unspecified";

    private final TrackCatalog catalog;
    private final ConstraintValidator validator;
    private final ObjectMapper objectMapper;

    public String exportToJson() {
        List<Track> tracks = catalog.findAll();
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tracks);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Catalog could not be serialized", e);
        }
    }

    /**
     * Upserts every track in the array. All records are validated before anything is written.
     *
     * @return number of tracks written
     */
    public int importFromJson(String json) {
        List<Track> tracks;
        try {
            tracks = objectMapper.readValue(json, new TypeReference<List<Track>>() {});
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Catalog JSON is malformed: " + e.getOriginalMessage());
        }
        if (tracks == null) {
            return 0;
        }

        List<String> errors = new ArrayList<>();
        for (Track track : tracks) {
            errors.addAll(validator.validateTrack(track).getErrors());
        }
        if (!errors.isEmpty()) {
            throw new InvalidInputException("Catalog JSON contains invalid tracks", errors);
        }

        int written = catalog.upsertAll(tracks);
        log.info("Imported {} tracks from JSON", written);
        return written;
    }

    public CatalogStatistics getStatistics() {
        List<Track> tracks = catalog.findAll();
        Map<String, Long> byGenre = tracks.stream()
                .collect(Collectors.groupingBy(t -> t.getGenre() != null ? t.getGenre() : NO_GENRE,
                        TreeMap::new, Collectors.counting()));
        Map<String, Long> byKey = tracks.stream()
                .collect(Collectors.groupingBy(Track::getCamelotKey, TreeMap::new, Collectors.counting()));

        return CatalogStatistics.builder()
                .totalTracks(tracks.size())
                .tracksByGenre(byGenre)
                .tracksByKey(byKey)
                .averageBpm(tracks.stream().filter(t -> t.getBpm() != null).mapToDouble(Track::getBpm).average().orElse(0.0))
                .totalDurationSec(tracks.stream().filter(t -> t.getDurationSec() != null).mapToLong(Track::getDurationSec).sum())
                .inferredTracks(tracks.stream().filter(Track::isFeaturesInferred).count())
                .build();
    }
}
