package com.cratepilot.app.service;

import com.cratepilot.app.config.GenreProfileConfig;
import com.cratepilot.app.dto.spotify.AudioAnalysis;
import com.cratepilot.app.dto.spotify.AudioFeatures;
import com.cratepilot.app.dto.spotify.RawTrackRecord;
import com.cratepilot.app.dto.spotify.SpotifyArtist;
import com.cratepilot.app.dto.spotify.SpotifyTrack;
import com.cratepilot.app.entity.FeatureSource;
import com.cratepilot.app.entity.SectionType;
import com.cratepilot.app.entity.Track;
import com.cratepilot.app.entity.TrackSection;
import com.cratepilot.app.exception.InvalidInputException;
import com.cratepilot.app.util.SpotifyKeyConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Converts provider records into catalog tracks.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrackNormalizer {

    public static final String ID_PREFIX = "spotify-";

    static final String UNDETECTED_KEY = "8A";

    private final FeatureInferenceService featureInference;
    private final Clock clock;

    public Track normalize(RawTrackRecord record) {
        SpotifyTrack source = record.getTrack();
        if (source == null || !StringUtils.hasText(source.getId())) {
            throw new InvalidInputException("Provider record has no track id");
        }
        if (!StringUtils.hasText(source.getName())) {
            throw new InvalidInputException("Provider track " + source.getId() + " has no title");
        }

        String genre = featureInference.detectGenre(source, record.getSearchContext());
        LocalDateTime now = LocalDateTime.now(clock);

        Track.TrackBuilder track = Track.builder()
                .id(toTrackId(source.getId()))
                .artist(joinArtists(source.getArtists()))
                .title(source.getName())
                .genre(GenreProfileConfig.UNKNOWN_GENRE.equals(genre) ? null : genre)
                .durationSec(source.getDurationMs() == null ? 0 : (int) Math.round(source.getDurationMs() / 1000.0))
                .popularity(source.getPopularity())
                .registeredAt(now)
                .updatedAt(now);

        if (source.getAlbum() != null) {
            track.album(source.getAlbum().getName())
                    .label(source.getAlbum().getLabel())
                    .releaseYear(parseYear(source.getAlbum().getReleaseDate()));
        }

        AudioFeatures features = record.getFeatures();
        if (features != null && features.getTempo() != null && features.getTempo() > 0) {
            track.bpm((double) Math.round(features.getTempo()))
                    .energy(features.getEnergy() == null ? null : scaleEnergy(features.getEnergy()))
                    .camelotKey(toCamelot(features))
                    .featureSource(FeatureSource.PROVIDER);
        } else {
            FeatureInferenceService.InferredFeatures inferred = featureInference.infer(source, record.getSearchContext());
            log.warn("No audio features for '{}', using inferred values", source.getName());
            track.bpm(inferred.bpm())
                    .energy(inferred.energy())
                    .camelotKey(inferred.camelotKey())
                    .featureSource(FeatureSource.INFERRED);
        }

        if (record.getAnalysis() != null && record.getAnalysis().getSections() != null) {
            track.sections(mapSections(record.getAnalysis().getSections()));
        }
        return track.build();
    }

    public static String toTrackId(String externalId) {
        return ID_PREFIX + externalId;
    }

    public static String toExternalId(String trackId) {
        return trackId.startsWith(ID_PREFIX) ? trackId.substring(ID_PREFIX.length()) : trackId;
    }

    /** 0.0-1.0 provider energy onto the 1-5 catalog scale. */
    static int scaleEnergy(double energy) {
        return Math.max(1, Math.min(5, (int) Math.ceil(energy * 5)));
    }

    static Integer parseYear(String releaseDate) {
        if (releaseDate == null || releaseDate.length() < 4) {
            return null;
        }
        try {
            return Integer.parseInt(releaseDate.substring(0, 4));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * First section is the intro and the last the outro; loud sections in between are drops
     * (or choruses below 120 BPM) and quiet ones breakdowns.
     */
    static List<TrackSection> mapSections(List<AudioAnalysis.Section> sections) {
        List<TrackSection> mapped = new ArrayList<>();
        List<AudioAnalysis.Section> present = sections.stream()
                .filter(s -> s != null && s.getStart() != null && s.getDuration() != null)
                .toList();
        for (int i = 0; i < present.size(); i++) {
            AudioAnalysis.Section section = present.get(i);
            double loudness = section.getLoudness() == null ? -8.0 : section.getLoudness();
            double tempo = section.getTempo() == null ? 0.0 : section.getTempo();

            SectionType type = SectionType.VERSE;
            if (i == 0) {
                type = SectionType.INTRO;
            } else if (i == present.size() - 1) {
                type = SectionType.OUTRO;
            } else if (loudness > -5) {
                type = tempo > 120 ? SectionType.DROP : SectionType.CHORUS;
            } else if (loudness < -10) {
                type = SectionType.BREAKDOWN;
            }
            mapped.add(new TrackSection(type, section.getStart(), section.getStart() + section.getDuration()));
        }
        return mapped;
    }

    private static String toCamelot(AudioFeatures features) {
        if (features.getKey() == null || features.getMode() == null) {
            return UNDETECTED_KEY;
        }
        return SpotifyKeyConverter.toCamelot(features.getKey(), features.getMode()).orElse(UNDETECTED_KEY);
    }

    private static String joinArtists(List<SpotifyArtist> artists) {
        if (artists == null || artists.isEmpty()) {
            return "Unknown Artist";
        }
        String joined = artists.stream()
                .map(SpotifyArtist::getName)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(", "));
        return joined.isEmpty() ? "Unknown Artist" : joined;
    }
}
