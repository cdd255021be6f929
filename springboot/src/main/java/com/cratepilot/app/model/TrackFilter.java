package com.cratepilot.app.model;

import com.cratepilot.app.entity.Track;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Locale;
import java.util.Set;

/**
 * Catalog query. Unset fields do not constrain; string matches on genre and artist ignore case.
 */
@Value
@Builder(toBuilder = true)
public class TrackFilter {

    @Singular(ignoreNullCollections = true)
    Set<String> genres;

    TempoRange bpmRange;

    @Singular(ignoreNullCollections = true)
    Set<String> keys;

    Integer energyMin;
    Integer energyMax;

    Integer durationMin;
    Integer durationMax;

    /** Substring match on the artist credit. */
    String artist;

    @Singular(ignoreNullCollections = true)
    Set<String> excludeArtists;

    @Singular(ignoreNullCollections = true)
    Set<String> ids;

    @Singular(ignoreNullCollections = true)
    Set<String> excludeIds;

    public static TrackFilter any() {
        return TrackFilter.builder().build();
    }

    public boolean matches(Track track) {
        if (!ids.isEmpty() && !ids.contains(track.getId())) {
            return false;
        }
        if (excludeIds.contains(track.getId())) {
            return false;
        }
        if (!genres.isEmpty() && (track.getGenre() == null
                || genres.stream().noneMatch(g -> g.equalsIgnoreCase(track.getGenre())))) {
            return false;
        }
        if (bpmRange != null && (track.getBpm() == null || !bpmRange.contains(track.getBpm()))) {
            return false;
        }
        if (!keys.isEmpty() && !keys.contains(track.getCamelotKey())) {
            return false;
        }
        if ((energyMin != null || energyMax != null) && !withinEnergy(track.getEnergy())) {
            return false;
        }
        if (durationMin != null && (track.getDurationSec() == null || track.getDurationSec() < durationMin)) {
            return false;
        }
        if (durationMax != null && (track.getDurationSec() == null || track.getDurationSec() > durationMax)) {
            return false;
        }
        if (artist != null && !containsIgnoreCase(track.getArtist(), artist)) {
            return false;
        }
        return excludeArtists.stream().noneMatch(excluded -> containsIgnoreCase(track.getArtist(), excluded));
    }

    private boolean withinEnergy(Integer energy) {
        if (energy == null) {
            return false;
        }
        return (energyMin == null || energy >= energyMin) && (energyMax == null || energy <= energyMax);
    }

    static boolean containsIgnoreCase(String value, String fragment) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
    }
}
