package com.cratepilot.app.service;

import com.cratepilot.app.entity.Track;
import com.cratepilot.app.model.TrackFilter;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Track persistence as seen by the planner and the importers.
 *
 * <p>Writes are keyed by track id: {@link #upsert(Track)} keeps the original registration time and
 * stamps the update time, {@link #insertIfAbsent(Track)} never overwrites an existing record.
 */
public interface TrackCatalog {

    Optional<Track> findById(String id);

    /** Tracks for the given ids in the order the ids were given; unknown ids are skipped. */
    List<Track> findAllById(Collection<String> ids);

    List<Track> findMany(TrackFilter filter);

    List<Track> findAll();

    boolean existsById(String id);

    Set<String> findExistingIds(Collection<String> ids);

    long count(TrackFilter filter);

    Track upsert(Track track);

    /**
     * Bulk restore. Like {@link #upsert(Track)}, except that an update time already present on an
     * incoming track is kept.
     */
    int upsertAll(Collection<Track> tracks);

    /**
     * @return true if the track was stored, false if a record with the same id already existed
     */
    boolean insertIfAbsent(Track track);

    boolean deleteById(String id);

    void deleteAll();
}
