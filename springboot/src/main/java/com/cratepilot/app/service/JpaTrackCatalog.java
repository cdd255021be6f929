package com.cratepilot.app.service;

import com.cratepilot.app.entity.Track;
import com.cratepilot.app.model.TrackFilter;
import com.cratepilot.app.repository.TrackRepository;
import com.cratepilot.app.repository.TrackSpecifications;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaTrackCatalog implements TrackCatalog {

    private final TrackRepository trackRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<Track> findById(String id) {
        return trackRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Track> findAllById(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        Map<String, Track> byId = trackRepository.findAllById(new HashSet<>(ids)).stream()
                .collect(Collectors.toMap(Track::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        return ids.stream().distinct().map(byId::get).filter(Objects::nonNull).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Track> findMany(TrackFilter filter) {
        return trackRepository.findAll(TrackSpecifications.from(filter), Sort.by("bpm", "id"));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Track> findAll() {
        return trackRepository.findAll(Sort.by("id"));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsById(String id) {
        return trackRepository.existsById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> findExistingIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(trackRepository.findExistingIds(ids));
    }

    @Override
    @Transactional(readOnly = true)
    public long count(TrackFilter filter) {
        return trackRepository.count(TrackSpecifications.from(filter));
    }

    @Override
    @Transactional
    public Track upsert(Track track) {
        return store(track, false);
    }

    @Override
    @Transactional
    public int upsertAll(Collection<Track> tracks) {
        List<Track> saved = new ArrayList<>(tracks.size());
        for (Track track : tracks) {
            saved.add(store(track, true));
        }
        log.info("Bulk upserted {} tracks", saved.size());
        return saved.size();
    }

    private Track store(Track track, boolean keepUpdatedAt) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime registeredAt = trackRepository.findById(track.getId())
                .map(Track::getRegisteredAt)
                .orElse(track.getRegisteredAt() != null ? track.getRegisteredAt() : now);
        track.setRegisteredAt(registeredAt);
        track.setUpdatedAt(keepUpdatedAt && track.getUpdatedAt() != null ? track.getUpdatedAt() : now);
        return trackRepository.save(track);
    }

    /**
     * Runs outside a surrounding transaction so a lost insert race only rolls back the failed save.
     */
    @Override
    public boolean insertIfAbsent(Track track) {
        if (trackRepository.existsById(track.getId())) {
            return false;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        track.setRegisteredAt(now);
        track.setUpdatedAt(now);
        try {
            trackRepository.saveAndFlush(track);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent insert of track {} lost the race, keeping the stored record", track.getId());
            return false;
        }
    }

    @Override
    @Transactional
    public boolean deleteById(String id) {
        if (!trackRepository.existsById(id)) {
            return false;
        }
        trackRepository.deleteById(id);
        return true;
    }

    @Override
    @Transactional
    public void deleteAll() {
        trackRepository.deleteAll();
    }
}
