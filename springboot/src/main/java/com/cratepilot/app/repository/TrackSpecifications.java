package com.cratepilot.app.repository;

import com.cratepilot.app.entity.Track;
import com.cratepilot.app.model.TrackFilter;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Translates a {@link TrackFilter} into a JPA criteria predicate with the same semantics as
 * {@link TrackFilter#matches(Track)}.
 */
public final class TrackSpecifications {

    private TrackSpecifications() {
    }

    public static Specification<Track> from(TrackFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (!filter.getIds().isEmpty()) {
                predicates.add(root.get("id").in(filter.getIds()));
            }
            if (!filter.getExcludeIds().isEmpty()) {
                predicates.add(cb.not(root.get("id").in(filter.getExcludeIds())));
            }
            if (!filter.getGenres().isEmpty()) {
                List<String> lowered = filter.getGenres().stream().map(g -> g.toLowerCase(Locale.ROOT)).toList();
                predicates.add(cb.lower(root.<String>get("genre")).in(lowered));
            }
            if (filter.getBpmRange() != null) {
                predicates.add(cb.between(root.<Double>get("bpm"), filter.getBpmRange().getMin(), filter.getBpmRange().getMax()));
            }
            if (!filter.getKeys().isEmpty()) {
                predicates.add(root.get("camelotKey").in(filter.getKeys()));
            }
            if (filter.getEnergyMin() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Integer>get("energy"), filter.getEnergyMin()));
            }
            if (filter.getEnergyMax() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<Integer>get("energy"), filter.getEnergyMax()));
            }
            if (filter.getDurationMin() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Integer>get("durationSec"), filter.getDurationMin()));
            }
            if (filter.getDurationMax() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<Integer>get("durationSec"), filter.getDurationMax()));
            }
            if (filter.getArtist() != null) {
                predicates.add(cb.like(cb.lower(root.<String>get("artist")), like(filter.getArtist())));
            }
            for (String excluded : filter.getExcludeArtists()) {
                predicates.add(cb.notLike(cb.lower(root.<String>get("artist")), like(excluded)));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static String like(String fragment) {
        return "%" + fragment.toLowerCase(Locale.ROOT) + "%";
    }
}
