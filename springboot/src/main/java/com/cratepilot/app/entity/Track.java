package com.cratepilot.app.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "sections")
@EqualsAndHashCode(of = "id")
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@Table(name = "tracks", indexes = {
        @Index(name = "idx_tracks_bpm", columnList = "bpm"),
        @Index(name = "idx_tracks_genre", columnList = "genre")
})
public class Track {

    @Id
    @Column(length = 128)
    private String id;

    @Column(nullable = false)
    private String artist;

    @Column(nullable = false)
    private String title;

    private String genre;

    @Column(name = "duration_sec", nullable = false)
    private Integer durationSec;

    @Column(nullable = false)
    private Double bpm;

    @Column(name = "camelot_key", nullable = false, length = 3)
    private String camelotKey;

    private Integer energy;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "track_sections", joinColumns = @JoinColumn(name = "track_id"))
    @OrderColumn(name = "section_index")
    @Builder.Default
    private List<TrackSection> sections = new ArrayList<>();

    @Column(name = "file_path", columnDefinition = "TEXT")
    private String filePath;

    private String album;

    @Column(name = "release_year")
    private Integer releaseYear;

    private String label;

    private Integer popularity;

    @Enumerated(EnumType.STRING)
    @Column(name = "feature_source", length = 16)
    @Builder.Default
    private FeatureSource featureSource = FeatureSource.MANUAL;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private LocalDateTime registeredAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @JsonIgnore
    public boolean isFeaturesInferred() {
        return featureSource == FeatureSource.INFERRED;
    }
}
