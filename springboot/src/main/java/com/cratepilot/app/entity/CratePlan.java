package com.cratepilot.app.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * An ordered crate built from a {@link CratePrompt}.
 *
 * <p>Plans have no setters. Stage results, finalization and revision each produce a copy through
 * {@link #toBuilder()}; a finalized plan is never changed again and revisions of it are refused.
 */
@Entity
@Table(name = "crate_plans")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString(exclude = "trackList")
@EqualsAndHashCode(of = "id")
public class CratePlan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Embedded
    private CratePrompt prompt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "crate_plan_tracks", joinColumns = @JoinColumn(name = "plan_id"))
    @OrderColumn(name = "track_position")
    @Column(name = "track_id", nullable = false)
    @Builder.Default
    private List<String> trackList = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String annotations;

    @Column(name = "total_duration_sec", nullable = false)
    private int totalDurationSec;

    @Embedded
    private PlanDetails details;

    @Column(nullable = false)
    private boolean finalized;

    @Column(name = "revised_from_id")
    private Long revisedFromId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
