package com.cratepilot.app.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * User constraints for one crate. Every field is optional; the value is never mutated after creation.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class CratePrompt {

    @Column(name = "prompt_tempo_min")
    private Double tempoMin;

    @Column(name = "prompt_tempo_max")
    private Double tempoMax;

    @Column(name = "prompt_target_key", length = 3)
    private String targetKey;

    @Column(name = "prompt_target_genre")
    private String targetGenre;

    @Column(name = "prompt_target_duration_sec")
    private Integer targetDurationSec;

    @Column(name = "prompt_notes", columnDefinition = "TEXT")
    private String notes;

    public boolean hasTempoRange() {
        return tempoMin != null && tempoMax != null;
    }

    public boolean hasTargetDuration() {
        return targetDurationSec != null && targetDurationSec > 0;
    }
}
