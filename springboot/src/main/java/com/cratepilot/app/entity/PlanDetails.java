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

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class PlanDetails {

    @Column(name = "llm_assisted", nullable = false)
    private boolean llmAssisted;

    @Column(name = "llm_trace", columnDefinition = "TEXT")
    private String trace;

    public static PlanDetails deterministic(String trace) {
        return new PlanDetails(false, trace);
    }
}
