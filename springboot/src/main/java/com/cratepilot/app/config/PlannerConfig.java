package com.cratepilot.app.config;

import com.cratepilot.app.model.PlannerSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PlannerConfig {

    @Bean
    public PlannerSettings plannerSettings(
            @Value("${app.planner.duration-tolerance-sec:300}") int durationToleranceSec,
            @Value("${app.planner.default-duration-sec:3600}") int defaultDurationSec,
            @Value("${app.planner.default-tempo-min:118}") double defaultTempoMin,
            @Value("${app.planner.default-tempo-max:130}") double defaultTempoMax,
            @Value("${app.planner.revision-min-chars:5}") int revisionMinChars,
            @Value("${app.planner.revision-max-chars:500}") int revisionMaxChars,
            @Value("${app.planner.revision-drift-warn-sec:600}") int revisionDriftWarnSec,
            @Value("${app.planner.max-prompt-tracks:80}") int maxPromptTracks,
            @Value("${app.planner.use-llm-query-plan:true}") boolean useLlmQueryPlan,
            @Value("${app.planner.search-limit:20}") int searchLimit) {
        return PlannerSettings.builder()
                .durationToleranceSec(durationToleranceSec)
                .defaultDurationSec(defaultDurationSec)
                .defaultTempoMin(defaultTempoMin)
                .defaultTempoMax(defaultTempoMax)
                .revisionMinChars(revisionMinChars)
                .revisionMaxChars(revisionMaxChars)
                .revisionDriftWarnSec(revisionDriftWarnSec)
                .maxPromptTracks(maxPromptTracks)
                .useLlmQueryPlan(useLlmQueryPlan)
                .searchLimit(searchLimit)
                .build();
    }
}
