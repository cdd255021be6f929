package com.cratepilot.app.service;

import com.cratepilot.app.dto.response.FinalizationResult;
import com.cratepilot.app.dto.response.RevisionResult;
import com.cratepilot.app.dto.response.ValidationResult;
import com.cratepilot.app.entity.CratePlan;
import com.cratepilot.app.entity.CratePrompt;
import com.cratepilot.app.exception.ResourceNotFoundException;
import com.cratepilot.app.repository.CratePlanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Stored plans. Every stage result the caller keeps is written as a new row or a replaced row;
 * revisions are stored as successors linked through {@code revisedFromId}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CratePlanService {

    private final CratePlanRepository planRepository;
    private final CratePlanner planner;

    @Transactional
    public CratePlan createPlan(CratePrompt prompt, List<String> seedTrackIds, boolean useLlm) {
        CratePlan saved = planRepository.save(planner.plan(prompt, seedTrackIds, useLlm));
        log.info("Stored plan {} ({} tracks)", saved.getId(), saved.getTrackList().size());
        return saved;
    }

    @Transactional(readOnly = true)
    public CratePlan getPlan(Long planId) {
        return planRepository.findById(planId)
                .orElseThrow(() -> new ResourceNotFoundException("CratePlan", planId));
    }

    @Transactional(readOnly = true)
    public List<CratePlan> getRecentPlans() {
        return planRepository.findTop20ByOrderByCreatedAtDesc();
    }

    @Transactional
    public CratePlan explainPlan(Long planId) {
        CratePlan plan = getPlan(planId);
        CratePlan explained = planner.explainPlan(plan);
        return explained == plan ? plan : planRepository.save(explained);
    }

    @Transactional
    public RevisionResult revisePlan(Long planId, String instructions) {
        RevisionResult result = planner.revisePlan(getPlan(planId), instructions);
        CratePlan saved = planRepository.save(result.getPlan());
        log.info("Stored revision {} of plan {}", saved.getId(), planId);
        return new RevisionResult(saved, result.getChangesExplanation(), result.getWarnings());
    }

    @Transactional(readOnly = true)
    public ValidationResult validatePlan(Long planId) {
        return planner.validate(getPlan(planId));
    }

    @Transactional
    public FinalizationResult finalizePlan(Long planId) {
        FinalizationResult result = planner.finalizePlan(getPlan(planId));
        if (!result.isSuccess()) {
            return result;
        }
        CratePlan saved = planRepository.save(result.getPlan());
        log.info("Finalized plan {}", planId);
        return FinalizationResult.finalized(saved, result.getWarnings());
    }

    @Transactional
    public void deletePlan(Long planId) {
        planRepository.delete(getPlan(planId));
        log.info("Deleted plan: {}", planId);
    }
}
