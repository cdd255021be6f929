package com.cratepilot.app.dto.response;

import com.cratepilot.app.entity.CratePlan;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a finalize request. On failure {@code plan} is the untouched input.
 */
@Value
public class FinalizationResult {

    boolean success;
    CratePlan plan;
    List<String> errors;
    List<String> warnings;

    public static FinalizationResult finalized(CratePlan plan, List<String> warnings) {
        return new FinalizationResult(true, plan, List.of(), List.copyOf(warnings));
    }

    public static FinalizationResult rejected(CratePlan plan, ValidationResult validation) {
        return new FinalizationResult(false, plan, validation.getErrors(), validation.getWarnings());
    }
}
