package com.cratepilot.app.exception;

import java.util.Map;

/**
 * A planning step that has no deterministic substitute failed, e.g. a revision the model could not produce.
 */
public class PlanningException extends BaseException {

    public PlanningException(String message) {
        super(ErrorCode.PLANNING_FAILED, message);
    }

    public PlanningException(String message, Long planId) {
        super(ErrorCode.PLANNING_FAILED, message, planId != null ? Map.of("planId", planId) : Map.of());
    }

    public PlanningException(String message, Throwable cause) {
        super(ErrorCode.PLANNING_FAILED, message, cause);
    }
}
