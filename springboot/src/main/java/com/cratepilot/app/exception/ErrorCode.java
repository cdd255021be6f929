package com.cratepilot.app.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_INPUT("INVALID_INPUT", 400),
    NOT_FOUND("NOT_FOUND", 404),
    UPSTREAM_REJECTED("UPSTREAM_REJECTED", 422),
    UNPARSEABLE_RESPONSE("UNPARSEABLE_RESPONSE", 422),
    PLANNING_FAILED("PLANNING_FAILED", 500),
    UPSTREAM_UNAVAILABLE("UPSTREAM_UNAVAILABLE", 502),
    LLM_UNAVAILABLE("LLM_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
