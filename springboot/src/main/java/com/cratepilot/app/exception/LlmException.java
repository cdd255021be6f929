package com.cratepilot.app.exception;

public class LlmException extends BaseException {

    public LlmException(String message) {
        super(ErrorCode.LLM_UNAVAILABLE, message);
    }

    public LlmException(String message, Throwable cause) {
        super(ErrorCode.LLM_UNAVAILABLE, message, cause);
    }
}
