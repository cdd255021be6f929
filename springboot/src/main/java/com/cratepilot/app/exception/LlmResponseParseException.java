package com.cratepilot.app.exception;

public class LlmResponseParseException extends BaseException {

    public LlmResponseParseException(String message) {
        super(ErrorCode.UNPARSEABLE_RESPONSE, message);
    }

    public LlmResponseParseException(String message, Throwable cause) {
        super(ErrorCode.UNPARSEABLE_RESPONSE, message, cause);
    }
}
