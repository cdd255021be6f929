package com.cratepilot.app.exception;

import java.util.List;
import java.util.Map;

/**
 * Malformed prompt, filter, instruction or configuration. Raised before any external call is made.
 */
public class InvalidInputException extends BaseException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, List<String> violations) {
        super(ErrorCode.INVALID_INPUT, message, Map.of("violations", List.copyOf(violations)));
    }
}
