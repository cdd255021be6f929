package com.cratepilot.app.exception;

import java.time.Duration;
import java.util.Map;
import lombok.Getter;

/**
 * Failure talking to the external metadata source.
 *
 * <p>A status of 0 means the request never got an HTTP answer (connect failure, timeout).
 * Those, 429 and 5xx answers are transient; other 4xx answers are semantic and must not be retried.
 */
@Getter
public class MetadataSourceException extends BaseException {

    static final int TOO_MANY_REQUESTS = 429;

    private final int status;
    private final boolean retryable;

    /** Server-requested pause before the next attempt, or null when none was sent. */
    private final Duration retryAfter;

    private MetadataSourceException(ErrorCode errorCode, String message, int status, boolean retryable,
                                    Duration retryAfter, Throwable cause) {
        super(errorCode, message, Map.of("status", status, "retryable", retryable), cause);
        this.status = status;
        this.retryable = retryable;
        this.retryAfter = retryAfter;
    }

    public static MetadataSourceException fromStatus(String operation, int status, String body, Throwable cause) {
        return fromStatus(operation, status, body, null, cause);
    }

    public static MetadataSourceException fromStatus(String operation, int status, String body, Duration retryAfter,
                                                     Throwable cause) {
        boolean transientStatus = status >= 500 || status == TOO_MANY_REQUESTS;
        String message = operation + " failed with status " + status
                + (body != null && !body.isBlank() ? ": " + abbreviate(body) : "");
        return new MetadataSourceException(
                transientStatus ? ErrorCode.UPSTREAM_UNAVAILABLE : ErrorCode.UPSTREAM_REJECTED,
                message, status, transientStatus, retryAfter, cause);
    }

    public static MetadataSourceException transientFailure(String operation, Throwable cause) {
        return new MetadataSourceException(ErrorCode.UPSTREAM_UNAVAILABLE,
                operation + " failed: " + cause.getMessage(), 0, true, null, cause);
    }

    public static MetadataSourceException interrupted(String operation, InterruptedException cause) {
        return new MetadataSourceException(ErrorCode.UPSTREAM_UNAVAILABLE,
                operation + " was interrupted", 0, false, null, cause);
    }

    public boolean isRateLimited() {
        return status == TOO_MANY_REQUESTS;
    }

    public boolean isFeatureUnavailable() {
        return status == 403 || status == 404;
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
