package ru.itmo.ghostpaste.exception;

import java.util.Map;

/**
 * Base of every failure the gist core reports. Carries an error code, the HTTP status the
 * REST layer should answer with, and an optional details map so callers can forward the error
 * without branching on types.
 */
public class GhostPasteException extends RuntimeException {

    private final ErrorCode code;
    private final int httpStatus;
    private final Map<String, Object> details;

    public GhostPasteException(ErrorCode code, int httpStatus, String message) {
        this(code, httpStatus, message, Map.of(), null);
    }

    public GhostPasteException(
            ErrorCode code, int httpStatus, String message, Map<String, Object> details) {
        this(code, httpStatus, message, details, null);
    }

    public GhostPasteException(
            ErrorCode code,
            int httpStatus,
            String message,
            Map<String, Object> details,
            Throwable cause) {
        super(message, cause);
        this.code = code;
        this.httpStatus = httpStatus;
        this.details = details != null ? details : Map.of();
    }

    public ErrorCode getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
