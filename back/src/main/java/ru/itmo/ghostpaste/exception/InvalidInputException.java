package ru.itmo.ghostpaste.exception;

import java.util.Map;

public class InvalidInputException extends GhostPasteException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, 400, message);
    }

    public InvalidInputException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_INPUT, 400, message, details);
    }

    private InvalidInputException(ErrorCode code, int httpStatus, String message, Map<String, Object> details) {
        super(code, httpStatus, message, details);
    }

    /** Size limit exceeded. Suggested HTTP status: 413. */
    public static InvalidInputException tooLarge(String what, long limit, long actual) {
        return new InvalidInputException(
                ErrorCode.PAYLOAD_TOO_LARGE,
                413,
                what + " too large: " + actual + " bytes exceeds limit of " + limit,
                Map.of("limit", limit, "actual", actual));
    }
}
