package ru.itmo.ghostpaste.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import ru.itmo.ghostpaste.dto.ErrorResponse;
import ru.itmo.ghostpaste.exception.ErrorCode;
import ru.itmo.ghostpaste.exception.GhostPasteException;

import java.util.Map;

/**
 * Renders every failure as {@code {error, message, details}}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GhostPasteException.class)
    public ResponseEntity<ErrorResponse> handleGhostPaste(GhostPasteException e) {
        if (e.getHttpStatus() >= 500) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.debug("Request rejected: {} {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(e.getHttpStatus())
                .body(new ErrorResponse(e.getCode().name(), e.getMessage(), e.getDetails()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        // enum creators throw our own exception from inside Jackson
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof GhostPasteException) {
                return handleGhostPaste((GhostPasteException) cause);
            }
        }
        return badRequest("Invalid JSON in request", Map.of());
    }

    @ExceptionHandler({MissingServletRequestPartException.class,
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponse> handleMissing(Exception e) {
        return badRequest(e.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return badRequest("Invalid value for " + e.getName(), Map.of("parameter", e.getName()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadSize(MaxUploadSizeExceededException e) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(new ErrorResponse(ErrorCode.PAYLOAD_TOO_LARGE.name(), "Upload too large", Map.of()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "Internal server error", Map.of()));
    }

    private static ResponseEntity<ErrorResponse> badRequest(String message, Map<String, Object> details) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ErrorCode.INVALID_INPUT.name(), message, details));
    }
}
