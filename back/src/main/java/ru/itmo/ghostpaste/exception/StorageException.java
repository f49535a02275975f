package ru.itmo.ghostpaste.exception;

import java.util.Map;

/** Object store failure that is not otherwise classified. */
public class StorageException extends GhostPasteException {

    public StorageException(String message) {
        super(ErrorCode.STORAGE_ERROR, 500, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, 500, message,
                Map.of("error", cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()),
                cause);
    }
}
