package ru.itmo.ghostpaste.exception;

import java.util.Map;

public class VersionConflictException extends GhostPasteException {

    public VersionConflictException(String id, int expected, int actual) {
        super(ErrorCode.CONFLICT, 409, "Version conflict - gist was modified by another user",
                Map.of("id", id, "expectedVersion", expected, "currentVersion", actual));
    }
}
