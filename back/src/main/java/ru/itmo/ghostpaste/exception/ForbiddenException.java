package ru.itmo.ghostpaste.exception;

public class ForbiddenException extends GhostPasteException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, 403, message);
    }
}
