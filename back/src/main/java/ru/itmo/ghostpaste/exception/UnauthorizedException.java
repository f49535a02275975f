package ru.itmo.ghostpaste.exception;

public class UnauthorizedException extends GhostPasteException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, 401, message);
    }
}
