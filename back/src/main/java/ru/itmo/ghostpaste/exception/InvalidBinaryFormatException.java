package ru.itmo.ghostpaste.exception;

public class InvalidBinaryFormatException extends GhostPasteException {

    public InvalidBinaryFormatException(String message) {
        super(ErrorCode.INVALID_BINARY_FORMAT, 400, message);
    }
}
