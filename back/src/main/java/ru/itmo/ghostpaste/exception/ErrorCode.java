package ru.itmo.ghostpaste.exception;

public enum ErrorCode {
    INVALID_INPUT,
    PAYLOAD_TOO_LARGE,
    INVALID_BINARY_FORMAT,
    NOT_FOUND,
    GIST_EXPIRED,
    UNAUTHORIZED,
    FORBIDDEN,
    CONFLICT,
    STORAGE_ERROR
}
