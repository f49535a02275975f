package ru.itmo.ghostpaste.exception;

import java.util.Map;

/** The record still exists but is past its expiry. Answered with 410 Gone. */
public class GistExpiredException extends GhostPasteException {

    public GistExpiredException(String id, String expiresAt) {
        super(ErrorCode.GIST_EXPIRED, 410, "Gist has expired",
                Map.of("id", id, "expiresAt", expiresAt));
    }
}
