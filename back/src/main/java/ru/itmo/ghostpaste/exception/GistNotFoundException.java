package ru.itmo.ghostpaste.exception;

import java.util.Map;

public class GistNotFoundException extends GhostPasteException {

    private final String id;

    public GistNotFoundException(String id) {
        super(ErrorCode.NOT_FOUND, 404, "Gist not found: " + id, Map.of("id", id));
        this.id = id;
    }

    /** A gist that exists but does not retain the requested blob generation. */
    public GistNotFoundException(String id, String versionToken) {
        super(ErrorCode.NOT_FOUND, 404, "Version " + versionToken + " not found for gist " + id,
                Map.of("id", id, "version", versionToken));
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
