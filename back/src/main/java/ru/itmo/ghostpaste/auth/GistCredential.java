package ru.itmo.ghostpaste.auth;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * What a caller presents to mutate a gist: an edit PIN, a deletion proof, both or neither.
 * Which one is consulted depends on the record's protection class.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GistCredential {
    private final String pin;
    private final String proof;

    public static GistCredential of(String pin, String proof) {
        return new GistCredential(blankToNull(pin), blankToNull(proof));
    }

    public static GistCredential pin(String pin) {
        return of(pin, null);
    }

    public static GistCredential proof(String proof) {
        return of(null, proof);
    }

    public static GistCredential none() {
        return of(null, null);
    }

    public boolean hasPin() {
        return pin != null;
    }

    public boolean hasProof() {
        return proof != null;
    }

    @Override
    public String toString() {
        return "GistCredential[pin=" + (hasPin() ? "***" : "none") + ", proof=" + (hasProof() ? "***" : "none") + "]";
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
