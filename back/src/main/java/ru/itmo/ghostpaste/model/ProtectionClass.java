package ru.itmo.ghostpaste.model;

/**
 * Which authorization path applies to a gist. Exactly one value holds for any record, and
 * update/delete logic switches on it before checking a credential.
 */
public enum ProtectionClass {
    /** Edit PIN hash and salt are both present. PIN governs update and delete. */
    PIN_PROTECTED,
    /** One-time-view without a PIN. Deletable with the derived deletion proof, never editable. */
    ONE_TIME_VIEW,
    /** Neither. The record is immutable through normal channels. */
    UNPROTECTED;

    public static ProtectionClass of(GistMetadata metadata) {
        if (hasText(metadata.getEditPinHash()) && hasText(metadata.getEditPinSalt())) {
            return PIN_PROTECTED;
        }
        if (metadata.isOneTimeView()) {
            return ONE_TIME_VIEW;
        }
        return UNPROTECTED;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
