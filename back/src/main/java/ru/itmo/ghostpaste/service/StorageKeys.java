package ru.itmo.ghostpaste.service;

/**
 * Object store layout for gists.
 */
final class StorageKeys {

    private StorageKeys() {
    }

    static String metadata(String id) {
        return "metadata/" + id + ".json";
    }

    static String blobPrefix(String id) {
        return "blobs/" + id + "/";
    }

    static String blob(String id, String versionToken) {
        return blobPrefix(id) + versionToken + ".bin";
    }

    static String history(String id) {
        return "history/" + id + ".json";
    }
}
