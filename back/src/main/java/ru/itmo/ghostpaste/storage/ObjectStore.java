package ru.itmo.ghostpaste.storage;

import ru.itmo.ghostpaste.exception.StorageException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed byte store the gist core persists into. Every call is independently atomic; nothing
 * spans more than one key.
 */
public interface ObjectStore {

    /**
     * Create or replace the object at {@code key}.
     *
     * @param customMetadata small string attributes kept beside the bytes (may be empty)
     */
    void put(String key, byte[] data, Map<String, String> customMetadata) throws StorageException;

    Optional<byte[]> get(String key) throws StorageException;

    /** Removes the key. Deleting an absent key is not an error. */
    void delete(String key) throws StorageException;

    /** Keys starting with {@code prefix}, in lexicographic order. */
    List<String> list(String prefix) throws StorageException;
}
