package ru.itmo.ghostpaste.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import ru.itmo.ghostpaste.exception.StorageException;
import ru.itmo.ghostpaste.model.StoredObject;
import ru.itmo.ghostpaste.repository.StoredObjectRepository;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Object store backed by a single relational table, one row per key.
 */
@Component
@ConditionalOnProperty(name = "ghostpaste.storage.type", havingValue = "jpa", matchIfMissing = true)
@Transactional
@Slf4j
public class JpaObjectStore implements ObjectStore {
    private final StoredObjectRepository objectRepository;

    public JpaObjectStore(StoredObjectRepository objectRepository) {
        this.objectRepository = objectRepository;
    }

    @Override
    public void put(String key, byte[] data, Map<String, String> customMetadata) {
        try {
            StoredObject object = StoredObject.builder()
                    .objectKey(key)
                    .content(data)
                    .contentSize((long) data.length)
                    .customMetadata(new HashMap<>(customMetadata))
                    .uploadedAt(Instant.now())
                    .build();
            objectRepository.saveAndFlush(object);
            log.debug("Stored {} bytes at {}", data.length, key);
        } catch (RuntimeException e) {
            throw new StorageException("Failed to store object " + key, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<byte[]> get(String key) {
        try {
            return objectRepository.findById(key).map(StoredObject::getContent);
        } catch (RuntimeException e) {
            throw new StorageException("Failed to read object " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            objectRepository.findById(key).ifPresent(object -> {
                objectRepository.delete(object);
                objectRepository.flush();
            });
        } catch (RuntimeException e) {
            throw new StorageException("Failed to delete object " + key, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> list(String prefix) {
        try {
            return objectRepository.findKeysLike(likePrefix(prefix));
        } catch (RuntimeException e) {
            throw new StorageException("Failed to list objects under " + prefix, e);
        }
    }

    static String likePrefix(String prefix) {
        StringBuilder pattern = new StringBuilder(prefix.length() + 1);
        for (char c : prefix.toCharArray()) {
            if (c == '!' || c == '%' || c == '_') {
                pattern.append('!');
            }
            pattern.append(c);
        }
        return pattern.append('%').toString();
    }
}
