package ru.itmo.ghostpaste.storage;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local object store for development and tests. Contents do not survive a restart.
 */
@Component
@ConditionalOnProperty(name = "ghostpaste.storage.type", havingValue = "memory")
public class InMemoryObjectStore implements ObjectStore {

    private final ConcurrentNavigableMap<String, byte[]> objects = new ConcurrentSkipListMap<>();
    private final Map<String, Map<String, String>> attributes = new ConcurrentSkipListMap<>();

    @Override
    public void put(String key, byte[] data, Map<String, String> customMetadata) {
        objects.put(key, data.clone());
        attributes.put(key, Map.copyOf(customMetadata));
    }

    @Override
    public Optional<byte[]> get(String key) {
        byte[] data = objects.get(key);
        return data == null ? Optional.empty() : Optional.of(data.clone());
    }

    @Override
    public void delete(String key) {
        objects.remove(key);
        attributes.remove(key);
    }

    @Override
    public List<String> list(String prefix) {
        List<String> keys = new ArrayList<>();
        for (String key : objects.tailMap(prefix, true).keySet()) {
            if (!key.startsWith(prefix)) {
                break;
            }
            keys.add(key);
        }
        return keys;
    }

    public Map<String, String> getCustomMetadata(String key) {
        return attributes.getOrDefault(key, Map.of());
    }

    public int size() {
        return objects.size();
    }
}
