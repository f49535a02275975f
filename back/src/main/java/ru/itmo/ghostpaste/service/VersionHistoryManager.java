package ru.itmo.ghostpaste.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.itmo.ghostpaste.config.GhostPasteProperties;
import ru.itmo.ghostpaste.exception.StorageException;
import ru.itmo.ghostpaste.model.VersionHistoryEntry;
import ru.itmo.ghostpaste.storage.ObjectStore;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Bounded per-gist list of prior blob generations, kept oldest first under
 * {@code history/{id}.json}. Once the cap is reached each new entry evicts the oldest one.
 */
@Service
@Slf4j
public class VersionHistoryManager {

    private static final TypeReference<List<VersionHistoryEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final ObjectStore objectStore;
    private final ObjectMapper objectMapper;
    private final int capacity;

    public VersionHistoryManager(ObjectStore objectStore, ObjectMapper objectMapper, GhostPasteProperties properties) {
        this.objectStore = objectStore;
        this.objectMapper = objectMapper;
        this.capacity = properties.getLimits().getMaxVersions();
    }

    /**
     * Appends {@code entry}.
     *
     * @return entries evicted to stay within capacity; their blobs are no longer referenced
     */
    public List<VersionHistoryEntry> record(String id, VersionHistoryEntry entry) {
        Deque<VersionHistoryEntry> entries = load(id);
        entries.addLast(entry);

        List<VersionHistoryEntry> evicted = new ArrayList<>(1);
        while (entries.size() > capacity) {
            evicted.add(entries.pollFirst());
        }

        save(id, entries);
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} history entries for gist {}", evicted.size(), id);
        }
        return evicted;
    }

    /** Entries newest first. */
    public List<VersionHistoryEntry> list(String id) {
        Deque<VersionHistoryEntry> entries = load(id);
        List<VersionHistoryEntry> newestFirst = new ArrayList<>(entries.size());
        for (Iterator<VersionHistoryEntry> it = entries.descendingIterator(); it.hasNext(); ) {
            newestFirst.add(it.next());
        }
        return newestFirst;
    }

    public void purge(String id) {
        objectStore.delete(StorageKeys.history(id));
    }

    private Deque<VersionHistoryEntry> load(String id) {
        Deque<VersionHistoryEntry> entries = new ArrayDeque<>(capacity + 1);
        byte[] json = objectStore.get(StorageKeys.history(id)).orElse(null);
        if (json == null) {
            return entries;
        }
        try {
            entries.addAll(objectMapper.readValue(json, ENTRY_LIST));
            return entries;
        } catch (IOException e) {
            throw new StorageException("Invalid version history for gist " + id, e);
        }
    }

    private void save(String id, Deque<VersionHistoryEntry> entries) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(new ArrayList<>(entries));
        } catch (IOException e) {
            throw new StorageException("Failed to serialize version history for gist " + id, e);
        }
        objectStore.put(StorageKeys.history(id), json,
                Map.of("type", "history", "entries", String.valueOf(entries.size())));
    }
}
