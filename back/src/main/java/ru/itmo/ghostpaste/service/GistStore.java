package ru.itmo.ghostpaste.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.itmo.ghostpaste.auth.GistAuthorizer;
import ru.itmo.ghostpaste.auth.GistCredential;
import ru.itmo.ghostpaste.config.GhostPasteProperties;
import ru.itmo.ghostpaste.dto.CreateGistRequest;
import ru.itmo.ghostpaste.dto.UpdateGistRequest;
import ru.itmo.ghostpaste.exception.ForbiddenException;
import ru.itmo.ghostpaste.exception.GhostPasteException;
import ru.itmo.ghostpaste.exception.GistExpiredException;
import ru.itmo.ghostpaste.exception.GistNotFoundException;
import ru.itmo.ghostpaste.exception.InvalidInputException;
import ru.itmo.ghostpaste.exception.StorageException;
import ru.itmo.ghostpaste.exception.UnauthorizedException;
import ru.itmo.ghostpaste.exception.VersionConflictException;
import ru.itmo.ghostpaste.model.EncryptedData;
import ru.itmo.ghostpaste.model.GistContent;
import ru.itmo.ghostpaste.model.GistMetadata;
import ru.itmo.ghostpaste.model.ProtectionClass;
import ru.itmo.ghostpaste.model.VersionHistoryEntry;
import ru.itmo.ghostpaste.storage.ObjectStore;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists gist records and their blobs, and owns the version, expiry and authorization
 * rules for them.
 *
 * <p>Expiry is lazy: an expired record stays in storage until it is deleted, but no
 * operation serves or mutates it. Nothing here holds locks or retries; concurrent updates
 * of one gist are last-writer-wins unless strict versioning is configured.
 */
@Service
@Slf4j
public class GistStore {
    private final ObjectStore objectStore;
    private final VersionHistoryManager historyManager;
    private final GistAuthorizer authorizer;
    private final GistIdGenerator idGenerator;
    private final ObjectMapper objectMapper;
    private final GhostPasteProperties properties;
    private final Clock clock;

    public GistStore(ObjectStore objectStore,
                     VersionHistoryManager historyManager,
                     GistAuthorizer authorizer,
                     GistIdGenerator idGenerator,
                     ObjectMapper objectMapper,
                     GhostPasteProperties properties,
                     Clock clock) {
        this.objectStore = objectStore;
        this.historyManager = historyManager;
        this.authorizer = authorizer;
        this.idGenerator = idGenerator;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Stores a new gist. The blob is written before the metadata, so a failure between the two
     * never leaves a record pointing at a missing blob.
     *
     * @param pin optional edit PIN; only its salted hash is kept
     */
    public GistMetadata create(CreateGistRequest request, byte[] blob, String pin) {
        Instant now = clock.instant();
        validateBlob(blob);

        String expiresAt = null;
        if (request.getExpiresAt() != null) {
            Instant expiry = Timestamps.parse("expires_at", request.getExpiresAt());
            if (!expiry.isAfter(now)) {
                throw new InvalidInputException("expires_at must be in the future");
            }
            expiresAt = Timestamps.format(expiry);
        }

        boolean oneTimeView = Boolean.TRUE.equals(request.getOneTimeView());
        boolean hasPin = pin != null && !pin.isEmpty();
        if (oneTimeView && hasPin) {
            throw new InvalidInputException("A one-time view gist cannot carry an edit PIN");
        }
        if (hasPin) {
            List<String> errors = authorizer.validatePinStrength(pin);
            if (!errors.isEmpty()) {
                throw new InvalidInputException("Invalid PIN: " + String.join(", ", errors),
                        Map.of("pin", errors));
            }
        }

        int blobCount = request.getBlobCount() == null ? 1 : request.getBlobCount();
        if (blobCount < 1) {
            throw new InvalidInputException("blob_count must be positive");
        }
        validateIndentSize(request.getIndentSize());

        String id = idGenerator.nextId();
        String timestamp = Timestamps.format(now);
        String versionToken = versionToken(1, now);

        GistMetadata.GistMetadataBuilder metadata = GistMetadata.builder()
                .id(id)
                .createdAt(timestamp)
                .updatedAt(timestamp)
                .expiresAt(expiresAt)
                .version(1)
                .currentVersion(versionToken)
                .totalSize(blob.length)
                .blobCount(blobCount)
                .oneTimeView(oneTimeView)
                .indentMode(request.getIndentMode())
                .indentSize(request.getIndentSize())
                .wrapMode(request.getWrapMode())
                .theme(request.getTheme())
                .encryptedMetadata(request.getEncryptedMetadata() != null
                        ? request.getEncryptedMetadata()
                        : EncryptedData.empty());
        if (hasPin) {
            String salt = authorizer.generateSalt();
            metadata.editPinSalt(salt).editPinHash(authorizer.hashPin(pin, salt));
        }
        GistMetadata record = metadata.build();

        putBlob(id, versionToken, blob);
        putMetadata(record);

        log.info("Created gist {} ({} bytes, protection {})", id, blob.length, record.getProtectionClass());
        return record;
    }

    /** Metadata of a live gist, without loading its blob. */
    public GistMetadata getMetadata(String id) {
        GistMetadata metadata = loadMetadata(id);
        ensureNotExpired(metadata);
        return metadata;
    }

    /**
     * Metadata and current blob of a live gist. Never deletes anything: one-time-view cleanup is
     * a separate call the caller makes once the content has been delivered.
     */
    public GistContent get(String id) {
        GistMetadata metadata = getMetadata(id);
        byte[] blob = objectStore.get(StorageKeys.blob(id, metadata.getCurrentVersion()))
                .orElseThrow(() -> new StorageException("Blob not found for gist " + id));
        return new GistContent(metadata, blob);
    }

    public boolean exists(String id) {
        return objectStore.get(StorageKeys.metadata(id)).isPresent();
    }

    /**
     * Replaces the blob of a PIN-protected gist and bumps its version by exactly one. The
     * previous blob generation stays retrievable through the version history.
     *
     * @param expectedVersion the version the caller last saw; only enforced when strict
     *                        versioning is configured
     * @return the stored record after the update
     */
    public GistMetadata update(String id, UpdateGistRequest fields, byte[] blob, int expectedVersion,
                               GistCredential credential) {
        validateBlob(blob);
        if (expectedVersion < 1) {
            throw new InvalidInputException("Invalid version number: " + expectedVersion);
        }
        UpdateGistRequest changes = fields != null ? fields : new UpdateGistRequest();
        if (changes.getBlobCount() != null && changes.getBlobCount() < 1) {
            throw new InvalidInputException("blob_count must be positive");
        }
        validateIndentSize(changes.getIndentSize());

        GistMetadata stored = getMetadata(id);
        authorizeEdit(stored, credential != null ? credential : GistCredential.none());
        if (properties.getGist().isStrictVersioning() && stored.getVersion() != expectedVersion) {
            throw new VersionConflictException(id, expectedVersion, stored.getVersion());
        }

        Instant now = clock.instant();
        int newVersion = stored.getVersion() + 1;
        String versionToken = versionToken(newVersion, now);

        GistMetadata updated = stored.toBuilder()
                .updatedAt(Timestamps.format(now))
                .version(newVersion)
                .currentVersion(versionToken)
                .totalSize(blob.length)
                .blobCount(changes.getBlobCount() != null ? changes.getBlobCount() : stored.getBlobCount())
                .encryptedMetadata(changes.getEncryptedMetadata() != null
                        ? changes.getEncryptedMetadata()
                        : stored.getEncryptedMetadata())
                .indentMode(changes.getIndentMode() != null ? changes.getIndentMode() : stored.getIndentMode())
                .indentSize(changes.getIndentSize() != null ? changes.getIndentSize() : stored.getIndentSize())
                .wrapMode(changes.getWrapMode() != null ? changes.getWrapMode() : stored.getWrapMode())
                .theme(changes.getTheme() != null ? changes.getTheme() : stored.getTheme())
                .build();

        putBlob(id, versionToken, blob);
        putMetadata(updated);

        VersionHistoryEntry previous = VersionHistoryEntry.builder()
                .versionToken(stored.getCurrentVersion())
                .createdAt(stored.getUpdatedAt())
                .size(stored.getTotalSize())
                .fileCount(stored.getBlobCount())
                .editedWithPin(stored.getVersion() > 1)
                .build();
        for (VersionHistoryEntry evicted : historyManager.record(id, previous)) {
            objectStore.delete(StorageKeys.blob(id, evicted.getVersionToken()));
        }

        log.info("Updated gist {} from version {} to {} (client sent {})",
                id, stored.getVersion(), newVersion, expectedVersion);
        return updated;
    }

    /**
     * Deletes a gist after checking the credential its protection class requires. The record
     * is re-read from storage, so the check always runs against current fields.
     *
     * @return {@code true} once metadata, blobs and history are gone
     */
    public boolean deleteIfNeeded(GistMetadata record, GistCredential credential) {
        return deleteIfNeeded(record.getId(), credential);
    }

    public boolean deleteIfNeeded(String id, GistCredential credential) {
        if (credential == null) {
            credential = GistCredential.none();
        }
        GistMetadata stored = getMetadata(id);
        switch (stored.getProtectionClass()) {
            case PIN_PROTECTED:
                if (!credential.hasPin()) {
                    throw new UnauthorizedException("Edit password required for deletion");
                }
                if (!authorizer.validatePin(credential.getPin(), stored)) {
                    throw new ForbiddenException("Invalid edit password");
                }
                break;
            case ONE_TIME_VIEW:
                if (!credential.hasProof()) {
                    throw new UnauthorizedException("Deletion proof required for one-time view gist");
                }
                if (!authorizer.validateDeletionProof(credential.getProof(), stored)) {
                    throw new ForbiddenException("Invalid deletion proof");
                }
                break;
            default:
                throw new ForbiddenException("Gist cannot be deleted - not one-time view and not PIN-protected");
        }

        deleteGist(id);
        log.info("Deleted gist {} ({})", id, stored.getProtectionClass());
        return true;
    }

    /**
     * Post-delivery cleanup of a one-time-view gist. Failures are logged and reported as
     * {@code false}; they never turn the delivery that preceded them into an error.
     */
    public boolean deleteAfterDelivery(String id, String proof) {
        try {
            return deleteIfNeeded(id, GistCredential.proof(proof));
        } catch (GhostPasteException e) {
            log.warn("One-time view cleanup of gist {} failed: {} {}", id, e.getCode(), e.getMessage());
            return false;
        }
    }

    /** Prior blob generations of a live gist, newest first. */
    public List<VersionHistoryEntry> listVersions(String id) {
        getMetadata(id);
        return historyManager.list(id);
    }

    /** Blob of the current or a retained prior generation. */
    public byte[] getVersionBlob(String id, String versionToken) {
        GistMetadata metadata = getMetadata(id);
        boolean known = versionToken.equals(metadata.getCurrentVersion())
                || historyManager.list(id).stream().anyMatch(e -> e.getVersionToken().equals(versionToken));
        if (!known) {
            throw new GistNotFoundException(id, versionToken);
        }
        return objectStore.get(StorageKeys.blob(id, versionToken))
                .orElseThrow(() -> new StorageException("Blob " + versionToken + " missing for gist " + id));
    }

    private void authorizeEdit(GistMetadata stored, GistCredential credential) {
        ProtectionClass protection = stored.getProtectionClass();
        if (protection == ProtectionClass.ONE_TIME_VIEW) {
            throw new ForbiddenException("One-time view gists cannot be edited");
        }
        if (protection == ProtectionClass.UNPROTECTED) {
            throw new ForbiddenException("Gist has no edit PIN and cannot be edited");
        }
        if (!credential.hasPin()) {
            throw new UnauthorizedException("Edit password required");
        }
        if (!authorizer.validatePin(credential.getPin(), stored)) {
            throw new ForbiddenException("Invalid edit password");
        }
    }

    // metadata first: once it is gone the gist is unreachable even if a blob delete fails
    private void deleteGist(String id) {
        objectStore.delete(StorageKeys.metadata(id));
        for (String key : objectStore.list(StorageKeys.blobPrefix(id))) {
            objectStore.delete(key);
        }
        historyManager.purge(id);
    }

    private GistMetadata loadMetadata(String id) {
        if (id == null || id.isBlank()) {
            throw new InvalidInputException("Invalid gist ID");
        }
        Optional<byte[]> json = objectStore.get(StorageKeys.metadata(id));
        if (json.isEmpty()) {
            throw new GistNotFoundException(id);
        }
        try {
            return objectMapper.readValue(json.get(), GistMetadata.class);
        } catch (IOException e) {
            throw new StorageException("Invalid metadata format for gist " + id, e);
        }
    }

    private void ensureNotExpired(GistMetadata metadata) {
        if (metadata.isExpiredAt(clock.instant())) {
            throw new GistExpiredException(metadata.getId(), metadata.getExpiresAt());
        }
    }

    private void putMetadata(GistMetadata metadata) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(metadata);
        } catch (IOException e) {
            throw new StorageException("Failed to serialize metadata for gist " + metadata.getId(), e);
        }
        objectStore.put(StorageKeys.metadata(metadata.getId()), json, Map.of(
                "type", "metadata",
                "version", String.valueOf(metadata.getVersion()),
                "createdAt", metadata.getCreatedAt()));
    }

    private void putBlob(String id, String versionToken, byte[] blob) {
        objectStore.put(StorageKeys.blob(id, versionToken), blob, Map.of(
                "type", "blob",
                "size", String.valueOf(blob.length)));
    }

    private void validateBlob(byte[] blob) {
        if (blob == null || blob.length == 0) {
            throw new InvalidInputException("Blob is required");
        }
        int maxTotalSize = properties.getLimits().getMaxTotalSize();
        if (blob.length > maxTotalSize) {
            throw InvalidInputException.tooLarge("Gist content", maxTotalSize, blob.length);
        }
    }

    private static void validateIndentSize(Integer indentSize) {
        if (indentSize != null && indentSize < 1) {
            throw new InvalidInputException("indent_size must be positive");
        }
    }

    private static String versionToken(int version, Instant at) {
        return "v" + version + "-" + at.toEpochMilli();
    }
}
