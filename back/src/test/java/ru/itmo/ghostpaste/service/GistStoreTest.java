package ru.itmo.ghostpaste.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import ru.itmo.ghostpaste.auth.GistAuthorizer;
import ru.itmo.ghostpaste.auth.GistCredential;
import ru.itmo.ghostpaste.config.GhostPasteProperties;
import ru.itmo.ghostpaste.dto.CreateGistRequest;
import ru.itmo.ghostpaste.dto.UpdateGistRequest;
import ru.itmo.ghostpaste.exception.ForbiddenException;
import ru.itmo.ghostpaste.exception.GistExpiredException;
import ru.itmo.ghostpaste.exception.GistNotFoundException;
import ru.itmo.ghostpaste.exception.InvalidInputException;
import ru.itmo.ghostpaste.exception.StorageException;
import ru.itmo.ghostpaste.exception.UnauthorizedException;
import ru.itmo.ghostpaste.exception.VersionConflictException;
import ru.itmo.ghostpaste.model.GistContent;
import ru.itmo.ghostpaste.model.GistMetadata;
import ru.itmo.ghostpaste.model.ProtectionClass;
import ru.itmo.ghostpaste.model.Theme;
import ru.itmo.ghostpaste.model.VersionHistoryEntry;
import ru.itmo.ghostpaste.storage.InMemoryObjectStore;
import ru.itmo.ghostpaste.storage.ObjectStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

class GistStoreTest {

    private static final Instant NOW = Instant.parse("2025-06-07T10:00:00Z");
    private static final String PIN = "abc123";

    private MutableClock clock;
    private InMemoryObjectStore objectStore;
    private ObjectMapper objectMapper;
    private GhostPasteProperties properties;
    private GistAuthorizer authorizer;
    private GistStore gistStore;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        objectStore = new InMemoryObjectStore();
        objectMapper = new ObjectMapper();
        properties = new GhostPasteProperties();
        properties.getAuth().setPinIterations(1000);
        authorizer = new GistAuthorizer(properties);
        gistStore = newStore(objectStore);
    }

    private GistStore newStore(ObjectStore store) {
        return new GistStore(store,
                new VersionHistoryManager(store, objectMapper, properties),
                authorizer,
                new GistIdGenerator(properties),
                objectMapper,
                properties,
                clock);
    }

    private static byte[] blob(int size) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) i;
        }
        return data;
    }

    private GistMetadata createWithPin() {
        return gistStore.create(new CreateGistRequest(), blob(64), PIN);
    }

    @Test
    void testCreate_AssignsIdentityAndFirstVersion() {
        GistMetadata created = gistStore.create(
                CreateGistRequest.builder().theme(Theme.DARK).build(), blob(100), null);

        assertEquals(12, created.getId().length());
        assertEquals("2025-06-07T10:00:00.000Z", created.getCreatedAt());
        assertEquals(created.getCreatedAt(), created.getUpdatedAt());
        assertEquals(1, created.getVersion());
        assertEquals(100, created.getTotalSize());
        assertEquals(1, created.getBlobCount());
        assertEquals(ProtectionClass.UNPROTECTED, created.getProtectionClass());
        assertTrue(gistStore.exists(created.getId()));

        GistContent content = gistStore.get(created.getId());
        assertArrayEquals(blob(100), content.getBlob());
        assertEquals(Theme.DARK, content.getMetadata().getTheme());
    }

    @Test
    void testCreate_HashesPinAndNeverStoresIt() {
        GistMetadata created = createWithPin();

        assertEquals(ProtectionClass.PIN_PROTECTED, created.getProtectionClass());
        assertNotNull(created.getEditPinSalt());
        assertNotEquals(PIN, created.getEditPinHash());
        assertTrue(authorizer.validatePin(PIN, gistStore.getMetadata(created.getId())));
    }

    @Test
    void testCreate_RejectsInvalidInputBeforeWriting() {
        CreateGistRequest past = CreateGistRequest.builder().expiresAt("2025-06-07T09:59:59.000Z").build();
        CreateGistRequest oneTimeView = CreateGistRequest.builder().oneTimeView(true).build();

        assertThrows(InvalidInputException.class, () -> gistStore.create(new CreateGistRequest(), new byte[0], null));
        assertThrows(InvalidInputException.class, () -> gistStore.create(past, blob(1), null));
        assertThrows(InvalidInputException.class, () -> gistStore.create(oneTimeView, blob(1), PIN));
        assertThrows(InvalidInputException.class, () -> gistStore.create(new CreateGistRequest(), blob(1), "1234"));
        assertThrows(InvalidInputException.class,
                () -> gistStore.create(CreateGistRequest.builder().blobCount(0).build(), blob(1), null));
        assertThrows(InvalidInputException.class,
                () -> gistStore.create(CreateGistRequest.builder().expiresAt("tomorrow").build(), blob(1), null));
        assertEquals(0, objectStore.size());
    }

    @Test
    void testCreate_RejectsOversizedBlob() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> gistStore.create(new CreateGistRequest(), new byte[5 * 1024 * 1024 + 1], null));

        assertEquals(413, e.getHttpStatus());
    }

    @Test
    void testCreate_WritesBlobBeforeMetadata() {
        ObjectStore mockStore = mock(ObjectStore.class);
        GistStore store = newStore(mockStore);

        store.create(new CreateGistRequest(), blob(10), null);

        InOrder order = inOrder(mockStore);
        order.verify(mockStore).put(startsWith("blobs/"), any(byte[].class), anyMap());
        order.verify(mockStore).put(startsWith("metadata/"), any(byte[].class), anyMap());
    }

    @Test
    void testCreate_PropagatesStorageFailure() {
        ObjectStore mockStore = mock(ObjectStore.class);
        doThrow(new StorageException("disk full"))
                .when(mockStore).put(anyString(), any(byte[].class), anyMap());
        GistStore store = newStore(mockStore);

        assertThrows(StorageException.class, () -> store.create(new CreateGistRequest(), blob(10), null));
        verify(mockStore, times(1)).put(anyString(), any(byte[].class), anyMap());
    }

    @Test
    void testGet_NotFound() {
        assertThrows(GistNotFoundException.class, () -> gistStore.get("missing"));
        assertFalse(gistStore.exists("missing"));
    }

    @Test
    void testGet_ExpiredGistIsGoneButStillStored() {
        GistMetadata created = gistStore.create(
                CreateGistRequest.builder().expiresAt("2025-06-07T11:00:00.000Z").build(), blob(5), null);

        clock.advance(Duration.ofHours(1));

        assertThrows(GistExpiredException.class, () -> gistStore.get(created.getId()));
        assertThrows(GistExpiredException.class, () -> gistStore.getMetadata(created.getId()));
        assertTrue(gistStore.exists(created.getId()));
    }

    @Test
    void testUpdate_IncrementsStoredVersionRegardlessOfSuppliedVersion() {
        GistMetadata created = createWithPin();
        clock.advance(Duration.ofSeconds(5));

        GistMetadata updated = gistStore.update(created.getId(), null, blob(32), 7, GistCredential.pin(PIN));

        assertEquals(2, updated.getVersion());
        assertEquals(32, updated.getTotalSize());
        assertEquals("2025-06-07T10:00:05.000Z", updated.getUpdatedAt());
        assertEquals(created.getCreatedAt(), updated.getCreatedAt());
        assertNotEquals(created.getCurrentVersion(), updated.getCurrentVersion());
        assertArrayEquals(blob(32), gistStore.get(created.getId()).getBlob());
    }

    @Test
    void testUpdate_RecordsPreviousVersionInHistory() {
        GistMetadata created = createWithPin();
        clock.advance(Duration.ofSeconds(1));
        gistStore.update(created.getId(), null, blob(32), 1, GistCredential.pin(PIN));
        clock.advance(Duration.ofSeconds(1));
        gistStore.update(created.getId(), null, blob(16), 2, GistCredential.pin(PIN));

        List<VersionHistoryEntry> versions = gistStore.listVersions(created.getId());

        assertEquals(2, versions.size());
        assertEquals(32, versions.get(0).getSize());
        assertTrue(versions.get(0).isEditedWithPin());
        assertEquals(created.getCurrentVersion(), versions.get(1).getVersionToken());
        assertFalse(versions.get(1).isEditedWithPin());
        assertArrayEquals(blob(64), gistStore.getVersionBlob(created.getId(), created.getCurrentVersion()));
        assertThrows(GistNotFoundException.class, () -> gistStore.getVersionBlob(created.getId(), "v9-0"));
    }

    @Test
    void testUpdate_KeepsFieldsNotSupplied() {
        GistMetadata created = gistStore.create(
                CreateGistRequest.builder().theme(Theme.LIGHT).indentSize(4).build(), blob(8), PIN);

        GistMetadata updated = gistStore.update(created.getId(),
                UpdateGistRequest.builder().theme(Theme.DARK).build(), blob(8), 1, GistCredential.pin(PIN));

        assertEquals(Theme.DARK, updated.getTheme());
        assertEquals(4, updated.getIndentSize());
        assertEquals(created.getEditPinHash(), updated.getEditPinHash());
    }

    @Test
    void testUpdate_EvictedHistoryBlobsAreDeleted() {
        properties.getLimits().setMaxVersions(2);
        gistStore = newStore(objectStore);
        GistMetadata created = createWithPin();

        for (int i = 0; i < 3; i++) {
            clock.advance(Duration.ofSeconds(1));
            gistStore.update(created.getId(), null, blob(8), i + 1, GistCredential.pin(PIN));
        }

        // current blob plus two retained generations
        assertEquals(3, objectStore.list("blobs/" + created.getId() + "/").size());
        assertThrows(GistNotFoundException.class,
                () -> gistStore.getVersionBlob(created.getId(), created.getCurrentVersion()));
    }

    @Test
    void testUpdate_StrictVersioningRejectsStaleVersion() {
        properties.getGist().setStrictVersioning(true);
        GistMetadata created = createWithPin();

        assertThrows(VersionConflictException.class,
                () -> gistStore.update(created.getId(), null, blob(8), 2, GistCredential.pin(PIN)));
        assertEquals(2, gistStore.update(created.getId(), null, blob(8), 1, GistCredential.pin(PIN)).getVersion());
    }

    @Test
    void testUpdate_Authorization() {
        GistMetadata pinned = createWithPin();
        GistMetadata open = gistStore.create(new CreateGistRequest(), blob(8), null);
        GistMetadata oneTime = gistStore.create(CreateGistRequest.builder().oneTimeView(true).build(), blob(8), null);

        assertThrows(UnauthorizedException.class,
                () -> gistStore.update(pinned.getId(), null, blob(8), 1, GistCredential.none()));
        assertThrows(ForbiddenException.class,
                () -> gistStore.update(pinned.getId(), null, blob(8), 1, GistCredential.pin("wrong1")));
        assertThrows(ForbiddenException.class,
                () -> gistStore.update(open.getId(), null, blob(8), 1, GistCredential.pin(PIN)));
        assertThrows(ForbiddenException.class,
                () -> gistStore.update(oneTime.getId(), null, blob(8), 1, GistCredential.pin(PIN)));
        assertEquals(1, gistStore.getMetadata(pinned.getId()).getVersion());
    }

    @Test
    void testUpdate_ExpiredGistIsGone() {
        GistMetadata created = gistStore.create(
                CreateGistRequest.builder().expiresAt("2025-06-07T10:30:00.000Z").build(), blob(8), PIN);
        clock.advance(Duration.ofMinutes(30));

        assertThrows(GistExpiredException.class,
                () -> gistStore.update(created.getId(), null, blob(8), 1, GistCredential.pin(PIN)));
    }

    @Test
    void testDelete_PinProtected() {
        GistMetadata created = createWithPin();
        gistStore.update(created.getId(), null, blob(8), 1, GistCredential.pin(PIN));

        assertThrows(UnauthorizedException.class,
                () -> gistStore.deleteIfNeeded(created, GistCredential.none()));
        assertThrows(ForbiddenException.class,
                () -> gistStore.deleteIfNeeded(created, GistCredential.pin("wrong1")));
        assertTrue(gistStore.deleteIfNeeded(created, GistCredential.pin(PIN)));

        assertFalse(gistStore.exists(created.getId()));
        assertEquals(0, objectStore.size());
    }

    @Test
    void testNullCredential_TreatedAsMissing() {
        GistMetadata pinned = createWithPin();
        GistMetadata oneTime = gistStore.create(CreateGistRequest.builder().oneTimeView(true).build(), blob(8), null);

        assertThrows(UnauthorizedException.class, () -> gistStore.deleteIfNeeded(pinned, null));
        assertThrows(UnauthorizedException.class, () -> gistStore.deleteIfNeeded(oneTime.getId(), null));
        assertThrows(UnauthorizedException.class,
                () -> gistStore.update(pinned.getId(), null, blob(8), 1, null));
        assertTrue(gistStore.exists(pinned.getId()));
    }

    @Test
    void testDelete_UnprotectedIsForbidden() {
        GistMetadata created = gistStore.create(new CreateGistRequest(), blob(8), null);

        assertThrows(ForbiddenException.class,
                () -> gistStore.deleteIfNeeded(created, GistCredential.of(PIN, "proof")));
        assertTrue(gistStore.exists(created.getId()));
    }

    @Test
    void testDelete_ExpiredGistIsGone() {
        GistMetadata created = gistStore.create(
                CreateGistRequest.builder().expiresAt("2025-06-07T10:00:01.000Z").build(), blob(8), PIN);
        clock.advance(Duration.ofSeconds(1));

        assertThrows(GistExpiredException.class,
                () -> gistStore.deleteIfNeeded(created, GistCredential.pin(PIN)));
    }

    @Test
    void testOneTimeView_EndToEnd() throws Exception {
        // Given
        GistMetadata record = GistMetadata.builder()
                .id("abc")
                .createdAt("2025-06-07T10:00:00.000Z")
                .updatedAt("2025-06-07T10:00:00.000Z")
                .version(1)
                .currentVersion("v1-1749290400000")
                .totalSize(1024)
                .blobCount(1)
                .oneTimeView(true)
                .build();
        objectStore.put("metadata/abc.json", objectMapper.writeValueAsBytes(record), Map.of());
        objectStore.put("blobs/abc/v1-1749290400000.bin", blob(1024), Map.of());
        String proof = "6edbc0479076843cb16e5e24e88d8ad7f659adb125c078087c4f6f0a692fc8b8";

        // When
        GistContent delivered = gistStore.get("abc");

        // Then
        assertEquals(1024, delivered.getBlob().length);
        assertTrue(gistStore.exists("abc"));
        assertThrows(UnauthorizedException.class, () -> gistStore.deleteIfNeeded("abc", GistCredential.none()));
        assertThrows(ForbiddenException.class,
                () -> gistStore.deleteIfNeeded("abc", GistCredential.proof(proof.replace('6', '7'))));
        assertTrue(gistStore.deleteIfNeeded(delivered.getMetadata(), GistCredential.proof(proof)));
        assertThrows(GistNotFoundException.class, () -> gistStore.get("abc"));
        assertThrows(GistNotFoundException.class,
                () -> gistStore.deleteIfNeeded(delivered.getMetadata(), GistCredential.proof(proof)));
        assertEquals(0, objectStore.size());
    }

    @Test
    void testDeleteAfterDelivery_IsBestEffort() {
        GistMetadata created = gistStore.create(CreateGistRequest.builder().oneTimeView(true).build(), blob(8), null);
        String proof = authorizer.deriveDeletionProof(created.getCreatedAt(), created.getTotalSize(), created.getId());

        assertFalse(gistStore.deleteAfterDelivery(created.getId(), "bogus"));
        assertFalse(gistStore.deleteAfterDelivery("missing", proof));
        assertTrue(gistStore.exists(created.getId()));

        assertTrue(gistStore.deleteAfterDelivery(created.getId(), proof));
        assertFalse(gistStore.exists(created.getId()));
    }

    @Test
    void testDeleteAfterDelivery_SwallowsStorageFailure() {
        GistMetadata created = gistStore.create(CreateGistRequest.builder().oneTimeView(true).build(), blob(8), null);
        String proof = authorizer.deriveDeletionProof(created.getCreatedAt(), created.getTotalSize(), created.getId());
        ObjectStore failing = spy(objectStore);
        doThrow(new StorageException("unavailable")).when(failing).delete(eq("metadata/" + created.getId() + ".json"));

        assertFalse(newStore(failing).deleteAfterDelivery(created.getId(), proof));
    }

    static class MutableClock extends Clock {
        private Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
