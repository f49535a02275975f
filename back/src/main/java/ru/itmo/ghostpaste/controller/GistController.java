package ru.itmo.ghostpaste.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;
import ru.itmo.ghostpaste.auth.GistCredential;
import ru.itmo.ghostpaste.config.GhostPasteProperties;
import ru.itmo.ghostpaste.dto.CreateGistRequest;
import ru.itmo.ghostpaste.dto.CreateGistResponse;
import ru.itmo.ghostpaste.dto.DeleteGistRequest;
import ru.itmo.ghostpaste.dto.GistView;
import ru.itmo.ghostpaste.dto.UpdateGistRequest;
import ru.itmo.ghostpaste.dto.UpdateGistResponse;
import ru.itmo.ghostpaste.exception.InvalidInputException;
import ru.itmo.ghostpaste.model.GistContent;
import ru.itmo.ghostpaste.model.GistMetadata;
import ru.itmo.ghostpaste.model.VersionHistoryEntry;
import ru.itmo.ghostpaste.service.GistStore;
import ru.itmo.ghostpaste.service.Timestamps;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Slf4j
public class GistController {
    static final String EDIT_PASSWORD_HEADER = "X-Edit-Password";
    static final String DELETE_PROOF_HEADER = "X-Delete-Proof";

    private static final String NO_STORE = "no-store, no-cache, must-revalidate";
    private static final String PRIVATE_CACHE = "private, max-age=300";

    private final GistStore gistStore;
    private final GhostPasteProperties properties;
    private final Clock clock;

    public GistController(GistStore gistStore, GhostPasteProperties properties, Clock clock) {
        this.gistStore = gistStore;
        this.properties = properties;
        this.clock = clock;
    }

    @PostMapping(value = "/gists", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<CreateGistResponse> create(
            @RequestPart("metadata") CreateGistRequest metadata,
            @RequestPart("blob") MultipartFile blob,
            @RequestParam(value = "password", required = false) String password) {
        GistMetadata created = gistStore.create(metadata, readBlob(blob), password);
        CreateGistResponse response = CreateGistResponse.builder()
                .id(created.getId())
                .url(properties.getBaseUrl() + "/g/" + created.getId())
                .createdAt(created.getCreatedAt())
                .expiresAt(created.getExpiresAt())
                .oneTimeView(created.isOneTimeView())
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/gists/{id}")
    public ResponseEntity<GistView> get(@PathVariable String id) {
        GistMetadata metadata = gistStore.getMetadata(id);
        return ResponseEntity.ok()
                .header(HttpHeaders.CACHE_CONTROL, metadata.isOneTimeView() ? NO_STORE : PRIVATE_CACHE)
                .body(GistView.of(metadata));
    }

    /**
     * Serves the current blob. For a one-time-view gist a client that already holds the
     * deletion proof may send it along; the gist is removed only after the whole body has been
     * written and flushed, so a failed transfer leaves it in place.
     */
    @GetMapping("/blobs/{id}")
    public ResponseEntity<StreamingResponseBody> blob(
            @PathVariable String id,
            @RequestHeader(value = DELETE_PROOF_HEADER, required = false) String deleteProof) {
        GistContent content = gistStore.get(id);
        GistMetadata metadata = content.getMetadata();
        byte[] blob = content.getBlob();
        boolean cleanUp = metadata.isOneTimeView() && deleteProof != null;

        StreamingResponseBody body = out -> {
            out.write(blob);
            out.flush();
            if (cleanUp) {
                boolean deleted = gistStore.deleteAfterDelivery(id, deleteProof);
                log.info("One-time view gist {} delivered, deleted: {}", id, deleted);
            }
        };
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_OCTET_STREAM_VALUE)
                .header(HttpHeaders.CACHE_CONTROL, metadata.isOneTimeView() ? NO_STORE : PRIVATE_CACHE)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"gist-" + id + ".bin\"")
                .header("X-Content-Type-Options", "nosniff")
                .contentLength(blob.length)
                .body(body);
    }

    @PutMapping(value = "/gists/{id}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public UpdateGistResponse update(
            @PathVariable String id,
            @RequestPart(value = "metadata", required = false) UpdateGistRequest metadata,
            @RequestPart("blob") MultipartFile blob,
            @RequestParam("version") int version,
            @RequestHeader(value = EDIT_PASSWORD_HEADER, required = false) String password) {
        GistMetadata updated = gistStore.update(id, metadata, readBlob(blob), version, GistCredential.pin(password));
        return new UpdateGistResponse(updated.getVersion());
    }

    @DeleteMapping("/gists/{id}")
    public ResponseEntity<Void> delete(
            @PathVariable String id,
            @RequestBody(required = false) DeleteGistRequest body,
            @RequestHeader(value = EDIT_PASSWORD_HEADER, required = false) String password) {
        String proof = body != null ? body.getProof() : null;
        gistStore.deleteIfNeeded(id, GistCredential.of(password, proof));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/gists/{id}/versions")
    public List<VersionHistoryEntry> versions(@PathVariable String id) {
        return gistStore.listVersions(id);
    }

    @GetMapping("/gists/{id}/versions/{token}")
    public ResponseEntity<byte[]> version(@PathVariable String id, @PathVariable String token) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_OCTET_STREAM_VALUE)
                .header(HttpHeaders.CACHE_CONTROL, PRIVATE_CACHE)
                .body(gistStore.getVersionBlob(id, token));
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "ok");
        status.put("timestamp", Timestamps.format(clock.instant()));
        status.put("storage", properties.getStorage().getType());
        return status;
    }

    private static byte[] readBlob(MultipartFile blob) {
        try {
            return blob.getBytes();
        } catch (IOException e) {
            throw new InvalidInputException("Failed to read blob: " + e.getMessage());
        }
    }
}
