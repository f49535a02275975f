package ru.itmo.ghostpaste.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * One key of the object store: metadata JSON, a blob generation or a history list.
 */
@Entity
@Table(name = "stored_objects")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StoredObject {
    @Id
    @Column(name = "object_key", nullable = false, length = 512)
    private String objectKey;

    @Column(columnDefinition = "BYTEA", nullable = false)
    private byte[] content;

    @Column(nullable = false)
    private Long contentSize;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "stored_object_metadata", joinColumns = @JoinColumn(name = "object_key"))
    @MapKeyColumn(name = "meta_key", length = 64)
    @Column(name = "meta_value", length = 256)
    @Builder.Default
    private Map<String, String> customMetadata = new HashMap<>();

    @Column(nullable = false)
    private Instant uploadedAt;
}
