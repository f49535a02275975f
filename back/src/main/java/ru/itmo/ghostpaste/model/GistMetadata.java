package ru.itmo.ghostpaste.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored record for one gist, serialized as JSON under {@code metadata/{id}.json}.
 * Everything here is unencrypted except {@link #encryptedMetadata}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GistMetadata {
    private String id;
    private String createdAt;
    private String updatedAt;
    private String expiresAt;
    private int version;

    // token of the blob generation currently served
    private String currentVersion;

    private long totalSize;
    private int blobCount;

    private String editPinHash;
    private String editPinSalt;

    private boolean oneTimeView;

    private IndentMode indentMode;
    private Integer indentSize;
    private WrapMode wrapMode;
    private Theme theme;

    private EncryptedData encryptedMetadata;

    @JsonIgnore
    public ProtectionClass getProtectionClass() {
        return ProtectionClass.of(this);
    }

    @JsonIgnore
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !Instant.parse(expiresAt).isAfter(now);
    }
}
