package ru.itmo.ghostpaste.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pointer to a retained blob generation. The blob itself lives at
 * {@code blobs/{id}/{versionToken}.bin}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VersionHistoryEntry {
    private String versionToken;
    private String createdAt;
    private long size;
    private int fileCount;
    private boolean editedWithPin;
}
