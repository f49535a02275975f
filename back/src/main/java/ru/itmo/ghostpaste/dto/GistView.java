package ru.itmo.ghostpaste.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.itmo.ghostpaste.model.GistMetadata;
import ru.itmo.ghostpaste.model.IndentMode;
import ru.itmo.ghostpaste.model.Theme;
import ru.itmo.ghostpaste.model.WrapMode;

/**
 * Public projection of a gist record. Leaves out the PIN hash, the salt and the encrypted
 * metadata.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GistView {
    private String id;
    private String createdAt;
    private String updatedAt;
    private String expiresAt;
    private boolean oneTimeView;
    private long totalSize;
    private int blobCount;
    private int version;
    private String currentVersion;
    private IndentMode indentMode;
    private Integer indentSize;
    private WrapMode wrapMode;
    private Theme theme;

    public static GistView of(GistMetadata metadata) {
        return GistView.builder()
                .id(metadata.getId())
                .createdAt(metadata.getCreatedAt())
                .updatedAt(metadata.getUpdatedAt())
                .expiresAt(metadata.getExpiresAt())
                .oneTimeView(metadata.isOneTimeView())
                .totalSize(metadata.getTotalSize())
                .blobCount(metadata.getBlobCount())
                .version(metadata.getVersion())
                .currentVersion(metadata.getCurrentVersion())
                .indentMode(metadata.getIndentMode())
                .indentSize(metadata.getIndentSize())
                .wrapMode(metadata.getWrapMode())
                .theme(metadata.getTheme())
                .build();
    }
}
