package ru.itmo.ghostpaste.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.itmo.ghostpaste.model.EncryptedData;
import ru.itmo.ghostpaste.model.IndentMode;
import ru.itmo.ghostpaste.model.Theme;
import ru.itmo.ghostpaste.model.WrapMode;

/**
 * The {@code metadata} part of a create request. The PIN travels separately and is never
 * part of this document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateGistRequest {
    private String expiresAt;
    private Boolean oneTimeView;
    private Integer blobCount;
    private EncryptedData encryptedMetadata;
    private IndentMode indentMode;
    private Integer indentSize;
    private WrapMode wrapMode;
    private Theme theme;
}
