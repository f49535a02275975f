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
 * Fields an edit may overwrite. Absent fields keep their stored value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpdateGistRequest {
    private EncryptedData encryptedMetadata;
    private Integer blobCount;
    private IndentMode indentMode;
    private Integer indentSize;
    private WrapMode wrapMode;
    private Theme theme;
}
