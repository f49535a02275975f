package ru.itmo.ghostpaste.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One named file inside a binary container. {@code language} is optional.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GistFile {
    private String name;
    private byte[] content;
    private String language;
}
