package ru.itmo.ghostpaste.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A gist record together with the blob generation it currently points at.
 */
@Getter
@AllArgsConstructor
public class GistContent {
    private final GistMetadata metadata;
    private final byte[] blob;
}
