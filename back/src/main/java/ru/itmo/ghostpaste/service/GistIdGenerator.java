package ru.itmo.ghostpaste.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import ru.itmo.ghostpaste.config.GhostPasteProperties;

import java.security.SecureRandom;

/**
 * Random URL-safe gist ids.
 */
@Component
public class GistIdGenerator {

    static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";

    private final SecureRandom random = new SecureRandom();
    private final int length;

    @Autowired
    public GistIdGenerator(GhostPasteProperties properties) {
        this(properties.getGist().getIdLength());
    }

    public GistIdGenerator(int length) {
        this.length = length;
    }

    public String nextId() {
        StringBuilder id = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            id.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return id.toString();
    }
}
