package ru.itmo.ghostpaste.config;

/**
 * Hard limits shared by the container codec and the record store.
 */
public final class GistLimits {

    public static final int MAX_FILE_SIZE = 500 * 1024;
    public static final int MAX_TOTAL_SIZE = 5 * 1024 * 1024;
    public static final int MAX_FILE_COUNT = 20;
    public static final int MAX_FILENAME_BYTES = 255;
    public static final int MAX_LANGUAGE_BYTES = 50;
    public static final int MAX_VERSIONS = 50;

    private GistLimits() {
    }
}
