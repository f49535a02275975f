package ru.itmo.ghostpaste.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ghostpaste")
@Data
public class GhostPasteProperties {

    private String baseUrl = "https://ghostpaste.dev";

    private Limits limits = new Limits();
    private Auth auth = new Auth();
    private Gist gist = new Gist();
    private Storage storage = new Storage();

    @Data
    public static class Limits {
        private int maxFileSize = GistLimits.MAX_FILE_SIZE;
        private int maxTotalSize = GistLimits.MAX_TOTAL_SIZE;
        private int maxFileCount = GistLimits.MAX_FILE_COUNT;
        private int maxFilenameBytes = GistLimits.MAX_FILENAME_BYTES;
        private int maxLanguageBytes = GistLimits.MAX_LANGUAGE_BYTES;
        private int maxVersions = GistLimits.MAX_VERSIONS;
    }

    @Data
    public static class Auth {
        private int pinIterations = 100_000;
        private int saltLength = 16;
    }

    @Data
    public static class Gist {
        private int idLength = 12;
        /**
         * When set, an update whose expected version differs from the stored one
         * is rejected with a conflict instead of overwriting.
         */
        private boolean strictVersioning = false;
    }

    @Data
    public static class Storage {
        private String type = "jpa"; // jpa or memory
    }
}
