package ru.itmo.ghostpaste.auth;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import ru.itmo.ghostpaste.config.GhostPasteProperties;
import ru.itmo.ghostpaste.model.GistMetadata;
import ru.itmo.ghostpaste.model.ProtectionClass;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Possession-based authorization for gists: salted PIN hashes for edit protection and a
 * deterministic deletion proof for one-time-view gists.
 *
 * <p>Every comparison is constant time, and every validation fails closed: an exception while
 * checking a credential means "invalid", never "valid".
 */
@Component
@Slf4j
public class GistAuthorizer {

    public static final int KEY_LENGTH_BITS = 256;
    public static final int MIN_PIN_LENGTH = 4;
    public static final int MAX_PIN_LENGTH = 20;

    // keeps proofs out of the PIN hash domain
    static final String DELETION_PROOF_DISCRIMINATOR = "delete";

    private static final Pattern LETTER_AND_DIGIT = Pattern.compile("^(?=.*[a-zA-Z])(?=.*\\d).+$");
    private static final Set<String> WEAK_PINS = Set.of(
            "1234", "0000", "1111", "2222", "3333", "4444", "5555", "6666", "7777", "8888", "9999",
            "password", "pass1234", "1234pass", "test1234", "admin123");

    private final SecureRandom random = new SecureRandom();
    private final int iterations;
    private final int saltLength;

    public GistAuthorizer() {
        this(new GhostPasteProperties.Auth());
    }

    @Autowired
    public GistAuthorizer(GhostPasteProperties properties) {
        this(properties.getAuth());
    }

    GistAuthorizer(GhostPasteProperties.Auth auth) {
        this.iterations = auth.getPinIterations();
        this.saltLength = auth.getSaltLength();
    }

    /** Random salt for a new PIN, Base64 encoded. */
    public String generateSalt() {
        byte[] salt = new byte[saltLength];
        random.nextBytes(salt);
        return Base64.getEncoder().encodeToString(salt);
    }

    /**
     * PBKDF2-HMAC-SHA256 of {@code pin} under the Base64 {@code salt}.
     *
     * @return Base64 encoded 32-byte derived key
     */
    public String hashPin(String pin, String salt) {
        byte[] saltBytes = Base64.getDecoder().decode(salt);
        PBEKeySpec spec = new PBEKeySpec(pin.toCharArray(), saltBytes, iterations, KEY_LENGTH_BITS);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            return Base64.getEncoder().encodeToString(factory.generateSecret(spec).getEncoded());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2WithHmacSHA256 unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }

    public boolean validatePin(String pin, GistMetadata record) {
        if (pin == null || record.getProtectionClass() != ProtectionClass.PIN_PROTECTED) {
            return false;
        }
        try {
            byte[] stored = Base64.getDecoder().decode(record.getEditPinHash());
            byte[] computed = Base64.getDecoder().decode(hashPin(pin, record.getEditPinSalt()));
            boolean valid = MessageDigest.isEqual(stored, computed);
            if (!valid) {
                log.warn("PIN validation failed for gist {}", record.getId());
            }
            return valid;
        } catch (RuntimeException e) {
            log.error("Error during PIN validation for gist {}", record.getId(), e);
            return false;
        }
    }

    /**
     * Strength rules applied when a PIN is first set.
     *
     * @return human readable violations, empty when the PIN is acceptable
     */
    public List<String> validatePinStrength(String pin) {
        List<String> errors = new ArrayList<>();
        if (pin == null || pin.isEmpty()) {
            errors.add("PIN is required");
            return errors;
        }
        if (pin.length() < MIN_PIN_LENGTH) {
            errors.add("PIN must be at least " + MIN_PIN_LENGTH + " characters long");
        }
        if (pin.length() > MAX_PIN_LENGTH) {
            errors.add("PIN must be no more than " + MAX_PIN_LENGTH + " characters long");
        }
        if (!LETTER_AND_DIGIT.matcher(pin).matches()) {
            errors.add("PIN must contain both letters and numbers");
        }
        if (WEAK_PINS.contains(pin.toLowerCase())) {
            errors.add("PIN is too common, please choose a stronger PIN");
        }
        return errors;
    }

    /**
     * Hex SHA-256 over {@code createdAt + totalSize + id + "delete"}. A client that fetched the
     * metadata can compute the same value locally.
     */
    public String deriveDeletionProof(String createdAt, long totalSize, String id) {
        String input = createdAt + totalSize + id + DELETION_PROOF_DISCRIMINATOR;
        return HexFormat.of().formatHex(sha256(input.getBytes(StandardCharsets.UTF_8)));
    }

    public boolean validateDeletionProof(String candidate, GistMetadata record) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        try {
            String expected = deriveDeletionProof(record.getCreatedAt(), record.getTotalSize(), record.getId());
            boolean valid = MessageDigest.isEqual(
                    expected.getBytes(StandardCharsets.UTF_8),
                    candidate.getBytes(StandardCharsets.UTF_8));
            if (!valid) {
                log.warn("Invalid deletion proof for gist {} (provided {}...)",
                        record.getId(), candidate.substring(0, Math.min(8, candidate.length())));
            }
            return valid;
        } catch (RuntimeException e) {
            log.error("Error during deletion proof validation for gist {}", record.getId(), e);
            return false;
        }
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
