package quest.gekko.pulse.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Deterministic content ids. Parts are joined with NUL so that "ab"+"c" and "a"+"bc" differ.
 */
public final class Fingerprint {
    private static final char SEP = '\u0000';

    private Fingerprint() {}

    public static String ofExternal(String source, String externalId) {
        return sha256(source + SEP + externalId);
    }

    public static String ofContent(String source, String author, String text, Instant createdAt) {
        return sha256(source + SEP + (author == null ? "" : author) + SEP + text + SEP + createdAt.toEpochMilli());
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
