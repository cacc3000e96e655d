package dev.medrag.evidence;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes the deduplication key of evidence content.
 *
 * <p>Two items are duplicates exactly when their full UTF-8 content bytes are equal, so the key is
 * the SHA-256 digest of the whole string rendered as lowercase hex.
 */
public final class ContentHasher {

    private ContentHasher() {
    }

    public static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available on this JVM", e);
        }
    }
}
