package cids.core.service.common;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Random secrets and their at-rest hashes.
 */
public final class SecureTokens {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private SecureTokens() {}

    /**
     * URL-safe random string without padding.
     */
    public static String randomUrlSafe(int bytes) {
        final var buffer = new byte[bytes];
        SECURE_RANDOM.nextBytes(buffer);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer);
    }

    /**
     * Random lowercase hex string of the given length.
     */
    public static String randomHex(int length) {
        final var buffer = new byte[(length + 1) / 2];
        SECURE_RANDOM.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer).substring(0, length);
    }

    public static String sha256Hex(String value) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Compare a plaintext secret to a stored hash in constant time.
     */
    public static boolean matchesHash(String plaintext, String expectedHash) {
        if (plaintext == null || expectedHash == null) {
            return false;
        }
        return MessageDigest.isEqual(
                sha256Hex(plaintext).getBytes(StandardCharsets.US_ASCII),
                expectedHash.getBytes(StandardCharsets.US_ASCII));
    }
}
