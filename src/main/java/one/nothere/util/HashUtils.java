package one.nothere.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 hashing used for page dedup keys.
 *
 * <p>Every JDK ships SHA-256, so a missing algorithm is reported as an
 * {@link IllegalStateException} instead of a checked exception.</p>
 */
public final class HashUtils {

    private HashUtils() {
    }

    /**
     * Computes SHA-256 of the UTF-8 bytes of {@code data}.
     *
     * @param data String to hash
     * @return SHA-256 hash as byte array
     */
    public static byte[] computeSha256(String data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        try {
            return MessageDigest.getInstance("SHA-256").digest(data.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Computes SHA-256 of a string and returns it as lowercase hex.
     *
     * @param data String to hash
     * @return 64 character hex digest
     *
     * @example
     * <pre>{@code
     * String key = HashUtils.sha256Hex("https://example.com/page");
     * }</pre>
     */
    public static String sha256Hex(String data) {
        return bytesToHex(computeSha256(data));
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}
