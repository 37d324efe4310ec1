package com.quorum.core.update;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * SHA-512 payload checksums, rendered as lowercase hex.
 *
 * @since 1.0.0
 */
public final class Checksums {

    public static final String ALGORITHM = "SHA-512";

    /** Length of a hex-encoded SHA-512 digest. */
    public static final int HEX_LENGTH = 128;

    private Checksums() {
        // utility class, not instantiable
    }

    public static String sha512Hex(byte[] data) {
        Objects.requireNonNull(data, "data must not be null");
        try {
            MessageDigest md = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(md.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available in this JVM", e);
        }
    }

    /**
     * Compare in constant time.
     *
     * @param expectedHex lowercase hex digest from a manifest
     * @param data        payload bytes
     * @return {@code true} if the digest of {@code data} equals {@code expectedHex}
     */
    public static boolean matches(String expectedHex, byte[] data) {
        if (expectedHex == null) {
            return false;
        }
        byte[] expected = expectedHex.getBytes(StandardCharsets.US_ASCII);
        byte[] actual = sha512Hex(data).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }
}
