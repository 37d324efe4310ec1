package com.quorum.core.update;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Objects;

/**
 * Reads and writes RSA keys as PEM text: X.509 {@code PUBLIC KEY} and PKCS#8
 * {@code PRIVATE KEY}.
 *
 * @since 1.0.0
 */
public final class PemKeys {

    private static final String PUBLIC_LABEL = "PUBLIC KEY";
    private static final String PRIVATE_LABEL = "PRIVATE KEY";
    private static final int LINE_LENGTH = 64;

    private PemKeys() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Reading
    // ---------------------------------------------------------------

    public static PublicKey readPublicKey(Path path) throws IOException, GeneralSecurityException {
        Objects.requireNonNull(path, "Public key path must not be null");
        return parsePublicKey(Files.readString(path, StandardCharsets.US_ASCII));
    }

    public static PrivateKey readPrivateKey(Path path) throws IOException, GeneralSecurityException {
        Objects.requireNonNull(path, "Private key path must not be null");
        return parsePrivateKey(Files.readString(path, StandardCharsets.US_ASCII));
    }

    public static PublicKey parsePublicKey(String pem) throws GeneralSecurityException {
        byte[] der = decode(pem, PUBLIC_LABEL);
        return KeyFactory.getInstance(SignatureScheme.KEY_ALGORITHM).generatePublic(new X509EncodedKeySpec(der));
    }

    public static PrivateKey parsePrivateKey(String pem) throws GeneralSecurityException {
        byte[] der = decode(pem, PRIVATE_LABEL);
        return KeyFactory.getInstance(SignatureScheme.KEY_ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(der));
    }

    // ---------------------------------------------------------------
    // Writing
    // ---------------------------------------------------------------

    public static String toPem(PublicKey key) {
        return encode(Objects.requireNonNull(key, "key must not be null").getEncoded(), PUBLIC_LABEL);
    }

    public static String toPem(PrivateKey key) {
        return encode(Objects.requireNonNull(key, "key must not be null").getEncoded(), PRIVATE_LABEL);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static byte[] decode(String pem, String label) throws InvalidKeySpecException {
        Objects.requireNonNull(pem, "PEM text must not be null");
        String begin = "-----BEGIN " + label + "-----";
        String end = "-----END " + label + "-----";
        int from = pem.indexOf(begin);
        int to = pem.indexOf(end);
        if (from < 0 || to < from) {
            throw new InvalidKeySpecException("Not a PEM " + label + " block");
        }
        String body = pem.substring(from + begin.length(), to);
        try {
            return Base64.getMimeDecoder().decode(body);
        } catch (IllegalArgumentException e) {
            throw new InvalidKeySpecException("Malformed base64 in PEM " + label + " block", e);
        }
    }

    private static String encode(byte[] der, String label) {
        Base64.Encoder encoder = Base64.getMimeEncoder(LINE_LENGTH, "\n".getBytes(StandardCharsets.US_ASCII));
        return "-----BEGIN " + label + "-----\n"
                + encoder.encodeToString(der)
                + "\n-----END " + label + "-----\n";
    }
}
