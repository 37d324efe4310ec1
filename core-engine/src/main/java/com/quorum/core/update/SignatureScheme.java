package com.quorum.core.update;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.Key;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.security.interfaces.RSAKey;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PSSParameterSpec;
import java.util.Objects;

/**
 * Manifest signatures: RSASSA-PSS with SHA-256, MGF1-SHA-256 and the maximum
 * salt length the key allows.
 *
 * <p>
 * The salt length depends on the modulus size, so it is derived from the key
 * on both the signing and the verifying side.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignatureScheme {

    public static final String ALGORITHM = "RSASSA-PSS";
    public static final String KEY_ALGORITHM = "RSA";

    private static final String DIGEST = "SHA-256";
    private static final int DIGEST_LENGTH = 32;

    private SignatureScheme() {
        // utility class, not instantiable
    }

    /**
     * @param data bytes to sign
     * @param key  RSA private key
     * @return raw signature bytes
     * @throws GeneralSecurityException if the key is unusable
     */
    public static byte[] sign(byte[] data, PrivateKey key) throws GeneralSecurityException {
        Objects.requireNonNull(data, "data must not be null");
        Signature signature = Signature.getInstance(ALGORITHM);
        signature.setParameter(parametersFor(key));
        signature.initSign(key);
        signature.update(data);
        return signature.sign();
    }

    /**
     * @param data      signed bytes
     * @param signature raw signature bytes
     * @param key       RSA public key
     * @return {@code true} only if the signature is valid for {@code data}
     * @throws GeneralSecurityException if the key is unusable
     */
    public static boolean verify(byte[] data, byte[] signature, PublicKey key) throws GeneralSecurityException {
        Objects.requireNonNull(data, "data must not be null");
        if (signature == null || signature.length == 0) {
            return false;
        }
        Signature verifier = Signature.getInstance(ALGORITHM);
        verifier.setParameter(parametersFor(key));
        verifier.initVerify(key);
        verifier.update(data);
        try {
            return verifier.verify(signature);
        } catch (SignatureException e) {
            // malformed signature encoding, e.g. wrong length
            return false;
        }
    }

    /**
     * PSS parameters for a key: salt length is {@code emLen - hLen - 2} where
     * {@code emLen = ceil((modBits - 1) / 8)}.
     */
    static PSSParameterSpec parametersFor(Key key) throws InvalidKeyException {
        if (!(key instanceof RSAKey rsaKey)) {
            throw new InvalidKeyException("RSA key required, got: "
                    + (key == null ? "null" : key.getAlgorithm()));
        }
        int modulusBits = rsaKey.getModulus().bitLength();
        int emLen = (modulusBits - 1 + 7) / 8;
        int saltLength = emLen - DIGEST_LENGTH - 2;
        if (saltLength < 0) {
            throw new InvalidKeyException("RSA key too small for PSS: " + modulusBits + " bits");
        }
        return new PSSParameterSpec(DIGEST, "MGF1", MGF1ParameterSpec.SHA256, saltLength,
                PSSParameterSpec.TRAILER_FIELD_BC);
    }
}
