package com.quorum.tools;

import com.quorum.core.update.PemKeys;
import com.quorum.core.update.SignatureScheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * Generates the RSA key pair used to sign update packages.
 *
 * <p>
 * The private key stays on the authoring workstation; only the public key is
 * provisioned onto appliances.
 * </p>
 *
 * @since 1.0.0
 */
public final class SigningKeyGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(SigningKeyGenerator.class);

    public static final String PRIVATE_KEY_FILE = "quorum-signing.key.pem";
    public static final String PUBLIC_KEY_FILE = "quorum-signing.pub.pem";

    private SigningKeyGenerator() {
        // utility class, not instantiable
    }

    /**
     * @param bits modulus size
     * @return a fresh RSA key pair
     * @throws GeneralSecurityException if RSA key generation is unavailable
     */
    public static KeyPair generate(int bits) throws GeneralSecurityException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance(SignatureScheme.KEY_ALGORITHM);
        generator.initialize(bits, new SecureRandom());
        return generator.generateKeyPair();
    }

    /**
     * Generate a key pair and write it as PEM files into {@code directory}.
     *
     * @param directory target directory, created if missing
     * @param bits      modulus size
     * @return path of the written public key
     * @throws IOException              if a file already exists or cannot be written
     * @throws GeneralSecurityException if key generation fails
     */
    public static Path writeKeyPair(Path directory, int bits) throws IOException, GeneralSecurityException {
        Objects.requireNonNull(directory, "directory must not be null");
        Files.createDirectories(directory);
        Path privateFile = directory.resolve(PRIVATE_KEY_FILE);
        Path publicFile = directory.resolve(PUBLIC_KEY_FILE);
        if (Files.exists(privateFile) || Files.exists(publicFile)) {
            throw new IOException("Refusing to overwrite existing key files in " + directory);
        }

        KeyPair pair = generate(bits);
        Files.writeString(privateFile, PemKeys.toPem(pair.getPrivate()), StandardCharsets.US_ASCII);
        restrictToOwner(privateFile);
        Files.writeString(publicFile, PemKeys.toPem(pair.getPublic()), StandardCharsets.US_ASCII);

        LOG.info("Wrote {}-bit signing key pair to {}", bits, directory);
        return publicFile;
    }

    private static void restrictToOwner(Path file) throws IOException {
        if (file.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } else {
            LOG.warn("File system does not support POSIX permissions; protect {} manually", file);
        }
    }
}
