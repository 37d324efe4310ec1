package com.quorum.tools;

import com.quorum.core.store.StoreKind;
import com.quorum.core.update.Checksums;
import com.quorum.core.update.ManifestEntry;
import com.quorum.core.update.PackageCodec;
import com.quorum.core.update.PackageManifest;
import com.quorum.core.update.SignatureScheme;
import com.quorum.core.update.UpdatePackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Authors a signed update package.
 *
 * <pre>
 * byte[] container = new UpdatePackageBuilder("2024.06.1")
 *         .payload(StoreKind.INDICATOR, "ioc-118", indicatorJson)
 *         .payloadFile(StoreKind.RULE, "rules-42", Path.of("rules.json"))
 *         .build(privateKey);
 * </pre>
 *
 * <p>
 * Payloads are taken as-is; their SHA-512 goes into the manifest and the
 * manifest bytes are signed.
 * </p>
 *
 * @since 1.0.0
 */
public class UpdatePackageBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(UpdatePackageBuilder.class);

    public static final String FILE_EXTENSION = ".qpkg";

    private final String packageVersion;
    private final Map<StoreKind, byte[]> payloads = new EnumMap<>(StoreKind.class);
    private final Map<StoreKind, String> versions = new EnumMap<>(StoreKind.class);
    private Instant createdAt = Instant.now();
    private long maxPackageBytes = Long.MAX_VALUE;

    public UpdatePackageBuilder(String packageVersion) {
        if (packageVersion == null || packageVersion.isBlank()) {
            throw new IllegalArgumentException("packageVersion must not be null or blank");
        }
        this.packageVersion = packageVersion;
    }

    /**
     * @param version package version
     * @return conventional file name, e.g. {@code quorum-update-2024.06.1.qpkg}
     */
    public static String defaultFileName(String version) {
        return "quorum-update-" + version + FILE_EXTENSION;
    }

    public UpdatePackageBuilder createdAt(Instant createdAt) {
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        return this;
    }

    /**
     * Refuse to build packages the appliance would reject as too large.
     */
    public UpdatePackageBuilder maxPackageBytes(long maxPackageBytes) {
        this.maxPackageBytes = maxPackageBytes;
        return this;
    }

    public UpdatePackageBuilder payload(StoreKind kind, String storeVersion, byte[] bytes) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(bytes, "bytes must not be null");
        if (storeVersion == null || storeVersion.isBlank()) {
            throw new IllegalArgumentException("storeVersion for " + kind + " must not be blank");
        }
        if (payloads.containsKey(kind)) {
            throw new IllegalArgumentException("Payload for " + kind + " already added");
        }
        payloads.put(kind, bytes.clone());
        versions.put(kind, storeVersion);
        return this;
    }

    public UpdatePackageBuilder payloadFile(StoreKind kind, String storeVersion, Path file) throws IOException {
        return payload(kind, storeVersion, Files.readAllBytes(file));
    }

    /**
     * @return the manifest that {@link #build} will sign
     */
    public PackageManifest manifest() {
        if (payloads.isEmpty()) {
            throw new IllegalStateException("A package needs at least one payload");
        }
        Map<String, ManifestEntry> stores = new LinkedHashMap<>();
        payloads.forEach((kind, bytes) ->
                stores.put(kind.wireName(), new ManifestEntry(versions.get(kind), Checksums.sha512Hex(bytes))));

        PackageManifest manifest = new PackageManifest();
        manifest.setFormatVersion(PackageManifest.FORMAT_VERSION);
        manifest.setPackageVersion(packageVersion);
        manifest.setCreatedAt(createdAt);
        manifest.setStores(stores);
        manifest.validate();
        return manifest;
    }

    /**
     * Sign and pack.
     *
     * @param signingKey RSA private key
     * @return container bytes
     * @throws GeneralSecurityException if signing fails
     * @throws IllegalStateException    if the result exceeds the size bound
     */
    public byte[] build(PrivateKey signingKey) throws GeneralSecurityException {
        Objects.requireNonNull(signingKey, "signingKey must not be null");
        byte[] manifestBytes = PackageCodec.writeManifest(manifest());
        byte[] signature = SignatureScheme.sign(manifestBytes, signingKey);
        byte[] container = PackageCodec.write(new UpdatePackage(manifestBytes, payloads, signature));
        if (container.length > maxPackageBytes) {
            throw new IllegalStateException("Package is " + container.length
                    + " bytes, appliances accept at most " + maxPackageBytes);
        }
        LOG.info("Built package {} with {} ({} bytes)", packageVersion, payloads.keySet(), container.length);
        return container;
    }

    /**
     * Sign, pack and write to {@code target}.
     *
     * @return the written file
     */
    public Path writeTo(Path target, PrivateKey signingKey) throws IOException, GeneralSecurityException {
        byte[] container = build(signingKey);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.write(target, container);
    }

    public String getPackageVersion() {
        return packageVersion;
    }
}
