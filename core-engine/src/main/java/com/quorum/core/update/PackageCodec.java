package com.quorum.core.update;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.quorum.core.store.StoreKind;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Reads and writes the update package container.
 *
 * <h3>Layout</h3>
 * <p>
 * A ZIP archive holding exactly:
 * </p>
 * <ul>
 * <li>{@value #MANIFEST_ENTRY}: UTF-8 JSON {@link PackageManifest}</li>
 * <li>{@value #PAYLOAD_PREFIX}{@code <kind>}: one payload per store kind</li>
 * <li>{@value #SIGNATURE_ENTRY}: signature over the exact manifest bytes</li>
 * </ul>
 * <p>
 * Any other entry, a duplicate entry or a missing manifest or signature makes
 * the container invalid. Every entry is read with a size bound so a
 * compressed entry cannot inflate past it.
 * </p>
 *
 * @since 1.0.0
 */
public final class PackageCodec {

    public static final String MANIFEST_ENTRY = "manifest.json";
    public static final String SIGNATURE_ENTRY = "manifest.sig";
    public static final String PAYLOAD_PREFIX = "payloads/";

    /** Fixed entry time so that identical inputs produce identical containers. */
    private static final long ENTRY_TIME = 0L;

    private static final int BUFFER_SIZE = 8192;

    private static final ObjectMapper MAPPER = createMapper();

    private PackageCodec() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Container
    // ---------------------------------------------------------------

    /**
     * Unpack a container.
     *
     * @param container     raw package bytes
     * @param maxEntryBytes upper bound for any single decompressed entry
     * @return the unpacked, still untrusted package
     * @throws UpdateException {@code PAYLOAD_TOO_LARGE} if an entry exceeds the
     *                         bound, {@code PAYLOAD_INVALID} if the container
     *                         is malformed
     */
    public static UpdatePackage read(byte[] container, long maxEntryBytes) throws UpdateException {
        Objects.requireNonNull(container, "container must not be null");
        byte[] manifest = null;
        byte[] signature = null;
        Map<StoreKind, byte[]> payloads = new EnumMap<>(StoreKind.class);
        Set<String> seen = new HashSet<>();

        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(container))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                String name = entry.getName();
                if (!seen.add(name)) {
                    throw invalid("duplicate container entry '" + name + "'");
                }
                if (entry.isDirectory()) {
                    throw invalid("unexpected directory entry '" + name + "'");
                }
                byte[] data = readBounded(zip, name, maxEntryBytes);
                if (MANIFEST_ENTRY.equals(name)) {
                    manifest = data;
                } else if (SIGNATURE_ENTRY.equals(name)) {
                    signature = data;
                } else if (name.startsWith(PAYLOAD_PREFIX)) {
                    payloads.put(payloadKind(name), data);
                } else {
                    throw invalid("unknown container entry '" + name + "'");
                }
            }
        } catch (ZipException e) {
            throw new UpdateException(UpdateFailureReason.PAYLOAD_INVALID,
                    "corrupt container: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UpdateException(UpdateFailureReason.PAYLOAD_INVALID,
                    "unreadable container: " + e.getMessage(), e);
        }

        if (manifest == null) {
            throw invalid("container has no " + MANIFEST_ENTRY);
        }
        if (signature == null) {
            throw invalid("container has no " + SIGNATURE_ENTRY);
        }
        return new UpdatePackage(manifest, payloads, signature);
    }

    /**
     * Pack a container. Entries are written manifest first, then payloads in
     * kind order, then the signature.
     *
     * @param updatePackage package to pack
     * @return container bytes
     */
    public static byte[] write(UpdatePackage updatePackage) {
        Objects.requireNonNull(updatePackage, "package must not be null");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            writeEntry(zip, MANIFEST_ENTRY, updatePackage.getManifestBytes());
            for (Map.Entry<StoreKind, byte[]> payload : updatePackage.getPayloads().entrySet()) {
                writeEntry(zip, PAYLOAD_PREFIX + payload.getKey().wireName(), payload.getValue());
            }
            writeEntry(zip, SIGNATURE_ENTRY, updatePackage.getSignature());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write package container", e);
        }
        return out.toByteArray();
    }

    // ---------------------------------------------------------------
    // Manifest
    // ---------------------------------------------------------------

    /**
     * Parse manifest bytes. Unknown properties and duplicate keys are
     * rejected.
     *
     * @param manifestBytes exact bytes of {@value #MANIFEST_ENTRY}
     * @return parsed manifest, not yet validated
     * @throws UpdateException {@code PAYLOAD_INVALID} if the JSON is malformed
     */
    public static PackageManifest parseManifest(byte[] manifestBytes) throws UpdateException {
        try {
            PackageManifest manifest = MAPPER.readValue(manifestBytes, PackageManifest.class);
            if (manifest == null) {
                throw invalid("manifest is empty");
            }
            return manifest;
        } catch (JsonProcessingException e) {
            throw new UpdateException(UpdateFailureReason.PAYLOAD_INVALID,
                    "malformed manifest: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UpdateException(UpdateFailureReason.PAYLOAD_INVALID,
                    "unreadable manifest: " + e.getMessage(), e);
        }
    }

    public static byte[] writeManifest(PackageManifest manifest) {
        try {
            return MAPPER.writeValueAsBytes(manifest);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize manifest", e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        mapper.configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);
        return mapper;
    }

    private static StoreKind payloadKind(String entryName) throws UpdateException {
        String wireName = entryName.substring(PAYLOAD_PREFIX.length());
        for (StoreKind kind : StoreKind.values()) {
            if (kind.wireName().equals(wireName)) {
                return kind;
            }
        }
        throw invalid("unknown payload entry '" + entryName + "'");
    }

    private static byte[] readBounded(InputStream in, String name, long maxBytes)
            throws IOException, UpdateException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[BUFFER_SIZE];
        long total = 0;
        int n;
        while ((n = in.read(buffer)) != -1) {
            total += n;
            if (total > maxBytes) {
                throw new UpdateException(UpdateFailureReason.PAYLOAD_TOO_LARGE,
                        "entry '" + name + "' exceeds " + maxBytes + " bytes");
            }
            out.write(buffer, 0, n);
        }
        return out.toByteArray();
    }

    private static void writeEntry(ZipOutputStream zip, String name, byte[] data) throws IOException {
        ZipEntry entry = new ZipEntry(name);
        entry.setTime(ENTRY_TIME);
        zip.putNextEntry(entry);
        zip.write(data);
        zip.closeEntry();
    }

    private static UpdateException invalid(String detail) {
        return new UpdateException(UpdateFailureReason.PAYLOAD_INVALID, detail);
    }
}
