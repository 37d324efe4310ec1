package com.quorum.core.update;

import com.quorum.core.store.StoreKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PackageCodec}.
 */
class PackageCodecTest {

    private static final long LIMIT = 1024 * 1024;

    private TestPackages.Builder builder;

    @BeforeEach
    void setUp() {
        builder = TestPackages.pkg("p1")
                .payload(StoreKind.INDICATOR, "ioc-1", TestPackages.INDICATOR_JSON)
                .payload(StoreKind.PATTERN, "ttp-1", TestPackages.PATTERN_JSON);
    }

    @Test
    @DisplayName("Should unpack manifest, payloads and signature")
    void shouldUnpackContainer() throws UpdateException {
        UpdatePackage unpacked = PackageCodec.read(builder.build(), LIMIT);

        assertThat(unpacked.getManifestBytes()).isEqualTo(builder.manifestBytes());
        assertThat(unpacked.getPayloads()).containsOnlyKeys(StoreKind.INDICATOR, StoreKind.PATTERN);
        assertThat(new String(unpacked.getPayloads().get(StoreKind.PATTERN), StandardCharsets.UTF_8))
                .isEqualTo(TestPackages.PATTERN_JSON);
        assertThat(unpacked.getSignature()).hasSize(256);
    }

    @Test
    @DisplayName("Should produce identical containers for identical inputs")
    void shouldWriteDeterministically() {
        byte[] manifest = builder.manifestBytes();
        byte[] signature = TestPackages.sign(manifest, TestPackages.KEYS);

        byte[] first = TestPackages.container(manifest, builder.payloads(), signature);
        byte[] second = TestPackages.container(manifest, builder.payloads(), signature);

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Should reject an unknown container entry")
    void shouldRejectUnknownEntry() throws IOException {
        Map<String, byte[]> entries = baseEntries();
        entries.put("README.txt", bytes("hello"));

        assertInvalid(zip(entries), "unknown container entry 'README.txt'");
    }

    @Test
    @DisplayName("Should reject a payload entry for an unknown store kind")
    void shouldRejectUnknownPayloadKind() throws IOException {
        Map<String, byte[]> entries = baseEntries();
        entries.put("payloads/yara", bytes("{}"));

        assertInvalid(zip(entries), "unknown payload entry 'payloads/yara'");
    }

    @Test
    @DisplayName("Should reject a directory entry")
    void shouldRejectDirectoryEntry() throws IOException {
        Map<String, byte[]> entries = baseEntries();
        entries.put("payloads/", new byte[0]);

        assertInvalid(zip(entries), "unexpected directory entry 'payloads/'");
    }

    @Test
    @DisplayName("Should reject a container without a manifest or signature")
    void shouldRejectMissingParts() throws IOException {
        Map<String, byte[]> noManifest = baseEntries();
        noManifest.remove(PackageCodec.MANIFEST_ENTRY);
        assertInvalid(zip(noManifest), "container has no manifest.json");

        Map<String, byte[]> noSignature = baseEntries();
        noSignature.remove(PackageCodec.SIGNATURE_ENTRY);
        assertInvalid(zip(noSignature), "container has no manifest.sig");
    }

    @Test
    @DisplayName("Should fail with PAYLOAD_TOO_LARGE when an entry exceeds the bound")
    void shouldBoundEntrySize() {
        byte[] container = builder.build();

        assertThatThrownBy(() -> PackageCodec.read(container, 64))
                .isInstanceOf(UpdateException.class)
                .satisfies(e -> assertThat(((UpdateException) e).getReason())
                        .isEqualTo(UpdateFailureReason.PAYLOAD_TOO_LARGE))
                .hasMessageContaining("exceeds 64 bytes");
    }

    @Test
    @DisplayName("Should round-trip a manifest through its JSON form")
    void shouldParseWrittenManifest() throws UpdateException {
        PackageManifest parsed = PackageCodec.parseManifest(builder.manifestBytes());

        assertThat(parsed.getPackageVersion()).isEqualTo("p1");
        assertThat(parsed.getCreatedAt()).isEqualTo(TestPackages.CREATED_AT);
        assertThat(parsed.getStores()).containsOnlyKeys("indicator", "pattern");
        assertThat(parsed.getStores().get("indicator").getVersion()).isEqualTo("ioc-1");
    }

    @Test
    @DisplayName("Should reject unknown manifest properties and duplicate keys")
    void shouldParseManifestStrictly() {
        assertThatThrownBy(() -> PackageCodec.parseManifest(
                bytes("{\"formatVersion\": 1, \"packageVersion\": \"p1\", \"signedBy\": \"x\"}")))
                .isInstanceOf(UpdateException.class)
                .hasMessageContaining("malformed manifest");
        assertThatThrownBy(() -> PackageCodec.parseManifest(
                bytes("{\"packageVersion\": \"p1\", \"packageVersion\": \"p2\"}")))
                .isInstanceOf(UpdateException.class)
                .hasMessageContaining("malformed manifest");
        assertThatThrownBy(() -> PackageCodec.parseManifest(bytes("not json")))
                .isInstanceOf(UpdateException.class)
                .satisfies(e -> assertThat(((UpdateException) e).getReason())
                        .isEqualTo(UpdateFailureReason.PAYLOAD_INVALID));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private Map<String, byte[]> baseEntries() {
        byte[] manifest = builder.manifestBytes();
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put(PackageCodec.MANIFEST_ENTRY, manifest);
        entries.put("payloads/indicator", bytes(TestPackages.INDICATOR_JSON));
        entries.put(PackageCodec.SIGNATURE_ENTRY, TestPackages.sign(manifest, TestPackages.KEYS));
        return entries;
    }

    private static byte[] zip(Map<String, byte[]> entries) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue());
                zip.closeEntry();
            }
        }
        return out.toByteArray();
    }

    private static void assertInvalid(byte[] container, String detail) {
        assertThatThrownBy(() -> PackageCodec.read(container, LIMIT))
                .isInstanceOf(UpdateException.class)
                .satisfies(e -> {
                    UpdateException failure = (UpdateException) e;
                    assertThat(failure.getReason()).isEqualTo(UpdateFailureReason.PAYLOAD_INVALID);
                    assertThat(failure.getDetail()).isEqualTo(detail);
                });
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
