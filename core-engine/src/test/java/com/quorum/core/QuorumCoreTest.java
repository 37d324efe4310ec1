package com.quorum.core;

import com.quorum.core.audit.AuditEntry;
import com.quorum.core.audit.JsonLinesAuditSink;
import com.quorum.core.config.EngineSettings;
import com.quorum.core.config.SettingsLoader;
import com.quorum.core.model.NormalizedLogRecord;
import com.quorum.core.model.Severity;
import com.quorum.core.model.Verdict;
import com.quorum.core.store.StoreKind;
import com.quorum.core.update.Checksums;
import com.quorum.core.update.ManifestEntry;
import com.quorum.core.update.PackageCodec;
import com.quorum.core.update.PackageManifest;
import com.quorum.core.update.PemKeys;
import com.quorum.core.update.SignatureScheme;
import com.quorum.core.update.UpdatePackage;
import com.quorum.core.update.UpdateResult;
import com.quorum.core.update.UpdateState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link QuorumCore}.
 */
class QuorumCoreTest {

    private static final Instant NOW = Instant.parse("2024-06-03T09:30:00Z");

    private static final String INDICATORS = "{\"indicators\": [{\"type\": \"ip\", \"value\": \"198.51.100.23\"}]}";

    @TempDir
    Path tempDir;

    private KeyPair keys;
    private EngineSettings settings;

    @BeforeEach
    void setUp() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance(SignatureScheme.KEY_ALGORITHM);
        generator.initialize(2048);
        keys = generator.generateKeyPair();

        Path publicKey = tempDir.resolve("update.pub.pem");
        Files.writeString(publicKey, PemKeys.toPem(keys.getPublic()), StandardCharsets.US_ASCII);

        settings = SettingsLoader.fromClasspath("test-quorum.yml");
        settings.setPublicKeyPath(publicKey.toString());
        settings.setAuditLogPath(tempDir.resolve("audit.jsonl").toString());
    }

    @Test
    @DisplayName("Should detect with content committed through the update manager")
    void shouldDetectWithCommittedContent() throws Exception {
        QuorumCore core = QuorumCore.fromSettings(settings, Clock.fixed(NOW, ZoneOffset.UTC));
        NormalizedLogRecord record = NormalizedLogRecord.builder()
                .id("evt-1")
                .timestamp(NOW)
                .host("gw-02")
                .sourceType("firewall")
                .rawMessage("DENY tcp 198.51.100.23:4444 -> 10.0.0.5:22")
                .build();

        Verdict before = core.detection().analyze(record);
        UpdateResult result = core.updates().submit(signedPackage());
        Verdict after = core.detection().analyze(record);

        assertThat(before.getSeverity()).isEqualTo(Severity.NONE);
        assertThat(before.getWarnings()).hasSize(4);
        assertThat(result.getFinalState()).isEqualTo(UpdateState.COMMITTED);
        assertThat(after.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(after.getStoreVersions()).containsEntry("indicator", "ioc-7");
        assertThat(after.getComputedAt()).isEqualTo(NOW);
        assertThat(core.stores().snapshot().isPresent(StoreKind.INDICATOR)).isTrue();
    }

    @Test
    @DisplayName("Should append audit entries to the configured JSON-lines file")
    void shouldWriteAuditLog() throws Exception {
        QuorumCore core = QuorumCore.fromSettings(settings, Clock.fixed(NOW, ZoneOffset.UTC));

        core.updates().submit(signedPackage(), "carol");

        assertThat(new JsonLinesAuditSink(Path.of(settings.getAuditLogPath())).readAll())
                .extracting(AuditEntry::getOutcome)
                .containsExactly("RECEIVED", "VERIFIED", "STAGED", "COMMITTED");
    }

    @Test
    @DisplayName("Should require a configured public key")
    void shouldRequirePublicKey() {
        settings.setPublicKeyPath(null);

        assertThatThrownBy(() -> QuorumCore.fromSettings(settings, Clock.systemUTC()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("publicKeyPath");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private byte[] signedPackage() throws Exception {
        byte[] payload = INDICATORS.getBytes(StandardCharsets.UTF_8);
        PackageManifest manifest = new PackageManifest();
        manifest.setFormatVersion(PackageManifest.FORMAT_VERSION);
        manifest.setPackageVersion("2024.06.03-1");
        manifest.setCreatedAt(NOW);
        manifest.setStores(Map.of("indicator", new ManifestEntry("ioc-7", Checksums.sha512Hex(payload))));

        byte[] manifestBytes = PackageCodec.writeManifest(manifest);
        byte[] signature = SignatureScheme.sign(manifestBytes, keys.getPrivate());
        return PackageCodec.write(new UpdatePackage(manifestBytes, Map.of(StoreKind.INDICATOR, payload), signature));
    }
}
