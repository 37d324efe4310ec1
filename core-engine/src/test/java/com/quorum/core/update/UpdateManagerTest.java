package com.quorum.core.update;

import com.quorum.core.audit.AuditEntry;
import com.quorum.core.audit.AuditSink;
import com.quorum.core.audit.InMemoryAuditSink;
import com.quorum.core.store.DetectorStores;
import com.quorum.core.store.StoreKind;
import com.quorum.core.store.StoreSnapshot;
import com.quorum.core.store.StoreVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.quorum.core.update.TestPackages.INDICATOR_JSON;
import static com.quorum.core.update.TestPackages.MODEL_JSON;
import static com.quorum.core.update.TestPackages.PATTERN_JSON;
import static com.quorum.core.update.TestPackages.RULE_JSON;
import static com.quorum.core.update.TestPackages.pkg;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link UpdateManager}.
 */
class UpdateManagerTest {

    private static final Instant NOW = Instant.parse("2024-06-02T08:00:00Z");
    private static final long MAX_BYTES = 1024 * 1024;

    private DetectorStores stores;
    private InMemoryAuditSink audit;
    private UpdateManager manager;

    @BeforeEach
    void setUp() {
        stores = new DetectorStores(3);
        audit = new InMemoryAuditSink();
        manager = newManager(audit, MAX_BYTES, 50);
    }

    // ---------------------------------------------------------------
    // Submission
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should commit a signed package touching every store kind")
    void shouldCommitFullPackage() {
        UpdateResult result = manager.submit(pkg("2024.06.1")
                .payload(StoreKind.INDICATOR, "ioc-1", INDICATOR_JSON)
                .payload(StoreKind.RULE, "rules-1", RULE_JSON)
                .payload(StoreKind.PATTERN, "ttp-1", PATTERN_JSON)
                .payload(StoreKind.ANOMALY_MODEL, "model-1", MODEL_JSON)
                .build(), "alice");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFinalState()).isEqualTo(UpdateState.COMMITTED);
        assertThat(result.getReason()).isNull();
        assertThat(result.getPackageVersion()).isEqualTo("2024.06.1");
        assertThat(result.getStoreKinds()).containsExactly(StoreKind.values());

        StoreSnapshot snapshot = stores.snapshot();
        assertThat(snapshot.versionLabels()).containsEntry("indicator", "ioc-1")
                .containsEntry("rule", "rules-1")
                .containsEntry("pattern", "ttp-1")
                .containsEntry("anomaly-model", "model-1");
        assertThat(snapshot.indicators().size()).isEqualTo(2);
        assertThat(snapshot.get(StoreKind.INDICATOR).getInstalledAt()).isEqualTo(NOW);
        assertThat(snapshot.get(StoreKind.INDICATOR).getPackageVersion()).isEqualTo("2024.06.1");
    }

    @Test
    @DisplayName("Should audit every state of a successful attempt")
    void shouldAuditEveryState() {
        UpdateResult result = manager.submit(pkg("p1").payload(StoreKind.RULE, "rules-1", RULE_JSON).build(), "alice");

        List<AuditEntry> entries = audit.entriesFor(result.getAttemptId());
        assertThat(entries).extracting(AuditEntry::getOutcome)
                .containsExactly("RECEIVED", "VERIFIED", "STAGED", "COMMITTED");
        assertThat(entries).allSatisfy(entry -> {
            assertThat(entry.getActor()).isEqualTo("alice");
            assertThat(entry.getAction()).isEqualTo(AuditEntry.ACTION_SUBMIT);
            assertThat(entry.getPackageVersion()).isEqualTo("p1");
            assertThat(entry.getStoreKinds()).containsExactly("rule");
            assertThat(entry.getTimestamp()).isEqualTo(NOW);
        });
    }

    @Test
    @DisplayName("Should reject a modified payload with checksum_mismatch and leave stores unchanged")
    void shouldRejectChecksumMismatch() {
        manager.submit(pkg("p1").payload(StoreKind.INDICATOR, "ioc-1", INDICATOR_JSON).build());
        StoreSnapshot before = stores.snapshot();
        audit = new InMemoryAuditSink();
        manager = newManager(audit, MAX_BYTES, 50);

        TestPackages.Builder builder = pkg("p2").payload(StoreKind.INDICATOR, "ioc-2", INDICATOR_JSON);
        byte[] manifest = builder.manifestBytes();
        Map<StoreKind, byte[]> payloads = Map.of(StoreKind.INDICATOR,
                INDICATOR_JSON.replace("203.0.113.7", "203.0.113.8").getBytes(StandardCharsets.UTF_8));
        UpdateResult result = manager.submit(TestPackages.container(manifest, payloads,
                TestPackages.sign(manifest, TestPackages.KEYS)));

        assertThat(result.getFinalState()).isEqualTo(UpdateState.FAILED);
        assertThat(result.getReason()).isEqualTo(UpdateFailureReason.CHECKSUM_MISMATCH);
        assertThat(stores.snapshot().versionLabels()).isEqualTo(before.versionLabels());
        assertThat(stores.snapshot().get(StoreKind.INDICATOR)).isEqualTo(before.get(StoreKind.INDICATOR));
        assertThat(audit.entries()).filteredOn(e -> e.getOutcome().equals("FAILED")).singleElement()
                .satisfies(e -> assertThat(e.getDetail()).startsWith("checksum_mismatch: "));
        assertThat(audit.entries()).noneMatch(e -> e.getOutcome().equals("VERIFIED"));
    }

    @Test
    @DisplayName("Should detect a change to any single payload byte")
    void shouldDetectAnyPayloadByteChange() {
        TestPackages.Builder builder = pkg("p1").payload(StoreKind.RULE, "rules-1", RULE_JSON);
        byte[] manifest = builder.manifestBytes();
        byte[] signature = TestPackages.sign(manifest, TestPackages.KEYS);
        byte[] original = RULE_JSON.getBytes(StandardCharsets.UTF_8);

        for (int i = 0; i < original.length; i++) {
            byte[] tampered = original.clone();
            tampered[i] ^= 0x01;
            UpdateResult result = manager.submit(TestPackages.container(manifest,
                    Map.of(StoreKind.RULE, tampered), signature));

            assertThat(result.getReason()).as("byte %d", i).isEqualTo(UpdateFailureReason.CHECKSUM_MISMATCH);
        }
        assertThat(stores.snapshot().isPresent(StoreKind.RULE)).isFalse();
    }

    @Test
    @DisplayName("Should report a modified manifest as signature_invalid, whatever byte changed")
    void shouldDetectAnyManifestByteChange() {
        TestPackages.Builder builder = pkg("p1").payload(StoreKind.INDICATOR, "ioc-1", INDICATOR_JSON);
        byte[] manifest = builder.manifestBytes();
        byte[] signature = TestPackages.sign(manifest, TestPackages.KEYS);

        for (int i = 0; i < manifest.length; i++) {
            byte[] tampered = manifest.clone();
            tampered[i] ^= 0x01;
            UpdateResult result = manager.submit(TestPackages.container(tampered, builder.payloads(), signature));

            assertThat(result.getReason()).as("byte %d", i).isEqualTo(UpdateFailureReason.SIGNATURE_INVALID);
        }
        assertThat(stores.snapshot().isPresent(StoreKind.INDICATOR)).isFalse();
        assertThat(audit.entries()).noneMatch(e -> e.getOutcome().equals("VERIFIED"));
    }

    @Test
    @DisplayName("Should reject a package signed with another key")
    void shouldRejectForeignSignature() {
        UpdateResult result = manager.submit(pkg("p1")
                .payload(StoreKind.INDICATOR, "ioc-1", INDICATOR_JSON)
                .build(TestPackages.OTHER_KEYS));

        assertThat(result.getReason()).isEqualTo(UpdateFailureReason.SIGNATURE_INVALID);
        assertThat(audit.entriesFor(result.getAttemptId())).extracting(AuditEntry::getOutcome)
                .containsExactly("RECEIVED", "FAILED");
        assertThat(stores.snapshot().isPresent(StoreKind.INDICATOR)).isFalse();
    }

    @Test
    @DisplayName("Should reject an oversized package before decoding it")
    void shouldRejectOversizedPackage() {
        UpdateManager small = newManager(audit, 100, 50);

        UpdateResult result = small.submit(pkg("p1").payload(StoreKind.INDICATOR, "ioc-1", INDICATOR_JSON).build());

        assertThat(result.getReason()).isEqualTo(UpdateFailureReason.PAYLOAD_TOO_LARGE);
        assertThat(result.getStoreKinds()).isEmpty();
        assertThat(audit.entries()).singleElement()
                .satisfies(e -> assertThat(e.getOutcome()).isEqualTo("FAILED"));
    }

    @Test
    @DisplayName("Should bound the decompressed size of every entry")
    void shouldBoundInflatedEntries() {
        StringBuilder padded = new StringBuilder(INDICATOR_JSON);
        for (int i = 0; i < 50_000; i++) {
            padded.append(' ');
        }
        byte[] container = pkg("p1").payload(StoreKind.INDICATOR, "ioc-1", padded.toString()).build();
        UpdateManager bounded = newManager(audit, 20_000, 50);

        assertThat(container.length).isLessThan(20_000);
        assertThat(bounded.submit(container).getReason()).isEqualTo(UpdateFailureReason.PAYLOAD_TOO_LARGE);
    }

    @Test
    @DisplayName("Should reject bytes that are not a package container")
    void shouldRejectGarbage() {
        UpdateResult result = manager.submit("definitely not a zip".getBytes(StandardCharsets.UTF_8));

        assertThat(result.getReason()).isEqualTo(UpdateFailureReason.PAYLOAD_INVALID);
    }

    @Test
    @DisplayName("Should reject a signed package whose payload does not compile")
    void shouldRejectInvalidPayload() {
        String badRule = RULE_JSON.replace("\"op\": \"gte\"", "\"op\": \"regex\"")
                .replace("\"value\": \"5\"", "\"value\": \"(\"");

        UpdateResult result = manager.submit(pkg("p1")
                .payload(StoreKind.INDICATOR, "ioc-1", INDICATOR_JSON)
                .payload(StoreKind.RULE, "rules-1", badRule)
                .build());

        assertThat(result.getReason()).isEqualTo(UpdateFailureReason.PAYLOAD_INVALID);
        assertThat(result.getDetail()).contains("regex does not compile");
        assertThat(audit.entriesFor(result.getAttemptId())).extracting(AuditEntry::getOutcome)
                .containsExactly("RECEIVED", "VERIFIED", "FAILED");
        // nothing from the package is applied, not even the valid indicator payload
        assertThat(stores.snapshot().isPresent(StoreKind.INDICATOR)).isFalse();
    }

    @Test
    @DisplayName("Should reject an anomaly model built for another featurizer")
    void shouldRejectFeaturizerMismatch() {
        String model = MODEL_JSON.replace("quorum-features/1", "quorum-features/9");

        UpdateResult result = manager.submit(pkg("p1").payload(StoreKind.ANOMALY_MODEL, "model-1", model).build());

        assertThat(result.getReason()).isEqualTo(UpdateFailureReason.PAYLOAD_INVALID);
        assertThat(result.getDetail()).contains("featurizer version 'quorum-features/9'");
    }

    @Test
    @DisplayName("Should reject a payload with unknown properties")
    void shouldRejectUnknownPayloadProperty() {
        String indicators = INDICATOR_JSON.replace("\"source\"", "\"origin\"");

        UpdateResult result = manager.submit(pkg("p1").payload(StoreKind.INDICATOR, "ioc-1", indicators).build());

        assertThat(result.getReason()).isEqualTo(UpdateFailureReason.PAYLOAD_INVALID);
    }

    @Test
    @DisplayName("Should reject a container missing a listed payload")
    void shouldRejectMissingPayload() {
        TestPackages.Builder builder = pkg("p1")
                .payload(StoreKind.INDICATOR, "ioc-1", INDICATOR_JSON)
                .payload(StoreKind.RULE, "rules-1", RULE_JSON);
        byte[] manifest = builder.manifestBytes();
        Map<StoreKind, byte[]> onlyIndicator = new EnumMap<>(StoreKind.class);
        onlyIndicator.put(StoreKind.INDICATOR, builder.payloads().get(StoreKind.INDICATOR));

        UpdateResult result = manager.submit(TestPackages.container(manifest, onlyIndicator,
                TestPackages.sign(manifest, TestPackages.KEYS)));

        assertThat(result.getReason()).isEqualTo(UpdateFailureReason.PAYLOAD_INVALID);
        assertThat(result.getDetail()).contains("missing [rule]");
    }

    @Test
    @DisplayName("Should keep committing when the audit sink fails")
    void shouldSurviveAuditSinkFailure() {
        UpdateManager withBrokenSink = newManager(entry -> {
            throw new IllegalStateException("disk full");
        }, MAX_BYTES, 50);

        UpdateResult result = withBrokenSink.submit(pkg("p1").payload(StoreKind.RULE, "rules-1", RULE_JSON).build());

        assertThat(result.getFinalState()).isEqualTo(UpdateState.COMMITTED);
    }

    // ---------------------------------------------------------------
    // Concurrency
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should reject an overlapping attempt and allow a disjoint one")
    void shouldRejectOverlappingAttempts() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AuditSink blocking = entry -> {
            audit.append(entry);
            if ("slow".equals(entry.getPackageVersion()) && "RECEIVED".equals(entry.getOutcome())) {
                entered.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        UpdateManager shared = newManager(blocking, MAX_BYTES, 50);

        CompletableFuture<UpdateResult> slow = CompletableFuture.supplyAsync(() ->
                shared.submit(pkg("slow").payload(StoreKind.INDICATOR, "ioc-1", INDICATOR_JSON).build()));
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

        UpdateResult overlapping = shared.submit(pkg("overlap")
                .payload(StoreKind.INDICATOR, "ioc-2", INDICATOR_JSON)
                .payload(StoreKind.PATTERN, "ttp-2", PATTERN_JSON)
                .build());
        UpdateResult rollback = shared.rollback(StoreKind.INDICATOR);
        UpdateResult disjoint = shared.submit(pkg("disjoint").payload(StoreKind.RULE, "rules-1", RULE_JSON).build());
        release.countDown();

        assertThat(overlapping.getReason()).isEqualTo(UpdateFailureReason.CONCURRENT_UPDATE_REJECTED);
        assertThat(rollback.getReason()).isEqualTo(UpdateFailureReason.CONCURRENT_UPDATE_REJECTED);
        assertThat(disjoint.getFinalState()).isEqualTo(UpdateState.COMMITTED);
        assertThat(slow.get(10, TimeUnit.SECONDS).getFinalState()).isEqualTo(UpdateState.COMMITTED);
        // the rejected attempt held nothing, so pattern is still free
        assertThat(stores.snapshot().isPresent(StoreKind.PATTERN)).isFalse();
        assertThat(shared.submit(pkg("after").payload(StoreKind.PATTERN, "ttp-1", PATTERN_JSON).build())
                .getFinalState()).isEqualTo(UpdateState.COMMITTED);
    }

    // ---------------------------------------------------------------
    // Rollback
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should restore the exact prior version on rollback")
    void shouldRestorePriorVersion() {
        manager.submit(pkg("p1").payload(StoreKind.INDICATOR, "ioc-1", INDICATOR_JSON).build());
        StoreVersion<?> first = stores.snapshot().get(StoreKind.INDICATOR);
        manager.submit(pkg("p2").payload(StoreKind.INDICATOR, "ioc-2", "{\"indicators\": []}").build());

        UpdateResult result = manager.rollback(StoreKind.INDICATOR);

        assertThat(result.getFinalState()).isEqualTo(UpdateState.ROLLED_BACK);
        assertThat(result.getAction()).isEqualTo(AuditEntry.ACTION_ROLLBACK);
        assertThat(result.getPackageVersion()).isEqualTo("p1");
        StoreVersion<?> restored = stores.snapshot().get(StoreKind.INDICATOR);
        assertThat(restored).isEqualTo(first);
        assertThat(restored.getChecksum())
                .isEqualTo(Checksums.sha512Hex(INDICATOR_JSON.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Should treat a second rollback as a no-op")
    void shouldMakeSecondRollbackNoOp() {
        manager.submit(pkg("p1").payload(StoreKind.RULE, "rules-1", RULE_JSON).build());
        manager.submit(pkg("p2").payload(StoreKind.RULE, "rules-2", RULE_JSON).build());
        manager.submit(pkg("p3").payload(StoreKind.RULE, "rules-3", RULE_JSON).build());
        manager.rollback(StoreKind.RULE);

        UpdateResult again = manager.rollback(StoreKind.RULE);

        assertThat(again.getFinalState()).isEqualTo(UpdateState.ROLLED_BACK);
        assertThat(again.getDetail()).isEqualTo("rule already rolled back, no change");
        assertThat(stores.snapshot().get(StoreKind.RULE).getVersion()).isEqualTo("rules-2");
        assertThat(audit.entriesFor(again.getAttemptId())).hasSize(1);
    }

    @Test
    @DisplayName("Should roll back to a named retained version")
    void shouldRollBackToNamedVersion() {
        for (int i = 1; i <= 3; i++) {
            manager.submit(pkg("p" + i).payload(StoreKind.PATTERN, "ttp-" + i, PATTERN_JSON).build());
        }

        UpdateResult result = manager.rollback(StoreKind.PATTERN, "ttp-1", "bob");

        assertThat(result.getFinalState()).isEqualTo(UpdateState.ROLLED_BACK);
        assertThat(stores.snapshot().get(StoreKind.PATTERN).getVersion()).isEqualTo("ttp-1");
        assertThat(audit.entriesFor(result.getAttemptId())).singleElement()
                .satisfies(e -> assertThat(e.getActor()).isEqualTo("bob"));
    }

    @Test
    @DisplayName("Should restore a named version even after a previous rollback")
    void shouldRestoreNamedVersionAfterRollback() {
        for (int i = 1; i <= 3; i++) {
            manager.submit(pkg("p" + i).payload(StoreKind.RULE, "rules-" + i, RULE_JSON).build());
        }
        manager.rollback(StoreKind.RULE);
        assertThat(stores.snapshot().get(StoreKind.RULE).getVersion()).isEqualTo("rules-2");

        UpdateResult named = manager.rollback(StoreKind.RULE, "rules-1");

        assertThat(named.getFinalState()).isEqualTo(UpdateState.ROLLED_BACK);
        assertThat(named.getDetail()).isNull();
        assertThat(named.getPackageVersion()).isEqualTo("p1");
        assertThat(stores.snapshot().get(StoreKind.RULE).getVersion()).isEqualTo("rules-1");
        assertThat(manager.status().getRetainedVersions().get(StoreKind.RULE)).isEmpty();

        UpdateResult gone = manager.rollback(StoreKind.RULE, "rules-1");

        assertThat(gone.getReason()).isEqualTo(UpdateFailureReason.ROLLBACK_TARGET_UNAVAILABLE);
        assertThat(stores.snapshot().get(StoreKind.RULE).getVersion()).isEqualTo("rules-1");
    }

    @Test
    @DisplayName("Should fail a rollback when no version is retained")
    void shouldFailRollbackWithoutTarget() {
        manager.submit(pkg("p1").payload(StoreKind.RULE, "rules-1", RULE_JSON).build());

        UpdateResult none = manager.rollback(StoreKind.RULE);
        UpdateResult unknown = manager.rollback(StoreKind.RULE, "rules-0");

        assertThat(none.getReason()).isEqualTo(UpdateFailureReason.ROLLBACK_TARGET_UNAVAILABLE);
        assertThat(unknown.getReason()).isEqualTo(UpdateFailureReason.ROLLBACK_TARGET_UNAVAILABLE);
        assertThat(unknown.getDetail()).contains("rules-0");
        assertThat(stores.snapshot().get(StoreKind.RULE).getVersion()).isEqualTo("rules-1");
    }

    @Test
    @DisplayName("Should roll back every updated kind together and skip untouched kinds")
    void shouldRollBackAll() {
        manager.submit(pkg("p1")
                .payload(StoreKind.INDICATOR, "ioc-1", INDICATOR_JSON)
                .payload(StoreKind.RULE, "rules-1", RULE_JSON)
                .build());
        manager.submit(pkg("p2")
                .payload(StoreKind.INDICATOR, "ioc-2", INDICATOR_JSON)
                .payload(StoreKind.RULE, "rules-2", RULE_JSON)
                .payload(StoreKind.PATTERN, "ttp-1", PATTERN_JSON)
                .build());

        UpdateResult result = manager.rollbackAll();

        assertThat(result.getFinalState()).isEqualTo(UpdateState.ROLLED_BACK);
        assertThat(result.getStoreKinds()).containsExactly(StoreKind.INDICATOR, StoreKind.RULE);
        assertThat(stores.snapshot().versionLabels())
                .containsEntry("indicator", "ioc-1")
                .containsEntry("rule", "rules-1")
                .containsEntry("pattern", "ttp-1")
                .containsEntry("anomaly-model", null);

        UpdateResult again = manager.rollbackAll();
        assertThat(again.getFinalState()).isEqualTo(UpdateState.ROLLED_BACK);
        assertThat(again.getDetail()).contains("already rolled back, no change");
        assertThat(stores.snapshot().get(StoreKind.INDICATOR).getVersion()).isEqualTo("ioc-1");
    }

    @Test
    @DisplayName("Should fail rollbackAll when nothing was ever updated twice")
    void shouldFailRollbackAllWithoutHistory() {
        assertThat(manager.rollbackAll().getReason()).isEqualTo(UpdateFailureReason.ROLLBACK_TARGET_UNAVAILABLE);
    }

    // ---------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should report active versions, retained versions and bounded history")
    void shouldReportStatus() {
        UpdateManager bounded = newManager(audit, MAX_BYTES, 2);
        bounded.submit(pkg("p1").payload(StoreKind.RULE, "rules-1", RULE_JSON).build());
        bounded.submit(pkg("p2").payload(StoreKind.RULE, "rules-2", RULE_JSON).build());
        UpdateResult last = bounded.submit(new byte[0]);

        UpdateStatus status = bounded.status();

        assertThat(status.getActiveVersions()).containsOnly(Map.entry(StoreKind.RULE, "rules-2"));
        assertThat(status.getRetainedVersions().get(StoreKind.RULE)).containsExactly("rules-1");
        assertThat(status.getRetainedVersions().get(StoreKind.PATTERN)).isEmpty();
        assertThat(status.getHistory()).hasSize(2);
        assertThat(status.getHistory().get(1)).isSameAs(last);
        assertThat(status.getHistory().get(0).getPackageVersion()).isEqualTo("p2");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private UpdateManager newManager(AuditSink sink, long maxBytes, int historySize) {
        return new UpdateManager(stores, TestPackages.KEYS.getPublic(), sink, maxBytes, historySize,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
