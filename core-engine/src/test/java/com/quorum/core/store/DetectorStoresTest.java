package com.quorum.core.store;

import com.quorum.core.intel.Indicator;
import com.quorum.core.intel.IndicatorSet;
import com.quorum.core.intel.IndicatorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorStores}.
 */
class DetectorStoresTest {

    private DetectorStores stores;

    @BeforeEach
    void setUp() {
        stores = new DetectorStores(2);
    }

    @Test
    @DisplayName("Should start with every store empty")
    void shouldStartEmpty() {
        StoreSnapshot snapshot = stores.snapshot();

        for (StoreKind kind : StoreKind.values()) {
            assertThat(snapshot.isPresent(kind)).isFalse();
            assertThat(stores.retained(kind)).isEmpty();
        }
        assertThat(snapshot.versionLabels()).containsOnlyKeys("indicator", "rule", "pattern", "anomaly-model");
    }

    @Test
    @DisplayName("Should activate all kinds of a commit together and retain what they replaced")
    void shouldCommitAndRetain() {
        StoreSnapshot before = stores.snapshot();
        stores.commit(Map.of(StoreKind.RULE, version(StoreKind.RULE, "r1"),
                StoreKind.PATTERN, version(StoreKind.PATTERN, "p1")));
        stores.commit(Map.of(StoreKind.RULE, version(StoreKind.RULE, "r2")));

        StoreSnapshot after = stores.snapshot();
        assertThat(after.get(StoreKind.RULE).getVersion()).isEqualTo("r2");
        assertThat(after.get(StoreKind.PATTERN).getVersion()).isEqualTo("p1");
        assertThat(stores.retained(StoreKind.RULE)).extracting(StoreVersion::getVersion).containsExactly("r1");
        assertThat(stores.retained(StoreKind.PATTERN)).isEmpty();
        assertThat(before.isPresent(StoreKind.RULE)).isFalse();
    }

    @Test
    @DisplayName("Should drop the oldest retained version beyond the limit")
    void shouldTrimToRetentionLimit() {
        for (int i = 1; i <= 4; i++) {
            stores.commit(Map.of(StoreKind.INDICATOR, version(StoreKind.INDICATOR, "v" + i)));
        }

        assertThat(stores.retained(StoreKind.INDICATOR)).extracting(StoreVersion::getVersion)
                .containsExactly("v3", "v2");
    }

    @Test
    @DisplayName("Should restore a named version and discard newer history")
    void shouldRestoreNamedVersion() {
        DetectorStores deep = new DetectorStores(3);
        for (int i = 1; i <= 4; i++) {
            deep.commit(Map.of(StoreKind.RULE, version(StoreKind.RULE, "v" + i)));
        }

        StoreVersion<?> target = deep.rollbackTarget(StoreKind.RULE, "v2").orElseThrow();
        deep.restore(Map.of(StoreKind.RULE, target));

        assertThat(deep.snapshot().get(StoreKind.RULE).getVersion()).isEqualTo("v2");
        assertThat(deep.retained(StoreKind.RULE)).extracting(StoreVersion::getVersion).containsExactly("v1");
        assertThat(deep.isRolledBack(StoreKind.RULE)).isTrue();
    }

    @Test
    @DisplayName("Should pick the immediately prior version when no target is named")
    void shouldPickPriorVersion() {
        stores.commit(Map.of(StoreKind.RULE, version(StoreKind.RULE, "v1")));
        stores.commit(Map.of(StoreKind.RULE, version(StoreKind.RULE, "v2")));

        assertThat(stores.rollbackTarget(StoreKind.RULE, null).map(StoreVersion::getVersion)).contains("v1");
        assertThat(stores.rollbackTarget(StoreKind.RULE, "v9")).isEmpty();
        assertThat(stores.rollbackTarget(StoreKind.PATTERN, null)).isEmpty();
    }

    @Test
    @DisplayName("Should clear the rolled-back flag on the next commit")
    void shouldClearRolledBackOnCommit() {
        stores.commit(Map.of(StoreKind.RULE, version(StoreKind.RULE, "v1")));
        stores.commit(Map.of(StoreKind.RULE, version(StoreKind.RULE, "v2")));
        stores.restore(Map.of(StoreKind.RULE, stores.rollbackTarget(StoreKind.RULE, null).orElseThrow()));
        assertThat(stores.isRolledBack(StoreKind.RULE)).isTrue();

        stores.commit(Map.of(StoreKind.RULE, version(StoreKind.RULE, "v3")));

        assertThat(stores.isRolledBack(StoreKind.RULE)).isFalse();
        assertThat(stores.retained(StoreKind.RULE)).extracting(StoreVersion::getVersion).containsExactly("v1");
    }

    @Test
    @DisplayName("Should refuse to restore a version that is not retained")
    void shouldRejectUnretainedRestore() {
        stores.commit(Map.of(StoreKind.RULE, version(StoreKind.RULE, "v1")));

        assertThatThrownBy(() -> stores.restore(Map.of(StoreKind.RULE, version(StoreKind.RULE, "v0"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not retained");
        assertThat(stores.snapshot().get(StoreKind.RULE).getVersion()).isEqualTo("v1");
    }

    @Test
    @DisplayName("Should reject a version filed under the wrong kind")
    void shouldRejectMismatchedKind() {
        Map<StoreKind, StoreVersion<?>> wrong = new EnumMap<>(StoreKind.class);
        wrong.put(StoreKind.RULE, version(StoreKind.PATTERN, "p1"));

        assertThatThrownBy(() -> stores.commit(wrong)).isInstanceOf(IllegalArgumentException.class);
        assertThat(stores.snapshot().isPresent(StoreKind.RULE)).isFalse();
    }

    @Test
    @DisplayName("Should expose active contents by type and refuse a mistyped store")
    void shouldExposeTypedContents() {
        IndicatorSet indicators = IndicatorSet.of(List.of(new Indicator(IndicatorType.IP, "192.0.2.1", "feed", null)));
        stores.commit(Map.of(
                StoreKind.INDICATOR, new StoreVersion<>(StoreKind.INDICATOR, "ioc-1", indicators,
                        Instant.parse("2024-06-01T00:00:00Z"), "sum-ioc-1", "pkg-1"),
                StoreKind.RULE, version(StoreKind.RULE, "r1")));

        StoreSnapshot snapshot = stores.snapshot();

        assertThat(snapshot.indicators()).isSameAs(indicators);
        assertThat(snapshot.patterns()).isNull();
        assertThatThrownBy(snapshot::rules)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("expected RuleSet");
    }

    @Test
    @DisplayName("Should reject an empty commit and a zero retention limit")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> stores.commit(Map.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DetectorStores(0)).isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static StoreVersion<String> version(StoreKind kind, String version) {
        return new StoreVersion<>(kind, version, "content-" + version,
                Instant.parse("2024-06-01T00:00:00Z"), "sum-" + version, "pkg-" + version);
    }
}
