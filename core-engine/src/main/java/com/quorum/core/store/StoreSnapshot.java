package com.quorum.core.store;

import com.quorum.core.anomaly.AnomalyModel;
import com.quorum.core.intel.IndicatorSet;
import com.quorum.core.rules.PatternSet;
import com.quorum.core.rules.RuleSet;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of the active version of every store kind.
 *
 * <p>
 * A detection call captures one snapshot before evaluating a record and uses
 * it for the whole evaluation. Commits never modify a snapshot; they publish a
 * new one, so a reader sees either every store from before a commit or every
 * store from after it.
 * </p>
 *
 * @since 1.0.0
 */
public final class StoreSnapshot {

    private static final StoreSnapshot EMPTY = new StoreSnapshot(new EnumMap<>(StoreKind.class));

    private final Map<StoreKind, StoreVersion<?>> versions;

    private StoreSnapshot(EnumMap<StoreKind, StoreVersion<?>> versions) {
        this.versions = Collections.unmodifiableMap(versions);
    }

    /**
     * @return snapshot with every store uninitialized
     */
    public static StoreSnapshot empty() {
        return EMPTY;
    }

    /**
     * Return a copy of this snapshot with the given kinds replaced.
     *
     * @param replacements new versions keyed by kind; {@code null} values clear
     *                     the store
     * @return new snapshot
     * @throws IllegalArgumentException if a version is filed under the wrong kind
     */
    public StoreSnapshot with(Map<StoreKind, StoreVersion<?>> replacements) {
        Objects.requireNonNull(replacements, "replacements must not be null");
        EnumMap<StoreKind, StoreVersion<?>> next = new EnumMap<>(StoreKind.class);
        next.putAll(versions);
        replacements.forEach((kind, version) -> {
            if (version == null) {
                next.remove(kind);
                return;
            }
            if (version.getKind() != kind) {
                throw new IllegalArgumentException(
                        "Version " + version + " cannot be installed as store kind " + kind);
            }
            next.put(kind, version);
        });
        return new StoreSnapshot(next);
    }

    public boolean isPresent(StoreKind kind) {
        return versions.containsKey(kind);
    }

    /**
     * @param kind store kind
     * @return active version, or {@code null} if the store is empty
     */
    public StoreVersion<?> get(StoreKind kind) {
        return versions.get(kind);
    }

    /**
     * @return active indicator set, or {@code null} if the store is empty
     */
    public IndicatorSet indicators() {
        return content(StoreKind.INDICATOR, IndicatorSet.class);
    }

    public RuleSet rules() {
        return content(StoreKind.RULE, RuleSet.class);
    }

    public PatternSet patterns() {
        return content(StoreKind.PATTERN, PatternSet.class);
    }

    public AnomalyModel anomalyModel() {
        return content(StoreKind.ANOMALY_MODEL, AnomalyModel.class);
    }

    /**
     * Version label of every store kind, in kind order, {@code null} for empty
     * stores.
     *
     * @return ordered map of wire name to version
     */
    public Map<String, String> versionLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        for (StoreKind kind : StoreKind.values()) {
            StoreVersion<?> version = versions.get(kind);
            labels.put(kind.wireName(), version != null ? version.getVersion() : null);
        }
        return labels;
    }

    private <C> C content(StoreKind kind, Class<C> type) {
        StoreVersion<?> version = versions.get(kind);
        if (version == null) {
            return null;
        }
        if (!type.isInstance(version.getContent())) {
            throw new IllegalStateException("Store " + kind + " holds "
                    + version.getContent().getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return type.cast(version.getContent());
    }

    @Override
    public String toString() {
        return "StoreSnapshot" + versionLabels();
    }
}
