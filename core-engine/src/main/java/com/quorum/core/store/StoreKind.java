package com.quorum.core.store;

import java.util.Locale;

/**
 * Independently versioned knowledge bases consumed by detection.
 *
 * @since 1.0.0
 */
public enum StoreKind {

    INDICATOR("indicator"),
    RULE("rule"),
    PATTERN("pattern"),
    ANOMALY_MODEL("anomaly-model");

    private final String wireName;

    StoreKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return the name used in package manifests and payload entry names
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a store kind from its manifest name (case-insensitive).
     *
     * @param name manifest name such as {@code "anomaly-model"}
     * @return the matching kind
     * @throws IllegalArgumentException if the name is unknown
     */
    public static StoreKind fromWireName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (StoreKind kind : values()) {
                if (kind.wireName.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown store kind: '" + name
                + "'. Supported: indicator, rule, pattern, anomaly-model");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
