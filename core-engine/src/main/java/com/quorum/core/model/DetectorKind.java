package com.quorum.core.model;

import java.util.Locale;

/**
 * The four detection techniques whose findings are fused into a verdict.
 *
 * <p>
 * Declaration order is the presentation priority used to break score ties
 * when ordering the findings of a verdict: {@code ioc > ttp > rule > anomaly}.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectorKind {

    IOC("ioc"),
    TTP("ttp"),
    RULE("rule"),
    ANOMALY("anomaly");

    private final String wireName;

    DetectorKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return lowercase name used in evidence, logs and serialized verdicts
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a kind from its wire name (case-insensitive).
     *
     * @param name wire name such as {@code "ioc"}
     * @return the matching kind
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DetectorKind fromWireName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (DetectorKind kind : values()) {
                if (kind.wireName.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown detector kind: '" + name
                + "'. Supported: ioc, ttp, rule, anomaly");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
