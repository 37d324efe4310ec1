package com.quorum.core.model;

/**
 * Verdict severity, ordered {@code NONE < LOW < MEDIUM < HIGH < CRITICAL}.
 *
 * @since 1.0.0
 */
public enum Severity {

    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * @param other severity to compare with
     * @return {@code true} if this severity ranks at or above {@code other}
     */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
