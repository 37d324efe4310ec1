package com.quorum.core.intel;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Kinds of compromise indicator held by the indicator store.
 *
 * <p>
 * Each type knows how to validate and canonicalize a value so that stored
 * indicators and atoms extracted from records compare with plain string
 * equality.
 * </p>
 *
 * @since 1.0.0
 */
public enum IndicatorType {

    IP("ip", "Malicious IP Detected"),
    DOMAIN("domain", "Malicious Domain Detected"),
    HASH("hash", "Malicious Hash Detected"),
    PROCESS("process", "Malicious Process Detected");

    private static final Pattern HASH_VALUE = Pattern.compile(
            "[0-9a-f]{32}|[0-9a-f]{40}|[0-9a-f]{64}");
    private static final Pattern DOMAIN_VALUE = Pattern.compile(
            "(?:[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,63}");

    private final String wireName;
    private final String findingName;

    IndicatorType(String wireName, String findingName) {
        this.wireName = wireName;
        this.findingName = findingName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return finding name reported when an indicator of this type is hit
     */
    public String findingName() {
        return findingName;
    }

    /**
     * Canonicalize a value of this type.
     *
     * @param raw raw value
     * @return canonical form used for lookup
     * @throws IllegalArgumentException if the value is not a well-formed
     *                                  indicator of this type
     */
    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException(wireName + " indicator value must not be blank");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        switch (this) {
            case IP -> {
                if (!AtomExtractor.isIpv4(value) && !AtomExtractor.isIpv6(value)) {
                    throw new IllegalArgumentException("Not an IP address: '" + raw + "'");
                }
            }
            case DOMAIN -> {
                if (value.endsWith(".")) {
                    value = value.substring(0, value.length() - 1);
                }
                if (!DOMAIN_VALUE.matcher(value).matches()) {
                    throw new IllegalArgumentException("Not a domain name: '" + raw + "'");
                }
            }
            case HASH -> {
                if (!HASH_VALUE.matcher(value).matches()) {
                    throw new IllegalArgumentException(
                            "Not an MD5/SHA-1/SHA-256 hex digest: '" + raw + "'");
                }
            }
            case PROCESS -> value = AtomExtractor.processBaseName(value);
        }
        return value;
    }

    /**
     * Resolve a type from its payload name (case-insensitive).
     *
     * @param name payload name such as {@code "ip"}
     * @return the matching type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static IndicatorType fromWireName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (IndicatorType type : values()) {
                if (type.wireName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown indicator type: '" + name
                + "'. Supported: ip, domain, hash, process");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
