package com.quorum.core.intel;

import java.util.Objects;

/**
 * A single compromise indicator in canonical form.
 *
 * @since 1.0.0
 */
public final class Indicator {

    private final IndicatorType type;
    private final String value;
    private final String source;
    private final String description;

    /**
     * @param type        indicator type
     * @param value       raw value, canonicalized via
     *                    {@link IndicatorType#normalize(String)}
     * @param source      originating feed, may be {@code null}
     * @param description free text, may be {@code null}
     * @throws IllegalArgumentException if the value is malformed for its type
     */
    public Indicator(IndicatorType type, String value, String source, String description) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.value = type.normalize(value);
        this.source = source;
        this.description = description;
    }

    public IndicatorType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public String getSource() {
        return source;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Indicator that))
            return false;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type + ":" + value;
    }
}
