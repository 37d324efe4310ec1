package com.quorum.core.intel;

import java.util.Objects;

/**
 * A candidate indicator value extracted from a record.
 *
 * @since 1.0.0
 */
public final class Atom {

    private final IndicatorType type;
    private final String value;
    private final String field;

    /**
     * @param type  atom type
     * @param value canonical value
     * @param field record field the atom was extracted from
     */
    public Atom(IndicatorType type, String value, String field) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.field = Objects.requireNonNull(field, "field must not be null");
    }

    public IndicatorType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public String getField() {
        return field;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Atom that))
            return false;
        return type == that.type && value.equals(that.value) && field.equals(that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, field);
    }

    @Override
    public String toString() {
        return type + ":" + value + "@" + field;
    }
}
