package com.quorum.core.rules;

import com.quorum.core.model.NormalizedLogRecord;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Leaf predicate over one record field.
 *
 * <p>
 * A field the record does not carry never matches, whatever the operator.
 * Numeric comparisons parse the field value as a {@code double}; a value that
 * does not parse never matches.
 * </p>
 *
 * @since 1.0.0
 */
public final class FieldCondition implements Condition {

    private final Operator operator;
    private final String field;
    private final String value;
    private final boolean ignoreCase;
    private final Pattern regex;
    private final double number;

    FieldCondition(Operator operator, String field, String value, boolean ignoreCase) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.field = Objects.requireNonNull(field, "field must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.ignoreCase = ignoreCase;
        if (operator.isLogical()) {
            throw new IllegalArgumentException("Field condition cannot use operator " + operator);
        }
        this.regex = operator == Operator.REGEX
                ? Pattern.compile(value, ignoreCase ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0)
                : null;
        this.number = operator.isNumeric() ? Double.parseDouble(value.trim()) : Double.NaN;
    }

    @Override
    public boolean matches(NormalizedLogRecord record) {
        Optional<String> resolved = record.resolveField(field);
        if (resolved.isEmpty()) {
            return false;
        }
        String actual = resolved.get();
        return switch (operator) {
            case EQUALS -> ignoreCase ? actual.equalsIgnoreCase(value) : actual.equals(value);
            case CONTAINS -> ignoreCase
                    ? actual.toLowerCase(Locale.ROOT).contains(value.toLowerCase(Locale.ROOT))
                    : actual.contains(value);
            case REGEX -> regex.matcher(actual).find();
            case GT, GTE, LT, LTE -> compareNumeric(actual);
            default -> false;
        };
    }

    private boolean compareNumeric(String actual) {
        double parsed;
        try {
            parsed = Double.parseDouble(actual.trim());
        } catch (NumberFormatException e) {
            return false;
        }
        return switch (operator) {
            case GT -> parsed > number;
            case GTE -> parsed >= number;
            case LT -> parsed < number;
            case LTE -> parsed <= number;
            default -> false;
        };
    }

    public Operator getOperator() {
        return operator;
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return field + ' ' + operator + " '" + value + '\'' + (ignoreCase ? " (i)" : "");
    }
}
