package com.quorum.core.rules;

import java.util.Locale;

/**
 * Node types of the rule and pattern expression tree.
 *
 * @since 1.0.0
 */
public enum Operator {

    ALL("all"),
    ANY("any"),
    NOT("not"),
    EQUALS("equals"),
    CONTAINS("contains"),
    REGEX("regex"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte");

    private final String wireName;

    Operator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isLogical() {
        return this == ALL || this == ANY || this == NOT;
    }

    public boolean isNumeric() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }

    /**
     * @param name payload name such as {@code "contains"}
     * @return the matching operator
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Operator fromWireName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (Operator op : values()) {
                if (op.wireName.equals(normalized)) {
                    return op;
                }
            }
        }
        throw new IllegalArgumentException("Unknown operator: '" + name
                + "'. Supported: all, any, not, equals, contains, regex, gt, gte, lt, lte");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
