package com.quorum.core.rules;

import com.quorum.core.model.NormalizedLogRecord;

import java.util.Objects;

/**
 * Negation of a single child condition.
 *
 * @since 1.0.0
 */
public final class NotCondition implements Condition {

    private final Condition child;

    NotCondition(Condition child) {
        this.child = Objects.requireNonNull(child, "child must not be null");
    }

    @Override
    public boolean matches(NormalizedLogRecord record) {
        return !child.matches(record);
    }

    public Condition getChild() {
        return child;
    }

    @Override
    public String toString() {
        return "not[" + child + ']';
    }
}
