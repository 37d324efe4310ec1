package com.quorum.core.rules;

import com.quorum.core.model.NormalizedLogRecord;

import java.util.List;
import java.util.Objects;

/**
 * Conjunction ({@code all}) or disjunction ({@code any}) of child conditions.
 * Evaluation short-circuits left to right.
 *
 * @since 1.0.0
 */
public final class CompositeCondition implements Condition {

    private final Operator operator;
    private final List<Condition> children;

    CompositeCondition(Operator operator, List<Condition> children) {
        if (operator != Operator.ALL && operator != Operator.ANY) {
            throw new IllegalArgumentException("Composite operator must be all or any, got: " + operator);
        }
        this.operator = operator;
        this.children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
    }

    @Override
    public boolean matches(NormalizedLogRecord record) {
        if (operator == Operator.ALL) {
            for (Condition child : children) {
                if (!child.matches(record)) {
                    return false;
                }
            }
            return true;
        }
        for (Condition child : children) {
            if (child.matches(record)) {
                return true;
            }
        }
        return false;
    }

    public Operator getOperator() {
        return operator;
    }

    public List<Condition> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return operator + children.toString();
    }
}
