package com.quorum.core.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Serialized form of one expression tree node, as written in rule and
 * pattern payloads.
 *
 * <pre>
 * {"op": "all", "children": [
 *   {"op": "equals", "field": "event_id", "value": "4625"},
 *   {"op": "not", "children": [{"op": "contains", "field": "user", "value": "svc_"}]},
 *   {"op": "gte", "field": "failed_count", "value": "5"}
 * ]}
 * </pre>
 *
 * @since 1.0.0
 */
public class ConditionDefinition {

    private String op;
    private String field;
    private String value;
    private boolean ignoreCase;
    private List<ConditionDefinition> children = new ArrayList<>();

    public ConditionDefinition() {
    }

    /**
     * Leaf node shorthand.
     */
    public static ConditionDefinition leaf(String op, String field, String value) {
        ConditionDefinition def = new ConditionDefinition();
        def.setOp(op);
        def.setField(field);
        def.setValue(value);
        return def;
    }

    /**
     * Logical node shorthand.
     */
    public static ConditionDefinition node(String op, ConditionDefinition... children) {
        ConditionDefinition def = new ConditionDefinition();
        def.setOp(op);
        def.setChildren(List.of(children));
        return def;
    }

    public String getOp() {
        return op;
    }

    public void setOp(String op) {
        this.op = op;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public boolean isIgnoreCase() {
        return ignoreCase;
    }

    public void setIgnoreCase(boolean ignoreCase) {
        this.ignoreCase = ignoreCase;
    }

    public List<ConditionDefinition> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void setChildren(List<ConditionDefinition> children) {
        this.children = children != null ? new ArrayList<>(children) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "ConditionDefinition{op='" + op + "', field='" + field + "', value='" + value
                + "', children=" + children.size() + '}';
    }
}
