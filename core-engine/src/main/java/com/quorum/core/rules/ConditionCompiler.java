package com.quorum.core.rules;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles {@link ConditionDefinition} trees into {@link Condition} trees.
 *
 * <p>
 * Compilation is where a rule or pattern payload is proven well-formed:
 * operators are known, leaves name a field and a value, regular expressions
 * compile, numeric operands parse and logical nodes have the right number of
 * children. Errors carry the path of the offending node, for example
 * {@code condition.children[1].value}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConditionCompiler {

    /** Deepest nesting accepted from a payload. */
    public static final int MAX_DEPTH = 32;

    /** Every operator. */
    public static final Set<Operator> ALL_OPERATORS = EnumSet.allOf(Operator.class);

    /** Operators allowed in pattern predicates. */
    public static final Set<Operator> PATTERN_OPERATORS = EnumSet.of(
            Operator.EQUALS, Operator.CONTAINS, Operator.REGEX);

    private ConditionCompiler() {
        // utility class, not instantiable
    }

    /**
     * Compile a definition tree.
     *
     * @param definition root node
     * @param path       label of the root used in error messages
     * @param allowed    operators permitted anywhere in the tree
     * @return compiled tree
     * @throws IllegalStateException if any node is invalid
     */
    public static Condition compile(ConditionDefinition definition, String path, Set<Operator> allowed) {
        Objects.requireNonNull(allowed, "allowed must not be null");
        return compile(definition, path, allowed, 1);
    }

    private static Condition compile(ConditionDefinition def, String path, Set<Operator> allowed, int depth) {
        if (def == null) {
            throw invalid(path, "node is missing");
        }
        if (depth > MAX_DEPTH) {
            throw invalid(path, "nesting deeper than " + MAX_DEPTH);
        }
        Operator op;
        try {
            op = Operator.fromWireName(def.getOp());
        } catch (IllegalArgumentException e) {
            throw invalid(path + ".op", e.getMessage());
        }
        if (!allowed.contains(op)) {
            throw invalid(path + ".op", "operator '" + op + "' is not allowed here");
        }

        List<ConditionDefinition> childDefs = def.getChildren();
        return switch (op) {
            case ALL, ANY -> {
                if (childDefs.isEmpty()) {
                    throw invalid(path + ".children", "'" + op + "' needs at least one child");
                }
                List<Condition> children = new ArrayList<>(childDefs.size());
                for (int i = 0; i < childDefs.size(); i++) {
                    children.add(compile(childDefs.get(i), path + ".children[" + i + "]", allowed, depth + 1));
                }
                yield new CompositeCondition(op, children);
            }
            case NOT -> {
                if (childDefs.size() != 1) {
                    throw invalid(path + ".children", "'not' needs exactly one child, got " + childDefs.size());
                }
                yield new NotCondition(compile(childDefs.get(0), path + ".children[0]", allowed, depth + 1));
            }
            default -> compileLeaf(op, def, path);
        };
    }

    private static Condition compileLeaf(Operator op, ConditionDefinition def, String path) {
        if (def.getField() == null || def.getField().isBlank()) {
            throw invalid(path + ".field", "'" + op + "' requires a field");
        }
        if (def.getValue() == null) {
            throw invalid(path + ".value", "'" + op + "' requires a value");
        }
        if (!def.getChildren().isEmpty()) {
            throw invalid(path + ".children", "'" + op + "' does not take children");
        }
        try {
            return new FieldCondition(op, def.getField().trim(), def.getValue(), def.isIgnoreCase());
        } catch (PatternSyntaxException e) {
            throw invalid(path + ".value", "regex does not compile: " + e.getDescription());
        } catch (NumberFormatException e) {
            throw invalid(path + ".value", "'" + def.getValue() + "' is not a number");
        }
    }

    private static IllegalStateException invalid(String path, String message) {
        return new IllegalStateException(path + ": " + message);
    }
}
