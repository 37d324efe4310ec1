package com.quorum.core.rules;

import java.util.List;
import java.util.Objects;

/**
 * Immutable rule store content.
 *
 * @since 1.0.0
 */
public final class RuleSet {

    private final List<CompiledRule> rules;

    public RuleSet(List<CompiledRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
    }

    /**
     * @param document parsed rule payload
     * @return compiled rule set
     * @throws IllegalStateException if the payload is invalid
     */
    public static RuleSet fromDocument(RuleDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        return new RuleSet(document.compile());
    }

    public List<CompiledRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    @Override
    public String toString() {
        return "RuleSet{size=" + rules.size() + '}';
    }
}
