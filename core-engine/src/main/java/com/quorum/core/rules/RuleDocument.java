package com.quorum.core.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * JSON payload of a rule store update: {@code {"rules": [...]}}.
 *
 * @since 1.0.0
 */
public class RuleDocument {

    private List<RuleDefinition> rules = new ArrayList<>();

    public List<RuleDefinition> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void setRules(List<RuleDefinition> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * Validate and compile every rule, collecting all errors.
     *
     * @return compiled rules in document order
     * @throws IllegalStateException if one or more rules are invalid or ids
     *                               repeat
     */
    public List<CompiledRule> compile() {
        List<String> errors = new ArrayList<>();
        List<CompiledRule> compiled = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            RuleDefinition rule = rules.get(i);
            if (rule == null) {
                errors.add("Rule at index " + i + " is null");
                continue;
            }
            try {
                CompiledRule result = rule.validate();
                if (!ids.add(result.getId())) {
                    errors.add("Duplicate rule id '" + result.getId() + "'");
                }
                compiled.add(result);
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rule payload validation failed:\n  - " + String.join("\n  - ", errors));
        }
        return compiled;
    }
}
