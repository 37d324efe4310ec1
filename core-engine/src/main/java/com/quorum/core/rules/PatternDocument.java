package com.quorum.core.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * JSON payload of a pattern store update: {@code {"patterns": [...]}}.
 *
 * @since 1.0.0
 */
public class PatternDocument {

    private List<PatternDefinition> patterns = new ArrayList<>();

    public List<PatternDefinition> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    public void setPatterns(List<PatternDefinition> patterns) {
        this.patterns = patterns != null ? new ArrayList<>(patterns) : new ArrayList<>();
    }

    /**
     * Validate and compile every pattern, collecting all errors.
     *
     * @return compiled patterns in document order
     * @throws IllegalStateException if one or more patterns are invalid or ids
     *                               repeat
     */
    public List<CompiledPattern> compile() {
        List<String> errors = new ArrayList<>();
        List<CompiledPattern> compiled = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < patterns.size(); i++) {
            PatternDefinition pattern = patterns.get(i);
            if (pattern == null) {
                errors.add("Pattern at index " + i + " is null");
                continue;
            }
            try {
                CompiledPattern result = pattern.validate();
                if (!ids.add(result.getId())) {
                    errors.add("Duplicate pattern id '" + result.getId() + "'");
                }
                compiled.add(result);
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Pattern payload validation failed:\n  - " + String.join("\n  - ", errors));
        }
        return compiled;
    }
}
