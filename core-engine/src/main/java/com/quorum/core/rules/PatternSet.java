package com.quorum.core.rules;

import java.util.List;
import java.util.Objects;

/**
 * Immutable pattern store content.
 *
 * @since 1.0.0
 */
public final class PatternSet {

    private final List<CompiledPattern> patterns;

    public PatternSet(List<CompiledPattern> patterns) {
        this.patterns = List.copyOf(Objects.requireNonNull(patterns, "patterns must not be null"));
    }

    /**
     * @param document parsed pattern payload
     * @return compiled pattern set
     * @throws IllegalStateException if the payload is invalid
     */
    public static PatternSet fromDocument(PatternDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        return new PatternSet(document.compile());
    }

    public List<CompiledPattern> getPatterns() {
        return patterns;
    }

    public int size() {
        return patterns.size();
    }

    @Override
    public String toString() {
        return "PatternSet{size=" + patterns.size() + '}';
    }
}
