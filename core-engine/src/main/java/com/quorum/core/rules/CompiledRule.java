package com.quorum.core.rules;

import com.quorum.core.model.NormalizedLogRecord;

import java.util.List;
import java.util.Objects;

/**
 * A validated rule with its compiled condition.
 *
 * @since 1.0.0
 */
public final class CompiledRule {

    private final String id;
    private final String title;
    private final String description;
    private final List<String> tags;
    private final double weight;
    private final Condition condition;

    public CompiledRule(String id, String title, String description, List<String> tags,
            double weight, Condition condition) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.description = description;
        this.tags = tags != null ? List.copyOf(tags) : List.of();
        this.weight = weight;
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public boolean matches(NormalizedLogRecord record) {
        return condition.matches(record);
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getTags() {
        return tags;
    }

    public double getWeight() {
        return weight;
    }

    public Condition getCondition() {
        return condition;
    }

    @Override
    public String toString() {
        return "CompiledRule{id='" + id + "', weight=" + weight + ", condition=" + condition + '}';
    }
}
