package com.quorum.core.rules;

import com.quorum.core.model.NormalizedLogRecord;

import java.util.Objects;

/**
 * A validated tactic/technique pattern with its compiled predicate.
 *
 * @since 1.0.0
 */
public final class CompiledPattern {

    private final String id;
    private final String name;
    private final String tactic;
    private final String technique;
    private final String description;
    private final double weight;
    private final Condition predicate;

    public CompiledPattern(String id, String name, String tactic, String technique,
            String description, double weight, Condition predicate) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.tactic = tactic;
        this.technique = technique;
        this.description = description;
        this.weight = weight;
        this.predicate = Objects.requireNonNull(predicate, "predicate must not be null");
    }

    public boolean matches(NormalizedLogRecord record) {
        return predicate.matches(record);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getTactic() {
        return tactic;
    }

    public String getTechnique() {
        return technique;
    }

    public String getDescription() {
        return description;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return "CompiledPattern{id='" + id + "', name='" + name + "', weight=" + weight + '}';
    }
}
