package com.quorum.core.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Describes a single declarative detection rule as shipped in a rule payload.
 *
 * <p>
 * A rule is pure data: a boolean expression over record fields plus a
 * declared weight, which becomes the score of the finding when the rule
 * matches. Call {@link #validate()} after deserialization.
 * </p>
 *
 * <pre>
 * {"id": "R-1001", "title": "Encoded PowerShell", "weight": 0.8,
 *  "tags": ["attack.execution"],
 *  "condition": {"op": "regex", "field": "raw_message", "value": "-enc(odedcommand)?\\s"}}
 * </pre>
 *
 * @since 1.0.0
 */
public class RuleDefinition {

    private String id;
    private String title;
    private String description;
    private Double weight;
    private List<String> tags = new ArrayList<>();
    private ConditionDefinition condition;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate the rule's metadata and compile its condition.
     *
     * @return the compiled rule
     * @throws IllegalStateException if validation fails
     */
    public CompiledRule validate() {
        List<String> errors = new ArrayList<>();
        String label = id != null ? id : "<no id>";

        if (id == null || id.isBlank()) {
            errors.add("Rule 'id' is required");
        }
        if (title == null || title.isBlank()) {
            errors.add("Rule '" + label + "' requires 'title'");
        }
        if (weight == null) {
            errors.add("Rule '" + label + "' requires 'weight'");
        } else if (weight.isNaN() || weight < 0.0 || weight > 1.0) {
            errors.add("Rule '" + label + "' requires 'weight' in [0, 1], got: " + weight);
        }

        Condition compiled = null;
        try {
            compiled = ConditionCompiler.compile(condition, "rule '" + label + "'.condition",
                    ConditionCompiler.ALL_OPERATORS);
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid RuleDefinition: " + String.join("; ", errors));
        }
        return new CompiledRule(id.trim(), title, description, tags, weight, compiled);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Double getWeight() {
        return weight;
    }

    public void setWeight(Double weight) {
        this.weight = weight;
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    public ConditionDefinition getCondition() {
        return condition;
    }

    public void setCondition(ConditionDefinition condition) {
        this.condition = condition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleDefinition that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "RuleDefinition{id='" + id + "', title='" + title + "', weight=" + weight + '}';
    }
}
