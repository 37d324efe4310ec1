package com.quorum.core.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A tactic/technique detection pattern as shipped in a pattern payload.
 *
 * <p>
 * The predicate is the conjunction of every test in {@code match}; only
 * {@code equals}, {@code contains} and {@code regex} tests are accepted. The
 * weight defaults to {@code 1.0}, the score of an exact technique match.
 * </p>
 *
 * <pre>
 * {"id": "T1003.001", "name": "LSASS Memory", "tactic": "credential-access",
 *  "technique": "OS Credential Dumping",
 *  "match": [{"field": "raw_message", "op": "contains", "value": "lsass", "ignoreCase": true}]}
 * </pre>
 *
 * @since 1.0.0
 */
public class PatternDefinition {

    /** Weight used when a pattern does not declare one. */
    public static final double DEFAULT_WEIGHT = 1.0;

    private String id;
    private String name;
    private String tactic;
    private String technique;
    private String description;
    private double weight = DEFAULT_WEIGHT;
    private List<ConditionDefinition> match = new ArrayList<>();

    /**
     * Validate metadata and compile the predicate.
     *
     * @return the compiled pattern
     * @throws IllegalStateException if validation fails
     */
    public CompiledPattern validate() {
        List<String> errors = new ArrayList<>();
        String label = id != null ? id : "<no id>";

        if (id == null || id.isBlank()) {
            errors.add("Pattern 'id' is required");
        }
        if (name == null || name.isBlank()) {
            errors.add("Pattern '" + label + "' requires 'name'");
        }
        if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
            errors.add("Pattern '" + label + "' requires 'weight' in [0, 1], got: " + weight);
        }
        if (match.isEmpty()) {
            errors.add("Pattern '" + label + "' requires at least one 'match' test");
        }

        List<Condition> tests = new ArrayList<>();
        for (int i = 0; i < match.size(); i++) {
            try {
                tests.add(ConditionCompiler.compile(match.get(i),
                        "pattern '" + label + "'.match[" + i + "]", ConditionCompiler.PATTERN_OPERATORS));
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid PatternDefinition: " + String.join("; ", errors));
        }
        return new CompiledPattern(id.trim(), name, tactic, technique, description, weight,
                new CompositeCondition(Operator.ALL, tests));
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTactic() {
        return tactic;
    }

    public void setTactic(String tactic) {
        this.tactic = tactic;
    }

    public String getTechnique() {
        return technique;
    }

    public void setTechnique(String technique) {
        this.technique = technique;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public double getWeight() {
        return weight;
    }

    public void setWeight(double weight) {
        this.weight = weight;
    }

    public List<ConditionDefinition> getMatch() {
        return Collections.unmodifiableList(match);
    }

    public void setMatch(List<ConditionDefinition> match) {
        this.match = match != null ? new ArrayList<>(match) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "PatternDefinition{id='" + id + "', name='" + name + "', weight=" + weight + '}';
    }
}
