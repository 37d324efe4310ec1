package com.quorum.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The single severity conclusion computed for one log record.
 *
 * <p>
 * A verdict is handed to the storage collaborator once computed and is never
 * modified afterwards; recomputing a record produces a new verdict that
 * replaces the old one downstream.
 * </p>
 *
 * <p>
 * Besides the fused severity and the ordered findings, a verdict records the
 * degraded-mode warnings raised while evaluating the record and the store
 * versions it was evaluated against ({@code null} values for empty stores).
 * </p>
 *
 * @since 1.0.0
 */
public final class Verdict {

    private final String recordId;
    private final Severity severity;
    private final List<DetectionFinding> findings;
    private final List<String> warnings;
    private final Map<String, String> storeVersions;
    private final Instant computedAt;

    private Verdict(Builder builder) {
        this.recordId = Objects.requireNonNull(builder.recordId, "recordId must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.computedAt = Objects.requireNonNull(builder.computedAt, "computedAt must not be null");
        this.findings = Collections.unmodifiableList(new ArrayList<>(builder.findings));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(builder.warnings));
        this.storeVersions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.storeVersions));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Verdict}. {@code recordId}, {@code severity}
     * and {@code computedAt} are required.
     */
    public static class Builder {
        private String recordId;
        private Severity severity;
        private List<DetectionFinding> findings = List.of();
        private List<String> warnings = List.of();
        private Map<String, String> storeVersions = Map.of();
        private Instant computedAt;

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder findings(List<DetectionFinding> findings) {
            this.findings = Objects.requireNonNull(findings, "findings must not be null");
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings = Objects.requireNonNull(warnings, "warnings must not be null");
            return this;
        }

        public Builder storeVersions(Map<String, String> storeVersions) {
            this.storeVersions = Objects.requireNonNull(storeVersions, "storeVersions must not be null");
            return this;
        }

        public Builder computedAt(Instant computedAt) {
            this.computedAt = computedAt;
            return this;
        }

        public Verdict build() {
            return new Verdict(this);
        }
    }

    public String getRecordId() {
        return recordId;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * @return findings in presentation order
     */
    public List<DetectionFinding> getFindings() {
        return findings;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public Map<String, String> getStoreVersions() {
        return storeVersions;
    }

    public Instant getComputedAt() {
        return computedAt;
    }

    /**
     * @return {@code true} if any detector produced a finding
     */
    public boolean isThreat() {
        return !findings.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Verdict that))
            return false;
        return recordId.equals(that.recordId)
                && severity == that.severity
                && findings.equals(that.findings)
                && warnings.equals(that.warnings)
                && storeVersions.equals(that.storeVersions)
                && computedAt.equals(that.computedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordId, severity, findings, warnings, storeVersions, computedAt);
    }

    @Override
    public String toString() {
        return "Verdict{" +
                "recordId='" + recordId + '\'' +
                ", severity=" + severity +
                ", findings=" + findings.size() +
                ", warnings=" + warnings.size() +
                ", computedAt=" + computedAt +
                '}';
    }
}
