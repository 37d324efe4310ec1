package com.quorum.core.audit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One append-only audit record, emitted for every state transition of an
 * update attempt or rollback.
 *
 * <p>
 * Serialized as one JSON object per line by {@link JsonLinesAuditSink}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code timestamp}, {@code attemptId},
 * {@code actor}, {@code action} and {@code outcome} are required.
 * </p>
 *
 * @since 1.0.0
 */
public class AuditEntry {

    public static final String ACTION_SUBMIT = "submit";
    public static final String ACTION_ROLLBACK = "rollback";

    /** When the transition happened. */
    private Instant timestamp;

    /** Correlates all entries of one attempt. */
    private String attemptId;

    /** Operator or process that triggered the attempt. */
    private String actor;

    /** {@value #ACTION_SUBMIT} or {@value #ACTION_ROLLBACK}. */
    private String action;

    /** Package version, or {@code null} when it could not be read. */
    private String packageVersion;

    /** Store kinds (wire names) touched by the attempt. */
    private List<String> storeKinds = new ArrayList<>();

    /** State reached, e.g. {@code VERIFIED} or {@code FAILED}. */
    private String outcome;

    /** Failure reason code and detail; {@code null} on success. */
    private String detail;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public AuditEntry() {
    }

    private AuditEntry(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.attemptId = Objects.requireNonNull(builder.attemptId, "attemptId must not be null");
        this.actor = Objects.requireNonNull(builder.actor, "actor must not be null");
        this.action = Objects.requireNonNull(builder.action, "action must not be null");
        this.outcome = Objects.requireNonNull(builder.outcome, "outcome must not be null");
        this.packageVersion = builder.packageVersion;
        this.storeKinds = new ArrayList<>(builder.storeKinds);
        this.detail = builder.detail;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AuditEntry} instances.
     */
    public static class Builder {
        private Instant timestamp;
        private String attemptId;
        private String actor;
        private String action;
        private String packageVersion;
        private List<String> storeKinds = List.of();
        private String outcome;
        private String detail;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder attemptId(String attemptId) {
            this.attemptId = attemptId;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder packageVersion(String packageVersion) {
            this.packageVersion = packageVersion;
            return this;
        }

        public Builder storeKinds(List<String> storeKinds) {
            this.storeKinds = Objects.requireNonNull(storeKinds, "storeKinds must not be null");
            return this;
        }

        public Builder outcome(String outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        /**
         * @return a new {@link AuditEntry}
         * @throws NullPointerException if a required field is missing
         */
        public AuditEntry build() {
            return new AuditEntry(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getAttemptId() {
        return attemptId;
    }

    public void setAttemptId(String attemptId) {
        this.attemptId = attemptId;
    }

    public String getActor() {
        return actor;
    }

    public void setActor(String actor) {
        this.actor = actor;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getPackageVersion() {
        return packageVersion;
    }

    public void setPackageVersion(String packageVersion) {
        this.packageVersion = packageVersion;
    }

    public List<String> getStoreKinds() {
        return Collections.unmodifiableList(storeKinds);
    }

    public void setStoreKinds(List<String> storeKinds) {
        this.storeKinds = storeKinds != null ? new ArrayList<>(storeKinds) : new ArrayList<>();
    }

    public String getOutcome() {
        return outcome;
    }

    public void setOutcome(String outcome) {
        this.outcome = outcome;
    }

    public String getDetail() {
        return detail;
    }

    public void setDetail(String detail) {
        this.detail = detail;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AuditEntry that))
            return false;
        return Objects.equals(timestamp, that.timestamp)
                && Objects.equals(attemptId, that.attemptId)
                && Objects.equals(actor, that.actor)
                && Objects.equals(action, that.action)
                && Objects.equals(packageVersion, that.packageVersion)
                && Objects.equals(storeKinds, that.storeKinds)
                && Objects.equals(outcome, that.outcome)
                && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, attemptId, actor, action, packageVersion, storeKinds, outcome, detail);
    }

    @Override
    public String toString() {
        return "AuditEntry{" +
                "timestamp=" + timestamp +
                ", attemptId='" + attemptId + '\'' +
                ", actor='" + actor + '\'' +
                ", action='" + action + '\'' +
                ", packageVersion='" + packageVersion + '\'' +
                ", storeKinds=" + storeKinds +
                ", outcome='" + outcome + '\'' +
                ", detail='" + detail + '\'' +
                '}';
    }
}
