package com.quorum.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A single log record after format-specific normalization.
 *
 * <p>
 * Records are produced by the external normalizer and are
 * <strong>immutable</strong>: the detection engine reads them from many
 * threads and never modifies them. Structured fields are kept in key order so
 * that iteration (and everything derived from it) is deterministic.
 * </p>
 *
 * <h3>Field references</h3>
 * <p>
 * Rules and patterns address record content by name through
 * {@link #resolveField(String)}: {@code raw_message} (alias
 * {@code message}), {@code host}, {@code source_type} and {@code id} resolve
 * to the record attributes, every other name to {@link #getStructuredFields()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class NormalizedLogRecord {

    public static final String FIELD_RAW_MESSAGE = "raw_message";
    public static final String FIELD_MESSAGE = "message";
    public static final String FIELD_HOST = "host";
    public static final String FIELD_SOURCE_TYPE = "source_type";
    public static final String FIELD_ID = "id";

    private final String id;
    private final Instant timestamp;
    private final String host;
    private final String sourceType;
    private final String rawMessage;
    private final Map<String, String> structuredFields;
    private final String contentHash;

    private NormalizedLogRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.host = builder.host;
        this.sourceType = builder.sourceType;
        this.rawMessage = builder.rawMessage != null ? builder.rawMessage : "";
        this.structuredFields = Collections.unmodifiableMap(new TreeMap<>(builder.structuredFields));
        this.contentHash = builder.contentHash;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link NormalizedLogRecord}.
     *
     * <p>
     * {@code id} and {@code timestamp} are required. A missing raw message is
     * stored as the empty string.
     * </p>
     */
    public static class Builder {
        private String id;
        private Instant timestamp;
        private String host;
        private String sourceType;
        private String rawMessage;
        private final Map<String, String> structuredFields = new TreeMap<>();
        private String contentHash;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder sourceType(String sourceType) {
            this.sourceType = sourceType;
            return this;
        }

        public Builder rawMessage(String rawMessage) {
            this.rawMessage = rawMessage;
            return this;
        }

        public Builder field(String name, String value) {
            Objects.requireNonNull(name, "Field name must not be null");
            if (value != null) {
                structuredFields.put(name, value);
            }
            return this;
        }

        public Builder structuredFields(Map<String, String> fields) {
            if (fields != null) {
                fields.forEach(this::field);
            }
            return this;
        }

        public Builder contentHash(String contentHash) {
            this.contentHash = contentHash;
            return this;
        }

        public NormalizedLogRecord build() {
            return new NormalizedLogRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Field resolution
    // ---------------------------------------------------------------

    /**
     * Resolve a field reference used by rules and patterns.
     *
     * @param fieldName reference name; must not be {@code null}
     * @return the value, or empty if the record has no such field
     */
    public Optional<String> resolveField(String fieldName) {
        Objects.requireNonNull(fieldName, "Field name must not be null");
        return switch (fieldName) {
            case FIELD_RAW_MESSAGE, FIELD_MESSAGE -> Optional.of(rawMessage);
            case FIELD_HOST -> Optional.ofNullable(host);
            case FIELD_SOURCE_TYPE -> Optional.ofNullable(sourceType);
            case FIELD_ID -> Optional.of(id);
            default -> Optional.ofNullable(structuredFields.get(fieldName));
        };
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getHost() {
        return host;
    }

    public String getSourceType() {
        return sourceType;
    }

    public String getRawMessage() {
        return rawMessage;
    }

    /**
     * @return unmodifiable, key-ordered view of the structured fields
     */
    public Map<String, String> getStructuredFields() {
        return structuredFields;
    }

    public String getContentHash() {
        return contentHash;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NormalizedLogRecord that))
            return false;
        return id.equals(that.id)
                && timestamp.equals(that.timestamp)
                && Objects.equals(host, that.host)
                && Objects.equals(sourceType, that.sourceType)
                && rawMessage.equals(that.rawMessage)
                && structuredFields.equals(that.structuredFields)
                && Objects.equals(contentHash, that.contentHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, timestamp, host, sourceType, rawMessage, structuredFields, contentHash);
    }

    @Override
    public String toString() {
        return "NormalizedLogRecord{" +
                "id='" + id + '\'' +
                ", timestamp=" + timestamp +
                ", host='" + host + '\'' +
                ", sourceType='" + sourceType + '\'' +
                ", fields=" + structuredFields.keySet() +
                '}';
    }
}
