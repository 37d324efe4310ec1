package com.quorum.core.audit;

/**
 * Append-only destination for {@link AuditEntry} records.
 *
 * <p>
 * Implementations must be safe for concurrent use and must never rewrite or
 * drop an entry once {@link #append} has returned. A failure to persist is
 * reported by throwing an unchecked exception.
 * </p>
 */
@FunctionalInterface
public interface AuditSink {

    void append(AuditEntry entry);
}
