package com.quorum.core.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps audit entries in memory, in append order.
 *
 * @since 1.0.0
 */
public class InMemoryAuditSink implements AuditSink {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void append(AuditEntry entry) {
        entries.add(entry);
    }

    /**
     * @return immutable copy of the entries appended so far
     */
    public List<AuditEntry> entries() {
        return List.copyOf(entries);
    }

    /**
     * @param attemptId attempt identifier
     * @return entries of one attempt, in append order
     */
    public List<AuditEntry> entriesFor(String attemptId) {
        return entries.stream()
                .filter(e -> attemptId.equals(e.getAttemptId()))
                .toList();
    }
}
