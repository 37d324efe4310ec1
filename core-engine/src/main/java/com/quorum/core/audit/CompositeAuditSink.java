package com.quorum.core.audit;

import java.util.List;
import java.util.Objects;

/**
 * Forwards each entry to several sinks in order. The first failing sink
 * aborts the fan-out and its exception propagates.
 */
public class CompositeAuditSink implements AuditSink {

    private final List<AuditSink> sinks;

    public CompositeAuditSink(List<AuditSink> sinks) {
        this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks must not be null"));
    }

    @Override
    public void append(AuditEntry entry) {
        for (AuditSink sink : sinks) {
            sink.append(entry);
        }
    }
}
