package com.quorum.core.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit entries to the dedicated {@value #LOGGER_NAME} SLF4J logger so
 * that the logging backend can route them to their own appender.
 *
 * @since 1.0.0
 */
public class LoggingAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "quorum.audit";

    private static final Logger AUDIT = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void append(AuditEntry entry) {
        if ("FAILED".equals(entry.getOutcome())) {
            AUDIT.warn("attempt={} actor={} action={} package={} stores={} outcome={} detail={}",
                    entry.getAttemptId(), entry.getActor(), entry.getAction(), entry.getPackageVersion(),
                    entry.getStoreKinds(), entry.getOutcome(), entry.getDetail());
        } else {
            AUDIT.info("attempt={} actor={} action={} package={} stores={} outcome={}",
                    entry.getAttemptId(), entry.getActor(), entry.getAction(), entry.getPackageVersion(),
                    entry.getStoreKinds(), entry.getOutcome());
        }
    }
}
