package com.quorum.core;

import com.quorum.core.audit.AuditSink;
import com.quorum.core.audit.CompositeAuditSink;
import com.quorum.core.audit.JsonLinesAuditSink;
import com.quorum.core.audit.LoggingAuditSink;
import com.quorum.core.config.EngineSettings;
import com.quorum.core.detection.DetectionEngine;
import com.quorum.core.detection.DetectorFactory;
import com.quorum.core.detection.SeverityFusion;
import com.quorum.core.store.DetectorStores;
import com.quorum.core.update.PemKeys;
import com.quorum.core.update.UpdateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Wires one {@link DetectorStores} handle into a {@link DetectionEngine} and
 * an {@link UpdateManager}.
 *
 * <pre>
 * EngineSettings settings = SettingsLoader.load();
 * QuorumCore core = QuorumCore.fromSettings(settings, Clock.systemUTC());
 * core.updates().submit(packageBytes);
 * Verdict verdict = core.detection().analyze(record);
 * </pre>
 *
 * @since 1.0.0
 */
public final class QuorumCore {

    private static final Logger LOG = LoggerFactory.getLogger(QuorumCore.class);

    private final DetectorStores stores;
    private final DetectionEngine detection;
    private final UpdateManager updates;

    private QuorumCore(DetectorStores stores, DetectionEngine detection, UpdateManager updates) {
        this.stores = stores;
        this.detection = detection;
        this.updates = updates;
    }

    /**
     * Build a core from explicit collaborators.
     *
     * @param settings  validated engine settings
     * @param publicKey package verification key
     * @param auditSink audit destination
     * @param clock     clock for verdicts and audit entries
     * @return wired core with empty stores
     */
    public static QuorumCore create(EngineSettings settings, PublicKey publicKey, AuditSink auditSink, Clock clock) {
        Objects.requireNonNull(settings, "settings must not be null");
        DetectorStores stores = new DetectorStores(settings.getRetainedVersions());
        DetectionEngine detection = new DetectionEngine(stores, DetectorFactory.createAll(settings),
                new SeverityFusion(settings.getFusion().toThresholds()), clock);
        UpdateManager updates = new UpdateManager(stores, publicKey, auditSink, settings, clock);
        return new QuorumCore(stores, detection, updates);
    }

    /**
     * Build a core whose key and audit log locations come from the settings.
     * Audit entries always go to the {@code quorum.audit} logger and, when
     * {@code auditLogPath} is set, to that JSON-lines file as well.
     *
     * @param settings validated engine settings; {@code publicKeyPath} is required
     * @param clock    clock for verdicts and audit entries
     * @return wired core with empty stores
     * @throws IOException              if the public key cannot be read
     * @throws GeneralSecurityException if the public key is not a valid RSA key
     */
    public static QuorumCore fromSettings(EngineSettings settings, Clock clock)
            throws IOException, GeneralSecurityException {
        Objects.requireNonNull(settings, "settings must not be null");
        if (settings.getPublicKeyPath() == null || settings.getPublicKeyPath().isBlank()) {
            throw new IllegalStateException("'publicKeyPath' must be configured to verify update packages");
        }
        PublicKey publicKey = PemKeys.readPublicKey(Path.of(settings.getPublicKeyPath()));
        LOG.info("Loaded update verification key from {}", settings.getPublicKeyPath());

        AuditSink auditSink = new LoggingAuditSink();
        if (settings.getAuditLogPath() != null && !settings.getAuditLogPath().isBlank()) {
            LOG.info("Appending audit entries to {}", settings.getAuditLogPath());
            auditSink = new CompositeAuditSink(List.of(auditSink,
                    new JsonLinesAuditSink(Path.of(settings.getAuditLogPath()))));
        }
        return create(settings, publicKey, auditSink, clock);
    }

    public DetectorStores stores() {
        return stores;
    }

    public DetectionEngine detection() {
        return detection;
    }

    public UpdateManager updates() {
        return updates;
    }
}
