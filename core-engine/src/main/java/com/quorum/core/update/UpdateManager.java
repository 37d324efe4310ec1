package com.quorum.core.update;

import com.quorum.core.audit.AuditEntry;
import com.quorum.core.audit.AuditSink;
import com.quorum.core.config.EngineSettings;
import com.quorum.core.store.DetectorStores;
import com.quorum.core.store.StoreKind;
import com.quorum.core.store.StoreSnapshot;
import com.quorum.core.store.StoreVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Verifies, stages and atomically commits signed update packages, and rolls
 * store kinds back to retained versions.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>Size bound: oversized packages fail before any decoding.</li>
 * <li>{@code RECEIVED}: container unpacked, manifest parsed, touched kinds
 * reserved, payload checksums compared with the manifest.</li>
 * <li>{@code VERIFIED}: manifest signature checked against the provisioned
 * public key.</li>
 * <li>{@code STAGED}: payloads decoded into candidate store versions.</li>
 * <li>{@code COMMITTED}: all touched kinds swapped in one step.</li>
 * </ol>
 *
 * <p>
 * A manifest that cannot be parsed, or whose checksums do not match, is
 * checked against the signature before the failure is classified: a forged
 * manifest reports {@link UpdateFailureReason#SIGNATURE_INVALID}, an intact
 * manifest with a modified payload reports
 * {@link UpdateFailureReason#CHECKSUM_MISMATCH}.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * At most one attempt holds a store kind at a time. Reservations are taken
 * all-or-nothing; a conflicting submission or rollback fails immediately with
 * {@link UpdateFailureReason#CONCURRENT_UPDATE_REJECTED}. Attempts on disjoint
 * kinds proceed in parallel.
 * </p>
 *
 * <h3>Errors</h3>
 * <p>
 * No method throws for an update failure: every outcome is returned as an
 * {@link UpdateResult}, audited, and leaves the active stores unchanged. The
 * core never retries.
 * </p>
 *
 * @since 1.0.0
 */
public class UpdateManager {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateManager.class);

    public static final String DEFAULT_ACTOR = "operator";

    private final DetectorStores stores;
    private final PublicKey publicKey;
    private final AuditSink auditSink;
    private final long maxPackageBytes;
    private final int attemptHistorySize;
    private final Clock clock;

    private final ConcurrentHashMap<StoreKind, String> reservations = new ConcurrentHashMap<>();
    private final Deque<UpdateResult> history = new ArrayDeque<>();

    /**
     * @param stores             store handle shared with the detection engine
     * @param publicKey          locally provisioned RSA verification key
     * @param auditSink          destination for audit entries
     * @param maxPackageBytes    size bound for a package and for each entry
     * @param attemptHistorySize number of results kept for {@link #status()}
     * @param clock              source of audit and install timestamps
     */
    public UpdateManager(DetectorStores stores, PublicKey publicKey, AuditSink auditSink,
            long maxPackageBytes, int attemptHistorySize, Clock clock) {
        this.stores = Objects.requireNonNull(stores, "stores must not be null");
        this.publicKey = Objects.requireNonNull(publicKey, "publicKey must not be null");
        this.auditSink = Objects.requireNonNull(auditSink, "auditSink must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxPackageBytes < 1) {
            throw new IllegalArgumentException("maxPackageBytes must be >= 1, got: " + maxPackageBytes);
        }
        if (attemptHistorySize < 1) {
            throw new IllegalArgumentException("attemptHistorySize must be >= 1, got: " + attemptHistorySize);
        }
        this.maxPackageBytes = maxPackageBytes;
        this.attemptHistorySize = attemptHistorySize;
    }

    public UpdateManager(DetectorStores stores, PublicKey publicKey, AuditSink auditSink,
            EngineSettings settings, Clock clock) {
        this(stores, publicKey, auditSink, settings.getMaxPackageBytes(), settings.getAttemptHistorySize(), clock);
    }

    // ---------------------------------------------------------------
    // Submission
    // ---------------------------------------------------------------

    public UpdateResult submit(byte[] packageBytes) {
        return submit(packageBytes, DEFAULT_ACTOR);
    }

    /**
     * Run one package through the full pipeline.
     *
     * @param packageBytes container bytes
     * @param actor        who submitted the package, recorded in the audit trail
     * @return final state of the attempt
     */
    public UpdateResult submit(byte[] packageBytes, String actor) {
        Objects.requireNonNull(packageBytes, "packageBytes must not be null");
        Attempt attempt = new Attempt(AuditEntry.ACTION_SUBMIT, actorOrDefault(actor));
        LOG.info("Update attempt {} received from '{}' ({} bytes)", attempt.id, attempt.actor, packageBytes.length);

        Set<StoreKind> reserved = EnumSet.noneOf(StoreKind.class);
        try {
            if (packageBytes.length > maxPackageBytes) {
                throw new UpdateException(UpdateFailureReason.PAYLOAD_TOO_LARGE,
                        "package is " + packageBytes.length + " bytes, limit is " + maxPackageBytes);
            }
            UpdatePackage updatePackage = PackageCodec.read(packageBytes, maxPackageBytes);
            Map<StoreKind, ManifestEntry> entries = readManifest(updatePackage, attempt);

            reserve(entries.keySet(), attempt.id);
            reserved.addAll(entries.keySet());
            attempt.transition(UpdateState.RECEIVED);

            checkPayloadSet(updatePackage, entries);
            checkChecksums(updatePackage, entries);
            verifySignature(updatePackage);
            attempt.transition(UpdateState.VERIFIED);

            Map<StoreKind, StoreVersion<?>> staged = stage(updatePackage, entries, attempt.packageVersion);
            attempt.transition(UpdateState.STAGED);

            commit(staged, attempt);
            return attempt.finish(UpdateState.COMMITTED, null, null);
        } catch (UpdateException e) {
            LOG.warn("Update attempt {} failed: {}", attempt.id, e.getMessage());
            return attempt.finish(UpdateState.FAILED, e.getReason(), e.getDetail());
        } finally {
            release(reserved, attempt.id);
        }
    }

    // ---------------------------------------------------------------
    // Rollback
    // ---------------------------------------------------------------

    public UpdateResult rollback(StoreKind kind) {
        return rollback(kind, null, DEFAULT_ACTOR);
    }

    public UpdateResult rollback(StoreKind kind, String targetVersion) {
        return rollback(kind, targetVersion, DEFAULT_ACTOR);
    }

    /**
     * Restore a retained version of one store kind.
     *
     * <p>
     * Without {@code targetVersion} the immediately prior version is restored,
     * and a kind whose last change was already a rollback is left unchanged and
     * reported as a no-op. A named version is restored whenever it is still
     * retained.
     * </p>
     *
     * @param kind          store kind
     * @param targetVersion retained version to restore, or {@code null}
     * @param actor         operator name for the audit trail
     * @return {@link UpdateState#ROLLED_BACK} or {@link UpdateState#FAILED}
     */
    public UpdateResult rollback(StoreKind kind, String targetVersion, String actor) {
        Objects.requireNonNull(kind, "kind must not be null");
        Attempt attempt = new Attempt(AuditEntry.ACTION_ROLLBACK, actorOrDefault(actor));
        attempt.kinds.add(kind);

        Set<StoreKind> reserved = EnumSet.noneOf(StoreKind.class);
        try {
            reserve(Set.of(kind), attempt.id);
            reserved.add(kind);

            if (targetVersion == null && stores.isRolledBack(kind)) {
                LOG.info("Rollback {} of {} is a no-op: already rolled back", attempt.id, kind);
                return attempt.finish(UpdateState.ROLLED_BACK, null,
                        kind + " already rolled back, no change");
            }
            StoreVersion<?> target = stores.rollbackTarget(kind, targetVersion)
                    .orElseThrow(() -> new UpdateException(UpdateFailureReason.ROLLBACK_TARGET_UNAVAILABLE,
                            targetVersion == null
                                    ? "no retained version of " + kind
                                    : "version '" + targetVersion + "' of " + kind + " is not retained"));
            attempt.packageVersion = target.getPackageVersion();

            restore(Map.of(kind, target));
            LOG.info("Rolled back {} to version {}", kind, target.getVersion());
            return attempt.finish(UpdateState.ROLLED_BACK, null, null);
        } catch (UpdateException e) {
            LOG.warn("Rollback {} failed: {}", attempt.id, e.getMessage());
            return attempt.finish(UpdateState.FAILED, e.getReason(), e.getDetail());
        } finally {
            release(reserved, attempt.id);
        }
    }

    public UpdateResult rollbackAll() {
        return rollbackAll(DEFAULT_ACTOR);
    }

    /**
     * Roll every kind with a retained version back to its immediately prior
     * version in one step. Kinds never updated are skipped; kinds already
     * rolled back are left unchanged.
     *
     * @param actor operator name for the audit trail
     * @return {@link UpdateState#ROLLED_BACK} or {@link UpdateState#FAILED}
     */
    public UpdateResult rollbackAll(String actor) {
        Attempt attempt = new Attempt(AuditEntry.ACTION_ROLLBACK, actorOrDefault(actor));
        Set<StoreKind> all = EnumSet.allOf(StoreKind.class);

        Set<StoreKind> reserved = EnumSet.noneOf(StoreKind.class);
        try {
            reserve(all, attempt.id);
            reserved.addAll(all);

            Map<StoreKind, StoreVersion<?>> targets = new EnumMap<>(StoreKind.class);
            List<StoreKind> alreadyRolledBack = new ArrayList<>();
            for (StoreKind kind : all) {
                if (stores.isRolledBack(kind)) {
                    alreadyRolledBack.add(kind);
                } else {
                    stores.rollbackTarget(kind, null).ifPresent(target -> targets.put(kind, target));
                }
            }
            attempt.kinds.addAll(targets.keySet());

            if (targets.isEmpty()) {
                if (alreadyRolledBack.isEmpty()) {
                    throw new UpdateException(UpdateFailureReason.ROLLBACK_TARGET_UNAVAILABLE,
                            "no store has a retained version");
                }
                attempt.kinds.addAll(alreadyRolledBack);
                return attempt.finish(UpdateState.ROLLED_BACK, null,
                        alreadyRolledBack + " already rolled back, no change");
            }

            restore(targets);
            LOG.info("Rolled back {} (unchanged: {})", targets.keySet(), alreadyRolledBack);
            return attempt.finish(UpdateState.ROLLED_BACK, null,
                    alreadyRolledBack.isEmpty() ? null : alreadyRolledBack + " already rolled back");
        } catch (UpdateException e) {
            LOG.warn("Rollback {} failed: {}", attempt.id, e.getMessage());
            return attempt.finish(UpdateState.FAILED, e.getReason(), e.getDetail());
        } finally {
            release(reserved, attempt.id);
        }
    }

    // ---------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------

    /**
     * @return active and retained versions per kind plus recent attempts
     */
    public UpdateStatus status() {
        StoreSnapshot snapshot = stores.snapshot();
        Map<StoreKind, String> active = new EnumMap<>(StoreKind.class);
        Map<StoreKind, List<String>> retained = new EnumMap<>(StoreKind.class);
        for (StoreKind kind : StoreKind.values()) {
            StoreVersion<?> version = snapshot.get(kind);
            if (version != null) {
                active.put(kind, version.getVersion());
            }
            retained.put(kind, stores.retained(kind).stream().map(StoreVersion::getVersion).toList());
        }
        List<UpdateResult> recent;
        synchronized (history) {
            recent = new ArrayList<>(history);
        }
        return new UpdateStatus(active, retained, recent);
    }

    // ---------------------------------------------------------------
    // Pipeline steps
    // ---------------------------------------------------------------

    private Map<StoreKind, ManifestEntry> readManifest(UpdatePackage updatePackage, Attempt attempt)
            throws UpdateException {
        Map<StoreKind, ManifestEntry> entries;
        try {
            PackageManifest manifest = PackageCodec.parseManifest(updatePackage.getManifestBytes());
            attempt.packageVersion = manifest.getPackageVersion();
            entries = manifest.validate();
        } catch (UpdateException | IllegalStateException e) {
            requireAuthentic(updatePackage);
            throw e instanceof UpdateException ue
                    ? ue
                    : new UpdateException(UpdateFailureReason.PAYLOAD_INVALID, e.getMessage(), e);
        }
        attempt.kinds.addAll(entries.keySet());
        return entries;
    }

    private void checkPayloadSet(UpdatePackage updatePackage, Map<StoreKind, ManifestEntry> entries)
            throws UpdateException {
        Set<StoreKind> present = updatePackage.getPayloads().keySet();
        if (present.equals(entries.keySet())) {
            return;
        }
        requireAuthentic(updatePackage);
        Set<StoreKind> missing = EnumSet.noneOf(StoreKind.class);
        missing.addAll(entries.keySet());
        missing.removeAll(present);
        Set<StoreKind> unlisted = EnumSet.noneOf(StoreKind.class);
        unlisted.addAll(present);
        unlisted.removeAll(entries.keySet());
        throw new UpdateException(UpdateFailureReason.PAYLOAD_INVALID,
                "payload set does not match manifest (missing " + missing + ", unlisted " + unlisted + ")");
    }

    private void checkChecksums(UpdatePackage updatePackage, Map<StoreKind, ManifestEntry> entries)
            throws UpdateException {
        for (Map.Entry<StoreKind, ManifestEntry> entry : entries.entrySet()) {
            byte[] payload = updatePackage.getPayloads().get(entry.getKey());
            if (!Checksums.matches(entry.getValue().getSha512(), payload)) {
                requireAuthentic(updatePackage);
                throw new UpdateException(UpdateFailureReason.CHECKSUM_MISMATCH,
                        entry.getKey() + " payload does not match its manifest checksum");
            }
        }
    }

    private void verifySignature(UpdatePackage updatePackage) throws UpdateException {
        boolean valid;
        try {
            valid = SignatureScheme.verify(updatePackage.getManifestBytes(), updatePackage.getSignature(), publicKey);
        } catch (GeneralSecurityException e) {
            throw new UpdateException(UpdateFailureReason.SIGNATURE_INVALID,
                    "signature could not be checked: " + e.getMessage(), e);
        }
        if (!valid) {
            throw new UpdateException(UpdateFailureReason.SIGNATURE_INVALID,
                    "manifest signature does not verify against the provisioned key");
        }
    }

    /**
     * Used on the failure paths before {@code VERIFIED}: a failure caused by a
     * forged manifest is reported as a signature failure.
     */
    private void requireAuthentic(UpdatePackage updatePackage) throws UpdateException {
        verifySignature(updatePackage);
    }

    private Map<StoreKind, StoreVersion<?>> stage(UpdatePackage updatePackage,
            Map<StoreKind, ManifestEntry> entries, String packageVersion) throws UpdateException {
        Map<StoreKind, StoreVersion<?>> staged = new EnumMap<>(StoreKind.class);
        for (Map.Entry<StoreKind, ManifestEntry> entry : entries.entrySet()) {
            StoreKind kind = entry.getKey();
            StoreVersion<?> version = PayloadDecoder.decode(kind, entry.getValue(),
                    updatePackage.getPayloads().get(kind), packageVersion, clock.instant());
            LOG.debug("Staged {} version {}", kind, version.getVersion());
            staged.put(kind, version);
        }
        return staged;
    }

    private void commit(Map<StoreKind, StoreVersion<?>> staged, Attempt attempt) throws UpdateException {
        try {
            stores.commit(staged);
        } catch (RuntimeException e) {
            LOG.error("Store swap failed for attempt {}; active stores unchanged", attempt.id, e);
            throw new UpdateException(UpdateFailureReason.STORE_SWAP_FAILED, e.getMessage(), e);
        }
        LOG.info("Committed package {}: {}", attempt.packageVersion, stores.snapshot().versionLabels());
    }

    private void restore(Map<StoreKind, StoreVersion<?>> targets) throws UpdateException {
        try {
            stores.restore(targets);
        } catch (RuntimeException e) {
            LOG.error("Store swap failed during rollback of {}; active stores unchanged", targets.keySet(), e);
            throw new UpdateException(UpdateFailureReason.STORE_SWAP_FAILED, e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Reservations
    // ---------------------------------------------------------------

    private void reserve(Set<StoreKind> kinds, String attemptId) throws UpdateException {
        List<StoreKind> acquired = new ArrayList<>();
        for (StoreKind kind : kinds) {
            String holder = reservations.putIfAbsent(kind, attemptId);
            if (holder != null) {
                acquired.forEach(k -> reservations.remove(k, attemptId));
                throw new UpdateException(UpdateFailureReason.CONCURRENT_UPDATE_REJECTED,
                        kind + " is held by attempt " + holder);
            }
            acquired.add(kind);
        }
    }

    private void release(Set<StoreKind> kinds, String attemptId) {
        kinds.forEach(kind -> reservations.remove(kind, attemptId));
    }

    // ---------------------------------------------------------------
    // Audit
    // ---------------------------------------------------------------

    private static String actorOrDefault(String actor) {
        return actor == null || actor.isBlank() ? DEFAULT_ACTOR : actor;
    }

    private void record(UpdateResult result) {
        synchronized (history) {
            history.addLast(result);
            while (history.size() > attemptHistorySize) {
                history.removeFirst();
            }
        }
    }

    private void audit(AuditEntry entry) {
        try {
            auditSink.append(entry);
        } catch (RuntimeException e) {
            LOG.error("Audit sink rejected entry {}", entry, e);
        }
    }

    /** Mutable bookkeeping for one submission or rollback. */
    private final class Attempt {
        private final String id = UUID.randomUUID().toString();
        private final String action;
        private final String actor;
        private final Set<StoreKind> kinds = EnumSet.noneOf(StoreKind.class);
        private String packageVersion;

        Attempt(String action, String actor) {
            this.action = action;
            this.actor = actor;
        }

        void transition(UpdateState state) {
            audit(entry(state, null));
        }

        UpdateResult finish(UpdateState state, UpdateFailureReason reason, String detail) {
            String auditDetail = reason == null ? detail : reason.code() + ": " + detail;
            audit(entry(state, auditDetail));
            UpdateResult result = new UpdateResult(id, action, state, reason, detail, packageVersion,
                    List.copyOf(kinds), clock.instant());
            record(result);
            return result;
        }

        private AuditEntry entry(UpdateState state, String detail) {
            return AuditEntry.builder()
                    .timestamp(clock.instant())
                    .attemptId(id)
                    .actor(actor)
                    .action(action)
                    .packageVersion(packageVersion)
                    .storeKinds(kinds.stream().map(StoreKind::wireName).toList())
                    .outcome(state.name())
                    .detail(detail)
                    .build();
        }
    }
}
