package com.quorum.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Explicit handle on the active detector stores and their retained history.
 *
 * <p>
 * One instance is created per engine and passed to both the
 * {@code DetectionEngine} (reader) and the {@code UpdateManager} (sole
 * writer). Tests construct isolated instances.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The active versions live in a single {@link AtomicReference} to an
 * immutable {@link StoreSnapshot}. Readers never lock. Writers publish a new
 * snapshot with compare-and-set, so updates of different store kinds can run
 * concurrently without losing each other's swap. The retained history of a
 * kind is only touched by the writer currently holding that kind, which the
 * update manager guarantees.
 * </p>
 *
 * <p>
 * A superseded version stays reachable for as long as an in-flight evaluation
 * holds the snapshot it belongs to; nothing here frees content eagerly.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorStores {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorStores.class);

    private final AtomicReference<StoreSnapshot> active = new AtomicReference<>(StoreSnapshot.empty());
    private final Map<StoreKind, Deque<StoreVersion<?>>> retained = new EnumMap<>(StoreKind.class);
    private final Map<StoreKind, Boolean> rolledBack = new EnumMap<>(StoreKind.class);
    private final int retentionLimit;

    /**
     * @param retentionLimit number of superseded versions kept per kind for
     *                       rollback; must be &gt;= 1
     */
    public DetectorStores(int retentionLimit) {
        if (retentionLimit < 1) {
            throw new IllegalArgumentException("retentionLimit must be >= 1, got: " + retentionLimit);
        }
        this.retentionLimit = retentionLimit;
        for (StoreKind kind : StoreKind.values()) {
            retained.put(kind, new ArrayDeque<>());
            rolledBack.put(kind, Boolean.FALSE);
        }
    }

    // ---------------------------------------------------------------
    // Read side
    // ---------------------------------------------------------------

    /**
     * @return the current active snapshot; never {@code null}
     */
    public StoreSnapshot snapshot() {
        return active.get();
    }

    /**
     * Retained (superseded) versions of a kind, newest first.
     *
     * @param kind store kind
     * @return copy of the retained versions
     */
    public List<StoreVersion<?>> retained(StoreKind kind) {
        Deque<StoreVersion<?>> history = retained.get(kind);
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    /**
     * @param kind store kind
     * @return {@code true} if the last change to this kind was a rollback
     */
    public boolean isRolledBack(StoreKind kind) {
        synchronized (rolledBack) {
            return rolledBack.get(kind);
        }
    }

    public int getRetentionLimit() {
        return retentionLimit;
    }

    // ---------------------------------------------------------------
    // Write side (update manager only)
    // ---------------------------------------------------------------

    /**
     * Make fully prepared versions active in one step.
     *
     * <p>
     * The previous active versions of the touched kinds are pushed onto their
     * retained history, which is then trimmed to the retention limit.
     * </p>
     *
     * @param replacements staged versions keyed by kind; must not be empty
     * @return the snapshot that was replaced
     */
    public StoreSnapshot commit(Map<StoreKind, StoreVersion<?>> replacements) {
        Objects.requireNonNull(replacements, "replacements must not be null");
        if (replacements.isEmpty()) {
            throw new IllegalArgumentException("Nothing to commit");
        }
        Map<StoreKind, StoreVersion<?>> copy = new EnumMap<>(replacements);
        StoreSnapshot previous = swap(copy);

        for (StoreKind kind : copy.keySet()) {
            StoreVersion<?> superseded = previous.get(kind);
            if (superseded != null) {
                Deque<StoreVersion<?>> history = retained.get(kind);
                synchronized (history) {
                    history.addFirst(superseded);
                    while (history.size() > retentionLimit) {
                        StoreVersion<?> dropped = history.removeLast();
                        LOG.debug("Retention limit reached for {}: dropping version {}",
                                kind, dropped.getVersion());
                    }
                }
            }
            setRolledBack(kind, false);
        }
        return previous;
    }

    /**
     * Find the retained version a rollback of {@code kind} would restore.
     *
     * @param kind          store kind
     * @param targetVersion explicit version to restore, or {@code null} for the
     *                      immediately prior one
     * @return the retained version, or empty if none matches
     */
    public Optional<StoreVersion<?>> rollbackTarget(StoreKind kind, String targetVersion) {
        Deque<StoreVersion<?>> history = retained.get(kind);
        synchronized (history) {
            if (targetVersion == null) {
                return Optional.ofNullable(history.peekFirst());
            }
            return history.stream()
                    .filter(v -> v.getVersion().equals(targetVersion))
                    .findFirst();
        }
    }

    /**
     * Reactivate retained versions in one step.
     *
     * <p>
     * Each target and every retained version newer than it leave the history;
     * the versions being replaced are discarded rather than retained, so a
     * rollback can never be rolled back.
     * </p>
     *
     * @param targets retained versions to reactivate, keyed by kind
     * @return the snapshot that was replaced
     * @throws IllegalStateException if a target is not in the retained history
     */
    public StoreSnapshot restore(Map<StoreKind, StoreVersion<?>> targets) {
        Objects.requireNonNull(targets, "targets must not be null");
        Map<StoreKind, StoreVersion<?>> copy = new EnumMap<>(targets);
        for (Map.Entry<StoreKind, StoreVersion<?>> entry : copy.entrySet()) {
            Deque<StoreVersion<?>> history = retained.get(entry.getKey());
            synchronized (history) {
                if (!history.contains(entry.getValue())) {
                    throw new IllegalStateException("Version " + entry.getValue()
                            + " is not retained for " + entry.getKey());
                }
            }
        }

        StoreSnapshot previous = swap(copy);

        for (Map.Entry<StoreKind, StoreVersion<?>> entry : copy.entrySet()) {
            Deque<StoreVersion<?>> history = retained.get(entry.getKey());
            synchronized (history) {
                Iterator<StoreVersion<?>> it = history.iterator();
                while (it.hasNext()) {
                    StoreVersion<?> candidate = it.next();
                    it.remove();
                    if (candidate.equals(entry.getValue())) {
                        break;
                    }
                }
            }
            setRolledBack(entry.getKey(), true);
        }
        return previous;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private StoreSnapshot swap(Map<StoreKind, StoreVersion<?>> replacements) {
        while (true) {
            StoreSnapshot current = active.get();
            StoreSnapshot next = current.with(replacements);
            if (active.compareAndSet(current, next)) {
                LOG.debug("Active stores now {}", next);
                return current;
            }
        }
    }

    private void setRolledBack(StoreKind kind, boolean value) {
        synchronized (rolledBack) {
            rolledBack.put(kind, value);
        }
    }
}
