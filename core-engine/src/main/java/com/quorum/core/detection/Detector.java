package com.quorum.core.detection;

import com.quorum.core.model.DetectionFinding;
import com.quorum.core.model.DetectorKind;
import com.quorum.core.model.NormalizedLogRecord;
import com.quorum.core.store.StoreKind;
import com.quorum.core.store.StoreSnapshot;

import java.util.List;

/**
 * Contract for the four detection techniques.
 * <p>
 * Implementations are <strong>stateless</strong>: all knowledge comes from the
 * {@link StoreSnapshot} passed to {@link #evaluate}, so one instance can serve
 * any number of concurrent evaluations.
 * </p>
 * <p>
 * The engine checks {@link StoreSnapshot#isPresent(StoreKind)} for
 * {@link #storeKind()} before calling {@link #evaluate}; detectors may assume
 * their store is populated.
 * </p>
 */
public interface Detector {

    /**
     * @return the kind stamped on every finding this detector produces
     */
    DetectorKind kind();

    /**
     * @return the store this detector reads
     */
    StoreKind storeKind();

    /**
     * Evaluate a single record against one snapshot of the active stores.
     *
     * @param record   the record to inspect
     * @param snapshot the store versions to evaluate against
     * @return findings, possibly empty; never {@code null}
     */
    List<DetectionFinding> evaluate(NormalizedLogRecord record, StoreSnapshot snapshot);
}
