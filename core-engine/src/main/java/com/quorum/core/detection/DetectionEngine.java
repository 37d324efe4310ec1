package com.quorum.core.detection;

import com.quorum.core.model.DetectionFinding;
import com.quorum.core.model.NormalizedLogRecord;
import com.quorum.core.model.Severity;
import com.quorum.core.model.Verdict;
import com.quorum.core.store.DetectorStores;
import com.quorum.core.store.StoreKind;
import com.quorum.core.store.StoreSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs every {@link Detector} against a record and fuses the findings into a
 * {@link Verdict}.
 *
 * <h3>Consistency</h3>
 * <p>
 * Each record is evaluated against a single {@link StoreSnapshot} taken at the
 * start of the evaluation, so a concurrent commit is observed either entirely
 * or not at all. Detection never blocks on updates.
 * </p>
 *
 * <h3>Degraded mode</h3>
 * <p>
 * A detector whose store is empty, or which throws, contributes no findings.
 * The verdict carries a warning for it and the record is still classified by
 * the remaining detectors.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionEngine.class);

    private final DetectorStores stores;
    private final List<Detector> detectors;
    private final SeverityFusion fusion;
    private final Clock clock;

    /** Kinds already reported as empty at WARN; cleared once the store is populated. */
    private final Set<StoreKind> reportedEmpty = ConcurrentHashMap.newKeySet();

    /**
     * @param stores    active store handle; must not be {@code null}
     * @param detectors detectors to run, in order; must not be {@code null}
     * @param fusion    severity fusion; must not be {@code null}
     * @param clock     source of {@code computedAt}; must not be {@code null}
     */
    public DetectionEngine(DetectorStores stores, List<Detector> detectors, SeverityFusion fusion, Clock clock) {
        this.stores = Objects.requireNonNull(stores, "stores must not be null");
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors must not be null"));
        this.fusion = Objects.requireNonNull(fusion, "fusion must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (this.detectors.isEmpty()) {
            throw new IllegalArgumentException("At least one detector is required");
        }
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Classify one record against the currently active stores.
     *
     * @param record the record; must not be {@code null}
     * @return the verdict
     */
    public Verdict analyze(NormalizedLogRecord record) {
        Objects.requireNonNull(record, "Record must not be null");
        return analyze(record, stores.snapshot());
    }

    /**
     * Classify a batch of records in parallel. Each record takes its own
     * snapshot; the returned list is positionally aligned with the input.
     *
     * @param records records; must not be {@code null} or contain {@code null}
     * @return verdicts in input order
     */
    public List<Verdict> analyzeBatch(List<NormalizedLogRecord> records) {
        Objects.requireNonNull(records, "Records must not be null");
        records.forEach(r -> Objects.requireNonNull(r, "Records must not contain null"));
        LOG.debug("Analyzing batch of {} record(s)", records.size());
        return records.parallelStream()
                .map(this::analyze)
                .toList();
    }

    /**
     * Classify a batch and publish every verdict, in input order, to the sink.
     *
     * @param records records to classify
     * @param sink    storage collaborator
     * @return the published verdicts
     */
    public List<Verdict> analyzeBatch(List<NormalizedLogRecord> records, VerdictSink sink) {
        Objects.requireNonNull(sink, "Verdict sink must not be null");
        List<Verdict> verdicts = analyzeBatch(records);
        verdicts.forEach(sink::accept);
        return verdicts;
    }

    public List<Detector> getDetectors() {
        return detectors;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    Verdict analyze(NormalizedLogRecord record, StoreSnapshot snapshot) {
        List<DetectionFinding> findings = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<StoreKind> emptyKinds = EnumSet.noneOf(StoreKind.class);

        for (Detector detector : detectors) {
            StoreKind storeKind = detector.storeKind();
            if (!snapshot.isPresent(storeKind)) {
                emptyKinds.add(storeKind);
                warnings.add(detector.kind() + " detector degraded: " + storeKind + " store is empty");
                continue;
            }
            try {
                findings.addAll(detector.evaluate(record, snapshot));
            } catch (RuntimeException e) {
                LOG.warn("Record [{}]: {} detector failed, continuing without it",
                        record.getId(), detector.kind(), e);
                warnings.add(detector.kind() + " detector degraded: " + e.getMessage());
            }
        }
        reportEmptyStores(record, emptyKinds);

        findings.sort(DetectionFinding.PRESENTATION_ORDER);
        Severity severity = fusion.fuse(findings);
        if (severity != Severity.NONE) {
            LOG.debug("Record [{}] classified {} with {} finding(s)", record.getId(), severity, findings.size());
        }

        return Verdict.builder()
                .recordId(record.getId())
                .severity(severity)
                .findings(findings)
                .warnings(warnings)
                .storeVersions(snapshot.versionLabels())
                .computedAt(clock.instant())
                .build();
    }

    /**
     * Logs an empty store at WARN the first time it is seen, and at DEBUG
     * afterwards until the store is populated again.
     */
    private void reportEmptyStores(NormalizedLogRecord record, Set<StoreKind> emptyKinds) {
        for (StoreKind kind : StoreKind.values()) {
            if (!emptyKinds.contains(kind)) {
                reportedEmpty.remove(kind);
            } else if (reportedEmpty.add(kind)) {
                LOG.warn("Detection running degraded: {} store is empty", kind);
            } else {
                LOG.debug("Record [{}]: {} store is empty", record.getId(), kind);
            }
        }
    }
}
