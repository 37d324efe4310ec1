package com.quorum.core.detection;

import com.quorum.core.intel.Atom;
import com.quorum.core.intel.AtomExtractor;
import com.quorum.core.intel.Indicator;
import com.quorum.core.intel.IndicatorSet;
import com.quorum.core.model.DetectionFinding;
import com.quorum.core.model.DetectorKind;
import com.quorum.core.model.NormalizedLogRecord;
import com.quorum.core.store.StoreKind;
import com.quorum.core.store.StoreSnapshot;
import com.quorum.core.store.StoreVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Indicator-of-compromise detector.
 *
 * <p>
 * Extracts atoms (addresses, domains, hashes, process names) from the record
 * and looks each one up in the active indicator store. Every hit is reported
 * with score 1.0; a known-bad indicator is never partially malicious.
 * </p>
 *
 * @since 1.0.0
 */
public class IndicatorDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(IndicatorDetector.class);

    static final double HIT_SCORE = 1.0;

    @Override
    public DetectorKind kind() {
        return DetectorKind.IOC;
    }

    @Override
    public StoreKind storeKind() {
        return StoreKind.INDICATOR;
    }

    @Override
    public List<DetectionFinding> evaluate(NormalizedLogRecord record, StoreSnapshot snapshot) {
        Objects.requireNonNull(record, "Record must not be null");
        StoreVersion<?> store = snapshot.get(StoreKind.INDICATOR);
        IndicatorSet indicators = snapshot.indicators();

        List<DetectionFinding> findings = new ArrayList<>();
        for (Atom atom : AtomExtractor.extract(record)) {
            Optional<Indicator> hit = indicators.lookup(atom.getType(), atom.getValue());
            if (hit.isEmpty()) {
                continue;
            }
            Indicator indicator = hit.get();
            LOG.debug("Record [{}]: indicator hit {}={} in field '{}'",
                    record.getId(), atom.getType(), atom.getValue(), atom.getField());

            Map<String, String> evidence = new TreeMap<>();
            evidence.put("indicator", indicator.getValue());
            evidence.put("indicator_type", indicator.getType().wireName());
            evidence.put("field", atom.getField());
            if (indicator.getSource() != null) {
                evidence.put("source", indicator.getSource());
            }
            if (indicator.getDescription() != null) {
                evidence.put("description", indicator.getDescription());
            }
            evidence.put("store_version", store.getVersion());
            findings.add(new DetectionFinding(kind(), atom.getType().findingName(), HIT_SCORE, evidence));
        }
        return findings;
    }
}
