package com.quorum.core.detection;

import com.quorum.core.model.DetectionFinding;
import com.quorum.core.model.DetectorKind;
import com.quorum.core.model.NormalizedLogRecord;
import com.quorum.core.rules.CompiledPattern;
import com.quorum.core.store.StoreKind;
import com.quorum.core.store.StoreSnapshot;
import com.quorum.core.store.StoreVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Tactic/technique pattern detector.
 *
 * <p>
 * Every stored pattern is evaluated; each match yields its own finding scored
 * with the pattern's weight.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(PatternDetector.class);

    @Override
    public DetectorKind kind() {
        return DetectorKind.TTP;
    }

    @Override
    public StoreKind storeKind() {
        return StoreKind.PATTERN;
    }

    @Override
    public List<DetectionFinding> evaluate(NormalizedLogRecord record, StoreSnapshot snapshot) {
        Objects.requireNonNull(record, "Record must not be null");
        StoreVersion<?> store = snapshot.get(StoreKind.PATTERN);

        List<DetectionFinding> findings = new ArrayList<>();
        for (CompiledPattern pattern : snapshot.patterns().getPatterns()) {
            if (!pattern.matches(record)) {
                continue;
            }
            LOG.debug("Record [{}]: pattern [{}] matched (weight={})",
                    record.getId(), pattern.getId(), pattern.getWeight());

            Map<String, String> evidence = new TreeMap<>();
            evidence.put("technique_id", pattern.getId());
            putIfPresent(evidence, "tactic", pattern.getTactic());
            putIfPresent(evidence, "technique", pattern.getTechnique());
            putIfPresent(evidence, "description", pattern.getDescription());
            evidence.put("store_version", store.getVersion());
            findings.add(new DetectionFinding(kind(), pattern.getName(), pattern.getWeight(), evidence));
        }
        return findings;
    }

    private static void putIfPresent(Map<String, String> evidence, String key, String value) {
        if (value != null && !value.isBlank()) {
            evidence.put(key, value);
        }
    }
}
