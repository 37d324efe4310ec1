package com.quorum.core.detection;

import com.quorum.core.model.DetectionFinding;
import com.quorum.core.model.DetectorKind;
import com.quorum.core.model.NormalizedLogRecord;
import com.quorum.core.rules.CompiledRule;
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
 * Declarative rule detector. Each matching rule emits one finding whose score
 * is the rule's declared weight.
 *
 * @since 1.0.0
 */
public class RuleDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(RuleDetector.class);

    @Override
    public DetectorKind kind() {
        return DetectorKind.RULE;
    }

    @Override
    public StoreKind storeKind() {
        return StoreKind.RULE;
    }

    @Override
    public List<DetectionFinding> evaluate(NormalizedLogRecord record, StoreSnapshot snapshot) {
        Objects.requireNonNull(record, "Record must not be null");
        StoreVersion<?> store = snapshot.get(StoreKind.RULE);

        List<DetectionFinding> findings = new ArrayList<>();
        for (CompiledRule rule : snapshot.rules().getRules()) {
            if (!rule.matches(record)) {
                continue;
            }
            LOG.debug("Record [{}]: rule [{}] matched (weight={})", record.getId(), rule.getId(), rule.getWeight());

            Map<String, String> evidence = new TreeMap<>();
            evidence.put("rule_id", rule.getId());
            if (rule.getDescription() != null && !rule.getDescription().isBlank()) {
                evidence.put("description", rule.getDescription());
            }
            if (!rule.getTags().isEmpty()) {
                evidence.put("tags", String.join(",", rule.getTags()));
            }
            evidence.put("store_version", store.getVersion());
            findings.add(new DetectionFinding(kind(), rule.getTitle(), rule.getWeight(), evidence));
        }
        return findings;
    }
}
