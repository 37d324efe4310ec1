package com.quorum.core.detection;

import com.quorum.core.intel.Indicator;
import com.quorum.core.intel.IndicatorSet;
import com.quorum.core.intel.IndicatorType;
import com.quorum.core.model.DetectionFinding;
import com.quorum.core.model.DetectorKind;
import com.quorum.core.store.StoreKind;
import com.quorum.core.store.StoreSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.quorum.core.detection.DetectionFixtures.record;
import static com.quorum.core.detection.DetectionFixtures.version;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link IndicatorDetector}.
 */
class IndicatorDetectorTest {

    private IndicatorDetector detector;
    private StoreSnapshot snapshot;

    @BeforeEach
    void setUp() {
        detector = new IndicatorDetector();
        IndicatorSet indicators = IndicatorSet.of(List.of(
                new Indicator(IndicatorType.IP, "203.0.113.7", "test-feed", "known C2"),
                new Indicator(IndicatorType.DOMAIN, "Evil.Example.COM", null, null),
                new Indicator(IndicatorType.PROCESS, "mimikatz.exe", null, null)));
        snapshot = StoreSnapshot.empty().with(Map.of(
                StoreKind.INDICATOR, version(StoreKind.INDICATOR, "ioc-7", indicators)));
    }

    @Test
    @DisplayName("Should report an indicator hit with score 1.0 and evidence")
    void shouldReportIpHit() {
        List<DetectionFinding> findings = detector.evaluate(
                record("r-1", "Accepted connection from 203.0.113.7 port 443"), snapshot);

        assertThat(findings).hasSize(1);
        DetectionFinding finding = findings.get(0);
        assertThat(finding.getDetectorKind()).isEqualTo(DetectorKind.IOC);
        assertThat(finding.getName()).isEqualTo("Malicious IP Detected");
        assertThat(finding.getScore()).isEqualTo(1.0);
        assertThat(finding.getEvidence())
                .containsEntry("indicator", "203.0.113.7")
                .containsEntry("indicator_type", "ip")
                .containsEntry("field", "raw_message")
                .containsEntry("source", "test-feed")
                .containsEntry("description", "known C2")
                .containsEntry("store_version", "ioc-7");
    }

    @Test
    @DisplayName("Should match domains case-insensitively")
    void shouldMatchDomainCaseInsensitively() {
        List<DetectionFinding> findings = detector.evaluate(
                record("r-2", "DNS query for EVIL.example.com"), snapshot);

        assertThat(findings).extracting(DetectionFinding::getName).containsExactly("Malicious Domain Detected");
        assertThat(findings.get(0).getEvidence()).doesNotContainKey("source");
    }

    @Test
    @DisplayName("Should match a process by its base name from a structured field")
    void shouldMatchProcessBaseName() {
        List<DetectionFinding> findings = detector.evaluate(
                record("r-3", "process started", Map.of("process", "C:\\Tools\\MIMIKATZ.EXE")), snapshot);

        assertThat(findings).extracting(DetectionFinding::getName).contains("Malicious Process Detected");
        assertThat(findings).filteredOn(f -> f.getName().equals("Malicious Process Detected"))
                .singleElement()
                .satisfies(f -> assertThat(f.getEvidence()).containsEntry("field", "process"));
    }

    @Test
    @DisplayName("Should NOT fire when no atom is a known indicator")
    void shouldNotFireWithoutHit() {
        assertThat(detector.evaluate(record("r-4", "connection from 198.51.100.1"), snapshot)).isEmpty();
    }
}
