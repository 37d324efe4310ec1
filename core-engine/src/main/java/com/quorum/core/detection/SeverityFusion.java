package com.quorum.core.detection;

import com.quorum.core.model.DetectionFinding;
import com.quorum.core.model.DetectorKind;
import com.quorum.core.model.Severity;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Combines a record's findings into one severity.
 *
 * <p>
 * The result depends only on the set of (kind, score) pairs, never on their
 * order. Raising any score or adding a finding never lowers the result.
 * </p>
 *
 * <ul>
 * <li>{@code CRITICAL}: any score &ge; critical, or two distinct detector kinds
 * each with a score &ge; corroboration</li>
 * <li>{@code HIGH}: any score &ge; high, or a ttp score &ge; ttpHigh</li>
 * <li>{@code MEDIUM}: any score &ge; medium</li>
 * <li>{@code LOW}: any score above zero</li>
 * <li>{@code NONE}: otherwise</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class SeverityFusion {

    private final FusionThresholds thresholds;

    public SeverityFusion(FusionThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
    }

    /**
     * @param findings findings for one record; may be empty
     * @return fused severity
     */
    public Severity fuse(Collection<DetectionFinding> findings) {
        Objects.requireNonNull(findings, "findings must not be null");

        double max = 0.0;
        double maxTtp = 0.0;
        Set<DetectorKind> corroborating = EnumSet.noneOf(DetectorKind.class);
        for (DetectionFinding finding : findings) {
            double score = finding.getScore();
            max = Math.max(max, score);
            if (finding.getDetectorKind() == DetectorKind.TTP) {
                maxTtp = Math.max(maxTtp, score);
            }
            if (score >= thresholds.getCorroboration()) {
                corroborating.add(finding.getDetectorKind());
            }
        }

        if (max >= thresholds.getCritical() || corroborating.size() >= 2) {
            return Severity.CRITICAL;
        }
        if (max >= thresholds.getHigh() || maxTtp >= thresholds.getTtpHigh()) {
            return Severity.HIGH;
        }
        if (max >= thresholds.getMedium()) {
            return Severity.MEDIUM;
        }
        if (max > 0.0) {
            return Severity.LOW;
        }
        return Severity.NONE;
    }

    public FusionThresholds getThresholds() {
        return thresholds;
    }
}
