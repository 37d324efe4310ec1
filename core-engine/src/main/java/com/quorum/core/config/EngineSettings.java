package com.quorum.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the engine YAML settings.
 *
 * <p>
 * Expected YAML structure (every key optional; defaults shown):
 * </p>
 *
 * <pre>
 * fusion:
 *   critical: 0.9
 *   corroboration: 0.6
 *   high: 0.7
 *   ttpHigh: 0.5
 *   medium: 0.4
 * anomalyScoreFloor: 0.5
 * retainedVersions: 3
 * maxPackageBytes: 16777216
 * attemptHistorySize: 50
 * publicKeyPath: /etc/quorum/update-signing.pub.pem
 * auditLogPath: /var/lib/quorum/audit.jsonl
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineSettings {

    public static final double DEFAULT_ANOMALY_SCORE_FLOOR = 0.5;
    public static final int DEFAULT_RETAINED_VERSIONS = 3;
    public static final long DEFAULT_MAX_PACKAGE_BYTES = 16L * 1024 * 1024;
    public static final int DEFAULT_ATTEMPT_HISTORY_SIZE = 50;

    private FusionSettings fusion = new FusionSettings();
    private double anomalyScoreFloor = DEFAULT_ANOMALY_SCORE_FLOOR;
    private int retainedVersions = DEFAULT_RETAINED_VERSIONS;
    private long maxPackageBytes = DEFAULT_MAX_PACKAGE_BYTES;
    private int attemptHistorySize = DEFAULT_ATTEMPT_HISTORY_SIZE;
    private String publicKeyPath;
    private String auditLogPath;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every setting, collecting all errors.
     *
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (fusion == null) {
            errors.add("'fusion' must not be null");
        } else {
            fusion.validate(errors);
        }
        if (Double.isNaN(anomalyScoreFloor) || anomalyScoreFloor < 0.0 || anomalyScoreFloor >= 1.0) {
            errors.add("'anomalyScoreFloor' must be in [0, 1), got: " + anomalyScoreFloor);
        }
        if (retainedVersions < 1) {
            errors.add("'retainedVersions' must be >= 1, got: " + retainedVersions);
        }
        if (maxPackageBytes < 1) {
            errors.add("'maxPackageBytes' must be >= 1, got: " + maxPackageBytes);
        }
        if (attemptHistorySize < 1) {
            errors.add("'attemptHistorySize' must be >= 1, got: " + attemptHistorySize);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine settings validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public FusionSettings getFusion() {
        return fusion;
    }

    public void setFusion(FusionSettings fusion) {
        this.fusion = fusion;
    }

    public double getAnomalyScoreFloor() {
        return anomalyScoreFloor;
    }

    public void setAnomalyScoreFloor(double anomalyScoreFloor) {
        this.anomalyScoreFloor = anomalyScoreFloor;
    }

    public int getRetainedVersions() {
        return retainedVersions;
    }

    public void setRetainedVersions(int retainedVersions) {
        this.retainedVersions = retainedVersions;
    }

    public long getMaxPackageBytes() {
        return maxPackageBytes;
    }

    public void setMaxPackageBytes(long maxPackageBytes) {
        this.maxPackageBytes = maxPackageBytes;
    }

    public int getAttemptHistorySize() {
        return attemptHistorySize;
    }

    public void setAttemptHistorySize(int attemptHistorySize) {
        this.attemptHistorySize = attemptHistorySize;
    }

    public String getPublicKeyPath() {
        return publicKeyPath;
    }

    public void setPublicKeyPath(String publicKeyPath) {
        this.publicKeyPath = publicKeyPath;
    }

    public String getAuditLogPath() {
        return auditLogPath;
    }

    public void setAuditLogPath(String auditLogPath) {
        this.auditLogPath = auditLogPath;
    }

    @Override
    public String toString() {
        return "EngineSettings{" +
                "fusion=" + fusion +
                ", anomalyScoreFloor=" + anomalyScoreFloor +
                ", retainedVersions=" + retainedVersions +
                ", maxPackageBytes=" + maxPackageBytes +
                ", attemptHistorySize=" + attemptHistorySize +
                ", publicKeyPath='" + publicKeyPath + '\'' +
                ", auditLogPath='" + auditLogPath + '\'' +
                '}';
    }
}
