package com.quorum.core.detection;

/**
 * Calibration constants for {@link SeverityFusion}.
 *
 * @since 1.0.0
 */
public final class FusionThresholds {

    public static final double DEFAULT_CRITICAL = 0.9;
    public static final double DEFAULT_CORROBORATION = 0.6;
    public static final double DEFAULT_HIGH = 0.7;
    public static final double DEFAULT_TTP_HIGH = 0.5;
    public static final double DEFAULT_MEDIUM = 0.4;

    private final double critical;
    private final double corroboration;
    private final double high;
    private final double ttpHigh;
    private final double medium;

    /**
     * @param critical      single-finding score that makes a record critical
     * @param corroboration per-kind score at which two distinct kinds make a
     *                      record critical
     * @param high          single-finding score that makes a record high
     * @param ttpHigh       ttp finding score that makes a record high
     * @param medium        single-finding score that makes a record medium
     * @throws IllegalArgumentException if a value is outside (0, 1] or the
     *                                  tiers are out of order
     */
    public FusionThresholds(double critical, double corroboration, double high, double ttpHigh, double medium) {
        requireUnit("critical", critical);
        requireUnit("corroboration", corroboration);
        requireUnit("high", high);
        requireUnit("ttpHigh", ttpHigh);
        requireUnit("medium", medium);
        if (!(medium <= high && high <= critical)) {
            throw new IllegalArgumentException(
                    "Thresholds must satisfy medium <= high <= critical, got: "
                            + medium + ", " + high + ", " + critical);
        }
        this.critical = critical;
        this.corroboration = corroboration;
        this.high = high;
        this.ttpHigh = ttpHigh;
        this.medium = medium;
    }

    public static FusionThresholds defaults() {
        return new FusionThresholds(DEFAULT_CRITICAL, DEFAULT_CORROBORATION, DEFAULT_HIGH,
                DEFAULT_TTP_HIGH, DEFAULT_MEDIUM);
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value <= 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " threshold must be in (0, 1], got: " + value);
        }
    }

    public double getCritical() {
        return critical;
    }

    public double getCorroboration() {
        return corroboration;
    }

    public double getHigh() {
        return high;
    }

    public double getTtpHigh() {
        return ttpHigh;
    }

    public double getMedium() {
        return medium;
    }

    @Override
    public String toString() {
        return "FusionThresholds{critical=" + critical + ", corroboration=" + corroboration
                + ", high=" + high + ", ttpHigh=" + ttpHigh + ", medium=" + medium + '}';
    }
}
