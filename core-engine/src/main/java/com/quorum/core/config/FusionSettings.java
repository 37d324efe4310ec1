package com.quorum.core.config;

import com.quorum.core.detection.FusionThresholds;

import java.util.ArrayList;
import java.util.List;

/**
 * Calibratable severity-fusion thresholds as written in the YAML settings.
 *
 * <pre>
 * fusion:
 *   critical: 0.9
 *   corroboration: 0.6
 *   high: 0.7
 *   ttpHigh: 0.5
 *   medium: 0.4
 * </pre>
 *
 * @since 1.0.0
 */
public class FusionSettings {

    private double critical = FusionThresholds.DEFAULT_CRITICAL;
    private double corroboration = FusionThresholds.DEFAULT_CORROBORATION;
    private double high = FusionThresholds.DEFAULT_HIGH;
    private double ttpHigh = FusionThresholds.DEFAULT_TTP_HIGH;
    private double medium = FusionThresholds.DEFAULT_MEDIUM;

    /**
     * @param errors collector for validation messages
     */
    void validate(List<String> errors) {
        List<String> local = new ArrayList<>();
        checkUnit("critical", critical, local);
        checkUnit("corroboration", corroboration, local);
        checkUnit("high", high, local);
        checkUnit("ttpHigh", ttpHigh, local);
        checkUnit("medium", medium, local);
        if (local.isEmpty() && !(medium <= high && high <= critical)) {
            local.add("fusion thresholds must satisfy medium <= high <= critical");
        }
        errors.addAll(local);
    }

    private static void checkUnit(String name, double value, List<String> errors) {
        if (Double.isNaN(value) || value <= 0.0 || value > 1.0) {
            errors.add("fusion." + name + " must be in (0, 1], got: " + value);
        }
    }

    /**
     * @return immutable thresholds for the fusion step
     */
    public FusionThresholds toThresholds() {
        return new FusionThresholds(critical, corroboration, high, ttpHigh, medium);
    }

    public double getCritical() {
        return critical;
    }

    public void setCritical(double critical) {
        this.critical = critical;
    }

    public double getCorroboration() {
        return corroboration;
    }

    public void setCorroboration(double corroboration) {
        this.corroboration = corroboration;
    }

    public double getHigh() {
        return high;
    }

    public void setHigh(double high) {
        this.high = high;
    }

    public double getTtpHigh() {
        return ttpHigh;
    }

    public void setTtpHigh(double ttpHigh) {
        this.ttpHigh = ttpHigh;
    }

    public double getMedium() {
        return medium;
    }

    public void setMedium(double medium) {
        this.medium = medium;
    }

    @Override
    public String toString() {
        return "FusionSettings{critical=" + critical + ", corroboration=" + corroboration
                + ", high=" + high + ", ttpHigh=" + ttpHigh + ", medium=" + medium + '}';
    }
}
