package com.quorum.core.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One detector's positive signal on a record.
 *
 * <p>
 * Findings are immutable. Evidence is stored key-ordered so that two findings
 * built from the same inputs are equal and render identically.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionFinding {

    /**
     * Presentation order inside a verdict: score descending, then detector-kind
     * priority, then name and evidence so that the order is total.
     */
    public static final Comparator<DetectionFinding> PRESENTATION_ORDER = Comparator
            .comparingDouble(DetectionFinding::getScore).reversed()
            .thenComparing(DetectionFinding::getDetectorKind)
            .thenComparing(DetectionFinding::getName)
            .thenComparing(f -> f.getEvidence().toString());

    private final DetectorKind detectorKind;
    private final String name;
    private final double score;
    private final Map<String, String> evidence;

    /**
     * @param detectorKind producing detector kind
     * @param name         human-readable finding name
     * @param score        normalized score in [0, 1]
     * @param evidence     supporting key/value evidence; may be {@code null}
     * @throws IllegalArgumentException if {@code score} is outside [0, 1] or NaN
     */
    public DetectionFinding(DetectorKind detectorKind, String name, double score,
            Map<String, String> evidence) {
        this.detectorKind = Objects.requireNonNull(detectorKind, "detectorKind must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException(
                    "Finding score must be in [0, 1] for '" + name + "', got: " + score);
        }
        this.score = score;
        this.evidence = evidence == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(evidence));
    }

    public DetectorKind getDetectorKind() {
        return detectorKind;
    }

    public String getName() {
        return name;
    }

    public double getScore() {
        return score;
    }

    public Map<String, String> getEvidence() {
        return evidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionFinding that))
            return false;
        return Double.compare(score, that.score) == 0
                && detectorKind == that.detectorKind
                && name.equals(that.name)
                && evidence.equals(that.evidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detectorKind, name, score, evidence);
    }

    @Override
    public String toString() {
        return "DetectionFinding{" +
                "kind=" + detectorKind +
                ", name='" + name + '\'' +
                ", score=" + score +
                ", evidence=" + evidence +
                '}';
    }
}
