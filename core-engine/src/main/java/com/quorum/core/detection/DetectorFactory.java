package com.quorum.core.detection;

import com.quorum.core.config.EngineSettings;
import com.quorum.core.model.DetectorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link Detector} instances from
 * {@link EngineSettings}.
 *
 * <p>
 * This is the single point of extension when adding a detection technique:
 * add a {@link DetectorKind} constant and create the corresponding detector
 * here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create the detector for one kind.
     *
     * @param kind     detector kind; must not be {@code null}
     * @param settings engine settings; must not be {@code null}
     * @return a new detector
     */
    public static Detector create(DetectorKind kind, EngineSettings settings) {
        Objects.requireNonNull(kind, "Detector kind must not be null");
        Objects.requireNonNull(settings, "Engine settings must not be null");

        return switch (kind) {
            case IOC -> new IndicatorDetector();
            case TTP -> new PatternDetector();
            case RULE -> new RuleDetector();
            case ANOMALY -> new AnomalyDetector(settings.getAnomalyScoreFloor());
        };
    }

    /**
     * Create one detector per {@link DetectorKind}, in declaration order.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong>.
     * </p>
     *
     * @param settings engine settings; must not be {@code null}
     * @return unmodifiable list of detectors
     */
    public static List<Detector> createAll(EngineSettings settings) {
        Objects.requireNonNull(settings, "Engine settings must not be null");
        LOG.info("Creating {} detector(s) (anomaly floor={})",
                DetectorKind.values().length, settings.getAnomalyScoreFloor());
        List<Detector> detectors = Arrays.stream(DetectorKind.values())
                .map(kind -> create(kind, settings))
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
