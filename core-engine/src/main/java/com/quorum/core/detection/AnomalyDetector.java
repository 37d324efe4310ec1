package com.quorum.core.detection;

import com.quorum.core.anomaly.AnomalyModel;
import com.quorum.core.anomaly.FeatureExtractor;
import com.quorum.core.model.DetectionFinding;
import com.quorum.core.model.DetectorKind;
import com.quorum.core.model.NormalizedLogRecord;
import com.quorum.core.store.StoreKind;
import com.quorum.core.store.StoreSnapshot;
import com.quorum.core.store.StoreVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Anomaly detector.
 *
 * <p>
 * Featurizes the record and scores it with the active anomaly model. A single
 * finding is produced when the score strictly exceeds the configured floor.
 * The model is never updated from observed records.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    static final String FINDING_NAME = "Statistical Anomaly";

    private final double scoreFloor;

    /**
     * @param scoreFloor scores at or below this value produce no finding
     * @throws IllegalArgumentException if {@code scoreFloor} is outside [0, 1)
     */
    public AnomalyDetector(double scoreFloor) {
        if (Double.isNaN(scoreFloor) || scoreFloor < 0.0 || scoreFloor >= 1.0) {
            throw new IllegalArgumentException("Anomaly score floor must be in [0, 1), got: " + scoreFloor);
        }
        this.scoreFloor = scoreFloor;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.ANOMALY;
    }

    @Override
    public StoreKind storeKind() {
        return StoreKind.ANOMALY_MODEL;
    }

    @Override
    public List<DetectionFinding> evaluate(NormalizedLogRecord record, StoreSnapshot snapshot) {
        Objects.requireNonNull(record, "Record must not be null");
        StoreVersion<?> store = snapshot.get(StoreKind.ANOMALY_MODEL);
        AnomalyModel model = snapshot.anomalyModel();

        if (!FeatureExtractor.VERSION.equals(model.featurizerVersion())) {
            throw new IllegalStateException("Anomaly model " + store.getVersion()
                    + " expects featurizer " + model.featurizerVersion()
                    + " but " + FeatureExtractor.VERSION + " is active");
        }

        double score = model.score(FeatureExtractor.extract(record));
        if (score <= scoreFloor) {
            LOG.trace("Record [{}]: anomaly score {} at or below floor {}", record.getId(), score, scoreFloor);
            return List.of();
        }

        LOG.debug("Record [{}]: anomaly score {} > floor {}", record.getId(), score, scoreFloor);
        Map<String, String> evidence = new TreeMap<>();
        evidence.put("featurizer", FeatureExtractor.VERSION);
        evidence.put("model_version", store.getVersion());
        evidence.put("raw_score", String.format(Locale.ROOT, "%.4f", score));
        return List.of(new DetectionFinding(kind(), FINDING_NAME, score, evidence));
    }

    public double getScoreFloor() {
        return scoreFloor;
    }
}
