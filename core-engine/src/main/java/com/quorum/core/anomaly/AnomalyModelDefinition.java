package com.quorum.core.anomaly;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * JSON payload of an anomaly-model update.
 *
 * <pre>
 * {"featurizerVersion": "quorum-features/1", "modelType": "logistic-zscore",
 *  "means": [...], "stdDevs": [...], "weights": [...], "bias": -4.0}
 * </pre>
 *
 * @since 1.0.0
 */
public class AnomalyModelDefinition {

    private String featurizerVersion;
    private String modelType;
    private double[] means;
    private double[] stdDevs;
    private double[] weights;
    private double bias;

    /**
     * Validate that the model can be loaded by this engine.
     *
     * <p>
     * A featurizer version other than {@link FeatureExtractor#VERSION} is
     * rejected rather than guessed compatible.
     * </p>
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (featurizerVersion == null || featurizerVersion.isBlank()) {
            errors.add("'featurizerVersion' is required");
        } else if (!FeatureExtractor.VERSION.equals(featurizerVersion.trim())) {
            errors.add("featurizer version '" + featurizerVersion + "' is not supported (engine provides '"
                    + FeatureExtractor.VERSION + "')");
        }
        if (modelType == null || modelType.isBlank()) {
            errors.add("'modelType' is required");
        } else if (!LogisticZScoreModel.TYPE.equals(modelType.trim().toLowerCase(Locale.ROOT))) {
            errors.add("Unknown model type: '" + modelType + "'. Supported: " + LogisticZScoreModel.TYPE);
        }
        checkVector("means", means, errors);
        checkVector("stdDevs", stdDevs, errors);
        checkVector("weights", weights, errors);
        if (stdDevs != null) {
            for (int i = 0; i < stdDevs.length; i++) {
                if (!(stdDevs[i] > 0.0)) {
                    errors.add("stdDevs[" + i + "] must be > 0, got: " + stdDevs[i]);
                }
            }
        }
        if (Double.isNaN(bias) || Double.isInfinite(bias)) {
            errors.add("'bias' must be finite");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid anomaly model: " + String.join("; ", errors));
        }
    }

    private static void checkVector(String name, double[] vector, List<String> errors) {
        if (vector == null) {
            errors.add("'" + name + "' is required");
            return;
        }
        if (vector.length != FeatureExtractor.DIMENSION) {
            errors.add("'" + name + "' must have " + FeatureExtractor.DIMENSION + " values, got: "
                    + vector.length);
        }
        for (double v : vector) {
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                errors.add("'" + name + "' contains a non-finite value");
                return;
            }
        }
    }

    public String getFeaturizerVersion() {
        return featurizerVersion;
    }

    public void setFeaturizerVersion(String featurizerVersion) {
        this.featurizerVersion = featurizerVersion;
    }

    public String getModelType() {
        return modelType;
    }

    public void setModelType(String modelType) {
        this.modelType = modelType;
    }

    public double[] getMeans() {
        return means;
    }

    public void setMeans(double[] means) {
        this.means = means;
    }

    public double[] getStdDevs() {
        return stdDevs;
    }

    public void setStdDevs(double[] stdDevs) {
        this.stdDevs = stdDevs;
    }

    public double[] getWeights() {
        return weights;
    }

    public void setWeights(double[] weights) {
        this.weights = weights;
    }

    public double getBias() {
        return bias;
    }

    public void setBias(double bias) {
        this.bias = bias;
    }
}
