package com.quorum.core.anomaly;

import java.util.Arrays;
import java.util.Objects;

/**
 * Logistic model over standardized features.
 *
 * <p>
 * {@code score = sigmoid(bias + sum(w[i] * (x[i] - mean[i]) / stdDev[i]))}.
 * The sigmoid keeps the score in [0, 1] whatever the inputs.
 * </p>
 *
 * @since 1.0.0
 */
public final class LogisticZScoreModel implements AnomalyModel {

    public static final String TYPE = "logistic-zscore";

    private final String featurizerVersion;
    private final double[] means;
    private final double[] stdDevs;
    private final double[] weights;
    private final double bias;

    public LogisticZScoreModel(String featurizerVersion, double[] means, double[] stdDevs,
            double[] weights, double bias) {
        this.featurizerVersion = Objects.requireNonNull(featurizerVersion, "featurizerVersion must not be null");
        this.means = means.clone();
        this.stdDevs = stdDevs.clone();
        this.weights = weights.clone();
        this.bias = bias;
        if (this.means.length != this.stdDevs.length || this.means.length != this.weights.length) {
            throw new IllegalArgumentException("means, stdDevs and weights must have equal length");
        }
        for (double sd : this.stdDevs) {
            if (!(sd > 0.0) || Double.isInfinite(sd)) {
                throw new IllegalArgumentException("stdDevs must be finite and > 0, got: " + sd);
            }
        }
    }

    @Override
    public String featurizerVersion() {
        return featurizerVersion;
    }

    @Override
    public int dimension() {
        return means.length;
    }

    @Override
    public double score(double[] features) {
        if (features.length != means.length) {
            throw new IllegalArgumentException(
                    "Expected " + means.length + " features, got: " + features.length);
        }
        double z = bias;
        for (int i = 0; i < features.length; i++) {
            z += weights[i] * (features[i] - means[i]) / stdDevs[i];
        }
        double score = 1.0 / (1.0 + Math.exp(-z));
        return Double.isNaN(score) ? 0.0 : score;
    }

    @Override
    public String toString() {
        return "LogisticZScoreModel{featurizer='" + featurizerVersion + "', bias=" + bias
                + ", weights=" + Arrays.toString(weights) + '}';
    }
}
