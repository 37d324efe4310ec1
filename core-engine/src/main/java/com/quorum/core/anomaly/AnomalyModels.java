package com.quorum.core.anomaly;

import java.util.Locale;
import java.util.Objects;

/**
 * Factory that loads {@link AnomalyModel} instances from payload definitions.
 *
 * <p>
 * The single point of extension when adding a model type: register the type
 * string here.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyModels {

    private AnomalyModels() {
        // utility class, not instantiable
    }

    /**
     * @param definition model definition; validated before loading
     * @return loaded model
     * @throws IllegalStateException if the definition is invalid
     */
    public static AnomalyModel load(AnomalyModelDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        definition.validate();
        String type = definition.getModelType().trim().toLowerCase(Locale.ROOT);
        return switch (type) {
            case LogisticZScoreModel.TYPE -> new LogisticZScoreModel(
                    definition.getFeaturizerVersion().trim(),
                    definition.getMeans(),
                    definition.getStdDevs(),
                    definition.getWeights(),
                    definition.getBias());
            default -> throw new IllegalStateException("Unknown model type: '" + definition.getModelType() + "'");
        };
    }
}
