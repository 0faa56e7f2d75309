package org.jstats.confidence_engine.modules.ensemble.model;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Outcome of fitting one family. Metrics are hold-out figures and are zero unless
 * {@link TrainingStatus#TRAINED}.
 */
public record FamilyResult(
        ModelFamily family,
        TrainingStatus status,
        @Nullable String message,
        double accuracy,
        double precision,
        double recall,
        double f1,
        Map<String, Double> topFeatures
) {

    public static FamilyResult insufficientData(ModelFamily family, String message) {
        return new FamilyResult(family, TrainingStatus.INSUFFICIENT_DATA, message, 0, 0, 0, 0, Map.of());
    }

    public static FamilyResult failed(ModelFamily family, String message) {
        return new FamilyResult(family, TrainingStatus.FAILED, message, 0, 0, 0, 0, Map.of());
    }
}
