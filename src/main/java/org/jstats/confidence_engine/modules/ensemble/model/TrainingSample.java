package org.jstats.confidence_engine.modules.ensemble.model;

import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.features.model.FeatureVector;

/**
 * One labeled row of the training set: the features a prediction was made with and whether
 * the bet won.
 */
public record TrainingSample(
        long predictionId,
        BetCategory category,
        FeatureVector features,
        String schemaSignature,
        boolean won
) {
}
