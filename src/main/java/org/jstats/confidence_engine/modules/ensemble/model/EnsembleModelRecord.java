package org.jstats.confidence_engine.modules.ensemble.model;

import org.jstats.confidence_engine.core.model.BetCategory;

import java.time.OffsetDateTime;
import java.util.Map;

public record EnsembleModelRecord(
        ModelFamily family,
        BetCategory category,
        String artifactPath,
        String schemaSignature,
        double accuracy,
        double precision,
        double recall,
        double f1,
        Map<String, Double> featureImportance,
        int sampleCount,
        OffsetDateTime trainedAt
) {
}
