package org.jstats.confidence_engine.modules.orchestrator.model;

import org.jspecify.annotations.Nullable;
import org.jstats.confidence_engine.core.model.BetCategory;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * An issued recommendation together with the figures it was issued with.
 *
 * @param owner                session id of the requester, or {@code system} for autonomous alerts
 * @param ensemblePredictedWin the ensemble's majority class at issue time, null when no model was available
 */
public record Prediction(
        long id,
        String owner,
        @Nullable String matchRef,
        BetCategory category,
        Map<String, Double> features,
        double odds,
        int rawConfidence,
        int confidence,
        double stakePercent,
        double expectedValue,
        @Nullable Boolean ensemblePredictedWin,
        Outcome outcome,
        OffsetDateTime createdAt,
        @Nullable OffsetDateTime settledAt
) {
}
