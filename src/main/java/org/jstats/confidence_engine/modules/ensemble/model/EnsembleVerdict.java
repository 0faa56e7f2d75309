package org.jstats.confidence_engine.modules.ensemble.model;

import org.jstats.confidence_engine.core.model.ConfidenceScale;

import java.util.List;

/**
 * Weighted consensus of every available model for one match.
 *
 * @param weightedProbability {@code Σ p_i w_i / Σ w_i} over all voting models
 * @param agreement           share of models voting for the majority class
 * @param consensusBoost      points added for (dis)agreement before clamping
 * @param confidence          confidence in the majority class, in [30, 95]
 */
public record EnsembleVerdict(
        boolean available,
        boolean predictedWin,
        double weightedProbability,
        double agreement,
        int consensusBoost,
        int confidence,
        List<ModelVote> votes
) {

    public static EnsembleVerdict unavailable() {
        return new EnsembleVerdict(false, false, 0.0, 0.0, 0, 0, List.of());
    }

    /**
     * Confidence that the bet wins. When the majority predicts a loss the complement is used,
     * so a confident "no" pulls the blended figure down.
     */
    public int winConfidence() {
        return predictedWin ? confidence : ConfidenceScale.clamp(100.0 - confidence);
    }
}
