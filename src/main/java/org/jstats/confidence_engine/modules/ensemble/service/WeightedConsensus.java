package org.jstats.confidence_engine.modules.ensemble.service;

import org.jstats.confidence_engine.core.model.ConfidenceScale;
import org.jstats.confidence_engine.modules.ensemble.model.EnsembleVerdict;
import org.jstats.confidence_engine.modules.ensemble.model.ModelVote;

import java.util.List;

/**
 * Combines per-model votes into one verdict: weighted mean probability plus a boost that
 * rewards agreement.
 */
public final class WeightedConsensus {

    /** Two of three models agreeing counts as strong consensus. */
    static final double STRONG_AGREEMENT = 2.0 / 3.0;

    private WeightedConsensus() {
    }

    public static EnsembleVerdict combine(List<ModelVote> votes) {
        if (votes.isEmpty()) {
            return EnsembleVerdict.unavailable();
        }

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        int winVotes = 0;
        for (ModelVote vote : votes) {
            weightedSum += vote.probability() * vote.weight();
            totalWeight += vote.weight();
            if (vote.predictedWin()) {
                winVotes++;
            }
        }
        double weightedProbability = totalWeight > 0 ? weightedSum / totalWeight : 0.5;

        // On a tie the first vote's class wins.
        int lossVotes = votes.size() - winVotes;
        boolean majorityWin = winVotes == lossVotes ? votes.get(0).predictedWin() : winVotes > lossVotes;
        double agreement = (double) Math.max(winVotes, lossVotes) / votes.size();

        int boost = consensusBoost(agreement);
        int confidence = ConfidenceScale.clamp(weightedProbability * 100.0 + boost);
        return new EnsembleVerdict(true, majorityWin, weightedProbability, agreement, boost, confidence, List.copyOf(votes));
    }

    static int consensusBoost(double agreement) {
        if (agreement >= 1.0) return 15;
        if (agreement >= STRONG_AGREEMENT) return 8;
        if (agreement >= 0.5) return 0;
        return -10;
    }
}
