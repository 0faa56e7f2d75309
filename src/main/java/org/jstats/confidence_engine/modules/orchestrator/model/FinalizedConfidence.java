package org.jstats.confidence_engine.modules.orchestrator.model;

import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.ensemble.model.EnsembleVerdict;

import java.util.List;

/**
 * @param expectedValue percent return per unit staked at the quoted odds
 * @param stakePercent  suggested stake as a percent of bankroll
 */
public record FinalizedConfidence(
        BetCategory category,
        int rawConfidence,
        int confidence,
        double expectedValue,
        double stakePercent,
        EnsembleVerdict ensemble,
        List<AuditStep> auditTrail
) {
}
