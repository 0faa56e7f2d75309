package org.jstats.confidence_engine.modules.orchestrator.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.ConfidenceScale;
import org.springframework.stereotype.Component;

/**
 * Expected value and fractional-Kelly stake for a confidence at given decimal odds.
 */
@Component
@NullMarked
public class StakeCalculator {

    private final EngineProperties.Staking settings;

    public StakeCalculator(EngineProperties properties) {
        this.settings = properties.staking();
    }

    /** {@code (p * odds - 1) * 100}, one decimal. */
    public double expectedValue(int confidence, double odds) {
        double ev = (confidence / 100.0 * odds - 1.0) * 100.0;
        return Math.round(ev * 10.0) / 10.0;
    }

    /**
     * Percent of bankroll: the Kelly fraction {@code (p * odds - 1) / (odds - 1)} scaled by the
     * configured multiplier and capped. Zero for odds of 1.0 or less, or for a
     * non-positive edge.
     */
    public double stakePercent(int confidence, double odds) {
        if (odds <= 1.0) {
            return 0.0;
        }
        double p = confidence / 100.0;
        double kelly = (p * odds - 1.0) / (odds - 1.0);
        if (kelly <= 0) {
            return 0.0;
        }
        double stake = ConfidenceScale.clamp(kelly * settings.kellyFraction() * 100.0, 0.0, settings.maxStakePercent());
        return Math.round(stake * 100.0) / 100.0;
    }
}
