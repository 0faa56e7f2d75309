package org.jstats.confidence_engine.modules.conditions.model;

import org.jstats.confidence_engine.core.model.BetCategory;

/**
 * Win/loss history of one named condition within one category.
 */
public record ConditionRecord(
        BetCategory category,
        String condition,
        int total,
        int wins,
        int losses,
        double avgConfidenceWhenFailed,
        int suggestedAdjustment
) {

    public static final int MIN_SUGGESTED = -20;
    public static final int MAX_SUGGESTED = 10;

    /**
     * {@code round((winRate - 0.5) * 30)} capped to [-20, 10]: penalties may run twice as deep
     * as boosts.
     */
    public static int suggestedAdjustment(int wins, int total) {
        if (total <= 0) {
            return 0;
        }
        long raw = Math.round(((double) wins / total - 0.5) * 30.0);
        return (int) Math.max(MIN_SUGGESTED, Math.min(MAX_SUGGESTED, raw));
    }

    public double winRate() {
        return total == 0 ? 0.0 : (double) wins / total;
    }
}
