package org.jstats.confidence_engine.modules.roi.model;

import org.jstats.confidence_engine.core.model.BetCategory;

/**
 * Running profit and loss of every settled bet sharing one condition key within a category.
 */
public record RoiRecord(
        BetCategory category,
        String conditionKey,
        int totalBets,
        int wins,
        int losses,
        double totalStaked,
        double totalReturned,
        double roiPercent,
        double avgOdds,
        double avgEv
) {

    /** Reserved key every settled bet is also recorded under. */
    public static final String OVERALL = "overall";
}
