package org.jstats.confidence_engine.modules.conditions.model;

import java.util.List;

/**
 * @param total   the clamped sum of weighted per-condition adjustments
 * @param reasons human-readable explanation per contributing condition
 */
public record ConditionAdjustment(int total, List<String> reasons) {

    public static ConditionAdjustment none() {
        return new ConditionAdjustment(0, List.of());
    }
}
