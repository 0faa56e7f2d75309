package org.jstats.confidence_engine.modules.orchestrator.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.jstats.confidence_engine.core.model.BetCategory;

import java.util.Map;

/**
 * A settled bet reported back for learning.
 *
 * @param stake amount staked, in the same unit the ROI totals are kept in
 */
public record OutcomeRequest(
        long predictionId,
        @NotNull BetCategory category,
        Map<String, Object> features,
        @Min(0) @Max(100) int rawConfidence,
        @DecimalMin("1.0") double odds,
        @DecimalMin("0.0") double stake,
        @NotNull Outcome outcome
) {}
