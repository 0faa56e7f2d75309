package org.jstats.confidence_engine.modules.orchestrator.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.jstats.confidence_engine.core.model.BetCategory;

import java.util.Map;

/**
 * @param matchRef      caller's match identifier, used to deduplicate repeated recommendations
 * @param odds          quoted decimal odds, strictly above 1.0 since a stake is computed
 */
public record RecommendationRequest(
        @Size(max = 64) String matchRef,
        @NotNull BetCategory category,
        @Min(0) @Max(100) int rawConfidence,
        Map<String, Object> features,
        @DecimalMin(value = "1.0", inclusive = false) double odds
) {}
