package org.jstats.confidence_engine.modules.orchestrator.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.jstats.confidence_engine.core.model.BetCategory;

import java.util.Map;

/**
 * @param rawConfidence upstream confidence in percent
 * @param features      feature map keyed by schema field name; unknown keys are ignored
 * @param odds          quoted decimal odds
 */
public record FinalizeRequest(
        @NotNull BetCategory category,
        @Min(0) @Max(100) int rawConfidence,
        Map<String, Object> features,
        @DecimalMin("1.0") double odds
) {}
