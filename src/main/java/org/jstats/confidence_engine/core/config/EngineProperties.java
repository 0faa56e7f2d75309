package org.jstats.confidence_engine.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Thresholds and tuning knobs for every learning layer, bound from {@code engine.*}.
 */
@ConfigurationProperties(prefix = "engine")
public record EngineProperties(
        @DefaultValue Calibration calibration,
        @DefaultValue Patterns patterns,
        @DefaultValue Conditions conditions,
        @DefaultValue Roi roi,
        @DefaultValue Ensemble ensemble,
        @DefaultValue Staking staking) {

    public record Calibration(
            @DefaultValue("10") int minSamples,
            @DefaultValue("0.65") double minFactor,
            @DefaultValue("1.35") double maxFactor) {}

    public record Patterns(
            @DefaultValue("5") int minSamples,
            @DefaultValue("15") int maxAdjustment) {}

    public record Conditions(
            @DefaultValue("5") int minSamples,
            @DefaultValue("3") int minAbsAdjustment,
            @DefaultValue("20") int fullTrustSamples,
            @DefaultValue("-25") int minTotal,
            @DefaultValue("15") int maxTotal) {}

    public record Roi(
            @DefaultValue("15") int minBets) {}

    /**
     * @param minSamples          labeled rows required before a category can be trained
     * @param trainFraction       share of rows used for fitting, the rest is the hold-out
     * @param modelDir            directory holding serialized model artifacts
     * @param cacheTtl            how long a loaded ensemble is served before it is reloaded
     * @param retrainGrowthFactor retrain once labeled rows exceed this multiple of the last training size
     * @param driftWindow         number of most recent settled predictions used for drift detection
     * @param driftTolerance      accuracy drop, in percentage points, that triggers a retrain
     */
    public record Ensemble(
            @DefaultValue("50") int minSamples,
            @DefaultValue("0.8") double trainFraction,
            @DefaultValue("42") long seed,
            @DefaultValue("ml_models") String modelDir,
            @DefaultValue("1h") Duration cacheTtl,
            @DefaultValue("1.2") double retrainGrowthFactor,
            @DefaultValue("20") int driftWindow,
            @DefaultValue("15") double driftTolerance) {}

    public record Staking(
            @DefaultValue("0.5") double blendWeight,
            @DefaultValue("15") int maxBlendAdjustment,
            @DefaultValue("0.25") double kellyFraction,
            @DefaultValue("10") double maxStakePercent) {}

    /** The same values the binder falls back to when nothing is configured. */
    public static EngineProperties defaults() {
        return new EngineProperties(
                new Calibration(10, 0.65, 1.35),
                new Patterns(5, 15),
                new Conditions(5, 3, 20, -25, 15),
                new Roi(15),
                new Ensemble(50, 0.8, 42L, "ml_models", Duration.ofHours(1), 1.2, 20, 15.0),
                new Staking(0.5, 15, 0.25, 10.0));
    }
}
