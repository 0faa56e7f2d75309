package org.jstats.confidence_engine.modules.orchestrator.service;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.core.model.ConfidenceScale;
import org.jstats.confidence_engine.modules.calibration.service.ConfidenceCalibrator;
import org.jstats.confidence_engine.modules.conditions.service.ConditionalErrorLearner;
import org.jstats.confidence_engine.modules.ensemble.model.EnsembleVerdict;
import org.jstats.confidence_engine.modules.ensemble.service.EnsembleVoter;
import org.jstats.confidence_engine.modules.features.model.FeatureVector;
import org.jstats.confidence_engine.modules.features.service.FeatureCodec;
import org.jstats.confidence_engine.modules.orchestrator.model.AuditStep;
import org.jstats.confidence_engine.modules.orchestrator.model.FinalizedConfidence;
import org.jstats.confidence_engine.modules.patterns.service.CoarsePatternLearner;
import org.jstats.confidence_engine.modules.roi.service.RoiLearner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a raw confidence through the correction chain in a fixed order: ensemble blend,
 * calibration, coarse pattern, conditional error, ROI. Every stage re-clamps to [30, 95].
 */
@Service
@NullMarked
public class ConfidenceOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceOrchestrator.class);

    private final FeatureCodec codec;
    private final EnsembleVoter voter;
    private final ConfidenceCalibrator calibrator;
    private final CoarsePatternLearner patterns;
    private final ConditionalErrorLearner conditions;
    private final RoiLearner roi;
    private final StakeCalculator stakes;
    private final EngineProperties.Staking settings;

    public ConfidenceOrchestrator(
            FeatureCodec codec,
            EnsembleVoter voter,
            ConfidenceCalibrator calibrator,
            CoarsePatternLearner patterns,
            ConditionalErrorLearner conditions,
            RoiLearner roi,
            StakeCalculator stakes,
            EngineProperties properties) {
        this.codec = codec;
        this.voter = voter;
        this.calibrator = calibrator;
        this.patterns = patterns;
        this.conditions = conditions;
        this.roi = roi;
        this.stakes = stakes;
        this.settings = properties.staking();
    }

    public FinalizedConfidence finalizeConfidence(
            BetCategory category,
            int rawConfidence,
            @Nullable Map<String, ?> features,
            double odds) {
        return finalizeConfidence(category, rawConfidence, codec.encode(features), odds);
    }

    public FinalizedConfidence finalizeConfidence(
            BetCategory category,
            int rawConfidence,
            FeatureVector features,
            double odds) {
        if (rawConfidence < 0 || rawConfidence > 100) {
            throw new IllegalArgumentException("Raw confidence must be within 0-100, got " + rawConfidence);
        }

        List<AuditStep> trail = new ArrayList<>();
        int current = rawConfidence;

        EnsembleVerdict verdict = voter.predict(features, category);
        if (verdict.available()) {
            int ml = verdict.winConfidence();
            double adjustment = ConfidenceScale.clamp(
                    (ml - rawConfidence) * settings.blendWeight(),
                    -settings.maxBlendAdjustment(),
                    settings.maxBlendAdjustment());
            int blended = ConfidenceScale.clamp(rawConfidence + adjustment);
            trail.add(new AuditStep("ensemble", current, blended,
                    "ml %d (agreement %.2f, boost %+d), adjustment %+.1f".formatted(
                            ml, verdict.agreement(), verdict.consensusBoost(), adjustment)));
            current = blended;
        } else {
            trail.add(new AuditStep("ensemble", current, current, "no trained ensemble"));
        }

        int calibrated = calibrator.calibrate(category, current);
        trail.add(new AuditStep("calibration", current, calibrated, "band factor"));
        current = calibrated;

        String pattern = patterns.detectPattern(features, category);
        int patternAdjustment = patterns.adjustment(pattern);
        int afterPattern = ConfidenceScale.clamp((double) current + patternAdjustment);
        trail.add(new AuditStep("pattern", current, afterPattern, "%s %+d".formatted(pattern, patternAdjustment)));
        current = afterPattern;

        var conditionAdjustment = conditions.aggregateAdjustment(category, features);
        int afterConditions = ConfidenceScale.clamp((double) current + conditionAdjustment.total());
        trail.add(new AuditStep("conditions", current, afterConditions,
                conditionAdjustment.reasons().isEmpty() ? "none" : String.join("; ", conditionAdjustment.reasons())));
        current = afterConditions;

        var roiAdjustment = roi.adjustment(category);
        int afterRoi = ConfidenceScale.clamp((double) current + roiAdjustment.delta());
        trail.add(new AuditStep("roi", current, afterRoi,
                roiAdjustment.reason() == null ? "not enough settled bets" : roiAdjustment.reason()));
        current = afterRoi;

        double ev = stakes.expectedValue(current, odds);
        double stake = stakes.stakePercent(current, odds);

        if (log.isDebugEnabled()) {
            log.debug("Finalized {} {} -> {} (ev={} stake={}%): {}", category.code(), rawConfidence, current, ev, stake, trail);
        }
        return new FinalizedConfidence(category, rawConfidence, current, ev, stake, verdict, List.copyOf(trail));
    }
}
