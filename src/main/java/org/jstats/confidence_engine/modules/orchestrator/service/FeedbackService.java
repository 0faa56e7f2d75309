package org.jstats.confidence_engine.modules.orchestrator.service;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.calibration.service.ConfidenceCalibrator;
import org.jstats.confidence_engine.modules.conditions.service.ConditionalErrorLearner;
import org.jstats.confidence_engine.modules.ensemble.model.TrainingSample;
import org.jstats.confidence_engine.modules.ensemble.repository.TrainingSampleRepository;
import org.jstats.confidence_engine.modules.ensemble.service.RetrainingPolicy;
import org.jstats.confidence_engine.modules.ensemble.service.RetrainingQueue;
import org.jstats.confidence_engine.modules.features.model.FeatureSchema;
import org.jstats.confidence_engine.modules.features.service.FeatureCodec;
import org.jstats.confidence_engine.modules.orchestrator.model.FeedbackResult;
import org.jstats.confidence_engine.modules.orchestrator.model.Outcome;
import org.jstats.confidence_engine.modules.orchestrator.model.Prediction;
import org.jstats.confidence_engine.modules.orchestrator.repository.PredictionRepository;
import org.jstats.confidence_engine.modules.patterns.service.CoarsePatternLearner;
import org.jstats.confidence_engine.modules.roi.service.RoiLearner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Feeds a settled result back into every learner, exactly once per prediction.
 */
@Service
@NullMarked
public class FeedbackService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    private final PredictionRepository predictions;
    private final FeatureCodec codec;
    private final ConfidenceCalibrator calibrator;
    private final CoarsePatternLearner patterns;
    private final ConditionalErrorLearner conditions;
    private final RoiLearner roi;
    private final StakeCalculator stakes;
    private final TrainingSampleRepository samples;
    private final RetrainingPolicy retrainingPolicy;
    private final RetrainingQueue retrainingQueue;
    private final Clock clock;

    public FeedbackService(
            PredictionRepository predictions,
            FeatureCodec codec,
            ConfidenceCalibrator calibrator,
            CoarsePatternLearner patterns,
            ConditionalErrorLearner conditions,
            RoiLearner roi,
            StakeCalculator stakes,
            TrainingSampleRepository samples,
            RetrainingPolicy retrainingPolicy,
            RetrainingQueue retrainingQueue,
            Clock clock) {
        this.predictions = predictions;
        this.codec = codec;
        this.calibrator = calibrator;
        this.patterns = patterns;
        this.conditions = conditions;
        this.roi = roi;
        this.stakes = stakes;
        this.samples = samples;
        this.retrainingPolicy = retrainingPolicy;
        this.retrainingQueue = retrainingQueue;
        this.clock = clock;
    }

    /**
     * Updates calibration, pattern, condition and ROI records for a win or a loss, stores
     * the labeled sample, settles the prediction and queues a retrain when due. The whole
     * call is one transaction: a failing learner leaves the prediction open, so the same
     * report can be sent again. A prediction that was already settled is left alone. An
     * unknown id is tolerated and learning proceeds from the supplied figures, once per id.
     *
     * @throws IllegalArgumentException when {@code outcome} is {@link Outcome#PENDING}
     */
    @Transactional
    public FeedbackResult recordOutcome(
            long predictionId,
            BetCategory category,
            @Nullable Map<String, ?> features,
            int rawConfidence,
            double odds,
            double stake,
            Outcome outcome) {
        if (outcome == Outcome.PENDING) {
            throw new IllegalArgumentException("PENDING is not a settled outcome");
        }

        var now = OffsetDateTime.now(clock);
        Prediction stored = predictions.findById(predictionId).orElse(null);
        if (stored != null && stored.outcome() != Outcome.PENDING) {
            log.info("Prediction {} already settled, ignoring {}", predictionId, outcome);
            return new FeedbackResult(predictionId, false, false, null);
        }
        if (stored == null) {
            log.warn("Prediction {} not found, learning from the supplied data only", predictionId);
        }
        if (outcome == Outcome.PUSH) {
            log.debug("Prediction {} pushed, nothing to learn", predictionId);
            return new FeedbackResult(predictionId, predictions.settle(predictionId, outcome, now), false, null);
        }

        boolean won = outcome == Outcome.WIN;
        var vector = codec.encode(features);

        // one sample per prediction id; a repeated report stops here
        var sample = new TrainingSample(predictionId, category, vector, FeatureSchema.signature(), won);
        if (!samples.insert(sample, now)) {
            log.info("Outcome for prediction {} already learned, ignoring {}", predictionId, outcome);
            return new FeedbackResult(predictionId, false, false, null);
        }

        calibrator.recordOutcome(category, rawConfidence, won);
        patterns.update(patterns.detectPattern(vector, category), won);
        var active = conditions.extractConditions(vector, category);
        for (String condition : active) {
            conditions.update(category, condition, won, rawConfidence);
        }
        double expectedValue = stored != null
                ? stored.expectedValue()
                : stakes.expectedValue(rawConfidence, odds);
        roi.record(category, active, won, odds, stake, expectedValue);

        // settled last, after every learner went through
        boolean settled = predictions.settle(predictionId, outcome, now);

        String retrainReason = retrainingPolicy.evaluate(category).orElse(null);
        if (retrainReason != null && retrainingQueue.request(category)) {
            log.info("Queued retrain for {}: {}", category.code(), retrainReason);
        }

        log.info("Learned {} for prediction {} ({}, {} conditions)", outcome, predictionId, category.code(), active.size());
        return new FeedbackResult(predictionId, settled, true, retrainReason);
    }
}
