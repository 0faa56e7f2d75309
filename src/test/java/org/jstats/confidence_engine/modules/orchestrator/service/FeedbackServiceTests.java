package org.jstats.confidence_engine.modules.orchestrator.service;

import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.calibration.service.ConfidenceCalibrator;
import org.jstats.confidence_engine.modules.conditions.service.ConditionalErrorLearner;
import org.jstats.confidence_engine.modules.ensemble.model.TrainingSample;
import org.jstats.confidence_engine.modules.ensemble.repository.TrainingSampleRepository;
import org.jstats.confidence_engine.modules.ensemble.service.RetrainingPolicy;
import org.jstats.confidence_engine.modules.ensemble.service.RetrainingQueue;
import org.jstats.confidence_engine.modules.features.model.FeatureSchema;
import org.jstats.confidence_engine.modules.features.service.FeatureCodec;
import org.jstats.confidence_engine.modules.orchestrator.model.Outcome;
import org.jstats.confidence_engine.modules.orchestrator.model.Prediction;
import org.jstats.confidence_engine.modules.orchestrator.repository.PredictionRepository;
import org.jstats.confidence_engine.modules.patterns.service.CoarsePatternLearner;
import org.jstats.confidence_engine.modules.roi.service.RoiLearner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class FeedbackServiceTests {

    private static final BetCategory CAT = BetCategory.HOME_WIN;
    private static final Map<String, Object> FEATURES = Map.of("home_wins", 4, "is_derby", 1);

    PredictionRepository predictions;
    ConfidenceCalibrator calibrator;
    CoarsePatternLearner patterns;
    ConditionalErrorLearner conditions;
    RoiLearner roi;
    TrainingSampleRepository samples;
    RetrainingPolicy policy;
    RetrainingQueue queue;

    FeedbackService service;

    @BeforeEach
    void setUp() {
        predictions = mock(PredictionRepository.class);
        calibrator = mock(ConfidenceCalibrator.class);
        patterns = mock(CoarsePatternLearner.class);
        conditions = mock(ConditionalErrorLearner.class);
        roi = mock(RoiLearner.class);
        samples = mock(TrainingSampleRepository.class);
        policy = mock(RetrainingPolicy.class);
        queue = new RetrainingQueue();
        var clock = Clock.fixed(Instant.parse("2024-09-01T12:00:00Z"), ZoneOffset.UTC);

        service = new FeedbackService(predictions, new FeatureCodec(), calibrator, patterns, conditions, roi,
                new StakeCalculator(EngineProperties.defaults()), samples, policy, queue, clock);

        when(patterns.detectPattern(any(), eq(CAT))).thenReturn("outcomes_home#pos:equal");
        when(conditions.extractConditions(any(), eq(CAT))).thenReturn(new TreeSet<>(Set.of("derby")));
        when(policy.evaluate(CAT)).thenReturn(Optional.empty());
    }

    @Test
    void win_updatesEveryLearnerAndStoresTheSample() {
        issued(11L, 29.2);
        when(predictions.settle(eq(11L), eq(Outcome.WIN), any())).thenReturn(true);

        var result = service.recordOutcome(11L, CAT, FEATURES, 70, 1.9, 2.0, Outcome.WIN);

        assertTrue(result.settled());
        assertTrue(result.learned());
        assertNull(result.retrainReason());
        verify(calibrator).recordOutcome(CAT, 70, true);
        verify(patterns).update("outcomes_home#pos:equal", true);
        verify(conditions).update(CAT, "derby", true, 70);
        verify(roi).record(CAT, Set.of("derby"), true, 1.9, 2.0, 29.2);

        var captor = ArgumentCaptor.forClass(TrainingSample.class);
        verify(samples).insert(captor.capture(), eq(OffsetDateTime.parse("2024-09-01T12:00:00Z")));
        assertEquals(11L, captor.getValue().predictionId());
        assertEquals(FeatureSchema.signature(), captor.getValue().schemaSignature());
        assertTrue(captor.getValue().won());
        assertTrue(queue.pending().isEmpty());
    }

    @Test
    void loss_isLearnedAsALoss() {
        issued(12L, 20.0);
        when(predictions.settle(eq(12L), eq(Outcome.LOSS), any())).thenReturn(true);

        service.recordOutcome(12L, CAT, FEATURES, 80, 1.5, 1.0, Outcome.LOSS);

        verify(calibrator).recordOutcome(CAT, 80, false);
        verify(conditions).update(CAT, "derby", false, 80);
    }

    @Test
    void firedPolicy_queuesARetrain() {
        issued(13L, 33.0);
        when(predictions.settle(eq(13L), eq(Outcome.WIN), any())).thenReturn(true);
        when(policy.evaluate(CAT)).thenReturn(Optional.of("no model for the current feature schema"));

        var result = service.recordOutcome(13L, CAT, FEATURES, 70, 1.9, 2.0, Outcome.WIN);

        assertEquals("no model for the current feature schema", result.retrainReason());
        assertEquals(Set.of(CAT), queue.pending());
    }

    @Test
    void push_settlesWithoutLearning() {
        issued(14L, 33.0);
        when(predictions.settle(eq(14L), eq(Outcome.PUSH), any())).thenReturn(true);

        var result = service.recordOutcome(14L, CAT, FEATURES, 70, 1.9, 2.0, Outcome.PUSH);

        assertTrue(result.settled());
        assertFalse(result.learned());
        verifyNoInteractions(calibrator, patterns, conditions, roi, samples, policy);
    }

    @Test
    void alreadySettled_isNotLearnedTwice() {
        var settled = mock(Prediction.class);
        when(settled.outcome()).thenReturn(Outcome.WIN);
        when(predictions.findById(15L)).thenReturn(Optional.of(settled));

        var result = service.recordOutcome(15L, CAT, FEATURES, 70, 1.9, 2.0, Outcome.WIN);

        assertFalse(result.settled());
        assertFalse(result.learned());
        verify(predictions, never()).settle(anyLong(), any(), any());
        verifyNoInteractions(calibrator, patterns, conditions, roi, samples, policy);
    }

    @Test
    void unknownPrediction_sentTwice_isLearnedOnce() {
        when(samples.insert(any(), any())).thenReturn(true, false);

        var first = service.recordOutcome(99L, CAT, FEATURES, 70, 1.9, 2.0, Outcome.WIN);
        var second = service.recordOutcome(99L, CAT, FEATURES, 70, 1.9, 2.0, Outcome.WIN);

        assertTrue(first.learned());
        assertFalse(first.settled());
        assertFalse(second.learned());
        verify(calibrator, times(1)).recordOutcome(CAT, 70, true);
        verify(patterns, times(1)).update("outcomes_home#pos:equal", true);
        verify(conditions, times(1)).update(CAT, "derby", true, 70);
        // no stored prediction, so EV comes from the supplied confidence and odds
        verify(roi, times(1)).record(CAT, Set.of("derby"), true, 1.9, 2.0, 33.0);
    }

    @Test
    void failingLearner_leavesThePredictionOpenForARetry() {
        issued(18L, 33.0);
        when(predictions.settle(eq(18L), eq(Outcome.LOSS), any())).thenReturn(true);
        doThrow(new IllegalStateException("connection reset"))
                .doNothing()
                .when(roi).record(any(), anyCollection(), anyBoolean(), anyDouble(), anyDouble(), anyDouble());

        assertThrows(IllegalStateException.class,
                () -> service.recordOutcome(18L, CAT, FEATURES, 70, 1.9, 2.0, Outcome.LOSS));
        verify(predictions, never()).settle(anyLong(), any(), any());

        var retry = service.recordOutcome(18L, CAT, FEATURES, 70, 1.9, 2.0, Outcome.LOSS);

        assertTrue(retry.learned());
        assertTrue(retry.settled());
        verify(roi, times(2)).record(CAT, Set.of("derby"), false, 1.9, 2.0, 33.0);
        verify(predictions, times(1)).settle(eq(18L), eq(Outcome.LOSS), any());
    }

    @Test
    void pending_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> service.recordOutcome(17L, CAT, FEATURES, 70, 1.9, 2.0, Outcome.PENDING));
        verifyNoInteractions(predictions);
    }
}
