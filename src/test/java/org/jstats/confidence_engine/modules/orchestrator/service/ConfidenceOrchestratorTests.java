package org.jstats.confidence_engine.modules.orchestrator.service;

import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.calibration.service.ConfidenceCalibrator;
import org.jstats.confidence_engine.modules.conditions.model.ConditionAdjustment;
import org.jstats.confidence_engine.modules.conditions.service.ConditionalErrorLearner;
import org.jstats.confidence_engine.modules.ensemble.model.EnsembleVerdict;
import org.jstats.confidence_engine.modules.ensemble.service.EnsembleVoter;
import org.jstats.confidence_engine.modules.features.service.FeatureCodec;
import org.jstats.confidence_engine.modules.orchestrator.model.AuditStep;
import org.jstats.confidence_engine.modules.patterns.service.CoarsePatternLearner;
import org.jstats.confidence_engine.modules.roi.model.RoiAdjustment;
import org.jstats.confidence_engine.modules.roi.service.RoiLearner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ConfidenceOrchestratorTests {

    private static final BetCategory CAT = BetCategory.TOTALS_OVER;
    private static final Map<String, Object> FEATURES = Map.of("home_wins", 3, "away_wins", 2);

    EnsembleVoter voter;
    ConfidenceCalibrator calibrator;
    CoarsePatternLearner patterns;
    ConditionalErrorLearner conditions;
    RoiLearner roi;

    ConfidenceOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        voter = mock(EnsembleVoter.class);
        calibrator = mock(ConfidenceCalibrator.class);
        patterns = mock(CoarsePatternLearner.class);
        conditions = mock(ConditionalErrorLearner.class);
        roi = mock(RoiLearner.class);
        var properties = EngineProperties.defaults();
        orchestrator = new ConfidenceOrchestrator(new FeatureCodec(), voter, calibrator, patterns, conditions, roi,
                new StakeCalculator(properties), properties);

        // Neutral learners unless a test says otherwise
        when(voter.predict(any(), eq(CAT))).thenReturn(EnsembleVerdict.unavailable());
        when(calibrator.calibrate(eq(CAT), anyInt())).thenAnswer(inv -> inv.getArgument(1));
        when(patterns.detectPattern(any(), eq(CAT))).thenReturn("totals_over#pos:equal");
        when(patterns.adjustment(anyString())).thenReturn(0);
        when(conditions.aggregateAdjustment(eq(CAT), any())).thenReturn(ConditionAdjustment.none());
        when(roi.adjustment(CAT)).thenReturn(RoiAdjustment.none());
    }

    @Test
    void confidentEnsemble_pullsRawConfidenceHalfwayUp() {
        when(voter.predict(any(), eq(CAT))).thenReturn(verdict(true, 95));

        var result = orchestrator.finalizeConfidence(CAT, 70, FEATURES, 1.9);

        // (95 - 70) * 0.5 = 12.5 -> 82.5 rounds half-up to 83
        assertEquals(83, result.confidence());
        assertEquals(57.7, result.expectedValue());
        assertEquals(10.0, result.stakePercent());
        assertTrue(result.ensemble().available());
        verify(calibrator).calibrate(CAT, 83);
    }

    @Test
    void ensembleAdjustment_isCappedAtFifteen() {
        when(voter.predict(any(), eq(CAT))).thenReturn(verdict(true, 95));

        assertEquals(75, orchestrator.finalizeConfidence(CAT, 60, FEATURES, 1.9).confidence());
    }

    @Test
    void ensembleBackingTheOtherSide_pullsDown() {
        // LOSS at 85 -> win confidence 30, (30 - 70) * 0.5 = -20 capped at -15
        when(voter.predict(any(), eq(CAT))).thenReturn(verdict(false, 85));

        assertEquals(55, orchestrator.finalizeConfidence(CAT, 70, FEATURES, 1.9).confidence());
    }

    @Test
    void correctionsApplyInOrder_withAuditTrail() {
        when(calibrator.calibrate(CAT, 70)).thenReturn(66);
        when(patterns.adjustment("totals_over#pos:equal")).thenReturn(10);
        when(conditions.aggregateAdjustment(eq(CAT), any())).thenReturn(new ConditionAdjustment(-6, List.of("derby: -6 (6/20 won)")));
        when(roi.adjustment(CAT)).thenReturn(new RoiAdjustment(3, "ROI 4.0% over 20 bets: +3"));

        var result = orchestrator.finalizeConfidence(CAT, 70, FEATURES, 2.0);

        assertEquals(73, result.confidence());
        assertEquals(List.of("ensemble", "calibration", "pattern", "conditions", "roi"),
                result.auditTrail().stream().map(AuditStep::stage).toList());
        assertEquals(new AuditStep("calibration", 70, 66, "band factor"), result.auditTrail().get(1));
        assertEquals(76, result.auditTrail().get(2).after());
        assertEquals(70, result.auditTrail().get(3).after());
        assertEquals("derby: -6 (6/20 won)", result.auditTrail().get(3).note());
    }

    @Test
    void everyStage_reclampsIntoRange() {
        when(calibrator.calibrate(CAT, 90)).thenReturn(92);
        when(patterns.adjustment(anyString())).thenReturn(15);
        when(conditions.aggregateAdjustment(eq(CAT), any())).thenReturn(new ConditionAdjustment(-25, List.of("x")));
        when(roi.adjustment(CAT)).thenReturn(new RoiAdjustment(-12, "bad"));

        var result = orchestrator.finalizeConfidence(CAT, 90, FEATURES, 1.5);

        assertEquals(95, result.auditTrail().get(2).after());
        assertEquals(70, result.auditTrail().get(3).after());
        assertEquals(58, result.confidence());
    }

    @Test
    void lowRawConfidence_endsAtTheFloor() {
        assertEquals(30, orchestrator.finalizeConfidence(CAT, 5, FEATURES, 1.9).confidence());
    }

    @Test
    void rawConfidenceOutOfRange_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> orchestrator.finalizeConfidence(CAT, 101, FEATURES, 1.9));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.finalizeConfidence(CAT, -1, FEATURES, 1.9));
    }

    private static EnsembleVerdict verdict(boolean win, int confidence) {
        return new EnsembleVerdict(true, win, confidence / 100.0, 1.0, 0, confidence, List.of());
    }
}
