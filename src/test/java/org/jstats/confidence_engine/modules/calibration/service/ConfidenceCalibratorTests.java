package org.jstats.confidence_engine.modules.calibration.service;

import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.calibration.model.CalibrationRecord;
import org.jstats.confidence_engine.modules.calibration.model.ConfidenceBand;
import org.jstats.confidence_engine.modules.calibration.repository.CalibrationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ConfidenceCalibratorTests {

    CalibrationRepository repo;
    Clock clock;

    ConfidenceCalibrator calibrator;

    @BeforeEach
    void setUp() {
        repo = mock(CalibrationRepository.class);
        clock = Clock.fixed(Instant.parse("2024-10-01T12:00:00Z"), ZoneId.of("UTC"));
        calibrator = new ConfidenceCalibrator(repo, EngineProperties.defaults(), clock);
    }

    @Test
    void bands_followTheTensDigit() {
        assertEquals(ConfidenceBand.BELOW_60, ConfidenceBand.of(59));
        assertEquals(ConfidenceBand.FROM_60_TO_69, ConfidenceBand.of(60));
        assertEquals(ConfidenceBand.FROM_70_TO_79, ConfidenceBand.of(79));
        assertEquals(ConfidenceBand.FROM_80_TO_100, ConfidenceBand.of(95));
        assertEquals(0.55, ConfidenceBand.BELOW_60.midpoint(), 1e-9);
        assertEquals(0.75, ConfidenceBand.FROM_70_TO_79.midpoint(), 1e-9);
    }

    @Test
    void factor_isWinRateOverBandMidpoint() {
        assertEquals(0.7333, CalibrationRecord.factor(20, 11, ConfidenceBand.FROM_70_TO_79), 1e-4);
        assertEquals(1.0, CalibrationRecord.factor(0, 0, ConfidenceBand.FROM_70_TO_79));
    }

    @Test
    void overconfidentBand_scalesDown() {
        when(repo.find(BetCategory.TOTALS_OVER, ConfidenceBand.FROM_70_TO_79)).thenReturn(Optional.of(
                new CalibrationRecord(BetCategory.TOTALS_OVER, ConfidenceBand.FROM_70_TO_79, 20, 11,
                        CalibrationRecord.factor(20, 11, ConfidenceBand.FROM_70_TO_79))));

        assertEquals(55, calibrator.calibrate(BetCategory.TOTALS_OVER, 75));
    }

    @Test
    void belowMinimumSamples_returnsInputUnchanged() {
        when(repo.find(BetCategory.BTTS, ConfidenceBand.FROM_70_TO_79)).thenReturn(Optional.of(
                new CalibrationRecord(BetCategory.BTTS, ConfidenceBand.FROM_70_TO_79, 9, 0, 0.0)));

        assertEquals(75, calibrator.calibrate(BetCategory.BTTS, 75));
    }

    @Test
    void unknownBand_returnsInputUnchanged() {
        when(repo.find(any(), any())).thenReturn(Optional.empty());

        assertEquals(72, calibrator.calibrate(BetCategory.HOME_WIN, 72));
    }

    @Test
    void zeroWins_clampsFactorToFloor() {
        when(repo.find(BetCategory.HOME_WIN, ConfidenceBand.FROM_80_TO_100)).thenReturn(Optional.of(
                new CalibrationRecord(BetCategory.HOME_WIN, ConfidenceBand.FROM_80_TO_100, 12, 0, 0.0)));

        // 80 * 0.65 = 52
        assertEquals(52, calibrator.calibrate(BetCategory.HOME_WIN, 80));
    }

    @Test
    void underconfidentBand_isCappedAtMaximumConfidence() {
        when(repo.find(BetCategory.HOME_WIN, ConfidenceBand.FROM_80_TO_100)).thenReturn(Optional.of(
                new CalibrationRecord(BetCategory.HOME_WIN, ConfidenceBand.FROM_80_TO_100, 10, 10, 1.18)));

        assertEquals(95, calibrator.calibrate(BetCategory.HOME_WIN, 85));
    }

    @Test
    void recordOutcome_upsertsTheRawConfidenceBand_atClockTime() {
        when(repo.increment(any(), any(), anyBoolean(), any())).thenReturn(
                new CalibrationRecord(BetCategory.DRAW, ConfidenceBand.FROM_60_TO_69, 1, 1, 1.538));

        calibrator.recordOutcome(BetCategory.DRAW, 64, true);

        ArgumentCaptor<OffsetDateTime> ts = ArgumentCaptor.forClass(OffsetDateTime.class);
        verify(repo).increment(eq(BetCategory.DRAW), eq(ConfidenceBand.FROM_60_TO_69), eq(true), ts.capture());
        assertEquals(Instant.parse("2024-10-01T12:00:00Z"), ts.getValue().toInstant());
    }
}
