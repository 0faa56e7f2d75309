package org.jstats.confidence_engine.modules.roi.service;

import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.roi.model.RoiRecord;
import org.jstats.confidence_engine.modules.roi.repository.RoiRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RoiLearnerTests {

    RoiRepository repo;
    RoiLearner learner;

    @BeforeEach
    void setUp() {
        repo = mock(RoiRepository.class);
        var clock = Clock.fixed(Instant.parse("2024-10-01T12:00:00Z"), ZoneId.of("UTC"));
        learner = new RoiLearner(repo, EngineProperties.defaults(), clock);
    }

    @Test
    void buckets_areHalfOpenOnTheLowerBound() {
        assertEquals(-12, RoiLearner.bucket(-20.01));
        assertEquals(-8, RoiLearner.bucket(-20.0));
        assertEquals(-4, RoiLearner.bucket(-10.0));
        assertEquals(-4, RoiLearner.bucket(-0.01));
        assertEquals(3, RoiLearner.bucket(0.0));
        assertEquals(6, RoiLearner.bucket(10.0));
        assertEquals(10, RoiLearner.bucket(25.0));
    }

    @Test
    void adjustment_needsFifteenBets() {
        when(repo.find(BetCategory.BTTS, RoiRecord.OVERALL)).thenReturn(Optional.of(overall(14, -30.0)));
        var none = learner.adjustment(BetCategory.BTTS);
        assertEquals(0, none.delta());
        assertNull(none.reason());

        when(repo.find(BetCategory.BTTS, RoiRecord.OVERALL)).thenReturn(Optional.of(overall(15, -10.0)));
        var adjustment = learner.adjustment(BetCategory.BTTS);
        assertEquals(-4, adjustment.delta());
        assertNotNull(adjustment.reason());
    }

    @Test
    void record_alwaysIncludesOverall_once() {
        learner.record(BetCategory.DRAW, List.of("derby", RoiRecord.OVERALL), true, 3.4, 2.0, 12.5);

        verify(repo).increment(eq(BetCategory.DRAW), eq("derby"), eq(true), eq(3.4), eq(2.0), eq(12.5), any(OffsetDateTime.class));
        verify(repo, times(1)).increment(eq(BetCategory.DRAW), eq(RoiRecord.OVERALL), eq(true), eq(3.4), eq(2.0), eq(12.5), any(OffsetDateTime.class));
        verifyNoMoreInteractions(repo);
    }

    private static RoiRecord overall(int bets, double roi) {
        return new RoiRecord(BetCategory.BTTS, RoiRecord.OVERALL, bets, bets / 2, bets - bets / 2,
                bets * 2.0, bets * 2.0 * (1 + roi / 100), roi, 1.9, 4.0);
    }
}
