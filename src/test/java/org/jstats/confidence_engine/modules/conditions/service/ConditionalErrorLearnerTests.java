package org.jstats.confidence_engine.modules.conditions.service;

import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.conditions.model.ConditionRecord;
import org.jstats.confidence_engine.modules.conditions.repository.ConditionRepository;
import org.jstats.confidence_engine.modules.features.model.FeatureVector;
import org.jstats.confidence_engine.modules.features.service.FeatureCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ConditionalErrorLearnerTests {

    private static final BetCategory CAT = BetCategory.TOTALS_OVER;

    ConditionRepository repo;
    ConditionalErrorLearner learner;

    @BeforeEach
    void setUp() {
        repo = mock(ConditionRepository.class);
        var clock = Clock.fixed(Instant.parse("2024-10-01T12:00:00Z"), ZoneId.of("UTC"));
        learner = new ConditionalErrorLearner(repo, new ConditionExtractor(), EngineProperties.defaults(), clock);
    }

    @Test
    void suggestedAdjustment_signAndCaps() {
        assertEquals(-6, ConditionRecord.suggestedAdjustment(6, 20));
        assertEquals(6, ConditionRecord.suggestedAdjustment(14, 20));
        assertEquals(-15, ConditionRecord.suggestedAdjustment(0, 20));
        assertEquals(10, ConditionRecord.suggestedAdjustment(20, 20));
        assertEquals(0, ConditionRecord.suggestedAdjustment(0, 0));
    }

    @Test
    void fullyTrustedCondition_appliesItsSuggestion() {
        when(repo.findAll(eq(CAT), anyCollection())).thenReturn(List.of(
                record("no_h2h_data", 20, 6)));

        var adjustment = learner.aggregateAdjustment(CAT, FeatureVector.defaults());

        assertEquals(-6, adjustment.total());
        assertEquals(1, adjustment.reasons().size());
        assertTrue(adjustment.reasons().get(0).startsWith("no_h2h_data: -6"));
    }

    @Test
    void youngCondition_isWeightedBySampleCount() {
        // 3/10 -> -6 suggested, weight 10/20 -> -3
        when(repo.findAll(eq(CAT), anyCollection())).thenReturn(List.of(record("no_h2h_data", 10, 3)));

        assertEquals(-3, learner.aggregateAdjustment(CAT, FeatureVector.defaults()).total());
    }

    @Test
    void thinOrWeakConditions_areSkipped() {
        when(repo.findAll(eq(CAT), anyCollection())).thenReturn(List.of(
                record("no_h2h_data", 4, 0),
                record("poor_home_form", 20, 9)));

        var adjustment = learner.aggregateAdjustment(CAT, FeatureVector.defaults());
        assertEquals(0, adjustment.total());
        assertTrue(adjustment.reasons().isEmpty());
    }

    @Test
    void aggregate_isClampedToRange() {
        when(repo.findAll(eq(CAT), anyCollection())).thenReturn(List.of(
                record("no_h2h_data", 40, 0),
                record("poor_away_form", 40, 2),
                record("poor_home_form", 40, 5)));

        var losingRuns = new FeatureCodec().encode(Map.of("home_wins", 1, "away_wins", 0));
        var adjustment = learner.aggregateAdjustment(CAT, losingRuns);
        assertEquals(-25, adjustment.total());
        assertTrue(adjustment.reasons().get(adjustment.reasons().size() - 1).contains("capped"));
    }

    @Test
    void update_passesConfidenceToRepository() {
        when(repo.increment(any(), anyString(), anyBoolean(), anyDouble(), any()))
                .thenReturn(new ConditionRecord(CAT, "derby", 1, 0, 1, 72.0, -15));

        learner.update(CAT, "derby", false, 72);

        verify(repo).increment(eq(CAT), eq("derby"), eq(false), eq(72.0), any(OffsetDateTime.class));
    }

    private static ConditionRecord record(String name, int total, int wins) {
        return new ConditionRecord(CAT, name, total, wins, total - wins, 70.0,
                ConditionRecord.suggestedAdjustment(wins, total));
    }
}
