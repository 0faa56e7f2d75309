package org.jstats.confidence_engine.modules.conditions.service;

import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.features.service.FeatureCodec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConditionExtractorTests {

    FeatureCodec codec = new FeatureCodec();
    ConditionExtractor extractor = new ConditionExtractor();

    @Test
    void defaults_onlyReportMissingHistory() {
        var conditions = extractor.extract(codec.encode(Map.of("home_wins", 2, "away_wins", 3)), BetCategory.BTTS);
        assertEquals(List.of("no_h2h_data"), List.copyOf(conditions));
    }

    @Test
    void crisisMatch_collectsEveryTrueCondition_sorted() {
        Map<String, Object> raw = Map.ofEntries(
                Map.entry("home_injuries", 9),
                Map.entry("away_injuries", 8),
                Map.entry("home_position", 3),
                Map.entry("away_position", 12),
                Map.entry("home_wins", 4),
                Map.entry("away_wins", 0),
                Map.entry("home_goals_scored", 2.4),
                Map.entry("away_goals_scored", 1.3),
                Map.entry("h2h_total", 6),
                Map.entry("home_rest_days", 2),
                Map.entry("is_cup_match", true),
                Map.entry("is_derby", 1),
                Map.entry("sharp_money_detected", "true"),
                Map.entry("class_diff", -3),
                Map.entry("home_key_players_out", 2));
        var features = codec.encode(raw);

        var conditions = List.copyOf(extractor.extract(features, BetCategory.TOTALS_OVER));

        assertEquals(List.of(
                "class_mismatch",
                "cup_match",
                "derby",
                "high_scoring_teams",
                "home_higher_position",
                "home_key_players_out",
                "home_many_injuries",
                "home_tired",
                "poor_away_form",
                "sharp_money",
                "strong_home_form"), conditions);
    }

    @Test
    void flatTrackBully_onlyForTheBackedSide() {
        var features = codec.encode(Map.of("home_bully_ratio", 1.8, "h2h_total", 2, "home_wins", 2, "away_wins", 2));

        assertTrue(extractor.extract(features, BetCategory.HOME_WIN).contains("flat_track_bully"));
        assertFalse(extractor.extract(features, BetCategory.AWAY_WIN).contains("flat_track_bully"));
        assertFalse(extractor.extract(features, BetCategory.TOTALS_OVER).contains("flat_track_bully"));
    }

    @Test
    void awaySideHigher_andLowScoring() {
        var features = codec.encode(Map.of(
                "home_position", 16, "away_position", 4,
                "home_goals_scored", 0.9, "away_goals_scored", 0.8));

        var conditions = extractor.extract(features, BetCategory.TOTALS_UNDER);
        assertTrue(conditions.contains("away_higher_position"));
        assertTrue(conditions.contains("low_scoring_teams"));
        assertFalse(conditions.contains("home_higher_position"));
    }

    @Test
    void sparseInput_raisesNoFormConditions() {
        var conditions = extractor.extract(codec.encode(Map.of("home_position", 8, "away_position", 9)), BetCategory.DRAW);

        assertTrue(conditions.stream().noneMatch(c -> c.endsWith("_form")), conditions.toString());
        assertTrue(conditions.contains("no_h2h_data"));
    }
}
