package org.jstats.confidence_engine.modules.conditions.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.features.model.FeatureVector;
import org.springframework.stereotype.Component;

import java.util.SortedSet;
import java.util.TreeSet;

import static org.jstats.confidence_engine.modules.features.model.FeatureField.*;

/**
 * Names the boolean match situations that currently hold. Each name is tracked separately
 * per category by {@link ConditionalErrorLearner}.
 */
@Component
@NullMarked
public class ConditionExtractor {

    static final int MANY_INJURIES = 8;
    static final int POSITION_GAP = 5;
    static final int POOR_FORM_WINS = 2;
    static final int STRONG_FORM_WINS = 4;
    static final double LOW_SCORING = 2.0;
    static final double HIGH_SCORING = 3.5;
    static final int TIRED_REST_DAYS = 3;
    static final int CLASS_GAP = 2;
    static final int KEY_PLAYERS_OUT = 2;
    static final double BULLY_RATIO = 1.5;

    public SortedSet<String> extract(FeatureVector features, BetCategory category) {
        SortedSet<String> conditions = new TreeSet<>();

        if (features.get(HOME_INJURIES) > MANY_INJURIES) conditions.add("home_many_injuries");
        if (features.get(AWAY_INJURIES) > MANY_INJURIES) conditions.add("away_many_injuries");

        int gap = features.getInt(AWAY_POSITION) - features.getInt(HOME_POSITION);
        if (gap > POSITION_GAP) conditions.add("home_higher_position");
        if (gap < -POSITION_GAP) conditions.add("away_higher_position");

        form("home", features.getInt(HOME_WINS), conditions);
        form("away", features.getInt(AWAY_WINS), conditions);

        double combinedScoring = features.get(HOME_GOALS_SCORED) + features.get(AWAY_GOALS_SCORED);
        if (combinedScoring < LOW_SCORING) conditions.add("low_scoring_teams");
        if (combinedScoring >= HIGH_SCORING) conditions.add("high_scoring_teams");

        if (features.getInt(H2H_TOTAL) == 0) conditions.add("no_h2h_data");
        if (features.get(HOME_REST_DAYS) < TIRED_REST_DAYS) conditions.add("home_tired");
        if (features.get(AWAY_REST_DAYS) < TIRED_REST_DAYS) conditions.add("away_tired");
        if (features.isSet(IS_CUP_MATCH)) conditions.add("cup_match");

        if (features.isSet(IS_DERBY)) conditions.add("derby");
        if (features.isSet(ELITE_VS_UNDERDOG)) conditions.add("elite_vs_underdog");
        if (Math.abs(features.get(CLASS_DIFF)) > CLASS_GAP) conditions.add("class_mismatch");
        if (features.isSet(SHARP_MONEY_DETECTED)) conditions.add("sharp_money");
        if (features.isSet(BOTH_UNDERPERFORMING)) conditions.add("xg_underperforming");
        if (features.isSet(IS_STRONG_WIND)) conditions.add("strong_wind");
        if (features.isSet(HOME_NEW_COACH)) conditions.add("home_new_coach");
        if (features.isSet(AWAY_NEW_COACH)) conditions.add("away_new_coach");
        if (features.get(HOME_KEY_PLAYERS_OUT) >= KEY_PLAYERS_OUT) conditions.add("home_key_players_out");
        if (features.get(AWAY_KEY_PLAYERS_OUT) >= KEY_PLAYERS_OUT) conditions.add("away_key_players_out");

        // Only meaningful when the backed side is the one expected to run up the score.
        if (category == BetCategory.HOME_WIN && features.get(HOME_BULLY_RATIO) >= BULLY_RATIO) {
            conditions.add("flat_track_bully");
        } else if (category == BetCategory.AWAY_WIN && features.get(AWAY_BULLY_RATIO) >= BULLY_RATIO) {
            conditions.add("flat_track_bully");
        }
        return conditions;
    }

    private static void form(String side, int wins, SortedSet<String> conditions) {
        if (wins < POOR_FORM_WINS) {
            conditions.add("poor_" + side + "_form");
        } else if (wins >= STRONG_FORM_WINS) {
            conditions.add("strong_" + side + "_form");
        }
    }
}
