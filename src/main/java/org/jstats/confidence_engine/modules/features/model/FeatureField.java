package org.jstats.confidence_engine.modules.features.model;

import java.util.Locale;

/**
 * The fixed, ordered feature schema shared by training and inference.
 * <p>
 * Declaration order is the vector order: append new fields at the end of a group only
 * together with a retrain, because {@link FeatureSchema#signature()} changes with it and
 * models trained on the previous layout stop being served.
 */
public enum FeatureField {

    // Team form, last five matches. Defaults describe an unremarkable 2-1-2 run (7 points)
    HOME_WINS(2),
    HOME_DRAWS(1),
    HOME_LOSSES(2),
    HOME_GOALS_SCORED(1.5),
    HOME_GOALS_CONCEDED(1.0),
    HOME_HOME_WIN_RATE(50),
    HOME_BTTS_PCT(50),
    HOME_OVER25_PCT(50),
    HOME_FORM_POINTS(7),
    AWAY_WINS(2),
    AWAY_DRAWS(1),
    AWAY_LOSSES(2),
    AWAY_GOALS_SCORED(1.0),
    AWAY_GOALS_CONCEDED(1.5),
    AWAY_AWAY_WIN_RATE(30),
    AWAY_BTTS_PCT(50),
    AWAY_OVER25_PCT(50),
    AWAY_FORM_POINTS(7),

    // Standings
    HOME_POSITION(10),
    AWAY_POSITION(10),
    POSITION_DIFF(0),
    HOME_POINTS_PER_GAME(1.4),
    AWAY_POINTS_PER_GAME(1.4),

    // Quoted odds and implied probabilities
    ODDS_HOME(2.5),
    ODDS_DRAW(3.5),
    ODDS_AWAY(3.0),
    IMPLIED_HOME(0.4),
    IMPLIED_DRAW(0.25),
    IMPLIED_AWAY(0.35),
    ODDS_OVER25(1.9),
    ODDS_UNDER25(1.9),
    ODDS_BTTS_YES(1.8),
    ODDS_BTTS_NO(2.0),
    IMPLIED_OVER25(0.5),
    IMPLIED_BTTS(0.5),
    BOOKMAKER_MARGIN(0.05),

    // Head to head
    H2H_HOME_WINS(0),
    H2H_DRAWS(0),
    H2H_AWAY_WINS(0),
    H2H_TOTAL(0),
    H2H_AVG_GOALS(2.5),
    H2H_BTTS_PCT(50),

    // Expected goals, base model
    EXPECTED_GOALS(2.5),
    EXPECTED_HOME_GOALS(1.3),
    EXPECTED_AWAY_GOALS(1.0),
    EXPECTED_GOALS_METHOD(0),
    AVG_BTTS_PCT(50),
    AVG_OVER25_PCT(50),

    // Referee; style 4=strict, 3=firm, 2=balanced, 1=lenient
    REFEREE_CARDS_PER_GAME(4.0),
    REFEREE_PENALTIES_PER_GAME(0.32),
    REFEREE_REDS_PER_GAME(0.12),
    REFEREE_STYLE(2),
    REFEREE_CARDS_VS_AVG(0),

    // Calendar congestion; score 0=fresh .. 3=exhausted
    HOME_REST_DAYS(5),
    AWAY_REST_DAYS(5),
    HOME_CONGESTION_SCORE(0),
    AWAY_CONGESTION_SCORE(0),
    REST_ADVANTAGE(0),
    HOME_MATCHES_LAST_14_DAYS(2),
    AWAY_MATCHES_LAST_14_DAYS(2),
    IS_CUP_MATCH(0),
    IS_EUROPEAN_WEEK(0),

    // Motivation
    IS_DERBY(0),
    HOME_MOTIVATION(5),
    AWAY_MOTIVATION(5),
    HOME_RELEGATION_BATTLE(0),
    AWAY_RELEGATION_BATTLE(0),
    HOME_TITLE_RACE(0),
    AWAY_TITLE_RACE(0),
    MOTIVATION_DIFF(0),
    HOME_EUROPEAN_RACE(0),
    AWAY_EUROPEAN_RACE(0),
    IS_DEAD_RUBBER(0),

    // Team class; 4=elite, 3=strong, 2=midtable, 1=weak, 0=relegation
    HOME_IS_ELITE(0),
    AWAY_IS_ELITE(0),
    HOME_TEAM_CLASS(2),
    AWAY_TEAM_CLASS(2),
    CLASS_DIFF(0),
    ELITE_VS_UNDERDOG(0),
    CLASS_MISMATCH(0),

    // Line movement and sharp money; direction -1=away, 0=stable, 1=home
    HOME_ODDS_DROPPED(0),
    AWAY_ODDS_DROPPED(0),
    DRAW_ODDS_DROPPED(0),
    OVER_ODDS_DROPPED(0),
    UNDER_ODDS_DROPPED(0),
    SHARP_MONEY_DETECTED(0),
    LINE_MOVEMENT_DIRECTION(0),
    HOME_ODDS_MOVE_PCT(0),
    AWAY_ODDS_MOVE_PCT(0),

    // Coach tenure
    HOME_NEW_COACH(0),
    AWAY_NEW_COACH(0),
    HOME_COACH_BOOST(0),
    AWAY_COACH_BOOST(0),
    HOME_COACH_TENURE_DAYS(365),
    AWAY_COACH_TENURE_DAYS(365),
    HOME_COACH_HONEYMOON(0),
    AWAY_COACH_HONEYMOON(0),

    // Injuries and availability
    HOME_INJURIES(0),
    AWAY_INJURIES(0),
    TOTAL_INJURIES(0),
    HOME_SUSPENSIONS(0),
    AWAY_SUSPENSIONS(0),
    HOME_LINEUP_CONFIRMED(0),
    AWAY_LINEUP_CONFIRMED(0),
    HOME_INJURY_CRISIS(0),
    AWAY_INJURY_CRISIS(0),
    FATIGUE_RISK(0),

    // Advanced xG and deviation signals
    HOME_XG_PER_GAME(1.3),
    AWAY_XG_PER_GAME(1.0),
    HOME_XGA_PER_GAME(1.0),
    AWAY_XGA_PER_GAME(1.3),
    HOME_XG_DIFF(0),
    AWAY_XG_DIFF(0),
    TOTAL_XG_DEVIATION(0),
    XG_EXPECTED_TOTAL(2.5),
    XG_EXPECTED_HOME(1.3),
    XG_EXPECTED_AWAY(1.0),
    HOME_RECENT_XG(1.3),
    AWAY_RECENT_XG(1.0),
    RECENT_XG_TOTAL(2.3),
    HOME_UNLUCKY(0),
    AWAY_UNLUCKY(0),
    HOME_LUCKY(0),
    AWAY_LUCKY(0),
    BOTH_UNDERPERFORMING(0),
    BOTH_OVERPERFORMING(0),
    XG_DATA_AVAILABLE(0),

    // Key-player impact modifiers
    HOME_ATTACK_MODIFIER(0),
    AWAY_ATTACK_MODIFIER(0),
    HOME_DEFENSE_MODIFIER(0),
    AWAY_DEFENSE_MODIFIER(0),
    HOME_GOALS_MODIFIER(0),
    AWAY_GOALS_MODIFIER(0),
    HOME_TOTAL_IMPACT(0),
    AWAY_TOTAL_IMPACT(0),
    HOME_KEY_PLAYERS_OUT(0),
    AWAY_KEY_PLAYERS_OUT(0),
    HOME_STAR_OUT(0),
    AWAY_STAR_OUT(0),
    HOME_DEFENSE_CRISIS(0),
    AWAY_DEFENSE_CRISIS(0),
    PLAYER_IMPACT_AVAILABLE(0),

    // Flat-track bully: scoring against weaker vs stronger opposition
    HOME_GOALS_VS_WEAKER(1.5),
    HOME_GOALS_VS_STRONGER(1.0),
    HOME_BULLY_RATIO(1.0),
    AWAY_GOALS_VS_WEAKER(1.2),
    AWAY_GOALS_VS_STRONGER(0.8),
    AWAY_BULLY_RATIO(1.0),
    HOME_IS_FLAT_TRACK_BULLY(0),
    AWAY_IS_FLAT_TRACK_BULLY(0),

    // Weather; strong wind is above 25 km/h
    WIND_SPEED_KMH(0),
    WIND_DIRECTION(0),
    WIND_AGAINST_HOME_1H(0),
    WIND_AGAINST_AWAY_1H(0),
    IS_STRONG_WIND(0),
    RAIN_INTENSITY(0),
    TEMPERATURE(20),
    HUMIDITY_PCT(60),

    // Ratings
    HOME_ELO(1500),
    AWAY_ELO(1500),
    ELO_DIFF(0),

    // Additional context
    HAS_WEB_NEWS(0),
    API_PRED_HOME_PCT(40),
    API_PRED_DRAW_PCT(27),
    API_PRED_AWAY_PCT(33);

    private final String key;
    private final double defaultValue;

    FeatureField(double defaultValue) {
        this.key = name().toLowerCase(Locale.ROOT);
        this.defaultValue = defaultValue;
    }

    /** The wire name used in feature maps, e.g. {@code home_position}. */
    public String key() {
        return key;
    }

    public double defaultValue() {
        return defaultValue;
    }
}
