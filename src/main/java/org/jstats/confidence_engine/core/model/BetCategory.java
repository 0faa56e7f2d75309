package org.jstats.confidence_engine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The fixed catalogue of wager types the engine learns independently.
 * The {@link #code()} is the stable key used in every persisted record.
 */
public enum BetCategory {

    HOME_WIN("outcomes_home"),
    AWAY_WIN("outcomes_away"),
    DRAW("outcomes_draw"),
    TOTALS_OVER("totals_over"),
    TOTALS_UNDER("totals_under"),
    BTTS("btts"),
    DOUBLE_CHANCE("double_chance"),
    HANDICAP("handicap");

    private final String code;

    BetCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** True for the match-result categories where one side is backed to win. */
    public boolean isSideWin() {
        return this == HOME_WIN || this == AWAY_WIN;
    }

    /**
     * Resolves a category from its code or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException when the value names no known category
     */
    @JsonCreator
    public static BetCategory fromCode(String value) {
        if (value != null) {
            var normalized = value.trim().toLowerCase(Locale.ROOT);
            for (BetCategory category : values()) {
                if (category.code.equals(normalized) || category.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return category;
                }
            }
        }
        throw new IllegalArgumentException("Unknown bet category: " + value);
    }
}
