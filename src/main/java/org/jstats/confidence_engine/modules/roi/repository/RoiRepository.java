package org.jstats.confidence_engine.modules.roi.repository;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.roi.model.RoiRecord;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@NullMarked
public class RoiRepository {

    private static final RowMapper<RoiRecord> ROW_MAPPER = (rs, i) -> new RoiRecord(
            BetCategory.fromCode(rs.getString("category")),
            rs.getString("condition_key"),
            rs.getInt("total_bets"),
            rs.getInt("wins"),
            rs.getInt("losses"),
            rs.getDouble("total_staked"),
            rs.getDouble("total_returned"),
            rs.getDouble("roi_percent"),
            rs.getDouble("avg_odds"),
            rs.getDouble("avg_ev"));

    private static final String COLUMNS = """
            category, condition_key, total_bets, wins, losses, total_staked, total_returned,
            roi_percent, avg_odds, avg_ev""";

    private final NamedParameterJdbcTemplate jdbc;

    public RoiRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Adds one settled bet to the key. ROI and the running averages are derived from the
     * post-update totals inside the same statement.
     */
    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 50))
    public RoiRecord increment(
            BetCategory category,
            String conditionKey,
            boolean won,
            double odds,
            double stake,
            double expectedValue,
            OffsetDateTime now) {
        final var sql = """
                INSERT INTO roi_record
                  (category, condition_key, total_bets, wins, losses, total_staked, total_returned,
                   roi_percent, avg_odds, avg_ev, updated_at)
                VALUES
                  (:category, :key, 1, :win, :loss, :stake, :returned,
                   CASE WHEN :stake > 0 THEN (:returned - :stake) / :stake * 100 ELSE 0 END,
                   :odds, :ev, :now)
                ON CONFLICT (category, condition_key)
                DO UPDATE SET
                  total_bets     = roi_record.total_bets + 1,
                  wins           = roi_record.wins + EXCLUDED.wins,
                  losses         = roi_record.losses + EXCLUDED.losses,
                  total_staked   = roi_record.total_staked + EXCLUDED.total_staked,
                  total_returned = roi_record.total_returned + EXCLUDED.total_returned,
                  roi_percent    = CASE
                      WHEN roi_record.total_staked + EXCLUDED.total_staked > 0
                      THEN (roi_record.total_returned + EXCLUDED.total_returned
                            - roi_record.total_staked - EXCLUDED.total_staked)
                           / (roi_record.total_staked + EXCLUDED.total_staked) * 100
                      ELSE 0
                  END,
                  avg_odds   = (roi_record.avg_odds * roi_record.total_bets + EXCLUDED.avg_odds) / (roi_record.total_bets + 1),
                  avg_ev     = (roi_record.avg_ev * roi_record.total_bets + EXCLUDED.avg_ev) / (roi_record.total_bets + 1),
                  updated_at = EXCLUDED.updated_at
                RETURNING %s
                """.formatted(COLUMNS);
        var params = new MapSqlParameterSource()
                .addValue("category", category.code())
                .addValue("key", conditionKey)
                .addValue("win", won ? 1 : 0)
                .addValue("loss", won ? 0 : 1)
                .addValue("stake", stake)
                .addValue("returned", won ? stake * odds : 0.0)
                .addValue("odds", odds)
                .addValue("ev", expectedValue)
                .addValue("now", now);
        return jdbc.queryForObject(sql, params, ROW_MAPPER);
    }

    public Optional<RoiRecord> find(BetCategory category, String conditionKey) {
        var sql = """
                SELECT %s
                FROM roi_record
                WHERE category = :category AND condition_key = :key
                """.formatted(COLUMNS);
        var params = new MapSqlParameterSource()
                .addValue("category", category.code())
                .addValue("key", conditionKey);
        return jdbc.query(sql, params, ROW_MAPPER).stream().findFirst();
    }

    public List<RoiRecord> findByCategory(BetCategory category) {
        var sql = """
                SELECT %s
                FROM roi_record
                WHERE category = :category
                ORDER BY total_bets DESC, condition_key
                """.formatted(COLUMNS);
        return jdbc.query(sql, new MapSqlParameterSource("category", category.code()), ROW_MAPPER);
    }
}
