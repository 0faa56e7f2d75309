package org.jstats.confidence_engine.modules.conditions.repository;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.conditions.model.ConditionRecord;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

@Repository
@NullMarked
public class ConditionRepository {

    private static final RowMapper<ConditionRecord> ROW_MAPPER = (rs, i) -> new ConditionRecord(
            BetCategory.fromCode(rs.getString("category")),
            rs.getString("condition_name"),
            rs.getInt("total"),
            rs.getInt("wins"),
            rs.getInt("losses"),
            rs.getDouble("avg_confidence_when_failed"),
            rs.getInt("suggested_adjustment"));

    private static final String COLUMNS =
            "category, condition_name, total, wins, losses, avg_confidence_when_failed, suggested_adjustment";

    private final NamedParameterJdbcTemplate jdbc;

    public ConditionRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Records one outcome. The failed-confidence mean only moves on a loss, and the suggested
     * adjustment is recomputed server-side with the same half-up rounding as
     * {@link ConditionRecord#suggestedAdjustment(int, int)}.
     */
    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 50))
    public ConditionRecord increment(
            BetCategory category,
            String condition,
            boolean won,
            double confidence,
            OffsetDateTime now) {
        final var sql = """
                INSERT INTO condition_record
                  (category, condition_name, total, wins, losses, avg_confidence_when_failed,
                   suggested_adjustment, updated_at)
                VALUES
                  (:category, :condition, 1, :win, :loss, :failedConfidence, :initialAdjustment, :now)
                ON CONFLICT (category, condition_name)
                DO UPDATE SET
                  total  = condition_record.total + 1,
                  wins   = condition_record.wins + EXCLUDED.wins,
                  losses = condition_record.losses + EXCLUDED.losses,
                  avg_confidence_when_failed = CASE
                      WHEN EXCLUDED.losses = 1
                      THEN (condition_record.avg_confidence_when_failed * condition_record.losses + :confidence)
                           / (condition_record.losses + 1)
                      ELSE condition_record.avg_confidence_when_failed
                  END,
                  suggested_adjustment = LEAST(10, GREATEST(-20, CAST(FLOOR(
                      (CAST(condition_record.wins + EXCLUDED.wins AS DOUBLE PRECISION) / (condition_record.total + 1) - 0.5)
                      * 30 + 0.5) AS INTEGER))),
                  updated_at = EXCLUDED.updated_at
                RETURNING %s
                """.formatted(COLUMNS);
        var params = new MapSqlParameterSource()
                .addValue("category", category.code())
                .addValue("condition", condition)
                .addValue("win", won ? 1 : 0)
                .addValue("loss", won ? 0 : 1)
                .addValue("confidence", confidence)
                .addValue("failedConfidence", won ? 0.0 : confidence)
                .addValue("initialAdjustment", ConditionRecord.suggestedAdjustment(won ? 1 : 0, 1))
                .addValue("now", now);
        return jdbc.queryForObject(sql, params, ROW_MAPPER);
    }

    public List<ConditionRecord> findAll(BetCategory category, Collection<String> conditions) {
        if (conditions.isEmpty()) {
            return List.of();
        }
        var sql = """
                SELECT %s
                FROM condition_record
                WHERE category = :category AND condition_name IN (:conditions)
                ORDER BY condition_name
                """.formatted(COLUMNS);
        var params = new MapSqlParameterSource()
                .addValue("category", category.code())
                .addValue("conditions", conditions);
        return jdbc.query(sql, params, ROW_MAPPER);
    }

    public List<ConditionRecord> findByCategory(BetCategory category) {
        var sql = """
                SELECT %s
                FROM condition_record
                WHERE category = :category
                ORDER BY condition_name
                """.formatted(COLUMNS);
        return jdbc.query(sql, new MapSqlParameterSource("category", category.code()), ROW_MAPPER);
    }

    public List<ConditionRecord> findRanked(BetCategory category, int minSamples, boolean ascending, int limit) {
        var sql = """
                SELECT %s
                FROM condition_record
                WHERE category = :category AND total >= :minSamples
                ORDER BY CAST(wins AS DOUBLE PRECISION) / total %s, total DESC
                LIMIT :limit
                """.formatted(COLUMNS, ascending ? "ASC" : "DESC");
        var params = new MapSqlParameterSource()
                .addValue("category", category.code())
                .addValue("minSamples", minSamples)
                .addValue("limit", limit);
        return jdbc.query(sql, params, ROW_MAPPER);
    }
}
