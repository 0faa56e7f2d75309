package org.jstats.confidence_engine.modules.calibration.repository;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.calibration.model.CalibrationRecord;
import org.jstats.confidence_engine.modules.calibration.model.ConfidenceBand;
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
public class CalibrationRepository {

    private static final RowMapper<CalibrationRecord> ROW_MAPPER = (rs, i) -> new CalibrationRecord(
            BetCategory.fromCode(rs.getString("category")),
            ConfidenceBand.fromLabel(rs.getString("band")),
            rs.getInt("predicted_count"),
            rs.getInt("actual_wins"),
            rs.getDouble("calibration_factor"));

    private final NamedParameterJdbcTemplate jdbc;

    public CalibrationRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Counts one settled prediction and recomputes the factor in the same statement.
     */
    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 50))
    public CalibrationRecord increment(BetCategory category, ConfidenceBand band, boolean won, OffsetDateTime now) {
        final var sql = """
                INSERT INTO calibration_record
                  (category, band, predicted_count, actual_wins, calibration_factor, updated_at)
                VALUES
                  (:category, :band, 1, :win, CAST(:win AS DOUBLE PRECISION) / :midpoint, :now)
                ON CONFLICT (category, band)
                DO UPDATE SET
                  predicted_count    = calibration_record.predicted_count + 1,
                  actual_wins        = calibration_record.actual_wins + EXCLUDED.actual_wins,
                  calibration_factor = CAST(calibration_record.actual_wins + EXCLUDED.actual_wins AS DOUBLE PRECISION)
                                       / (calibration_record.predicted_count + 1) / :midpoint,
                  updated_at         = EXCLUDED.updated_at
                RETURNING category, band, predicted_count, actual_wins, calibration_factor
                """;
        var params = new MapSqlParameterSource()
                .addValue("category", category.code())
                .addValue("band", band.label())
                .addValue("win", won ? 1 : 0)
                .addValue("midpoint", band.midpoint())
                .addValue("now", now);
        return jdbc.queryForObject(sql, params, ROW_MAPPER);
    }

    public Optional<CalibrationRecord> find(BetCategory category, ConfidenceBand band) {
        var sql = """
                SELECT category, band, predicted_count, actual_wins, calibration_factor
                FROM calibration_record
                WHERE category = :category AND band = :band
                """;
        var params = new MapSqlParameterSource()
                .addValue("category", category.code())
                .addValue("band", band.label());
        return jdbc.query(sql, params, ROW_MAPPER).stream().findFirst();
    }

    public List<CalibrationRecord> findByCategory(BetCategory category) {
        var sql = """
                SELECT category, band, predicted_count, actual_wins, calibration_factor
                FROM calibration_record
                WHERE category = :category
                ORDER BY band
                """;
        return jdbc.query(sql, new MapSqlParameterSource("category", category.code()), ROW_MAPPER);
    }
}
