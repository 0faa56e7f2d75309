package org.jstats.confidence_engine.modules.patterns.repository;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.modules.patterns.model.PatternRecord;
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
public class PatternRepository {

    private static final RowMapper<PatternRecord> ROW_MAPPER = (rs, i) -> new PatternRecord(
            rs.getString("signature"),
            rs.getInt("wins"),
            rs.getInt("losses"));

    private final NamedParameterJdbcTemplate jdbc;

    public PatternRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 50))
    public PatternRecord increment(String signature, boolean won, OffsetDateTime now) {
        final var sql = """
                INSERT INTO pattern_record (signature, wins, losses, updated_at)
                VALUES (:signature, :win, :loss, :now)
                ON CONFLICT (signature)
                DO UPDATE SET
                  wins       = pattern_record.wins + EXCLUDED.wins,
                  losses     = pattern_record.losses + EXCLUDED.losses,
                  updated_at = EXCLUDED.updated_at
                RETURNING signature, wins, losses
                """;
        var params = new MapSqlParameterSource()
                .addValue("signature", signature)
                .addValue("win", won ? 1 : 0)
                .addValue("loss", won ? 0 : 1)
                .addValue("now", now);
        return jdbc.queryForObject(sql, params, ROW_MAPPER);
    }

    public Optional<PatternRecord> find(String signature) {
        var sql = "SELECT signature, wins, losses FROM pattern_record WHERE signature = :signature";
        return jdbc.query(sql, new MapSqlParameterSource("signature", signature), ROW_MAPPER)
                .stream()
                .findFirst();
    }

    /**
     * Patterns with at least {@code minSamples} observations, ordered by win rate.
     *
     * @param ascending true for the weakest patterns first
     */
    public List<PatternRecord> findRanked(int minSamples, boolean ascending, int limit) {
        var sql = """
                SELECT signature, wins, losses
                FROM pattern_record
                WHERE wins + losses >= :minSamples
                ORDER BY CAST(wins AS DOUBLE PRECISION) / (wins + losses) %s, wins + losses DESC
                LIMIT :limit
                """.formatted(ascending ? "ASC" : "DESC");
        var params = new MapSqlParameterSource()
                .addValue("minSamples", minSamples)
                .addValue("limit", limit);
        return jdbc.query(sql, params, ROW_MAPPER);
    }
}
