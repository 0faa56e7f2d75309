package org.jstats.confidence_engine.modules.orchestrator.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.orchestrator.model.Outcome;
import org.jstats.confidence_engine.modules.orchestrator.model.Prediction;
import org.postgresql.util.PGobject;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@NullMarked
public class PredictionRepository {

    private static final TypeReference<Map<String, Double>> FEATURE_MAP = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<Prediction> rowMapper;

    public PredictionRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, i) -> new Prediction(
                rs.getLong("id"),
                rs.getString("owner"),
                rs.getString("match_ref"),
                BetCategory.fromCode(rs.getString("category")),
                readFeatures(rs.getString("features")),
                rs.getDouble("odds"),
                rs.getInt("raw_confidence"),
                rs.getInt("confidence"),
                rs.getDouble("stake_percent"),
                rs.getDouble("expected_value"),
                rs.getObject("ensemble_predicted_win", Boolean.class),
                Outcome.valueOf(rs.getString("outcome")),
                rs.getObject("created_at", OffsetDateTime.class),
                rs.getObject("settled_at", OffsetDateTime.class));
    }

    public long insert(
            String owner,
            @Nullable String matchRef,
            BetCategory category,
            Map<String, Double> features,
            double odds,
            int rawConfidence,
            int confidence,
            double stakePercent,
            double expectedValue,
            @Nullable Boolean ensemblePredictedWin,
            OffsetDateTime now) {
        final var sql = """
                INSERT INTO prediction
                  (owner, match_ref, category, features, odds, raw_confidence, confidence,
                   stake_percent, expected_value, ensemble_predicted_win, outcome, created_at)
                VALUES
                  (:owner, :matchRef, :category, :features, :odds, :raw, :confidence,
                   :stake, :ev, :ensembleWin, 'PENDING', :now)
                RETURNING id
                """;
        var params = new MapSqlParameterSource()
                .addValue("owner", owner)
                .addValue("matchRef", matchRef)
                .addValue("category", category.code())
                .addValue("features", jsonb(features))
                .addValue("odds", odds)
                .addValue("raw", rawConfidence)
                .addValue("confidence", confidence)
                .addValue("stake", stakePercent)
                .addValue("ev", expectedValue)
                .addValue("ensembleWin", ensemblePredictedWin)
                .addValue("now", now);
        Long id = jdbc.queryForObject(sql, params, Long.class);
        if (id == null) {
            throw new IllegalStateException("Prediction insert returned no id");
        }
        return id;
    }

    public Optional<Prediction> findById(long id) {
        var sql = "SELECT * FROM prediction WHERE id = :id";
        return jdbc.query(sql, new MapSqlParameterSource("id", id), rowMapper).stream().findFirst();
    }

    /**
     * Moves a pending prediction to its final outcome.
     *
     * @return false when the row does not exist or has already been settled
     */
    public boolean settle(long id, Outcome outcome, OffsetDateTime settledAt) {
        var sql = """
                UPDATE prediction
                SET outcome = :outcome, settled_at = :settledAt
                WHERE id = :id AND outcome = 'PENDING'
                """;
        var params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("outcome", outcome.name())
                .addValue("settledAt", settledAt);
        return jdbc.update(sql, params) == 1;
    }

    /**
     * Whether the ensemble's predicted class matched the result, for the most recent decisive
     * settlements that had an ensemble verdict. Newest first.
     */
    public List<Boolean> recentEnsembleHits(BetCategory category, int limit) {
        var sql = """
                SELECT ensemble_predicted_win = (outcome = 'WIN') AS hit
                FROM prediction
                WHERE category = :category
                  AND ensemble_predicted_win IS NOT NULL
                  AND outcome IN ('WIN', 'LOSS')
                ORDER BY settled_at DESC, id DESC
                LIMIT :limit
                """;
        var params = new MapSqlParameterSource()
                .addValue("category", category.code())
                .addValue("limit", limit);
        return jdbc.query(sql, params, (rs, i) -> rs.getBoolean("hit"));
    }

    /** Keeps the oldest row of every (owner, match, category) group. Rows without a match reference are never touched. */
    public int deleteDuplicates() {
        var sql = """
                DELETE FROM prediction newer
                USING prediction older
                WHERE newer.owner = older.owner
                  AND newer.match_ref = older.match_ref
                  AND newer.category = older.category
                  AND newer.id > older.id
                """;
        return jdbc.update(sql, new MapSqlParameterSource());
    }

    private PGobject jsonb(Map<String, Double> features) {
        var jsonb = new PGobject();
        jsonb.setType("jsonb");
        try {
            jsonb.setValue(objectMapper.writeValueAsString(features));
        } catch (JsonProcessingException | SQLException e) {
            throw new IllegalArgumentException("Failed to set JSONB features", e);
        }
        return jsonb;
    }

    private Map<String, Double> readFeatures(String json) {
        try {
            return objectMapper.readValue(json, FEATURE_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored features are not valid JSON", e);
        }
    }
}
