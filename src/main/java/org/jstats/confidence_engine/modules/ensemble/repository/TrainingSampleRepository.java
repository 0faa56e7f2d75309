package org.jstats.confidence_engine.modules.ensemble.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.ensemble.model.TrainingSample;
import org.jstats.confidence_engine.modules.features.model.FeatureVector;
import org.postgresql.util.PGobject;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;

@Repository
@NullMarked
public class TrainingSampleRepository {

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<TrainingSample> rowMapper;

    public TrainingSampleRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, i) -> new TrainingSample(
                rs.getLong("prediction_id"),
                BetCategory.fromCode(rs.getString("category")),
                readVector(rs.getString("features")),
                rs.getString("schema_signature"),
                rs.getBoolean("won"));
    }

    /**
     * Stores the labeled row once per prediction.
     *
     * @return false when a sample for this prediction already exists
     */
    public boolean insert(TrainingSample sample, OffsetDateTime now) {
        final var sql = """
                INSERT INTO training_sample
                  (prediction_id, category, features, schema_signature, won, created_at)
                VALUES
                  (:predictionId, :category, :features, :signature, :won, :now)
                ON CONFLICT (prediction_id)
                DO NOTHING
                """;
        var params = new MapSqlParameterSource()
                .addValue("predictionId", sample.predictionId())
                .addValue("category", sample.category().code())
                .addValue("features", jsonb(sample.features()))
                .addValue("signature", sample.schemaSignature())
                .addValue("won", sample.won())
                .addValue("now", now);
        return jdbc.update(sql, params) == 1;
    }

    public int count(BetCategory category, String schemaSignature) {
        var sql = """
                SELECT COUNT(*)
                FROM training_sample
                WHERE category = :category AND schema_signature = :signature
                """;
        var params = new MapSqlParameterSource()
                .addValue("category", category.code())
                .addValue("signature", schemaSignature);
        Integer count = jdbc.queryForObject(sql, params, Integer.class);
        return count == null ? 0 : count;
    }

    /** Rows in insertion order, so a seeded shuffle yields the same split every time. */
    public List<TrainingSample> findAll(BetCategory category, String schemaSignature) {
        var sql = """
                SELECT prediction_id, category, features, schema_signature, won
                FROM training_sample
                WHERE category = :category AND schema_signature = :signature
                ORDER BY id
                """;
        var params = new MapSqlParameterSource()
                .addValue("category", category.code())
                .addValue("signature", schemaSignature);
        return jdbc.query(sql, params, rowMapper);
    }

    private PGobject jsonb(FeatureVector features) {
        var jsonb = new PGobject();
        jsonb.setType("jsonb");
        try {
            jsonb.setValue(objectMapper.writeValueAsString(features.toArray()));
        } catch (JsonProcessingException | SQLException e) {
            throw new IllegalArgumentException("Failed to set JSONB features", e);
        }
        return jsonb;
    }

    private FeatureVector readVector(String json) {
        try {
            return FeatureVector.of(objectMapper.readValue(json, double[].class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored training vector is not valid JSON", e);
        }
    }
}
