package org.jstats.confidence_engine.modules.ensemble.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.ensemble.model.EnsembleModelRecord;
import org.jstats.confidence_engine.modules.ensemble.model.ModelFamily;
import org.postgresql.util.PGobject;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
@NullMarked
public class EnsembleModelRepository {

    private static final TypeReference<LinkedHashMap<String, Double>> IMPORTANCE = new TypeReference<>() {};

    private static final String COLUMNS = """
            model_name, category, artifact_path, schema_signature, accuracy, precision_score,
            recall_score, f1_score, feature_importance, sample_count, trained_at""";

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<EnsembleModelRecord> rowMapper;

    public EnsembleModelRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, i) -> new EnsembleModelRecord(
                ModelFamily.fromCode(rs.getString("model_name")),
                BetCategory.fromCode(rs.getString("category")),
                rs.getString("artifact_path"),
                rs.getString("schema_signature"),
                rs.getDouble("accuracy"),
                rs.getDouble("precision_score"),
                rs.getDouble("recall_score"),
                rs.getDouble("f1_score"),
                readImportance(rs.getString("feature_importance")),
                rs.getInt("sample_count"),
                rs.getObject("trained_at", OffsetDateTime.class));
    }

    /** Replaces the family's record for the category wholesale. */
    public void upsert(EnsembleModelRecord record) {
        final var sql = """
                INSERT INTO ensemble_model_record
                  (model_name, category, artifact_path, schema_signature, accuracy, precision_score,
                   recall_score, f1_score, feature_importance, sample_count, trained_at)
                VALUES
                  (:model, :category, :path, :signature, :accuracy, :precision,
                   :recall, :f1, :importance, :samples, :trainedAt)
                ON CONFLICT (model_name, category)
                DO UPDATE SET
                  artifact_path      = EXCLUDED.artifact_path,
                  schema_signature   = EXCLUDED.schema_signature,
                  accuracy           = EXCLUDED.accuracy,
                  precision_score    = EXCLUDED.precision_score,
                  recall_score       = EXCLUDED.recall_score,
                  f1_score           = EXCLUDED.f1_score,
                  feature_importance = EXCLUDED.feature_importance,
                  sample_count       = EXCLUDED.sample_count,
                  trained_at         = EXCLUDED.trained_at
                """;
        var params = new MapSqlParameterSource()
                .addValue("model", record.family().code())
                .addValue("category", record.category().code())
                .addValue("path", record.artifactPath())
                .addValue("signature", record.schemaSignature())
                .addValue("accuracy", record.accuracy())
                .addValue("precision", record.precision())
                .addValue("recall", record.recall())
                .addValue("f1", record.f1())
                .addValue("importance", jsonb(record.featureImportance()))
                .addValue("samples", record.sampleCount())
                .addValue("trainedAt", record.trainedAt());
        jdbc.update(sql, params);
    }

    public List<EnsembleModelRecord> findByCategory(BetCategory category) {
        var sql = """
                SELECT %s
                FROM ensemble_model_record
                WHERE category = :category
                ORDER BY model_name
                """.formatted(COLUMNS);
        return jdbc.query(sql, new MapSqlParameterSource("category", category.code()), rowMapper);
    }

    private PGobject jsonb(Map<String, Double> importance) {
        var jsonb = new PGobject();
        jsonb.setType("jsonb");
        try {
            jsonb.setValue(objectMapper.writeValueAsString(importance));
        } catch (JsonProcessingException | SQLException e) {
            throw new IllegalArgumentException("Failed to set JSONB feature importance", e);
        }
        return jsonb;
    }

    private Map<String, Double> readImportance(String json) {
        try {
            return objectMapper.readValue(json, IMPORTANCE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored feature importance is not valid JSON", e);
        }
    }
}
