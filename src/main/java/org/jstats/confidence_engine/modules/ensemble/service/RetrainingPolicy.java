package org.jstats.confidence_engine.modules.ensemble.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.ensemble.model.EnsembleModelRecord;
import org.jstats.confidence_engine.modules.ensemble.repository.EnsembleModelRepository;
import org.jstats.confidence_engine.modules.ensemble.repository.TrainingSampleRepository;
import org.jstats.confidence_engine.modules.features.model.FeatureSchema;
import org.jstats.confidence_engine.modules.orchestrator.repository.PredictionRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a category's ensemble is stale: missing, outgrown by new labeled data, or
 * drifting below its hold-out accuracy on recent settlements.
 */
@Component
@NullMarked
public class RetrainingPolicy {

    private final TrainingSampleRepository samples;
    private final EnsembleModelRepository models;
    private final PredictionRepository predictions;
    private final EngineProperties.Ensemble settings;

    public RetrainingPolicy(
            TrainingSampleRepository samples,
            EnsembleModelRepository models,
            PredictionRepository predictions,
            EngineProperties properties) {
        this.samples = samples;
        this.models = models;
        this.predictions = predictions;
        this.settings = properties.ensemble();
    }

    /** The reason to retrain, or empty when the current models are still good enough. */
    public Optional<String> evaluate(BetCategory category) {
        String signature = FeatureSchema.signature();
        int available = samples.count(category, signature);
        if (available < settings.minSamples()) {
            return Optional.empty();
        }

        List<EnsembleModelRecord> current = models.findByCategory(category).stream()
                .filter(r -> signature.equals(r.schemaSignature()))
                .toList();
        if (current.isEmpty()) {
            return Optional.of("no model trained on the current schema, %d samples available".formatted(available));
        }

        int lastTrainedOn = current.stream().mapToInt(EnsembleModelRecord::sampleCount).max().orElse(0);
        if (available > lastTrainedOn * settings.retrainGrowthFactor()) {
            return Optional.of("samples grew from %d to %d".formatted(lastTrainedOn, available));
        }

        List<Boolean> hits = predictions.recentEnsembleHits(category, settings.driftWindow());
        if (hits.size() >= settings.driftWindow()) {
            double recentAccuracy = 100.0 * hits.stream().filter(Boolean::booleanValue).count() / hits.size();
            double trainedAccuracy = 100.0 * current.stream().mapToDouble(EnsembleModelRecord::accuracy).average().orElse(0.0);
            if (trainedAccuracy - recentAccuracy > settings.driftTolerance()) {
                return Optional.of("recent accuracy %.1f%% vs %.1f%% at training".formatted(recentAccuracy, trainedAccuracy));
            }
        }
        return Optional.empty();
    }
}
