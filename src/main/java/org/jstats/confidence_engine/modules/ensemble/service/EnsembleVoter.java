package org.jstats.confidence_engine.modules.ensemble.service;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.ensemble.model.EnsembleModelRecord;
import org.jstats.confidence_engine.modules.ensemble.model.EnsembleVerdict;
import org.jstats.confidence_engine.modules.ensemble.model.ModelVote;
import org.jstats.confidence_engine.modules.ensemble.repository.EnsembleModelRepository;
import org.jstats.confidence_engine.modules.ensemble.service.EnsembleModelCache.LoadedModel;
import org.jstats.confidence_engine.modules.features.model.FeatureSchema;
import org.jstats.confidence_engine.modules.features.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.tribuo.classification.Label;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Asks every trained model of a category for its vote and combines them with
 * {@link WeightedConsensus}.
 */
@Service
@NullMarked
public class EnsembleVoter {

    private static final Logger log = LoggerFactory.getLogger(EnsembleVoter.class);

    private final EnsembleModelRepository repository;
    private final ModelArtifactStore artifacts;
    private final EnsembleModelCache cache;
    private final Set<BetCategory> warnedUnavailable = ConcurrentHashMap.newKeySet();

    public EnsembleVoter(EnsembleModelRepository repository, ModelArtifactStore artifacts, EnsembleModelCache cache) {
        this.repository = repository;
        this.artifacts = artifacts;
        this.cache = cache;
    }

    /**
     * Returns {@link EnsembleVerdict#unavailable()} when no usable model exists. Repeated
     * failures open the {@code ensembleVoter} circuit and degrade to the same answer.
     */
    @CircuitBreaker(name = "ensembleVoter", fallbackMethod = "predictFallback")
    public EnsembleVerdict predict(FeatureVector features, BetCategory category) {
        var models = cache.get(category, this::load);
        if (models.isEmpty()) {
            if (warnedUnavailable.add(category)) {
                log.warn("No trained ensemble for {}; confidence passes through without an ML opinion", category.code());
            }
            return EnsembleVerdict.unavailable();
        }
        warnedUnavailable.remove(category);

        var example = LabeledExamples.unlabeled(features);
        List<ModelVote> votes = new ArrayList<>(models.size());
        for (LoadedModel loaded : models) {
            try {
                var prediction = loaded.model().predict(example);
                Label predicted = prediction.getOutput();
                Label scored = prediction.getOutputScores().get(predicted.getLabel());
                double probability = scored != null ? scored.getScore() : predicted.getScore();
                votes.add(new ModelVote(loaded.family(), LabeledExamples.isWin(predicted), probability));
            } catch (RuntimeException e) {
                log.error("Model {} failed to predict for {}: {}", loaded.family().code(), category.code(), e.getMessage());
            }
        }

        var verdict = WeightedConsensus.combine(votes);
        if (log.isDebugEnabled()) {
            log.debug("Ensemble {} -> win={} p={} agreement={} confidence={}", category.code(),
                    verdict.predictedWin(), String.format("%.3f", verdict.weightedProbability()),
                    String.format("%.2f", verdict.agreement()), verdict.confidence());
        }
        return verdict;
    }

    private EnsembleVerdict predictFallback(FeatureVector features, BetCategory category, Exception ex) {
        log.warn("Ensemble voter fallback for {}: {}", category.code(), ex.getMessage());
        return EnsembleVerdict.unavailable();
    }

    private List<LoadedModel> load(BetCategory category) {
        String signature = FeatureSchema.signature();
        List<LoadedModel> loaded = new ArrayList<>();
        for (EnsembleModelRecord record : repository.findByCategory(category)) {
            if (!signature.equals(record.schemaSignature())) {
                log.warn("Ignoring {} model for {}: trained on schema {} but current schema is {}",
                        record.family().code(), category.code(), record.schemaSignature(), signature);
                continue;
            }
            try {
                loaded.add(new LoadedModel(record.family(), artifacts.read(Path.of(record.artifactPath()))));
            } catch (RuntimeException e) {
                log.warn("Could not load {} model for {}: {}", record.family().code(), category.code(), e.getMessage());
            }
        }
        log.info("Loaded {} ensemble model(s) for {}", loaded.size(), category.code());
        return List.copyOf(loaded);
    }
}
