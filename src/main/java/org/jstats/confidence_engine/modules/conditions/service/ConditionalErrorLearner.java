package org.jstats.confidence_engine.modules.conditions.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.core.model.ConfidenceScale;
import org.jstats.confidence_engine.modules.conditions.model.ConditionAdjustment;
import org.jstats.confidence_engine.modules.conditions.model.ConditionRecord;
import org.jstats.confidence_engine.modules.conditions.repository.ConditionRepository;
import org.jstats.confidence_engine.modules.features.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Learns which match conditions the upstream confidence systematically misjudges, per
 * category, and turns that history into a bounded correction.
 */
@Service
@NullMarked
public class ConditionalErrorLearner {

    private static final Logger log = LoggerFactory.getLogger(ConditionalErrorLearner.class);

    private final ConditionRepository repository;
    private final ConditionExtractor extractor;
    private final EngineProperties.Conditions settings;
    private final Clock clock;

    public ConditionalErrorLearner(
            ConditionRepository repository,
            ConditionExtractor extractor,
            EngineProperties properties,
            Clock clock) {
        this.repository = repository;
        this.extractor = extractor;
        this.settings = properties.conditions();
        this.clock = clock;
    }

    public Set<String> extractConditions(FeatureVector features, BetCategory category) {
        return extractor.extract(features, category);
    }

    public void update(BetCategory category, String condition, boolean won, int confidenceAtTime) {
        var updated = repository.increment(category, condition, won, confidenceAtTime, OffsetDateTime.now(clock));
        log.debug("Condition {}/{} -> {}/{} suggested={}", category.code(), condition,
                updated.wins(), updated.total(), updated.suggestedAdjustment());
    }

    /**
     * Sums the suggestions of every currently-true condition with enough history, each
     * weighted by {@code min(1, total / fullTrustSamples)}, and clamps the sum.
     */
    public ConditionAdjustment aggregateAdjustment(BetCategory category, FeatureVector features) {
        var active = extractor.extract(features, category);
        if (active.isEmpty()) {
            return ConditionAdjustment.none();
        }

        int total = 0;
        List<String> reasons = new ArrayList<>();
        for (ConditionRecord record : repository.findAll(category, active)) {
            if (record.total() < settings.minSamples()
                    || Math.abs(record.suggestedAdjustment()) < settings.minAbsAdjustment()) {
                continue;
            }
            double weight = Math.min(1.0, (double) record.total() / settings.fullTrustSamples());
            int contribution = (int) Math.round(record.suggestedAdjustment() * weight);
            if (contribution == 0) {
                continue;
            }
            total += contribution;
            reasons.add("%s: %+d (%d/%d won)".formatted(
                    record.condition(), contribution, record.wins(), record.total()));
        }

        int clamped = ConfidenceScale.clamp(total, settings.minTotal(), settings.maxTotal());
        if (clamped != total) {
            reasons.add("conditions capped at %+d".formatted(clamped));
        }
        return new ConditionAdjustment(clamped, List.copyOf(reasons));
    }

    public List<ConditionRecord> best(BetCategory category, int limit) {
        return repository.findRanked(category, settings.minSamples(), false, limit);
    }

    public List<ConditionRecord> worst(BetCategory category, int limit) {
        return repository.findRanked(category, settings.minSamples(), true, limit);
    }
}
