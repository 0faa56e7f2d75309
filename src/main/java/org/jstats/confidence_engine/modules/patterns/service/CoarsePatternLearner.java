package org.jstats.confidence_engine.modules.patterns.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.core.model.ConfidenceScale;
import org.jstats.confidence_engine.modules.features.model.FeatureVector;
import org.jstats.confidence_engine.modules.patterns.model.PatternRecord;
import org.jstats.confidence_engine.modules.patterns.repository.PatternRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Tracks win rates of coarse match contexts, independent of the fine-grained conditions.
 */
@Service
@NullMarked
public class CoarsePatternLearner {

    private static final Logger log = LoggerFactory.getLogger(CoarsePatternLearner.class);

    private static final double ADJUSTMENT_SCALE = 50.0;

    private final PatternRepository repository;
    private final PatternDetector detector;
    private final EngineProperties.Patterns settings;
    private final Clock clock;

    public CoarsePatternLearner(
            PatternRepository repository,
            PatternDetector detector,
            EngineProperties properties,
            Clock clock) {
        this.repository = repository;
        this.detector = detector;
        this.settings = properties.patterns();
        this.clock = clock;
    }

    public String detectPattern(FeatureVector features, BetCategory category) {
        return detector.detect(features, category);
    }

    public void update(String pattern, boolean won) {
        var updated = repository.increment(pattern, won, OffsetDateTime.now(clock));
        log.debug("Pattern {} -> {}W/{}L", pattern, updated.wins(), updated.losses());
    }

    /** Zero until the pattern has enough history, then {@code round((winRate - 0.5) * 50)} capped at ±15. */
    public int adjustment(String pattern) {
        return repository.find(pattern)
                .filter(r -> r.total() >= settings.minSamples())
                .map(r -> ConfidenceScale.clamp(
                        Math.round((r.winRate() - 0.5) * ADJUSTMENT_SCALE),
                        -settings.maxAdjustment(),
                        settings.maxAdjustment()))
                .orElse(0);
    }

    public List<PatternRecord> best(int limit) {
        return repository.findRanked(settings.minSamples(), false, limit);
    }

    public List<PatternRecord> worst(int limit) {
        return repository.findRanked(settings.minSamples(), true, limit);
    }
}
