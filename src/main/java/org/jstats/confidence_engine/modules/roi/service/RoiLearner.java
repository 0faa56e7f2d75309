package org.jstats.confidence_engine.modules.roi.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.roi.model.RoiAdjustment;
import org.jstats.confidence_engine.modules.roi.model.RoiRecord;
import org.jstats.confidence_engine.modules.roi.repository.RoiRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Tracks realized profitability per category and nudges confidence toward categories that
 * actually make money.
 */
@Service
@NullMarked
public class RoiLearner {

    private static final Logger log = LoggerFactory.getLogger(RoiLearner.class);

    private final RoiRepository repository;
    private final EngineProperties.Roi settings;
    private final Clock clock;

    public RoiLearner(RoiRepository repository, EngineProperties properties, Clock clock) {
        this.repository = repository;
        this.settings = properties.roi();
        this.clock = clock;
    }

    /** Records the bet under every given key and under {@link RoiRecord#OVERALL}. */
    public void record(
            BetCategory category,
            Collection<String> conditionKeys,
            boolean won,
            double odds,
            double stake,
            double expectedValue) {
        Set<String> keys = new LinkedHashSet<>(conditionKeys);
        keys.add(RoiRecord.OVERALL);
        var now = OffsetDateTime.now(clock);
        for (String key : keys) {
            repository.increment(category, key, won, odds, stake, expectedValue, now);
        }
        log.debug("ROI recorded for {} under {} keys", category.code(), keys.size());
    }

    public RoiAdjustment adjustment(BetCategory category) {
        return repository.find(category, RoiRecord.OVERALL)
                .filter(r -> r.totalBets() >= settings.minBets())
                .map(r -> {
                    int delta = bucket(r.roiPercent());
                    return new RoiAdjustment(delta, "ROI %.1f%% over %d bets: %+d".formatted(
                            r.roiPercent(), r.totalBets(), delta));
                })
                .orElseGet(RoiAdjustment::none);
    }

    public List<RoiRecord> snapshot(BetCategory category) {
        return repository.findByCategory(category);
    }

    /** Buckets are half-open on the lower bound, so exactly -10.0 falls in [-10, 0). */
    public static int bucket(double roiPercent) {
        if (roiPercent < -20) return -12;
        if (roiPercent < -10) return -8;
        if (roiPercent < 0) return -4;
        if (roiPercent < 10) return 3;
        if (roiPercent < 25) return 6;
        return 10;
    }
}
