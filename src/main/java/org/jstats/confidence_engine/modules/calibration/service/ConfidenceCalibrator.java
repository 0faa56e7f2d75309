package org.jstats.confidence_engine.modules.calibration.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.core.model.ConfidenceScale;
import org.jstats.confidence_engine.modules.calibration.model.CalibrationRecord;
import org.jstats.confidence_engine.modules.calibration.model.ConfidenceBand;
import org.jstats.confidence_engine.modules.calibration.repository.CalibrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Answers "when we claimed X% in category C, how often were we right?" and scales future
 * claims by the observed ratio.
 */
@Service
@NullMarked
public class ConfidenceCalibrator {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceCalibrator.class);

    private final CalibrationRepository repository;
    private final EngineProperties.Calibration settings;
    private final Clock clock;

    public ConfidenceCalibrator(CalibrationRepository repository, EngineProperties properties, Clock clock) {
        this.repository = repository;
        this.settings = properties.calibration();
        this.clock = clock;
    }

    public void recordOutcome(BetCategory category, int rawConfidence, boolean won) {
        var band = ConfidenceBand.of(rawConfidence);
        var updated = repository.increment(category, band, won, OffsetDateTime.now(clock));
        if (log.isDebugEnabled()) {
            log.debug("Calibration {} {} -> {}/{} factor={}", category.code(), band.label(),
                    updated.actualWins(), updated.predictedCount(), String.format("%.3f", updated.calibrationFactor()));
        }
    }

    /**
     * Returns the raw confidence untouched while the band has too little history, otherwise
     * scales it by the clamped factor.
     */
    public int calibrate(BetCategory category, int rawConfidence) {
        var band = ConfidenceBand.of(rawConfidence);
        return repository.find(category, band)
                .filter(r -> r.predictedCount() >= settings.minSamples())
                .map(r -> apply(rawConfidence, r))
                .orElse(rawConfidence);
    }

    public List<CalibrationRecord> snapshot(BetCategory category) {
        return repository.findByCategory(category);
    }

    private int apply(int rawConfidence, CalibrationRecord record) {
        double factor = ConfidenceScale.clamp(record.calibrationFactor(), settings.minFactor(), settings.maxFactor());
        return ConfidenceScale.clamp(rawConfidence * factor);
    }
}
