package org.jstats.confidence_engine.modules.orchestrator.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.calibration.service.ConfidenceCalibrator;
import org.jstats.confidence_engine.modules.conditions.service.ConditionalErrorLearner;
import org.jstats.confidence_engine.modules.ensemble.repository.EnsembleModelRepository;
import org.jstats.confidence_engine.modules.ensemble.service.RetrainingQueue;
import org.jstats.confidence_engine.modules.features.model.FeatureSchema;
import org.jstats.confidence_engine.modules.orchestrator.model.EngineStatus;
import org.jstats.confidence_engine.modules.patterns.service.CoarsePatternLearner;
import org.jstats.confidence_engine.modules.roi.service.RoiLearner;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@NullMarked
public class EngineStatusService {

    static final int RANKED_LIMIT = 5;

    private final ConfidenceCalibrator calibrator;
    private final CoarsePatternLearner patterns;
    private final ConditionalErrorLearner conditions;
    private final RoiLearner roi;
    private final EnsembleModelRepository models;
    private final RetrainingQueue retrainingQueue;

    public EngineStatusService(
            ConfidenceCalibrator calibrator,
            CoarsePatternLearner patterns,
            ConditionalErrorLearner conditions,
            RoiLearner roi,
            EnsembleModelRepository models,
            RetrainingQueue retrainingQueue) {
        this.calibrator = calibrator;
        this.patterns = patterns;
        this.conditions = conditions;
        this.roi = roi;
        this.models = models;
        this.retrainingQueue = retrainingQueue;
    }

    public EngineStatus status() {
        List<EngineStatus.CategoryStatus> categories = new ArrayList<>();
        for (BetCategory category : BetCategory.values()) {
            categories.add(new EngineStatus.CategoryStatus(
                    category,
                    calibrator.snapshot(category),
                    roi.snapshot(category),
                    conditions.best(category, RANKED_LIMIT),
                    conditions.worst(category, RANKED_LIMIT),
                    models.findByCategory(category)));
        }
        return new EngineStatus(
                FeatureSchema.signature(),
                List.copyOf(categories),
                patterns.best(RANKED_LIMIT),
                patterns.worst(RANKED_LIMIT),
                retrainingQueue.pending());
    }
}
