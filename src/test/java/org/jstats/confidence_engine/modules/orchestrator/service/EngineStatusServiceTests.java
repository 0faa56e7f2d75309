package org.jstats.confidence_engine.modules.orchestrator.service;

import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.calibration.model.CalibrationRecord;
import org.jstats.confidence_engine.modules.calibration.model.ConfidenceBand;
import org.jstats.confidence_engine.modules.calibration.service.ConfidenceCalibrator;
import org.jstats.confidence_engine.modules.conditions.service.ConditionalErrorLearner;
import org.jstats.confidence_engine.modules.ensemble.repository.EnsembleModelRepository;
import org.jstats.confidence_engine.modules.ensemble.service.RetrainingQueue;
import org.jstats.confidence_engine.modules.features.model.FeatureSchema;
import org.jstats.confidence_engine.modules.patterns.model.PatternRecord;
import org.jstats.confidence_engine.modules.patterns.service.CoarsePatternLearner;
import org.jstats.confidence_engine.modules.roi.service.RoiLearner;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class EngineStatusServiceTests {

    @Test
    void status_coversEveryCategoryAndPendingRetrains() {
        var calibrator = mock(ConfidenceCalibrator.class);
        var patterns = mock(CoarsePatternLearner.class);
        var conditions = mock(ConditionalErrorLearner.class);
        var roi = mock(RoiLearner.class);
        var models = mock(EnsembleModelRepository.class);
        var queue = new RetrainingQueue();
        queue.request(BetCategory.DRAW);

        var calibration = new CalibrationRecord(BetCategory.HOME_WIN, ConfidenceBand.FROM_70_TO_79, 20, 11, 0.7333);
        when(calibrator.snapshot(any())).thenReturn(List.of());
        when(calibrator.snapshot(BetCategory.HOME_WIN)).thenReturn(List.of(calibration));
        when(patterns.best(EngineStatusService.RANKED_LIMIT)).thenReturn(List.of(new PatternRecord("draw#pos:equal", 8, 2)));

        var status = new EngineStatusService(calibrator, patterns, conditions, roi, models, queue).status();

        assertEquals(FeatureSchema.signature(), status.schemaSignature());
        assertEquals(BetCategory.values().length, status.categories().size());
        assertEquals(List.of(calibration), status.categories().get(0).calibration());
        assertEquals(1, status.bestPatterns().size());
        assertEquals(Set.of(BetCategory.DRAW), status.pendingRetrains());
        verify(conditions).worst(BetCategory.HANDICAP, EngineStatusService.RANKED_LIMIT);
    }
}
