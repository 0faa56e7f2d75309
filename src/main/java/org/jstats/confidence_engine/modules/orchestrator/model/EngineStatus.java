package org.jstats.confidence_engine.modules.orchestrator.model;

import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.calibration.model.CalibrationRecord;
import org.jstats.confidence_engine.modules.conditions.model.ConditionRecord;
import org.jstats.confidence_engine.modules.ensemble.model.EnsembleModelRecord;
import org.jstats.confidence_engine.modules.patterns.model.PatternRecord;
import org.jstats.confidence_engine.modules.roi.model.RoiRecord;

import java.util.List;
import java.util.Set;

/**
 * Read-only view of everything the engine has learned so far.
 */
public record EngineStatus(
        String schemaSignature,
        List<CategoryStatus> categories,
        List<PatternRecord> bestPatterns,
        List<PatternRecord> worstPatterns,
        Set<BetCategory> pendingRetrains
) {

    public record CategoryStatus(
            BetCategory category,
            List<CalibrationRecord> calibration,
            List<RoiRecord> roi,
            List<ConditionRecord> bestConditions,
            List<ConditionRecord> worstConditions,
            List<EnsembleModelRecord> models
    ) {}
}
