package org.jstats.confidence_engine.modules.ensemble.model;

import org.jstats.confidence_engine.core.model.BetCategory;

import java.util.List;

public record TrainingReport(BetCategory category, int sampleCount, List<FamilyResult> results) {

    public boolean anyTrained() {
        return results.stream().anyMatch(r -> r.status() == TrainingStatus.TRAINED);
    }
}
