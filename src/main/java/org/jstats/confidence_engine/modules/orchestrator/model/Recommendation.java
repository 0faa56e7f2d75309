package org.jstats.confidence_engine.modules.orchestrator.model;

public record Recommendation(long predictionId, FinalizedConfidence finalized) {
}
