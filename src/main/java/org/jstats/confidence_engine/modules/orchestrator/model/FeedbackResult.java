package org.jstats.confidence_engine.modules.orchestrator.model;

import org.jspecify.annotations.Nullable;

/**
 * @param settled       whether this call moved the stored prediction out of PENDING
 * @param learned       whether the learners were updated
 * @param retrainReason why a retrain was queued, null when none was
 */
public record FeedbackResult(long predictionId, boolean settled, boolean learned, @Nullable String retrainReason) {
}
