package org.jstats.confidence_engine.modules.orchestrator.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.modules.features.service.FeatureCodec;
import org.jstats.confidence_engine.modules.orchestrator.model.Recommendation;
import org.jstats.confidence_engine.modules.orchestrator.model.RecommendationRequest;
import org.jstats.confidence_engine.modules.orchestrator.repository.PredictionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Finalizes a confidence and records it as a pending prediction, so the later settlement can
 * be matched to the exact figures that were issued.
 */
@Service
@NullMarked
public class RecommendationService {

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    public static final String SYSTEM_OWNER = "system";

    private final ConfidenceOrchestrator orchestrator;
    private final PredictionRepository predictions;
    private final FeatureCodec codec;
    private final Clock clock;

    public RecommendationService(
            ConfidenceOrchestrator orchestrator,
            PredictionRepository predictions,
            FeatureCodec codec,
            Clock clock) {
        this.orchestrator = orchestrator;
        this.predictions = predictions;
        this.codec = codec;
        this.clock = clock;
    }

    public Recommendation issue(String owner, RecommendationRequest request) {
        if (request.odds() <= 1.0) {
            throw new IllegalArgumentException("Odds must be above 1.0 to size a stake, got " + request.odds());
        }
        var vector = codec.encode(request.features());
        var finalized = orchestrator.finalizeConfidence(request.category(), request.rawConfidence(), vector, request.odds());
        var ensemble = finalized.ensemble();

        long id = predictions.insert(
                owner,
                request.matchRef(),
                request.category(),
                codec.decode(vector),
                request.odds(),
                request.rawConfidence(),
                finalized.confidence(),
                finalized.stakePercent(),
                finalized.expectedValue(),
                ensemble.available() ? ensemble.predictedWin() : null,
                OffsetDateTime.now(clock));

        log.info("Issued prediction {} for {} {}: {} -> {}", id, owner, request.category().code(),
                request.rawConfidence(), finalized.confidence());
        return new Recommendation(id, finalized);
    }
}
