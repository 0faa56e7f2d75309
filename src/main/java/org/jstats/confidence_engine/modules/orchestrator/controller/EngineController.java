package org.jstats.confidence_engine.modules.orchestrator.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.ensemble.model.TrainingReport;
import org.jstats.confidence_engine.modules.ensemble.service.EnsembleTrainer;
import org.jstats.confidence_engine.modules.orchestrator.model.EngineStatus;
import org.jstats.confidence_engine.modules.orchestrator.model.FeedbackResult;
import org.jstats.confidence_engine.modules.orchestrator.model.FinalizeRequest;
import org.jstats.confidence_engine.modules.orchestrator.model.FinalizedConfidence;
import org.jstats.confidence_engine.modules.orchestrator.model.OutcomeRequest;
import org.jstats.confidence_engine.modules.orchestrator.model.Recommendation;
import org.jstats.confidence_engine.modules.orchestrator.model.RecommendationRequest;
import org.jstats.confidence_engine.modules.orchestrator.service.ConfidenceOrchestrator;
import org.jstats.confidence_engine.modules.orchestrator.service.EngineStatusService;
import org.jstats.confidence_engine.modules.orchestrator.service.FeedbackService;
import org.jstats.confidence_engine.modules.orchestrator.service.PredictionMaintenanceService;
import org.jstats.confidence_engine.modules.orchestrator.service.RecommendationService;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Admin surface of the engine: finalize and issue confidences, report outcomes, train and
 * inspect.
 */
@Tag(name = "Confidence Engine", description = "Confidence correction chain, feedback loop and ensemble administration")
@Validated
@RestController
@RequestMapping("/api/engine")
public class EngineController {

    static final String SESSION_HEADER = "X-Session-Id";

    private final ConfidenceOrchestrator orchestrator;
    private final RecommendationService recommendations;
    private final FeedbackService feedback;
    private final EnsembleTrainer trainer;
    private final EngineStatusService status;
    private final PredictionMaintenanceService maintenance;

    public EngineController(
            ConfidenceOrchestrator orchestrator,
            RecommendationService recommendations,
            FeedbackService feedback,
            EnsembleTrainer trainer,
            EngineStatusService status,
            PredictionMaintenanceService maintenance) {
        this.orchestrator = orchestrator;
        this.recommendations = recommendations;
        this.feedback = feedback;
        this.trainer = trainer;
        this.status = status;
        this.maintenance = maintenance;
    }

    @Operation(
            summary = "Finalize a raw confidence",
            description = "Runs the ensemble blend, calibration, pattern, condition and ROI corrections and "
                    + "returns the final confidence with its expected value, stake and audit trail. Nothing is stored.",
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Confidence finalized",
                            content = @Content(
                                    mediaType = "application/json",
                                    schema = @Schema(implementation = FinalizedConfidence.class)
                            )
                    ),
                    @ApiResponse(
                            responseCode = "400",
                            description = "Invalid request",
                            content = @Content(mediaType = "application/problem+json")
                    )
            }
    )
    @PostMapping("/finalize")
    public FinalizedConfidence finalizeConfidence(@RequestBody @Valid FinalizeRequest request) {
        return orchestrator.finalizeConfidence(request.category(), request.rawConfidence(), request.features(), request.odds());
    }

    @Operation(
            summary = "Issue a recommendation",
            description = "Finalizes the confidence and stores it as a pending prediction owned by the calling session."
    )
    @PostMapping("/recommendations")
    public Recommendation issue(
            @RequestHeader(name = SESSION_HEADER, defaultValue = RecommendationService.SYSTEM_OWNER) String owner,
            @RequestBody @Valid RecommendationRequest request) {
        return recommendations.issue(owner, request);
    }

    @Operation(
            summary = "Report a settled outcome",
            description = "Settles the prediction and feeds a win or loss into every learner. Pushes settle without "
                    + "learning; repeated reports for the same prediction are ignored."
    )
    @PostMapping("/outcomes")
    public FeedbackResult recordOutcome(@RequestBody @Valid OutcomeRequest request) {
        return feedback.recordOutcome(
                request.predictionId(),
                request.category(),
                request.features(),
                request.rawConfidence(),
                request.odds(),
                request.stake(),
                request.outcome());
    }

    @Operation(
            summary = "Train the ensemble for a category",
            description = "Fits every model family on the stored labeled samples and reports per-family results."
    )
    @PostMapping("/models/{category}/train")
    public TrainingReport train(@PathVariable String category) {
        return trainer.train(BetCategory.fromCode(category));
    }

    @Operation(summary = "Learned state of every layer")
    @GetMapping("/status")
    public EngineStatus status() {
        return status.status();
    }

    @Operation(
            summary = "Remove duplicate predictions",
            description = "Keeps the first prediction per session, match and category."
    )
    @PostMapping("/maintenance/deduplicate")
    public ResponseEntity<Map<String, Object>> deduplicate() {
        int removed = maintenance.deduplicate();
        return ResponseEntity.ok(Map.of(
                "message", "Deduplication completed",
                "removed", removed
        ));
    }
}
