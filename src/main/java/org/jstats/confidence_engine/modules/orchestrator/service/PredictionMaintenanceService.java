package org.jstats.confidence_engine.modules.orchestrator.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.modules.orchestrator.repository.PredictionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@NullMarked
public class PredictionMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(PredictionMaintenanceService.class);

    private final PredictionRepository predictions;

    public PredictionMaintenanceService(PredictionRepository predictions) {
        this.predictions = predictions;
    }

    /** Removes repeated predictions for the same owner, match and category, keeping the first. */
    @Transactional
    public int deduplicate() {
        int removed = predictions.deleteDuplicates();
        log.info("Removed {} duplicate prediction(s)", removed);
        return removed;
    }
}
