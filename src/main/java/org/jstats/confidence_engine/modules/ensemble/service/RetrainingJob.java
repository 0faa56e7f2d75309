package org.jstats.confidence_engine.modules.ensemble.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Retrains out of band: every queued category, plus any category whose policy fires on its
 * own (for example after drift builds up without new feedback requests).
 */
@Component
@NullMarked
@ConditionalOnProperty(prefix = "engine.ensemble", name = "retrain-job-enabled", havingValue = "true", matchIfMissing = true)
public class RetrainingJob {

    private static final Logger log = LoggerFactory.getLogger(RetrainingJob.class);

    private final RetrainingQueue queue;
    private final RetrainingPolicy policy;
    private final EnsembleTrainer trainer;

    public RetrainingJob(RetrainingQueue queue, RetrainingPolicy policy, EnsembleTrainer trainer) {
        this.queue = queue;
        this.policy = policy;
        this.trainer = trainer;
    }

    @Scheduled(
            fixedDelayString = "${engine.ensemble.retrain-check-interval-ms:900000}",
            initialDelayString = "${engine.ensemble.retrain-check-interval-ms:900000}")
    public void run() {
        Set<BetCategory> due = EnumSet.noneOf(BetCategory.class);
        due.addAll(queue.drain());
        for (BetCategory category : BetCategory.values()) {
            if (!due.contains(category)) {
                policy.evaluate(category).ifPresent(reason -> {
                    log.info("Retrain due for {}: {}", category.code(), reason);
                    due.add(category);
                });
            }
        }

        for (BetCategory category : due) {
            try {
                var report = trainer.train(category);
                log.info("Retrain of {} finished, any model trained: {}", category.code(), report.anyTrained());
            } catch (RuntimeException e) {
                log.error("Retrain of {} failed: {}", category.code(), e.getMessage(), e);
            }
        }
    }
}
