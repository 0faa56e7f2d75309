package org.jstats.confidence_engine.modules.ensemble.service;

import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.ensemble.model.TrainingReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RetrainingJobTests {

    RetrainingQueue queue;
    RetrainingPolicy policy;
    EnsembleTrainer trainer;
    RetrainingJob job;

    @BeforeEach
    void setUp() {
        queue = new RetrainingQueue();
        policy = mock(RetrainingPolicy.class);
        trainer = mock(EnsembleTrainer.class);
        job = new RetrainingJob(queue, policy, trainer);
        when(policy.evaluate(any())).thenReturn(Optional.empty());
        when(trainer.train(any())).thenAnswer(inv -> new TrainingReport(inv.getArgument(0), 0, List.of()));
    }

    @Test
    void queuedCategories_areTrainedOnce_andQueueIsDrained() {
        assertTrue(queue.request(BetCategory.BTTS));
        assertFalse(queue.request(BetCategory.BTTS));

        job.run();

        verify(trainer, times(1)).train(BetCategory.BTTS);
        verify(policy, never()).evaluate(BetCategory.BTTS);
        assertTrue(queue.pending().isEmpty());
    }

    @Test
    void policyFiring_withoutRequest_alsoTrains() {
        when(policy.evaluate(BetCategory.DRAW)).thenReturn(Optional.of("samples grew"));

        job.run();

        verify(trainer).train(BetCategory.DRAW);
        verify(trainer, times(1)).train(any());
    }

    @Test
    void failingTrain_doesNotStopOtherCategories() {
        queue.request(BetCategory.HOME_WIN);
        queue.request(BetCategory.AWAY_WIN);
        when(trainer.train(BetCategory.HOME_WIN)).thenThrow(new IllegalStateException("disk full"));

        job.run();

        verify(trainer).train(BetCategory.AWAY_WIN);
    }
}
