package org.jstats.confidence_engine.modules.ensemble.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.modules.ensemble.model.ModelFamily;
import org.springframework.stereotype.Component;
import org.tribuo.Trainer;
import org.tribuo.classification.Label;
import org.tribuo.classification.dtree.CARTClassificationTrainer;
import org.tribuo.classification.ensemble.VotingCombiner;
import org.tribuo.classification.sgd.linear.LogisticRegressionTrainer;
import org.tribuo.classification.xgboost.XGBoostClassificationTrainer;
import org.tribuo.common.tree.RandomForestTrainer;

/**
 * Builds a fresh, seeded Tribuo trainer per family.
 */
@Component
@NullMarked
public class ClassifierFactory {

    static final int FOREST_TREES = 100;
    static final int FOREST_MAX_DEPTH = 10;
    static final float FOREST_FEATURE_FRACTION = 0.5f;
    static final int BOOSTING_ROUNDS = 200;
    static final double BOOSTING_ETA = 0.1;
    static final int BOOSTING_MAX_DEPTH = 6;
    static final double BOOSTING_SUBSAMPLE = 0.8;

    public Trainer<Label> trainerFor(ModelFamily family, long seed) {
        return switch (family) {
            case RANDOM_FOREST -> new RandomForestTrainer<>(
                    new CARTClassificationTrainer(FOREST_MAX_DEPTH, FOREST_FEATURE_FRACTION, seed),
                    new VotingCombiner(),
                    FOREST_TREES,
                    seed);
            // single thread keeps a seeded run reproducible
            case GRADIENT_BOOSTING -> new XGBoostClassificationTrainer(
                    BOOSTING_ROUNDS,
                    BOOSTING_ETA,
                    0.0,
                    BOOSTING_MAX_DEPTH,
                    1.0,
                    BOOSTING_SUBSAMPLE,
                    BOOSTING_SUBSAMPLE,
                    1.0,
                    0.0,
                    1,
                    true,
                    seed);
            case LOGISTIC_REGRESSION -> new LogisticRegressionTrainer();
        };
    }
}
