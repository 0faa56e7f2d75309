package org.jstats.confidence_engine.modules.ensemble.model;

/**
 * @param predictedWin whether the model's majority class is a winning bet
 * @param probability  the model's probability for the class it predicted, in [0, 1]
 */
public record ModelVote(ModelFamily family, boolean predictedWin, double probability) {

    public double weight() {
        return family.weight();
    }
}
