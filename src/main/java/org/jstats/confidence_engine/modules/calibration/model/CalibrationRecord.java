package org.jstats.confidence_engine.modules.calibration.model;

import org.jstats.confidence_engine.core.model.BetCategory;

/**
 * Observed accuracy for one (category, band). The factor is stored unclamped.
 */
public record CalibrationRecord(
        BetCategory category,
        ConfidenceBand band,
        int predictedCount,
        int actualWins,
        double calibrationFactor
) {

    public static double factor(int predictedCount, int actualWins, ConfidenceBand band) {
        if (predictedCount <= 0) {
            return 1.0;
        }
        return ((double) actualWins / predictedCount) / band.midpoint();
    }

    public double winRate() {
        return predictedCount == 0 ? 0.0 : (double) actualWins / predictedCount;
    }
}
