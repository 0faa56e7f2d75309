package org.jstats.confidence_engine.core.model;

/**
 * Bounds shared by every layer that emits a confidence percentage.
 */
public final class ConfidenceScale {

    public static final int MIN_CONFIDENCE = 30;
    public static final int MAX_CONFIDENCE = 95;

    private ConfidenceScale() {
    }

    /** Rounds half-up and clamps into [{@value #MIN_CONFIDENCE}, {@value #MAX_CONFIDENCE}]. */
    public static int clamp(double confidence) {
        return (int) Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, Math.round(confidence)));
    }

    public static int clamp(long value, int min, int max) {
        return (int) Math.max(min, Math.min(max, value));
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
