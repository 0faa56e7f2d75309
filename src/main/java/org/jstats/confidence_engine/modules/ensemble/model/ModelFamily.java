package org.jstats.confidence_engine.modules.ensemble.model;

import java.util.Arrays;

/**
 * The classifier families that make up an ensemble, with their fixed voting weights.
 */
public enum ModelFamily {
    RANDOM_FOREST("random_forest", 1.0),
    GRADIENT_BOOSTING("gradient_boost", 1.2),
    LOGISTIC_REGRESSION("logistic", 0.8);

    private final String code;
    private final double weight;

    ModelFamily(String code, double weight) {
        this.code = code;
        this.weight = weight;
    }

    public String code() {
        return code;
    }

    public double weight() {
        return weight;
    }

    /** Tree families expose split-frequency importances. */
    public boolean treeBased() {
        return this != LOGISTIC_REGRESSION;
    }

    public static ModelFamily fromCode(String code) {
        return Arrays.stream(values())
                .filter(f -> f.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown model family: " + code));
    }
}
