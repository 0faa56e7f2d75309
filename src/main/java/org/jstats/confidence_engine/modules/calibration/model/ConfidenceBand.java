package org.jstats.confidence_engine.modules.calibration.model;

/**
 * 10-point confidence buckets used to group predictions for calibration.
 * Derived on read from {@code floor(confidence / 10) * 10}, never stored on predictions.
 */
public enum ConfidenceBand {

    BELOW_60("<60", 50),
    FROM_60_TO_69("60-69", 60),
    FROM_70_TO_79("70-79", 70),
    FROM_80_TO_100("80-100", 80);

    private final String label;
    private final int low;

    ConfidenceBand(String label, int low) {
        this.label = label;
        this.low = low;
    }

    public static ConfidenceBand of(double confidence) {
        int bucket = (int) Math.floor(confidence / 10.0) * 10;
        if (bucket < 60) return BELOW_60;
        if (bucket < 70) return FROM_60_TO_69;
        if (bucket < 80) return FROM_70_TO_79;
        return FROM_80_TO_100;
    }

    public static ConfidenceBand fromLabel(String label) {
        for (ConfidenceBand band : values()) {
            if (band.label.equals(label)) {
                return band;
            }
        }
        throw new IllegalArgumentException("Unknown confidence band: " + label);
    }

    public String label() {
        return label;
    }

    /** The win rate a perfectly calibrated band would show: {@code (low + 5) / 100}. */
    public double midpoint() {
        return (low + 5) / 100.0;
    }
}
