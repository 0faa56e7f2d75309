package org.jstats.confidence_engine.modules.features.model;

import java.util.Arrays;

/**
 * Immutable numeric vector laid out in {@link FeatureSchema} order.
 */
public final class FeatureVector {

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    /**
     * @throws IllegalArgumentException when the length does not match the schema
     */
    public static FeatureVector of(double[] values) {
        if (values.length != FeatureSchema.size()) {
            throw new IllegalArgumentException(
                    "Expected %d features, got %d".formatted(FeatureSchema.size(), values.length));
        }
        return new FeatureVector(values.clone());
    }

    public static FeatureVector defaults() {
        var values = new double[FeatureSchema.size()];
        for (FeatureField field : FeatureSchema.fields()) {
            values[field.ordinal()] = field.defaultValue();
        }
        return new FeatureVector(values);
    }

    public double get(FeatureField field) {
        return values[field.ordinal()];
    }

    /** Convenience for count and flag fields. */
    public int getInt(FeatureField field) {
        return (int) Math.round(values[field.ordinal()]);
    }

    public boolean isSet(FeatureField field) {
        return values[field.ordinal()] >= 1.0;
    }

    public int size() {
        return values.length;
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FeatureVector other && Arrays.equals(values, other.values));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
