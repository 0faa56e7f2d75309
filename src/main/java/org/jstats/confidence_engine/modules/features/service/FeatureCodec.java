package org.jstats.confidence_engine.modules.features.service;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.confidence_engine.modules.features.model.FeatureField;
import org.jstats.confidence_engine.modules.features.model.FeatureSchema;
import org.jstats.confidence_engine.modules.features.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps loosely-typed feature dictionaries onto the fixed {@link FeatureSchema} layout.
 * <p>
 * Encoding never fails: unknown keys are dropped, missing or unreadable values fall back
 * to the field default.
 */
@Component
@NullMarked
public class FeatureCodec {

    private static final Logger log = LoggerFactory.getLogger(FeatureCodec.class);

    public FeatureVector encode(@Nullable Map<String, ?> features) {
        var values = FeatureVector.defaults().toArray();
        if (features == null || features.isEmpty()) {
            return FeatureVector.of(values);
        }

        int ignored = 0;
        for (var entry : features.entrySet()) {
            var field = FeatureSchema.byKey(entry.getKey()).orElse(null);
            if (field == null) {
                ignored++;
                continue;
            }
            values[field.ordinal()] = toDouble(entry.getValue(), field);
        }

        if (ignored > 0 && log.isDebugEnabled()) {
            log.debug("Ignored {} unknown feature keys out of {}", ignored, features.size());
        }
        return FeatureVector.of(values);
    }

    /** Inverse of {@link #encode}: every schema field, in vector order. */
    public Map<String, Double> decode(FeatureVector vector) {
        var decoded = new LinkedHashMap<String, Double>();
        for (FeatureField field : FeatureSchema.fields()) {
            decoded.put(field.key(), vector.get(field));
        }
        return decoded;
    }

    private static double toDouble(@Nullable Object raw, FeatureField field) {
        double value;
        if (raw instanceof Number n) {
            value = n.doubleValue();
        } else if (raw instanceof Boolean b) {
            value = b ? 1.0 : 0.0;
        } else if (raw instanceof String s) {
            value = parse(s, field.defaultValue());
        } else {
            value = field.defaultValue();
        }
        return Double.isFinite(value) ? value : field.defaultValue();
    }

    private static double parse(String text, double fallback) {
        var trimmed = text.trim().toLowerCase(Locale.ROOT);
        if (trimmed.equals("true")) return 1.0;
        if (trimmed.equals("false")) return 0.0;
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException ignore) {
            return fallback;
        }
    }
}
