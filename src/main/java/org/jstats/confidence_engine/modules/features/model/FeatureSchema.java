package org.jstats.confidence_engine.modules.features.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static view of the {@link FeatureField} layout: ordered names, lookup by key and a
 * signature that identifies the layout in persisted samples and models.
 */
public final class FeatureSchema {

    private static final List<FeatureField> FIELDS = List.of(FeatureField.values());
    private static final Map<String, FeatureField> BY_KEY;
    private static final String[] NAMES;
    private static final String SIGNATURE;

    static {
        var byKey = new LinkedHashMap<String, FeatureField>();
        for (FeatureField field : FIELDS) {
            byKey.put(field.key(), field);
        }
        BY_KEY = Collections.unmodifiableMap(byKey);
        NAMES = FIELDS.stream().map(FeatureField::key).toArray(String[]::new);
        SIGNATURE = digest(String.join(",", NAMES));
    }

    private FeatureSchema() {
    }

    public static int size() {
        return FIELDS.size();
    }

    public static List<FeatureField> fields() {
        return FIELDS;
    }

    /** Feature names in vector order; a fresh copy on every call. */
    public static String[] names() {
        return Arrays.copyOf(NAMES, NAMES.length);
    }

    public static Optional<FeatureField> byKey(String key) {
        return Optional.ofNullable(BY_KEY.get(key));
    }

    /** Short SHA-256 prefix over the ordered field keys. */
    public static String signature() {
        return SIGNATURE;
    }

    private static String digest(String layout) {
        try {
            var sha = MessageDigest.getInstance("SHA-256");
            var hash = sha.digest(layout.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
