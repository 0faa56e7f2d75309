package org.jstats.confidence_engine.modules.roi.model;

import org.jspecify.annotations.Nullable;

public record RoiAdjustment(int delta, @Nullable String reason) {

    public static RoiAdjustment none() {
        return new RoiAdjustment(0, null);
    }
}
