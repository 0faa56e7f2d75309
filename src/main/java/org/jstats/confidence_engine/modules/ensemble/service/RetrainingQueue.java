package org.jstats.confidence_engine.modules.ensemble.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Categories whose retraining was requested from the request path and not yet run.
 */
@Component
@NullMarked
public class RetrainingQueue {

    private final Set<BetCategory> pending = ConcurrentHashMap.newKeySet();

    /** @return false if the category was already queued */
    public boolean request(BetCategory category) {
        return pending.add(category);
    }

    public List<BetCategory> drain() {
        Set<BetCategory> drained = EnumSet.noneOf(BetCategory.class);
        for (BetCategory category : BetCategory.values()) {
            if (pending.remove(category)) {
                drained.add(category);
            }
        }
        return List.copyOf(drained);
    }

    public Set<BetCategory> pending() {
        return Set.copyOf(pending);
    }
}
