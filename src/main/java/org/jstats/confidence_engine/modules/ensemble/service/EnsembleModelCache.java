package org.jstats.confidence_engine.modules.ensemble.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.ensemble.model.ModelFamily;
import org.springframework.stereotype.Component;
import org.tribuo.Model;
import org.tribuo.classification.Label;

import java.util.List;
import java.util.function.Function;

/**
 * Loaded ensembles per category. Entries expire after the configured TTL and are dropped
 * after a successful retrain so the next vote reloads from the model records.
 */
@Component
@NullMarked
public class EnsembleModelCache {

    public record LoadedModel(ModelFamily family, Model<Label> model) {}

    private final Cache<BetCategory, List<LoadedModel>> cache;

    public EnsembleModelCache(EngineProperties properties) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(BetCategory.values().length)
                .expireAfterWrite(properties.ensemble().cacheTtl())
                .build();
    }

    public List<LoadedModel> get(BetCategory category, Function<BetCategory, List<LoadedModel>> loader) {
        return cache.get(category, loader);
    }

    public void invalidate(BetCategory category) {
        cache.invalidate(category);
    }
}
