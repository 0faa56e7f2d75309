package org.jstats.confidence_engine.modules.ensemble.service;

import com.oracle.labs.mlrg.olcut.util.Pair;
import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.ensemble.model.EnsembleModelRecord;
import org.jstats.confidence_engine.modules.ensemble.model.FamilyResult;
import org.jstats.confidence_engine.modules.ensemble.model.ModelFamily;
import org.jstats.confidence_engine.modules.ensemble.model.TrainingReport;
import org.jstats.confidence_engine.modules.ensemble.model.TrainingSample;
import org.jstats.confidence_engine.modules.ensemble.model.TrainingStatus;
import org.jstats.confidence_engine.modules.ensemble.repository.EnsembleModelRepository;
import org.jstats.confidence_engine.modules.ensemble.repository.TrainingSampleRepository;
import org.jstats.confidence_engine.modules.features.model.FeatureSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.tribuo.Dataset;
import org.tribuo.Model;
import org.tribuo.classification.Label;
import org.tribuo.classification.evaluation.LabelEvaluator;
import org.tribuo.ensemble.EnsembleModel;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Fits every model family for a category on the stored labeled samples, evaluates each on a
 * seeded hold-out split and publishes the ones that trained.
 */
@Service
@NullMarked
public class EnsembleTrainer {

    private static final Logger log = LoggerFactory.getLogger(EnsembleTrainer.class);

    static final int TOP_FEATURES = 10;

    private final TrainingSampleRepository samples;
    private final EnsembleModelRepository models;
    private final ClassifierFactory classifiers;
    private final ModelArtifactStore artifacts;
    private final EnsembleModelCache cache;
    private final EngineProperties.Ensemble settings;
    private final Clock clock;

    public EnsembleTrainer(
            TrainingSampleRepository samples,
            EnsembleModelRepository models,
            ClassifierFactory classifiers,
            ModelArtifactStore artifacts,
            EnsembleModelCache cache,
            EngineProperties properties,
            Clock clock) {
        this.samples = samples;
        this.models = models;
        this.classifiers = classifiers;
        this.artifacts = artifacts;
        this.cache = cache;
        this.settings = properties.ensemble();
        this.clock = clock;
    }

    public TrainingReport train(BetCategory category) {
        String signature = FeatureSchema.signature();
        List<TrainingSample> rows = samples.findAll(category, signature);
        if (rows.size() < settings.minSamples()) {
            log.debug("Not training {}: {} samples, need {}", category.code(), rows.size(), settings.minSamples());
            return allFamilies(category, rows.size(),
                    "need %d labeled samples, have %d".formatted(settings.minSamples(), rows.size()));
        }

        List<TrainingSample> shuffled = new ArrayList<>(rows);
        Collections.shuffle(shuffled, new Random(settings.seed()));
        int cut = (int) Math.round(shuffled.size() * settings.trainFraction());
        var trainSet = LabeledExamples.dataset(category.code() + "-train", shuffled.subList(0, cut));
        var testSet = LabeledExamples.dataset(category.code() + "-holdout", shuffled.subList(cut, shuffled.size()));

        if (trainSet.getOutputInfo().size() < 2) {
            return allFamilies(category, rows.size(), "training split holds a single outcome class");
        }

        log.info("Training ensemble for {} on {} samples ({} train / {} hold-out)",
                category.code(), rows.size(), trainSet.size(), testSet.size());

        var now = OffsetDateTime.now(clock);
        List<FamilyResult> results = new ArrayList<>();
        for (ModelFamily family : ModelFamily.values()) {
            results.add(trainFamily(category, family, trainSet, testSet, signature, rows.size(), now));
        }

        var report = new TrainingReport(category, rows.size(), List.copyOf(results));
        if (report.anyTrained()) {
            cache.invalidate(category);
        }
        return report;
    }

    private FamilyResult trainFamily(
            BetCategory category,
            ModelFamily family,
            Dataset<Label> trainSet,
            Dataset<Label> testSet,
            String signature,
            int sampleCount,
            OffsetDateTime now) {
        try {
            Model<Label> model = classifiers.trainerFor(family, settings.seed()).train(trainSet);
            var evaluation = new LabelEvaluator().evaluate(model, testSet);
            double accuracy = finite(evaluation.accuracy());
            double precision = finite(evaluation.macroAveragedPrecision());
            double recall = finite(evaluation.macroAveragedRecall());
            double f1 = finite(evaluation.macroAveragedF1());
            Map<String, Double> importance = family.treeBased() ? importance(model) : Map.of();

            var path = artifacts.write(family, category, model);
            models.upsert(new EnsembleModelRecord(family, category, path.toString(), signature,
                    accuracy, precision, recall, f1, importance, sampleCount, now));

            log.info("Trained {} for {}: accuracy={} f1={}", family.code(), category.code(),
                    String.format("%.3f", accuracy), String.format("%.3f", f1));
            return new FamilyResult(family, TrainingStatus.TRAINED, null, accuracy, precision, recall, f1, importance);
        } catch (RuntimeException e) {
            log.error("Training {} for {} failed: {}", family.code(), category.code(), e.getMessage(), e);
            return FamilyResult.failed(family, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    /**
     * Split frequency per feature summed over the ensemble members, normalized to sum to 1,
     * top {@value #TOP_FEATURES} by weight.
     */
    static Map<String, Double> importance(Model<Label> model) {
        List<? extends Model<Label>> members = model instanceof EnsembleModel<Label> ensemble
                ? ensemble.getModels()
                : List.of(model);

        Map<String, Double> totals = new HashMap<>();
        for (Model<Label> member : members) {
            for (List<Pair<String, Double>> ranked : member.getTopFeatures(-1).values()) {
                for (Pair<String, Double> feature : ranked) {
                    totals.merge(feature.getA(), Math.abs(feature.getB()), Double::sum);
                }
            }
        }
        double sum = totals.values().stream().mapToDouble(Double::doubleValue).sum();
        if (sum <= 0) {
            return Map.of();
        }

        Map<String, Double> top = new LinkedHashMap<>();
        totals.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .limit(TOP_FEATURES)
                .forEach(e -> top.put(e.getKey(), Math.round(e.getValue() / sum * 10_000) / 10_000.0));
        return top;
    }

    private static TrainingReport allFamilies(BetCategory category, int sampleCount, String message) {
        List<FamilyResult> results = new ArrayList<>();
        for (ModelFamily family : ModelFamily.values()) {
            results.add(FamilyResult.insufficientData(family, message));
        }
        return new TrainingReport(category, sampleCount, List.copyOf(results));
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
